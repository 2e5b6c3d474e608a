package me.golemcore.palace.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.palace.domain.model.CancellationToken;
import me.golemcore.palace.domain.model.ConnectionType;
import me.golemcore.palace.domain.model.Conversation;
import me.golemcore.palace.domain.model.ExtractionError;
import me.golemcore.palace.domain.model.IngestionReport;
import me.golemcore.palace.domain.model.KnowledgeConnection;
import me.golemcore.palace.domain.model.MemoryNode;
import me.golemcore.palace.domain.model.MemoryNodeType;
import me.golemcore.palace.domain.model.Message;
import me.golemcore.palace.domain.model.PalaceStats;
import me.golemcore.palace.domain.model.ParseResult;
import me.golemcore.palace.infrastructure.config.AutoConfiguration;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import me.golemcore.palace.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class MemoryPalaceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String EXTRACTION_PROMPT = "extracting and organizing knowledge";
    private static final String DISCOVERY_PROMPT = "relationships between knowledge concepts";

    private static final String RUST_INSIGHT = """
            [{"title": "Use rust for indexing", "content": "Rust gives predictable indexing latency",
              "summary": "rust for the indexer", "keywords": ["rust", "index"], "type": "idea", "importance": 0.8}]
            """;
    private static final String COMPACTION_INSIGHT = """
            [{"title": "Index compaction", "content": "Compact segments nightly",
              "summary": "nightly compaction", "keywords": ["index", "compaction"], "type": "fact",
              "importance": 0.6}]
            """;
    private static final String ELABORATIVE = """
            {"connected": true, "type": "elaborative", "strength": 0.6, "description": "builds on"}
            """;

    private LlmCompletionService completionService;
    private StoragePort storagePort;
    private Map<String, String> persisted;
    private PalaceProperties properties;
    private ObjectMapper objectMapper;
    private Clock clock;
    private MemoryPalaceService service;

    @BeforeEach
    void setUp() {
        completionService = mock(LlmCompletionService.class);
        persisted = new HashMap<>();
        storagePort = mock(StoragePort.class);
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean())).thenAnswer(inv -> {
            persisted.put(inv.getArgument(1), inv.getArgument(2));
            return CompletableFuture.completedFuture(null);
        });
        when(storagePort.getText(anyString(), anyString()))
                .thenAnswer(inv -> CompletableFuture.completedFuture(persisted.get(inv.getArgument(1))));

        properties = new PalaceProperties();
        objectMapper = AutoConfiguration.objectMapper();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = createService();
    }

    private MemoryPalaceService createService() {
        ConnectionDiscoveryService discovery = new ConnectionDiscoveryService(completionService,
                List.of(new AllNodesCandidateSelector(), new RecentNodesCandidateSelector(properties)),
                properties, objectMapper, clock);
        discovery.init();
        MemoryPalaceService created = new MemoryPalaceService(
                new InsightExtractionService(completionService, properties, objectMapper),
                new MemoryNodeFactory(clock),
                discovery,
                new MemoryRecallService(properties, clock),
                new MemoryPalaceStore(storagePort, properties, objectMapper),
                properties,
                clock);
        created.init();
        return created;
    }

    // ===== ingestion =====

    @Test
    void shouldCreateNodeFiledUnderEveryKeyword() {
        extractionReturns(RUST_INSIGHT);

        IngestionReport report = service.ingestConversation(conversation("c1", "Let's use rust for the indexer"));

        assertEquals(1, report.getNodesCreated());
        assertTrue(report.isSaved());
        String id = report.getCreatedNodeIds().get(0);
        assertEquals(List.of(id), ids(service.getNodesByTopic("rust")));
        assertEquals(List.of(id), ids(service.getNodesByTopic("index")));
        assertEquals(1, service.getRecentNodes().size());

        MemoryNode node = service.getNode(id).orElseThrow();
        assertEquals(MemoryNodeType.IDEA, node.getNodeType());
        assertEquals("c1", node.getSourceConversationId());
        assertEquals(List.of("c1-m1"), node.getSourceMessageIds());
        assertEquals(NOW, node.getCreatedAt());
        assertTrue(persisted.containsKey("knowledge-graph.json"));
        assertTrue(persisted.containsKey("search-index.json"));
    }

    @Test
    void shouldConnectNewNodeToExistingNodeInOneDirection() {
        extractionReturns(COMPACTION_INSIGHT, RUST_INSIGHT);
        when(completionService.complete(contains(DISCOVERY_PROMPT), anyString(), anyDouble()))
                .thenReturn(ParseResult.success(ELABORATIVE));

        String b = service.ingestConversation(conversation("c1", "compaction")).getCreatedNodeIds().get(0);
        IngestionReport second = service.ingestConversation(conversation("c2", "rust"));
        String a = second.getCreatedNodeIds().get(0);

        assertEquals(1, second.getConnectionsCreated());
        assertEquals(List.of(b), service.getNode(a).orElseThrow().getConnections());
        assertTrue(service.getNode(b).orElseThrow().getConnections().isEmpty());
        KnowledgeConnection edge = service.getConnections().get(0);
        assertEquals(ConnectionType.ELABORATIVE, edge.getConnectionType());
        assertEquals(0.6, edge.getStrength(), 1e-9);
        assertEquals(List.of(b), ids(service.getConnectedNodes(a)));
        verify(completionService, times(1)).complete(contains(DISCOVERY_PROMPT), anyString(), anyDouble());
    }

    @Test
    void shouldReportExtractionFailureWithoutCreatingNodes() {
        when(completionService.complete(contains(EXTRACTION_PROMPT), anyString(), anyDouble()))
                .thenReturn(ParseResult.success("I could not find anything"));

        IngestionReport report = service.ingestConversation(conversation("c1", "hello"));

        assertEquals(ExtractionError.MALFORMED_JSON, report.getExtractionError());
        assertEquals(0, report.getNodesCreated());
        assertFalse(report.isSaved());
        assertNotNull(service.getLastError());
        assertTrue(service.getAllNodes().isEmpty());
    }

    @Test
    void shouldCreateNoNodesWhenAnyInsightIsIncomplete() {
        extractionReturns("""
                [{"title": "Use rust for indexing", "content": "Rust gives predictable indexing latency"},
                 {"title": "Index compaction", "content": "Compact segments nightly", "summary": "nightly",
                  "keywords": ["index"], "type": "fact", "importance": 0.6}]
                """);

        IngestionReport report = service.ingestConversation(conversation("c1", "rust"));

        assertEquals(ExtractionError.MISSING_FIELDS, report.getExtractionError());
        assertEquals(0, report.getNodesCreated());
        assertTrue(service.getAllNodes().isEmpty());
        assertTrue(service.getTopicClusters().isEmpty());
    }

    @Test
    void shouldIgnoreEmptyConversation() {
        IngestionReport report = service.ingestConversation(Conversation.builder().id("empty").build());

        assertEquals(0, report.getNodesCreated());
        verifyNoInteractions(completionService);
        assertFalse(service.isProcessing());
    }

    @Test
    void shouldNotCommitAfterCancellation() {
        extractionReturns(COMPACTION_INSIGHT, RUST_INSIGHT);
        service.ingestConversation(conversation("c1", "compaction"));

        CancellationToken token = new CancellationToken();
        when(completionService.complete(contains(DISCOVERY_PROMPT), anyString(), anyDouble())).thenAnswer(inv -> {
            token.cancel();
            return ParseResult.success(ELABORATIVE);
        });

        IngestionReport report = service.ingestConversation(conversation("c2", "rust"), token);

        assertTrue(report.isCancelled());
        assertEquals(0, report.getNodesCreated());
        assertEquals(1, service.getAllNodes().size());
        assertTrue(service.getConnections().isEmpty());
    }

    @Test
    void shouldKeepStateWhenSaveFails() {
        extractionReturns(RUST_INSIGHT);
        doReturn(CompletableFuture.failedFuture(new RuntimeException("disk full")))
                .when(storagePort).putTextAtomic(anyString(), anyString(), anyString(), anyBoolean());

        IngestionReport report = service.ingestConversation(conversation("c1", "rust"));

        assertEquals(1, report.getNodesCreated());
        assertFalse(report.isSaved());
        assertTrue(service.getLastError().contains("save"));
        assertEquals(1, service.getAllNodes().size());
    }

    // ===== recall =====

    @Test
    void shouldRecallMatchingNodeFirstAndRecordAccess() {
        extractionReturns(RUST_INSIGHT, COMPACTION_INSIGHT);
        when(completionService.complete(contains(DISCOVERY_PROMPT), anyString(), anyDouble()))
                .thenReturn(ParseResult.success("{\"connected\": false}"));
        String a = service.ingestConversation(conversation("c1", "rust")).getCreatedNodeIds().get(0);
        service.ingestConversation(conversation("c2", "compaction"));

        List<MemoryNode> results = service.recall("rust");

        assertEquals(a, results.get(0).getId());
        assertEquals(1, results.size());
        assertEquals(1, service.getNode(a).orElseThrow().getAccessCount());
    }

    @Test
    void shouldNotRecordAccessWhenDisabled() {
        properties.getRecall().setRecordAccess(false);
        extractionReturns(RUST_INSIGHT);
        String a = service.ingestConversation(conversation("c1", "rust")).getCreatedNodeIds().get(0);

        service.recall("rust");

        assertEquals(0, service.getNode(a).orElseThrow().getAccessCount());
    }

    @Test
    void shouldReturnDetachedCopies() {
        extractionReturns(RUST_INSIGHT);
        String a = service.ingestConversation(conversation("c1", "rust")).getCreatedNodeIds().get(0);

        service.getNode(a).orElseThrow().setTitle("changed");

        assertEquals("Use rust for indexing", service.getNode(a).orElseThrow().getTitle());
    }

    // ===== queries and persistence =====

    @Test
    void shouldSummarizeState() {
        extractionReturns(RUST_INSIGHT, COMPACTION_INSIGHT);
        when(completionService.complete(contains(DISCOVERY_PROMPT), anyString(), anyDouble()))
                .thenReturn(ParseResult.success(ELABORATIVE));
        service.ingestConversation(conversation("c1", "rust"));
        service.ingestConversation(conversation("c2", "compaction"));

        PalaceStats stats = service.getStats();

        assertEquals(2, stats.getNodeCount());
        assertEquals(1, stats.getConnectionCount());
        assertEquals(3, stats.getTopicCount());
        assertEquals(1L, stats.getNodesByType().get(MemoryNodeType.IDEA));
        assertEquals(1L, stats.getNodesByType().get(MemoryNodeType.FACT));
        assertEquals(2, stats.getIndexedDocuments());
        assertEquals(2, service.getTopicClusters().get("index").size());
        assertEquals(1, service.getNodesByType(MemoryNodeType.FACT).size());
    }

    @Test
    void shouldReloadPersistedState() {
        extractionReturns(RUST_INSIGHT);
        String a = service.ingestConversation(conversation("c1", "rust")).getCreatedNodeIds().get(0);

        MemoryPalaceService restarted = createService();

        assertTrue(restarted.getNode(a).isPresent());
        assertEquals(a, restarted.recall("rust").get(0).getId());
    }

    private void extractionReturns(String first, String... rest) {
        ParseResult<String>[] next = toResults(rest);
        when(completionService.complete(contains(EXTRACTION_PROMPT), anyString(), anyDouble()))
                .thenReturn(ParseResult.success(first), next);
    }

    @SuppressWarnings("unchecked")
    private static ParseResult<String>[] toResults(String... completions) {
        ParseResult<String>[] results = new ParseResult[completions.length];
        for (int i = 0; i < completions.length; i++) {
            results[i] = ParseResult.success(completions[i]);
        }
        return results;
    }

    private static Conversation conversation(String id, String text) {
        return Conversation.builder()
                .id(id)
                .title(id)
                .createdAt(NOW)
                .messages(List.of(Message.builder()
                        .id(id + "-m1")
                        .role("user")
                        .content(text)
                        .timestamp(NOW)
                        .build()))
                .build();
    }

    private static List<String> ids(List<MemoryNode> nodes) {
        return nodes.stream().map(MemoryNode::getId).toList();
    }
}
