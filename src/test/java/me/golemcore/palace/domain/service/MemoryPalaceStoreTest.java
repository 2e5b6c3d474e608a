package me.golemcore.palace.domain.service;

import me.golemcore.palace.domain.model.ConnectionType;
import me.golemcore.palace.domain.model.KnowledgeConnection;
import me.golemcore.palace.domain.model.KnowledgeGraph;
import me.golemcore.palace.domain.model.MemoryNode;
import me.golemcore.palace.domain.model.MemoryNodeType;
import me.golemcore.palace.domain.model.SearchIndex;
import me.golemcore.palace.infrastructure.config.AutoConfiguration;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import me.golemcore.palace.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MemoryPalaceStoreTest {

    private static final String DIR = "memory-palace";
    private static final String GRAPH_KEY = "knowledge-graph.json";
    private static final String INDEX_KEY = "search-index.json";
    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant ACCESSED = Instant.parse("2026-03-02T08:30:15.123Z");

    private StoragePort storagePort;
    private Map<String, String> persisted;
    private MemoryPalaceStore store;

    @BeforeEach
    void setUp() {
        persisted = new HashMap<>();
        storagePort = mock(StoragePort.class);
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean())).thenAnswer(inv -> {
            persisted.put(inv.getArgument(1), inv.getArgument(2));
            return CompletableFuture.completedFuture(null);
        });
        when(storagePort.getText(anyString(), anyString()))
                .thenAnswer(inv -> CompletableFuture.completedFuture(persisted.get(inv.getArgument(1))));

        store = new MemoryPalaceStore(storagePort, new PalaceProperties(), AutoConfiguration.objectMapper());
    }

    @Test
    void shouldRestoreSavedGraphAndIndex() {
        KnowledgeGraph graph = new KnowledgeGraph();
        SearchIndex index = new SearchIndex();
        MemoryNode a = node("A", "Use rust for indexing", MemoryNodeType.IDEA);
        a.setSummary("rust for the indexer");
        a.setSourceConversationId("c1");
        a.setSourceMessageIds(new ArrayList<>(List.of("m1", "m2")));
        a.setAccessCount(4);
        a.setLastAccessedAt(ACCESSED);
        a.setImportance(0.85);
        MemoryNode b = node("B", "Index compaction", MemoryNodeType.FACT);
        graph.addNode(a);
        graph.addNode(b);
        index.indexNode(a);
        index.indexNode(b);
        graph.addConnection(KnowledgeConnection.builder()
                .id("e1")
                .sourceNodeId("A")
                .targetNodeId("B")
                .connectionType(ConnectionType.ELABORATIVE)
                .strength(0.6)
                .description("builds on")
                .createdAt(CREATED)
                .build());

        store.save(graph, index);
        KnowledgeGraph loadedGraph = store.loadGraph();
        SearchIndex loadedIndex = store.loadIndex();

        assertEquals(List.of("A", "B"), loadedGraph.getTimeline());
        assertEquals(List.of("A"), loadedGraph.getTopics().get("rust"));
        MemoryNode loadedA = loadedGraph.findNode("A").orElseThrow();
        assertEquals(MemoryNodeType.IDEA, loadedA.getNodeType());
        assertEquals(CREATED, loadedA.getCreatedAt());
        assertEquals(ACCESSED, loadedA.getLastAccessedAt());
        assertEquals(4, loadedA.getAccessCount());
        assertEquals(0.85, loadedA.getImportance(), 1e-12);
        assertEquals("rust for the indexer", loadedA.getSummary());
        assertEquals("c1", loadedA.getSourceConversationId());
        assertEquals(List.of("m1", "m2"), loadedA.getSourceMessageIds());
        assertEquals(List.of("B"), loadedA.getConnections());
        assertEquals(a, loadedA);
        assertEquals(b, loadedGraph.findNode("B").orElseThrow());

        KnowledgeConnection loadedEdge = loadedGraph.getConnections().get(0);
        assertEquals(ConnectionType.ELABORATIVE, loadedEdge.getConnectionType());
        assertEquals(0.6, loadedEdge.getStrength(), 1e-12);
        assertEquals("builds on", loadedEdge.getDescription());
        assertEquals(CREATED, loadedEdge.getCreatedAt());
        assertEquals(graph.getConnections(), loadedGraph.getConnections());
        assertEquals(graph.getTopics(), loadedGraph.getTopics());

        assertEquals(index.getTotalDocuments(), loadedIndex.getTotalDocuments());
        assertEquals(index.getTermCount(), loadedIndex.getTermCount());
        for (String term : List.of("rust", "indexing", "index", "compaction")) {
            assertEquals(index.getDocumentFrequency(term), loadedIndex.getDocumentFrequency(term), term);
            assertEquals(index.getPostings(term), loadedIndex.getPostings(term), term);
            assertEquals(index.calculateTfIdf(term, "A"), loadedIndex.calculateTfIdf(term, "A"), 1e-12);
        }
        assertEquals(index.getWordCount("A"), loadedIndex.getWordCount("A"));
        assertEquals(index.getWordCount("B"), loadedIndex.getWordCount("B"));
        verify(storagePort).putTextAtomic(eq(DIR), eq(GRAPH_KEY), anyString(), eq(true));
        verify(storagePort).putTextAtomic(eq(DIR), eq(INDEX_KEY), anyString(), eq(true));
    }

    @Test
    void shouldStartEmptyWhenNothingPersisted() {
        assertEquals(0, store.loadGraph().getNodeCount());
        assertEquals(0, store.loadIndex().getTotalDocuments());
    }

    @Test
    void shouldStartEmptyOnUndecodableDocument() {
        persisted.put(GRAPH_KEY, "{not json");
        persisted.put(INDEX_KEY, "[]");

        assertEquals(0, store.loadGraph().getNodeCount());
        assertEquals(0, store.loadIndex().getTotalDocuments());
    }

    @Test
    void shouldStartEmptyOnNewerSchema() {
        persisted.put(GRAPH_KEY, "{\"schemaVersion\": 99, \"nodes\": {}, \"connections\": [], "
                + "\"topics\": {}, \"timeline\": []}");

        assertEquals(0, store.loadGraph().getNodeCount());
    }

    @Test
    void shouldStartEmptyOnInconsistentGraph() {
        persisted.put(GRAPH_KEY, "{\"schemaVersion\": 1, \"nodes\": {}, \"connections\": [], "
                + "\"topics\": {}, \"timeline\": [\"ghost\"]}");

        KnowledgeGraph graph = store.loadGraph();

        assertTrue(graph.getTimeline().isEmpty());
    }

    @Test
    void shouldStartEmptyWhenStoreFails() {
        doReturn(CompletableFuture.failedFuture(new RuntimeException("disk gone")))
                .when(storagePort).getText(anyString(), anyString());

        assertEquals(0, store.loadGraph().getNodeCount());
    }

    @Test
    void shouldAttemptBothWritesAndReportFailure() {
        doReturn(CompletableFuture.failedFuture(new RuntimeException("disk full")))
                .when(storagePort).putTextAtomic(anyString(), eq(GRAPH_KEY), anyString(), anyBoolean());

        assertThrows(MemoryPalaceStorageException.class, () -> store.save(new KnowledgeGraph(), new SearchIndex()));
        assertTrue(persisted.containsKey(INDEX_KEY));
    }

    private static MemoryNode node(String id, String title, MemoryNodeType type) {
        return MemoryNode.builder()
                .id(id)
                .title(title)
                .content(title)
                .summary("")
                .keywords(new ArrayList<>(List.of(id.equals("A") ? "rust" : "compaction")))
                .createdAt(CREATED)
                .lastAccessedAt(CREATED)
                .importance(0.7)
                .nodeType(type)
                .build();
    }
}
