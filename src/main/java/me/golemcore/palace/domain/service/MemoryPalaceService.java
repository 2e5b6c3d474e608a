package me.golemcore.palace.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.palace.domain.model.CancellationToken;
import me.golemcore.palace.domain.model.Conversation;
import me.golemcore.palace.domain.model.IngestionReport;
import me.golemcore.palace.domain.model.InsightCandidate;
import me.golemcore.palace.domain.model.KnowledgeConnection;
import me.golemcore.palace.domain.model.KnowledgeGraph;
import me.golemcore.palace.domain.model.MemoryNode;
import me.golemcore.palace.domain.model.MemoryNodeType;
import me.golemcore.palace.domain.model.PalaceStats;
import me.golemcore.palace.domain.model.ParseResult;
import me.golemcore.palace.domain.model.SearchIndex;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single entry point of the memory palace. Owns the knowledge graph and the
 * search index and is their only writer.
 *
 * <p>
 * Ingestion runs extraction, node creation, connection discovery and commit,
 * one insight at a time. Completion calls are made without holding the state
 * lock; each node is committed together with all of its edges under the write
 * lock, so readers never see a node without its edges. Ingestions are
 * serialized among themselves. Recall and queries take the read lock, except
 * recall with access recording enabled, which writes access metadata.
 *
 * <p>
 * Every mutation is followed by a save. Save failures are logged and surfaced
 * through {@link #getLastError()}; in-memory state stays authoritative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryPalaceService {

    private static final int DEFAULT_RECENT_LIMIT = 10;

    private final InsightExtractionService extractionService;
    private final MemoryNodeFactory nodeFactory;
    private final ConnectionDiscoveryService discoveryService;
    private final MemoryRecallService recallService;
    private final MemoryPalaceStore store;
    private final PalaceProperties properties;
    private final Clock clock;

    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock(true);
    private final Lock ingestionLock = new ReentrantLock();
    private final AtomicBoolean processing = new AtomicBoolean(false);

    private KnowledgeGraph graph = new KnowledgeGraph();
    private SearchIndex index = new SearchIndex();
    private volatile String lastError;

    @PostConstruct
    public void init() {
        load();
    }

    /**
     * Replaces the in-memory state with the persisted snapshot.
     */
    public void load() {
        KnowledgeGraph loadedGraph = store.loadGraph();
        SearchIndex loadedIndex = store.loadIndex();
        stateLock.writeLock().lock();
        try {
            graph = loadedGraph;
            index = loadedIndex;
        } finally {
            stateLock.writeLock().unlock();
        }
        log.info("[Palace] Ready: {} node(s), {} indexed document(s)", loadedGraph.getNodeCount(),
                loadedIndex.getTotalDocuments());
    }

    /**
     * Persists the current state.
     *
     * @return {@code true} if both documents were written
     */
    public boolean save() {
        stateLock.readLock().lock();
        try {
            store.save(graph, index);
            return true;
        } catch (MemoryPalaceStorageException e) {
            lastError = "Failed to save memory palace: " + e.getMessage();
            log.error("[Palace] {}", lastError, e);
            return false;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public IngestionReport ingestConversation(Conversation conversation) {
        return ingestConversation(conversation, CancellationToken.none());
    }

    /**
     * Distills a conversation into nodes and edges. Extraction failures and
     * per-pair discovery failures degrade to fewer results; nothing is thrown
     * for them.
     */
    public IngestionReport ingestConversation(Conversation conversation, CancellationToken token) {
        if (conversation == null || conversation.isEmpty()) {
            return IngestionReport.empty();
        }

        ingestionLock.lock();
        processing.set(true);
        try {
            return doIngest(conversation, token);
        } finally {
            processing.set(false);
            ingestionLock.unlock();
        }
    }

    private IngestionReport doIngest(Conversation conversation, CancellationToken token) {
        log.info("[Palace] Ingesting conversation {} ({} message(s))", conversation.getId(),
                conversation.getMessages().size());

        ParseResult<List<InsightCandidate>> extraction = extractionService.extractInsights(conversation.toTranscript());
        if (!extraction.isSuccess()) {
            lastError = "Insight extraction failed: " + extraction.describeError();
            log.warn("[Palace] {}", lastError);
            return IngestionReport.builder().extractionError(extraction.error()).build();
        }

        List<String> createdNodeIds = new ArrayList<>();
        int connectionsCreated = 0;
        boolean cancelled = false;
        List<String> messageIds = conversation.getMessageIds();

        for (InsightCandidate candidate : extraction.value()) {
            if (token.isCancelled()) {
                cancelled = true;
                break;
            }
            MemoryNode node = nodeFactory.createNode(candidate, conversation.getId(), messageIds);

            List<MemoryNode> candidates;
            stateLock.readLock().lock();
            try {
                candidates = copies(discoveryService.selectCandidates(node, graph));
            } finally {
                stateLock.readLock().unlock();
            }

            List<KnowledgeConnection> edges = discoveryService.discoverConnections(node, candidates, token);
            if (token.isCancelled()) {
                cancelled = true;
                break;
            }

            connectionsCreated += commit(node, edges);
            createdNodeIds.add(node.getId());
        }

        if (cancelled) {
            log.info("[Palace] Ingestion of {} cancelled after {} node(s)", conversation.getId(),
                    createdNodeIds.size());
        }

        boolean saved = false;
        if (!createdNodeIds.isEmpty()) {
            saved = save();
        }

        log.info("[Palace] Conversation {}: {} node(s), {} connection(s)", conversation.getId(),
                createdNodeIds.size(), connectionsCreated);
        return IngestionReport.builder()
                .createdNodeIds(List.copyOf(createdNodeIds))
                .connectionsCreated(connectionsCreated)
                .cancelled(cancelled)
                .saved(saved)
                .build();
    }

    private int commit(MemoryNode node, List<KnowledgeConnection> edges) {
        stateLock.writeLock().lock();
        try {
            graph.addNode(node);
            index.indexNode(node);
            int added = 0;
            for (KnowledgeConnection edge : edges) {
                // target may not exist if a snapshot was reloaded mid-ingestion
                if (graph.containsNode(edge.getTargetNodeId()) && graph.addConnection(edge)) {
                    added++;
                }
            }
            return added;
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    /**
     * Ranked recall over the keyword and TF-IDF passes. Blank queries yield an
     * empty list.
     */
    public List<MemoryNode> recall(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        if (!properties.getRecall().isRecordAccess()) {
            stateLock.readLock().lock();
            try {
                return copies(recallService.recall(query, graph, index));
            } finally {
                stateLock.readLock().unlock();
            }
        }

        List<MemoryNode> results;
        stateLock.writeLock().lock();
        try {
            List<MemoryNode> ranked = recallService.recall(query, graph, index);
            Instant now = clock.instant();
            for (MemoryNode node : ranked) {
                graph.recordAccess(node.getId(), now);
            }
            results = copies(ranked);
        } finally {
            stateLock.writeLock().unlock();
        }
        if (!results.isEmpty()) {
            save();
        }
        return results;
    }

    public Optional<MemoryNode> getNode(String id) {
        stateLock.readLock().lock();
        try {
            return graph.findNode(id).map(MemoryNode::copy);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<MemoryNode> getAllNodes() {
        stateLock.readLock().lock();
        try {
            return copies(graph.getNodes());
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<MemoryNode> getNodesByType(MemoryNodeType type) {
        stateLock.readLock().lock();
        try {
            return graph.getNodes().stream()
                    .filter(node -> node.getNodeType() == type)
                    .map(MemoryNode::copy)
                    .toList();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<MemoryNode> getRecentNodes() {
        return getRecentNodes(DEFAULT_RECENT_LIMIT);
    }

    public List<MemoryNode> getRecentNodes(int limit) {
        stateLock.readLock().lock();
        try {
            return copies(graph.getRecentNodes(limit));
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<MemoryNode> getNodesByTopic(String topic) {
        stateLock.readLock().lock();
        try {
            return copies(graph.getNodesByTopic(topic));
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Topic to nodes, in topic insertion order. Topics that resolve to no node
     * are left out.
     */
    public Map<String, List<MemoryNode>> getTopicClusters() {
        stateLock.readLock().lock();
        try {
            Map<String, List<MemoryNode>> clusters = new LinkedHashMap<>();
            for (String topic : graph.getTopics().keySet()) {
                List<MemoryNode> nodes = copies(graph.getNodesByTopic(topic));
                if (!nodes.isEmpty()) {
                    clusters.put(topic, nodes);
                }
            }
            return clusters;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<MemoryNode> getConnectedNodes(String nodeId) {
        stateLock.readLock().lock();
        try {
            return copies(graph.getConnectedNodes(nodeId));
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public List<KnowledgeConnection> getConnections() {
        stateLock.readLock().lock();
        try {
            return graph.getConnections().stream()
                    .map(connection -> connection.toBuilder().build())
                    .toList();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public PalaceStats getStats() {
        stateLock.readLock().lock();
        try {
            Map<MemoryNodeType, Long> byType = new EnumMap<>(MemoryNodeType.class);
            for (MemoryNode node : graph.getNodes()) {
                byType.merge(node.getNodeType(), 1L, Long::sum);
            }
            return PalaceStats.builder()
                    .nodeCount(graph.getNodeCount())
                    .connectionCount(graph.getConnections().size())
                    .topicCount(graph.getTopics().size())
                    .nodesByType(byType)
                    .indexedDocuments(index.getTotalDocuments())
                    .indexedTerms(index.getTermCount())
                    .build();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public boolean isProcessing() {
        return processing.get();
    }

    public String getLastError() {
        return lastError;
    }

    private static List<MemoryNode> copies(Collection<MemoryNode> nodes) {
        List<MemoryNode> copies = new ArrayList<>(nodes.size());
        for (MemoryNode node : nodes) {
            copies.add(node.copy());
        }
        return copies;
    }
}
