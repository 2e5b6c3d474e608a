package me.golemcore.palace.domain.model;

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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The memory palace aggregate: node store, connection store, keyword topic
 * index and insertion-ordered timeline.
 *
 * <p>
 * Invariants maintained by every mutator:
 * <ul>
 * <li>every id in {@code timeline} or in a topic bucket exists in
 * {@code nodes}</li>
 * <li>{@code timeline} holds each node id exactly once, in insertion
 * order</li>
 * <li>a node's {@code connections} equals the distinct targets of the edges
 * whose source is that node</li>
 * </ul>
 *
 * <p>
 * Not thread-safe. The owning service serializes writers against readers.
 * Persisted field by field, so accessors never leak mutable state.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class KnowledgeGraph {

    public static final int SCHEMA_VERSION = 1;

    private int schemaVersion = SCHEMA_VERSION;
    private Map<String, MemoryNode> nodes = new LinkedHashMap<>();
    private List<KnowledgeConnection> connections = new ArrayList<>();
    private Map<String, List<String>> topics = new LinkedHashMap<>();
    private List<String> timeline = new ArrayList<>();

    /**
     * Inserts a node, appends it to the timeline and files its id under every
     * keyword.
     *
     * @throws IllegalArgumentException
     *             if the node has no id
     * @throws IllegalStateException
     *             if a node with the same id already exists
     */
    public void addNode(MemoryNode node) {
        Objects.requireNonNull(node, "node");
        String id = node.getId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Memory node has no id");
        }
        if (nodes.containsKey(id)) {
            throw new IllegalStateException("Memory node already exists: " + id);
        }

        nodes.put(id, node);
        timeline.add(id);

        if (node.getKeywords() == null) {
            return;
        }
        for (String keyword : node.getKeywords()) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            List<String> bucket = topics.computeIfAbsent(keyword, k -> new ArrayList<>());
            if (!bucket.contains(id)) {
                bucket.add(id);
            }
        }
    }

    /**
     * Appends an edge and refreshes the source node's adjacency in place. An edge
     * with the same source, target and type as an existing one is ignored.
     *
     * @return {@code true} if the edge was added
     * @throws IllegalArgumentException
     *             if either endpoint is unknown
     */
    public boolean addConnection(KnowledgeConnection connection) {
        Objects.requireNonNull(connection, "connection");
        MemoryNode source = nodes.get(connection.getSourceNodeId());
        if (source == null) {
            throw new IllegalArgumentException("Unknown source node: " + connection.getSourceNodeId());
        }
        if (!nodes.containsKey(connection.getTargetNodeId())) {
            throw new IllegalArgumentException("Unknown target node: " + connection.getTargetNodeId());
        }
        for (KnowledgeConnection existing : connections) {
            if (existing.sameEdge(connection)) {
                return false;
            }
        }

        connections.add(connection);
        refreshAdjacency(source);
        return true;
    }

    /**
     * Whether any edge leads from {@code sourceId} to {@code targetId}.
     */
    public boolean hasConnection(String sourceId, String targetId) {
        for (KnowledgeConnection connection : connections) {
            if (connection.getSourceNodeId().equals(sourceId) && connection.getTargetNodeId().equals(targetId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Bumps the access counter and stamps the access time of a node.
     */
    public void recordAccess(String nodeId, Instant accessedAt) {
        MemoryNode node = nodes.get(nodeId);
        if (node == null) {
            return;
        }
        node.setAccessCount(node.getAccessCount() + 1);
        node.setLastAccessedAt(accessedAt);
    }

    public Optional<MemoryNode> findNode(String id) {
        return Optional.ofNullable(id != null ? nodes.get(id) : null);
    }

    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    public Collection<MemoryNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public List<KnowledgeConnection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    public Map<String, List<String>> getTopics() {
        return Collections.unmodifiableMap(topics);
    }

    public List<String> getTimeline() {
        return Collections.unmodifiableList(timeline);
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public List<MemoryNode> getNodesByTopic(String topic) {
        List<String> ids = topics.get(topic);
        if (ids == null) {
            return List.of();
        }
        return resolve(ids);
    }

    public List<MemoryNode> getConnectedNodes(String nodeId) {
        MemoryNode node = nodes.get(nodeId);
        if (node == null || node.getConnections() == null) {
            return List.of();
        }
        return resolve(node.getConnections());
    }

    /**
     * The last {@code limit} nodes of the timeline, newest first.
     */
    public List<MemoryNode> getRecentNodes(int limit) {
        if (limit <= 0 || timeline.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, timeline.size() - limit);
        List<MemoryNode> recent = resolve(timeline.subList(from, timeline.size()));
        Collections.reverse(recent);
        return recent;
    }

    /**
     * Case-insensitive substring match of the whole query against title, content,
     * summary and keywords. The query is not tokenized.
     */
    public List<MemoryNode> searchNodes(String query) {
        if (query == null || query.isEmpty()) {
            return List.of();
        }
        String needle = query.toLowerCase(Locale.ROOT);
        List<MemoryNode> matches = new ArrayList<>();
        for (MemoryNode node : nodes.values()) {
            if (contains(node.getTitle(), needle)
                    || contains(node.getContent(), needle)
                    || contains(node.getSummary(), needle)
                    || keywordsContain(node.getKeywords(), needle)) {
                matches.add(node);
            }
        }
        return matches;
    }

    /**
     * Checks the structural invariants, used to reject corrupt snapshots.
     */
    public boolean isConsistent() {
        if (nodes == null || connections == null || topics == null || timeline == null) {
            return false;
        }
        Set<String> seen = new HashSet<>();
        for (String id : timeline) {
            if (!nodes.containsKey(id) || !seen.add(id)) {
                return false;
            }
        }
        if (seen.size() != nodes.size()) {
            return false;
        }
        for (List<String> bucket : topics.values()) {
            if (bucket == null || !nodes.keySet().containsAll(bucket)) {
                return false;
            }
        }
        for (KnowledgeConnection connection : connections) {
            if (!nodes.containsKey(connection.getSourceNodeId())
                    || !nodes.containsKey(connection.getTargetNodeId())) {
                return false;
            }
        }
        for (MemoryNode node : nodes.values()) {
            Set<String> expected = targetsOf(node.getId());
            Set<String> actual = node.getConnections() != null
                    ? new LinkedHashSet<>(node.getConnections())
                    : Set.of();
            if (!expected.equals(actual)) {
                return false;
            }
        }
        return true;
    }

    private void refreshAdjacency(MemoryNode node) {
        node.setConnections(new ArrayList<>(targetsOf(node.getId())));
    }

    private Set<String> targetsOf(String sourceId) {
        Set<String> targets = new LinkedHashSet<>();
        for (KnowledgeConnection connection : connections) {
            if (connection.getSourceNodeId().equals(sourceId)) {
                targets.add(connection.getTargetNodeId());
            }
        }
        return targets;
    }

    private List<MemoryNode> resolve(List<String> ids) {
        List<MemoryNode> resolved = new ArrayList<>(ids.size());
        for (String id : ids) {
            MemoryNode node = nodes.get(id);
            if (node != null) {
                resolved.add(node);
            }
        }
        return resolved;
    }

    private static boolean contains(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static boolean keywordsContain(List<String> keywords, String needle) {
        if (keywords == null) {
            return false;
        }
        for (String keyword : keywords) {
            if (contains(keyword, needle)) {
                return true;
            }
        }
        return false;
    }
}
