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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.palace.domain.model.KnowledgeGraph;
import me.golemcore.palace.domain.model.MemoryNode;
import me.golemcore.palace.domain.model.SearchIndex;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Answers free-text recall queries against the graph and the search index.
 *
 * <p>
 * Two passes are merged as a set:
 * <ol>
 * <li>keyword pass - case-insensitive substring match of the raw query</li>
 * <li>statistical pass - summed TF-IDF of the whitespace-separated query
 * tokens, top {@code palace.recall.statistical-top-k} nodes</li>
 * </ol>
 * and ranked by {@code importance + accessWeight * accessCount + recencyBoost}
 * (the boost applies to nodes created within the recency window).
 *
 * <p>
 * Read-only: callers own locking and access bookkeeping.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRecallService {

    private final PalaceProperties properties;
    private final Clock clock;

    public List<MemoryNode> recall(String query, KnowledgeGraph graph, SearchIndex index) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        Map<String, MemoryNode> merged = new LinkedHashMap<>();
        for (MemoryNode node : graph.searchNodes(query)) {
            merged.putIfAbsent(node.getId(), node);
        }
        int keywordHits = merged.size();
        for (MemoryNode node : statisticalSearch(query, graph, index)) {
            merged.putIfAbsent(node.getId(), node);
        }

        Instant now = clock.instant();
        Map<String, Double> scores = new HashMap<>();
        for (MemoryNode node : merged.values()) {
            scores.put(node.getId(), compositeScore(node, now));
        }

        List<MemoryNode> ranked = new ArrayList<>(merged.values());
        ranked.sort(Comparator
                .comparingDouble((MemoryNode node) -> scores.get(node.getId()))
                .reversed()
                .thenComparing(MemoryNode::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));

        log.debug("[Recall] '{}': {} keyword hit(s), {} total after merge", query, keywordHits, ranked.size());
        return ranked;
    }

    /**
     * Nodes ranked by summed TF-IDF over the lowercased, whitespace-split query.
     */
    List<MemoryNode> statisticalSearch(String query, KnowledgeGraph graph, SearchIndex index) {
        Map<String, Double> nodeScores = new HashMap<>();
        for (String token : query.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            for (String nodeId : index.getPostings(token).keySet()) {
                nodeScores.merge(nodeId, index.calculateTfIdf(token, nodeId), Double::sum);
            }
        }

        int topK = Math.max(0, properties.getRecall().getStatisticalTopK());
        List<MemoryNode> results = new ArrayList<>();
        nodeScores.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(topK)
                .forEach(entry -> graph.findNode(entry.getKey()).ifPresent(results::add));
        return results;
    }

    double compositeScore(MemoryNode node, Instant now) {
        PalaceProperties.RecallProperties recall = properties.getRecall();
        double score = node.getImportance() + recall.getAccessCountWeight() * node.getAccessCount();
        if (node.getCreatedAt() != null) {
            Duration age = Duration.between(node.getCreatedAt(), now);
            if (age.compareTo(Duration.ofHours(recall.getRecencyWindowHours())) < 0) {
                score += recall.getRecencyBoost();
            }
        }
        return score;
    }
}
