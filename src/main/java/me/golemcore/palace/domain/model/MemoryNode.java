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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A single extracted knowledge unit.
 *
 * <p>
 * Nodes are stored as mutable records keyed by id inside
 * {@link KnowledgeGraph}; adjacency and access metadata are updated in place.
 * {@link #connections} mirrors the targets of this node's outgoing edges and is
 * maintained by the graph only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryNode {

    private String id;
    private String title;
    private String content;
    private String summary;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String sourceConversationId;

    @Builder.Default
    private List<String> sourceMessageIds = new ArrayList<>();

    private Instant createdAt;
    private Instant lastAccessedAt;
    private int accessCount;
    private double importance;

    @Builder.Default
    private MemoryNodeType nodeType = MemoryNodeType.INSIGHT;

    @Builder.Default
    private List<String> connections = new ArrayList<>();

    // Reserved for semantic scoring, never populated yet.
    private List<Float> embedding;

    /**
     * Detached deep copy, safe to hand out while the original keeps mutating.
     */
    public MemoryNode copy() {
        return MemoryNode.builder()
                .id(id)
                .title(title)
                .content(content)
                .summary(summary)
                .keywords(copyOf(keywords))
                .sourceConversationId(sourceConversationId)
                .sourceMessageIds(copyOf(sourceMessageIds))
                .createdAt(createdAt)
                .lastAccessedAt(lastAccessedAt)
                .accessCount(accessCount)
                .importance(importance)
                .nodeType(nodeType)
                .connections(copyOf(connections))
                .embedding(embedding != null ? new ArrayList<>(embedding) : null)
                .build();
    }

    private static List<String> copyOf(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
