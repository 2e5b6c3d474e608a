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
import me.golemcore.palace.domain.model.KnowledgeGraph;
import me.golemcore.palace.domain.model.MemoryNode;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares the new node against the most recent
 * {@code palace.discovery.max-comparisons} nodes of the timeline, newest
 * first.
 */
@Component
@RequiredArgsConstructor
public class RecentNodesCandidateSelector implements DiscoveryCandidateSelector {

    public static final String STRATEGY = "recent";

    private final PalaceProperties properties;

    @Override
    public String getStrategy() {
        return STRATEGY;
    }

    @Override
    public List<MemoryNode> selectCandidates(MemoryNode newNode, KnowledgeGraph graph) {
        int limit = Math.max(0, properties.getDiscovery().getMaxComparisons());
        List<MemoryNode> candidates = new ArrayList<>();
        if (limit == 0) {
            return candidates;
        }
        // One extra in case the new node is already on the timeline.
        for (MemoryNode existing : graph.getRecentNodes(limit + 1)) {
            if (candidates.size() >= limit) {
                break;
            }
            if (!existing.getId().equals(newNode.getId())
                    && !graph.hasConnection(newNode.getId(), existing.getId())) {
                candidates.add(existing);
            }
        }
        return candidates;
    }
}
