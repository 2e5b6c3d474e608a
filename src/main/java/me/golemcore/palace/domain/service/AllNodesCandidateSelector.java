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

import me.golemcore.palace.domain.model.KnowledgeGraph;
import me.golemcore.palace.domain.model.MemoryNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares the new node against every existing node, in node store order.
 */
@Component
public class AllNodesCandidateSelector implements DiscoveryCandidateSelector {

    public static final String STRATEGY = "all";

    @Override
    public String getStrategy() {
        return STRATEGY;
    }

    @Override
    public List<MemoryNode> selectCandidates(MemoryNode newNode, KnowledgeGraph graph) {
        List<MemoryNode> candidates = new ArrayList<>();
        for (MemoryNode existing : graph.getNodes()) {
            if (!existing.getId().equals(newNode.getId())
                    && !graph.hasConnection(newNode.getId(), existing.getId())) {
                candidates.add(existing);
            }
        }
        return candidates;
    }
}
