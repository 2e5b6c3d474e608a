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

import java.util.List;

/**
 * Chooses which existing nodes a newly ingested node is compared against.
 * Each comparison costs one completion call, so the strategy bounds ingestion
 * cost.
 */
public interface DiscoveryCandidateSelector {

    /**
     * Strategy name matched against {@code palace.discovery.strategy}.
     */
    String getStrategy();

    /**
     * Candidate nodes, never including {@code newNode} itself or nodes it
     * already points to.
     */
    List<MemoryNode> selectCandidates(MemoryNode newNode, KnowledgeGraph graph);
}
