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
import me.golemcore.palace.domain.model.InsightCandidate;
import me.golemcore.palace.domain.model.MemoryNode;
import me.golemcore.palace.domain.model.MemoryNodeType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Promotes insight candidates to memory nodes. Pure mapping apart from id
 * generation and timestamps.
 */
@Component
@RequiredArgsConstructor
public class MemoryNodeFactory {

    private final Clock clock;

    /**
     * @param candidate
     *            accepted insight
     * @param sourceConversationId
     *            conversation the insight came from
     * @param sourceMessageIds
     *            messages of that conversation
     */
    public MemoryNode createNode(InsightCandidate candidate, String sourceConversationId,
            List<String> sourceMessageIds) {
        Instant now = clock.instant();
        return MemoryNode.builder()
                .id(UUID.randomUUID().toString())
                .title(candidate.title())
                .content(candidate.content())
                .summary(candidate.summary())
                .keywords(new ArrayList<>(candidate.keywords()))
                .sourceConversationId(sourceConversationId)
                .sourceMessageIds(sourceMessageIds != null ? new ArrayList<>(sourceMessageIds) : new ArrayList<>())
                .createdAt(now)
                .lastAccessedAt(now)
                .accessCount(0)
                .importance(candidate.importance())
                .nodeType(MemoryNodeType.fromValue(candidate.type()))
                .connections(new ArrayList<>())
                .embedding(null)
                .build();
    }
}
