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
import java.util.Objects;

/**
 * Directed, typed, weighted edge between two memory nodes. Edges are not
 * symmetric: {@code A -> B} says nothing about {@code B -> A}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class KnowledgeConnection {

    private String id;
    private String sourceNodeId;
    private String targetNodeId;
    private ConnectionType connectionType;
    private double strength;
    private String description;
    private Instant createdAt;

    public boolean sameEdge(KnowledgeConnection other) {
        return other != null
                && Objects.equals(sourceNodeId, other.sourceNodeId)
                && Objects.equals(targetNodeId, other.targetNodeId)
                && connectionType == other.connectionType;
    }
}
