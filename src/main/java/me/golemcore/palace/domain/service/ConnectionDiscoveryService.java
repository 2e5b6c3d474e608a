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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.palace.domain.model.CancellationToken;
import me.golemcore.palace.domain.model.ConnectionType;
import me.golemcore.palace.domain.model.ConnectionVerdict;
import me.golemcore.palace.domain.model.ExtractionError;
import me.golemcore.palace.domain.model.KnowledgeConnection;
import me.golemcore.palace.domain.model.KnowledgeGraph;
import me.golemcore.palace.domain.model.MemoryNode;
import me.golemcore.palace.domain.model.ParseResult;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Discovers typed, weighted relationships between a new node and existing
 * nodes.
 *
 * <p>
 * Each candidate pair costs one completion call, issued sequentially. A failed
 * or malformed verdict for one pair yields no edge for that pair and never
 * aborts the others. Candidates are chosen by the
 * {@link DiscoveryCandidateSelector} named in
 * {@code palace.discovery.strategy}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectionDiscoveryService {

    private static final String SYSTEM_PROMPT = "You analyze relationships between knowledge concepts. "
            + "Only identify meaningful, non-trivial connections.";

    private static final String PROMPT_TEMPLATE = """
            Analyze these two knowledge nodes and determine if there's a meaningful connection:

            Node 1: "%s" - %s
            Node 2: "%s" - %s

            If connected, respond with JSON:
            {"connected": true, "type": "similar|causal|contradictory|elaborative|temporal|thematic", \
            "strength": 0.0-1.0, "description": "explanation"}

            If not connected:
            {"connected": false}
            """;

    private final LlmCompletionService completionService;
    private final List<DiscoveryCandidateSelector> selectors;
    private final PalaceProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private DiscoveryCandidateSelector activeSelector;

    @PostConstruct
    public void init() {
        String strategy = properties.getDiscovery().getStrategy();
        activeSelector = selectors.stream()
                .filter(selector -> selector.getStrategy().equalsIgnoreCase(strategy))
                .findFirst()
                .orElse(null);
        if (activeSelector == null) {
            activeSelector = selectors.stream()
                    .filter(selector -> AllNodesCandidateSelector.STRATEGY.equals(selector.getStrategy()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No discovery candidate selector registered"));
            log.warn("[Discovery] Unknown strategy '{}', using: {}", strategy, activeSelector.getStrategy());
        } else {
            log.info("[Discovery] Candidate strategy: {}", activeSelector.getStrategy());
        }
    }

    public List<MemoryNode> selectCandidates(MemoryNode newNode, KnowledgeGraph graph) {
        return activeSelector.selectCandidates(newNode, graph);
    }

    public List<KnowledgeConnection> discoverConnections(MemoryNode newNode, List<MemoryNode> existingNodes) {
        return discoverConnections(newNode, existingNodes, CancellationToken.none());
    }

    /**
     * Evaluates {@code newNode} against every node in {@code existingNodes} and
     * returns the edges {@code newNode -> existing} the completion service
     * confirmed. Stops issuing calls once {@code token} is cancelled.
     */
    public List<KnowledgeConnection> discoverConnections(MemoryNode newNode, List<MemoryNode> existingNodes,
            CancellationToken token) {
        List<KnowledgeConnection> discovered = new ArrayList<>();
        if (newNode == null || existingNodes == null || existingNodes.isEmpty()) {
            return discovered;
        }

        int compared = 0;
        int failures = 0;
        for (MemoryNode existing : existingNodes) {
            if (token.isCancelled()) {
                log.info("[Discovery] Cancelled after {} of {} comparison(s)", compared, existingNodes.size());
                break;
            }
            if (existing.getId().equals(newNode.getId())) {
                continue;
            }

            ParseResult<ConnectionVerdict> verdict = analyzePair(newNode, existing);
            compared++;
            if (!verdict.isSuccess()) {
                failures++;
                log.debug("[Discovery] No verdict for '{}' -> '{}': {}", newNode.getTitle(), existing.getTitle(),
                        verdict.describeError());
                continue;
            }
            toConnection(verdict.value(), newNode, existing).ifPresent(discovered::add);
        }

        log.info("[Discovery] '{}': {} connection(s) from {} candidate(s), {} failed",
                newNode.getTitle(), discovered.size(), existingNodes.size(), failures);
        return discovered;
    }

    ParseResult<ConnectionVerdict> analyzePair(MemoryNode source, MemoryNode target) {
        String prompt = PROMPT_TEMPLATE.formatted(
                source.getTitle(), source.getSummary(),
                target.getTitle(), target.getSummary());
        return completionService
                .complete(SYSTEM_PROMPT, prompt, properties.getDiscovery().getTemperature())
                .flatMap(this::parseVerdict);
    }

    ParseResult<ConnectionVerdict> parseVerdict(String response) {
        String cleaned = LlmCompletionService.stripCodeFences(response);
        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            return ParseResult.failure(ExtractionError.MALFORMED_JSON, e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ParseResult.failure(ExtractionError.MALFORMED_JSON, "expected a JSON object");
        }

        JsonNode connected = root.get("connected");
        if (connected == null || !connected.isBoolean()) {
            return ParseResult.failure(ExtractionError.MISSING_FIELDS, "connected");
        }
        if (!connected.booleanValue()) {
            return ParseResult.success(ConnectionVerdict.notConnected());
        }

        JsonNode type = root.get("type");
        JsonNode strength = root.get("strength");
        JsonNode description = root.get("description");
        if (type == null || !type.isTextual() || strength == null || !strength.isNumber()
                || description == null || !description.isTextual()) {
            return ParseResult.failure(ExtractionError.MISSING_FIELDS, "type, strength and description required");
        }

        Optional<ConnectionType> connectionType = ConnectionType.parse(type.asText());
        if (connectionType.isEmpty()) {
            return ParseResult.failure(ExtractionError.INVALID_VALUE, "unknown connection type " + type.asText());
        }
        double strengthValue = strength.asDouble();
        if (strengthValue < 0.0 || strengthValue > 1.0) {
            return ParseResult.failure(ExtractionError.INVALID_VALUE, "strength out of range " + strengthValue);
        }

        return ParseResult.success(
                new ConnectionVerdict(true, connectionType.get(), strengthValue, description.asText()));
    }

    private Optional<KnowledgeConnection> toConnection(ConnectionVerdict verdict, MemoryNode source,
            MemoryNode target) {
        if (!verdict.connected()) {
            return Optional.empty();
        }
        return Optional.of(KnowledgeConnection.builder()
                .id(UUID.randomUUID().toString())
                .sourceNodeId(source.getId())
                .targetNodeId(target.getId())
                .connectionType(verdict.type())
                .strength(verdict.strength())
                .description(verdict.description())
                .createdAt(clock.instant())
                .build());
    }
}
