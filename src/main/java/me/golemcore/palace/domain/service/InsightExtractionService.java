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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.palace.domain.model.ExtractionError;
import me.golemcore.palace.domain.model.InsightCandidate;
import me.golemcore.palace.domain.model.ParseResult;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns conversation text into insight candidates via the completion service.
 *
 * <p>
 * Extraction is best-effort: one completion call, no retries. The response is
 * untrusted; it is fence-stripped and decoded as a JSON array whose elements
 * must all carry every insight field with its JSON type. Any failure, including
 * a single mismatching element, is reported as a {@link ParseResult} failure
 * which callers treat as "no insights".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InsightExtractionService {

    private static final String SYSTEM_PROMPT = "You are an expert at extracting and organizing knowledge "
            + "from conversations. Extract meaningful insights that would be valuable to remember later.";

    private static final String PROMPT_TEMPLATE = """
            Analyze this conversation and extract key insights, facts, ideas, and important information \
            that should be remembered. For each insight, provide:
            1. A clear title
            2. The main content/insight
            3. A brief summary
            4. 3-5 relevant keywords
            5. The type (insight, fact, idea, question, solution, pattern)
            6. Importance score (0.0-1.0)

            Conversation:
            %s

            Respond with JSON array:
            [{"title": "...", "content": "...", "summary": "...", "keywords": ["..."], "type": "insight", "importance": 0.8}]
            """;

    private final LlmCompletionService completionService;
    private final PalaceProperties properties;
    private final ObjectMapper objectMapper;

    public ParseResult<List<InsightCandidate>> extractInsights(String conversationText) {
        if (conversationText == null || conversationText.isBlank()) {
            return ParseResult.success(List.of());
        }

        String prompt = buildPrompt(conversationText);
        log.debug("[Extraction] Prompt:\n{}", prompt);

        ParseResult<List<InsightCandidate>> result = completionService
                .complete(SYSTEM_PROMPT, prompt, properties.getExtraction().getTemperature())
                .flatMap(this::parseInsights);

        if (result.isSuccess()) {
            log.info("[Extraction] Extracted {} insight(s)", result.value().size());
        } else {
            log.warn("[Extraction] No insights extracted: {}", result.describeError());
        }
        return result;
    }

    String buildPrompt(String conversationText) {
        int maxChars = Math.max(0, properties.getExtraction().getMaxConversationChars());
        String truncated = conversationText.length() > maxChars
                ? conversationText.substring(0, maxChars)
                : conversationText;
        return PROMPT_TEMPLATE.formatted(truncated);
    }

    ParseResult<List<InsightCandidate>> parseInsights(String response) {
        String cleaned = LlmCompletionService.stripCodeFences(response);
        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            return ParseResult.failure(ExtractionError.MALFORMED_JSON, e.getOriginalMessage());
        }
        if (root == null || !root.isArray()) {
            return ParseResult.failure(ExtractionError.MALFORMED_JSON, "expected a JSON array");
        }

        List<InsightCandidate> candidates = new ArrayList<>();
        int position = 0;
        for (JsonNode element : root) {
            InsightCandidate candidate = toCandidate(element);
            if (candidate == null) {
                log.debug("[Extraction] Insight #{} does not match the expected shape: {}", position, element);
                return ParseResult.failure(ExtractionError.MISSING_FIELDS,
                        "insight #" + position + " lacks a field or has a wrong type");
            }
            candidates.add(candidate);
            position++;
        }
        return ParseResult.success(candidates);
    }

    /**
     * Strict decode: every field must be present with its JSON type, otherwise
     * {@code null}.
     */
    private InsightCandidate toCandidate(JsonNode element) {
        if (element == null || !element.isObject()) {
            return null;
        }
        JsonNode title = element.get("title");
        JsonNode content = element.get("content");
        JsonNode summary = element.get("summary");
        JsonNode keywords = element.get("keywords");
        JsonNode type = element.get("type");
        JsonNode importance = element.get("importance");
        if (!isText(title) || !isText(content) || !isText(summary) || !isText(type)
                || importance == null || !importance.isNumber() || !isTextArray(keywords)) {
            return null;
        }

        return new InsightCandidate(title.asText().trim(), content.asText().trim(), summary.asText().trim(),
                normalizeKeywords(keywords), type.asText().trim(), clamp(importance.asDouble()));
    }

    private static List<String> normalizeKeywords(JsonNode node) {
        Set<String> keywords = new LinkedHashSet<>();
        for (JsonNode keyword : node) {
            if (!keyword.asText().isBlank()) {
                keywords.add(keyword.asText().trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(keywords);
    }

    private static boolean isText(JsonNode node) {
        return node != null && node.isTextual();
    }

    private static boolean isTextArray(JsonNode node) {
        if (node == null || !node.isArray()) {
            return false;
        }
        for (JsonNode value : node) {
            if (!value.isTextual()) {
                return false;
            }
        }
        return true;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
