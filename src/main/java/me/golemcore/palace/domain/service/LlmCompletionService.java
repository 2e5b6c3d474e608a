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
import me.golemcore.palace.domain.model.ExtractionError;
import me.golemcore.palace.domain.model.LlmRequest;
import me.golemcore.palace.domain.model.LlmResponse;
import me.golemcore.palace.domain.model.Message;
import me.golemcore.palace.domain.model.ParseResult;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import me.golemcore.palace.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-shot, time-bounded calls to the text-completion service.
 *
 * <p>
 * Every outcome is folded into a {@link ParseResult}: network failures,
 * timeouts and empty completions become failures, never exceptions. No retries
 * are performed here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmCompletionService {

    private final LlmPort llmPort;
    private final PalaceProperties properties;

    public ParseResult<String> complete(String systemPrompt, String prompt, double temperature) {
        LlmRequest request = LlmRequest.builder()
                .model(properties.getLlm().getModel())
                .systemPrompt(systemPrompt)
                .messages(List.of(Message.builder()
                        .role("user")
                        .content(prompt)
                        .build()))
                .temperature(temperature)
                .build();

        long timeoutMs = properties.getLlm().getTimeoutMs();
        CompletableFuture<LlmResponse> future = null;
        try {
            future = llmPort.chat(request);
            LlmResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (response == null || !response.hasContent()) {
                return ParseResult.failure(ExtractionError.EMPTY_COMPLETION, "completion was empty");
            }
            return ParseResult.success(response.getContent());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Completion] No response within {}ms", timeoutMs);
            return ParseResult.failure(ExtractionError.TIMEOUT, "no response within " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ParseResult.failure(ExtractionError.COMPLETION_FAILED, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Completion] Call failed: {}", cause.getMessage());
            return ParseResult.failure(ExtractionError.COMPLETION_FAILED, cause.getMessage());
        } catch (RuntimeException e) {
            log.warn("[Completion] Call failed: {}", e.getMessage());
            return ParseResult.failure(ExtractionError.COMPLETION_FAILED, e.getMessage());
        }
    }

    /**
     * Removes Markdown code-fence markers and surrounding whitespace.
     */
    public static String stripCodeFences(String response) {
        if (response == null) {
            return "";
        }
        return response
                .replace("```json", "")
                .replace("```", "")
                .trim();
    }
}
