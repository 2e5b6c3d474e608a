package me.golemcore.palace.adapter.outbound.llm;

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

import me.golemcore.palace.domain.model.LlmRequest;
import me.golemcore.palace.domain.model.LlmResponse;
import me.golemcore.palace.domain.model.Message;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Completion adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible API endpoint
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * Models are addressed as {@code provider/name}; a bare name is treated as
 * OpenAI. Rate-limit errors are retried with exponential backoff, every other
 * failure completes the future exceptionally.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Configuration via {@code palace.llm.providers.*}.
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";

    private final PalaceProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();
    private volatile String currentModel;

    @Override
    public synchronized void initialize() {
        String model = properties.getLlm().getModel();
        this.currentModel = model;
        try {
            resolveModel(model);
            log.info("Langchain4j adapter initialized with model: {}", model);
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : properties.getLlm().getModel();
            ChatModel chatModel = resolveModel(model);
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .temperature(request.getTemperature())
                    .maxOutputTokens(request.getMaxTokens())
                    .build();

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(chatRequest);
                    return convertResponse(response, model);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.warn("[LLM] Chat failed: {}", e.getMessage());
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public String getCurrentModel() {
        return currentModel != null ? currentModel : properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    private ChatModel resolveModel(String model) {
        return models.computeIfAbsent(model, this::createModel);
    }

    private ChatModel createModel(String model) {
        String provider = providerOf(model);
        PalaceProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add palace.llm.providers." + provider + ".api-key");
        }
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(4096)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        // All non-Anthropic providers use OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            if (msg.isAssistantMessage()) {
                messages.add(AiMessage.from(msg.getContent()));
            } else {
                if (!msg.isUserMessage()) {
                    log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                }
                messages.add(UserMessage.from(msg.getContent()));
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                .build();
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private static String providerOf(String model) {
        return model.contains("/") ? model.substring(0, model.indexOf('/')) : PROVIDER_OPENAI;
    }

    private static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }
}
