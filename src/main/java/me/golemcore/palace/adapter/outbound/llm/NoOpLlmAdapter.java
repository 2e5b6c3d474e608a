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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op adapter used when no completion provider is configured.
 *
 * <p>
 * Returns an empty completion, which the extraction and discovery parsers
 * treat as "nothing found". The memory palace therefore stays usable for
 * recall even without a provider.
 *
 * <p>
 * Provider ID: {@code "none"}
 *
 * @see LlmProviderAdapter
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content("")
                .model("none")
                .finishReason("stop")
                .build());
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
