package me.golemcore.palace.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the memory palace, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code palace.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - text-completion provider settings</li>
 * <li>{@link StorageProperties} - durable store location and keys</li>
 * <li>{@link ExtractionProperties} - insight extraction prompt bounds</li>
 * <li>{@link DiscoveryProperties} - connection discovery strategy</li>
 * <li>{@link RecallProperties} - recall ranking weights</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "palace")
@Data
public class PalaceProperties {

    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();
    private ExtractionProperties extraction = new ExtractionProperties();
    private DiscoveryProperties discovery = new DiscoveryProperties();
    private RecallProperties recall = new RecallProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        /**
         * Model in {@code provider/name} form, e.g. {@code openai/gpt-4o-mini}.
         */
        private String model = "openai/gpt-4o-mini";
        private long timeoutMs = 60000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String directory = "memory-palace";
        private String graphKey = "knowledge-graph.json";
        private String indexKey = "search-index.json";
        private boolean backup = true;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.memory-palace/workspace";
    }

    @Data
    public static class ExtractionProperties {
        private int maxConversationChars = 2000;
        private double temperature = 0.3;
    }

    @Data
    public static class DiscoveryProperties {
        /**
         * Candidate selection strategy: {@code all} or {@code recent}.
         */
        private String strategy = "all";
        /**
         * Number of most recent nodes compared by the {@code recent} strategy.
         */
        private int maxComparisons = 50;
        private double temperature = 0.2;
    }

    @Data
    public static class RecallProperties {
        private int statisticalTopK = 20;
        private long recencyWindowHours = 24;
        private double recencyBoost = 0.2;
        private double accessCountWeight = 0.1;
        private boolean recordAccess = true;
    }
}
