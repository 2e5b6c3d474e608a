package me.golemcore.palace;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Memory Palace.
 *
 * <p>
 * Memory Palace is a personal knowledge graph and recall engine. It distills
 * conversations into memory nodes, links them by semantic relationship and
 * answers recall queries by combining substring matches with TF-IDF ranking.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → MemoryPalaceService, extraction, discovery, recall
 * Ports              → LlmPort (text completion), StoragePort (durable store)
 * Infrastructure     → langchain4j LLM adapter, local filesystem storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code palace.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PalaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PalaceApplication.class, args);
    }

}
