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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.palace.domain.model.KnowledgeGraph;
import me.golemcore.palace.domain.model.SearchIndex;
import me.golemcore.palace.infrastructure.config.PalaceProperties;
import me.golemcore.palace.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Snapshots the knowledge graph and the search index to the durable store as
 * two independent JSON documents.
 *
 * <p>
 * Loading is lenient: a missing, undecodable, newer-schema or inconsistent
 * document leaves that structure empty. Saving overwrites both documents and
 * reports failure through {@link MemoryPalaceStorageException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MemoryPalaceStore {

    private final StoragePort storagePort;
    private final PalaceProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Writes both documents. Both writes are attempted even if the first fails.
     *
     * @throws MemoryPalaceStorageException
     *             if either document could not be written
     */
    public void save(KnowledgeGraph graph, SearchIndex index) {
        PalaceProperties.StorageProperties storage = properties.getStorage();
        RuntimeException failure = null;

        try {
            write(storage.getGraphKey(), objectMapper.writeValueAsString(graph));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Store] Failed to save knowledge graph: {}", e.getMessage());
            failure = new MemoryPalaceStorageException("Failed to save knowledge graph", e);
        }

        try {
            write(storage.getIndexKey(), objectMapper.writeValueAsString(index));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Store] Failed to save search index: {}", e.getMessage());
            if (failure == null) {
                failure = new MemoryPalaceStorageException("Failed to save search index", e);
            } else {
                failure.addSuppressed(e);
            }
        }

        if (failure != null) {
            throw failure;
        }
        log.debug("[Store] Saved {} node(s), {} indexed document(s)", graph.getNodeCount(),
                index.getTotalDocuments());
    }

    public KnowledgeGraph loadGraph() {
        KnowledgeGraph graph = read(properties.getStorage().getGraphKey(), KnowledgeGraph.class);
        if (graph == null) {
            return new KnowledgeGraph();
        }
        if (graph.getSchemaVersion() > KnowledgeGraph.SCHEMA_VERSION || !graph.isConsistent()) {
            log.warn("[Store] Knowledge graph snapshot unusable (schema {}), starting empty",
                    graph.getSchemaVersion());
            return new KnowledgeGraph();
        }
        log.info("[Store] Loaded knowledge graph: {} node(s), {} connection(s)", graph.getNodeCount(),
                graph.getConnections().size());
        return graph;
    }

    public SearchIndex loadIndex() {
        SearchIndex index = read(properties.getStorage().getIndexKey(), SearchIndex.class);
        if (index == null) {
            return new SearchIndex();
        }
        if (index.getSchemaVersion() > SearchIndex.SCHEMA_VERSION || !index.isConsistent()) {
            log.warn("[Store] Search index snapshot unusable (schema {}), starting empty",
                    index.getSchemaVersion());
            return new SearchIndex();
        }
        log.info("[Store] Loaded search index: {} document(s), {} term(s)", index.getTotalDocuments(),
                index.getTermCount());
        return index;
    }

    private void write(String key, String json) {
        PalaceProperties.StorageProperties storage = properties.getStorage();
        storagePort.putTextAtomic(storage.getDirectory(), key, json, storage.isBackup()).join();
    }

    private <T> T read(String key, Class<T> type) {
        String directory = properties.getStorage().getDirectory();
        try {
            String json = storagePort.getText(directory, key).join();
            if (json == null || json.isBlank()) {
                log.debug("[Store] No snapshot at {}/{}", directory, key);
                return null;
            }
            return objectMapper.readValue(json, type);
        } catch (IOException | RuntimeException e) {
            log.warn("[Store] Failed to load {}/{}: {}", directory, key, e.getMessage());
            return null;
        }
    }
}
