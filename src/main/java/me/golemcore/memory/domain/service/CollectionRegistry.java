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

package me.golemcore.memory.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.model.CollectionInfo;
import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.StoragePort;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps track of which embedding model each collection was indexed with.
 *
 * <p>
 * The record lives in {@code registry/collections.json} next to the engine's
 * other files rather than in the backend, so every backend supports it.
 */
@Component
@Slf4j
public class CollectionRegistry {

    private static final String FILE_NAME = "collections.json";

    private final VectorIndexPort vectorIndex;
    private final EmbeddingPort embeddingPort;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    private Map<String, CollectionInfo> infos;

    public CollectionRegistry(VectorIndexPort vectorIndex, EmbeddingPort embeddingPort, StoragePort storagePort,
            ObjectMapper objectMapper, Clock clock, MemoryProperties properties) {
        this.vectorIndex = vectorIndex;
        this.embeddingPort = embeddingPort;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getRegistryDirectory();
    }

    /**
     * Creates every backend collection that does not exist yet. Collections seen for
     * the first time are recorded under the current embedding model; a stored model
     * that differs from the current one is reported.
     */
    public synchronized void initializeCollections() {
        for (KnowledgeCollection collection : KnowledgeCollection.values()) {
            String name = collection.getCollectionName();
            vectorIndex.ensureCollection(name, embeddingPort.getDimension());
            Optional<CollectionInfo> info = getInfo(name);
            if (info.isEmpty()) {
                recordCurrentModel(name);
            } else if (!matchesCurrentModel(info.get())) {
                log.warn("[Registry] Collection {} indexed with {} v{}, current model is {} v{}; reindex needed",
                        name, info.get().getEmbeddingModel(), info.get().getEmbeddingModelVersion(),
                        embeddingPort.getModel(), embeddingPort.getModelVersion());
            }
        }
    }

    public synchronized Optional<CollectionInfo> getInfo(String collection) {
        return Optional.ofNullable(loaded().get(collection));
    }

    /**
     * Marks the collection as indexed with the currently configured model.
     */
    public synchronized void recordCurrentModel(String collection) {
        CollectionInfo info = CollectionInfo.builder()
                .name(collection)
                .embeddingModel(embeddingPort.getModel())
                .embeddingModelVersion(embeddingPort.getModelVersion())
                .dimension(embeddingPort.getDimension())
                .indexedAt(clock.instant())
                .build();
        loaded().put(collection, info);
        save();
    }

    public boolean matchesCurrentModel(CollectionInfo info) {
        return Objects.equals(info.getEmbeddingModel(), embeddingPort.getModel())
                && Objects.equals(info.getEmbeddingModelVersion(), embeddingPort.getModelVersion());
    }

    private Map<String, CollectionInfo> loaded() {
        if (infos != null) {
            return infos;
        }
        infos = new LinkedHashMap<>();
        String json = storagePort.getText(directory, FILE_NAME).join();
        if (json != null && !json.isBlank()) {
            try {
                infos.putAll(objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, CollectionInfo>>() {
                }));
            } catch (JsonProcessingException e) {
                log.warn("[Registry] Failed to parse {}, starting empty: {}", FILE_NAME, e.getMessage());
            }
        }
        return infos;
    }

    private void save() {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(infos);
            storagePort.putTextAtomic(directory, FILE_NAME, json, true).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize collection registry", e);
        }
    }
}
