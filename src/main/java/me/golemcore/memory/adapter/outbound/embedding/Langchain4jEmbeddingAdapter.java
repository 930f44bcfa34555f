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

package me.golemcore.memory.adapter.outbound.embedding;

import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j against an OpenAI-compatible endpoint.
 *
 * <p>
 * The model client is built on first use by a guarded once-only initializer,
 * so the application starts without an API key and reports the service as
 * unavailable instead.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code memory.embedding.api-key} - API key
 * <li>{@code memory.embedding.base-url} - endpoint
 * <li>{@code memory.embedding.model} - embedding model name
 * <li>{@code memory.embedding.dimension} - vector size of the model
 * </ul>
 *
 * @see me.golemcore.memory.port.outbound.EmbeddingPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final MemoryProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        String apiKey = properties.getEmbedding().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Embedding] API key not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        try {
            OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(getModel());
            String baseUrl = properties.getEmbedding().getBaseUrl();
            if (baseUrl != null && !baseUrl.isBlank()) {
                builder.baseUrl(baseUrl);
            }
            embeddingModel = builder.build();
            log.info("[Embedding] Model initialized: {}", getModel());
        } catch (Exception e) {
            log.error("[Embedding] Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }
            if (texts.isEmpty()) {
                return List.of();
            }

            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            Response<List<Embedding>> response = embeddingModel.embedAll(segments);

            return response.content().stream()
                    .map(Embedding::vector)
                    .toList();
        });
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public String getModelVersion() {
        return properties.getEmbedding().getModelVersion();
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
