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

package me.golemcore.memory.port.outbound;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for generating text embeddings (dense vector representations) for every
 * collection of the memory store.
 */
public interface EmbeddingPort {

    /**
     * Generate embedding for a single text.
     *
     * @param text
     *            the text to embed
     * @return vector representation
     */
    CompletableFuture<float[]> embed(String text);

    /**
     * Generate embeddings for multiple texts (batch), in input order.
     *
     * @param texts
     *            list of texts to embed
     * @return list of vector representations
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts);

    /**
     * Get the embedding dimension, used to size newly created collections.
     */
    int getDimension();

    /**
     * Get the model name.
     */
    String getModel();

    /**
     * Get the configured model version tag. Collections indexed under a different
     * model or version need a reindex.
     */
    String getModelVersion();

    /**
     * Check if the embedding service is available.
     */
    boolean isAvailable();
}
