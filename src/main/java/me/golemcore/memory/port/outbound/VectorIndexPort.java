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

import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorHit;
import me.golemcore.memory.domain.model.VectorRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Port for the vector index backend: similarity search, payload filtering and
 * CRUD over embedding records.
 *
 * <p>
 * Calls are blocking. Implementations throw unchecked exceptions on backend
 * failures; callers decide whether a failure degrades or propagates.
 */
public interface VectorIndexPort {

    /**
     * Create the collection if it does not exist yet.
     */
    void ensureCollection(String collection, int dimension);

    /**
     * Insert or replace records by id.
     */
    void upsert(String collection, List<VectorRecord> records);

    /**
     * Fetch records by id. Unknown ids are skipped.
     */
    List<VectorRecord> get(String collection, Collection<String> ids);

    /**
     * Fetch records matching a payload filter.
     *
     * @param limit
     *            maximum number of records, or {@code 0} for all
     */
    List<VectorRecord> find(String collection, VectorFilter filter, int limit);

    /**
     * Nearest-neighbour query, closest first.
     */
    List<VectorHit> query(String collection, float[] vector, VectorFilter filter, int limit);

    /**
     * Remove records by id.
     */
    void delete(String collection, Collection<String> ids);

    long count(String collection);

    /**
     * Replace payloads of existing records, keeping vectors and documents.
     */
    void updatePayloads(String collection, Map<String, Map<String, Object>> payloadsById);

    /**
     * Replace vectors of existing records, keeping payloads and documents.
     */
    void updateVectors(String collection, Map<String, float[]> vectorsById);
}
