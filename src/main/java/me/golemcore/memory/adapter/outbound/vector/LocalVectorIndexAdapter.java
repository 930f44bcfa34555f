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

package me.golemcore.memory.adapter.outbound.vector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorHit;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.StoragePort;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process vector index with brute-force cosine search.
 *
 * <p>
 * Each collection is kept in memory and, when {@code memory.vector.local.persist}
 * is on, snapshotted after every mutation to {@code vectors/{collection}.jsonl}
 * through {@link StoragePort#putTextAtomic}. Snapshots are loaded lazily on
 * first access to a collection.
 *
 * <p>
 * Operations on one collection are serialized by a per-collection monitor.
 * Every snapshot rewrites the whole collection file, which keeps the format a
 * plain JSONL dump; large deployments use the Qdrant backend instead.
 */
@Slf4j
public class LocalVectorIndexAdapter implements VectorIndexPort {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final boolean persist;
    private final String directory;

    private final Map<String, LocalCollection> collections = new ConcurrentHashMap<>();

    public LocalVectorIndexAdapter(MemoryProperties properties, StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.persist = properties.getVector().getLocal().isPersist();
        this.directory = properties.getStorage().getVectorsDirectory();
    }

    @Override
    public void ensureCollection(String collection, int dimension) {
        collection(collection);
        log.debug("[VectorIndex] Collection {} ready ({} records, dimension {})", collection, count(collection),
                dimension);
    }

    @Override
    public void upsert(String collection, List<VectorRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        LocalCollection local = collection(collection);
        synchronized (local) {
            Map<String, VectorRecord> changes = new LinkedHashMap<>();
            for (VectorRecord record : records) {
                changes.put(record.id(), copy(record));
            }
            apply(collection, local, changes);
        }
    }

    @Override
    public List<VectorRecord> get(String collection, Collection<String> ids) {
        LocalCollection local = collection(collection);
        synchronized (local) {
            List<VectorRecord> result = new ArrayList<>();
            for (String id : ids) {
                VectorRecord record = local.records.get(id);
                if (record != null) {
                    result.add(copy(record));
                }
            }
            return result;
        }
    }

    @Override
    public List<VectorRecord> find(String collection, VectorFilter filter, int limit) {
        LocalCollection local = collection(collection);
        synchronized (local) {
            List<VectorRecord> result = new ArrayList<>();
            for (VectorRecord record : local.records.values()) {
                if (filter.matches(record.payload())) {
                    result.add(copy(record));
                    if (limit > 0 && result.size() >= limit) {
                        break;
                    }
                }
            }
            return result;
        }
    }

    @Override
    public List<VectorHit> query(String collection, float[] vector, VectorFilter filter, int limit) {
        LocalCollection local = collection(collection);
        List<VectorHit> hits = new ArrayList<>();
        synchronized (local) {
            for (VectorRecord record : local.records.values()) {
                if (record.vector() == null || record.vector().length != vector.length) {
                    continue;
                }
                if (!filter.matches(record.payload())) {
                    continue;
                }
                double distance = 1.0 - cosineSimilarity(vector, record.vector());
                hits.add(new VectorHit(copy(record), distance));
            }
        }
        hits.sort(Comparator.comparingDouble(VectorHit::distance));
        return limit > 0 && hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }

    @Override
    public void delete(String collection, Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        LocalCollection local = collection(collection);
        synchronized (local) {
            Map<String, VectorRecord> changes = new LinkedHashMap<>();
            for (String id : ids) {
                if (local.records.containsKey(id)) {
                    changes.put(id, null);
                }
            }
            apply(collection, local, changes);
        }
    }

    @Override
    public long count(String collection) {
        LocalCollection local = collection(collection);
        synchronized (local) {
            return local.records.size();
        }
    }

    @Override
    public void updatePayloads(String collection, Map<String, Map<String, Object>> payloadsById) {
        LocalCollection local = collection(collection);
        synchronized (local) {
            Map<String, VectorRecord> changes = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, Object>> entry : payloadsById.entrySet()) {
                VectorRecord existing = local.records.get(entry.getKey());
                if (existing != null) {
                    changes.put(existing.id(), new VectorRecord(existing.id(), existing.vector(),
                            existing.document(), new LinkedHashMap<>(entry.getValue())));
                }
            }
            apply(collection, local, changes);
        }
    }

    @Override
    public void updateVectors(String collection, Map<String, float[]> vectorsById) {
        LocalCollection local = collection(collection);
        synchronized (local) {
            Map<String, VectorRecord> changes = new LinkedHashMap<>();
            for (Map.Entry<String, float[]> entry : vectorsById.entrySet()) {
                VectorRecord existing = local.records.get(entry.getKey());
                if (existing != null) {
                    changes.put(existing.id(), new VectorRecord(existing.id(), entry.getValue().clone(),
                            existing.document(), existing.payload()));
                }
            }
            apply(collection, local, changes);
        }
    }

    /**
     * Cosine similarity in [-1, 1]; zero vectors compare as 0.
     */
    static double cosineSimilarity(float[] a, float[] b) {
        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private LocalCollection collection(String name) {
        return collections.computeIfAbsent(name, this::load);
    }

    private LocalCollection load(String name) {
        LocalCollection local = new LocalCollection();
        if (!persist) {
            return local;
        }
        String content = storagePort.getText(directory, snapshotPath(name)).join();
        if (content == null || content.isBlank()) {
            return local;
        }
        int skipped = 0;
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                VectorRecord record = objectMapper.readValue(line, VectorRecord.class);
                local.records.put(record.id(), record);
            } catch (JsonProcessingException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("[VectorIndex] Skipped {} unreadable records in snapshot of {}", skipped, name);
        }
        log.debug("[VectorIndex] Loaded {} records into {}", local.records.size(), name);
        return local;
    }

    /**
     * Applies record changes (a null value removes the record) and snapshots the
     * collection. When the snapshot fails the changes are reverted before the
     * error propagates, so memory never holds writes the snapshot does not.
     */
    private void apply(String name, LocalCollection local, Map<String, VectorRecord> changes) {
        if (changes.isEmpty()) {
            return;
        }
        Map<String, VectorRecord> previous = new LinkedHashMap<>();
        for (Map.Entry<String, VectorRecord> change : changes.entrySet()) {
            VectorRecord old = change.getValue() != null
                    ? local.records.put(change.getKey(), change.getValue())
                    : local.records.remove(change.getKey());
            previous.put(change.getKey(), old);
        }
        try {
            persist(name, local);
        } catch (RuntimeException e) {
            for (Map.Entry<String, VectorRecord> entry : previous.entrySet()) {
                if (entry.getValue() != null) {
                    local.records.put(entry.getKey(), entry.getValue());
                } else {
                    local.records.remove(entry.getKey());
                }
            }
            log.warn("[VectorIndex] Snapshot of {} failed, reverted {} changes: {}", name, previous.size(),
                    e.getMessage());
            throw e;
        }
    }

    private void persist(String name, LocalCollection local) {
        if (!persist) {
            return;
        }
        StringBuilder sb = new StringBuilder();
        try {
            for (VectorRecord record : local.records.values()) {
                sb.append(objectMapper.writeValueAsString(record)).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize collection " + name, e);
        }
        storagePort.putTextAtomic(directory, snapshotPath(name), sb.toString(), false).join();
    }

    private static String snapshotPath(String name) {
        return name + ".jsonl";
    }

    private static VectorRecord copy(VectorRecord record) {
        Map<String, Object> payload = record.payload() != null ? new LinkedHashMap<>(record.payload())
                : new LinkedHashMap<>();
        return new VectorRecord(record.id(), record.vector(), record.document(), payload);
    }

    private static final class LocalCollection {
        private final Map<String, VectorRecord> records = new LinkedHashMap<>();
    }
}
