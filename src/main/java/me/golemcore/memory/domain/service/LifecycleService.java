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

import me.golemcore.memory.domain.model.AuditEventType;
import me.golemcore.memory.domain.model.CleanupResult;
import me.golemcore.memory.domain.model.CollectionInfo;
import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.ReindexStatus;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TTL expiry and embedding-model reindexing for the knowledge collections
 * (facts, files, learnings).
 *
 * <p>
 * TTL is configured per collection in days; {@code 0} disables expiry.
 * Expired entries are hard-deleted regardless of status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecycleService {

    public static final String ALL = "all";

    private static final long SECONDS_PER_DAY = 86_400L;
    private static final int REINDEX_BATCH_SIZE = 64;

    private final KnowledgeIndex knowledgeIndex;
    private final VectorIndexPort vectorIndex;
    private final EmbeddingPort embeddingPort;
    private final CollectionRegistry collectionRegistry;
    private final AuditLogService auditLogService;
    private final MemoryProperties properties;
    private final Clock clock;

    public int ttlDays(KnowledgeCollection collection) {
        MemoryProperties.TtlProperties ttl = properties.getTtl();
        return switch (collection) {
        case FACTS -> ttl.getFactsDays();
        case FILES -> ttl.getFilesDays();
        case LEARNINGS -> ttl.getLearningsDays();
        default -> 0;
        };
    }

    /**
     * Ids of entries created more than {@code ttlDays} ago, judged by the numeric
     * creation timestamp. Entries without one never expire.
     */
    public List<String> getExpiredIds(KnowledgeCollection collection, int ttlDays) {
        if (ttlDays <= 0) {
            return List.of();
        }
        try {
            if (knowledgeIndex.count(collection) == 0) {
                return List.of();
            }
            long cutoff = clock.instant().getEpochSecond() - ttlDays * SECONDS_PER_DAY;
            List<String> expired = new ArrayList<>();
            for (KnowledgeEntry entry : knowledgeIndex.find(collection, VectorFilter.none(), 0)) {
                Long createdTs = entry.getMetadata().getCreatedTs();
                if (createdTs != null && createdTs > 0 && createdTs < cutoff) {
                    expired.add(entry.getId());
                }
            }
            return expired;
        } catch (RuntimeException e) {
            log.warn("[Lifecycle] TTL scan of {} failed: {}", collection.getShortName(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Expired ids per collection for a collection name or {@code all}.
     */
    public Map<String, List<String>> getExpired(String collectionName) {
        Map<String, List<String>> expired = new LinkedHashMap<>();
        for (KnowledgeCollection collection : resolve(collectionName)) {
            expired.put(collection.getShortName(), getExpiredIds(collection, ttlDays(collection)));
        }
        return expired;
    }

    /**
     * Hard-deletes expired entries.
     *
     * @param collectionName
     *            {@code facts}, {@code files}, {@code learnings} or {@code all}
     */
    public CleanupResult cleanupExpired(String collectionName) {
        Map<String, Integer> deleted = new LinkedHashMap<>();
        int total = 0;
        for (KnowledgeCollection collection : resolve(collectionName)) {
            int ttl = ttlDays(collection);
            if (ttl <= 0) {
                continue;
            }
            List<String> expired = getExpiredIds(collection, ttl);
            if (expired.isEmpty()) {
                deleted.put(collection.getShortName(), 0);
                continue;
            }
            try {
                knowledgeIndex.hardDelete(collection, expired);
                deleted.put(collection.getShortName(), expired.size());
                total += expired.size();
                log.info("[Lifecycle] TTL cleanup removed {} entries from {}", expired.size(),
                        collection.getShortName());
            } catch (RuntimeException e) {
                log.error("[Lifecycle] TTL delete in {} failed: {}", collection.getShortName(), e.getMessage());
                deleted.put(collection.getShortName(), 0);
            }
        }
        if (total > 0) {
            auditLogService.record(AuditEventType.TTL_CLEANUP, null, null, null,
                    Map.of("total_deleted", total, "by_collection", new LinkedHashMap<>(deleted)));
        }
        return new CleanupResult(deleted, total);
    }

    /**
     * Compares the embedding model each knowledge collection was indexed with to
     * the configured one. Collections without a record are not flagged.
     */
    public List<ReindexStatus> checkReindexNeeded() {
        List<ReindexStatus> statuses = new ArrayList<>();
        for (KnowledgeCollection collection : KnowledgeCollection.KNOWLEDGE) {
            Optional<CollectionInfo> info = collectionRegistry.getInfo(collection.getCollectionName());
            String storedModel = info.map(CollectionInfo::getEmbeddingModel).orElse("");
            String storedVersion = info.map(CollectionInfo::getEmbeddingModelVersion).orElse("");
            boolean needed = info.isPresent() && !collectionRegistry.matchesCurrentModel(info.get());
            statuses.add(new ReindexStatus(collection.getShortName(), storedModel, storedVersion,
                    embeddingPort.getModel(), embeddingPort.getModelVersion(), needed));
        }
        return statuses;
    }

    /**
     * Re-embeds every document of a collection in place, keeping ids and
     * metadata.
     *
     * @param force
     *            reindex even when the stored model matches
     * @return number of documents re-embedded
     */
    public int reindexCollection(String collectionName, boolean force) {
        KnowledgeCollection collection = KnowledgeCollection.fromName(collectionName)
                .filter(KnowledgeCollection.KNOWLEDGE::contains)
                .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + collectionName));
        if (!force && !needsReindex(collection)) {
            log.info("[Lifecycle] Reindex of {} not needed", collection.getShortName());
            return 0;
        }

        String name = collection.getCollectionName();
        List<VectorRecord> records = vectorIndex.find(name, VectorFilter.none(), 0);
        if (records.isEmpty()) {
            collectionRegistry.recordCurrentModel(name);
            return 0;
        }
        log.info("[Lifecycle] Reindexing {} ({} documents) with {}", collection.getShortName(), records.size(),
                embeddingPort.getModel());

        for (int from = 0; from < records.size(); from += REINDEX_BATCH_SIZE) {
            List<VectorRecord> batch = records.subList(from, Math.min(records.size(), from + REINDEX_BATCH_SIZE));
            List<float[]> vectors = embeddingPort.embedBatch(batch.stream().map(VectorRecord::document).toList())
                    .join();
            Map<String, float[]> vectorsById = new LinkedHashMap<>();
            for (int i = 0; i < batch.size(); i++) {
                vectorsById.put(batch.get(i).id(), vectors.get(i));
            }
            vectorIndex.updateVectors(name, vectorsById);
        }
        collectionRegistry.recordCurrentModel(name);

        auditLogService.record(AuditEventType.COLLECTION_REINDEXED, null, null, null,
                Map.of("collection", collection.getShortName(), "reindexed", records.size(),
                        "embedding_model", embeddingPort.getModel()));
        log.info("[Lifecycle] Reindexed {} documents in {}", records.size(), collection.getShortName());
        return records.size();
    }

    /**
     * Reindexes every knowledge collection; a failing collection is logged and
     * reported as 0.
     */
    public Map<String, Integer> reindexAll(boolean force) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (KnowledgeCollection collection : KnowledgeCollection.KNOWLEDGE) {
            try {
                counts.put(collection.getShortName(), reindexCollection(collection.getShortName(), force));
            } catch (RuntimeException e) {
                log.error("[Lifecycle] Reindex of {} failed: {}", collection.getShortName(), e.getMessage());
                counts.put(collection.getShortName(), 0);
            }
        }
        return counts;
    }

    private boolean needsReindex(KnowledgeCollection collection) {
        return collectionRegistry.getInfo(collection.getCollectionName())
                .map(info -> !collectionRegistry.matchesCurrentModel(info))
                .orElse(false);
    }

    private static List<KnowledgeCollection> resolve(String collectionName) {
        if (collectionName == null || ALL.equalsIgnoreCase(collectionName.trim())) {
            return KnowledgeCollection.KNOWLEDGE;
        }
        return KnowledgeCollection.fromName(collectionName)
                .filter(KnowledgeCollection.KNOWLEDGE::contains)
                .map(List::of)
                .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + collectionName));
    }
}
