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

import me.golemcore.memory.domain.model.AuditEvent;
import me.golemcore.memory.domain.model.AuditEventType;
import me.golemcore.memory.domain.model.EmbeddingStatus;
import me.golemcore.memory.domain.model.EntryStatus;
import me.golemcore.memory.domain.model.FactSearchRequest;
import me.golemcore.memory.domain.model.FileSummary;
import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.KnowledgeMetadata;
import me.golemcore.memory.domain.model.RetrievalMetricsSnapshot;
import me.golemcore.memory.domain.model.SearchResult;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Facts and file chunks: writes, hybrid search, file management and store-wide
 * statistics.
 *
 * <p>
 * File-management operations locate chunks by file name, rewrite their metadata
 * and leave embeddings untouched. Each returns the number of chunks it changed
 * and records an audit event when that number is positive.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeStoreService {

    private final KnowledgeIndex knowledgeIndex;
    private final SearchMerger searchMerger;
    private final RetrievalMetrics retrievalMetrics;
    private final AuditLogService auditLogService;
    private final EmbeddingPort embeddingPort;
    private final VectorIndexPort vectorIndex;
    private final MemoryProperties properties;
    private final Clock clock;

    // ===== Writes =====

    /**
     * Stores a fact.
     *
     * @return the new entry id, or an empty string when {@code text} is blank
     */
    public String addFact(String text, KnowledgeMetadata metadata) {
        return addEntry(KnowledgeCollection.FACTS, text, metadata);
    }

    /**
     * Stores one chunk of an uploaded file.
     *
     * @return the new entry id, or an empty string when {@code text} is blank
     */
    public String addFileChunk(String text, KnowledgeMetadata metadata) {
        return addEntry(KnowledgeCollection.FILES, text, metadata);
    }

    private String addEntry(KnowledgeCollection collection, String text, KnowledgeMetadata metadata) {
        String prepared = knowledgeIndex.prepareText(text);
        if (prepared.isEmpty()) {
            log.debug("[Knowledge] Skipping blank {} entry", collection.getShortName());
            return "";
        }
        Instant now = clock.instant();
        KnowledgeMetadata base = metadata != null ? metadata.toBuilder().build() : new KnowledgeMetadata();
        KnowledgeMetadata stored = base.toBuilder()
                .status(EntryStatus.ACTIVE)
                .version(1)
                .supersededAt(null)
                .supersededBy(null)
                .deletedAt(null)
                .createdAt(now)
                .createdTs(now.getEpochSecond())
                .build();

        String id = UUID.randomUUID().toString();
        knowledgeIndex.write(collection, id, prepared, knowledgeIndex.embed(prepared), stored);
        log.info("[Knowledge] Added {} entry {}", collection.getShortName(), id);
        return id;
    }

    // ===== Search =====

    /**
     * Hybrid search over facts, and file chunks when requested. Results are
     * deduplicated by text, filtered by minimum priority and sorted by composite
     * score. Backend failures degrade to fewer or no results.
     */
    public List<SearchResult> searchFacts(FactSearchRequest request) {
        long started = System.nanoTime();
        int topK = request.getTopK() != null && request.getTopK() > 0
                ? request.getTopK()
                : properties.getSearch().getTopK();
        boolean error = false;
        List<SearchResult> candidates = new ArrayList<>();

        try {
            float[] queryVector = knowledgeIndex.embed(request.getQuery());
            VectorFilter filter = VectorFilter.where("status", EntryStatus.ACTIVE)
                    .and("agent_name", request.getAgentName())
                    .and("workspace_id", request.getWorkspaceId());

            List<KnowledgeCollection> collections = request.isIncludeFiles()
                    ? List.of(KnowledgeCollection.FACTS, KnowledgeCollection.FILES)
                    : List.of(KnowledgeCollection.FACTS);
            for (KnowledgeCollection collection : collections) {
                try {
                    candidates.addAll(knowledgeIndex.rankedQuery(collection, request.getQuery(), queryVector,
                            filter, topK));
                } catch (RuntimeException e) {
                    error = true;
                    log.warn("[Knowledge] Search in {} failed: {}", collection.getShortName(), e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            error = true;
            log.warn("[Knowledge] Fact search failed: {}", e.getMessage());
        }

        List<SearchResult> results = searchMerger.merge(candidates, request.getMinPriority(), topK);
        retrievalMetrics.record((System.nanoTime() - started) / 1_000_000.0, results.size(), error);
        return results;
    }

    // ===== File management =====

    public List<FileSummary> listFiles(String workspaceId) {
        List<KnowledgeEntry> chunks;
        try {
            chunks = knowledgeIndex.find(KnowledgeCollection.FILES,
                    VectorFilter.none().and("workspace_id", workspaceId), 0);
        } catch (RuntimeException e) {
            log.warn("[Knowledge] Listing files failed: {}", e.getMessage());
            return List.of();
        }

        Map<String, FileSummary> files = new LinkedHashMap<>();
        for (KnowledgeEntry chunk : chunks) {
            KnowledgeMetadata metadata = chunk.getMetadata();
            String key = metadata.getFileId() != null ? metadata.getFileId() : metadata.getFileName();
            if (key == null) {
                continue;
            }
            FileSummary summary = files.computeIfAbsent(key, k -> FileSummary.builder()
                    .fileId(metadata.getFileId())
                    .fileName(metadata.getFileName())
                    .folder(metadata.getFolder())
                    .workspaceId(metadata.getWorkspaceId())
                    .status(metadata.getStatus())
                    .build());
            summary.setChunks(summary.getChunks() + 1);
            summary.setPinned(summary.isPinned() || Boolean.TRUE.equals(metadata.getPinned()));
            if (metadata.isActive()) {
                summary.setStatus(EntryStatus.ACTIVE);
            }
        }
        return new ArrayList<>(files.values());
    }

    public int softDeleteFile(String fileName) {
        Instant now = clock.instant();
        return rewriteFileChunks(fileName, KnowledgeMetadata::isActive,
                metadata -> metadata.toBuilder().status(EntryStatus.DELETED).deletedAt(now).build(),
                AuditEventType.FILE_SOFT_DELETED, Map.of());
    }

    public int restoreFile(String fileName) {
        return rewriteFileChunks(fileName, metadata -> metadata.getStatus() == EntryStatus.DELETED,
                metadata -> metadata.toBuilder().status(EntryStatus.ACTIVE).deletedAt(null).build(),
                AuditEventType.FILE_RESTORED, Map.of());
    }

    /**
     * Pins or unpins a file. Pinned chunks get the {@code pinned} priority,
     * unpinned ones go back to {@code normal}.
     */
    public int pinFile(String fileName, boolean pinned) {
        return rewriteFileChunks(fileName, metadata -> metadata.getStatus() != EntryStatus.DELETED,
                metadata -> metadata.toBuilder().pinned(pinned).priority(pinned ? "pinned" : "normal").build(),
                pinned ? AuditEventType.FILE_PINNED : AuditEventType.FILE_UNPINNED, Map.of());
    }

    /**
     * Moves a file to a folder; a blank folder moves it to the root.
     */
    public int moveFile(String fileName, String folder) {
        String target = folder != null && !folder.isBlank() ? folder.trim() : null;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("folder", target != null ? target : "");
        return rewriteFileChunks(fileName, metadata -> metadata.getStatus() != EntryStatus.DELETED,
                metadata -> metadata.toBuilder().folder(target).build(),
                AuditEventType.FILE_MOVED, details);
    }

    /**
     * Renames every chunk of a file. A blank new name changes nothing.
     */
    public int renameFile(String oldName, String newName) {
        String target = newName != null ? newName.trim() : "";
        if (target.isEmpty() || oldName == null || oldName.isBlank()) {
            return 0;
        }
        return rewriteFileChunks(oldName, metadata -> true,
                metadata -> metadata.toBuilder().fileName(target).build(),
                AuditEventType.FILE_RENAMED, Map.of("old_name", oldName, "new_name", target));
    }

    /**
     * Permanently removes every chunk of the named file.
     */
    public int deleteFileByName(String fileName) {
        return hardDeleteChunks(VectorFilter.where("file_name", fileName), fileName);
    }

    /**
     * Permanently removes every chunk with the given file id.
     */
    public int deleteFileChunks(String fileId) {
        return hardDeleteChunks(VectorFilter.where("file_id", fileId), fileId);
    }

    private int hardDeleteChunks(VectorFilter filter, String reference) {
        List<String> ids = knowledgeIndex.find(KnowledgeCollection.FILES, filter, 0).stream()
                .map(KnowledgeEntry::getId)
                .toList();
        if (ids.isEmpty()) {
            return 0;
        }
        knowledgeIndex.hardDelete(KnowledgeCollection.FILES, ids);
        auditLogService.record(AuditEventType.FILE_DELETED, null, null, reference,
                Map.of("chunks", ids.size()));
        log.info("[Knowledge] Deleted {} chunks of {}", ids.size(), reference);
        return ids.size();
    }

    private int rewriteFileChunks(String fileName, Predicate<KnowledgeMetadata> applies,
            UnaryOperator<KnowledgeMetadata> rewrite, AuditEventType eventType, Map<String, Object> details) {
        if (fileName == null || fileName.isBlank()) {
            return 0;
        }
        List<KnowledgeEntry> changed = new ArrayList<>();
        for (KnowledgeEntry chunk : knowledgeIndex.find(KnowledgeCollection.FILES,
                VectorFilter.where("file_name", fileName), 0)) {
            if (applies.test(chunk.getMetadata())) {
                chunk.setMetadata(rewrite.apply(chunk.getMetadata()));
                changed.add(chunk);
            }
        }
        if (changed.isEmpty()) {
            return 0;
        }
        knowledgeIndex.updateMetadata(KnowledgeCollection.FILES, changed);

        Map<String, Object> auditDetails = new LinkedHashMap<>(details);
        auditDetails.put("chunks", changed.size());
        auditLogService.record(eventType, null, changed.get(0).getMetadata().getWorkspaceId(), fileName,
                auditDetails);
        log.info("[Knowledge] {}: {} chunks of {}", eventType.getCode(), changed.size(), fileName);
        return changed.size();
    }

    // ===== Stats and diagnostics =====

    /**
     * Record counts per collection. A collection whose count cannot be read is
     * reported as 0.
     */
    public Map<String, Long> getStats() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (KnowledgeCollection collection : KnowledgeCollection.values()) {
            try {
                counts.put(collection.getShortName(), vectorIndex.count(collection.getCollectionName()));
            } catch (RuntimeException e) {
                log.warn("[Knowledge] Count of {} failed: {}", collection.getShortName(), e.getMessage());
                counts.put(collection.getShortName(), 0L);
            }
        }
        return counts;
    }

    public EmbeddingStatus getEmbeddingStatus() {
        return new EmbeddingStatus(embeddingPort.getModel(), embeddingPort.getModelVersion(),
                embeddingPort.getDimension(), embeddingPort.isAvailable(), getStats());
    }

    public List<AuditEvent> listAuditLogs(int topK, String workspaceId, String modelName) {
        return auditLogService.list(topK, workspaceId, modelName);
    }

    public RetrievalMetricsSnapshot getRetrievalMetrics() {
        return retrievalMetrics.snapshot();
    }
}
