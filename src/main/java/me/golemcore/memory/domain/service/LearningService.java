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
import me.golemcore.memory.domain.model.Contradiction;
import me.golemcore.memory.domain.model.EntryStatus;
import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.KnowledgeMetadata;
import me.golemcore.memory.domain.model.KnowledgeValidationException;
import me.golemcore.memory.domain.model.LearningSearchRequest;
import me.golemcore.memory.domain.model.LearningStats;
import me.golemcore.memory.domain.model.LearningWriteResult;
import me.golemcore.memory.domain.model.SearchResult;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Versioned per-model learnings.
 *
 * <p>
 * A learning is identified by its key {@code workspace::model::category}. Each
 * write to a key creates a new version and supersedes the previous active one.
 * Superseded entries are kept for history.
 *
 * <p>
 * Writes to one key are serialized by a striped lock inside this process. The
 * new version is written before the old one is marked superseded; should the
 * second step be lost, or should two processes write the same key,
 * {@link #reconcileActiveVersions()} keeps the highest version active and
 * supersedes the rest.
 */
@Service
@Slf4j
public class LearningService {

    public static final String DEFAULT_WORKSPACE = "default";
    public static final String DEFAULT_CATEGORY = "general";
    public static final Set<String> ALLOWED_CATEGORIES = Set.of("general", "preference", "fact", "skill",
            "correction");

    private static final int LOCK_STRIPES = 64;
    private static final KnowledgeCollection LEARNINGS = KnowledgeCollection.LEARNINGS;
    private static final Comparator<KnowledgeEntry> NEWEST_FIRST = Comparator
            .comparing((KnowledgeEntry entry) -> versionOf(entry.getMetadata()))
            .thenComparing(entry -> entry.getMetadata().getCreatedAt(),
                    Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .reversed();

    private final KnowledgeIndex knowledgeIndex;
    private final ContradictionDetector contradictionDetector;
    private final GraphService graphService;
    private final SearchMerger searchMerger;
    private final RetrievalMetrics retrievalMetrics;
    private final AuditLogService auditLogService;
    private final MemoryProperties properties;
    private final Clock clock;
    private final Object[] keyLocks = new Object[LOCK_STRIPES];

    public LearningService(KnowledgeIndex knowledgeIndex, ContradictionDetector contradictionDetector,
            GraphService graphService, SearchMerger searchMerger, RetrievalMetrics retrievalMetrics,
            AuditLogService auditLogService, MemoryProperties properties, Clock clock) {
        this.knowledgeIndex = knowledgeIndex;
        this.contradictionDetector = contradictionDetector;
        this.graphService = graphService;
        this.searchMerger = searchMerger;
        this.retrievalMetrics = retrievalMetrics;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new Object();
        }
    }

    /**
     * Stores a new version of a learning.
     *
     * @return write result; its id is empty when {@code text} is blank
     */
    public LearningWriteResult addLearning(String text, String modelName, String agentName, String category,
            KnowledgeMetadata metadata, String workspaceId) {
        String prepared = knowledgeIndex.prepareText(text);
        if (prepared.isEmpty()) {
            log.debug("[Learning] Skipping blank learning for model {}", modelName);
            return LearningWriteResult.skipped();
        }
        requireModel(modelName);
        String workspace = resolveWorkspace(workspaceId);
        String resolvedCategory = resolveCategory(category);
        String learningKey = learningKey(workspace, modelName, resolvedCategory);
        float[] embedding = knowledgeIndex.embed(prepared);

        synchronized (lockFor(learningKey)) {
            Optional<KnowledgeEntry> current = findActive(learningKey).stream().findFirst();
            String newId = UUID.randomUUID().toString();
            Instant now = clock.instant();

            int version = 1;
            boolean conflict = false;
            String previousId = null;
            if (current.isPresent()) {
                version = versionOf(current.get().getMetadata()) + 1;
                conflict = !KnowledgeText.sameMeaningText(current.get().getText(), prepared);
                previousId = current.get().getId();
            }

            List<Contradiction> contradictions = contradictionDetector.detect(prepared, embedding, modelName,
                    workspace, previousId);

            KnowledgeMetadata base = metadata != null ? metadata : new KnowledgeMetadata();
            KnowledgeMetadata stored = base.toBuilder()
                    .workspaceId(workspace)
                    .agentName(agentName)
                    .modelName(modelName)
                    .category(resolvedCategory)
                    .learningKey(learningKey)
                    .status(EntryStatus.ACTIVE)
                    .version(version)
                    .previousVersionId(previousId)
                    .supersededAt(null)
                    .supersededBy(null)
                    .deletedAt(null)
                    .conflictDetected(conflict)
                    .contradictions(contradictions.isEmpty() ? null : contradictions)
                    .createdAt(now)
                    .createdTs(now.getEpochSecond())
                    .build();
            knowledgeIndex.write(LEARNINGS, newId, prepared, embedding, stored);

            if (current.isPresent()) {
                KnowledgeEntry previous = current.get();
                previous.setMetadata(previous.getMetadata().toBuilder()
                        .status(EntryStatus.SUPERSEDED)
                        .supersededAt(now)
                        .supersededBy(newId)
                        .build());
                knowledgeIndex.updateMetadata(LEARNINGS, List.of(previous));
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("version", version);
            details.put("learning_key", learningKey);
            details.put("conflict_detected", conflict);
            details.put("contradictions", contradictions.size());
            if (previousId != null) {
                details.put("previous_version_id", previousId);
            }
            auditLogService.record(AuditEventType.LEARNING_ADDED, modelName, workspace, newId, details);
            log.info("[Learning] Added {} v{} (conflict={}, contradictions={})", learningKey, version, conflict,
                    contradictions.size());

            linkContradictions(newId, contradictions, workspace);

            return LearningWriteResult.builder()
                    .id(newId)
                    .version(version)
                    .learningKey(learningKey)
                    .conflictDetected(conflict)
                    .previousVersionId(previousId)
                    .contradictions(contradictions)
                    .build();
        }
    }

    /**
     * Hybrid search over active learnings of one model.
     */
    public List<SearchResult> searchLearnings(LearningSearchRequest request) {
        requireModel(request.getModelName());
        long started = System.nanoTime();
        int topK = request.getTopK() != null && request.getTopK() > 0
                ? request.getTopK()
                : properties.getSearch().getTopK();
        boolean error = false;
        List<SearchResult> candidates = new ArrayList<>();

        try {
            float[] queryVector = knowledgeIndex.embed(request.getQuery());
            VectorFilter filter = VectorFilter.where("model_name", request.getModelName())
                    .and("status", EntryStatus.ACTIVE)
                    .and("workspace_id", request.getWorkspaceId())
                    .and("category", request.getCategory());
            candidates.addAll(knowledgeIndex.rankedQuery(LEARNINGS, request.getQuery(), queryVector, filter, topK));
        } catch (RuntimeException e) {
            error = true;
            log.warn("[Learning] Search failed for model {}: {}", request.getModelName(), e.getMessage());
        }

        List<SearchResult> results = searchMerger.merge(candidates, request.getMinPriority(), topK);
        retrievalMetrics.record((System.nanoTime() - started) / 1_000_000.0, results.size(), error);
        return results;
    }

    /**
     * Soft-deletes the active learnings of a model. Entries that are already
     * superseded or deleted are left alone and not counted, so repeating the call
     * returns 0.
     *
     * @return number of entries deleted by this call
     */
    public int deleteModelLearnings(String modelName, String category, String workspaceId) {
        requireModel(modelName);
        VectorFilter filter = VectorFilter.where("model_name", modelName)
                .and("status", EntryStatus.ACTIVE)
                .and("category", category)
                .and("workspace_id", workspaceId);
        Instant now = clock.instant();
        List<KnowledgeEntry> deleted = new ArrayList<>();
        for (KnowledgeEntry entry : knowledgeIndex.find(LEARNINGS, filter, 0)) {
            if (!entry.getMetadata().isActive()) {
                continue;
            }
            entry.setMetadata(entry.getMetadata().toBuilder()
                    .status(EntryStatus.DELETED)
                    .deletedAt(now)
                    .build());
            deleted.add(entry);
        }
        if (deleted.isEmpty()) {
            return 0;
        }
        knowledgeIndex.updateMetadata(LEARNINGS, deleted);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("deleted_count", deleted.size());
        if (category != null) {
            details.put("category", category);
        }
        auditLogService.record(AuditEventType.LEARNINGS_DELETED, modelName, workspaceId, null, details);
        log.info("[Learning] Soft-deleted {} learnings of model {}", deleted.size(), modelName);
        return deleted.size();
    }

    /**
     * Every stored version, newest first, regardless of status.
     */
    public List<KnowledgeEntry> listVersions(String modelName, String category, String workspaceId) {
        requireModel(modelName);
        VectorFilter filter = VectorFilter.where("model_name", modelName)
                .and("category", category)
                .and("workspace_id", workspaceId);
        try {
            List<KnowledgeEntry> versions = new ArrayList<>(knowledgeIndex.find(LEARNINGS, filter, 0));
            versions.sort(NEWEST_FIRST);
            return versions;
        } catch (RuntimeException e) {
            log.warn("[Learning] Listing versions of model {} failed: {}", modelName, e.getMessage());
            return List.of();
        }
    }

    public LearningStats getLearningStats() {
        List<KnowledgeEntry> entries;
        try {
            entries = knowledgeIndex.find(LEARNINGS, VectorFilter.none(), 0);
        } catch (RuntimeException e) {
            log.warn("[Learning] Reading stats failed: {}", e.getMessage());
            return new LearningStats(0, 0, Map.of(), Map.of());
        }
        Map<String, Integer> byModel = new TreeMap<>();
        Map<String, Integer> byCategory = new TreeMap<>();
        int active = 0;
        for (KnowledgeEntry entry : entries) {
            KnowledgeMetadata metadata = entry.getMetadata();
            byModel.merge(metadata.getModelName() != null ? metadata.getModelName() : "unknown", 1, Integer::sum);
            byCategory.merge(metadata.getCategory() != null ? metadata.getCategory() : DEFAULT_CATEGORY, 1,
                    Integer::sum);
            if (metadata.isActive()) {
                active++;
            }
        }
        return new LearningStats(entries.size(), active, byModel, byCategory);
    }

    /**
     * Repairs keys that ended up with more than one active version: the highest
     * version stays active, the others are superseded by it.
     *
     * @return number of entries superseded
     */
    public int reconcileActiveVersions() {
        Map<String, Integer> activePerKey = new LinkedHashMap<>();
        for (KnowledgeEntry entry : knowledgeIndex.find(LEARNINGS, VectorFilter.where("status", EntryStatus.ACTIVE),
                0)) {
            String key = entry.getMetadata().getLearningKey();
            if (key != null) {
                activePerKey.merge(key, 1, Integer::sum);
            }
        }

        int superseded = 0;
        for (Map.Entry<String, Integer> keyCount : activePerKey.entrySet()) {
            if (keyCount.getValue() > 1) {
                superseded += reconcileKey(keyCount.getKey());
            }
        }
        if (superseded > 0) {
            log.info("[Learning] Reconciled {} duplicate active versions", superseded);
        }
        return superseded;
    }

    private int reconcileKey(String learningKey) {
        synchronized (lockFor(learningKey)) {
            List<KnowledgeEntry> active = findActive(learningKey);
            if (active.size() < 2) {
                return 0;
            }
            KnowledgeEntry keep = active.get(0);
            Instant now = clock.instant();
            List<KnowledgeEntry> stale = new ArrayList<>();
            for (KnowledgeEntry entry : active.subList(1, active.size())) {
                entry.setMetadata(entry.getMetadata().toBuilder()
                        .status(EntryStatus.SUPERSEDED)
                        .supersededAt(now)
                        .supersededBy(keep.getId())
                        .build());
                stale.add(entry);
            }
            knowledgeIndex.updateMetadata(LEARNINGS, stale);

            KnowledgeMetadata kept = keep.getMetadata();
            auditLogService.record(AuditEventType.VERSIONS_RECONCILED, kept.getModelName(), kept.getWorkspaceId(),
                    keep.getId(), Map.of("learning_key", learningKey, "superseded", stale.size()));
            log.warn("[Learning] Key {} had {} active versions, kept v{}", learningKey, active.size(),
                    versionOf(kept));
            return stale.size();
        }
    }

    /**
     * Active entries of a key, highest version first.
     */
    private List<KnowledgeEntry> findActive(String learningKey) {
        List<KnowledgeEntry> active = new ArrayList<>(knowledgeIndex.find(LEARNINGS,
                VectorFilter.where("learning_key", learningKey).and("status", EntryStatus.ACTIVE), 0));
        active.sort(NEWEST_FIRST);
        return active;
    }

    private void linkContradictions(String newId, List<Contradiction> contradictions, String workspace) {
        if (contradictions.isEmpty() || !properties.getContradiction().isLinkInGraph()) {
            return;
        }
        for (Contradiction contradiction : contradictions) {
            try {
                graphService.createContradictionRelationship(newId, contradiction.getId(),
                        contradiction.getSimilarity(), workspace);
            } catch (RuntimeException e) {
                log.warn("[Learning] Failed to link contradiction {} -> {}: {}", newId, contradiction.getId(),
                        e.getMessage());
            }
        }
    }

    /**
     * Every learning operation is scoped to one model.
     */
    private static void requireModel(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            throw new KnowledgeValidationException(KnowledgeValidationException.ValidationError.INVALID_METADATA,
                    "model name is required");
        }
    }

    static String learningKey(String workspace, String modelName, String category) {
        return workspace + "::" + modelName + "::" + category;
    }

    static String resolveWorkspace(String workspaceId) {
        return workspaceId != null && !workspaceId.isBlank() ? workspaceId.trim() : DEFAULT_WORKSPACE;
    }

    static String resolveCategory(String category) {
        if (category == null || category.isBlank()) {
            return DEFAULT_CATEGORY;
        }
        String normalized = category.trim().toLowerCase(Locale.ROOT);
        if (!ALLOWED_CATEGORIES.contains(normalized)) {
            log.warn("[Learning] Unknown category '{}', using '{}'", category, DEFAULT_CATEGORY);
            return DEFAULT_CATEGORY;
        }
        return normalized;
    }

    private static int versionOf(KnowledgeMetadata metadata) {
        return metadata.getVersion() != null ? metadata.getVersion() : 1;
    }

    private Object lockFor(String learningKey) {
        return keyLocks[Math.floorMod(learningKey.hashCode(), LOCK_STRIPES)];
    }
}
