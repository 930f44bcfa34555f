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

import me.golemcore.memory.domain.model.EntryStatus;
import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.domain.model.KnowledgeValidationException;
import me.golemcore.memory.domain.model.ScoredSkill;
import me.golemcore.memory.domain.model.SkillDraft;
import me.golemcore.memory.domain.model.SkillEntry;
import me.golemcore.memory.domain.model.SkillPatch;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorHit;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Skill engine: versioned, confidence-scored procedural knowledge with semantic
 * search.
 *
 * <p>
 * Lifecycle: create, search, apply ({@link #recordUsage}), update (new version,
 * old one superseded), delete (soft). Each use reinforces confidence by
 * {@code c + (1 - c) * rate}, which grows fast for weak skills and flattens out
 * towards 1.0.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SkillService {

    private static final String COLLECTION = KnowledgeCollection.SKILLS.getCollectionName();

    private final VectorIndexPort vectorIndex;
    private final KnowledgeIndex knowledgeIndex;
    private final PayloadMapper payloadMapper;
    private final SkillDialogExtractor dialogExtractor;
    private final MemoryProperties properties;
    private final Clock clock;

    public SkillEntry createSkill(SkillDraft draft) {
        String goal = draft.getGoal() != null ? draft.getGoal().strip() : "";
        if (goal.isEmpty()) {
            throw new KnowledgeValidationException(KnowledgeValidationException.ValidationError.BLANK_GOAL,
                    "Skill goal must not be blank");
        }
        Instant now = clock.instant();
        String id = newSkillId();
        double confidence = draft.getConfidence() != null
                ? clampConfidence(draft.getConfidence())
                : properties.getSkills().getDefaultConfidence();

        SkillEntry skill = SkillEntry.builder()
                .id(id)
                .canonicalId(id)
                .goal(goal)
                .steps(copy(draft.getSteps()))
                .examples(copy(draft.getExamples()))
                .constraints(copy(draft.getConstraints()))
                .sources(copy(draft.getSources()))
                .tags(copy(draft.getTags()))
                .confidence(confidence)
                .version(1)
                .status(EntryStatus.ACTIVE)
                .modelName(draft.getModelName())
                .workspaceId(draft.getWorkspaceId())
                .usageCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        store(skill, true);
        log.info("[Skills] Created skill {} ({}), confidence {}", id, truncate(goal), confidence);
        return skill;
    }

    public SkillEntry createFromDialog(String dialogText, String modelName, String workspaceId) {
        return createSkill(dialogExtractor.extract(dialogText, modelName, workspaceId));
    }

    public Optional<SkillEntry> getSkill(String id) {
        return vectorIndex.get(COLLECTION, List.of(id)).stream()
                .findFirst()
                .map(this::toSkill);
    }

    public List<SkillEntry> listSkills(String workspaceId, EntryStatus status) {
        VectorFilter filter = VectorFilter.where("status", status != null ? status : EntryStatus.ACTIVE)
                .and("workspace_id", workspaceId);
        try {
            return vectorIndex.find(COLLECTION, filter, 0).stream()
                    .map(this::toSkill)
                    .toList();
        } catch (RuntimeException e) {
            log.warn("[Skills] Listing skills failed: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Writes a new version of a skill. Fields left null in the patch keep their
     * current values; the canonical id and usage count carry over.
     *
     * <p>
     * Only the active version can be updated, so a canonical id keeps a single
     * active version.
     *
     * @return the new version, or empty when the skill does not exist or is not
     *         active
     */
    public synchronized Optional<SkillEntry> updateSkill(String id, SkillPatch patch) {
        Optional<SkillEntry> found = getSkill(id);
        if (found.isEmpty() || found.get().getStatus() != EntryStatus.ACTIVE) {
            log.debug("[Skills] Update rejected for {}: not an active version", id);
            return Optional.empty();
        }
        SkillEntry current = found.get();
        Instant now = clock.instant();

        SkillEntry next = current.toBuilder()
                .id(newSkillId())
                .goal(patch.getGoal() != null && !patch.getGoal().isBlank() ? patch.getGoal().strip()
                        : current.getGoal())
                .steps(patch.getSteps() != null ? copy(patch.getSteps()) : current.getSteps())
                .examples(patch.getExamples() != null ? copy(patch.getExamples()) : current.getExamples())
                .constraints(patch.getConstraints() != null ? copy(patch.getConstraints()) : current.getConstraints())
                .sources(patch.getSources() != null ? copy(patch.getSources()) : current.getSources())
                .tags(patch.getTags() != null ? copy(patch.getTags()) : current.getTags())
                .confidence(patch.getConfidence() != null ? clampConfidence(patch.getConfidence())
                        : current.getConfidence())
                .version(current.getVersion() + 1)
                .status(EntryStatus.ACTIVE)
                .previousVersionId(current.getId())
                .updatedAt(now)
                .supersededAt(null)
                .build();
        store(next, true);

        current.setStatus(EntryStatus.SUPERSEDED);
        current.setSupersededAt(now);
        current.setUpdatedAt(now);
        store(current, false);

        log.info("[Skills] Updated skill {} -> {}, v{} -> v{}", current.getId(), next.getId(), current.getVersion(),
                next.getVersion());
        return Optional.of(next);
    }

    /**
     * Soft delete.
     *
     * @return false when the skill does not exist or is already deleted
     */
    public synchronized boolean deleteSkill(String id) {
        Optional<SkillEntry> found = getSkill(id);
        if (found.isEmpty() || found.get().getStatus() == EntryStatus.DELETED) {
            return false;
        }
        SkillEntry skill = found.get();
        Instant now = clock.instant();
        skill.setStatus(EntryStatus.DELETED);
        skill.setDeletedAt(now);
        skill.setUpdatedAt(now);
        store(skill, false);
        log.info("[Skills] Deleted skill {}", id);
        return true;
    }

    /**
     * Semantic search over active skills. Hits below the minimum confidence are
     * dropped.
     */
    public List<ScoredSkill> searchSkills(String query, Integer topK, Double minConfidence, String workspaceId) {
        MemoryProperties.SkillsProperties config = properties.getSkills();
        int limit = topK != null && topK > 0 ? topK : config.getSearchTopK();
        double threshold = minConfidence != null ? minConfidence : config.getMinConfidence();
        VectorFilter filter = VectorFilter.where("status", EntryStatus.ACTIVE).and("workspace_id", workspaceId);

        try {
            List<VectorHit> hits = vectorIndex.query(COLLECTION, knowledgeIndex.embed(query), filter, limit);
            List<ScoredSkill> results = new ArrayList<>();
            for (VectorHit hit : hits) {
                SkillEntry skill = toSkill(hit.record());
                if (skill.getConfidence() < threshold) {
                    continue;
                }
                results.add(new ScoredSkill(skill, RankingService.round(hit.similarity())));
            }
            return results;
        } catch (RuntimeException e) {
            log.warn("[Skills] Search failed: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Counts a successful use of an active skill and reinforces its confidence.
     *
     * @return false unless the skill exists and is active
     */
    public synchronized boolean recordUsage(String id) {
        Optional<SkillEntry> found = getSkill(id);
        if (found.isEmpty() || found.get().getStatus() != EntryStatus.ACTIVE) {
            return false;
        }
        SkillEntry skill = found.get();
        double boostRate = Math.max(0.0, Math.min(1.0, properties.getSkills().getConfidenceBoostRate()));
        double confidence = skill.getConfidence();
        double boosted = RankingService.round(confidence + (1.0 - confidence) * boostRate);

        Instant now = clock.instant();
        skill.setUsageCount(skill.getUsageCount() + 1);
        skill.setConfidence(Math.min(1.0, Math.max(confidence, boosted)));
        skill.setLastUsedAt(now);
        skill.setUpdatedAt(now);
        store(skill, false);
        log.info("[Skills] Skill {} used: usage={}, confidence={}", id, skill.getUsageCount(),
                skill.getConfidence());
        return true;
    }

    /**
     * Text embedded for a skill: goal plus steps, examples and constraints.
     */
    static String buildDocument(SkillEntry skill) {
        List<String> parts = new ArrayList<>();
        parts.add(skill.getGoal());
        if (!skill.getSteps().isEmpty()) {
            parts.add("Steps: " + String.join("; ", skill.getSteps()));
        }
        if (!skill.getExamples().isEmpty()) {
            parts.add("Examples: " + String.join("; ", skill.getExamples()));
        }
        if (!skill.getConstraints().isEmpty()) {
            parts.add("Constraints: " + String.join("; ", skill.getConstraints()));
        }
        return String.join(" | ", parts);
    }

    private void store(SkillEntry skill, boolean embed) {
        String document = buildDocument(skill);
        if (embed) {
            vectorIndex.upsert(COLLECTION, List.of(new VectorRecord(skill.getId(), knowledgeIndex.embed(document),
                    document, payloadMapper.toPayload(skill))));
        } else {
            vectorIndex.updatePayloads(COLLECTION,
                    Map.of(skill.getId(), payloadMapper.toPayload(skill)));
        }
    }

    private SkillEntry toSkill(VectorRecord record) {
        SkillEntry skill = payloadMapper.fromPayload(record.payload(), SkillEntry.class);
        if (skill.getId() == null) {
            skill.setId(record.id());
        }
        if (skill.getStatus() == null) {
            skill.setStatus(EntryStatus.ACTIVE);
        }
        return skill;
    }

    private static String newSkillId() {
        return "skill-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private static String truncate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80);
    }
}
