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

import me.golemcore.memory.domain.model.Contradiction;
import me.golemcore.memory.domain.model.EntryStatus;
import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorHit;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds active learnings that are semantically close to a new learning but say
 * something different.
 *
 * <p>
 * Detection is best effort: backend errors are logged and reported as "no
 * contradictions", never propagated to the write that triggered them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContradictionDetector {

    private static final String COLLECTION = KnowledgeCollection.LEARNINGS.getCollectionName();

    private final VectorIndexPort vectorIndex;
    private final MemoryProperties properties;

    /**
     * @param text
     *            new learning text
     * @param embedding
     *            embedding of {@code text}
     * @param modelName
     *            owning model
     * @param workspaceId
     *            owning workspace
     * @param excludeId
     *            id of the version being superseded, or {@code null}
     */
    public List<Contradiction> detect(String text, float[] embedding, String modelName, String workspaceId,
            String excludeId) {
        try {
            if (vectorIndex.count(COLLECTION) == 0) {
                return List.of();
            }
            MemoryProperties.ContradictionProperties config = properties.getContradiction();
            VectorFilter filter = VectorFilter.where("model_name", modelName)
                    .and("workspace_id", workspaceId)
                    .and("status", EntryStatus.ACTIVE);
            List<VectorHit> hits = vectorIndex.query(COLLECTION, embedding, filter, config.getCandidateCount());

            List<Contradiction> contradictions = new ArrayList<>();
            for (VectorHit hit : hits) {
                String candidateId = hit.record().id();
                if (candidateId.equals(excludeId)) {
                    continue;
                }
                Object status = hit.record().payload().get("status");
                if (EntryStatus.fromCode(status != null ? status.toString() : null) != EntryStatus.ACTIVE) {
                    continue;
                }
                double similarity = 1.0 - hit.distance();
                if (similarity < config.getSimilarityThreshold()) {
                    continue;
                }
                if (KnowledgeText.sameMeaningText(hit.record().document(), text)) {
                    continue;
                }
                Object learningKey = hit.record().payload().get("learning_key");
                contradictions.add(Contradiction.builder()
                        .id(candidateId)
                        .text(hit.record().document())
                        .similarity(RankingService.round(similarity))
                        .learningKey(learningKey != null ? learningKey.toString() : null)
                        .build());
            }
            if (!contradictions.isEmpty()) {
                log.info("[Contradiction] {} contradiction(s) for model {} in workspace {}",
                        contradictions.size(), modelName, workspaceId);
            }
            return contradictions;
        } catch (RuntimeException e) {
            log.warn("[Contradiction] Detection failed, continuing without: {}", e.getMessage());
            return List.of();
        }
    }
}
