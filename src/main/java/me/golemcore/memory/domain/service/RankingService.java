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

import me.golemcore.memory.domain.model.KnowledgeMetadata;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw similarity plus entry metadata into a single composite score.
 *
 * <p>
 * Composite score:
 *
 * <pre>
 * relevance * w_rel + importance * w_imp + reliability * w_rely
 *     + recency * w_rec + frequency * w_freq + priority * w_prio
 * </pre>
 *
 * Missing scalars count as a neutral 0.5. Negative weights are treated as 0,
 * which keeps the score non-decreasing in every factor. Results are clamped to
 * [0, 1] and rounded to four decimals.
 */
@Service
@RequiredArgsConstructor
public class RankingService {

    static final double NEUTRAL = 0.5;

    private static final Map<String, Double> PRIORITY_SCORES = new LinkedHashMap<>();

    static {
        PRIORITY_SCORES.put("critical", 1.0);
        PRIORITY_SCORES.put("pinned", 0.9);
        PRIORITY_SCORES.put("reinforced", 0.75);
        PRIORITY_SCORES.put("normal", 0.5);
        PRIORITY_SCORES.put("archived", 0.1);
    }

    private final MemoryProperties properties;
    private final Clock clock;

    /**
     * Weighted average of semantic and keyword relevance. Falls back to the
     * semantic score when both weights are zero.
     */
    public double blendRelevance(double semantic, double keyword) {
        double semanticWeight = Math.max(0.0, properties.getSearch().getSemanticWeight());
        double keywordWeight = Math.max(0.0, properties.getSearch().getKeywordWeight());
        double s = clamp(semantic);
        double k = clamp(keyword);
        double total = semanticWeight + keywordWeight;
        if (total <= 0.0) {
            return round(s);
        }
        return round(clamp((s * semanticWeight + k * keywordWeight) / total));
    }

    /**
     * Score of a priority tag. Lookup is case-insensitive and trimmed; unknown or
     * missing tags score as {@code normal}.
     */
    public double resolvePriorityScore(String priority) {
        if (priority == null) {
            return PRIORITY_SCORES.get("normal");
        }
        Double score = PRIORITY_SCORES.get(priority.trim().toLowerCase(Locale.ROOT));
        return score != null ? score : PRIORITY_SCORES.get("normal");
    }

    /**
     * Hard priority cutoff used by searches. A blank {@code minPriority} admits
     * everything.
     */
    public boolean meetsMinPriority(String priority, String minPriority) {
        if (minPriority == null || minPriority.isBlank()) {
            return true;
        }
        return resolvePriorityScore(priority) >= resolvePriorityScore(minPriority);
    }

    public double buildRankScore(double relevance, KnowledgeMetadata metadata) {
        if (metadata == null) {
            return rankScore(relevance, null, null, NEUTRAL, null, null);
        }
        return rankScore(relevance, metadata.getImportance(), metadata.getReliability(), recency(metadata),
                metadata.getFrequency(), metadata.getPriority());
    }

    /**
     * Composite score from explicit factors. {@code null} scalars are neutral.
     */
    public double rankScore(double relevance, Double importance, Double reliability, double recency,
            Double frequency, String priority) {
        MemoryProperties.RankingProperties weights = properties.getRanking();
        double score = clamp(relevance) * weight(weights.getRelevanceWeight())
                + scalar(importance) * weight(weights.getImportanceWeight())
                + scalar(reliability) * weight(weights.getReliabilityWeight())
                + clamp(recency) * weight(weights.getRecencyWeight())
                + scalar(frequency) * weight(weights.getFrequencyWeight())
                + resolvePriorityScore(priority) * weight(weights.getPriorityWeight());
        return round(clamp(score));
    }

    /**
     * Linear decay over the configured window: 1.0 for a fresh entry, 0.0 once it
     * is {@code recency-window-days} old. Unknown age is neutral.
     */
    public double recency(KnowledgeMetadata metadata) {
        Instant createdAt = metadata.getCreatedAt();
        if (createdAt == null && metadata.getCreatedTs() != null) {
            createdAt = Instant.ofEpochSecond(metadata.getCreatedTs());
        }
        int windowDays = properties.getRanking().getRecencyWindowDays();
        if (createdAt == null || windowDays <= 0) {
            return NEUTRAL;
        }
        double ageDays = Duration.between(createdAt, clock.instant()).toMillis() / 86_400_000.0;
        return clamp(1.0 - ageDays / windowDays);
    }

    /**
     * Fraction of whitespace-separated query tokens found as substrings of the
     * text, case-insensitive.
     */
    public double keywordOverlap(String query, String text) {
        if (query == null || text == null || query.isBlank() || text.isBlank()) {
            return 0.0;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        String[] tokens = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
        int matched = 0;
        for (String token : tokens) {
            if (haystack.contains(token)) {
                matched++;
            }
        }
        return round((double) matched / tokens.length);
    }

    static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    private static double scalar(Double value) {
        if (value == null || value.isNaN()) {
            return NEUTRAL;
        }
        return clamp(value);
    }

    private static double weight(double configured) {
        return Math.max(0.0, configured);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
