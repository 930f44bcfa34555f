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

import me.golemcore.memory.domain.model.SearchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges per-collection candidates into the final result list.
 */
@Component
@RequiredArgsConstructor
public class SearchMerger {

    private final RankingService rankingService;

    /**
     * Sorts by composite score, keeps the best-scored hit per text, applies the
     * minimum priority cutoff and truncates to {@code topK}.
     */
    public List<SearchResult> merge(List<SearchResult> candidates, String minPriority, int topK) {
        List<SearchResult> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(SearchResult::getScore).reversed());

        Set<String> seenTexts = new HashSet<>();
        List<SearchResult> results = new ArrayList<>();
        for (SearchResult candidate : sorted) {
            if (!seenTexts.add(candidate.getText())) {
                continue;
            }
            String priority = candidate.getMetadata() != null ? candidate.getMetadata().getPriority() : null;
            if (!rankingService.meetsMinPriority(priority, minPriority)) {
                continue;
            }
            results.add(candidate);
            if (results.size() >= topK) {
                break;
            }
        }
        return results;
    }
}
