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

package me.golemcore.memory.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ranked search hit. {@code score} is the composite rank score, {@code relevance}
 * the blended semantic/keyword relevance it was built from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchResult {

    private String id;
    private String text;
    private double score;
    private double relevance;
    private double semanticScore;
    private double keywordScore;
    private String source;
    private KnowledgeMetadata metadata;
}
