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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Versioned procedural knowledge: a goal with ordered steps, examples and
 * constraints.
 *
 * <p>
 * Every version is a separate record. {@code canonicalId} is shared by all
 * versions of one skill, {@code id} identifies a single version.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SkillEntry {

    private String id;
    private String canonicalId;
    private String goal;

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    @Builder.Default
    private List<String> examples = new ArrayList<>();

    @Builder.Default
    private List<String> constraints = new ArrayList<>();

    @Builder.Default
    private List<String> sources = new ArrayList<>();

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private double confidence;
    private int version;
    private EntryStatus status;
    private String modelName;
    private String workspaceId;
    private int usageCount;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUsedAt;
    private Instant supersededAt;
    private Instant deletedAt;
    private String previousVersionId;
}
