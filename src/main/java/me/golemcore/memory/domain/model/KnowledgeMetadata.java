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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed metadata stored next to every knowledge entry.
 *
 * <p>
 * Fields are serialized in snake_case and become the filterable payload of the
 * vector index record. Caller-supplied attributes that have no dedicated field
 * go to {@link #extensions}, which is bounded and accepts scalar values only
 * (see {@link #validate()}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KnowledgeMetadata {

    public static final int MAX_EXTENSIONS = 32;
    public static final int MAX_EXTENSION_KEY_LENGTH = 64;

    private String workspaceId;
    private String agentName;
    private String modelName;
    private String category;
    private EntryStatus status;
    private Integer version;
    private String learningKey;
    private String priority;

    private Double importance;
    private Double reliability;
    private Double frequency;

    private Instant createdAt;
    private Long createdTs;

    private Instant supersededAt;
    private String supersededBy;
    private String previousVersionId;
    private Instant deletedAt;

    private Boolean conflictDetected;
    private List<Contradiction> contradictions;

    private String fileName;
    private String fileId;
    private Integer chunkIndex;
    private Boolean pinned;
    private String folder;
    private String source;

    @Builder.Default
    private Map<String, Object> extensions = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isActive() {
        return status == null || status == EntryStatus.ACTIVE;
    }

    public List<Contradiction> contradictionsOrEmpty() {
        return contradictions != null ? contradictions : new ArrayList<>();
    }

    /**
     * Checks value ranges and the extension map bounds.
     *
     * @throws KnowledgeValidationException
     *             when a field is out of range or an extension is not a scalar
     */
    public void validate() {
        checkUnitRange("importance", importance);
        checkUnitRange("reliability", reliability);
        checkUnitRange("frequency", frequency);
        if (version != null && version < 1) {
            throw new KnowledgeValidationException(KnowledgeValidationException.ValidationError.INVALID_METADATA,
                    "version must be >= 1");
        }
        if (extensions == null) {
            return;
        }
        if (extensions.size() > MAX_EXTENSIONS) {
            throw new KnowledgeValidationException(KnowledgeValidationException.ValidationError.INVALID_METADATA,
                    "too many metadata extensions: " + extensions.size() + " (max " + MAX_EXTENSIONS + ")");
        }
        for (Map.Entry<String, Object> entry : extensions.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank() || key.length() > MAX_EXTENSION_KEY_LENGTH) {
                throw new KnowledgeValidationException(
                        KnowledgeValidationException.ValidationError.INVALID_METADATA,
                        "invalid metadata extension key: " + key);
            }
            Object value = entry.getValue();
            if (value != null && !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new KnowledgeValidationException(
                        KnowledgeValidationException.ValidationError.INVALID_METADATA,
                        "metadata extension '" + key + "' must be a scalar value");
            }
        }
    }

    private static void checkUnitRange(String name, Double value) {
        if (value == null) {
            return;
        }
        if (value.isNaN() || value < 0.0 || value > 1.0) {
            throw new KnowledgeValidationException(KnowledgeValidationException.ValidationError.INVALID_METADATA,
                    name + " must be within [0, 1]");
        }
    }
}
