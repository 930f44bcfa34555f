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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Directed, typed link between two knowledge graph nodes. Edges are not
 * versioned and deletion is permanent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RelationshipEdge {

    public static final String CONTRADICTS = "contradicts";
    public static final String DEFAULT_NODE_TYPE = "memory";

    private String id;
    private String sourceId;
    private String targetId;
    private String sourceType;
    private String targetType;
    private String relationshipType;
    private String workspaceId;
    private Instant createdAt;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Returns the node on the other side of the edge relative to {@code nodeId}.
     */
    public String otherEnd(String nodeId) {
        return nodeId.equals(sourceId) ? targetId : sourceId;
    }
}
