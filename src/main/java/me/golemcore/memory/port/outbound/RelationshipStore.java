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

package me.golemcore.memory.port.outbound;

import me.golemcore.memory.domain.model.RelationshipEdge;

import java.util.List;
import java.util.Optional;

/**
 * Storage for knowledge graph edges.
 */
public interface RelationshipStore {

    void save(RelationshipEdge edge, float[] embedding, String description);

    Optional<RelationshipEdge> findById(String id);

    boolean delete(String id);

    /**
     * All edges, optionally narrowed by workspace and relationship type.
     */
    List<RelationshipEdge> findAll(String workspaceId, String relationshipType, int limit);

    /**
     * Edges where {@code nodeId} is either source or target, deduplicated by edge
     * id.
     *
     * @param relationshipType
     *            optional type filter, {@code null} for any
     * @param limit
     *            cap on the merged result
     */
    List<RelationshipEdge> findIncident(String nodeId, String relationshipType, int limit);
}
