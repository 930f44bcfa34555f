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

package me.golemcore.memory.adapter.outbound.graph;

import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.domain.model.RelationshipEdge;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.domain.service.PayloadMapper;
import me.golemcore.memory.port.outbound.RelationshipStore;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relationship store backed by the relationships collection of the vector
 * index.
 *
 * <p>
 * The index filters are AND-only, so an incident-edge lookup runs two queries
 * (node as source, node as target) and merges them here. A backend with native
 * OR support only needs a different {@link RelationshipStore}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorIndexRelationshipStore implements RelationshipStore {

    private static final String COLLECTION = KnowledgeCollection.RELATIONSHIPS.getCollectionName();

    private final VectorIndexPort vectorIndex;
    private final PayloadMapper payloadMapper;

    @Override
    public void save(RelationshipEdge edge, float[] embedding, String description) {
        vectorIndex.upsert(COLLECTION,
                List.of(new VectorRecord(edge.getId(), embedding, description, payloadMapper.toPayload(edge))));
    }

    @Override
    public Optional<RelationshipEdge> findById(String id) {
        return vectorIndex.get(COLLECTION, List.of(id)).stream()
                .findFirst()
                .map(this::toEdge);
    }

    @Override
    public boolean delete(String id) {
        if (vectorIndex.get(COLLECTION, List.of(id)).isEmpty()) {
            return false;
        }
        vectorIndex.delete(COLLECTION, List.of(id));
        return true;
    }

    @Override
    public List<RelationshipEdge> findAll(String workspaceId, String relationshipType, int limit) {
        VectorFilter filter = VectorFilter.none()
                .and("workspace_id", workspaceId)
                .and("relationship_type", relationshipType);
        return vectorIndex.find(COLLECTION, filter, limit).stream()
                .map(this::toEdge)
                .toList();
    }

    @Override
    public List<RelationshipEdge> findIncident(String nodeId, String relationshipType, int limit) {
        Map<String, RelationshipEdge> merged = new LinkedHashMap<>();
        for (String field : List.of("source_id", "target_id")) {
            VectorFilter filter = VectorFilter.where(field, nodeId).and("relationship_type", relationshipType);
            for (VectorRecord record : vectorIndex.find(COLLECTION, filter, limit)) {
                merged.putIfAbsent(record.id(), toEdge(record));
            }
        }
        List<RelationshipEdge> edges = new ArrayList<>(merged.values());
        log.debug("[Graph] {} incident edges for {}", edges.size(), nodeId);
        return limit > 0 && edges.size() > limit ? new ArrayList<>(edges.subList(0, limit)) : edges;
    }

    private RelationshipEdge toEdge(VectorRecord record) {
        RelationshipEdge edge = payloadMapper.fromPayload(record.payload(), RelationshipEdge.class);
        if (edge.getId() == null) {
            edge.setId(record.id());
        }
        return edge;
    }
}
