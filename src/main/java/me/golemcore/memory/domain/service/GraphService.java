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

import me.golemcore.memory.domain.model.KnowledgeValidationException;
import me.golemcore.memory.domain.model.RelationshipEdge;
import me.golemcore.memory.domain.model.TraversalNode;
import me.golemcore.memory.domain.model.TraversalResult;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.RelationshipStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Typed knowledge graph over memory entries.
 *
 * <p>
 * Edges are directed and carry one type from {@code memory.graph.relationship-types}.
 * Neighbor lookup treats edges as undirected. Traversal is breadth-first and
 * bounded by depth and node count, so it terminates on cyclic graphs and visits
 * every node at most once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphService {

    private final RelationshipStore relationshipStore;
    private final KnowledgeIndex knowledgeIndex;
    private final MemoryProperties properties;
    private final Clock clock;

    /**
     * Creates a directed edge.
     *
     * @throws KnowledgeValidationException
     *             for a type outside the configured set, a self-loop, blank node
     *             ids or non-scalar metadata
     */
    public RelationshipEdge createRelationship(String sourceId, String targetId, String relationshipType,
            String sourceType, String targetType, Map<String, Object> metadata, String workspaceId) {
        String type = relationshipType != null ? relationshipType.trim().toLowerCase(Locale.ROOT) : "";
        if (!properties.getGraph().getRelationshipTypes().contains(type)) {
            throw new KnowledgeValidationException(
                    KnowledgeValidationException.ValidationError.INVALID_RELATIONSHIP_TYPE,
                    "Unsupported relationship type: " + relationshipType);
        }
        if (sourceId == null || sourceId.isBlank() || targetId == null || targetId.isBlank()) {
            throw new KnowledgeValidationException(KnowledgeValidationException.ValidationError.INVALID_METADATA,
                    "source and target ids are required");
        }
        if (sourceId.equals(targetId)) {
            throw new KnowledgeValidationException(KnowledgeValidationException.ValidationError.SELF_LOOP,
                    "Relationship source and target must differ: " + sourceId);
        }
        Map<String, Object> edgeMetadata = validatedMetadata(metadata);

        String srcType = blankToDefault(sourceType);
        String tgtType = blankToDefault(targetType);
        RelationshipEdge edge = RelationshipEdge.builder()
                .id(UUID.randomUUID().toString())
                .sourceId(sourceId)
                .targetId(targetId)
                .sourceType(srcType)
                .targetType(tgtType)
                .relationshipType(type)
                .workspaceId(workspaceId)
                .createdAt(clock.instant())
                .metadata(edgeMetadata)
                .build();

        String description = srcType + ":" + sourceId + " " + type + " " + tgtType + ":" + targetId;
        relationshipStore.save(edge, knowledgeIndex.embed(description), description);
        log.info("[Graph] Created {} edge {} -> {} ({})", type, sourceId, targetId, edge.getId());
        return edge;
    }

    /**
     * Records that a new learning contradicts an existing one.
     */
    public RelationshipEdge createContradictionRelationship(String newId, String existingId, double similarity,
            String workspaceId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("similarity", similarity);
        return createRelationship(newId, existingId, RelationshipEdge.CONTRADICTS, "learning", "learning", metadata,
                workspaceId);
    }

    /**
     * Edges incident to {@code nodeId} in either direction.
     *
     * @param relationshipType
     *            optional type filter
     * @param maxResults
     *            cap, or {@code null} for {@code memory.graph.max-neighbors}
     */
    public List<RelationshipEdge> getNeighbors(String nodeId, String relationshipType, Integer maxResults) {
        int limit = maxResults != null && maxResults > 0 ? maxResults : properties.getGraph().getMaxNeighbors();
        try {
            return relationshipStore.findIncident(nodeId, relationshipType, limit);
        } catch (RuntimeException e) {
            log.warn("[Graph] Neighbor lookup for {} failed: {}", nodeId, e.getMessage());
            return List.of();
        }
    }

    /**
     * Breadth-first traversal from {@code startNode}.
     *
     * @param maxDepth
     *            requested depth, capped by {@code memory.graph.max-depth}
     * @param relationshipTypes
     *            edge types to follow, empty or {@code null} for all
     * @param maxNodes
     *            cap on discovered nodes, {@code null} for
     *            {@code memory.graph.max-nodes}
     */
    public TraversalResult traverse(String startNode, Integer maxDepth, List<String> relationshipTypes,
            Integer maxNodes) {
        MemoryProperties.GraphProperties graph = properties.getGraph();
        int depthLimit = maxDepth != null ? Math.min(maxDepth, graph.getMaxDepth()) : graph.getMaxDepth();
        int nodeLimit = maxNodes != null && maxNodes > 0 ? maxNodes : graph.getMaxNodes();
        List<String> types = relationshipTypes != null ? relationshipTypes : List.of();

        Deque<QueuedNode> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        Set<String> edgeIds = new HashSet<>();
        List<TraversalNode> nodes = new ArrayList<>();
        int maxDepthReached = 0;

        queue.add(new QueuedNode(startNode, 0));
        visited.add(startNode);

        while (!queue.isEmpty()) {
            QueuedNode current = queue.poll();
            if (current.depth() > depthLimit) {
                continue;
            }

            List<RelationshipEdge> neighbors = neighborsForTraversal(current.nodeId(), types);
            nodes.add(new TraversalNode(current.nodeId(), current.depth(), neighbors));
            neighbors.forEach(edge -> edgeIds.add(edge.getId()));
            maxDepthReached = Math.max(maxDepthReached, current.depth());

            if (current.depth() < depthLimit) {
                for (RelationshipEdge edge : neighbors) {
                    String next = edge.otherEnd(current.nodeId());
                    if (!visited.contains(next) && nodes.size() + queue.size() < nodeLimit) {
                        visited.add(next);
                        queue.add(new QueuedNode(next, current.depth() + 1));
                    }
                }
            }
        }

        log.debug("[Graph] Traversal from {} visited {} nodes, {} edges", startNode, nodes.size(), edgeIds.size());
        return new TraversalResult(startNode, nodes, edgeIds.size(), maxDepthReached);
    }

    public Optional<RelationshipEdge> getRelationship(String id) {
        try {
            return relationshipStore.findById(id);
        } catch (RuntimeException e) {
            log.warn("[Graph] Lookup of {} failed: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Permanently removes an edge.
     *
     * @return false when no such edge exists
     */
    public boolean deleteRelationship(String id) {
        boolean deleted = relationshipStore.delete(id);
        if (deleted) {
            log.info("[Graph] Deleted edge {}", id);
        }
        return deleted;
    }

    public List<RelationshipEdge> listRelationships(String workspaceId, String relationshipType) {
        try {
            return relationshipStore.findAll(workspaceId, relationshipType, 0);
        } catch (RuntimeException e) {
            log.warn("[Graph] Listing relationships failed: {}", e.getMessage());
            return List.of();
        }
    }

    private List<RelationshipEdge> neighborsForTraversal(String nodeId, List<String> types) {
        if (types.size() == 1) {
            return getNeighbors(nodeId, types.get(0), null);
        }
        List<RelationshipEdge> neighbors = getNeighbors(nodeId, null, null);
        if (types.isEmpty()) {
            return neighbors;
        }
        return neighbors.stream()
                .filter(edge -> types.contains(edge.getRelationshipType()))
                .toList();
    }

    private static Map<String, Object> validatedMetadata(Map<String, Object> metadata) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (metadata == null) {
            return result;
        }
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            Object value = entry.getValue();
            if (value != null && !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new KnowledgeValidationException(
                        KnowledgeValidationException.ValidationError.INVALID_METADATA,
                        "relationship metadata '" + entry.getKey() + "' must be a scalar value");
            }
            result.put(entry.getKey(), value);
        }
        return result;
    }

    private static String blankToDefault(String nodeType) {
        return nodeType != null && !nodeType.isBlank() ? nodeType.trim() : RelationshipEdge.DEFAULT_NODE_TYPE;
    }

    private record QueuedNode(String nodeId, int depth) {
    }
}
