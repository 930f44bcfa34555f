package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.KnowledgeValidationException;
import me.golemcore.memory.domain.model.KnowledgeValidationException.ValidationError;
import me.golemcore.memory.domain.model.RelationshipEdge;
import me.golemcore.memory.domain.model.TraversalNode;
import me.golemcore.memory.domain.model.TraversalResult;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.RelationshipStore;
import me.golemcore.memory.testsupport.MemoryTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GraphServiceTest {

    private static final String RELATES_TO = "relates_to";
    private static final String DEPENDS_ON = "depends_on";
    private static final String WORKSPACE = "default";

    private MemoryTestContext context;
    private GraphService graphService;

    @BeforeEach
    void setUp() {
        context = new MemoryTestContext();
        graphService = context.graphService;
    }

    // ===== Edge creation =====

    @Test
    void shouldCreateEdgeWithDefaultsAndNormalizedType() {
        RelationshipEdge edge = graphService.createRelationship("A", "B", " Relates_To ", null, "fact",
                Map.of("weight", 0.7), WORKSPACE);

        assertNotNull(edge.getId());
        assertEquals(RELATES_TO, edge.getRelationshipType());
        assertEquals("memory", edge.getSourceType());
        assertEquals("fact", edge.getTargetType());
        assertEquals(MemoryTestContext.NOW, edge.getCreatedAt());

        RelationshipEdge stored = graphService.getRelationship(edge.getId()).orElseThrow();
        assertEquals("A", stored.getSourceId());
        assertEquals("B", stored.getTargetId());
        assertEquals(0.7, ((Number) stored.getMetadata().get("weight")).doubleValue(), 1e-9);
    }

    @Test
    void shouldRejectSelfLoop() {
        KnowledgeValidationException ex = assertThrows(KnowledgeValidationException.class,
                () -> graphService.createRelationship("A", "A", RELATES_TO, null, null, null, WORKSPACE));

        assertEquals(ValidationError.SELF_LOOP, ex.getError());
        assertTrue(graphService.listRelationships(null, null).isEmpty());
    }

    @Test
    void shouldRejectUnknownRelationshipType() {
        KnowledgeValidationException ex = assertThrows(KnowledgeValidationException.class,
                () -> graphService.createRelationship("A", "B", "likes", null, null, null, WORKSPACE));

        assertEquals(ValidationError.INVALID_RELATIONSHIP_TYPE, ex.getError());
    }

    @Test
    void shouldRejectBlankIdsAndNestedMetadata() {
        KnowledgeValidationException blank = assertThrows(KnowledgeValidationException.class,
                () -> graphService.createRelationship(" ", "B", RELATES_TO, null, null, null, WORKSPACE));
        KnowledgeValidationException nested = assertThrows(KnowledgeValidationException.class,
                () -> graphService.createRelationship("A", "B", RELATES_TO, null, null,
                        Map.of("nested", Map.of("x", 1)), WORKSPACE));

        assertEquals(ValidationError.INVALID_METADATA, blank.getError());
        assertEquals(ValidationError.INVALID_METADATA, nested.getError());
    }

    @Test
    void shouldAcceptConfiguredRelationshipTypes() {
        context.properties.getGraph().getRelationshipTypes().add("mentions");

        RelationshipEdge edge = graphService.createRelationship("A", "B", "mentions", null, null, null, WORKSPACE);

        assertEquals("mentions", edge.getRelationshipType());
    }

    // ===== Neighbors =====

    @Test
    void shouldFindNeighborsInBothDirections() {
        graphService.createRelationship("A", "B", RELATES_TO, null, null, null, WORKSPACE);
        graphService.createRelationship("C", "A", DEPENDS_ON, null, null, null, WORKSPACE);
        graphService.createRelationship("B", "C", RELATES_TO, null, null, null, WORKSPACE);

        assertEquals(2, graphService.getNeighbors("A", null, null).size());
        assertEquals(1, graphService.getNeighbors("A", DEPENDS_ON, null).size());
        assertEquals(1, graphService.getNeighbors("A", null, 1).size());
        assertTrue(graphService.getNeighbors("Z", null, null).isEmpty());
    }

    @Test
    void shouldReturnNoNeighborsWhenStoreFails() {
        RelationshipStore store = mock(RelationshipStore.class);
        when(store.findIncident(anyString(), any(), anyInt())).thenThrow(new IllegalStateException("down"));
        GraphService failing = new GraphService(store, context.knowledgeIndex, new MemoryProperties(),
                Clock.systemUTC());

        assertTrue(failing.getNeighbors("A", null, null).isEmpty());
    }

    // ===== Traversal =====

    @Test
    void shouldTraverseChainWithDepths() {
        graphService.createRelationship("A", "B", RELATES_TO, null, null, null, WORKSPACE);
        graphService.createRelationship("B", "C", DEPENDS_ON, null, null, null, WORKSPACE);

        TraversalResult result = graphService.traverse("A", 2, null, null);

        assertEquals(List.of("A", "B", "C"), result.nodeIds());
        assertEquals(List.of(0, 1, 2), result.nodes().stream().map(TraversalNode::depth).toList());
        assertEquals(2, result.totalRelationships());
        assertEquals(2, result.maxDepthReached());
        assertEquals("A", result.startNode());
    }

    @Test
    void shouldTerminateOnCycleAndVisitEachNodeOnce() {
        graphService.createRelationship("A", "B", RELATES_TO, null, null, null, WORKSPACE);
        graphService.createRelationship("B", "C", RELATES_TO, null, null, null, WORKSPACE);
        graphService.createRelationship("C", "A", RELATES_TO, null, null, null, WORKSPACE);

        TraversalResult result = graphService.traverse("A", 3, null, null);

        assertEquals(3, result.nodes().size());
        assertEquals(3, result.nodeIds().stream().distinct().count());
        assertEquals(3, result.totalRelationships());
        assertEquals(1, result.maxDepthReached());
    }

    @Test
    void shouldCapDepthAtConfiguredMaximum() {
        context.properties.getGraph().setMaxDepth(1);
        graphService.createRelationship("A", "B", RELATES_TO, null, null, null, WORKSPACE);
        graphService.createRelationship("B", "C", RELATES_TO, null, null, null, WORKSPACE);

        TraversalResult result = graphService.traverse("A", 5, null, null);

        assertEquals(List.of("A", "B"), result.nodeIds());
        assertEquals(1, result.maxDepthReached());
    }

    @Test
    void shouldReturnOnlyStartNodeAtDepthZero() {
        graphService.createRelationship("A", "B", RELATES_TO, null, null, null, WORKSPACE);

        TraversalResult result = graphService.traverse("A", 0, null, null);

        assertEquals(List.of("A"), result.nodeIds());
        assertEquals(1, result.totalRelationships());
        assertEquals(0, result.maxDepthReached());
    }

    @Test
    void shouldBoundNumberOfNodes() {
        for (int i = 0; i < 8; i++) {
            graphService.createRelationship("hub", "leaf-" + i, RELATES_TO, null, null, null, WORKSPACE);
        }

        TraversalResult result = graphService.traverse("hub", 2, null, 4);

        assertEquals(4, result.nodes().size());
        assertEquals("hub", result.nodes().get(0).nodeId());
    }

    @Test
    void shouldFollowOnlyRequestedTypes() {
        graphService.createRelationship("A", "B", RELATES_TO, null, null, null, WORKSPACE);
        graphService.createRelationship("A", "C", DEPENDS_ON, null, null, null, WORKSPACE);
        graphService.createRelationship("A", "D", "supersedes", null, null, null, WORKSPACE);

        TraversalResult single = graphService.traverse("A", 1, List.of(DEPENDS_ON), null);
        TraversalResult multiple = graphService.traverse("A", 1, List.of(DEPENDS_ON, "supersedes"), null);

        assertEquals(List.of("A", "C"), single.nodeIds());
        assertEquals(List.of("A", "C", "D"), multiple.nodeIds());
        assertEquals(2, multiple.totalRelationships());
    }

    @Test
    void shouldTraverseIsolatedNode() {
        TraversalResult result = graphService.traverse("lonely", 3, null, null);

        assertEquals(List.of("lonely"), result.nodeIds());
        assertEquals(0, result.totalRelationships());
        assertEquals(0, result.maxDepthReached());
    }

    // ===== Management =====

    @Test
    void shouldListAndDeleteRelationships() {
        RelationshipEdge first = graphService.createRelationship("A", "B", RELATES_TO, null, null, null, "ws-1");
        graphService.createRelationship("B", "C", DEPENDS_ON, null, null, null, "ws-1");
        graphService.createRelationship("X", "Y", RELATES_TO, null, null, null, "ws-2");

        assertEquals(2, graphService.listRelationships("ws-1", null).size());
        assertEquals(2, graphService.listRelationships(null, RELATES_TO).size());

        assertTrue(graphService.deleteRelationship(first.getId()));
        assertFalse(graphService.deleteRelationship(first.getId()));
        assertTrue(graphService.getRelationship(first.getId()).isEmpty());
        assertEquals(1, graphService.listRelationships("ws-1", null).size());
    }
}
