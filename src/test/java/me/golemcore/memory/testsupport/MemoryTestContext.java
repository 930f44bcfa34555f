package me.golemcore.memory.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.adapter.outbound.graph.VectorIndexRelationshipStore;
import me.golemcore.memory.adapter.outbound.vector.LocalVectorIndexAdapter;
import me.golemcore.memory.domain.service.AuditLogService;
import me.golemcore.memory.domain.service.CollectionRegistry;
import me.golemcore.memory.domain.service.ContradictionDetector;
import me.golemcore.memory.domain.service.GraphService;
import me.golemcore.memory.domain.service.KnowledgeIndex;
import me.golemcore.memory.domain.service.KnowledgeStoreService;
import me.golemcore.memory.domain.service.LearningService;
import me.golemcore.memory.domain.service.LifecycleService;
import me.golemcore.memory.domain.service.PayloadMapper;
import me.golemcore.memory.domain.service.RankingService;
import me.golemcore.memory.domain.service.RetrievalMetrics;
import me.golemcore.memory.domain.service.SearchMerger;
import me.golemcore.memory.domain.service.SkillDialogExtractor;
import me.golemcore.memory.domain.service.SkillService;
import me.golemcore.memory.infrastructure.config.AutoConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryProperties;

import java.time.Instant;

/**
 * The memory engine wired by hand on top of the in-process vector index, fake
 * embeddings, map-backed storage and a controllable clock. Properties may be
 * changed after construction; services read them per call.
 */
public final class MemoryTestContext {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    public final MemoryProperties properties = new MemoryProperties();
    public final MutableClock clock = new MutableClock(NOW);
    public final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    public final InMemoryStoragePort storage = new InMemoryStoragePort();
    public final FakeEmbeddingPort embeddings = new FakeEmbeddingPort();
    public final LocalVectorIndexAdapter vectorIndex;
    public final PayloadMapper payloadMapper;
    public final RankingService rankingService;
    public final KnowledgeIndex knowledgeIndex;
    public final RetrievalMetrics retrievalMetrics;
    public final SearchMerger searchMerger;
    public final AuditLogService auditLogService;
    public final CollectionRegistry collectionRegistry;
    public final GraphService graphService;
    public final ContradictionDetector contradictionDetector;
    public final KnowledgeStoreService knowledgeStore;
    public final LearningService learningService;
    public final SkillService skillService;
    public final LifecycleService lifecycleService;

    public MemoryTestContext() {
        properties.getVector().getLocal().setPersist(false);
        properties.getEmbedding().setDimension(FakeEmbeddingPort.DIMENSION);

        vectorIndex = new LocalVectorIndexAdapter(properties, storage, objectMapper);
        payloadMapper = new PayloadMapper(objectMapper);
        rankingService = new RankingService(properties, clock);
        knowledgeIndex = new KnowledgeIndex(vectorIndex, embeddings, payloadMapper, rankingService, properties);
        retrievalMetrics = new RetrievalMetrics();
        searchMerger = new SearchMerger(rankingService);
        auditLogService = new AuditLogService(storage, objectMapper, clock, properties);
        collectionRegistry = new CollectionRegistry(vectorIndex, embeddings, storage, objectMapper, clock,
                properties);
        graphService = new GraphService(new VectorIndexRelationshipStore(vectorIndex, payloadMapper), knowledgeIndex,
                properties, clock);
        contradictionDetector = new ContradictionDetector(vectorIndex, properties);
        knowledgeStore = new KnowledgeStoreService(knowledgeIndex, searchMerger, retrievalMetrics, auditLogService,
                embeddings, vectorIndex, properties, clock);
        learningService = new LearningService(knowledgeIndex, contradictionDetector, graphService, searchMerger,
                retrievalMetrics, auditLogService, properties, clock);
        skillService = new SkillService(vectorIndex, knowledgeIndex, payloadMapper, new SkillDialogExtractor(),
                properties, clock);
        lifecycleService = new LifecycleService(knowledgeIndex, vectorIndex, embeddings, collectionRegistry,
                auditLogService, properties, clock);
    }
}
