package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.AuditEvent;
import me.golemcore.memory.domain.model.AuditEventType;
import me.golemcore.memory.domain.model.CleanupResult;
import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.domain.model.KnowledgeMetadata;
import me.golemcore.memory.domain.model.ReindexStatus;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.testsupport.FakeEmbeddingPort;
import me.golemcore.memory.testsupport.MemoryTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleServiceTest {

    private static final String FACTS = KnowledgeCollection.FACTS.getCollectionName();

    private MemoryTestContext context;
    private LifecycleService lifecycleService;

    @BeforeEach
    void setUp() {
        context = new MemoryTestContext();
        lifecycleService = context.lifecycleService;
    }

    // ===== TTL =====

    @Test
    void shouldReturnNoExpiredIdsWhenTtlDisabledOrCollectionEmpty() {
        assertTrue(lifecycleService.getExpiredIds(KnowledgeCollection.FACTS, 90).isEmpty());

        addFactDaysAgo("Old fact", 400);
        assertTrue(lifecycleService.getExpiredIds(KnowledgeCollection.FACTS, 0).isEmpty());
        assertTrue(lifecycleService.getExpiredIds(KnowledgeCollection.FACTS, -1).isEmpty());
    }

    @Test
    void shouldFindEntriesOlderThanTtl() {
        String old = addFactDaysAgo("Old fact", 100);
        addFactDaysAgo("Recent fact", 10);

        assertEquals(List.of(old), lifecycleService.getExpiredIds(KnowledgeCollection.FACTS, 90));
        assertEquals(2, lifecycleService.getExpiredIds(KnowledgeCollection.FACTS, 5).size());
    }

    @Test
    void shouldNeverExpireEntriesWithoutTimestamp() {
        context.knowledgeIndex.write(KnowledgeCollection.FACTS, "legacy", "Imported fact",
                FakeEmbeddingPort.axis(0), new KnowledgeMetadata());
        context.clock.advance(Duration.ofDays(1000));

        assertTrue(lifecycleService.getExpiredIds(KnowledgeCollection.FACTS, 1).isEmpty());
    }

    @Test
    void shouldCleanUpAllCollectionsWithPositiveTtl() {
        addFactDaysAgo("Old fact", 100);
        addFactDaysAgo("Recent fact", 10);
        context.clock.set(MemoryTestContext.NOW.minus(Duration.ofDays(40)));
        context.knowledgeStore.addFileChunk("Old chunk", KnowledgeMetadata.builder().fileName("a.txt").build());
        context.learningService.addLearning("Ancient learning", "gpt-4", "agent", null, null, null);
        context.clock.set(MemoryTestContext.NOW);

        CleanupResult result = lifecycleService.cleanupExpired(LifecycleService.ALL);

        assertEquals(2, result.totalDeleted());
        assertEquals(Map.of("facts", 1, "files", 1), result.deletedByCollection());
        assertEquals(1, context.vectorIndex.count(FACTS));
        assertEquals(1, context.vectorIndex.count(KnowledgeCollection.LEARNINGS.getCollectionName()));

        AuditEvent event = context.auditLogService.list(1, null, null).get(0);
        assertEquals(AuditEventType.TTL_CLEANUP, event.getEventType());
        assertEquals(2, event.getDetails().get("total_deleted"));
    }

    @Test
    void shouldCleanUpSingleCollection() {
        addFactDaysAgo("Old fact", 100);
        context.clock.set(MemoryTestContext.NOW.minus(Duration.ofDays(40)));
        context.knowledgeStore.addFileChunk("Old chunk", KnowledgeMetadata.builder().fileName("a.txt").build());
        context.clock.set(MemoryTestContext.NOW);

        CleanupResult result = lifecycleService.cleanupExpired("files");

        assertEquals(1, result.totalDeleted());
        assertEquals(1, context.vectorIndex.count(FACTS));
    }

    @Test
    void shouldNotAuditEmptyCleanup() {
        addFactDaysAgo("Recent fact", 1);

        CleanupResult result = lifecycleService.cleanupExpired(LifecycleService.ALL);

        assertEquals(0, result.totalDeleted());
        assertTrue(context.auditLogService.list(10, null, null).isEmpty());
    }

    @Test
    void shouldRejectUnknownCollectionName() {
        assertThrows(IllegalArgumentException.class, () -> lifecycleService.cleanupExpired("skills"));
        assertThrows(IllegalArgumentException.class, () -> lifecycleService.cleanupExpired("nope"));
    }

    @Test
    void shouldListExpiredPerCollection() {
        String old = addFactDaysAgo("Old fact", 100);

        Map<String, List<String>> expired = lifecycleService.getExpired(LifecycleService.ALL);

        assertEquals(List.of("facts", "files", "learnings"), List.copyOf(expired.keySet()));
        assertEquals(List.of(old), expired.get("facts"));
        assertTrue(expired.get("learnings").isEmpty());
    }

    // ===== Reindex =====

    @Test
    void shouldNotFlagReindexWithoutRecordedModel() {
        List<ReindexStatus> statuses = lifecycleService.checkReindexNeeded();

        assertEquals(3, statuses.size());
        assertTrue(statuses.stream().noneMatch(ReindexStatus::reindexNeeded));
        assertEquals("", statuses.get(0).storedModel());
    }

    @Test
    void shouldFlagReindexAfterModelChange() {
        context.collectionRegistry.initializeCollections();
        assertTrue(lifecycleService.checkReindexNeeded().stream().noneMatch(ReindexStatus::reindexNeeded));

        context.embeddings.setModel("test-embedding-large");

        List<ReindexStatus> statuses = lifecycleService.checkReindexNeeded();
        assertTrue(statuses.stream().allMatch(ReindexStatus::reindexNeeded));
        assertEquals("test-embedding", statuses.get(0).storedModel());
        assertEquals("test-embedding-large", statuses.get(0).currentModel());
    }

    @Test
    void shouldSkipReindexWhenModelMatches() {
        context.collectionRegistry.initializeCollections();
        addFactDaysAgo("Team uses Postgres", 0);

        assertEquals(0, lifecycleService.reindexCollection("facts", false));
    }

    @Test
    void shouldReembedAllDocumentsAfterModelChange() {
        context.collectionRegistry.initializeCollections();
        String id = addFactDaysAgo("Team uses Postgres", 0);
        addFactDaysAgo("Lunch is at noon", 0);

        context.embeddings.setModelVersion("2");
        context.embeddings.register("Team uses Postgres", FakeEmbeddingPort.axis(4));

        assertEquals(2, lifecycleService.reindexCollection("facts", false));

        VectorRecord record = context.vectorIndex.get(FACTS, List.of(id)).get(0);
        assertArrayEquals(FakeEmbeddingPort.axis(4), record.vector());
        assertEquals("Team uses Postgres", record.document());
        assertEquals("2", context.collectionRegistry.getInfo(FACTS).orElseThrow().getEmbeddingModelVersion());
        assertFalse(lifecycleService.checkReindexNeeded().get(0).reindexNeeded());
        assertEquals(AuditEventType.COLLECTION_REINDEXED,
                context.auditLogService.list(1, null, null).get(0).getEventType());
    }

    @Test
    void shouldForceReindex() {
        context.collectionRegistry.initializeCollections();
        addFactDaysAgo("Team uses Postgres", 0);

        Map<String, Integer> counts = lifecycleService.reindexAll(true);

        assertEquals(Map.of("facts", 1, "files", 0, "learnings", 0), counts);
    }

    @Test
    void shouldReportFailedReindexAsZero() {
        context.collectionRegistry.initializeCollections();
        addFactDaysAgo("Team uses Postgres", 0);
        context.embeddings.setFailing(true);

        assertEquals(0, lifecycleService.reindexAll(true).get("facts"));
    }

    @Test
    void shouldRejectReindexOfUnknownCollection() {
        assertThrows(IllegalArgumentException.class, () -> lifecycleService.reindexCollection("graph", true));
    }

    private String addFactDaysAgo(String text, int days) {
        context.clock.set(MemoryTestContext.NOW.minus(Duration.ofDays(days)));
        String id = context.knowledgeStore.addFact(text, new KnowledgeMetadata());
        context.clock.set(MemoryTestContext.NOW);
        return id;
    }
}
