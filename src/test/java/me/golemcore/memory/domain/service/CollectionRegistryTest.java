package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.CollectionInfo;
import me.golemcore.memory.domain.model.KnowledgeCollection;
import me.golemcore.memory.testsupport.MemoryTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CollectionRegistryTest {

    private MemoryTestContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new MemoryTestContext();
    }

    @Test
    void shouldCreateAndRecordEveryCollectionOnFirstInit() {
        ctx.collectionRegistry.initializeCollections();

        for (KnowledgeCollection collection : KnowledgeCollection.values()) {
            CollectionInfo info = ctx.collectionRegistry.getInfo(collection.getCollectionName()).orElseThrow();
            assertEquals("test-embedding", info.getEmbeddingModel());
            assertEquals("1", info.getEmbeddingModelVersion());
            assertEquals(16, info.getDimension());
            assertEquals(MemoryTestContext.NOW, info.getIndexedAt());
            assertEquals(0, ctx.vectorIndex.count(collection.getCollectionName()));
        }
        String json = ctx.storage.read("registry", "collections.json");
        assertNotNull(json);
        assertTrue(json.contains("\"embedding_model\" : \"test-embedding\""));
    }

    @Test
    void shouldKeepStoredModelWhenItChanges() {
        ctx.collectionRegistry.initializeCollections();
        ctx.embeddings.setModelVersion("2");

        ctx.collectionRegistry.initializeCollections();

        CollectionInfo info = ctx.collectionRegistry.getInfo("agent_learnings").orElseThrow();
        assertEquals("1", info.getEmbeddingModelVersion());
        assertFalse(ctx.collectionRegistry.matchesCurrentModel(info));
    }

    @Test
    void shouldLoadPersistedRecordsInNewInstance() {
        ctx.collectionRegistry.recordCurrentModel("agent_memory_facts");

        CollectionRegistry reloaded = new CollectionRegistry(ctx.vectorIndex, ctx.embeddings, ctx.storage,
                ctx.objectMapper, ctx.clock, ctx.properties);

        assertTrue(reloaded.getInfo("agent_memory_facts").isPresent());
        assertTrue(reloaded.getInfo("agent_memory_files").isEmpty());
    }

    @Test
    void shouldStartEmptyOnCorruptRegistry() {
        ctx.storage.write("registry", "collections.json", "{broken");

        assertTrue(ctx.collectionRegistry.getInfo("agent_learnings").isEmpty());
    }

    @Test
    void shouldMatchOnModelAndVersion() {
        CollectionInfo info = CollectionInfo.builder().embeddingModel("test-embedding").embeddingModelVersion("1")
                .build();
        assertTrue(ctx.collectionRegistry.matchesCurrentModel(info));

        ctx.embeddings.setModel("other");
        assertFalse(ctx.collectionRegistry.matchesCurrentModel(info));
    }
}
