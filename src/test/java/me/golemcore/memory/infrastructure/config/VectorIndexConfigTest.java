package me.golemcore.memory.infrastructure.config;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class VectorIndexConfigTest {

    @ParameterizedTest
    @ValueSource(strings = { "local", " Local ", "LOCAL" })
    void shouldResolveLocalBackend(String value) {
        assertEquals(VectorIndexConfig.Backend.LOCAL, VectorIndexConfig.resolveBackend(value));
    }

    @ParameterizedTest
    @ValueSource(strings = { "qdrant", "QDRANT", "\tQdrant\n" })
    void shouldResolveQdrantBackend(String value) {
        assertEquals(VectorIndexConfig.Backend.QDRANT, VectorIndexConfig.resolveBackend(value));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "faiss", "chroma", "  " })
    void shouldRejectUnsupportedBackend(String value) {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> VectorIndexConfig.resolveBackend(value));
        assertTrue(ex.getMessage().contains("Unsupported vector backend"));
    }
}
