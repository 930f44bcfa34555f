package me.golemcore.memory.domain.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeMetadataTest {

    @Test
    void shouldAcceptDefaults() {
        assertDoesNotThrow(() -> KnowledgeMetadata.builder().build().validate());
    }

    @Test
    void shouldTreatMissingStatusAsActive() {
        assertTrue(KnowledgeMetadata.builder().build().isActive());
        assertFalse(KnowledgeMetadata.builder().status(EntryStatus.SUPERSEDED).build().isActive());
    }

    @Test
    void shouldRejectOutOfRangeScores() {
        assertInvalid(KnowledgeMetadata.builder().importance(1.5).build());
        assertInvalid(KnowledgeMetadata.builder().reliability(-0.1).build());
        assertInvalid(KnowledgeMetadata.builder().frequency(Double.NaN).build());
        assertInvalid(KnowledgeMetadata.builder().version(0).build());
    }

    @Test
    void shouldAcceptScalarExtensions() {
        Map<String, Object> extensions = new LinkedHashMap<>();
        extensions.put("ticket", "OPS-12");
        extensions.put("retries", 3);
        extensions.put("verified", true);
        extensions.put("note", null);

        assertDoesNotThrow(() -> KnowledgeMetadata.builder().extensions(extensions).build().validate());
    }

    @Test
    void shouldRejectNestedExtensionValues() {
        assertInvalid(KnowledgeMetadata.builder().extensions(Map.of("nested", List.of(1, 2))).build());
        assertInvalid(KnowledgeMetadata.builder().extensions(Map.of("nested", Map.of("a", 1))).build());
    }

    @Test
    void shouldBoundExtensionKeysAndCount() {
        assertInvalid(KnowledgeMetadata.builder().extensions(Map.of(" ", "x")).build());
        assertInvalid(KnowledgeMetadata.builder().extensions(Map.of("k".repeat(65), "x")).build());

        Map<String, Object> many = new LinkedHashMap<>();
        for (int i = 0; i <= KnowledgeMetadata.MAX_EXTENSIONS; i++) {
            many.put("key" + i, i);
        }
        assertInvalid(KnowledgeMetadata.builder().extensions(many).build());
    }

    @Test
    void shouldResolveStatusCodesLeniently() {
        assertEquals(EntryStatus.SUPERSEDED, EntryStatus.fromCode(" Superseded "));
        assertEquals(EntryStatus.DELETED, EntryStatus.fromCode("deleted"));
        assertEquals(EntryStatus.ACTIVE, EntryStatus.fromCode(null));
        assertEquals(EntryStatus.ACTIVE, EntryStatus.fromCode("archived"));
    }

    private static void assertInvalid(KnowledgeMetadata metadata) {
        KnowledgeValidationException ex = assertThrows(KnowledgeValidationException.class, metadata::validate);
        assertEquals(KnowledgeValidationException.ValidationError.INVALID_METADATA, ex.getError());
    }
}
