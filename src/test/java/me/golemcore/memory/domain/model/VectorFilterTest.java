package me.golemcore.memory.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VectorFilterTest {

    @Test
    void shouldMatchEverythingWhenEmpty() {
        assertTrue(VectorFilter.none().isEmpty());
        assertTrue(VectorFilter.none().matches(Map.of()));
        assertTrue(VectorFilter.none().matches(null));
    }

    @Test
    void shouldIgnoreNullConditions() {
        VectorFilter filter = VectorFilter.where("workspace_id", null).and("model_name", "gpt-4");

        assertEquals(Map.of("model_name", "gpt-4"), filter.getConditions());
    }

    @Test
    void shouldStoreStatusByCode() {
        VectorFilter filter = VectorFilter.where("status", EntryStatus.ACTIVE);

        assertEquals("active", filter.getConditions().get("status"));
        assertTrue(filter.matches(Map.of("status", "active")));
        assertFalse(filter.matches(Map.of("status", "superseded")));
    }

    @Test
    void shouldCompareNumbersByValue() {
        VectorFilter filter = VectorFilter.where("version", 2);

        assertTrue(filter.matches(Map.of("version", 2L)));
        assertTrue(filter.matches(Map.of("version", 2.0)));
        assertFalse(filter.matches(Map.of("version", 3)));
    }

    @Test
    void shouldRequireEveryCondition() {
        VectorFilter filter = VectorFilter.where("model_name", "gpt-4").and("workspace_id", "ws1");
        Map<String, Object> payload = new HashMap<>();
        payload.put("model_name", "gpt-4");

        assertFalse(filter.matches(payload));
        payload.put("workspace_id", "ws1");
        assertTrue(filter.matches(payload));
    }

    @Test
    void shouldNotMutateOriginalOnAnd() {
        VectorFilter base = VectorFilter.where("a", 1);
        VectorFilter extended = base.and("b", 2);

        assertEquals(1, base.getConditions().size());
        assertEquals(2, extended.getConditions().size());
    }
}
