package io.sqlsugar.condition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvaluationContextTest {
    @Test
    void nullValueIsPresent() {
        EvaluationContext context = EvaluationContext.of("x", null);
        assertTrue(context.contains("x"));
        assertNull(context.get("x"));
        assertFalse(context.contains("y"));
    }

    @Test
    void flatDottedKeyWins() {
        EvaluationContext context = EvaluationContext.of("user.id", 7, "user", Map.of("id", 9));
        assertEquals(7, context.get("user.id"));
    }

    @Test
    void dottedNamesAreOnlyMatchedAsWholeKeys() {
        EvaluationContext context = EvaluationContext.of(
            "user", Map.of("id", 5L, "active", true),
            "title", "abc"
        );
        assertFalse(context.contains("user.id"));
        assertNull(context.get("user.active"));
        assertFalse(context.contains("title.hash"));
        assertNull(context.get("title.hash"));
        assertTrue(context.contains("user"));
    }

    @Test
    void nestedViewExpandsDottedKeys() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("user.id", 1);
        values.put("user.name", "ann");
        values.put("limit", 10);
        Map<String, Object> view = EvaluationContext.from(values).nestedView();
        assertEquals(Map.of("id", 1, "name", "ann"), view.get("user"));
        assertEquals(10, view.get("limit"));
    }

    @Test
    void withReturnsNewContext() {
        EvaluationContext base = EvaluationContext.empty();
        EvaluationContext next = base.with("a", 1);
        assertTrue(base.isEmpty());
        assertEquals(1, next.get("a"));
    }

    @Test
    void invalidPairsThrow() {
        assertThrows(IllegalArgumentException.class, () -> EvaluationContext.of("id", 1, "name"));
        assertThrows(IllegalArgumentException.class, () -> EvaluationContext.of("id", 1, "id", 2));
        assertThrows(IllegalArgumentException.class, () -> EvaluationContext.of("id", 1, 2, "x"));
    }
}
