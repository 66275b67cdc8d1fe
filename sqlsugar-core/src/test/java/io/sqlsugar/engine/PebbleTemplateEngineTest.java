package io.sqlsugar.engine;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PebbleTemplateEngineTest {
    private final PebbleTemplateEngine engine = new PebbleTemplateEngine();

    @Test
    void attributeLookupIsOneDottedName() {
        assertEquals(
            List.of(VariableReference.of("user.id")),
            engine.references("SELECT * FROM users WHERE id = {{ user.id }}")
        );
    }

    @Test
    void filtersAccumulateAcrossReferences() {
        List<VariableReference> references = engine.references(
            "WHERE amount > {{ amt | float }} AND total < {{ amt | round(2) }}"
        );
        assertEquals(List.of(new VariableReference("amt", List.of("float", "round"))), references);
    }

    @Test
    void conditionsAndElifAreVisited() {
        List<VariableReference> references = engine.references(
            "{% if a > 1 %}x{% elif b == None %}y{% else %}{{ c }}{% endif %}"
        );
        assertEquals(List.of(VariableReference.of("a"), VariableReference.of("b"), VariableReference.of("c")), references);
    }

    @Test
    void loopLocalsAreNotInputs() {
        List<VariableReference> references = engine.references(
            "{% for item in items %}{{ item.name }}{{ loop.index }}{% endfor %}"
        );
        assertEquals(List.of(VariableReference.of("items")), references);
    }

    @Test
    void validateRejectsBrokenSyntax() {
        assertDoesNotThrow(() -> engine.validate("{% if a %}x{% elif b %}y{% endif %}"));
        assertThrows(TemplateEngineException.class, () -> engine.validate("{% if a %}x"));
        assertThrows(TemplateEngineException.class, () -> engine.references("{{ a "));
    }

    @Test
    void rendersSqlFilters() {
        assertEquals("'O''Brien'", engine.render("{{ name | sql_quote }}", Map.of("name", "O'Brien")));
        assertEquals("'a', 'b'", engine.render("{{ codes | sql_in }}", Map.of("codes", List.of("a", "b"))));
        assertEquals("\"order\"", engine.render("{{ table | sql_identifier }}", Map.of("table", "order")));
        assertEquals("2024-03-01", engine.render("{{ day | sql_date }}", Map.of("day", "2024-03-01T10:00:00")));
        assertEquals("on", engine.render("{% if active == True %}on{% endif %}", Map.of("active", true)));
    }

    @Test
    void rendersConversionFilters() {
        assertEquals("3.5", engine.render("{{ amount | float }}", Map.of("amount", "3.5")));
        assertEquals("12", engine.render("{{ amount | int }}", Map.of("amount", "12.7")));
        assertEquals("3.14", engine.render("{{ amount | round(2) }}", Map.of("amount", 3.14159)));
        assertEquals("{\"k\":1}", engine.render("{{ data | tojson }}", Map.of("data", Map.of("k", 1))));
    }
}
