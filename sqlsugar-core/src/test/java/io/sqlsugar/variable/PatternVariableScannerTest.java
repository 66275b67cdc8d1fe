package io.sqlsugar.variable;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.sqlsugar.engine.VariableReference;
import java.util.List;
import org.junit.jupiter.api.Test;

class PatternVariableScannerTest {
    @Test
    void collectsPrintedVariablesWithFilters() {
        List<VariableReference> references = PatternVariableScanner.scan(
            "SELECT * FROM t WHERE amount > {{ amt | float }} AND total = {{ amt | round(2) }} AND name = {{ name }}"
        );
        assertEquals(
            List.of(new VariableReference("amt", List.of("float", "round")), VariableReference.of("name")),
            references
        );
    }

    @Test
    void truncatesDeepPaths() {
        assertEquals(
            List.of(VariableReference.of("order.customer")),
            PatternVariableScanner.scan("{{ order.customer.address.city }}")
        );
        assertEquals("a.b", PatternVariableScanner.truncate("a.b.c"));
        assertEquals("a", PatternVariableScanner.truncate("a"));
    }

    @Test
    void scansConditionsAndSkipsKeywordsAndLiterals() {
        List<VariableReference> references = PatternVariableScanner.scan(
            "{% if status in ['open', 'closed'] and not archived %}x{% elif owner is not None %}y{% endif %}"
        );
        assertEquals(
            List.of(VariableReference.of("status"), VariableReference.of("archived"), VariableReference.of("owner")),
            references
        );
    }

    @Test
    void skipsTestNamesAndFunctions() {
        List<VariableReference> references = PatternVariableScanner.scan(
            "{% if region is defined %}{{ range(limit) }}{{ user.name | default('x') }}{% endif %}"
        );
        assertEquals(
            List.of(
                VariableReference.of("region"),
                VariableReference.of("limit"),
                new VariableReference("user.name", List.of("default"))
            ),
            references
        );
    }

    @Test
    void excludesLoopAndSetLocals() {
        List<VariableReference> references = PatternVariableScanner.scan(
            "{% set cutoff = since %}"
                + "{% for key, value in filters.items() %}{{ key }} = {{ value }} AND {{ loop.index }}{% endfor %}"
                + "{{ cutoff }}"
        );
        assertEquals(List.of(VariableReference.of("since"), VariableReference.of("filters")), references);
    }
}
