package io.sqlsugar.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.sqlsugar.condition.EvaluationContext;
import io.sqlsugar.template.BlockReducer;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DecisionLogTest {
    private static final String TEMPLATE = "WHERE {% if active %}a{% endif %}{% if vip %}b{% endif %}";

    @Test
    void logsOneLinePerDecision() {
        List<String> lines = new ArrayList<>();
        DecisionLog log = DecisionLog.builder().sink(lines::add).build();
        new BlockReducer(List.of(log)).reduce(TEMPLATE, EvaluationContext.of("active", true));
        assertEquals(
            List.of(
                "JINJA: [REMOVE] vip | missing variable: vip",
                "JINJA: [KEEP] active | active = true (truthy)"
            ),
            lines
        );
    }

    @Test
    void reasonCanBeOmitted() {
        List<String> lines = new ArrayList<>();
        DecisionLog log = DecisionLog.builder().includeReason(false).prefix("SQL-IF:").sink(lines::add).build();
        new BlockReducer(List.of(log)).reduce(TEMPLATE, EvaluationContext.of("active", true, "vip", true));
        assertEquals(List.of("SQL-IF: [KEEP] vip", "SQL-IF: [KEEP] active"), lines);
    }

    @Test
    void summaryAndElapsed() {
        List<String> lines = new ArrayList<>();
        DecisionLog log = DecisionLog.builder()
            .includeReason(false)
            .includeSummary(true)
            .includeElapsed(true)
            .sink(lines::add)
            .build();
        new BlockReducer(List.of(log)).reduce(TEMPLATE, EvaluationContext.of("active", false, "vip", 1));
        assertEquals(3, lines.size());
        String summary = lines.get(2);
        assertTrue(summary.startsWith("JINJA: kept=1, removed=1, decisions=2, elapsed="), summary);
        assertTrue(summary.endsWith("ns"), summary);
    }

    @Test
    void disabledLogIsSilent() {
        List<String> lines = new ArrayList<>();
        DecisionLog log = DecisionLog.builder().enabled(false).includeSummary(true).sink(lines::add).build();
        new BlockReducer(List.of(log)).reduce(TEMPLATE, EvaluationContext.empty());
        assertTrue(lines.isEmpty());
    }

    @Test
    void blankPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DecisionLog.builder().prefix(" "));
    }
}
