package io.sqlsugar.condition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TruthyEvaluatorTest {
    @Test
    void falsyValues() {
        assertFalse(TruthyEvaluator.isTruthy(null));
        assertFalse(TruthyEvaluator.isTruthy(false));
        assertFalse(TruthyEvaluator.isTruthy(0));
        assertFalse(TruthyEvaluator.isTruthy(0L));
        assertFalse(TruthyEvaluator.isTruthy(0.0));
        assertFalse(TruthyEvaluator.isTruthy(Double.NaN));
        assertFalse(TruthyEvaluator.isTruthy(BigDecimal.ZERO));
        assertFalse(TruthyEvaluator.isTruthy(""));
        assertFalse(TruthyEvaluator.isTruthy("   "));
        assertFalse(TruthyEvaluator.isTruthy("0"));
        assertFalse(TruthyEvaluator.isTruthy("False"));
        assertFalse(TruthyEvaluator.isTruthy("no"));
        assertFalse(TruthyEvaluator.isTruthy("OFF"));
        assertFalse(TruthyEvaluator.isTruthy(List.of()));
        assertFalse(TruthyEvaluator.isTruthy(Map.of()));
        assertFalse(TruthyEvaluator.isTruthy(new int[0]));
        assertFalse(TruthyEvaluator.isTruthy(Optional.empty()));
    }

    @Test
    void truthyValues() {
        assertTrue(TruthyEvaluator.isTruthy(true));
        assertTrue(TruthyEvaluator.isTruthy(42));
        assertTrue(TruthyEvaluator.isTruthy(-1));
        assertTrue(TruthyEvaluator.isTruthy(0.5));
        assertTrue(TruthyEvaluator.isTruthy("1"));
        assertTrue(TruthyEvaluator.isTruthy("true"));
        assertTrue(TruthyEvaluator.isTruthy("on"));
        assertTrue(TruthyEvaluator.isTruthy("yes"));
        assertTrue(TruthyEvaluator.isTruthy("00"));
        assertTrue(TruthyEvaluator.isTruthy(List.of(1)));
        assertTrue(TruthyEvaluator.isTruthy(List.of(0)));
        assertTrue(TruthyEvaluator.isTruthy(Map.of("k", "v")));
        assertTrue(TruthyEvaluator.isTruthy(new Object()));
    }

    @Test
    void logicalChainEvaluatesLeftToRight() {
        EvaluationContext context = EvaluationContext.of("a", true, "b", 0);
        Evaluation and = TruthyEvaluator.evaluate(ConditionParser.parse("a and b"), context);
        assertFalse(and.value());
        assertEquals("(a = true (truthy) and b = 0 (falsy)) = false", and.details());

        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("a or b"), context).value());
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("b or b or a"), context).value());
    }

    @Test
    void comparisonsCoerceNumbers() {
        EvaluationContext context = EvaluationContext.of("age", "21", "score", 7.5, "name", "bob");
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("age >= 18"), context).value());
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("score < 10"), context).value());
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("name == 'bob'"), context).value());
        assertFalse(TruthyEvaluator.evaluate(ConditionParser.parse("name > 1"), context).value());

        Evaluation equality = TruthyEvaluator.evaluate(ConditionParser.parse("score == 7.5"), context);
        assertEquals("7.5 == 7.5 = true", equality.details());
    }

    @Test
    void comparisonResolvesRightSideFromContext() {
        EvaluationContext context = EvaluationContext.of("low", 1, "high", 5);
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("low < high"), context).value());
    }

    @Test
    void nullOrderingComparisonIsFalse() {
        EvaluationContext context = EvaluationContext.of("limit", null);
        assertFalse(TruthyEvaluator.evaluate(ConditionParser.parse("limit > 0"), context).value());
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("limit == None"), context).value());
    }

    @Test
    void membershipAgainstListsAndStrings() {
        EvaluationContext context = EvaluationContext.of("status", "open", "roles", List.of("admin", "dev"), "n", 2);
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("status in ['open', 'pending']"), context).value());
        assertFalse(TruthyEvaluator.evaluate(ConditionParser.parse("status not in ('open', 'pending')"), context).value());
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("'dev' in roles"), context).value());
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("'pen' in status"), context).value());
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("n in [1, 2, 3]"), context).value());
    }

    @Test
    void membershipAgainstScalarIsFalseWithReason() {
        EvaluationContext context = EvaluationContext.of("n", 2, "limit", 10);
        Evaluation evaluation = TruthyEvaluator.evaluate(ConditionParser.parse("n in limit"), context);
        assertFalse(evaluation.value());
        assertTrue(evaluation.details().startsWith("cannot evaluate n in limit"));
    }

    @Test
    void existenceDistinguishesNullFromValue() {
        EvaluationContext context = EvaluationContext.of("x", null, "y", 0);
        assertFalse(TruthyEvaluator.evaluate(ConditionParser.parse("x is not None"), context).value());
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("x is None"), context).value());
        Evaluation y = TruthyEvaluator.evaluate(ConditionParser.parse("y is not None"), context);
        assertTrue(y.value());
        assertEquals("y exists", y.details());
    }

    @Test
    void filteredOperands() {
        EvaluationContext context = EvaluationContext.of("items", List.of(1, 2), "name", " Bob ");
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("items|length > 1"), context).value());
        assertTrue(TruthyEvaluator.evaluate(ConditionParser.parse("name | trim | lower == 'bob'"), context).value());
        assertFalse(TruthyEvaluator.evaluate(ConditionParser.parse("items | length == 0"), context).value());
    }

    @Test
    void absentVariablesCoverEveryCheckedOperand() {
        EvaluationContext context = EvaluationContext.of("a", 1);
        assertEquals(List.of("x"), TruthyEvaluator.absentVariables(ConditionParser.parse("x"), context));
        assertEquals(List.of("x"), TruthyEvaluator.absentVariables(ConditionParser.parse("x is not None"), context));
        assertEquals(
            List.of("b", "items"),
            TruthyEvaluator.absentVariables(ConditionParser.parse("a and b == 1 or items|length > 0"), context)
        );
        assertTrue(TruthyEvaluator.absentVariables(ConditionParser.parse("a > missing_right"), context).isEmpty());
        assertTrue(TruthyEvaluator.absentVariables(ConditionParser.parse("'x' in a"), context).isEmpty());
    }
}
