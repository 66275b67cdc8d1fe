package io.sqlsugar.condition;

import io.sqlsugar.condition.ParsedCondition.Comparison;
import io.sqlsugar.condition.ParsedCondition.ExistenceCheck;
import io.sqlsugar.condition.ParsedCondition.ExistenceOperator;
import io.sqlsugar.condition.ParsedCondition.Logical;
import io.sqlsugar.condition.ParsedCondition.LogicalOperator;
import io.sqlsugar.condition.ParsedCondition.Membership;
import io.sqlsugar.condition.ParsedCondition.MembershipOperator;
import io.sqlsugar.condition.ParsedCondition.VariableCheck;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 按 Python 风格真值规则对条件求值。
 * <p>
 * 假值：{@code false}、任意数值零、NaN、{@code null}、空串与空白串、{@code "0"}、
 * 不区分大小写的 {@code "false"}/{@code "no"}/{@code "off"}、空集合、空数组、空 Map 与空 Optional。
 * 其余一律为真。逻辑组合会对所有操作数求值以保留完整的判定说明，结果与短路求值一致。
 */
public final class TruthyEvaluator {
    private static final Set<String> FALSY_WORDS = Set.of("false", "no", "off");

    private TruthyEvaluator() {
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return isNonZero(number);
        }
        if (value instanceof CharSequence text) {
            String string = text.toString();
            if (string.isBlank() || string.equals("0")) {
                return false;
            }
            return !FALSY_WORDS.contains(string.toLowerCase(Locale.ROOT));
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    public static Evaluation evaluate(ParsedCondition condition, EvaluationContext context) {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(context, "context");
        if (condition instanceof VariableCheck check) {
            return evaluateVariable(check, context);
        }
        if (condition instanceof ExistenceCheck check) {
            return evaluateExistence(check, context);
        }
        if (condition instanceof Comparison comparison) {
            return evaluateComparison(comparison, context);
        }
        if (condition instanceof Membership membership) {
            return evaluateMembership(membership, context);
        }
        if (condition instanceof Logical logical) {
            return evaluateLogical(logical, context);
        }
        throw new IllegalArgumentException("Unsupported condition: " + condition.getClass().getName());
    }

    /**
     * Names referenced by a variable check, an existence check or the left side of a comparison,
     * collected through logical operands, that the context does not bind. Literals are skipped and
     * filters are stripped down to the variable they apply to.
     */
    public static List<String> absentVariables(ParsedCondition condition, EvaluationContext context) {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(context, "context");
        Set<String> absent = new LinkedHashSet<>();
        collectAbsent(condition, context, absent);
        return new ArrayList<>(absent);
    }

    private static void collectAbsent(ParsedCondition condition, EvaluationContext context, Set<String> absent) {
        if (condition instanceof VariableCheck check) {
            checkPresent(check.variable(), context, absent);
        } else if (condition instanceof ExistenceCheck check) {
            checkPresent(check.variable(), context, absent);
        } else if (condition instanceof Comparison comparison) {
            checkPresent(comparison.left(), context, absent);
        } else if (condition instanceof Logical logical) {
            for (ParsedCondition operand : logical.operands()) {
                collectAbsent(operand, context, absent);
            }
        }
    }

    private static void checkPresent(String operand, EvaluationContext context, Set<String> absent) {
        if (ValueLiterals.isLiteral(operand)) {
            return;
        }
        String name = OperandFilters.baseName(operand);
        if (!name.isEmpty() && !context.contains(name)) {
            absent.add(name);
        }
    }

    private static Evaluation evaluateVariable(VariableCheck check, EvaluationContext context) {
        String variable = check.variable();
        Object value = operandValue(variable, context);
        if (value == null) {
            return new Evaluation(false, variable + " is null");
        }
        boolean truthy = isTruthy(value);
        return new Evaluation(truthy, variable + " = " + describe(value) + " (" + (truthy ? "truthy" : "falsy") + ")");
    }

    private static Evaluation evaluateExistence(ExistenceCheck check, EvaluationContext context) {
        String variable = check.variable();
        boolean exists = operandValue(variable, context) != null;
        boolean result = check.operator() == ExistenceOperator.EXISTS ? exists : !exists;
        return new Evaluation(result, variable + (exists ? " exists" : " does not exist"));
    }

    private static Evaluation evaluateComparison(Comparison comparison, EvaluationContext context) {
        Object left = operandValue(comparison.left(), context);
        Object right = ValueLiterals.resolve(comparison.right(), context);
        boolean result = switch (comparison.operator()) {
            case EQ -> ValueComparisons.looseEquals(left, right);
            case NE -> !ValueComparisons.looseEquals(left, right);
            default -> ValueComparisons.compare(
                ValueComparisons.toNumber(left),
                comparison.operator(),
                ValueComparisons.toNumber(right)
            );
        };
        String details = describe(left) + " " + comparison.operator().symbol() + " " + describe(right) + " = " + result;
        return new Evaluation(result, details);
    }

    private static Evaluation evaluateMembership(Membership membership, EvaluationContext context) {
        Object value = operandValue(membership.variable(), context);
        Object target = ValueLiterals.resolve(membership.target(), context);
        String keyword = membership.operator().keyword();
        boolean found;
        if (target instanceof Collection<?> items) {
            found = ValueComparisons.contains(items, value);
        } else if (target != null && target.getClass().isArray()) {
            found = ValueComparisons.contains(arrayElements(target), value);
        } else if (target instanceof Map<?, ?> map) {
            found = map.containsKey(value == null ? null : String.valueOf(value));
        } else if (target instanceof CharSequence text) {
            found = text.toString().contains(String.valueOf(value));
        } else {
            return new Evaluation(
                false,
                "cannot evaluate " + membership.variable() + " " + keyword + " " + membership.target()
                    + ": target is neither a list nor a string"
            );
        }
        boolean result = membership.operator() == MembershipOperator.IN ? found : !found;
        return new Evaluation(result, describe(value) + " " + keyword + " " + describe(target) + " = " + result);
    }

    private static Evaluation evaluateLogical(Logical logical, EvaluationContext context) {
        List<Evaluation> results = new ArrayList<>();
        for (ParsedCondition operand : logical.operands()) {
            results.add(evaluate(operand, context));
        }
        boolean result = results.get(0).value();
        StringBuilder details = new StringBuilder(results.get(0).details());
        for (int i = 0; i < logical.operators().size(); i++) {
            LogicalOperator operator = logical.operators().get(i);
            Evaluation next = results.get(i + 1);
            result = operator == LogicalOperator.AND ? result && next.value() : result || next.value();
            details.append(' ').append(operator.keyword()).append(' ').append(next.details());
        }
        return new Evaluation(result, "(" + details + ") = " + result);
    }

    private static Object operandValue(String operand, EvaluationContext context) {
        if (ValueLiterals.isLiteral(operand)) {
            return ValueLiterals.resolve(operand, context);
        }
        if (context.contains(operand)) {
            return context.get(operand);
        }
        return OperandFilters.apply(operand, context);
    }

    private static boolean isNonZero(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal.signum() != 0;
        }
        if (number instanceof BigInteger integer) {
            return integer.signum() != 0;
        }
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            return !Double.isNaN(value) && value != 0;
        }
        return number.longValue() != 0;
    }

    private static List<Object> arrayElements(Object array) {
        int length = Array.getLength(array);
        Object[] elements = new Object[length];
        for (int i = 0; i < length; i++) {
            elements[i] = Array.get(array, i);
        }
        return Arrays.asList(elements);
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "\"" + value + "\"";
        }
        if (value.getClass().isArray()) {
            return arrayElements(value).toString();
        }
        return String.valueOf(value);
    }
}
