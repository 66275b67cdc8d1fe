package io.sqlsugar.condition;

import java.util.Collection;
import java.util.Objects;

/**
 * Loose equality and numeric coercion used by {@code ==}, {@code !=}, the ordering operators and
 * membership tests. Numbers, booleans and numeric strings compare by value across types.
 */
final class ValueComparisons {
    private ValueComparisons() {
    }

    static boolean looseEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof String leftText && right instanceof String rightText) {
            return leftText.equals(rightText);
        }
        if (isNumeric(left) || isNumeric(right)) {
            double leftNumber = toNumber(left);
            double rightNumber = toNumber(right);
            if (!Double.isNaN(leftNumber) && !Double.isNaN(rightNumber)) {
                return leftNumber == rightNumber;
            }
            return false;
        }
        return Objects.equals(left, right);
    }

    static boolean contains(Collection<?> items, Object candidate) {
        for (Object item : items) {
            if (looseEquals(item, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Coerces a value for the ordering operators. Values without a numeric reading become NaN,
     * which makes every ordering comparison false.
     */
    static double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (ValueLiterals.isNumber(trimmed)) {
                return ValueLiterals.parseNumber(trimmed).doubleValue();
            }
        }
        return Double.NaN;
    }

    static boolean compare(double left, ParsedCondition.ComparisonOperator operator, double right) {
        if (Double.isNaN(left) || Double.isNaN(right)) {
            return false;
        }
        return switch (operator) {
            case GT -> left > right;
            case LT -> left < right;
            case GE -> left >= right;
            case LE -> left <= right;
            case EQ -> left == right;
            case NE -> left != right;
        };
    }

    private static boolean isNumeric(Object value) {
        return value instanceof Number || value instanceof Boolean;
    }
}
