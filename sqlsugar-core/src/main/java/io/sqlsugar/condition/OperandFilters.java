package io.sqlsugar.condition;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * The handful of filters that make sense inside a condition operand, e.g. {@code items|length > 0}.
 * Unknown filters leave the value unchanged.
 */
final class OperandFilters {
    private OperandFilters() {
    }

    static String baseName(String operand) {
        int pipe = operand.indexOf('|');
        return (pipe < 0 ? operand : operand.substring(0, pipe)).trim();
    }

    static Object apply(String operand, EvaluationContext context) {
        String[] parts = operand.split("\\|");
        Object value = context.get(parts[0].trim());
        for (int i = 1; i < parts.length; i++) {
            value = applyOne(parts[i].trim(), value, context);
        }
        return value;
    }

    private static Object applyOne(String filter, Object value, EvaluationContext context) {
        int paren = filter.indexOf('(');
        String name = paren < 0 ? filter : filter.substring(0, paren).trim();
        String argument = paren < 0 || !filter.endsWith(")") ? "" : filter.substring(paren + 1, filter.length() - 1).trim();
        switch (name) {
            case "length", "count" -> {
                return size(value);
            }
            case "lower" -> {
                return value == null ? null : value.toString().toLowerCase(Locale.ROOT);
            }
            case "upper" -> {
                return value == null ? null : value.toString().toUpperCase(Locale.ROOT);
            }
            case "trim" -> {
                return value == null ? null : value.toString().trim();
            }
            case "string" -> {
                return value == null ? "" : value.toString();
            }
            case "int" -> {
                double number = ValueComparisons.toNumber(value);
                return Double.isNaN(number) ? 0L : (long) number;
            }
            case "float" -> {
                double number = ValueComparisons.toNumber(value);
                return Double.isNaN(number) ? 0.0 : number;
            }
            case "default", "d" -> {
                return value == null && !argument.isEmpty() ? ValueLiterals.resolve(argument, context) : value;
            }
            default -> {
                return value;
            }
        }
    }

    private static Object size(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof CharSequence text) {
            return text.length();
        }
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        if (value instanceof Map<?, ?> map) {
            return map.size();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value);
        }
        return 1;
    }
}
