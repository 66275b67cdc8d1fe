package io.sqlsugar.condition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Literal values that may appear on the right side of a comparison or as a membership target.
 */
final class ValueLiterals {
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(?:\\d+\\.\\d*|\\.\\d+|\\d+)(?:[eE][-+]?\\d+)?");
    private static final JsonMapper LIST_MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .build();

    private ValueLiterals() {
    }

    static boolean isLiteral(String text) {
        String value = text.trim();
        return isQuoted(value)
            || isNumber(value)
            || isBoolean(value)
            || isNone(value)
            || isList(value);
    }

    /**
     * Resolves an operand: quoted string, number, boolean, None/null, list literal, then a context
     * lookup, and finally the raw text itself.
     */
    static Object resolve(String text, EvaluationContext context) {
        String value = text.trim();
        if (isQuoted(value)) {
            return unquote(value);
        }
        if (isNumber(value)) {
            return parseNumber(value);
        }
        if (isBoolean(value)) {
            return Boolean.parseBoolean(value.toLowerCase(Locale.ROOT));
        }
        if (isNone(value)) {
            return null;
        }
        if (isList(value)) {
            return parseList(value, context);
        }
        if (context.contains(value)) {
            return context.get(value);
        }
        return value;
    }

    static boolean isQuoted(String value) {
        if (value.length() < 2) {
            return false;
        }
        char first = value.charAt(0);
        return (first == '\'' || first == '"') && value.charAt(value.length() - 1) == first;
    }

    static boolean isList(String value) {
        return value.length() >= 2
            && (value.startsWith("[") && value.endsWith("]") || value.startsWith("(") && value.endsWith(")"));
    }

    static boolean isNumber(String value) {
        return DECIMAL.matcher(value).matches();
    }

    private static boolean isBoolean(String value) {
        return value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false");
    }

    private static boolean isNone(String value) {
        return value.equals("None") || value.equals("none") || value.equals("null");
    }

    static Number parseNumber(String value) {
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value.startsWith("+") ? value.substring(1) : value);
            } catch (NumberFormatException ex) {
                return new BigDecimal(value);
            }
        }
        return Double.parseDouble(value);
    }

    private static String unquote(String value) {
        String body = value.substring(1, value.length() - 1);
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch == '\\' && i + 1 < body.length()) {
                out.append(body.charAt(++i));
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }

    private static List<Object> parseList(String value, EvaluationContext context) {
        String json = "[" + value.substring(1, value.length() - 1) + "]";
        try {
            List<?> parsed = LIST_MAPPER.readValue(json, List.class);
            return new ArrayList<>(parsed);
        } catch (JsonProcessingException ex) {
            // Python spellings such as None/True or bare names are not JSON
            List<Object> items = new ArrayList<>();
            for (String element : splitElements(value.substring(1, value.length() - 1))) {
                items.add(resolve(element, context));
            }
            return items;
        }
    }

    private static List<String> splitElements(String body) {
        List<String> elements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = '\0';
        int depth = 0;
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (quote != '\0') {
                current.append(ch);
                if (ch == '\\' && i + 1 < body.length()) {
                    current.append(body.charAt(++i));
                } else if (ch == quote) {
                    quote = '\0';
                }
                continue;
            }
            if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '[' || ch == '(') {
                depth++;
            } else if (ch == ']' || ch == ')') {
                depth--;
            } else if (ch == ',' && depth == 0) {
                addElement(elements, current);
                continue;
            }
            current.append(ch);
        }
        addElement(elements, current);
        return elements;
    }

    private static void addElement(List<String> elements, StringBuilder current) {
        String element = current.toString().trim();
        if (!element.isEmpty()) {
            elements.add(element);
        }
        current.setLength(0);
    }
}
