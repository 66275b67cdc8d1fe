package io.sqlsugar.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.pebbletemplates.pebble.error.PebbleException;
import io.pebbletemplates.pebble.extension.AbstractExtension;
import io.pebbletemplates.pebble.extension.Filter;
import io.pebbletemplates.pebble.template.EvaluationContext;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * SQL 相关过滤器，以及 Jinja 模板中常见但 Pebble 内置未提供的类型转换过滤器。
 * <p>
 * 注册后变量的过滤器链可以被试渲染，例如 {@code {{ amount | float | round(2) }}}。
 */
public final class SqlFilterExtension extends AbstractExtension {
    private static final ObjectMapper JSON = new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    @Override
    public Map<String, Filter> getFilters() {
        Map<String, Filter> filters = new LinkedHashMap<>();
        filters.put("sql_quote", new SimpleFilter(List.of(), (input, args) -> quote(input)));
        filters.put("sql_identifier", new SimpleFilter(
            List.of(),
            (input, args) -> input == null ? null : "\"" + input.toString().replace("\"", "\"\"") + "\""
        ));
        filters.put("sql_in", new SimpleFilter(List.of(), (input, args) -> inList(input)));
        filters.put("sql_date", new SimpleFilter(List.of("format"), (input, args) -> sqlDate(input, args.get("format"))));
        filters.put("sql_datetime", new SimpleFilter(List.of(), (input, args) -> sqlDateTime(input)));
        filters.put("float", new SimpleFilter(List.of("default"), (input, args) -> toDouble(input, args.get("default"))));
        filters.put("int", new SimpleFilter(List.of("default"), (input, args) -> toLong(input, args.get("default"))));
        filters.put("string", new SimpleFilter(List.of(), (input, args) -> input == null ? "" : input.toString()));
        filters.put("bool", new SimpleFilter(List.of(), (input, args) -> toBoolean(input)));
        filters.put("round", new SimpleFilter(List.of("precision"), (input, args) -> round(input, args.get("precision"))));
        filters.put("truncate", new SimpleFilter(
            List.of("length", "killwords", "end"),
            (input, args) -> truncate(input, args.get("length"), args.get("end"))
        ));
        filters.put("tojson", new SimpleFilter(List.of("indent"), (input, args) -> toJson(input, args.get("indent"))));
        return filters;
    }

    static String quote(Object input) {
        if (input == null) {
            return "NULL";
        }
        if (input instanceof Number || input instanceof Boolean) {
            return input.toString();
        }
        return "'" + input.toString().replace("'", "''") + "'";
    }

    private static String inList(Object input) {
        List<String> quoted = new ArrayList<>();
        if (input instanceof Iterable<?> iterable) {
            for (Object item : iterable) {
                quoted.add(quote(item));
            }
        } else if (input != null && input.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(input); i++) {
                quoted.add(quote(Array.get(input, i)));
            }
        } else {
            return quote(input);
        }
        return String.join(", ", quoted);
    }

    private static String sqlDate(Object input, Object format) {
        LocalDate date = toDate(input);
        if (date == null) {
            return input == null ? null : input.toString();
        }
        String pattern = format == null ? "yyyy-MM-dd" : jinjaDatePattern(format.toString());
        return date.format(DateTimeFormatter.ofPattern(pattern, Locale.ROOT));
    }

    private static String sqlDateTime(Object input) {
        if (input instanceof LocalDateTime dateTime) {
            return dateTime.format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
        }
        LocalDate date = toDate(input);
        return date == null ? String.valueOf(input) : date.atStartOfDay().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
    }

    private static LocalDate toDate(Object input) {
        if (input instanceof TemporalAccessor temporal) {
            return LocalDate.from(temporal);
        }
        if (input instanceof CharSequence text && text.length() >= 10) {
            try {
                return LocalDate.parse(text.subSequence(0, 10));
            } catch (RuntimeException ex) {
                return null;
            }
        }
        return null;
    }

    /**
     * Moment-style tokens ({@code YYYY-MM-DD}) to {@link DateTimeFormatter} ones.
     */
    private static String jinjaDatePattern(String format) {
        return format.replace("YYYY", "yyyy").replace("DD", "dd");
    }

    private static Object toDouble(Object input, Object fallback) {
        BigDecimal number = toDecimal(input);
        if (number != null) {
            return number.doubleValue();
        }
        return fallback == null ? 0.0 : fallback;
    }

    private static Object toLong(Object input, Object fallback) {
        BigDecimal number = toDecimal(input);
        if (number != null) {
            return number.longValue();
        }
        return fallback == null ? 0L : fallback;
    }

    private static BigDecimal toDecimal(Object input) {
        if (input instanceof BigDecimal decimal) {
            return decimal;
        }
        if (input instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (input instanceof Boolean bool) {
            return bool ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        if (input != null) {
            try {
                return new BigDecimal(input.toString().trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static boolean toBoolean(Object input) {
        if (input instanceof Boolean bool) {
            return bool;
        }
        if (input instanceof CharSequence text) {
            String lower = text.toString().trim().toLowerCase(Locale.ROOT);
            return lower.equals("true") || lower.equals("1") || lower.equals("yes") || lower.equals("on");
        }
        if (input instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return input != null;
    }

    private static Object round(Object input, Object precision) {
        BigDecimal number = toDecimal(input);
        if (number == null) {
            return input;
        }
        int scale = precision instanceof Number digits ? digits.intValue() : 0;
        BigDecimal rounded = number.setScale(scale, RoundingMode.HALF_UP);
        return scale == 0 ? (Object) rounded.longValue() : (Object) rounded.doubleValue();
    }

    private static Object truncate(Object input, Object length, Object end) {
        if (input == null) {
            return null;
        }
        String text = input.toString();
        int limit = length instanceof Number number ? number.intValue() : 255;
        String suffix = end == null ? "..." : end.toString();
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, Math.max(0, limit - suffix.length())) + suffix;
    }

    private static String toJson(Object input, Object indent) {
        try {
            if (indent instanceof Number number && number.intValue() > 0) {
                return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(input);
            }
            return JSON.writeValueAsString(input);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value is not serializable to JSON: " + input, ex);
        }
    }

    @FunctionalInterface
    private interface FilterBody {
        Object apply(Object input, Map<String, Object> args);
    }

    private static final class SimpleFilter implements Filter {
        private final List<String> argumentNames;
        private final FilterBody body;

        private SimpleFilter(List<String> argumentNames, FilterBody body) {
            this.argumentNames = argumentNames;
            this.body = body;
        }

        @Override
        public List<String> getArgumentNames() {
            return argumentNames;
        }

        @Override
        public Object apply(
            Object input,
            Map<String, Object> args,
            PebbleTemplate self,
            EvaluationContext context,
            int lineNumber
        ) throws PebbleException {
            try {
                return body.apply(input, args);
            } catch (RuntimeException ex) {
                throw new PebbleException(ex, ex.getMessage(), lineNumber, self.getName());
            }
        }
    }
}
