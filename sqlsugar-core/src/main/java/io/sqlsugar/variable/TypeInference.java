package io.sqlsugar.variable;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 基于变量名的类型推断。
 * <p>
 * 规则按顺序匹配，先匹配先生效；自定义规则排在内置规则之前。变量名先规范化：
 * 驼峰拆分为下划线并转为小写，例如 {@code userId} 规范化为 {@code user_id}。
 * 同时负责生成演示值与必填判断。
 */
public final class TypeInference {
    private static final List<TypeRule> BUILT_IN_RULES = List.of(
        TypeRule.of("flag", "(^|\\.)(is|has|can|should)_", VariableType.BOOLEAN),
        TypeRule.of("uuid", "uuid|guid", VariableType.UUID),
        TypeRule.of("email", "e?mail", VariableType.EMAIL),
        TypeRule.of("url", "(^|[._])(url|uri|link|href)s?($|[._])", VariableType.URL),
        TypeRule.of("identifier", "(^|[._])ids?($|[._])|id$", VariableType.NUMBER),
        TypeRule.of(
            "quantity",
            "count|amount|num|total|quantity|price|limit|offset|(^|[._])age($|[._])",
            VariableType.NUMBER
        ),
        TypeRule.of("timestamp", "created|updated|timestamp|_at($|\\.)", VariableType.DATETIME),
        TypeRule.of("date", "date|time", VariableType.DATE),
        TypeRule.of("structured", "json|data|config|params|_list($|\\.)", VariableType.JSON)
    );
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern NEGATIVE_FLAG = Pattern.compile("delete|remove|exclude|hide|disable");
    private static final Pattern IDENTIFIER = Pattern.compile("(^|[._])ids?($|[._])|id$");
    private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final TypeInference DEFAULTS = new TypeInference(List.of(), Clock.systemDefaultZone());

    private final List<TypeRule> rules;
    private final Clock clock;

    private TypeInference(List<TypeRule> customRules, Clock clock) {
        List<TypeRule> all = new ArrayList<>(customRules);
        all.addAll(BUILT_IN_RULES);
        this.rules = List.copyOf(all);
        this.clock = clock;
    }

    public static TypeInference defaults() {
        return DEFAULTS;
    }

    public static TypeInference withRules(List<TypeRule> customRules) {
        return withRules(customRules, Clock.systemDefaultZone());
    }

    public static TypeInference withRules(List<TypeRule> customRules, Clock clock) {
        Objects.requireNonNull(customRules, "customRules");
        Objects.requireNonNull(clock, "clock");
        return new TypeInference(customRules, clock);
    }

    public List<TypeRule> rules() {
        return rules;
    }

    public VariableType infer(String name) {
        String normalized = normalize(name);
        for (TypeRule rule : rules) {
            if (rule.matches(normalized)) {
                return rule.type();
            }
        }
        return VariableType.STRING;
    }

    public Object defaultValue(String name, VariableType type) {
        Objects.requireNonNull(type, "type");
        String normalized = normalize(name);
        return switch (type) {
            case NUMBER -> defaultNumber(normalized);
            case DATE -> LocalDate.now(clock).toString();
            case DATETIME -> LocalDateTime.now(clock).format(DATETIME_FORMAT);
            case BOOLEAN -> !NEGATIVE_FLAG.matcher(normalized).find();
            case EMAIL -> "test@example.com";
            case URL -> "https://example.com";
            case UUID -> "00000000-0000-0000-0000-000000000000";
            case JSON -> "{\"key\": \"value\"}";
            case STRING -> "demo_" + name;
        };
    }

    public boolean isRequired(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.contains("id") || lower.contains("required") || lower.contains("mandatory");
    }

    /**
     * Builds a pattern-tier descriptor for {@code name}; the structural tier re-tags it.
     */
    public VariableDescriptor describe(String name, List<String> filters, ExtractionMethod method) {
        VariableType type = infer(name);
        return new VariableDescriptor(name, type, defaultValue(name, type), isRequired(name), filters, method, true, null);
    }

    static String normalize(String name) {
        Objects.requireNonNull(name, "name");
        return CAMEL_BOUNDARY.matcher(name).replaceAll("$1_$2").toLowerCase(Locale.ROOT);
    }

    private static Integer defaultNumber(String normalized) {
        if (normalized.contains("limit")) {
            return 50;
        }
        if (normalized.contains("count")) {
            return 10;
        }
        if (IDENTIFIER.matcher(normalized).find()) {
            return 123;
        }
        return 42;
    }
}
