package io.sqlsugar.condition;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 条件求值上下文。
 * <p>
 * 扁平的 name → value 映射，允许 {@code "user.id"} 这类带点的键，也允许 null 值（null 与缺失是两种状态）。
 * 查找只按完整的键匹配：绑定了 {@code user} 这个 Map 并不意味着 {@code user.active} 存在。
 * 嵌套结构只在 {@link #nestedView()} 中展开，供渲染使用。
 */
public final class EvaluationContext {
    private final Map<String, Object> values;

    private EvaluationContext(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static EvaluationContext empty() {
        return new EvaluationContext(Map.of());
    }

    public static EvaluationContext from(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        return new EvaluationContext(values);
    }

    public static EvaluationContext of(String name, Object value, Object... more) {
        Objects.requireNonNull(name, "name");
        if (more.length % 2 != 0) {
            throw new IllegalArgumentException("Context entries must be name/value pairs");
        }
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(name, value);
        for (int i = 0; i < more.length; i += 2) {
            if (!(more[i] instanceof String key)) {
                throw new IllegalArgumentException("Context name must be a String");
            }
            if (entries.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate context entry: " + key);
            }
            entries.put(key, more[i + 1]);
        }
        return new EvaluationContext(entries);
    }

    public EvaluationContext with(String name, Object value) {
        Objects.requireNonNull(name, "name");
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.put(name, value);
        return new EvaluationContext(next);
    }

    public boolean contains(String name) {
        return values.containsKey(Objects.requireNonNull(name, "name"));
    }

    /**
     * Returns the value bound to {@code name}, or null when it is absent or bound to null.
     * Use {@link #contains(String)} to tell the two apart.
     */
    public Object get(String name) {
        return values.get(Objects.requireNonNull(name, "name"));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 将带点的键展开为嵌套 Map，供模板引擎渲染使用。
     * 带点的键与同名标量冲突时，带点的键优先。
     */
    public Map<String, Object> nestedView() {
        Map<String, Object> root = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getKey().indexOf('.') < 0) {
                root.put(entry.getKey(), entry.getValue());
            }
        }
        Set<Map<String, Object>> owned = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String key = entry.getKey();
            if (key.indexOf('.') < 0) {
                continue;
            }
            String[] segments = key.split("\\.");
            Map<String, Object> current = root;
            for (int i = 0; i < segments.length - 1; i++) {
                current = childMap(current, segments[i], owned);
            }
            current.put(segments[segments.length - 1], entry.getValue());
        }
        return root;
    }

    private static Map<String, Object> childMap(
        Map<String, Object> parent,
        String name,
        Set<Map<String, Object>> owned
    ) {
        Object existing = parent.get(name);
        if (existing != null && owned.contains(existing)) {
            @SuppressWarnings("unchecked")
            Map<String, Object> reused = (Map<String, Object>) existing;
            return reused;
        }
        Map<String, Object> child = new LinkedHashMap<>();
        if (existing instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> nested : map.entrySet()) {
                child.put(String.valueOf(nested.getKey()), nested.getValue());
            }
        }
        owned.add(child);
        parent.put(name, child);
        return child;
    }

    @Override
    public String toString() {
        return "EvaluationContext" + values;
    }
}
