package io.sqlsugar.engine;

import java.util.List;
import java.util.Objects;

public record VariableReference(String name, List<String> filters) {
    public VariableReference {
        Objects.requireNonNull(name, "name");
        filters = List.copyOf(filters);
    }

    public static VariableReference of(String name) {
        return new VariableReference(name, List.of());
    }
}
