package io.sqlsugar.condition;

import java.util.Objects;

public record Evaluation(boolean value, String details) {
    public Evaluation {
        Objects.requireNonNull(details, "details");
    }
}
