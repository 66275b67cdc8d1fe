package io.sqlsugar.template;

import java.util.Objects;

public record ElifBranch(String condition, String content) {
    public ElifBranch {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(content, "content");
    }
}
