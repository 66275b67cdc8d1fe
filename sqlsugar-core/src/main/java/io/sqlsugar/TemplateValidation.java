package io.sqlsugar;

import java.util.List;

public record TemplateValidation(boolean valid, List<String> errors) {
    public TemplateValidation {
        errors = List.copyOf(errors);
    }

    public static TemplateValidation of(List<String> errors) {
        return new TemplateValidation(errors.isEmpty(), errors);
    }
}
