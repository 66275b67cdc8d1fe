package io.sqlsugar.variable;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named pattern over the normalized variable name, i.e. lowercase with camelCase split by '_'.
 * The pattern matches when it is found anywhere in the name.
 */
public record TypeRule(String name, Pattern pattern, VariableType type) {
    public TypeRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(type, "type");
    }

    public static TypeRule of(String name, String regex, VariableType type) {
        Objects.requireNonNull(regex, "regex");
        return new TypeRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), type);
    }

    public boolean matches(String normalizedName) {
        return pattern.matcher(normalizedName).find();
    }
}
