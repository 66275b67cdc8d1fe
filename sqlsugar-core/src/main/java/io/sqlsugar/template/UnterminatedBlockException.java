package io.sqlsugar.template;

/**
 * Raised when an {@code {% if %}} has no balancing {@code {% endif %}}.
 */
public final class UnterminatedBlockException extends IllegalArgumentException {
    private final String condition;
    private final int startOffset;

    public UnterminatedBlockException(String condition, int startOffset) {
        super("Unterminated block '{% if " + condition + " %}' at offset " + startOffset + ": missing {% endif %}");
        this.condition = condition;
        this.startOffset = startOffset;
    }

    public String condition() {
        return condition;
    }

    public int startOffset() {
        return startOffset;
    }
}
