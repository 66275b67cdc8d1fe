package io.sqlsugar.condition;

public final class ConditionParseException extends IllegalArgumentException {
    private final String condition;

    public ConditionParseException(String message, String condition) {
        super(message + ": " + condition);
        this.condition = condition;
    }

    public String condition() {
        return condition;
    }
}
