package io.sqlsugar.engine;

public final class TemplateEngineException extends RuntimeException {
    public TemplateEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
