package io.sqlsugar.engine;

import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.error.PebbleException;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link TemplateEngine} backed by Pebble.
 * <p>
 * Templates are compiled from literal strings without caching, auto-escaping or strict variables.
 * Jinja spellings Pebble lacks ({@code elif}, {@code None}, {@code True}/{@code False}) are rewritten
 * first; constructs Pebble cannot parse at all (the {@code in} operator, tuple unpacking in
 * {@code for}) surface as {@link TemplateEngineException}.
 */
public final class PebbleTemplateEngine implements TemplateEngine {
    private final PebbleEngine engine;

    public PebbleTemplateEngine() {
        this.engine = new PebbleEngine.Builder()
            .cacheActive(false)
            .autoEscaping(false)
            .strictVariables(false)
            .newLineTrimming(false)
            .extension(new SqlFilterExtension())
            .extension(ReferenceCollector.extension())
            .build();
    }

    @Override
    public List<VariableReference> references(String template) {
        Objects.requireNonNull(template, "template");
        String source = JinjaSyntax.toPebble(template);
        List<VariableReference> references = ReferenceCollector.collect(() -> compile(source));
        Set<String> loopVariables = JinjaSyntax.loopVariables(template);
        if (loopVariables.isEmpty()) {
            return references;
        }
        List<VariableReference> inputs = new ArrayList<>();
        for (VariableReference reference : references) {
            String root = reference.name();
            int dot = root.indexOf('.');
            if (dot >= 0) {
                root = root.substring(0, dot);
            }
            if (!loopVariables.contains(root)) {
                inputs.add(reference);
            }
        }
        return inputs;
    }

    @Override
    public void validate(String template) {
        Objects.requireNonNull(template, "template");
        compile(JinjaSyntax.toPebble(template));
    }

    @Override
    public String render(String template, Map<String, Object> context) {
        Objects.requireNonNull(template, "template");
        Map<String, Object> safeContext = context == null ? Map.of() : context;
        PebbleTemplate compiled = compile(JinjaSyntax.toPebble(template));
        try (Writer writer = new StringWriter()) {
            compiled.evaluate(writer, safeContext);
            return writer.toString();
        } catch (PebbleException | IOException ex) {
            throw new TemplateEngineException("Failed to render template: " + ex.getMessage(), ex);
        }
    }

    private PebbleTemplate compile(String source) {
        try {
            return engine.getLiteralTemplate(source);
        } catch (PebbleException ex) {
            throw new TemplateEngineException("Invalid template syntax: " + ex.getMessage(), ex);
        }
    }
}
