package io.sqlsugar.engine;

import io.pebbletemplates.pebble.extension.AbstractExtension;
import io.pebbletemplates.pebble.extension.AbstractNodeVisitor;
import io.pebbletemplates.pebble.extension.NodeVisitorFactory;
import io.pebbletemplates.pebble.node.Node;
import io.pebbletemplates.pebble.node.expression.BinaryExpression;
import io.pebbletemplates.pebble.node.expression.ContextVariableExpression;
import io.pebbletemplates.pebble.node.expression.Expression;
import io.pebbletemplates.pebble.node.expression.FilterExpression;
import io.pebbletemplates.pebble.node.expression.FilterInvocationExpression;
import io.pebbletemplates.pebble.node.expression.FunctionOrMacroInvocationExpression;
import io.pebbletemplates.pebble.node.expression.GetAttributeExpression;
import io.pebbletemplates.pebble.node.expression.LiteralStringExpression;
import io.pebbletemplates.pebble.node.expression.UnaryExpression;
import io.pebbletemplates.pebble.template.PebbleTemplateImpl;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Node visitor that records variable references while Pebble compiles a template.
 * <p>
 * Pebble runs registered node visitors once per compiled template, so references are handed back
 * through a thread-bound sink that {@link #collect} opens around the compile call.
 */
final class ReferenceCollector extends AbstractNodeVisitor {
    private static final ThreadLocal<Map<String, Set<String>>> SINK = new ThreadLocal<>();

    private final Map<String, Set<String>> references;

    private ReferenceCollector(PebbleTemplateImpl template, Map<String, Set<String>> references) {
        super(template);
        this.references = references;
    }

    /**
     * Runs {@code compile} with a fresh sink and returns what the visitor recorded during it.
     */
    static List<VariableReference> collect(Runnable compile) {
        Map<String, Set<String>> references = new LinkedHashMap<>();
        SINK.set(references);
        try {
            compile.run();
        } finally {
            SINK.remove();
        }
        List<VariableReference> result = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : references.entrySet()) {
            result.add(new VariableReference(entry.getKey(), new ArrayList<>(entry.getValue())));
        }
        return result;
    }

    static AbstractExtension extension() {
        return new AbstractExtension() {
            @Override
            public List<NodeVisitorFactory> getNodeVisitors() {
                return List.of(template -> {
                    Map<String, Set<String>> references = SINK.get();
                    return new ReferenceCollector(
                        (PebbleTemplateImpl) template,
                        references == null ? new LinkedHashMap<>() : references
                    );
                });
            }
        };
    }

    /**
     * Expressions are not dispatched to dedicated overloads, they all arrive here.
     */
    @Override
    public void visit(Node node) {
        if (node instanceof ContextVariableExpression variable) {
            record(variable.getName(), List.of());
        } else if (node instanceof GetAttributeExpression attribute) {
            visitAttribute(attribute, List.of());
        } else if (node instanceof FilterExpression filter) {
            visitFilterChain(filter);
        } else if (node instanceof FunctionOrMacroInvocationExpression function) {
            if (function.getArguments() != null) {
                function.getArguments().accept(this);
            }
        } else if (node instanceof BinaryExpression<?> binary) {
            accept(binary.getLeftExpression());
            accept(binary.getRightExpression());
        } else if (node instanceof UnaryExpression unary) {
            accept(unary.getChildExpression());
        }
    }

    private void visitFilterChain(FilterExpression outer) {
        List<String> filters = new ArrayList<>();
        Expression<?> current = outer;
        while (current instanceof FilterExpression filter) {
            if (filter.getRightExpression() instanceof FilterInvocationExpression invocation) {
                filters.add(0, invocation.getFilterName());
                if (invocation.getArgs() != null) {
                    invocation.getArgs().accept(this);
                }
            }
            current = filter.getLeftExpression();
        }
        if (current instanceof ContextVariableExpression variable) {
            record(variable.getName(), filters);
        } else if (current instanceof GetAttributeExpression attribute) {
            visitAttribute(attribute, filters);
        } else {
            accept(current);
        }
    }

    private void visitAttribute(GetAttributeExpression attribute, List<String> filters) {
        String path = attributePath(attribute);
        if (path != null) {
            record(path, filters);
            return;
        }
        accept(attribute.getNode());
    }

    /**
     * {@code base.attr} as one dotted name, or null when the lookup is not a plain property chain.
     */
    private String attributePath(GetAttributeExpression attribute) {
        if (!(attribute.getAttributeNameExpression() instanceof LiteralStringExpression literal)) {
            return null;
        }
        Object name = literal.evaluate(getTemplate(), null);
        Expression<?> base = attribute.getNode();
        if (base instanceof ContextVariableExpression variable) {
            return variable.getName() + "." + name;
        }
        if (base instanceof GetAttributeExpression nested) {
            String prefix = attributePath(nested);
            return prefix == null ? null : prefix + "." + name;
        }
        return null;
    }

    private void accept(Expression<?> expression) {
        if (expression != null) {
            expression.accept(this);
        }
    }

    private void record(String name, List<String> filters) {
        references.computeIfAbsent(name, key -> new LinkedHashSet<>()).addAll(filters);
    }
}
