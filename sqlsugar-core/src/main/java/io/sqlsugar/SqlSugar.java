package io.sqlsugar;

import io.sqlsugar.audit.ReductionObserver;
import io.sqlsugar.condition.ConditionParseException;
import io.sqlsugar.condition.ConditionParser;
import io.sqlsugar.condition.EvaluationContext;
import io.sqlsugar.condition.ParsedCondition;
import io.sqlsugar.condition.TruthyEvaluator;
import io.sqlsugar.engine.PebbleTemplateEngine;
import io.sqlsugar.engine.TemplateEngine;
import io.sqlsugar.engine.TemplateEngineException;
import io.sqlsugar.template.BlockReducer;
import io.sqlsugar.template.BlockScanner;
import io.sqlsugar.template.ConditionalBlock;
import io.sqlsugar.template.ElifBranch;
import io.sqlsugar.template.ProcessingResult;
import io.sqlsugar.template.UnterminatedBlockException;
import io.sqlsugar.variable.TypeInference;
import io.sqlsugar.variable.VariableDescriptor;
import io.sqlsugar.variable.VariableExtractor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

public final class SqlSugar {
    private static final Pattern DEEP_PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z0-9_]+){2,}");

    private final TemplateEngine engine;
    private final TypeInference typeInference;
    private final VariableExtractor extractor;
    private final BlockReducer reducer;

    private SqlSugar(TemplateEngine engine, TypeInference typeInference, List<ReductionObserver> observers) {
        this.engine = engine;
        this.typeInference = typeInference;
        this.extractor = engine == null
            ? VariableExtractor.patternOnly(typeInference)
            : new VariableExtractor(engine, typeInference);
        this.reducer = new BlockReducer(observers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * An instance without a template engine: extraction falls straight to the pattern scan.
     */
    public static SqlSugar patternOnly() {
        return builder().withoutEngine().build();
    }

    public List<VariableDescriptor> extractVariables(String template) {
        return extractor.extract(template);
    }

    /**
     * Context binding every extracted variable to its demo value.
     * <p>
     * 提取结果中的名字最多保留一个点，而条件按完整名字查找，所以条件里出现的 {@code a.b.c}
     * 这类更深的路径也按完整名字绑定一份演示值，否则对应区块会被当作缺失变量删除。
     *
     * @throws UnterminatedBlockException if an {@code if} has no balancing {@code endif}
     */
    public EvaluationContext demoContext(String template) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (VariableDescriptor descriptor : extractVariables(template)) {
            values.put(descriptor.name(), descriptor.defaultValue());
        }
        bindDeepConditionPaths(template, values);
        return EvaluationContext.from(values);
    }

    private void bindDeepConditionPaths(String text, Map<String, Object> values) {
        for (ConditionalBlock block : BlockScanner.scan(text)) {
            List<ElifBranch> branches = new ArrayList<>();
            branches.add(new ElifBranch(block.condition(), block.content()));
            branches.addAll(block.elifBranches());
            for (ElifBranch branch : branches) {
                bindDeepPaths(branch.condition(), values);
                bindDeepConditionPaths(branch.content(), values);
            }
            if (block.hasElse()) {
                bindDeepConditionPaths(block.elseContent(), values);
            }
        }
    }

    private void bindDeepPaths(String condition, Map<String, Object> values) {
        ParsedCondition parsed;
        try {
            parsed = ConditionParser.parse(condition);
        } catch (ConditionParseException ex) {
            // the reducer keeps unparseable branches without looking anything up
            return;
        }
        for (String name : TruthyEvaluator.absentVariables(parsed, EvaluationContext.from(values))) {
            if (DEEP_PATH.matcher(name).matches()) {
                values.put(name, typeInference.defaultValue(name, typeInference.infer(name)));
            }
        }
    }

    public ProcessingResult reduce(String template) {
        return reduce(template, demoContext(template));
    }

    public ProcessingResult reduce(String template, Map<String, ?> context) {
        Objects.requireNonNull(context, "context");
        return reduce(template, EvaluationContext.from(context));
    }

    /**
     * @throws UnterminatedBlockException if an {@code if} has no balancing {@code endif}
     */
    public ProcessingResult reduce(String template, EvaluationContext context) {
        return reducer.reduce(template, context);
    }

    public TemplateValidation validate(String template) {
        Objects.requireNonNull(template, "template");
        List<String> errors = new ArrayList<>();
        try {
            BlockScanner.scan(template);
        } catch (UnterminatedBlockException ex) {
            errors.add(ex.getMessage());
        }
        if (engine != null) {
            try {
                engine.validate(template);
            } catch (TemplateEngineException ex) {
                errors.add(ex.getMessage());
            }
        }
        return TemplateValidation.of(errors);
    }

    public Optional<TemplateEngine> engine() {
        return Optional.ofNullable(engine);
    }

    public TypeInference typeInference() {
        return typeInference;
    }

    public static final class Builder {
        private TemplateEngine engine;
        private boolean engineDisabled;
        private TypeInference typeInference = TypeInference.defaults();
        private List<ReductionObserver> observers = List.of();

        private Builder() {
        }

        // 模板引擎：默认使用 Pebble，用于结构化变量提取与语法校验。
        public Builder engine(TemplateEngine engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
            this.engineDisabled = false;
            return this;
        }

        public Builder withoutEngine() {
            this.engine = null;
            this.engineDisabled = true;
            return this;
        }

        // 类型推断：自定义规则优先于内置规则。
        public Builder typeInference(TypeInference typeInference) {
            this.typeInference = Objects.requireNonNull(typeInference, "typeInference");
            return this;
        }

        public Builder observers(List<ReductionObserver> observers) {
            this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
            return this;
        }

        public SqlSugar build() {
            TemplateEngine finalEngine = engine;
            if (finalEngine == null && !engineDisabled) {
                finalEngine = new PebbleTemplateEngine();
            }
            return new SqlSugar(finalEngine, typeInference, observers);
        }
    }
}
