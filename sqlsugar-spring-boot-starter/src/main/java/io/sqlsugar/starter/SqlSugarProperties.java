package io.sqlsugar.starter;

import io.sqlsugar.audit.DecisionLog;
import io.sqlsugar.variable.TypeInference;
import io.sqlsugar.variable.TypeRule;
import io.sqlsugar.variable.VariableType;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for SQL Sugar.
 * <p>
 * Configure these properties under the "sqlsugar" prefix in application.yml:
 * <pre>{@code
 * sqlsugar:
 *   engine:
 *     enabled: true
 *   decision-log:
 *     enabled: true
 *     prefix: "JINJA:"
 *     include-reason: true
 *   type-inference:
 *     custom-rules:
 *       - name: tenant
 *         pattern: "^tenant"
 *         type: NUMBER
 * }</pre>
 */
@ConfigurationProperties(prefix = "sqlsugar")
public class SqlSugarProperties {

    private EngineProperties engine = new EngineProperties();
    private DecisionLogProperties decisionLog = new DecisionLogProperties();
    private TypeInferenceProperties typeInference = new TypeInferenceProperties();

    public EngineProperties getEngine() {
        return engine;
    }

    public void setEngine(EngineProperties engine) {
        this.engine = engine;
    }

    public DecisionLogProperties getDecisionLog() {
        return decisionLog;
    }

    public void setDecisionLog(DecisionLogProperties decisionLog) {
        this.decisionLog = decisionLog;
    }

    public TypeInferenceProperties getTypeInference() {
        return typeInference;
    }

    public void setTypeInference(TypeInferenceProperties typeInference) {
        this.typeInference = typeInference;
    }

    public static class EngineProperties {
        /**
         * false 时不创建模板引擎，变量提取只走正则扫描。
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class DecisionLogProperties {
        private boolean enabled = true;
        private boolean includeReason = true;
        private boolean includeSummary = false;
        private boolean includeElapsed = false;
        private String prefix = "JINJA:";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isIncludeReason() {
            return includeReason;
        }

        public void setIncludeReason(boolean includeReason) {
            this.includeReason = includeReason;
        }

        public boolean isIncludeSummary() {
            return includeSummary;
        }

        public void setIncludeSummary(boolean includeSummary) {
            this.includeSummary = includeSummary;
        }

        public boolean isIncludeElapsed() {
            return includeElapsed;
        }

        public void setIncludeElapsed(boolean includeElapsed) {
            this.includeElapsed = includeElapsed;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public DecisionLog build(Consumer<String> logger) {
            if (!enabled) {
                return null;
            }
            return DecisionLog.builder()
                .includeReason(includeReason)
                .includeSummary(includeSummary)
                .includeElapsed(includeElapsed)
                .prefix(prefix)
                .sink(logger)
                .build();
        }
    }

    public static class TypeInferenceProperties {
        private List<RuleProperties> customRules = new ArrayList<>();

        public List<RuleProperties> getCustomRules() {
            return customRules;
        }

        public void setCustomRules(List<RuleProperties> customRules) {
            this.customRules = customRules;
        }

        public TypeInference build() {
            if (customRules.isEmpty()) {
                return TypeInference.defaults();
            }
            List<TypeRule> rules = new ArrayList<>(customRules.size());
            for (RuleProperties rule : customRules) {
                rules.add(rule.toRule());
            }
            return TypeInference.withRules(rules);
        }
    }

    public static class RuleProperties {
        private String name;
        private String pattern;
        private VariableType type = VariableType.STRING;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public VariableType getType() {
            return type;
        }

        public void setType(VariableType type) {
            this.type = type;
        }

        TypeRule toRule() {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("Type rule pattern must not be blank: " + name);
            }
            return TypeRule.of(name == null ? pattern : name, pattern, type);
        }
    }
}
