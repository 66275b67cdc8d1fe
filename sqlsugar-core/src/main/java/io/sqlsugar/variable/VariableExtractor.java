package io.sqlsugar.variable;

import io.sqlsugar.condition.EvaluationContext;
import io.sqlsugar.engine.TemplateEngine;
import io.sqlsugar.engine.TemplateEngineException;
import io.sqlsugar.engine.VariableReference;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 变量提取，三级回退，先成功者生效：
 * <ol>
 *   <li>结构化：由模板引擎解析语法树并遍历节点；抛出异常或未发现变量时进入下一级。</li>
 *   <li>校验后正则扫描：先做语法校验（失败只记录日志），再做正则扫描，最后对每个变量按其演示值试渲染。</li>
 *   <li>纯正则扫描：未配置模板引擎时使用。</li>
 * </ol>
 * 所有层级的变量名最多保留一个点，重复引用合并，过滤器按首次出现顺序累积。
 */
public final class VariableExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(VariableExtractor.class);

    private final TemplateEngine engine;
    private final TypeInference typeInference;

    public VariableExtractor(TemplateEngine engine, TypeInference typeInference) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.typeInference = Objects.requireNonNull(typeInference, "typeInference");
    }

    private VariableExtractor(TypeInference typeInference) {
        this.engine = null;
        this.typeInference = Objects.requireNonNull(typeInference, "typeInference");
    }

    public static VariableExtractor patternOnly(TypeInference typeInference) {
        return new VariableExtractor(typeInference);
    }

    public List<VariableDescriptor> extract(String template) {
        Objects.requireNonNull(template, "template");
        if (engine == null) {
            return describe(PatternVariableScanner.scan(template), ExtractionMethod.PATTERN);
        }
        List<VariableDescriptor> structural = structural(template);
        if (!structural.isEmpty()) {
            return structural;
        }
        return validatedPattern(template);
    }

    private List<VariableDescriptor> structural(String template) {
        List<VariableReference> references;
        try {
            references = engine.references(template);
        } catch (TemplateEngineException ex) {
            LOGGER.debug("Structural extraction unavailable, falling back to pattern scan: {}", ex.getMessage());
            return List.of();
        }
        if (references.isEmpty()) {
            LOGGER.debug("Structural extraction found no variables, falling back to pattern scan");
        }
        return describe(merge(references), ExtractionMethod.STRUCTURAL);
    }

    private List<VariableDescriptor> validatedPattern(String template) {
        try {
            engine.validate(template);
        } catch (TemplateEngineException ex) {
            LOGGER.warn("Template syntax check failed, variables are pattern-scanned: {}", ex.getMessage());
        }
        List<VariableDescriptor> scanned = describe(PatternVariableScanner.scan(template), ExtractionMethod.PATTERN);
        List<VariableDescriptor> validated = new ArrayList<>(scanned.size());
        for (VariableDescriptor descriptor : scanned) {
            validated.add(testRender(descriptor));
        }
        return validated;
    }

    private VariableDescriptor testRender(VariableDescriptor descriptor) {
        StringBuilder probe = new StringBuilder("{{ ").append(descriptor.name());
        for (String filter : descriptor.filters()) {
            probe.append(" | ").append(filter);
        }
        probe.append(" }}");
        Map<String, Object> context = EvaluationContext.of(descriptor.name(), descriptor.defaultValue()).nestedView();
        try {
            engine.render(probe.toString(), context);
            return descriptor.withValidation(ExtractionMethod.VALIDATED_PATTERN, true, null);
        } catch (TemplateEngineException ex) {
            LOGGER.debug("Test render of {} failed: {}", descriptor.name(), ex.getMessage());
            return descriptor.withValidation(ExtractionMethod.VALIDATED_PATTERN, false, ex.getMessage());
        }
    }

    private List<VariableReference> merge(List<VariableReference> references) {
        Map<String, Set<String>> merged = new LinkedHashMap<>();
        for (VariableReference reference : references) {
            merged.computeIfAbsent(PatternVariableScanner.truncate(reference.name()), key -> new LinkedHashSet<>())
                .addAll(reference.filters());
        }
        List<VariableReference> result = new ArrayList<>(merged.size());
        for (Map.Entry<String, Set<String>> entry : merged.entrySet()) {
            result.add(new VariableReference(entry.getKey(), new ArrayList<>(entry.getValue())));
        }
        return result;
    }

    private List<VariableDescriptor> describe(List<VariableReference> references, ExtractionMethod method) {
        List<VariableDescriptor> descriptors = new ArrayList<>(references.size());
        for (VariableReference reference : references) {
            descriptors.add(typeInference.describe(reference.name(), reference.filters(), method));
        }
        return descriptors;
    }
}
