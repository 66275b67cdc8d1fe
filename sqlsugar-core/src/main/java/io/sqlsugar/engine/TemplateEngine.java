package io.sqlsugar.engine;

import java.util.List;
import java.util.Map;

/**
 * 模板引擎协作者：提供语法树遍历、语法校验与渲染。
 * <p>
 * 只被变量提取与校验使用，区块化简从不调用它。失败统一以 {@link TemplateEngineException} 抛出。
 */
public interface TemplateEngine {
    /**
     * Walks the parsed template and returns every variable reference in first-seen order.
     * Attribute lookups come back as one dotted name; filters applied to a reference are attached to it.
     */
    List<VariableReference> references(String template);

    void validate(String template);

    String render(String template, Map<String, Object> context);
}
