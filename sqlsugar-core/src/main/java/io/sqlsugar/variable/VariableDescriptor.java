package io.sqlsugar.variable;

import java.util.List;
import java.util.Objects;

/**
 * 模板中一个去重后的变量引用及其推断信息。
 *
 * @param name             变量名，最多包含一个点，例如 {@code user.id}
 * @param type             按名称推断的类型
 * @param defaultValue     演示值
 * @param required         名称是否暗示必填
 * @param filters          依次出现过的过滤器，去重且保持首次出现顺序
 * @param extractionMethod 产生该描述的提取方式
 * @param valid            试渲染是否成功；未试渲染时为 true
 * @param validationError  试渲染失败原因，成功时为 null
 */
public record VariableDescriptor(
    String name,
    VariableType type,
    Object defaultValue,
    boolean required,
    List<String> filters,
    ExtractionMethod extractionMethod,
    boolean valid,
    String validationError
) {
    public VariableDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(extractionMethod, "extractionMethod");
        filters = List.copyOf(filters);
    }

    public VariableDescriptor withValidation(ExtractionMethod method, boolean valid, String validationError) {
        return new VariableDescriptor(name, type, defaultValue, required, filters, method, valid, validationError);
    }
}
