package io.sqlsugar.template;

import java.util.List;
import java.util.Objects;

/**
 * 模板中一个最外层的 {@code {% if %} ... {% endif %}} 区块。
 * <p>
 * {@code startOffset}/{@code endOffset} 为字符偏移，均为闭区间，覆盖从 if 标签首字符到 endif 标签末字符的完整区块；
 * 嵌套区块原样保留在各分支内容中，不单独列出。
 *
 * @param condition    if 分支的条件文本
 * @param content      if 分支内容
 * @param elifBranches elif 分支，按出现顺序
 * @param elseContent  else 分支内容，没有 else 时为 null
 * @param startOffset  区块首字符偏移
 * @param endOffset    区块末字符偏移
 */
public record ConditionalBlock(
    String condition,
    String content,
    List<ElifBranch> elifBranches,
    String elseContent,
    int startOffset,
    int endOffset
) {
    public ConditionalBlock {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(content, "content");
        elifBranches = List.copyOf(elifBranches);
        if (startOffset < 0 || endOffset <= startOffset) {
            throw new IllegalArgumentException("Invalid block span: [" + startOffset + ", " + endOffset + "]");
        }
    }

    public boolean hasElse() {
        return elseContent != null;
    }

    public boolean hasElif() {
        return !elifBranches.isEmpty();
    }

    /**
     * Length of the enclosed region, i.e. {@code endOffset - startOffset + 1}.
     */
    public int length() {
        return endOffset - startOffset + 1;
    }
}
