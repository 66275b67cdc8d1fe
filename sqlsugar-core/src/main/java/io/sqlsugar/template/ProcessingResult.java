package io.sqlsugar.template;

import java.util.List;
import java.util.Objects;

/**
 * 区块化简结果。嵌套区块的偏移相对于其所在分支的内容，而不是原始模板。
 *
 * @param reducedTemplate 去除全部条件指令后的模板
 * @param removedBlocks   整体被删除的区块，按处理顺序（含嵌套区块）
 * @param keptBlocks      保留了某个分支的区块，按处理顺序（含嵌套区块）
 * @param decisions       按处理顺序记录的判定，仅用于审计
 */
public record ProcessingResult(
    String reducedTemplate,
    List<ConditionalBlock> removedBlocks,
    List<ConditionalBlock> keptBlocks,
    List<Decision> decisions
) {
    public ProcessingResult {
        Objects.requireNonNull(reducedTemplate, "reducedTemplate");
        removedBlocks = List.copyOf(removedBlocks);
        keptBlocks = List.copyOf(keptBlocks);
        decisions = List.copyOf(decisions);
    }
}
