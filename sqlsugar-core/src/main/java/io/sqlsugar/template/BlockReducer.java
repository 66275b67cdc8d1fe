package io.sqlsugar.template;

import io.sqlsugar.audit.ReductionObserver;
import io.sqlsugar.condition.ConditionParseException;
import io.sqlsugar.condition.ConditionParser;
import io.sqlsugar.condition.Evaluation;
import io.sqlsugar.condition.EvaluationContext;
import io.sqlsugar.condition.ParsedCondition;
import io.sqlsugar.condition.TruthyEvaluator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 按上下文消解模板中的条件区块，删除不会被渲染的分支。
 * <p>
 * 区块从模板末尾向开头依次处理，前面区块的偏移在改写后面区块时保持有效。单个区块的处理规则：
 * <ol>
 *   <li>依次解析 if / elif 条件；解析失败时保守地保留该分支。</li>
 *   <li>条件引用的变量（变量检查、存在性检查、比较左值，逻辑组合逐个展开）若不在上下文中，
 *       整个区块直接删除，优先于真值判断。</li>
 *   <li>第一个为真的分支被保留；全部为假时保留 else 分支；没有 else 则删除整个区块。</li>
 * </ol>
 * 被保留的分支内容会按同一上下文继续递归消解，因此结果中不再含有条件指令。
 * <p>
 * 实例不可变，可在线程间共享。
 */
public final class BlockReducer {
    private final List<ReductionObserver> observers;

    public BlockReducer() {
        this(List.of());
    }

    public BlockReducer(List<ReductionObserver> observers) {
        this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
    }

    /**
     * @throws UnterminatedBlockException if an {@code if} has no balancing {@code endif}
     */
    public ProcessingResult reduce(String template, EvaluationContext context) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(context, "context");
        long start = System.nanoTime();
        Pass pass = new Pass(context);
        String reduced = pass.reduceText(template);
        ProcessingResult result = new ProcessingResult(reduced, pass.removed, pass.kept, pass.decisions);
        notifyAfterReduce(template, result, start);
        return result;
    }

    private void notifyBeforeBlock(ConditionalBlock block) {
        for (ReductionObserver observer : observers) {
            observer.beforeBlock(block);
        }
    }

    private void notifyDecision(ConditionalBlock block, Decision decision) {
        for (ReductionObserver observer : observers) {
            observer.onDecision(block, decision);
        }
    }

    private void notifyAfterReduce(String template, ProcessingResult result, long start) {
        long elapsed = System.nanoTime() - start;
        for (ReductionObserver observer : observers) {
            observer.afterReduce(template, result, elapsed);
        }
    }

    /**
     * State of one {@link #reduce} call.
     */
    private final class Pass {
        private final EvaluationContext context;
        private final List<Decision> decisions = new ArrayList<>();
        private final List<ConditionalBlock> removed = new ArrayList<>();
        private final List<ConditionalBlock> kept = new ArrayList<>();

        private Pass(EvaluationContext context) {
            this.context = context;
        }

        private String reduceText(String text) {
            List<ConditionalBlock> blocks = BlockScanner.scan(text);
            if (blocks.isEmpty()) {
                return text;
            }
            StringBuilder out = new StringBuilder(text);
            for (int i = blocks.size() - 1; i >= 0; i--) {
                ConditionalBlock block = blocks.get(i);
                String replacement = resolve(block);
                out.replace(block.startOffset(), block.endOffset() + 1, replacement);
            }
            return out.toString();
        }

        private String resolve(ConditionalBlock block) {
            notifyBeforeBlock(block);
            List<ElifBranch> branches = new ArrayList<>();
            branches.add(new ElifBranch(block.condition(), block.content()));
            branches.addAll(block.elifBranches());
            for (ElifBranch branch : branches) {
                ParsedCondition parsed;
                try {
                    parsed = ConditionParser.parse(branch.condition());
                } catch (ConditionParseException ex) {
                    record(block, Decision.keep(branch.condition(), "unparseable condition, kept: " + ex.getMessage()));
                    kept.add(block);
                    return reduceText(branch.content());
                }
                List<String> absent = TruthyEvaluator.absentVariables(parsed, context);
                if (!absent.isEmpty()) {
                    record(block, Decision.remove(branch.condition(), "missing variable: " + String.join(", ", absent)));
                    removed.add(block);
                    return "";
                }
                Evaluation evaluation = TruthyEvaluator.evaluate(parsed, context);
                if (evaluation.value()) {
                    record(block, Decision.keep(branch.condition(), evaluation.details()));
                    kept.add(block);
                    return reduceText(branch.content());
                }
                record(block, Decision.remove(branch.condition(), evaluation.details()));
            }
            if (block.hasElse()) {
                record(block, Decision.keep("else", "no preceding condition was true"));
                kept.add(block);
                return reduceText(block.elseContent());
            }
            removed.add(block);
            return "";
        }

        private void record(ConditionalBlock block, Decision decision) {
            decisions.add(decision);
            notifyDecision(block, decision);
        }
    }
}
