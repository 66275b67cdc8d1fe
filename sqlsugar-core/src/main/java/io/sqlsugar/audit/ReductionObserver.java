package io.sqlsugar.audit;

import io.sqlsugar.template.ConditionalBlock;
import io.sqlsugar.template.Decision;
import io.sqlsugar.template.ProcessingResult;

/**
 * 区块化简观察器。
 * <p>
 * 用于监听条件区块的判定过程，便于实现日志、审计等横切能力。各回调均提供默认空实现，按需覆盖即可。
 * <p>
 * 回调顺序（正常情况下）：每个区块先触发 {@link #beforeBlock}，随后每个被求值的分支条件触发一次
 * {@link #onDecision}；整个模板处理完成后触发一次 {@link #afterReduce}。
 * 嵌套区块在其所在分支被保留后才会被处理。
 */
public interface ReductionObserver {
    /**
     * 区块开始处理前回调。
     *
     * @param block 即将处理的区块
     */
    default void beforeBlock(ConditionalBlock block) {
    }

    /**
     * 每产生一条判定时回调。
     *
     * @param block    判定所属区块
     * @param decision 判定结果
     */
    default void onDecision(ConditionalBlock block, Decision decision) {
    }

    /**
     * 整个模板化简完成后回调。
     *
     * @param template     原始模板
     * @param result       化简结果
     * @param elapsedNanos 耗时（纳秒）
     */
    default void afterReduce(String template, ProcessingResult result, long elapsedNanos) {
    }
}
