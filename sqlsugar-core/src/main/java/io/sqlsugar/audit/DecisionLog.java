package io.sqlsugar.audit;

import io.sqlsugar.template.ConditionalBlock;
import io.sqlsugar.template.Decision;
import io.sqlsugar.template.ProcessingResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.LoggerFactory;

/**
 * 区块判定日志观察器。
 * <p>
 * 作为 {@link ReductionObserver} 的实现，在每个条件被求值时输出一行可读日志，例如：
 * <pre>
 * JINJA: [REMOVE] user.active | user.active = false (falsy)
 * </pre>
 * 通过 {@link Builder} 配置，构建后为不可变对象，线程安全。默认输出到 SLF4J。
 */
public final class DecisionLog implements ReductionObserver {
    private final boolean enabled;
    private final boolean includeReason;
    private final boolean includeSummary;
    private final boolean includeElapsed;
    private final String prefix;
    private final Consumer<String> sink;

    private DecisionLog(Builder builder) {
        this.enabled = builder.enabled;
        this.includeReason = builder.includeReason;
        this.includeSummary = builder.includeSummary;
        this.includeElapsed = builder.includeElapsed;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void onDecision(ConditionalBlock block, Decision decision) {
        if (!enabled) {
            return;
        }
        sink.accept(format(decision));
    }

    @Override
    public void afterReduce(String template, ProcessingResult result, long elapsedNanos) {
        if (!enabled || !includeSummary && !includeElapsed) {
            return;
        }
        List<String> parts = new ArrayList<>();
        if (includeSummary) {
            parts.add("kept=" + result.keptBlocks().size());
            parts.add("removed=" + result.removedBlocks().size());
            parts.add("decisions=" + result.decisions().size());
        }
        if (includeElapsed) {
            parts.add("elapsed=" + elapsedNanos + "ns");
        }
        sink.accept(prefix + " " + String.join(", ", parts));
    }

    private String format(Decision decision) {
        String line = prefix + " [" + decision.action().name() + "] " + decision.condition();
        if (!includeReason) {
            return line;
        }
        return line + " | " + decision.reason();
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean includeReason = true;
        private boolean includeSummary = false;
        private boolean includeElapsed = false;
        private String prefix = "JINJA:";
        private Consumer<String> sink = LoggerFactory.getLogger(DecisionLog.class)::info;

        /**
         * 全局开关：关闭后不输出任何日志。
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * 是否输出判定理由。
         */
        public Builder includeReason(boolean enabled) {
            this.includeReason = enabled;
            return this;
        }

        /**
         * 是否在模板处理完成后输出保留/删除区块数。
         */
        public Builder includeSummary(boolean enabled) {
            this.includeSummary = enabled;
            return this;
        }

        /**
         * 是否输出整体耗时（纳秒）。
         */
        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        public Builder prefix(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.prefix = prefix;
            return this;
        }

        /**
         * 设置日志输出目标，默认写入 SLF4J 的 INFO 级别。
         */
        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public DecisionLog build() {
            return new DecisionLog(this);
        }
    }
}
