package io.sqlsugar.condition;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 条件表达式解析树。
 * <p>
 * 封闭的五种节点：存在性检查、比较、成员检查、逻辑组合与变量真值检查。
 * 节点不可变，每次求值时重新解析生成，除树形结构外没有身份语义。
 */
public sealed interface ParsedCondition permits ParsedCondition.ExistenceCheck, ParsedCondition.Comparison,
    ParsedCondition.Membership, ParsedCondition.Logical, ParsedCondition.VariableCheck {

    enum ExistenceOperator {
        EXISTS,
        NOT_EXISTS
    }

    enum ComparisonOperator {
        EQ("=="),
        NE("!="),
        GE(">="),
        LE("<="),
        GT(">"),
        LT("<");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum MembershipOperator {
        IN("in"),
        NOT_IN("not in");

        private final String keyword;

        MembershipOperator(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    enum LogicalOperator {
        AND,
        OR;

        public String keyword() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    record ExistenceCheck(String variable, ExistenceOperator operator) implements ParsedCondition {
        public ExistenceCheck {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(operator, "operator");
        }
    }

    record Comparison(String left, ComparisonOperator operator, String right) implements ParsedCondition {
        public Comparison {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }
    }

    record Membership(String variable, MembershipOperator operator, String target) implements ParsedCondition {
        public Membership {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(target, "target");
        }
    }

    record Logical(List<ParsedCondition> operands, List<LogicalOperator> operators) implements ParsedCondition {
        public Logical {
            operands = List.copyOf(operands);
            operators = List.copyOf(operators);
            if (operands.isEmpty()) {
                throw new IllegalArgumentException("Logical condition requires operands");
            }
            if (operators.size() != operands.size() - 1) {
                throw new IllegalArgumentException(
                    "Logical condition has " + operands.size() + " operands but " + operators.size() + " operators"
                );
            }
        }
    }

    /**
     * 兜底节点：整个条件文本被视为一个变量名，按真值规则判断。
     */
    record VariableCheck(String variable) implements ParsedCondition {
        public VariableCheck {
            Objects.requireNonNull(variable, "variable");
        }
    }
}
