package io.sqlsugar.condition;

import io.sqlsugar.condition.ParsedCondition.Comparison;
import io.sqlsugar.condition.ParsedCondition.ComparisonOperator;
import io.sqlsugar.condition.ParsedCondition.ExistenceCheck;
import io.sqlsugar.condition.ParsedCondition.ExistenceOperator;
import io.sqlsugar.condition.ParsedCondition.Logical;
import io.sqlsugar.condition.ParsedCondition.LogicalOperator;
import io.sqlsugar.condition.ParsedCondition.Membership;
import io.sqlsugar.condition.ParsedCondition.MembershipOperator;
import io.sqlsugar.condition.ParsedCondition.VariableCheck;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the condition of an {@code {% if %}} / {@code {% elif %}} directive.
 * <p>
 * Recognizers are tried in a fixed order and the first match wins: existence check, comparison,
 * membership, logical chain, and finally a bare variable check. There is no precedence climbing and
 * no parenthesised grouping; {@code and}/{@code or} chains are kept flat and evaluated left to right.
 * A condition that carries a top-level {@code and}/{@code or} is always split first, so the first
 * three recognizers only ever see a single operand. Whatever reaches the fallback becomes a
 * {@link VariableCheck} on the trimmed text, so {@code not x} or {@code x is defined} are looked up as names.
 * {@link ConditionParseException} is raised only for an empty condition, an unterminated string literal
 * or a missing operand.
 */
public final class ConditionParser {
    private static final Pattern LOGICAL_SPLIT = Pattern.compile("\\s+(and|or)\\s+");
    private static final Pattern EXISTS = Pattern.compile("^(.+?)\\s+is\\s+not\\s+(?:None|none|null)$");
    private static final Pattern NOT_EXISTS = Pattern.compile("^(.+?)\\s+is\\s+(?:None|none|null)$");
    private static final Pattern NOT_IN = Pattern.compile("\\s+not\\s+in\\s+");
    private static final Pattern IN = Pattern.compile("\\s+in\\s+");
    private static final String[] COMPARISON_SYMBOLS = {"==", "!=", ">=", "<=", ">", "<"};

    private final String input;
    private final String masked;

    private ConditionParser(String input) {
        this.input = input;
        this.masked = maskQuoted(input);
    }

    public static ParsedCondition parse(String condition) {
        Objects.requireNonNull(condition, "condition");
        return new ConditionParser(condition.trim()).parseCondition();
    }

    private ParsedCondition parseCondition() {
        if (input.isEmpty()) {
            throw new ConditionParseException("Empty condition", input);
        }
        if (hasLogicalConnective()) {
            return parseLogical();
        }
        ParsedCondition existence = parseExistence();
        if (existence != null) {
            return existence;
        }
        ParsedCondition comparison = parseComparison();
        if (comparison != null) {
            return comparison;
        }
        ParsedCondition membership = parseMembership();
        if (membership != null) {
            return membership;
        }
        return new VariableCheck(input);
    }

    private boolean hasLogicalConnective() {
        return masked.contains(" and ") || masked.contains(" or ");
    }

    private ParsedCondition parseExistence() {
        Matcher exists = EXISTS.matcher(masked);
        if (exists.matches()) {
            return new ExistenceCheck(operand(exists.start(1), exists.end(1)), ExistenceOperator.EXISTS);
        }
        Matcher notExists = NOT_EXISTS.matcher(masked);
        if (notExists.matches()) {
            return new ExistenceCheck(operand(notExists.start(1), notExists.end(1)), ExistenceOperator.NOT_EXISTS);
        }
        return null;
    }

    private ParsedCondition parseComparison() {
        for (int i = 0; i < masked.length(); i++) {
            for (String symbol : COMPARISON_SYMBOLS) {
                if (masked.startsWith(symbol, i)) {
                    String left = operand(0, i);
                    String right = operand(i + symbol.length(), input.length());
                    return new Comparison(left, comparisonOperator(symbol), right);
                }
            }
        }
        return null;
    }

    private ParsedCondition parseMembership() {
        Matcher notIn = NOT_IN.matcher(masked);
        Matcher in = IN.matcher(masked);
        boolean hasNotIn = notIn.find();
        boolean hasIn = in.find();
        if (!hasNotIn && !hasIn) {
            return null;
        }
        if (hasNotIn && (!hasIn || notIn.start() <= in.start())) {
            return new Membership(
                operand(0, notIn.start()),
                MembershipOperator.NOT_IN,
                operand(notIn.end(), input.length())
            );
        }
        return new Membership(operand(0, in.start()), MembershipOperator.IN, operand(in.end(), input.length()));
    }

    private ParsedCondition parseLogical() {
        List<ParsedCondition> operands = new ArrayList<>();
        List<LogicalOperator> operators = new ArrayList<>();
        Matcher matcher = LOGICAL_SPLIT.matcher(masked);
        int start = 0;
        while (matcher.find()) {
            operands.add(parse(operand(start, matcher.start())));
            operators.add(LogicalOperator.valueOf(matcher.group(1).toUpperCase(Locale.ROOT)));
            start = matcher.end();
        }
        operands.add(parse(operand(start, input.length())));
        return new Logical(operands, operators);
    }

    private String operand(int start, int end) {
        String value = input.substring(start, end).trim();
        if (value.isEmpty()) {
            throw new ConditionParseException("Missing operand at position " + start, input);
        }
        return value;
    }

    private ComparisonOperator comparisonOperator(String symbol) {
        for (ComparisonOperator operator : ComparisonOperator.values()) {
            if (operator.symbol().equals(symbol)) {
                return operator;
            }
        }
        throw new ConditionParseException("Unknown comparison operator " + symbol, input);
    }

    /**
     * Replaces the characters inside quoted literals with '_' so that operators and keywords
     * found in the mask are guaranteed to sit outside any string literal. Offsets are preserved.
     */
    private static String maskQuoted(String input) {
        StringBuilder out = new StringBuilder(input.length());
        char quote = '\0';
        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);
            if (quote == '\0') {
                if (ch == '\'' || ch == '"') {
                    quote = ch;
                }
                out.append(ch);
                continue;
            }
            if (ch == '\\' && i + 1 < input.length()) {
                out.append("__");
                i++;
                continue;
            }
            if (ch == quote) {
                quote = '\0';
                out.append(ch);
                continue;
            }
            out.append('_');
        }
        if (quote != '\0') {
            throw new ConditionParseException("Unterminated string literal", input);
        }
        return out.toString();
    }
}
