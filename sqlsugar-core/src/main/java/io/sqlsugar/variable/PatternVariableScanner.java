package io.sqlsugar.variable;

import io.sqlsugar.engine.VariableReference;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于正则的变量扫描，不依赖模板引擎。
 * <p>
 * 扫描 {@code {{ expr }}} 以及 if / elif / for / set 语句中的表达式。表达式按引号外的 {@code |}
 * 拆分为基础表达式与过滤器链，过滤器参数（如 {@code truncate(10)}）只保留过滤器名。
 * 关键字、字面量、测试名（{@code is defined}）、函数名以及循环变量和 set 赋值的局部变量都会被排除。
 */
public final class PatternVariableScanner {
    private static final Pattern TAG = Pattern.compile("\\{\\{-?(.+?)-?}}|\\{%-?\\s*(\\w+)(.*?)-?%}", Pattern.DOTALL);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*");
    private static final Pattern FOR_CLAUSE = Pattern.compile("^\\s*([\\w\\s,]+?)\\s+in\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern SET_CLAUSE = Pattern.compile("^\\s*([\\w\\s,]+?)\\s*=(?!=)(.*)$", Pattern.DOTALL);
    private static final Set<String> KEYWORDS = Set.of(
        "and", "or", "not", "in", "is", "if", "else", "elif", "for", "endfor", "endif", "set", "recursive",
        "true", "false", "none", "null", "True", "False", "None", "defined", "undefined"
    );

    private PatternVariableScanner() {
    }

    public static List<VariableReference> scan(String template) {
        Objects.requireNonNull(template, "template");
        Scan scan = new Scan();
        Matcher matcher = TAG.matcher(template);
        while (matcher.find()) {
            if (matcher.group(1) != null) {
                scan.expression(matcher.group(1));
                continue;
            }
            String keyword = matcher.group(2);
            String body = matcher.group(3);
            switch (keyword) {
                case "if", "elif" -> scan.expression(body);
                case "for" -> scan.forClause(body);
                case "set" -> scan.setClause(body);
                default -> {
                    // else, endif, endfor, macros and the like carry no inputs
                }
            }
        }
        return scan.result();
    }

    /**
     * Caps a dotted name at one dot: {@code a.b.c} becomes {@code a.b}.
     */
    public static String truncate(String name) {
        int first = name.indexOf('.');
        if (first < 0) {
            return name;
        }
        int second = name.indexOf('.', first + 1);
        return second < 0 ? name : name.substring(0, second);
    }

    private static final class Scan {
        private final Map<String, Set<String>> references = new LinkedHashMap<>();
        private final Set<String> locals = new HashSet<>();

        private void forClause(String body) {
            Matcher matcher = FOR_CLAUSE.matcher(body);
            if (!matcher.matches()) {
                expression(body);
                return;
            }
            for (String target : matcher.group(1).split(",")) {
                locals.add(target.trim());
            }
            locals.add("loop");
            expression(matcher.group(2));
        }

        private void setClause(String body) {
            Matcher matcher = SET_CLAUSE.matcher(body);
            if (!matcher.matches()) {
                return;
            }
            expression(matcher.group(2));
            for (String target : matcher.group(1).split(",")) {
                locals.add(target.trim());
            }
        }

        private void expression(String text) {
            List<String> segments = splitFilters(text);
            String base = segments.get(0).trim();
            List<String> filters = new ArrayList<>();
            for (int i = 1; i < segments.size(); i++) {
                String segment = segments.get(i).trim();
                Matcher name = IDENTIFIER.matcher(segment);
                if (!name.lookingAt()) {
                    continue;
                }
                filters.add(name.group());
                identifiers(segment.substring(name.end()));
            }
            if (IDENTIFIER.matcher(base).matches() && !KEYWORDS.contains(base)) {
                record(base, filters);
            } else {
                identifiers(base);
            }
        }

        private void identifiers(String text) {
            String masked = maskQuoted(text);
            Matcher matcher = IDENTIFIER.matcher(masked);
            while (matcher.find()) {
                String name = matcher.group();
                if (KEYWORDS.contains(name)) {
                    continue;
                }
                if (matcher.start() > 0) {
                    char previous = masked.charAt(matcher.start() - 1);
                    if (previous == '.' || Character.isLetterOrDigit(previous)) {
                        continue;
                    }
                }
                if (nextNonSpace(masked, matcher.end()) == '(') {
                    // method call: the receiver is the input, a bare name is a function
                    int dot = name.lastIndexOf('.');
                    if (dot > 0) {
                        record(name.substring(0, dot), List.of());
                    }
                    continue;
                }
                if (isTestName(masked, matcher.start())) {
                    continue;
                }
                record(name, List.of());
            }
        }

        private void record(String name, List<String> filters) {
            String root = name.indexOf('.') < 0 ? name : name.substring(0, name.indexOf('.'));
            if (locals.contains(root)) {
                return;
            }
            references.computeIfAbsent(truncate(name), key -> new LinkedHashSet<>()).addAll(filters);
        }

        private List<VariableReference> result() {
            List<VariableReference> result = new ArrayList<>();
            for (Map.Entry<String, Set<String>> entry : references.entrySet()) {
                result.add(new VariableReference(entry.getKey(), new ArrayList<>(entry.getValue())));
            }
            return result;
        }
    }

    /**
     * Splits on '|' outside quotes and parentheses. The first element is the base expression.
     */
    private static List<String> splitFilters(String text) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = '\0';
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != '\0') {
                if (ch == quote) {
                    quote = '\0';
                }
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '(' || ch == '[') {
                depth++;
            } else if (ch == ')' || ch == ']') {
                depth--;
            } else if (ch == '|' && depth == 0) {
                segments.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(ch);
        }
        segments.add(current.toString());
        return segments;
    }

    private static String maskQuoted(String text) {
        StringBuilder out = new StringBuilder(text.length());
        char quote = '\0';
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote == '\0') {
                if (ch == '\'' || ch == '"') {
                    quote = ch;
                }
                out.append(ch);
            } else if (ch == quote) {
                quote = '\0';
                out.append(ch);
            } else {
                out.append(' ');
            }
        }
        return out.toString();
    }

    private static char nextNonSpace(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return text.charAt(i);
            }
        }
        return '\0';
    }

    /**
     * Whether the word at {@code start} follows {@code is} or {@code is not}, i.e. names a test.
     */
    private static boolean isTestName(String text, int start) {
        String before = text.substring(0, start).stripTrailing();
        return before.endsWith(" is") || before.equals("is")
            || before.endsWith(" is not") || before.equals("is not");
    }
}
