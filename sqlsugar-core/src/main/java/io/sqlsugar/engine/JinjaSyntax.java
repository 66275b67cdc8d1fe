package io.sqlsugar.engine;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the Jinja spellings Pebble does not understand. Only the inside of tags is touched and
 * quoted literals inside a tag are left alone.
 */
final class JinjaSyntax {
    private static final Pattern TAG = Pattern.compile("\\{\\{.*?}}|\\{%.*?%}", Pattern.DOTALL);
    private static final Pattern WORD = Pattern.compile("\\b(elif|None|True|False)\\b");
    private static final Pattern FOR_TARGETS = Pattern.compile(
        "\\{%-?\\s*for\\s+([A-Za-z_][A-Za-z0-9_]*)(?:\\s*,\\s*([A-Za-z_][A-Za-z0-9_]*))?\\s+in\\s"
    );
    private static final Map<String, String> REPLACEMENTS = Map.of(
        "elif", "elseif",
        "None", "null",
        "True", "true",
        "False", "false"
    );

    private JinjaSyntax() {
    }

    static String toPebble(String template) {
        Matcher matcher = TAG.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        int last = 0;
        while (matcher.find()) {
            out.append(template, last, matcher.start());
            out.append(rewriteTag(matcher.group()));
            last = matcher.end();
        }
        out.append(template, last, template.length());
        return out.toString();
    }

    /**
     * Names bound by {@code for} tags; they are loop locals, not template inputs.
     */
    static Set<String> loopVariables(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = FOR_TARGETS.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
            if (matcher.group(2) != null) {
                names.add(matcher.group(2));
            }
        }
        if (!names.isEmpty()) {
            names.add("loop");
        }
        return names;
    }

    private static String rewriteTag(String tag) {
        StringBuilder out = new StringBuilder(tag.length());
        StringBuilder plain = new StringBuilder();
        char quote = '\0';
        for (int i = 0; i < tag.length(); i++) {
            char ch = tag.charAt(i);
            if (quote == '\0' && (ch == '\'' || ch == '"')) {
                out.append(rewriteWords(plain));
                plain.setLength(0);
                quote = ch;
                out.append(ch);
            } else if (quote != '\0') {
                out.append(ch);
                if (ch == '\\' && i + 1 < tag.length()) {
                    out.append(tag.charAt(++i));
                } else if (ch == quote) {
                    quote = '\0';
                }
            } else {
                plain.append(ch);
            }
        }
        out.append(rewriteWords(plain));
        return out.toString();
    }

    private static String rewriteWords(CharSequence text) {
        Matcher matcher = WORD.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, REPLACEMENTS.get(matcher.group(1)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
