package io.sqlsugar.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the outermost conditional blocks of a template.
 * <p>
 * The template is cut into directive tags and the text between them. A tag never spans physical
 * lines, but any number of tags may share one line. Nesting is tracked with a depth counter; at
 * depth zero {@code elif} and {@code else} close the running branch and the balancing
 * {@code endif} closes the block. Stray {@code elif}/{@code else}/{@code endif} tags outside any
 * block are left as text.
 */
public final class BlockScanner {
    private static final Pattern TAG = Pattern.compile("\\{%(-?)\\s*(if|elif|else|endif)\\b(.*?)(-?)%}");

    private BlockScanner() {
    }

    public static List<ConditionalBlock> scan(String template) {
        Objects.requireNonNull(template, "template");
        List<Tag> tags = tags(template);
        List<ConditionalBlock> blocks = new ArrayList<>();
        int index = 0;
        while (index < tags.size()) {
            Tag tag = tags.get(index);
            if (tag.kind() != Kind.IF) {
                index++;
                continue;
            }
            BlockBuilder builder = new BlockBuilder(template, tag);
            index = builder.consume(tags, index + 1);
            blocks.add(builder.build());
        }
        return blocks;
    }

    /**
     * Whether the template still carries any conditional directive, balanced or not.
     */
    public static boolean hasDirectives(String template) {
        return TAG.matcher(template).find();
    }

    private static List<Tag> tags(String template) {
        List<Tag> tags = new ArrayList<>();
        Matcher matcher = TAG.matcher(template);
        while (matcher.find()) {
            Kind kind = Kind.valueOf(matcher.group(2).toUpperCase(Locale.ROOT));
            String argument = matcher.group(3).trim();
            if ((kind == Kind.ELSE || kind == Kind.ENDIF) && !argument.isEmpty()) {
                continue;
            }
            tags.add(new Tag(
                kind,
                argument,
                matcher.start(),
                matcher.end(),
                !matcher.group(1).isEmpty(),
                !matcher.group(4).isEmpty()
            ));
        }
        return tags;
    }

    private enum Kind {
        IF,
        ELIF,
        ELSE,
        ENDIF
    }

    /**
     * @param start     offset of the opening brace
     * @param end       offset just past the closing brace
     * @param trimLeft  leading dash marker, whitespace before the tag is dropped
     * @param trimRight trailing dash marker, whitespace after the tag is dropped
     */
    private record Tag(Kind kind, String argument, int start, int end, boolean trimLeft, boolean trimRight) {
    }

    private static final class BlockBuilder {
        private final String template;
        private final Tag opening;
        private final List<ElifBranch> elifBranches = new ArrayList<>();
        private String content;
        private String elseContent;
        private Tag branchTag;
        private int endOffset = -1;

        private BlockBuilder(String template, Tag opening) {
            this.template = template;
            this.opening = opening;
            this.branchTag = opening;
        }

        /**
         * Consumes tags up to the balancing endif and returns the index after it.
         */
        private int consume(List<Tag> tags, int from) {
            int depth = 0;
            for (int i = from; i < tags.size(); i++) {
                Tag tag = tags.get(i);
                switch (tag.kind()) {
                    case IF -> depth++;
                    case ENDIF -> {
                        if (depth == 0) {
                            closeBranch(tag);
                            endOffset = tag.end() - 1;
                            return i + 1;
                        }
                        depth--;
                    }
                    case ELIF, ELSE -> {
                        if (depth == 0 && branchTag.kind() != Kind.ELSE) {
                            closeBranch(tag);
                            branchTag = tag;
                        }
                    }
                    default -> throw new IllegalStateException("Unknown tag " + tag.kind());
                }
            }
            throw new UnterminatedBlockException(opening.argument(), opening.start());
        }

        private void closeBranch(Tag closing) {
            String body = template.substring(branchTag.end(), closing.start());
            if (branchTag.trimRight()) {
                body = body.stripLeading();
            }
            if (closing.trimLeft()) {
                body = body.stripTrailing();
            }
            switch (branchTag.kind()) {
                case IF -> content = body;
                case ELIF -> elifBranches.add(new ElifBranch(branchTag.argument(), body));
                case ELSE -> elseContent = body;
                default -> throw new IllegalStateException("Unexpected branch " + branchTag.kind());
            }
        }

        private ConditionalBlock build() {
            return new ConditionalBlock(
                opening.argument(),
                content,
                elifBranches,
                elseContent,
                opening.start(),
                endOffset
            );
        }
    }
}
