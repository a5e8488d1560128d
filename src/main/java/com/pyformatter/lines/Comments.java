package com.pyformatter.lines;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;

/**
 * Extracts comments from leaf prefixes.
 */
public final class Comments {

    public static final Set<String> FMT_OFF = Set.of("# fmt: off", "# fmt:off", "# yapf: disable");
    public static final Set<String> FMT_ON = Set.of("# fmt: on", "# fmt:on", "# yapf: enable");
    public static final Set<String> FMT_SKIP = Set.of("# fmt: skip", "# fmt:skip");

    private static final String COMMENT_NO_SPACE_AFTER = "!:#'";

    /** Subtypes of comments. */
    public enum Kind {
        SHEBANG,
        DOC_COMMENT,
        SECTION_BANNER,
        ORDINARY
    }

    /**
     * A comment found in a prefix, before it becomes a leaf.
     */
    public static final class ProtoComment {
        private final TokenType type;
        private final String value;
        private final int newlines;
        private final int start;
        private final int consumed;
        private final boolean formFeed;

        ProtoComment(TokenType type, String value, int newlines, int start, int consumed, boolean formFeed) {
            this.type = type;
            this.value = value;
            this.newlines = newlines;
            this.start = start;
            this.consumed = consumed;
            this.formFeed = formFeed;
        }

        /** COMMENT for a trailing comment, STANDALONE_COMMENT for one on its own line. */
        public TokenType getType() {
            return type;
        }

        public String getValue() {
            return value;
        }

        /** Blank lines directly before the comment. */
        public int getNewlines() {
            return newlines;
        }

        /** Offset of the comment's line in the prefix. */
        public int getStart() {
            return start;
        }

        /** Prefix characters up to and including the comment's line end. */
        public int getConsumed() {
            return consumed;
        }

        public boolean hasFormFeed() {
            return formFeed;
        }

        public boolean isStandalone() {
            return type == TokenType.STANDALONE_COMMENT;
        }

        public Kind getKind() {
            if (value.startsWith("#!")) {
                return Kind.SHEBANG;
            }
            if (value.startsWith("#:")) {
                return Kind.DOC_COMMENT;
            }
            String body = value.substring(1).trim();
            if (body.length() >= 3 && (body.chars().allMatch(c -> c == '-') || body.chars().allMatch(c -> c == '=')
                    || body.chars().allMatch(c -> c == '#'))) {
                return Kind.SECTION_BANNER;
            }
            return Kind.ORDINARY;
        }

        /**
         * Creates the leaf that carries this comment on a line.
         */
        public Leaf toLeaf() {
            String prefix = "\n".repeat(newlines) + (formFeed ? "\f" : "");
            return new Leaf(type, value, prefix, 0, 0);
        }
    }

    private Comments() {
    }

    /**
     * Lists the comments in {@code prefix}. The first comment is a trailing one when it sits on
     * the same line as the preceding token, except in the prefix of the end marker.
     */
    public static List<ProtoComment> listComments(String prefix, boolean isEndmarker) {
        if (prefix.isEmpty() || prefix.indexOf('#') < 0) {
            return Collections.emptyList();
        }
        List<ProtoComment> result = new ArrayList<>();
        int consumed = 0;
        int newlines = 0;
        int ignoredLines = 0;
        boolean formFeed = false;
        String[] lines = prefix.split("\n", -1);
        for (int index = 0; index < lines.length; index++) {
            String raw = lines[index];
            int lineStart = consumed;
            consumed += raw.length() + 1;
            String line = stripLeading(raw);
            if (line.isEmpty()) {
                newlines++;
                if (raw.indexOf('\f') >= 0) {
                    formFeed = true;
                }
            }
            if (!line.startsWith("#")) {
                if (line.endsWith("\\")) {
                    ignoredLines++;
                }
                continue;
            }
            TokenType type = index == ignoredLines && !isEndmarker
                    ? TokenType.COMMENT
                    : TokenType.STANDALONE_COMMENT;
            result.add(new ProtoComment(type, makeComment(line), newlines, lineStart,
                    Math.min(consumed, prefix.length()), formFeed));
            newlines = 0;
            formFeed = false;
        }
        return result;
    }

    /**
     * Text of {@code prefix} after its last comment line.
     */
    public static String afterComments(String prefix, boolean isEndmarker) {
        List<ProtoComment> comments = listComments(prefix, isEndmarker);
        if (comments.isEmpty()) {
            return prefix;
        }
        return prefix.substring(comments.get(comments.size() - 1).getConsumed());
    }

    /**
     * Normalizes comment text: trailing whitespace is removed and a space is put after the hash
     * unless the comment is a shebang, a doc comment or a comment of hashes.
     */
    public static String makeComment(String content) {
        String text = stripTrailing(content);
        if (text.isEmpty()) {
            return "#";
        }
        if (text.charAt(0) == '#') {
            text = text.substring(1);
        }
        if (!text.isEmpty() && text.charAt(0) == '\u00a0' && !text.strip().startsWith("type:")) {
            text = " " + text.substring(1);
        }
        if (!text.isEmpty() && text.charAt(0) != ' ' && COMMENT_NO_SPACE_AFTER.indexOf(text.charAt(0)) < 0) {
            text = " " + text;
        }
        return "#" + text;
    }

    public static boolean containsFmtSkip(String comment) {
        return FMT_SKIP.contains(comment);
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t' || s.charAt(i) == '\f'
                || s.charAt(i) == '\u000b')) {
            i++;
        }
        return s.substring(i);
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }
}
