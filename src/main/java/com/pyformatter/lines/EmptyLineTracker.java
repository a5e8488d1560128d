package com.pyformatter.lines;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.Preview;
import com.pyformatter.tree.Leaf;

/**
 * Decides how many blank lines go before and after each logical line.
 * <p>
 * Lines are fed in output order; each call returns a {@link LinesBlock} whose {@code before}
 * count may still be raised later when a definition follows a leading comment.
 */
public class EmptyLineTracker {
    private static final Set<String> DEPENDENT_CLAUSE_EXCLUSIONS =
            Set.of("with", "try", "for", "while", "if", "match");

    private final FormatOptions options;
    private Line previousLine;
    private LinesBlock previousBlock;
    private final Deque<Integer> previousDefs = new ArrayDeque<>();
    private LinesBlock semanticLeadingComment;

    public EmptyLineTracker(FormatOptions options) {
        this.options = options;
    }

    /**
     * The blank lines around one logical line, plus the rendered lines it expanded into.
     */
    public static class LinesBlock {
        private final LinesBlock previousBlock;
        private final Line originalLine;
        private int before;
        private int after;
        private final boolean formFeed;
        private final List<String> contentLines = new ArrayList<>();

        LinesBlock(LinesBlock previousBlock, Line originalLine, int before, int after, boolean formFeed) {
            this.previousBlock = previousBlock;
            this.originalLine = originalLine;
            this.before = before;
            this.after = after;
            this.formFeed = formFeed;
        }

        public LinesBlock getPreviousBlock() {
            return previousBlock;
        }

        public Line getOriginalLine() {
            return originalLine;
        }

        public int getBefore() {
            return before;
        }

        public int getAfter() {
            return after;
        }

        public void setAfter(int after) {
            this.after = after;
        }

        public boolean hasFormFeed() {
            return formFeed;
        }

        public List<String> getContentLines() {
            return contentLines;
        }

        public void addContent(String renderedLine) {
            contentLines.add(renderedLine);
        }

        /**
         * Blank lines before, the content lines and blank lines after, joined.
         */
        public String render() {
            StringBuilder out = new StringBuilder();
            if (formFeed && before > 0) {
                out.append("\n".repeat(before - 1)).append("\f\n");
            } else {
                out.append("\n".repeat(Math.max(0, before)));
            }
            for (String line : contentLines) {
                out.append(line);
            }
            out.append("\n".repeat(after));
            return out.toString();
        }
    }

    public LinesBlock maybeEmptyLines(Line currentLine) {
        boolean formFeed = false;
        if (!currentLine.isEmpty()) {
            String prefix = currentLine.getLeaves().get(0).getPrefix();
            formFeed = currentLine.getDepth() == 0 && prefix.indexOf('\f') >= 0;
        }
        int before;
        int after;
        if (previousLine == null) {
            consumeFirstLeafNewlines(currentLine, maxAllowed(currentLine));
            before = 0;
            after = 0;
            if (currentLine.isDef() || currentLine.isClass()) {
                previousDefs.push(currentLine.getDepth());
            }
        } else {
            int[] counts = computeEmptyLines(currentLine);
            before = counts[0] - previousBlock.after;
            after = counts[1];
        }
        if (previousBlock != null && previousBlock.previousBlock == null
                && previousBlock.originalLine.getLeaves().size() == 1
                && previousBlock.originalLine.isTripleQuotedString()
                && !(currentLine.isClass() || currentLine.isDef())) {
            before = 1;
        }
        before = Math.max(0, before);

        LinesBlock block = new LinesBlock(previousBlock, currentLine, before, after, formFeed);
        if (currentLine.isComment()) {
            if (previousLine == null
                    || (!previousLine.isDecorator() && (semanticLeadingComment == null || before > 0))) {
                semanticLeadingComment = block;
            }
        } else if (!currentLine.isDecorator()) {
            semanticLeadingComment = null;
        }
        previousLine = currentLine;
        previousBlock = block;
        return block;
    }

    private int maxAllowed(Line line) {
        if (line.getDepth() == 0) {
            return options.isPyi() ? 1 : 2;
        }
        return 1;
    }

    private int consumeFirstLeafNewlines(Line line, int maxAllowed) {
        if (line.isEmpty()) {
            return 0;
        }
        Leaf first = line.getLeaves().get(0);
        int newlines = 0;
        String prefix = first.getPrefix();
        for (int i = 0; i < prefix.length(); i++) {
            if (prefix.charAt(i) == '\n') {
                newlines++;
            }
        }
        first.setPrefix("");
        return Math.min(newlines, maxAllowed);
    }

    private int[] computeEmptyLines(Line currentLine) {
        int before = consumeFirstLeafNewlines(currentLine, maxAllowed(currentLine));
        int userBefore = before;
        int depth = currentLine.getDepth();
        while (!previousDefs.isEmpty() && previousDefs.peek() >= depth) {
            int definitionDepth = previousDefs.pop();
            if (options.isPyi()) {
                before = depth > 0 ? 0 : 1;
            } else if (depth > 0) {
                before = 1;
            } else if (definitionDepth > 0 && currentLine.opensBlock()
                    && !DEPENDENT_CLAUSE_EXCLUSIONS.contains(currentLine.getLeaves().get(0).getValue())) {
                // an else/except following a conditionally defined function
                before = 1;
            } else {
                before = 2;
            }
        }
        if (currentLine.isDecorator() || currentLine.isDef() || currentLine.isClass()) {
            return new int[] {emptyLinesForClassOrDef(currentLine, before, userBefore), 0};
        }
        if (previousLine.isImport() && !currentLine.isImport() && depth == previousLine.getDepth()) {
            if (options.isPreview(Preview.ALWAYS_ONE_NEWLINE_AFTER_IMPORT) && depth == 0) {
                return new int[] {1, 0};
            }
            return new int[] {Math.max(before, 1), 0};
        }
        if (previousLine.isClass() && currentLine.isTripleQuotedString()) {
            return new int[] {0, 1};
        }
        if (previousLine.opensBlock()) {
            return new int[] {0, 0};
        }
        return new int[] {before, 0};
    }

    private int emptyLinesForClassOrDef(Line currentLine, int before, int userBefore) {
        if (!currentLine.isDecorator()) {
            previousDefs.push(currentLine.getDepth());
        }
        if (previousLine.isDecorator()) {
            return 0;
        }
        if (previousLine.getDepth() < currentLine.getDepth()
                && (previousLine.isClass() || previousLine.isDef())) {
            return 0;
        }
        LinesBlock commentToAddNewlines = null;
        if (previousLine.isComment() && previousLine.getDepth() == currentLine.getDepth() && before == 0) {
            LinesBlock leading = semanticLeadingComment;
            if (leading != null && leading.previousBlock != null
                    && !leading.previousBlock.originalLine.isClass()
                    && !leading.previousBlock.originalLine.opensBlock()
                    && leading.before <= 1) {
                commentToAddNewlines = leading;
            } else {
                return 0;
            }
        }

        int newlines;
        if (options.isPyi()) {
            newlines = pyiEmptyLines(currentLine, userBefore);
        } else {
            newlines = currentLine.getDepth() > 0 ? 1 : 2;
            if (previousLine.isStubDef() && (currentLine.isDef() || currentLine.isDecorator())
                    && previousLine.getDepth() == currentLine.getDepth() && userBefore == 0) {
                // consecutive overload stubs stay together
                newlines = 0;
            }
        }
        if (commentToAddNewlines != null && newlines > 0) {
            LinesBlock beforeComment = commentToAddNewlines.previousBlock;
            commentToAddNewlines.before = Math.max(commentToAddNewlines.before, newlines) - beforeComment.after;
            newlines = 0;
        }
        return newlines;
    }

    private int pyiEmptyLines(Line currentLine, int userBefore) {
        int depth = currentLine.getDepth();
        if (currentLine.isClass() || previousLine.isClass()) {
            if (previousLine.isStubClass() && currentLine.isClass() && depth == previousLine.getDepth()) {
                return depth > 0 ? 0 : Math.min(1, userBefore);
            }
            return depth > 0 ? 0 : 1;
        }
        if ((currentLine.isDef() || currentLine.isDecorator()) && !previousLine.isDef()) {
            if (depth > 0) {
                // attributes and methods keep the user's separation
                return Math.min(1, userBefore);
            }
            return 1;
        }
        if (depth > 0) {
            return 0;
        }
        return Math.min(1, userBefore);
    }
}
