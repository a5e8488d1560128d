package com.pyformatter.split;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.pyformatter.api.Feature;
import com.pyformatter.lines.BracketTracker;
import com.pyformatter.lines.Line;
import com.pyformatter.lines.Priorities;
import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.NodeType;

/**
 * Splits a bracket body at every delimiter of its highest priority, one element per line.
 * When the split is at commas a trailing comma is added, unless a {@code *args} or
 * {@code **kwargs} element sits where the target versions do not accept one.
 */
public class DelimiterSplit implements SplitStrategy {

    private static final Set<NodeType> DEF_ARGS = Set.of(NodeType.TYPEDARGSLIST);
    private static final Set<NodeType> CALL_ARGS = Set.of(NodeType.ARGLIST, NodeType.ARGUMENT);

    @Override
    public String getName() {
        return "delimiter_split";
    }

    @Override
    public List<Line> split(Line line, Set<Feature> features) throws CannotSplitException {
        List<Leaf> leaves = line.getLeaves();
        if (leaves.isEmpty()) {
            throw new CannotSplitException("Line empty");
        }
        Leaf lastLeaf = leaves.get(leaves.size() - 1);
        BracketTracker tracker = line.getBracketTracker();
        int delimiter = tracker.maxDelimiterPriority(lastLeaf);
        if (delimiter == 0) {
            throw new CannotSplitException("No delimiters found");
        }
        if (delimiter == Priorities.DOT && tracker.delimiterCountWithPriority(delimiter) == 1) {
            throw new CannotSplitException("Splitting a single attribute from its parent looks wrong");
        }

        LineCollector collector = new LineCollector(line);
        int lowestDepth = Integer.MAX_VALUE;
        boolean trailingCommaSafe = true;
        int lastNonCommentIndex = lastNonCommentLeaf(line);
        for (int index = 0; index < leaves.size(); index++) {
            Leaf leaf = leaves.get(index);
            collector.add(leaf);
            for (Leaf comment : line.commentsAfter(leaf)) {
                collector.add(comment);
            }

            lowestDepth = Math.min(leaf.getBracketDepth(), lowestDepth);
            if (leaf.getBracketDepth() == lowestDepth) {
                if (Priorities.isVararg(leaf, DEF_ARGS)) {
                    trailingCommaSafe = trailingCommaSafe && features.contains(Feature.TRAILING_COMMA_IN_DEF);
                } else if (Priorities.isVararg(leaf, CALL_ARGS)) {
                    trailingCommaSafe = trailingCommaSafe && features.contains(Feature.TRAILING_COMMA_IN_CALL);
                }
            }

            if (lastLeaf.is(TokenType.STANDALONE_COMMENT) && index == lastNonCommentIndex) {
                addTrailingComma(trailingCommaSafe, delimiter, collector.current());
            }

            if (tracker.priorityOf(leaf) == delimiter) {
                collector.startNewLine();
            }
        }
        if (!collector.current().isEmpty()) {
            addTrailingComma(trailingCommaSafe, delimiter, collector.current());
        }
        return collector.finish();
    }

    private static void addTrailingComma(boolean safe, int delimiter, Line line) {
        List<Leaf> leaves = line.getLeaves();
        if (!safe || delimiter != Priorities.COMMA || leaves.isEmpty()) {
            return;
        }
        Leaf last = leaves.get(leaves.size() - 1);
        if (!last.isOp(",") && !last.is(TokenType.STANDALONE_COMMENT)) {
            line.append(new Leaf(TokenType.OP, ","));
        }
    }

    private static int lastNonCommentLeaf(Line line) {
        List<Leaf> leaves = line.getLeaves();
        for (int i = leaves.size() - 1; i > 0; i--) {
            if (!leaves.get(i).is(TokenType.STANDALONE_COMMENT)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Accumulates leaves into lines at the depth of the line being split, starting a new line
     * whenever a leaf cannot join the current one.
     */
    static final class LineCollector {
        private final Line original;
        private final List<Line> result = new ArrayList<>();
        private Line current;

        LineCollector(Line original) {
            this.original = original;
            this.current = newLine();
        }

        Line current() {
            return current;
        }

        void add(Leaf leaf) {
            try {
                current.appendSafe(leaf, true);
            } catch (IllegalArgumentException e) {
                result.add(current);
                current = newLine();
                current.append(leaf);
            }
        }

        void startNewLine() {
            result.add(current);
            current = newLine();
        }

        /**
         * The collected lines, each with the leading whitespace of its first leaf removed.
         */
        List<Line> finish() {
            if (!current.isEmpty()) {
                result.add(current);
            }
            List<Line> lines = new ArrayList<>();
            for (Line line : result) {
                if (!line.isEmpty()) {
                    line.getLeaves().get(0).setPrefix("");
                    lines.add(line);
                }
            }
            return lines;
        }

        private Line newLine() {
            return new Line(original.getOptions(), original.getDepth(), original.isInsideBrackets());
        }
    }
}
