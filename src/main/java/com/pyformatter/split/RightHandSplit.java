package com.pyformatter.split;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.pyformatter.api.Feature;
import com.pyformatter.lines.BracketTracker;
import com.pyformatter.lines.Line;
import com.pyformatter.lines.Priorities;
import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.NodeType;
import com.pyformatter.tree.Trees;
import com.pyformatter.util.LoggerUtil;

/**
 * Splits a line at its last opening bracket: everything before it stays on the head line,
 * the bracket contents move to an indented body and the closing bracket starts the tail.
 * Trailing calls and subscripts may be skipped over (see {@link TrailerOmitter}), and
 * invisible parentheses are only shown when omitting them would read worse.
 */
public class RightHandSplit implements SplitStrategy {
    private static final Logger logger = LoggerUtil.getLogger(RightHandSplit.class);

    private final int lineLength;

    public RightHandSplit(int lineLength) {
        this.lineLength = lineLength;
    }

    @Override
    public String getName() {
        return "rhs";
    }

    /**
     * Tries the omit sets from {@link TrailerOmitter} in turn and keeps the first split whose
     * head fits; otherwise falls back to splitting at the very last bracket.
     */
    @Override
    public List<Line> split(Line line, Set<Feature> features) throws CannotSplitException {
        for (Set<Leaf> omit : TrailerOmitter.generate(line, lineLength)) {
            List<Line> lines = rightHandSplit(line, features, omit);
            if (LineTransformer.isLineShortEnough(lines.get(0), lineLength)) {
                return lines;
            }
        }
        return rightHandSplit(line, features, identitySet());
    }

    List<Line> rightHandSplit(Line line, Set<Feature> features, Set<Leaf> omit) throws CannotSplitException {
        Split split = firstSplit(line, omit);
        return maybeSplitOmittingOptionalParens(split, line, features, omit);
    }

    private Split firstSplit(Line line, Set<Leaf> omit) throws CannotSplitException {
        List<Leaf> tail = new ArrayList<>();
        List<Leaf> body = new ArrayList<>();
        List<Leaf> head = new ArrayList<>();
        List<Leaf> current = tail;
        Leaf openingBracket = null;
        Leaf closingBracket = null;
        List<Leaf> leaves = line.getLeaves();
        for (int i = leaves.size() - 1; i >= 0; i--) {
            Leaf leaf = leaves.get(i);
            if (current == body && leaf == openingBracket) {
                current = body.isEmpty() ? tail : head;
            }
            current.add(leaf);
            if (current == tail && leaf.isClosingBracket() && !omit.contains(leaf)) {
                openingBracket = leaf.getOpeningBracket();
                closingBracket = leaf;
                current = body;
            }
        }
        if (openingBracket == null || closingBracket == null || head.isEmpty()) {
            throw new CannotSplitException("No brackets found");
        }
        Collections.reverse(tail);
        Collections.reverse(body);
        Collections.reverse(head);
        return new Split(
                BracketSplitBuilder.build(head, line, openingBracket, BracketSplitBuilder.Component.HEAD),
                BracketSplitBuilder.build(body, line, openingBracket, BracketSplitBuilder.Component.BODY),
                BracketSplitBuilder.build(tail, line, openingBracket, BracketSplitBuilder.Component.TAIL),
                openingBracket, closingBracket);
    }

    private List<Line> maybeSplitOmittingOptionalParens(Split split, Line line, Set<Feature> features,
                                                        Set<Leaf> omit) throws CannotSplitException {
        if (!features.contains(Feature.FORCE_OPTIONAL_PARENTHESES)
                && split.openingBracket.isInvisible() && split.openingBracket.isLeftParen()
                && split.closingBracket.isInvisible() && split.closingBracket.isRightParen()
                && !line.isImport()
                && canOmitInvisibleParens(split)) {
            Set<Leaf> widerOmit = identitySet();
            widerOmit.addAll(omit);
            widerOmit.add(split.closingBracket);
            try {
                Split withoutParens = firstSplit(line, widerOmit);
                if (preferSplitWithoutParens(withoutParens, split)) {
                    return maybeSplitOmittingOptionalParens(withoutParens, line, features, widerOmit);
                }
            } catch (CannotSplitException e) {
                if (!(canBeSplit(split.body) || LineTransformer.isLineShortEnough(split.body, lineLength))) {
                    throw new CannotSplitException("Splitting failed after omitting optional parentheses.", e);
                }
                logger.log(Level.FINEST, "Keeping optional parentheses: " + e.getMessage());
            }
        }
        split.openingBracket.makeVisible();
        split.closingBracket.makeVisible();
        List<Line> result = new ArrayList<>();
        for (Line part : List.of(split.head, split.body, split.tail)) {
            if (!part.isEmpty()) {
                result.add(part);
            }
        }
        return result;
    }

    /**
     * Whether the split that skips the optional parentheses beats the one that shows them.
     * Showing them only wins for an assignment whose short, bracketed left side would otherwise
     * be split instead of its right side.
     */
    private boolean preferSplitWithoutParens(Split withoutParens, Split withParens) {
        List<Leaf> head = withParens.head.getLeaves();
        if (!(head.size() >= 2 && head.get(head.size() - 2).isOp("="))) {
            return true;
        }
        boolean leftSideHasBrackets = false;
        for (int i = 0; i < head.size() - 1; i++) {
            Leaf leaf = head.get(i);
            if (leaf.isOpeningBracket() || leaf.isClosingBracket()) {
                leftSideHasBrackets = true;
                break;
            }
        }
        if (!leftSideHasBrackets) {
            return true;
        }
        if (!LineTransformer.isLineShortEnough(withParens.head, lineLength - 1)) {
            return true;
        }
        if (withParens.head.getMagicTrailingComma() != null) {
            return true;
        }
        return splitsInsideRightSide(withoutParens);
    }

    private boolean splitsInsideRightSide(Split withoutParens) {
        List<Leaf> head = withoutParens.head.getLeaves();
        for (int i = head.size() - 1; i >= 0; i--) {
            Leaf leaf = head.get(i);
            if (leaf.isOp("=")) {
                break;
            }
            if (leaf.isClosingBracket()) {
                return true;
            }
        }
        boolean headHasAssignment = false;
        for (Leaf leaf : head) {
            if (leaf.isOp("=")) {
                headHasAssignment = true;
                break;
            }
        }
        return headHasAssignment && LineTransformer.isLineShortEnough(withoutParens.head, lineLength);
    }

    /**
     * Whether the body of {@code split} reads well without the optional parentheses around it.
     * Only answers yes for shapes that cannot end up producing lines that are too long.
     */
    boolean canOmitInvisibleParens(Split split) {
        Line line = split.body;
        List<Leaf> leaves = line.getLeaves();

        // standalone comments need the parentheses unless a nested bracket pair holds them
        Leaf closing = null;
        for (int i = leaves.size() - 1; i >= 0; i--) {
            Leaf leaf = leaves.get(i);
            if (closing != null && leaf == closing.getOpeningBracket()) {
                closing = null;
            }
            if (leaf.is(TokenType.STANDALONE_COMMENT) && closing == null) {
                return false;
            }
            if (closing == null && leaf.isClosingBracket() && leaves.contains(leaf.getOpeningBracket())
                    && !leaf.getValue().isEmpty()) {
                closing = leaf;
            }
        }

        BracketTracker tracker = line.getBracketTracker();
        if (tracker.getDelimiters().isEmpty()) {
            return true;
        }
        int maxPriority = tracker.maxDelimiterPriority();
        if (tracker.delimiterCountWithPriority(maxPriority) > 1) {
            return false;
        }
        if (maxPriority == Priorities.DOT) {
            return true;
        }
        if (leaves.size() < 2) {
            return false;
        }

        Leaf first = leaves.get(0);
        Leaf second = leaves.get(1);
        if (first.isOpeningBracket() && !second.isClosingBracket() && canOmitOpeningParen(line, first)) {
            return true;
        }

        Leaf penultimate = leaves.get(leaves.size() - 2);
        Leaf last = leaves.get(leaves.size() - 1);
        boolean lastIsUsableBracket = last.isOp(")") || last.isOp("}")
                || (last.isOp("]") && last.getParent() != null && !last.getParent().is(NodeType.TRAILER));
        if (lastIsUsableBracket) {
            if (penultimate.isOpeningBracket()) {
                return false;
            }
            if (Trees.isMultilineString(first)) {
                return true;
            }
            int length = 4 * line.getDepth();
            boolean seenOtherBrackets = false;
            List<Integer> lengths = LeafLengths.of(line);
            for (int i = 0; i < lengths.size(); i++) {
                Leaf leaf = leaves.get(i);
                length += lengths.get(i);
                if (leaf == last.getOpeningBracket()) {
                    if (seenOtherBrackets || length <= lineLength) {
                        return true;
                    }
                } else if (leaf.isOpeningBracket()) {
                    seenOtherBrackets = true;
                }
            }
        }
        return false;
    }

    private boolean canOmitOpeningParen(Line line, Leaf first) {
        boolean remainder = false;
        int length = 4 * line.getDepth();
        List<Leaf> leaves = line.getLeaves();
        List<Integer> lengths = LeafLengths.of(line);
        for (int i = 0; i < lengths.size(); i++) {
            Leaf leaf = leaves.get(i);
            if (leaf.isClosingBracket() && leaf.getOpeningBracket() == first) {
                remainder = true;
            }
            if (remainder) {
                length += lengths.get(i);
                if (length > lineLength) {
                    return false;
                }
                if (leaf.isOpeningBracket()) {
                    remainder = false;
                }
            }
        }
        return lengths.size() == leaves.size();
    }

    /**
     * False when the line certainly cannot be split: a single leaf, or a string followed by a
     * chain of attribute accesses and calls that has nothing to break on.
     */
    static boolean canBeSplit(Line line) {
        List<Leaf> leaves = line.getLeaves();
        if (leaves.size() < 2) {
            return false;
        }
        if (leaves.get(0).is(TokenType.STRING) && leaves.get(1).isOp(".")) {
            int callCount = 0;
            int dotCount = 0;
            Leaf next = leaves.get(leaves.size() - 1);
            for (int i = leaves.size() - 2; i >= 0; i--) {
                Leaf leaf = leaves.get(i);
                if (leaf.isOpeningBracket()) {
                    if (!next.isClosingBracket()) {
                        return false;
                    }
                    callCount++;
                } else if (leaf.isOp(".")) {
                    dotCount++;
                } else if (leaf.is(TokenType.NAME)) {
                    if (!(next.isOp(".") || next.isOpeningBracket())) {
                        return false;
                    }
                } else if (!leaf.isClosingBracket()) {
                    return false;
                }
                if (dotCount > 1 && callCount > 1) {
                    return false;
                }
                next = leaf;
            }
        }
        return true;
    }

    private static Set<Leaf> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    /**
     * The three lines of a bracket split and the bracket pair it happened at.
     */
    static final class Split {
        final Line head;
        final Line body;
        final Line tail;
        final Leaf openingBracket;
        final Leaf closingBracket;

        Split(Line head, Line body, Line tail, Leaf openingBracket, Leaf closingBracket) {
            this.head = head;
            this.body = body;
            this.tail = tail;
            this.openingBracket = openingBracket;
            this.closingBracket = closingBracket;
        }
    }
}
