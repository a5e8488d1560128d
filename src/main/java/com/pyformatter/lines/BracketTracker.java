package com.pyformatter.lines;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;

/**
 * Keeps track of brackets on a line: assigns every leaf its bracket depth, links closing
 * brackets to their opening ones and records the split priority of depth-0 delimiters.
 * <p>
 * The target of a {@code for} and the parameters of a {@code lambda} are tracked one level
 * deeper so that their commas never count as delimiters of the enclosing expression.
 */
public class BracketTracker {
    private int depth;
    private final Map<String, Leaf> bracketMatch = new HashMap<>();
    private final Map<Leaf, Integer> delimiters = new IdentityHashMap<>();
    private Leaf previous;
    private final List<Integer> forLoopDepths = new ArrayList<>();
    private final List<Integer> lambdaArgumentDepths = new ArrayList<>();
    private final List<Leaf> invisible = new ArrayList<>();

    /**
     * Marks {@code leaf} with bracket information; leaves must be marked in line order.
     *
     * @throws IllegalStateException when a closing bracket has no matching opening bracket
     */
    public void mark(Leaf leaf) {
        if (leaf.is(TokenType.COMMENT)) {
            return;
        }
        maybeDecrementAfterForLoopVariable(leaf);
        maybeDecrementAfterLambdaParameters(leaf);
        if (leaf.isClosingBracket()) {
            depth--;
            Leaf opening = bracketMatch.remove(key(depth, leaf));
            if (opening == null) {
                throw new IllegalStateException("Unable to match a closing bracket: '" + leaf.getValue()
                        + "' at line " + leaf.getLine());
            }
            leaf.setOpeningBracket(opening);
            if (leaf.getValue().isEmpty()) {
                invisible.add(leaf);
            }
        }
        leaf.setBracketDepth(depth);
        if (depth == 0) {
            int before = Priorities.splitBefore(leaf, previous);
            int after = Priorities.splitAfter(leaf);
            if (before > 0 && previous != null) {
                delimiters.put(previous, before);
            }
            if (after > 0) {
                delimiters.put(leaf, after);
            }
        }
        if (leaf.isOpeningBracket()) {
            bracketMatch.put(key(depth, leaf), leaf);
            depth++;
            if (leaf.getValue().isEmpty()) {
                invisible.add(leaf);
            }
        }
        previous = leaf;
        maybeIncrementLambdaParameters(leaf);
        maybeIncrementForLoopVariable(leaf);
    }

    private static String key(int depth, Leaf bracket) {
        char kind;
        if (bracket.isLeftParen() || bracket.isRightParen()) {
            kind = ')';
        } else if (bracket.isOp("[") || bracket.isOp("]")) {
            kind = ']';
        } else {
            kind = '}';
        }
        return depth + ":" + kind;
    }

    public int getDepth() {
        return depth;
    }

    public boolean anyOpenBrackets() {
        return !bracketMatch.isEmpty();
    }

    /**
     * The split priority recorded for {@code leaf}, 0 when it is not a delimiter.
     */
    public int priorityOf(Leaf leaf) {
        return delimiters.getOrDefault(leaf, 0);
    }

    public boolean isDelimiter(Leaf leaf) {
        return delimiters.containsKey(leaf);
    }

    public Map<Leaf, Integer> getDelimiters() {
        return delimiters;
    }

    public int maxDelimiterPriority() {
        return maxDelimiterPriority(null);
    }

    /**
     * Highest priority among the delimiters, ignoring {@code exclude}; 0 when there are none.
     */
    public int maxDelimiterPriority(Leaf exclude) {
        int max = 0;
        for (Map.Entry<Leaf, Integer> entry : delimiters.entrySet()) {
            if (entry.getKey() != exclude && entry.getValue() > max) {
                max = entry.getValue();
            }
        }
        return max;
    }

    /**
     * Number of delimiters with the given priority, or with the highest one when 0 is passed.
     */
    public int delimiterCountWithPriority(int priority) {
        if (delimiters.isEmpty()) {
            return 0;
        }
        int wanted = priority == 0 ? maxDelimiterPriority() : priority;
        int count = 0;
        for (int value : delimiters.values()) {
            if (value == wanted) {
                count++;
            }
        }
        return count;
    }

    public List<Leaf> getInvisible() {
        return invisible;
    }

    /**
     * The innermost currently open square bracket, if the last opened bracket is one.
     */
    public Leaf openSquareBracket() {
        return bracketMatch.get((depth - 1) + ":]");
    }

    private void maybeIncrementForLoopVariable(Leaf leaf) {
        if (leaf.isName("for")) {
            depth++;
            forLoopDepths.add(depth);
        }
    }

    private void maybeDecrementAfterForLoopVariable(Leaf leaf) {
        if (!forLoopDepths.isEmpty() && forLoopDepths.get(forLoopDepths.size() - 1) == depth
                && leaf.isName("in")) {
            depth--;
            forLoopDepths.remove(forLoopDepths.size() - 1);
        }
    }

    private void maybeIncrementLambdaParameters(Leaf leaf) {
        if (leaf.isName("lambda")) {
            depth++;
            lambdaArgumentDepths.add(depth);
        }
    }

    private void maybeDecrementAfterLambdaParameters(Leaf leaf) {
        if (!lambdaArgumentDepths.isEmpty() && lambdaArgumentDepths.get(lambdaArgumentDepths.size() - 1) == depth
                && leaf.isOp(":")) {
            depth--;
            lambdaArgumentDepths.remove(lambdaArgumentDepths.size() - 1);
        }
    }
}
