package com.pyformatter.split;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.pyformatter.lines.Line;
import com.pyformatter.lines.Priorities;
import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.NodeType;

/**
 * Builds the head, body and tail lines of a bracket split.
 */
final class BracketSplitBuilder {

    enum Component {
        HEAD,
        BODY,
        TAIL
    }

    private BracketSplitBuilder() {
    }

    /**
     * Creates the line holding {@code leaves}. A body goes one level deeper than
     * {@code original}, loses the leading whitespace of its first leaf and gains a trailing
     * comma when the original line is an import or a definition with a single parameter.
     */
    static Line build(List<Leaf> leaves, Line original, Leaf openingBracket, Component component) {
        Line result = new Line(original.getOptions(), original.getDepth(), false);
        List<Leaf> content = new ArrayList<>(leaves);
        if (component == Component.BODY) {
            result.setInsideBrackets(true);
            result.setDepth(original.getDepth() + 1);
            if (!content.isEmpty()) {
                content.get(0).setPrefix("");
                if (original.isImport() || isDefWithoutCommas(original, openingBracket, content)) {
                    addTrailingComma(content);
                }
            }
        }
        Set<Leaf> tracked = component == Component.HEAD
                ? leavesInsideMatchingBrackets(content)
                : Collections.emptySet();
        for (Leaf leaf : content) {
            result.append(leaf, true, tracked.contains(leaf));
            for (Leaf comment : original.commentsAfter(leaf)) {
                result.append(comment, true);
            }
        }
        if (component == Component.BODY && shouldSplitLine(result, openingBracket)) {
            result.setShouldSplitRhs(true);
        }
        return result;
    }

    private static boolean isDefWithoutCommas(Line original, Leaf openingBracket, List<Leaf> leaves) {
        if (!original.isDef() || openingBracket.getValue().isEmpty()) {
            return false;
        }
        for (Leaf leaf : leaves) {
            if (leaf.isOp(",")) {
                return false;
            }
        }
        return true;
    }

    private static void addTrailingComma(List<Leaf> leaves) {
        for (int i = leaves.size() - 1; i >= 0; i--) {
            Leaf leaf = leaves.get(i);
            if (leaf.is(TokenType.STANDALONE_COMMENT)) {
                continue;
            }
            if (!leaf.isOp(",")) {
                leaves.add(i + 1, new Leaf(TokenType.OP, ","));
            }
            break;
        }
    }

    /**
     * Whether the body of a split should be exploded one element per line right away: it holds
     * comma-delimited items and either ends with a magic trailing comma or is a collection
     * literal or import list.
     */
    static boolean shouldSplitLine(Line line, Leaf openingBracket) {
        Node parent = openingBracket.getParent();
        String value = openingBracket.getValue();
        if (parent == null || !(value.isEmpty() || "[{(".contains(value))) {
            return false;
        }
        List<Leaf> leaves = line.getLeaves();
        if (leaves.isEmpty()) {
            return false;
        }
        Leaf last = leaves.get(leaves.size() - 1);
        boolean trailingComma = last.isOp(",");
        int maxPriority = line.getBracketTracker().maxDelimiterPriority(last);
        return maxPriority == Priorities.COMMA
                && ((line.getOptions().isMagicTrailingComma() && trailingComma)
                || parent.is(NodeType.ATOM) || parent.is(NodeType.IMPORT_FROM));
    }

    /**
     * The leaves enclosed by bracket pairs that both open and close within {@code leaves},
     * brackets included. Scanning starts at the first opening bracket and stops at the first
     * unmatched closing one.
     */
    static Set<Leaf> leavesInsideMatchingBrackets(List<Leaf> leaves) {
        Set<Leaf> result = Collections.newSetFromMap(new IdentityHashMap<>());
        int start = -1;
        for (int i = 0; i < leaves.size(); i++) {
            if (leaves.get(i).isOpeningBracket()) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return result;
        }
        List<Integer> stack = new ArrayList<>();
        for (int i = start; i < leaves.size(); i++) {
            Leaf leaf = leaves.get(i);
            if (leaf.isOpeningBracket()) {
                stack.add(i);
            }
            if (leaf.isClosingBracket()) {
                if (!stack.isEmpty() && matches(leaves.get(stack.get(stack.size() - 1)), leaf)) {
                    int open = stack.remove(stack.size() - 1);
                    for (int j = open; j <= i; j++) {
                        result.add(leaves.get(j));
                    }
                } else {
                    break;
                }
            }
        }
        return result;
    }

    private static boolean matches(Leaf opening, Leaf closing) {
        if (opening.isLeftParen()) {
            return closing.isRightParen();
        }
        if (opening.isOp("[")) {
            return closing.isOp("]");
        }
        return opening.isOp("{") && closing.isOp("}");
    }
}
