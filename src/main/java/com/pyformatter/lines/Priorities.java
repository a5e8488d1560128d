package com.pyformatter.lines;

import java.util.Map;
import java.util.Set;

import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.NodeType;

/**
 * Split priorities of delimiters. A higher number means the line is split there first.
 */
public final class Priorities {
    public static final int COMMA = 20;
    public static final int COMPREHENSION = 18;
    public static final int TERNARY = 16;
    public static final int LOGIC = 14;
    public static final int STRING = 12;
    public static final int COMPARATOR = 10;
    public static final int DOT = 1;

    private static final Map<String, Integer> MATH = Map.ofEntries(
            Map.entry("|", 9),
            Map.entry("^", 8),
            Map.entry("&", 7),
            Map.entry("<<", 6),
            Map.entry(">>", 6),
            Map.entry("+", 5),
            Map.entry("-", 5),
            Map.entry("*", 4),
            Map.entry("/", 4),
            Map.entry("//", 4),
            Map.entry("%", 4),
            Map.entry("@", 4),
            Map.entry("~", 4),
            Map.entry("**", 1));

    private static final Set<String> COMPARATORS = Set.of("<", ">", "==", "!=", "<=", ">=");

    static final Set<NodeType> VARARGS_PARENTS = Set.of(
            NodeType.ARGLIST, NodeType.ARGUMENT, NodeType.TRAILER, NodeType.TYPEDARGSLIST,
            NodeType.VARARGSLIST, NodeType.TYPEVARTUPLE, NodeType.PARAMSPEC);

    static final Set<NodeType> UNPACKING_PARENTS = Set.of(
            NodeType.ATOM, NodeType.LISTMAKER, NodeType.TESTLIST_GEXP, NodeType.TESTLIST_STAR_EXPR,
            NodeType.DICTSETMAKER, NodeType.EXPRLIST);

    private Priorities() {
    }

    public static boolean isMathOperator(Leaf leaf) {
        return leaf.is(TokenType.OP) && MATH.containsKey(leaf.getValue());
    }

    /**
     * True when {@code leaf} is a {@code *}, {@code **} or {@code /} that introduces varargs or
     * unpacking rather than acting as an operator.
     */
    public static boolean isVararg(Leaf leaf) {
        return isVararg(leaf, VARARGS_PARENTS) || isVararg(leaf, UNPACKING_PARENTS);
    }

    /**
     * True when {@code leaf} is a varargs marker whose enclosing node (looking through a star
     * expression) has one of the {@code within} types.
     */
    public static boolean isVararg(Leaf leaf, Set<NodeType> within) {
        if (!(leaf.isOp("*") || leaf.isOp("**") || leaf.isOp("/")) || leaf.getParent() == null) {
            return false;
        }
        Node parent = leaf.getParent();
        if (parent.is(NodeType.STAR_EXPR)) {
            if (parent.getParent() == null) {
                return false;
            }
            parent = parent.getParent();
        }
        return within.contains(parent.getType());
    }

    /**
     * Priority of splitting after {@code leaf}; only commas qualify.
     */
    public static int splitAfter(Leaf leaf) {
        return leaf.isOp(",") ? COMMA : 0;
    }

    /**
     * Priority of splitting before {@code leaf}, given the leaf that precedes it on the line.
     */
    public static int splitBefore(Leaf leaf, Leaf previous) {
        if (isVararg(leaf)) {
            return 0;
        }
        Node parent = leaf.getParent();
        if (leaf.isOp(".") && parent != null
                && !parent.is(NodeType.IMPORT_FROM) && !parent.is(NodeType.DOTTED_NAME)
                && (previous == null || previous.isClosingBracket())) {
            return DOT;
        }
        if (isMathOperator(leaf) && parent != null
                && !parent.is(NodeType.FACTOR) && !parent.is(NodeType.STAR_EXPR)) {
            return MATH.get(leaf.getValue());
        }
        if (leaf.is(TokenType.OP) && COMPARATORS.contains(leaf.getValue())) {
            return COMPARATOR;
        }
        if (leaf.is(TokenType.STRING) && previous != null && previous.is(TokenType.STRING)) {
            return STRING;
        }
        if (!leaf.is(TokenType.NAME) || parent == null) {
            return 0;
        }
        String value = leaf.getValue();
        if (value.equals("for") && parent.is(NodeType.COMP_FOR)
                && !(previous != null && previous.isName("async"))) {
            return COMPREHENSION;
        }
        if (value.equals("async") && parent.is(NodeType.COMP_FOR)) {
            return COMPREHENSION;
        }
        if (value.equals("if") && parent.is(NodeType.COMP_IF)) {
            return COMPREHENSION;
        }
        if ((value.equals("if") || value.equals("else")) && parent.is(NodeType.TEST)) {
            return TERNARY;
        }
        if (value.equals("is")) {
            return COMPARATOR;
        }
        if (value.equals("in") && (parent.is(NodeType.COMP_OP) || parent.is(NodeType.COMPARISON))
                && !(previous != null && previous.isName("not"))) {
            return COMPARATOR;
        }
        if (value.equals("not") && parent.is(NodeType.COMP_OP)
                && !(previous != null && previous.isName("is"))) {
            return COMPARATOR;
        }
        if ((value.equals("and") || value.equals("or"))
                && (parent.is(NodeType.AND_TEST) || parent.is(NodeType.OR_TEST))) {
            return LOGIC;
        }
        return 0;
    }
}
