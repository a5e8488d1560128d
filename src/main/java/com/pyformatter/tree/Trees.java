package com.pyformatter.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.pyformatter.tokenize.TokenType;

/**
 * Structural queries over the concrete tree shared by the line generator, the split engine and
 * the equivalence checker.
 */
public final class Trees {

    /** Statement kinds whose body may sit on the header line. */
    public static final Set<NodeType> STATEMENTS = Set.of(
            NodeType.IF_STMT, NodeType.WHILE_STMT, NodeType.FOR_STMT, NodeType.TRY_STMT,
            NodeType.EXCEPT_CLAUSE, NodeType.WITH_STMT, NodeType.FUNCDEF, NodeType.CLASSDEF,
            NodeType.MATCH_STMT, NodeType.CASE_BLOCK);

    private static final Set<NodeType> IMPLICIT_TUPLES = Set.of(
            NodeType.TESTLIST, NodeType.TESTLIST_STAR_EXPR, NodeType.EXPRLIST);

    private Trees() {
    }

    /**
     * The leaf that precedes {@code node} in source order, or null at the start of the file.
     */
    public static Leaf precedingLeaf(TreeNode node) {
        TreeNode current = node;
        while (current != null) {
            TreeNode previous = current.prevSibling();
            if (previous != null) {
                return previous.lastLeaf();
            }
            current = current.getParent();
        }
        return null;
    }

    /**
     * The child of {@code ancestor} on the path down to {@code descendant}.
     */
    public static TreeNode childTowards(Node ancestor, TreeNode descendant) {
        TreeNode node = descendant;
        while (node != null && node.getParent() != ancestor) {
            node = node.getParent();
        }
        return node;
    }

    public static List<TreeNode> preOrder(TreeNode root) {
        List<TreeNode> result = new ArrayList<>();
        collectPreOrder(root, result);
        return result;
    }

    private static void collectPreOrder(TreeNode node, List<TreeNode> into) {
        into.add(node);
        if (node instanceof Node) {
            for (TreeNode child : ((Node) node).getChildren()) {
                collectPreOrder(child, into);
            }
        }
    }

    /**
     * Returns the wrapped child when {@code node} is exactly {@code ( child )}.
     */
    public static TreeNode unwrapSingletonParenthesis(TreeNode node) {
        if (!(node instanceof Node) || ((Node) node).childCount() != 3) {
            return null;
        }
        Node atom = (Node) node;
        if (!(atom.child(0) instanceof Leaf) || !((Leaf) atom.child(0)).isLeftParen()) {
            return null;
        }
        if (!(atom.child(2) instanceof Leaf) || !((Leaf) atom.child(2)).isRightParen()) {
            return null;
        }
        return atom.child(1);
    }

    public static boolean isOneTuple(TreeNode node) {
        if (node.is(NodeType.ATOM)) {
            TreeNode inner = unwrapSingletonParenthesis(node);
            return inner != null && inner.is(NodeType.TESTLIST_GEXP)
                    && ((Node) inner).childCount() == 2 && isComma(((Node) inner).child(1));
        }
        if (node instanceof Node && IMPLICIT_TUPLES.contains(((Node) node).getType())) {
            Node tuple = (Node) node;
            return tuple.childCount() == 2 && isComma(tuple.child(1));
        }
        return false;
    }

    private static boolean isComma(TreeNode node) {
        return node instanceof Leaf && ((Leaf) node).isOp(",");
    }

    public static boolean isEmptyTuple(TreeNode node) {
        if (!node.is(NodeType.ATOM) || ((Node) node).childCount() != 2) {
            return false;
        }
        Node atom = (Node) node;
        return atom.child(0) instanceof Leaf && ((Leaf) atom.child(0)).isOp("(")
                && atom.child(1) instanceof Leaf && ((Leaf) atom.child(1)).isOp(")");
    }

    public static boolean isWalrusAssignment(TreeNode node) {
        TreeNode inner = unwrapSingletonParenthesis(node);
        return inner != null && inner.is(NodeType.NAMEDEXPR_TEST);
    }

    public static boolean isYield(TreeNode node) {
        if (node.is(NodeType.YIELD_EXPR)) {
            return true;
        }
        if (node instanceof Leaf) {
            return ((Leaf) node).isName("yield");
        }
        if (!node.is(NodeType.ATOM)) {
            return false;
        }
        TreeNode inner = unwrapSingletonParenthesis(node);
        return inner != null && isYield(inner);
    }

    /**
     * True for an atom whose surrounding parentheses are both invisible.
     */
    public static boolean isAtomWithInvisibleParens(TreeNode node) {
        if (!node.is(NodeType.ATOM) || ((Node) node).childCount() < 2) {
            return false;
        }
        Node atom = (Node) node;
        TreeNode first = atom.child(0);
        TreeNode last = atom.child(atom.childCount() - 1);
        return first instanceof Leaf && ((Leaf) first).isLeftParen() && ((Leaf) first).isInvisible()
                && last instanceof Leaf && ((Leaf) last).isRightParen() && ((Leaf) last).isInvisible();
    }

    public static boolean hasTripleQuotes(String value) {
        String body = value.substring(stringPrefixLength(value));
        return body.startsWith("\"\"\"") || body.startsWith("'''");
    }

    public static boolean isMultilineString(Leaf leaf) {
        return leaf.is(TokenType.STRING) && hasTripleQuotes(leaf.getValue()) && leaf.getValue().contains("\n");
    }

    /**
     * Length of the letter prefix of a string literal ({@code rb}, {@code f}, ...).
     */
    public static int stringPrefixLength(String value) {
        int i = 0;
        while (i < value.length() && value.charAt(i) != '"' && value.charAt(i) != '\'') {
            i++;
        }
        return i;
    }

    /**
     * A simple statement consisting only of {@code ...}.
     */
    public static boolean isStubBody(TreeNode node) {
        if (!node.is(NodeType.SIMPLE_STMT) || ((Node) node).childCount() != 2) {
            return false;
        }
        TreeNode child = ((Node) node).child(0);
        return child instanceof Leaf && ((Leaf) child).isOp("...") && child.getPrefix().isBlank();
    }

    /**
     * An indented suite whose only statement is {@code ...} and which holds no comments.
     */
    public static boolean isStubSuite(Node suite) {
        if (suite.getParent() != null && !isFunctionOrClass(suite.getParent())) {
            return false;
        }
        if (!suite.getPrefix().isBlank() || suite.childCount() != 4) {
            return false;
        }
        if (!suite.child(0).is(TokenType.NEWLINE) || !suite.child(1).is(TokenType.INDENT)
                || !suite.child(3).is(TokenType.DEDENT)) {
            return false;
        }
        if (!suite.child(3).getPrefix().isBlank()) {
            return false;
        }
        return isStubBody(suite.child(2));
    }

    public static boolean isFunctionOrClass(TreeNode node) {
        return node.is(NodeType.FUNCDEF) || node.is(NodeType.CLASSDEF) || node.is(NodeType.ASYNC_FUNCDEF);
    }

    /**
     * True when the string leaf is the first expression statement of a module, class or function
     * body.
     */
    public static boolean isDocstring(Leaf leaf) {
        Node statement = leaf.getParent();
        if (statement == null || !statement.is(NodeType.SIMPLE_STMT) || statement.child(0) != leaf) {
            return false;
        }
        Node container = statement.getParent();
        if (container == null) {
            return false;
        }
        if (container.is(NodeType.FILE_INPUT)) {
            return container.child(0) == statement;
        }
        if (isFunctionOrClass(container)) {
            return true;
        }
        if (container.is(NodeType.SUITE)) {
            Node owner = container.getParent();
            return owner != null && isFunctionOrClass(owner)
                    && container.childCount() > 2 && container.child(2) == statement;
        }
        return false;
    }
}
