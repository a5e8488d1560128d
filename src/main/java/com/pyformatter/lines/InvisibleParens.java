package com.pyformatter.lines;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.NodeType;
import com.pyformatter.tree.TreeNode;
import com.pyformatter.tree.Trees;

/**
 * Places optional parentheses. Redundant existing parentheses become invisible and bare
 * children get invisible ones, so that the split engine can later decide whether to show them.
 */
public final class InvisibleParens {

    private InvisibleParens() {
    }

    /**
     * Normalizes the parentheses around every child of {@code node} that directly follows a leaf
     * whose value is in {@code parensAfter}.
     */
    public static void normalize(Node node, Set<String> parensAfter) {
        for (Comments.ProtoComment comment : Comments.listComments(node.getPrefix(), false)) {
            if (Comments.FMT_OFF.contains(comment.getValue())) {
                return;
            }
        }
        boolean checkLpar = false;
        List<TreeNode> children = new ArrayList<>(node.getChildren());
        for (int index = 0; index < children.size(); index++) {
            TreeNode child = children.get(index);
            if (child.is(NodeType.ANNASSIGN)) {
                normalize((Node) child, parensAfter);
            }
            if (index == 0 && child.is(NodeType.TESTLIST_STAR_EXPR)) {
                // unpacking targets of an assignment
                checkLpar = true;
            }
            if (checkLpar) {
                int position = node.indexOf(child);
                if (child.is(NodeType.ATOM) && isTargetOfForOrDel(node, child)) {
                    if (makeParensInvisibleInAtom(child, node, true)) {
                        wrapInParentheses(node, child, false);
                    }
                } else if (child instanceof Node && node.is(NodeType.WITH_STMT)) {
                    removeWithParens((Node) child, node);
                } else if (child.is(NodeType.ATOM)) {
                    if (makeParensInvisibleInAtom(child, node, false)) {
                        wrapInParentheses(node, child, false);
                    }
                } else if (Trees.isOneTuple(child)) {
                    wrapInParentheses(node, child, true);
                } else if (node.is(NodeType.IMPORT_FROM)) {
                    normalizeImportFrom(node, child, position);
                    break;
                } else if (node.is(NodeType.EXCEPT_CLAUSE) && child instanceof Leaf && ((Leaf) child).isOp("*")) {
                    // except* keeps its star next to the keyword
                    continue;
                } else if (!(child instanceof Leaf && Trees.isMultilineString((Leaf) child))) {
                    wrapInParentheses(node, child, false);
                }
            }
            checkLpar = child instanceof Leaf && parensAfter.contains(((Leaf) child).getValue());
        }
    }

    private static boolean isTargetOfForOrDel(Node node, TreeNode child) {
        if (node.is(NodeType.DEL_STMT)) {
            return true;
        }
        TreeNode previous = child.prevSibling();
        return node.is(NodeType.FOR_STMT) && previous instanceof Leaf && ((Leaf) previous).isName("for");
    }

    private static void normalizeImportFrom(Node parent, TreeNode child, int index) {
        if (child instanceof Leaf && ((Leaf) child).isOp("(")) {
            ((Leaf) child).makeInvisible();
            ((Leaf) parent.child(parent.childCount() - 1)).makeInvisible();
        } else if (!(child instanceof Leaf && ((Leaf) child).isOp("*"))) {
            parent.insertChild(index, Leaf.invisibleParen(true));
            parent.appendChild(Leaf.invisibleParen(false));
        }
    }

    private static void removeWithParens(Node child, Node parent) {
        if (child.is(NodeType.ATOM)) {
            if (makeParensInvisibleInAtom(child, parent, true)) {
                wrapInParentheses(parent, child, false);
            }
            if (child.childCount() > 1 && child.child(1) instanceof Node) {
                removeWithParens((Node) child.child(1), child);
            }
        } else if (child.is(NodeType.TESTLIST_GEXP)) {
            for (TreeNode item : new ArrayList<>(child.getChildren())) {
                if (item.is(NodeType.ATOM)) {
                    removeWithParens((Node) item, child);
                }
            }
        } else if (child.is(NodeType.ASEXPR_TEST)) {
            TreeNode context = child.child(0);
            if (makeParensInvisibleInAtom(context, child, true)) {
                wrapInParentheses(child, context, false);
            }
        }
    }

    /**
     * Makes the parentheses of {@code node} invisible when that is safe, recursing into nested
     * redundant parentheses.
     *
     * @return whether {@code node} should itself be wrapped in invisible parentheses
     */
    public static boolean makeParensInvisibleInAtom(TreeNode node, Node parent, boolean removeBracketsAroundComma) {
        if (!node.is(NodeType.ATOM)
                || Trees.isEmptyTuple(node)
                || Trees.isOneTuple(node)
                || Trees.isYield(node)
                || Trees.isWalrusAssignment(node)
                || isGenerator(node)
                || (!removeBracketsAroundComma && maxDelimiterPriorityInAtom(node) >= Priorities.COMMA)
                || isTupleContainingWalrus(node)) {
            return false;
        }
        Node atom = (Node) node;
        TreeNode first = atom.child(0);
        TreeNode last = atom.child(atom.childCount() - 1);
        if (first instanceof Leaf && ((Leaf) first).isOp("(") && last instanceof Leaf && ((Leaf) last).isOp(")")) {
            TreeNode middle = atom.child(1);
            if (!middle.getPrefix().strip().startsWith("# type: ignore")) {
                ((Leaf) first).makeInvisible();
                ((Leaf) last).makeInvisible();
            }
            makeParensInvisibleInAtom(middle, parent, removeBracketsAroundComma);
            if (Trees.isAtomWithInvisibleParens(middle)) {
                middle.replace(((Node) middle).child(1));
            }
            return false;
        }
        return !(first instanceof Leaf && ((Leaf) first).isInvisible());
    }

    private static boolean isGenerator(TreeNode node) {
        TreeNode inner = Trees.unwrapSingletonParenthesis(node);
        if (inner == null || !inner.is(NodeType.TESTLIST_GEXP)) {
            return false;
        }
        for (TreeNode child : ((Node) inner).getChildren()) {
            if (child.is(NodeType.COMP_FOR)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTupleContainingWalrus(TreeNode node) {
        TreeNode inner = Trees.unwrapSingletonParenthesis(node);
        if (inner == null || !inner.is(NodeType.TESTLIST_GEXP)) {
            return false;
        }
        for (TreeNode child : ((Node) inner).getChildren()) {
            if (child.is(NodeType.NAMEDEXPR_TEST)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Highest delimiter priority directly inside the parentheses of {@code node}, 0 when it is
     * not parenthesized.
     */
    public static int maxDelimiterPriorityInAtom(TreeNode node) {
        if (!node.is(NodeType.ATOM)) {
            return 0;
        }
        Node atom = (Node) node;
        TreeNode first = atom.child(0);
        TreeNode last = atom.child(atom.childCount() - 1);
        if (!(first instanceof Leaf && ((Leaf) first).isLeftParen()
                && last instanceof Leaf && ((Leaf) last).isRightParen())) {
            return 0;
        }
        BracketTracker tracker = new BracketTracker();
        try {
            for (int i = 1; i < atom.childCount() - 1; i++) {
                for (Leaf leaf : atom.child(i).leaves()) {
                    tracker.mark(leaf);
                }
            }
        } catch (IllegalStateException e) {
            return 0;
        }
        return tracker.maxDelimiterPriority();
    }

    /**
     * Replaces {@code child} with an atom that wraps it in parentheses. The child's prefix moves
     * to the opening parenthesis.
     */
    public static Node wrapInParentheses(Node parent, TreeNode child, boolean visible) {
        Leaf lpar = visible ? new Leaf(TokenType.OP, "(") : Leaf.invisibleParen(true);
        Leaf rpar = visible ? new Leaf(TokenType.OP, ")") : Leaf.invisibleParen(false);
        int index = parent.indexOf(child);
        String prefix = child.getPrefix();
        child.remove();
        child.setPrefix("");
        Node atom = new Node(NodeType.ATOM, List.of(lpar, child, rpar));
        lpar.setPrefix(prefix);
        parent.insertChild(index, atom);
        return atom;
    }
}
