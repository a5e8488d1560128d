package com.pyformatter.lines;

import java.util.Set;

import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.NodeType;
import com.pyformatter.tree.TreeNode;
import com.pyformatter.tree.Trees;

/**
 * Decides the whitespace that goes before a leaf on a line.
 */
public final class Whitespace {
    private static final String NO = "";
    private static final String SPACE = " ";
    private static final String DOUBLESPACE = "  ";

    private static final Set<NodeType> TYPED_NAMES = Set.of(NodeType.TNAME, NodeType.TNAME_STAR);

    private Whitespace() {
    }

    /**
     * Returns the whitespace to put before {@code leaf}.
     *
     * @param complexSubscript whether the leaf is inside a subscript whose parts are not trivial,
     *                         in which case slice colons are treated like binary operators
     */
    public static String before(Leaf leaf, boolean complexSubscript) {
        TokenType t = leaf.getType();
        String v = leaf.getValue();
        if (leaf.isClosingBracket() || leaf.isOp(",") || leaf.isOp(";") || t == TokenType.STANDALONE_COMMENT) {
            return NO;
        }
        if (t == TokenType.COMMENT) {
            return DOUBLESPACE;
        }
        Node p = leaf.getParent();
        if (p == null) {
            return SPACE;
        }
        if (isHuggedPowerOperator(leaf) || isAfterHuggedPowerOperator(leaf)) {
            return NO;
        }
        if (leaf.isOp(":") && !p.is(NodeType.SUBSCRIPT) && !p.is(NodeType.SUBSCRIPTLIST) && !p.is(NodeType.SLICEOP)) {
            return NO;
        }

        TreeNode prev = leaf.prevSibling();
        if (prev == null) {
            Leaf prevp = Trees.precedingLeaf(p);
            if (prevp == null || prevp.isOpeningBracket()) {
                return NO;
            }
            if (leaf.isOp(":")) {
                if (prevp.isOp(":")) {
                    return NO;
                } else if (!prevp.isOp(",") && !complexSubscript) {
                    return NO;
                }
                return SPACE;
            }
            Node prevpParent = prevp.getParent();
            if (prevp.isOp("=")) {
                if (prevpParent != null) {
                    if (prevpParent.is(NodeType.ARGLIST) || prevpParent.is(NodeType.ARGUMENT)
                            || prevpParent.is(NodeType.PARAMETERS) || prevpParent.is(NodeType.VARARGSLIST)) {
                        return NO;
                    } else if (prevpParent.is(NodeType.TYPEDARGSLIST)) {
                        // the equal sign carries a space only after an annotated parameter
                        return prevp.getPrefix();
                    }
                }
            } else if (prevp.isOp("*") && prevpParent != null && prevpParent.is(NodeType.STAR_EXPR)
                    && prevpParent.getParent() != null && prevpParent.getParent().is(NodeType.SUBSCRIPTLIST)) {
                return NO;
            } else if (prevp.isOp("*") || prevp.isOp("**") || prevp.isOp("/")) {
                if (Priorities.isVararg(prevp)) {
                    return NO;
                }
            } else if (prevp.isOp(":")) {
                if (prevpParent != null && (prevpParent.is(NodeType.SUBSCRIPT) || prevpParent.is(NodeType.SLICEOP))) {
                    return complexSubscript ? SPACE : NO;
                }
            } else if (prevpParent != null && (prevpParent.is(NodeType.FACTOR) || prevpParent.is(NodeType.STAR_EXPR))
                    && Priorities.isMathOperator(prevp)) {
                return NO;
            } else if (prevp.isOp("@") && p.getParent() != null && p.getParent().is(NodeType.DECORATOR)) {
                return NO;
            }
        } else if (prev instanceof Leaf && ((Leaf) prev).isOpeningBracket()) {
            return NO;
        }

        if (p.is(NodeType.PARAMETERS) || p.is(NodeType.ARGLIST)) {
            if (prev == null || !isComma(prev)) {
                return NO;
            }
        } else if (p.is(NodeType.VARARGSLIST)) {
            if (prev != null && !isComma(prev)) {
                return NO;
            }
        } else if (p.is(NodeType.TYPEDARGSLIST)) {
            if (prev == null) {
                return NO;
            }
            if (leaf.isOp("=")) {
                if (!(prev instanceof Node && TYPED_NAMES.contains(((Node) prev).getType()))) {
                    return NO;
                }
            } else if (prev instanceof Leaf && ((Leaf) prev).isOp("=")) {
                return prev.getPrefix();
            } else if (!isComma(prev)) {
                return NO;
            }
        } else if (TYPED_NAMES.contains(p.getType())) {
            if (prev == null) {
                Leaf prevp = Trees.precedingLeaf(p);
                if (prevp == null || !prevp.isOp(",")) {
                    return NO;
                }
            }
        } else if (p.is(NodeType.TRAILER)) {
            if (leaf.isLeftParen() || leaf.isRightParen()) {
                return NO;
            }
            if (prev == null) {
                if (leaf.isOp(".") || leaf.isOp("[")) {
                    return NO;
                }
            } else if (!isComma(prev)) {
                return NO;
            }
        } else if (p.is(NodeType.ARGUMENT)) {
            if (leaf.isOp("=")) {
                return NO;
            }
            if (prev == null) {
                Leaf prevp = Trees.precedingLeaf(p);
                if (prevp == null || prevp.isLeftParen()) {
                    return NO;
                }
            } else if (prev instanceof Leaf && (((Leaf) prev).isOp("=") || ((Leaf) prev).isOp("*")
                    || ((Leaf) prev).isOp("**") || ((Leaf) prev).isOp("/"))) {
                return NO;
            }
        } else if (p.is(NodeType.DECORATOR)) {
            return NO;
        } else if (p.is(NodeType.DOTTED_NAME)) {
            if (prev != null) {
                return NO;
            }
            Leaf prevp = Trees.precedingLeaf(p);
            if (prevp == null || prevp.isOp("@") || prevp.isOp(".")) {
                return NO;
            }
        } else if (p.is(NodeType.CLASSDEF)) {
            if (leaf.isLeftParen()) {
                return NO;
            }
            if (prev instanceof Leaf && ((Leaf) prev).isLeftParen()) {
                return NO;
            }
        } else if (p.is(NodeType.SUBSCRIPT) || p.is(NodeType.SLICEOP)) {
            if (prev == null) {
                Node grandparent = p.getParent();
                if (grandparent != null && grandparent.is(NodeType.SUBSCRIPTLIST)) {
                    return SPACE;
                }
                return NO;
            } else if (!complexSubscript) {
                return NO;
            }
        } else if (p.is(NodeType.ATOM)) {
            if (prev != null && leaf.isOp(".")) {
                return NO;
            }
        } else if (p.is(NodeType.DICTSETMAKER)) {
            if (prev instanceof Leaf && ((Leaf) prev).isOp("**")) {
                return NO;
            }
        } else if (p.is(NodeType.FACTOR) || p.is(NodeType.STAR_EXPR)) {
            if (prev == null) {
                Leaf prevp = Trees.precedingLeaf(p);
                if (prevp == null || prevp.isOpeningBracket()) {
                    return NO;
                }
                Node prevpParent = prevp.getParent();
                if (prevp.isOp(":") && prevpParent != null
                        && (prevpParent.is(NodeType.SUBSCRIPT) || prevpParent.is(NodeType.SLICEOP))) {
                    return NO;
                } else if (prevp.isOp("=") && prevpParent != null && prevpParent.is(NodeType.ARGUMENT)) {
                    return NO;
                }
            } else if (t == TokenType.NAME || t == TokenType.NUMBER || t == TokenType.STRING
                    || leaf.isOpeningBracket() || leaf.isOp("...")) {
                return NO;
            }
        } else if (p.is(NodeType.EXCEPT_CLAUSE)) {
            if (leaf.isOp("*")) {
                return NO;
            }
        } else if (p.is(NodeType.TYPEPARAMS)) {
            if (leaf.isOp("[")) {
                return NO;
            }
        } else if (p.is(NodeType.TYPEVARTUPLE) || p.is(NodeType.PARAMSPEC)) {
            if (prev != null) {
                return NO;
            }
        } else if (p.is(NodeType.IMPORT_FROM)) {
            if (leaf.isOp(".") || leaf.isOp("...")) {
                if (prev instanceof Leaf && (((Leaf) prev).isOp(".") || ((Leaf) prev).isOp("..."))) {
                    return NO;
                }
            } else if (t == TokenType.NAME) {
                if (v.equals("import")) {
                    return SPACE;
                }
                if (prev instanceof Leaf && (((Leaf) prev).isOp(".") || ((Leaf) prev).isOp("..."))) {
                    return NO;
                }
            }
        }
        if (t == TokenType.OP && v.equals("") && leaf.isRightParen()) {
            return NO;
        }
        return SPACE;
    }

    private static boolean isComma(TreeNode node) {
        return node instanceof Leaf && ((Leaf) node).isOp(",");
    }

    /**
     * A {@code **} whose operands are both simple is written without surrounding spaces.
     */
    static boolean isHuggedPowerOperator(Leaf leaf) {
        Node parent = leaf.getParent();
        if (!leaf.isOp("**") || parent == null || !parent.is(NodeType.POWER) || parent.childCount() != 3
                || parent.child(1) != leaf) {
            return false;
        }
        return isSimplePowerOperand(parent.child(0)) && isSimplePowerOperand(parent.child(2));
    }

    private static boolean isAfterHuggedPowerOperator(Leaf leaf) {
        Leaf previous = Trees.precedingLeaf(leaf);
        return previous != null && isHuggedPowerOperator(previous);
    }

    /**
     * Names, numbers and plain attribute chains, optionally behind a unary operator.
     */
    static boolean isSimplePowerOperand(TreeNode operand) {
        if (operand instanceof Leaf) {
            Leaf leaf = (Leaf) operand;
            return (leaf.is(TokenType.NAME) && !leaf.isName("await")) || leaf.is(TokenType.NUMBER);
        }
        Node node = (Node) operand;
        if (node.is(NodeType.FACTOR) && node.childCount() == 2) {
            return isSimplePowerOperand(node.child(1));
        }
        if (node.is(NodeType.POWER)) {
            if (!(node.child(0) instanceof Leaf) || !node.child(0).is(TokenType.NAME)
                    || ((Leaf) node.child(0)).isName("await")) {
                return false;
            }
            for (int i = 1; i < node.childCount(); i++) {
                TreeNode child = node.child(i);
                if (!child.is(NodeType.TRAILER) || ((Node) child).childCount() != 2
                        || !(((Node) child).child(0) instanceof Leaf)
                        || !((Leaf) ((Node) child).child(0)).isOp(".")) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
