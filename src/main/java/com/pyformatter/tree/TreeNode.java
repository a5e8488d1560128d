package com.pyformatter.tree;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.tokenize.TokenType;

/**
 * Common base of {@link Leaf} and {@link Node}. Rendering a tree with {@link #toString()}
 * reproduces its source text exactly.
 */
public abstract class TreeNode {
    Node parent;

    public Node getParent() {
        return parent;
    }

    public abstract String getPrefix();

    public abstract void setPrefix(String prefix);

    /**
     * All leaves below (or at) this node, in source order.
     */
    public List<Leaf> leaves() {
        List<Leaf> result = new ArrayList<>();
        collectLeaves(result);
        return result;
    }

    abstract void collectLeaves(List<Leaf> into);

    public abstract Leaf firstLeaf();

    public abstract Leaf lastLeaf();

    public abstract TreeNode deepCopy();

    public boolean is(NodeType type) {
        return false;
    }

    public boolean is(TokenType type) {
        return false;
    }

    public TreeNode nextSibling() {
        if (parent == null) {
            return null;
        }
        List<TreeNode> siblings = parent.getChildren();
        int index = parent.indexOf(this);
        return index + 1 < siblings.size() ? siblings.get(index + 1) : null;
    }

    public TreeNode prevSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOf(this);
        return index > 0 ? parent.getChildren().get(index - 1) : null;
    }

    /**
     * Detaches this node from its parent.
     *
     * @return the former index in the parent, or -1 when detached already
     */
    public int remove() {
        if (parent == null) {
            return -1;
        }
        int index = parent.indexOf(this);
        parent.removeChildAt(index);
        return index;
    }

    /**
     * Puts {@code replacement} where this node was.
     */
    public void replace(TreeNode replacement) {
        Node p = parent;
        int index = remove();
        p.insertChild(index, replacement);
    }
}
