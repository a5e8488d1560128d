package com.pyformatter.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A composite tree node. The node owns its children exclusively; every mutation keeps the
 * children's parent links in sync.
 */
public class Node extends TreeNode {
    private final NodeType type;
    private final List<TreeNode> children = new ArrayList<>();

    public Node(NodeType type) {
        this.type = type;
    }

    public Node(NodeType type, List<? extends TreeNode> children) {
        this.type = type;
        for (TreeNode child : children) {
            appendChild(child);
        }
    }

    public NodeType getType() {
        return type;
    }

    @Override
    public boolean is(NodeType type) {
        return this.type == type;
    }

    public List<TreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public TreeNode child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public int indexOf(TreeNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        throw new IllegalStateException("Not a child of this node: " + child);
    }

    public void appendChild(TreeNode child) {
        detach(child);
        child.parent = this;
        children.add(child);
    }

    public void insertChild(int index, TreeNode child) {
        detach(child);
        child.parent = this;
        children.add(index, child);
    }

    public void setChild(int index, TreeNode child) {
        detach(child);
        TreeNode old = children.set(index, child);
        old.parent = null;
        child.parent = this;
    }

    void removeChildAt(int index) {
        TreeNode removed = children.remove(index);
        removed.parent = null;
    }

    private static void detach(TreeNode child) {
        if (child.parent != null) {
            child.remove();
        }
    }

    @Override
    public String getPrefix() {
        return children.isEmpty() ? "" : children.get(0).getPrefix();
    }

    @Override
    public void setPrefix(String prefix) {
        if (!children.isEmpty()) {
            children.get(0).setPrefix(prefix);
        }
    }

    @Override
    void collectLeaves(List<Leaf> into) {
        for (TreeNode child : children) {
            child.collectLeaves(into);
        }
    }

    @Override
    public Leaf firstLeaf() {
        return children.isEmpty() ? null : children.get(0).firstLeaf();
    }

    @Override
    public Leaf lastLeaf() {
        return children.isEmpty() ? null : children.get(children.size() - 1).lastLeaf();
    }

    @Override
    public Node deepCopy() {
        Node copy = new Node(type);
        for (TreeNode child : children) {
            copy.appendChild(child.deepCopy());
        }
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Leaf leaf : leaves()) {
            sb.append(leaf.getPrefix()).append(leaf.getValue());
        }
        return sb.toString();
    }
}
