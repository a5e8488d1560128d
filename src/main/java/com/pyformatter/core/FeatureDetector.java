package com.pyformatter.core;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.pyformatter.api.Feature;
import com.pyformatter.api.TargetVersion;
import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.NodeType;
import com.pyformatter.tree.TreeNode;
import com.pyformatter.tree.Trees;

/**
 * Finds the version-specific language features a source tree uses, and from them the target
 * versions it can run on.
 */
public final class FeatureDetector {

    // {expr=}, {expr=!r}, {expr=:fmt}
    private static final Pattern SELF_DOCUMENTING =
            Pattern.compile("\\{[^{}]*[^=!<>]=\\s*(![rsa])?(:[^{}]*)?\\}");

    private FeatureDetector() {
    }

    public static Set<Feature> detect(Node root) {
        Set<Feature> features = EnumSet.noneOf(Feature.class);
        for (TreeNode node : Trees.preOrder(root)) {
            if (node instanceof Leaf) {
                detectInLeaf((Leaf) node, features);
            } else {
                detectInNode((Node) node, features);
            }
        }
        return features;
    }

    /**
     * Every version that supports all of {@code features}.
     */
    public static Set<TargetVersion> inferTargetVersions(Set<Feature> features) {
        Set<TargetVersion> versions = EnumSet.noneOf(TargetVersion.class);
        for (TargetVersion version : TargetVersion.values()) {
            if (version.getFeatures().containsAll(features)) {
                versions.add(version);
            }
        }
        return versions;
    }

    private static void detectInLeaf(Leaf leaf, Set<Feature> features) {
        switch (leaf.getType()) {
            case STRING -> {
                String prefix = leaf.getValue().substring(0, Trees.stringPrefixLength(leaf.getValue()))
                        .toLowerCase(Locale.ROOT);
                if (prefix.contains("f")) {
                    features.add(Feature.F_STRINGS);
                    if (SELF_DOCUMENTING.matcher(leaf.getValue()).find()) {
                        features.add(Feature.DEBUG_F_STRINGS);
                    }
                }
            }
            case NUMBER -> {
                if (leaf.getValue().contains("_")) {
                    features.add(Feature.NUMERIC_UNDERSCORES);
                }
            }
            case OP -> {
                Node parent = leaf.getParent();
                if (leaf.isOp(":=")) {
                    features.add(Feature.ASSIGNMENT_EXPRESSIONS);
                } else if (leaf.isOp("/") && parent != null
                        && (parent.is(NodeType.TYPEDARGSLIST) || parent.is(NodeType.VARARGSLIST)
                        || parent.is(NodeType.PARAMETERS))) {
                    features.add(Feature.POS_ONLY_ARGUMENTS);
                } else if (leaf.isOp("*") && parent != null && parent.is(NodeType.EXCEPT_CLAUSE)) {
                    features.add(Feature.EXCEPT_STAR);
                }
            }
            default -> {
            }
        }
    }

    private static void detectInNode(Node node, Set<Feature> features) {
        switch (node.getType()) {
            case MATCH_STMT -> features.add(Feature.PATTERN_MATCHING);
            case TYPEPARAMS, TYPE_STMT -> features.add(Feature.TYPE_PARAMS);
            case DECORATOR -> {
                if (!isSimpleDecorator(node.child(1))) {
                    features.add(Feature.RELAXED_DECORATORS);
                }
            }
            case TNAME_STAR -> features.add(Feature.VARIADIC_GENERICS);
            case SUBSCRIPT, SUBSCRIPTLIST -> {
                if (hasChild(node, NodeType.STAR_EXPR)) {
                    features.add(Feature.VARIADIC_GENERICS);
                }
            }
            case TRAILER -> {
                TreeNode inner = node.childCount() == 3 ? node.child(1) : null;
                if (inner != null && inner.is(NodeType.STAR_EXPR) && ((Leaf) node.child(0)).isOp("[")) {
                    features.add(Feature.VARIADIC_GENERICS);
                }
            }
            case ARGLIST -> {
                if (hasTrailingCommaAfterVararg(node)) {
                    features.add(Feature.TRAILING_COMMA_IN_CALL);
                }
            }
            case TYPEDARGSLIST -> {
                if (hasTrailingCommaAfterVararg(node)) {
                    features.add(Feature.TRAILING_COMMA_IN_DEF);
                }
            }
            case RETURN_STMT, YIELD_EXPR -> {
                if (node.childCount() > 1 && node.child(1).is(NodeType.TESTLIST_STAR_EXPR)
                        && hasChild((Node) node.child(1), NodeType.STAR_EXPR)) {
                    features.add(Feature.UNPACKING_ON_FLOW);
                }
            }
            case ANNASSIGN -> {
                TreeNode value = node.childCount() > 3 ? node.child(3) : null;
                if (value != null && value.is(NodeType.TESTLIST_STAR_EXPR)) {
                    features.add(Feature.ANN_ASSIGN_EXTENDED_RHS);
                }
            }
            case WITH_STMT -> {
                TreeNode items = node.child(1);
                if (items.is(NodeType.ATOM) && ((Node) items).childCount() == 3) {
                    TreeNode inner = ((Node) items).child(1);
                    if (inner.is(NodeType.ASEXPR_TEST)
                            || (inner.is(NodeType.TESTLIST_GEXP) && hasChild((Node) inner, NodeType.ASEXPR_TEST))) {
                        features.add(Feature.PARENTHESIZED_CONTEXT_MANAGERS);
                    }
                }
            }
            default -> {
            }
        }
    }

    /**
     * A dotted name, optionally followed by a single call.
     */
    private static boolean isSimpleDecorator(TreeNode expression) {
        if (expression instanceof Leaf) {
            return expression.is(TokenType.NAME);
        }
        Node node = (Node) expression;
        if (!node.is(NodeType.POWER) || !node.child(0).is(TokenType.NAME)) {
            return node.is(NodeType.DOTTED_NAME);
        }
        for (int i = 1; i < node.childCount(); i++) {
            TreeNode trailer = node.child(i);
            if (!trailer.is(NodeType.TRAILER)) {
                return false;
            }
            Leaf opener = (Leaf) ((Node) trailer).child(0);
            boolean last = i == node.childCount() - 1;
            if (!(opener.isOp(".") || (last && opener.isOp("(")))) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasTrailingCommaAfterVararg(Node list) {
        TreeNode last = list.child(list.childCount() - 1);
        if (!(last instanceof Leaf && ((Leaf) last).isOp(","))) {
            return false;
        }
        for (TreeNode child : list.getChildren()) {
            if (child instanceof Leaf && (((Leaf) child).isOp("*") || ((Leaf) child).isOp("**"))) {
                return true;
            }
            if (child.is(NodeType.ARGUMENT) || child.is(NodeType.STAR_EXPR)) {
                TreeNode first = ((Node) child).child(0);
                if (first instanceof Leaf && (((Leaf) first).isOp("*") || ((Leaf) first).isOp("**"))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean hasChild(Node node, NodeType type) {
        for (TreeNode child : node.getChildren()) {
            if (child.is(type)) {
                return true;
            }
        }
        return false;
    }
}
