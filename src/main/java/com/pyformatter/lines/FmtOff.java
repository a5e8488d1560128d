package com.pyformatter.lines;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.pyformatter.api.LineRange;
import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.NodeType;
import com.pyformatter.tree.TreeNode;
import com.pyformatter.util.LoggerUtil;

/**
 * Turns source regions that must not be reformatted into single verbatim
 * {@link TokenType#STANDALONE_COMMENT} leaves: statements between {@code # fmt: off} and
 * {@code # fmt: on}, statements ending in {@code # fmt: skip}, and statements outside the
 * requested line ranges.
 */
public final class FmtOff {
    private static final Logger logger = LoggerUtil.getLogger(FmtOff.class);

    private FmtOff() {
    }

    /**
     * Converts every {@code fmt: off} region. A region starts at a statement whose leading
     * comments hold the opening sentinel and ends before the next statement of the same block
     * whose leading comments hold the closing sentinel, or at the end of the block.
     */
    public static void convertRegions(Node root) {
        for (Node container : containers(root)) {
            convertRegionsIn(container);
        }
    }

    private static void convertRegionsIn(Node container) {
        int index = firstStatementIndex(container);
        while (index < container.childCount()) {
            TreeNode statement = container.child(index);
            if (!isStatement(statement)) {
                index++;
                continue;
            }
            Comments.ProtoComment opening = null;
            int previousConsumed = 0;
            for (Comments.ProtoComment comment : Comments.listComments(statement.getPrefix(), false)) {
                if (Comments.FMT_OFF.contains(comment.getValue())) {
                    opening = comment;
                    break;
                }
                previousConsumed = comment.getConsumed();
            }
            if (opening == null) {
                index++;
                continue;
            }
            int end = index + 1;
            while (end < container.childCount() && isStatement(container.child(end))
                    && !startsWithFmtOn(container.child(end))) {
                end++;
            }
            List<TreeNode> region = new ArrayList<>(container.getChildren().subList(index, end));
            String prefix = statement.getPrefix();
            statement.setPrefix(prefix.substring(opening.getConsumed()));
            String value = opening.getValue() + "\n" + render(region);
            String standalonePrefix = prefix.substring(0, previousConsumed) + "\n".repeat(opening.getNewlines());
            replaceWithVerbatim(container, region, value, standalonePrefix);
            logger.fine(() -> "Left " + region.size() + " statement(s) unformatted after '# fmt: off'");
            index++;
        }
    }

    private static boolean startsWithFmtOn(TreeNode statement) {
        for (Comments.ProtoComment comment : Comments.listComments(statement.getPrefix(), false)) {
            if (Comments.FMT_ON.contains(comment.getValue())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Converts simple statements whose line ends in a trailing {@code # fmt: skip}.
     */
    public static void convertSkips(Node root) {
        List<Node> statements = new ArrayList<>();
        collect(root, NodeType.SIMPLE_STMT, statements);
        for (Node statement : statements) {
            TreeNode newline = statement.child(statement.childCount() - 1);
            if (!newline.is(TokenType.NEWLINE)) {
                continue;
            }
            List<Comments.ProtoComment> comments = Comments.listComments(newline.getPrefix(), false);
            if (comments.isEmpty() || comments.get(0).isStandalone()
                    || !Comments.containsFmtSkip(comments.get(0).getValue())) {
                continue;
            }
            List<TreeNode> skipped = new ArrayList<>(statement.getChildren().subList(0, statement.childCount() - 1));
            String prefix = skipped.get(0).getPrefix();
            skipped.get(0).setPrefix("");
            String value = render(skipped) + "  " + comments.get(0).getValue();
            newline.setPrefix("");
            replaceWithVerbatim(statement, skipped, value, prefix);
        }
    }

    /**
     * Keeps every statement that does not touch one of {@code ranges} verbatim. Compound
     * statements that touch a range keep their header formatted and are examined statement by
     * statement inside their blocks.
     */
    public static void convertOutsideRanges(Node root, List<LineRange> ranges) {
        if (ranges.isEmpty()) {
            return;
        }
        convertOutsideRangesIn(root, ranges);
    }

    private static void convertOutsideRangesIn(Node container, List<LineRange> ranges) {
        int index = firstStatementIndex(container);
        while (index < container.childCount()) {
            TreeNode statement = container.child(index);
            if (!isStatement(statement) || statement.is(TokenType.STANDALONE_COMMENT)) {
                index++;
                continue;
            }
            int first = statement.firstLeaf().getLine();
            int last = lastLine(statement);
            boolean touched = ranges.stream().anyMatch(range -> range.intersects(first, last));
            if (!touched) {
                String prefix = statement.getPrefix();
                statement.setPrefix("");
                String value = render(List.of(statement));
                replaceWithVerbatim(container, List.of(statement), value, prefix);
            } else if (statement instanceof Node && !statement.is(NodeType.SIMPLE_STMT)) {
                for (Node inner : directContainers((Node) statement)) {
                    convertOutsideRangesIn(inner, ranges);
                }
            }
            index++;
        }
    }

    private static int lastLine(TreeNode statement) {
        int last = 0;
        for (Leaf leaf : statement.leaves()) {
            if (leaf.is(TokenType.DEDENT) || leaf.is(TokenType.INDENT) || leaf.is(TokenType.NEWLINE)) {
                continue;
            }
            int line = leaf.getLine();
            String value = leaf.getValue();
            for (int i = 0; i < value.length(); i++) {
                if (value.charAt(i) == '\n') {
                    line++;
                }
            }
            last = Math.max(last, line);
        }
        return last;
    }

    // ------------------------------------------------------------------ shared helpers

    private static String render(List<TreeNode> nodes) {
        StringBuilder text = new StringBuilder();
        for (TreeNode node : nodes) {
            text.append(node.toString());
        }
        if (text.length() > 0 && text.charAt(text.length() - 1) == '\n') {
            text.setLength(text.length() - 1);
        }
        return text.toString();
    }

    private static void replaceWithVerbatim(Node parent, List<TreeNode> nodes, String value, String prefix) {
        int firstIndex = parent.indexOf(nodes.get(0));
        for (TreeNode node : nodes) {
            node.remove();
        }
        parent.insertChild(firstIndex, new Leaf(TokenType.STANDALONE_COMMENT, value, prefix,
                nodes.get(0).firstLeaf().getLine(), nodes.get(0).firstLeaf().getColumn()));
    }

    private static boolean isStatement(TreeNode child) {
        return !(child.is(TokenType.NEWLINE) || child.is(TokenType.INDENT) || child.is(TokenType.DEDENT)
                || child.is(TokenType.ENDMARKER));
    }

    private static int firstStatementIndex(Node container) {
        return container.is(NodeType.SUITE) ? 2 : 0;
    }

    /**
     * Every block of the tree that holds statements: the module and all indented suites.
     */
    private static List<Node> containers(Node root) {
        List<Node> result = new ArrayList<>();
        result.add(root);
        collect(root, NodeType.SUITE, result);
        return result;
    }

    private static List<Node> directContainers(Node statement) {
        List<Node> result = new ArrayList<>();
        for (TreeNode child : statement.getChildren()) {
            if (child.is(NodeType.SUITE)) {
                result.add((Node) child);
            } else if (child instanceof Node && !child.is(NodeType.SIMPLE_STMT)) {
                result.addAll(directContainers((Node) child));
            }
        }
        return result;
    }

    private static void collect(TreeNode node, NodeType type, List<Node> into) {
        if (!(node instanceof Node)) {
            return;
        }
        for (TreeNode child : ((Node) node).getChildren()) {
            if (child.is(type)) {
                into.add((Node) child);
            }
            collect(child, type, into);
        }
    }
}
