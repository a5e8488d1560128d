package com.pyformatter.lines;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.Preview;
import com.pyformatter.normalize.DocstringNormalizer;
import com.pyformatter.normalize.NumericNormalizer;
import com.pyformatter.normalize.StringNormalizer;
import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.NodeType;
import com.pyformatter.tree.TreeNode;
import com.pyformatter.tree.Trees;
import com.pyformatter.util.LoggerUtil;

/**
 * Walks the tree depth-first and cuts it into logical lines, one per statement or statement
 * header. Comments found in leaf prefixes become trailing or standalone comments, string and
 * number literals are normalized, and optional parentheses are placed on the way.
 */
public class LineGenerator {
    private static final Logger logger = LoggerUtil.getLogger(LineGenerator.class);

    static final Set<String> ASSIGNMENTS = Set.of(
            "=", ":=", "+=", "-=", "*=", "@=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "**=", "//=");

    private static final Set<TokenType> WHITESPACE = EnumSet.of(
            TokenType.NEWLINE, TokenType.NL, TokenType.INDENT, TokenType.DEDENT, TokenType.ENDMARKER,
            TokenType.COMMENT);

    private static final Set<NodeType> ARITH_LIKE = EnumSet.of(
            NodeType.ARITH_EXPR, NodeType.SHIFT_EXPR, NodeType.XOR_EXPR, NodeType.AND_EXPR);

    private final FormatOptions options;
    private final List<Line> lines = new ArrayList<>();
    private Line currentLine;

    public LineGenerator(FormatOptions options) {
        this.options = options;
    }

    /**
     * Produces the logical lines of {@code root} in source order. The tree is modified in place:
     * prefixes are normalized and parentheses are added, hidden or shown.
     */
    public List<Line> generate(Node root) {
        lines.clear();
        currentLine = new Line(options, 0, false);
        visit(root);
        line(0);
        logger.fine(() -> "Generated " + lines.size() + " logical lines");
        return new ArrayList<>(lines);
    }

    /**
     * Closes the current line and starts a new one {@code indent} levels deeper. An empty line is
     * never emitted; only its depth changes.
     */
    private void line(int indent) {
        if (currentLine.isEmpty()) {
            currentLine.setDepth(currentLine.getDepth() + indent);
            return;
        }
        if (currentLine.getLeaves().size() == 1 && isAsyncKeyword(currentLine.getLeaves().get(0))) {
            // the async keyword waits for the def, for or with that follows it
            return;
        }
        Line complete = currentLine;
        currentLine = new Line(options, complete.getDepth() + indent, false);
        lines.add(complete);
    }

    private static boolean isAsyncKeyword(Leaf leaf) {
        Node parent = leaf.getParent();
        return leaf.isName("async") && parent != null
                && (parent.is(NodeType.ASYNC_STMT) || parent.is(NodeType.ASYNC_FUNCDEF));
    }

    // ------------------------------------------------------------------ dispatch

    private void visit(TreeNode node) {
        if (node instanceof Leaf) {
            visitLeaf((Leaf) node);
        } else {
            visitNode((Node) node);
        }
    }

    private void visitLeaf(Leaf leaf) {
        switch (leaf.getType()) {
            case INDENT -> {
                line(1);
                visitDefault(leaf);
            }
            case DEDENT -> visitDedent(leaf);
            case ENDMARKER -> {
                visitDefault(leaf);
                line(0);
            }
            case STANDALONE_COMMENT -> {
                if (!currentLine.getBracketTracker().anyOpenBrackets()) {
                    line(0);
                }
                visitDefault(leaf);
            }
            case STRING -> visitString(leaf);
            default -> {
                if (leaf.isOp(";")) {
                    line(0);
                } else {
                    visitDefault(leaf);
                }
            }
        }
    }

    private void visitNode(Node node) {
        switch (node.getType()) {
            case SIMPLE_STMT -> visitSimpleStmt(node);
            case SUITE -> visitSuite(node);
            case DECORATED, DECORATORS -> visitDecorators(node);
            case ASYNC_STMT, ASYNC_FUNCDEF -> visitAsyncStmt(node);
            case FUNCDEF -> visitFuncdef(node);
            case MATCH_STMT, CASE_BLOCK -> visitMatchCase(node);
            case GUARD -> visitGuard(node);
            case FACTOR -> visitFactor(node);
            case POWER -> visitPower(node);
            case ASSERT_STMT -> visitStmt(node, Set.of("assert"), Set.of("assert", ","));
            case IF_STMT -> visitStmt(node, Set.of("if", "else", "elif"), Set.of("if", "elif"));
            case WHILE_STMT -> visitStmt(node, Set.of("while", "else"), Set.of("while"));
            case FOR_STMT -> visitStmt(node, Set.of("for", "else"), Set.of("for", "in"));
            case TRY_STMT -> visitStmt(node, Set.of("try", "except", "else", "finally"), Set.of());
            case EXCEPT_CLAUSE -> visitStmt(node, Set.of("except"), Set.of("except"));
            case WITH_STMT -> visitStmt(node, Set.of("with"), Set.of("with"));
            case CLASSDEF -> visitStmt(node, Set.of("class"), Set.of());
            case EXPR_STMT -> visitStmt(node, Set.of(), ASSIGNMENTS);
            case RETURN_STMT -> visitStmt(node, Set.of("return"), Set.of("return"));
            case IMPORT_FROM -> visitStmt(node, Set.of(), Set.of("import"));
            case DEL_STMT -> visitStmt(node, Set.of("del"), Set.of("del"));
            default -> visitChildren(node);
        }
    }

    private void visitChildren(Node node) {
        for (TreeNode child : new ArrayList<>(node.getChildren())) {
            visit(child);
        }
    }

    // ------------------------------------------------------------------ leaves

    private void visitDefault(Leaf leaf) {
        boolean anyOpenBrackets = currentLine.getBracketTracker().anyOpenBrackets();
        for (Comments.ProtoComment proto : Comments.listComments(leaf.getPrefix(), leaf.is(TokenType.ENDMARKER))) {
            Leaf comment = proto.toLeaf();
            if (anyOpenBrackets) {
                // comments inside brackets are subject to splitting
                currentLine.append(comment);
            } else if (comment.is(TokenType.COMMENT)) {
                currentLine.append(comment);
                line(0);
            } else {
                line(0);
                currentLine.append(comment);
                line(0);
            }
        }
        normalizePrefix(leaf, anyOpenBrackets);
        if (leaf.is(TokenType.STRING)) {
            normalizeString(leaf);
        } else if (leaf.is(TokenType.NUMBER)) {
            leaf.setValue(NumericNormalizer.normalize(leaf.getValue()));
        }
        if (!WHITESPACE.contains(leaf.getType())) {
            currentLine.append(leaf);
        }
    }

    /**
     * Outside brackets only the blank lines after the last comment survive (plus a form feed
     * marker); inside brackets, and after a backslash continuation, the prefix is emptied.
     */
    private static void normalizePrefix(Leaf leaf, boolean insideBrackets) {
        if (!insideBrackets) {
            String afterComments = Comments.afterComments(leaf.getPrefix(), leaf.is(TokenType.ENDMARKER));
            if (afterComments.indexOf('\\') < 0) {
                int newlines = 0;
                for (int i = 0; i < afterComments.length(); i++) {
                    if (afterComments.charAt(i) == '\n') {
                        newlines++;
                    }
                }
                leaf.setPrefix("\n".repeat(newlines) + (afterComments.indexOf('\f') >= 0 ? "\f" : ""));
                return;
            }
        }
        leaf.setPrefix("");
    }

    private void normalizeString(Leaf leaf) {
        String value = StringNormalizer.normalizePrefix(leaf.getValue());
        if (!options.isSkipStringNormalization()) {
            value = StringNormalizer.normalizeQuotes(value);
            value = StringNormalizer.normalizeUnicodeEscapeSequences(value);
        }
        leaf.setValue(value);
    }

    private void visitString(Leaf leaf) {
        if (Trees.isDocstring(leaf)) {
            String formatted = DocstringNormalizer.format(leaf.getValue(), currentLine.getDepth(),
                    options.getLineLength(), !options.isSkipStringNormalization());
            leaf.setValue(formatted);
        }
        visitDefault(leaf);
    }

    /**
     * Comments in the prefix of a dedent are indented like the block that just ended, so they
     * are emitted as standalone lines before the depth drops.
     */
    private void visitDedent(Leaf leaf) {
        line(0);
        for (Comments.ProtoComment proto : Comments.listComments(leaf.getPrefix(), false)) {
            Leaf comment = proto.toLeaf();
            comment.setType(TokenType.STANDALONE_COMMENT);
            currentLine.append(comment);
            line(0);
        }
        leaf.setPrefix("");
        line(0);
        line(-1);
    }

    // ------------------------------------------------------------------ statements

    private void visitStmt(Node node, Set<String> keywords, Set<String> parens) {
        InvisibleParens.normalize(node, parens);
        for (TreeNode child : new ArrayList<>(node.getChildren())) {
            if (child.is(TokenType.NAME) && keywords.contains(((Leaf) child).getValue())) {
                line(0);
            }
            visit(child);
        }
    }

    private void visitSimpleStmt(Node node) {
        TreeNode previous = null;
        for (TreeNode child : new ArrayList<>(node.getChildren())) {
            boolean startsStatement = previous == null || (previous instanceof Leaf && ((Leaf) previous).isOp(";"));
            if (startsStatement && child instanceof Node && ARITH_LIKE.contains(((Node) child).getType())) {
                InvisibleParens.wrapInParentheses(node, child, false);
            }
            previous = child;
        }
        Node parent = node.getParent();
        boolean suiteLike = parent != null && Trees.STATEMENTS.contains(parent.getType());
        if (suiteLike) {
            if ((options.isPyi() || Trees.isFunctionOrClass(parent)) && Trees.isStubBody(node)) {
                visitChildren(node);
            } else {
                line(1);
                visitChildren(node);
                line(-1);
            }
        } else {
            if (parent == null || !parent.is(NodeType.SUITE) || !Trees.isStubSuite(parent)) {
                line(0);
            }
            visitChildren(node);
        }
    }

    private void visitSuite(Node node) {
        if (Trees.isStubSuite(node)) {
            // "def f(): ..." keeps its body on the header line
            visit(node.child(2));
        } else {
            visitChildren(node);
        }
    }

    private void visitDecorators(Node node) {
        for (TreeNode child : new ArrayList<>(node.getChildren())) {
            line(0);
            visit(child);
        }
    }

    private void visitAsyncStmt(Node node) {
        line(0);
        visit(node.child(0));
        visit(node.child(1));
    }

    /**
     * Removes redundant parentheses around a return annotation and wraps a bare one in
     * invisible parentheses.
     */
    private void visitFuncdef(Node node) {
        line(0);
        boolean returnAnnotation = false;
        for (TreeNode child : new ArrayList<>(node.getChildren())) {
            if (child instanceof Leaf && ((Leaf) child).isOp("->")) {
                returnAnnotation = true;
            } else if (returnAnnotation) {
                if (child.is(NodeType.ATOM) && ((Node) child).child(0) instanceof Leaf
                        && ((Leaf) ((Node) child).child(0)).isOp("(")) {
                    if (InvisibleParens.makeParensInvisibleInAtom(child, node, false)) {
                        InvisibleParens.wrapInParentheses(node, child, false);
                    }
                } else {
                    InvisibleParens.wrapInParentheses(node, child, false);
                }
                returnAnnotation = false;
            }
        }
        for (TreeNode child : new ArrayList<>(node.getChildren())) {
            visit(child);
        }
    }

    private void visitMatchCase(Node node) {
        line(0);
        visitChildren(node);
    }

    private void visitGuard(Node node) {
        if (options.isPreview(Preview.REMOVE_REDUNDANT_GUARD_PARENS)) {
            InvisibleParens.normalize(node, Set.of("if"));
        }
        visitChildren(node);
    }

    // ------------------------------------------------------------------ expressions

    /**
     * A unary operator applied to a power gets explicit parentheses: {@code -(2**8)}.
     */
    private void visitFactor(Node node) {
        TreeNode operand = node.child(1);
        if (operand.is(NodeType.POWER) && ((Node) operand).childCount() == 3
                && ((Node) operand).child(1) instanceof Leaf && ((Leaf) ((Node) operand).child(1)).isOp("**")) {
            InvisibleParens.wrapInParentheses(node, operand, true);
        }
        visitChildren(node);
    }

    private void visitPower(Node node) {
        for (int i = 0; i < node.childCount() - 1; i++) {
            TreeNode child = node.child(i);
            if (!(child instanceof Leaf) || !child.is(TokenType.NUMBER)) {
                continue;
            }
            TreeNode next = node.child(i + 1);
            String value = ((Leaf) child).getValue().toLowerCase(Locale.ROOT);
            if (next.is(NodeType.TRAILER) && ((Node) next).child(0) instanceof Leaf
                    && ((Leaf) ((Node) next).child(0)).isOp(".")
                    && !value.startsWith("0x") && !value.startsWith("0b") && !value.startsWith("0o")
                    && !value.contains("j")) {
                // 1 .real becomes (1).real
                InvisibleParens.wrapInParentheses(node, child, true);
            }
        }
        removeAwaitParens(node);
        visitChildren(node);
    }

    private static void removeAwaitParens(Node node) {
        if (node.childCount() < 2 || !(node.child(0) instanceof Leaf) || !((Leaf) node.child(0)).isName("await")) {
            return;
        }
        TreeNode operand = node.child(1);
        if (!operand.is(NodeType.ATOM) || !(((Node) operand).child(0) instanceof Leaf)
                || !((Leaf) ((Node) operand).child(0)).isOp("(")) {
            return;
        }
        if (InvisibleParens.makeParensInvisibleInAtom(operand, node, true)) {
            InvisibleParens.wrapInParentheses(node, operand, false);
        }
        Node atom = (Node) node.child(1);
        if (atom.childCount() < 3) {
            return;
        }
        TreeNode contents = atom.child(1);
        if (!(contents instanceof Node)) {
            return;
        }
        Node inner = (Node) contents;
        boolean keepParens = !inner.is(NodeType.POWER)
                || (inner.child(0) instanceof Leaf && ((Leaf) inner.child(0)).isName("await"));
        for (TreeNode child : inner.getChildren()) {
            if (child instanceof Leaf && ((Leaf) child).isOp("**")) {
                keepParens = true;
            }
        }
        if (keepParens) {
            // await binds tighter than most operators
            ((Leaf) atom.child(0)).makeVisible();
            ((Leaf) atom.child(atom.childCount() - 1)).makeVisible();
        }
    }
}
