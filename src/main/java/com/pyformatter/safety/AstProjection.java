package com.pyformatter.safety;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.NodeType;
import com.pyformatter.tree.TreeNode;
import com.pyformatter.tree.Trees;

/**
 * Projects a concrete tree onto the parts that carry meaning, one indented line per element.
 * Two programs that differ only in layout project to the same lines.
 *
 * <p>Left out of the projection: whitespace, comments and backslash continuations (all live in
 * prefixes), newline and indentation tokens, semicolons, commas, and parentheses that only
 * group. Tuples are marked explicitly, so dropping commas and grouping parentheses cannot hide
 * a change between {@code a} and {@code (a,)}. String literals appear as their decoded value,
 * numbers as their numeric value, and simple statements are listed one by one whether they
 * were joined with {@code ;} or written on the header line of a block.
 */
public final class AstProjection {

    private static final Set<TokenType> SKIPPED_TOKENS = Set.of(
            TokenType.NEWLINE, TokenType.NL, TokenType.INDENT, TokenType.DEDENT, TokenType.ENDMARKER,
            TokenType.COMMENT, TokenType.STANDALONE_COMMENT);

    private static final Set<NodeType> TUPLES = Set.of(
            NodeType.TESTLIST_GEXP, NodeType.TESTLIST_STAR_EXPR, NodeType.EXPRLIST, NodeType.TESTLIST,
            NodeType.SUBSCRIPTLIST);

    // Sequences whose trailing comma is meaningless and whose single element stands for itself
    private static final Set<NodeType> SEQUENCES = Set.of(
            NodeType.ARGLIST, NodeType.TYPEDARGSLIST, NodeType.VARARGSLIST, NodeType.LISTMAKER,
            NodeType.DICTSETMAKER, NodeType.IMPORT_AS_NAMES, NodeType.DOTTED_AS_NAMES);

    private final List<String> lines = new ArrayList<>();

    private AstProjection() {
    }

    public static List<String> of(Node root) {
        AstProjection projection = new AstProjection();
        projection.visit(root, 0);
        return projection.lines;
    }

    private void visit(TreeNode node, int depth) {
        if (node instanceof Leaf) {
            visitLeaf((Leaf) node, depth);
            return;
        }
        Node current = (Node) node;
        switch (current.getType()) {
            case FILE_INPUT, SUITE -> visitBlock(current, depth);
            case SIMPLE_STMT -> {
                emit(depth, "BODY");
                visitSmallStatements(current, depth + 1);
            }
            case ATOM -> visitAtom(current, depth);
            case CLASSDEF -> visitChildren(current, depth, true);
            case IMPORT_FROM -> visitChildren(current, depth, true);
            default -> {
                if (TUPLES.contains(current.getType()) && !isGenerator(current)) {
                    emit(depth, "TUPLE");
                    visitChildren(current, depth + 1, false);
                } else if (SEQUENCES.contains(current.getType()) && countMeaningful(current) == 1) {
                    visitChildren(current, depth, false);
                } else {
                    emit(depth, current.getType().name());
                    visitChildren(current, depth + 1, false);
                }
            }
        }
    }

    private void visitBlock(Node block, int depth) {
        emit(depth, block.is(NodeType.FILE_INPUT) ? "MODULE" : "BODY");
        for (TreeNode child : block.getChildren()) {
            if (child.is(NodeType.SIMPLE_STMT)) {
                visitSmallStatements((Node) child, depth + 1);
            } else {
                visit(child, depth + 1);
            }
        }
    }

    private void visitSmallStatements(Node statement, int depth) {
        for (TreeNode child : statement.getChildren()) {
            if (child instanceof Leaf && ((Leaf) child).isOp(";")) {
                continue;
            }
            if (child instanceof Leaf && child.is(TokenType.STRING)) {
                emit(depth, "EXPR " + docstringValue(((Leaf) child).getValue()));
            } else {
                visit(child, depth);
            }
        }
    }

    private void visitAtom(Node atom, int depth) {
        TreeNode first = atom.child(0);
        if (!(first instanceof Leaf && ((Leaf) first).isLeftParen())) {
            emit(depth, "ATOM");
            visitChildren(atom, depth + 1, false);
            return;
        }
        if (atom.childCount() == 2) {
            emit(depth, "TUPLE");
            return;
        }
        // a parenthesized expression projects as the expression itself
        visit(atom.child(1), depth);
    }

    private void visitChildren(Node node, int depth, boolean skipParens) {
        for (TreeNode child : node.getChildren()) {
            if (child instanceof Leaf && skipParens && (((Leaf) child).isLeftParen() || ((Leaf) child).isRightParen())) {
                continue;
            }
            visit(child, depth);
        }
    }

    private void visitLeaf(Leaf leaf, int depth) {
        if (SKIPPED_TOKENS.contains(leaf.getType()) || leaf.isOp(",") || leaf.isOp(";") || leaf.isInvisible()) {
            return;
        }
        switch (leaf.getType()) {
            case STRING -> emit(depth, "STRING " + stringValue(leaf.getValue()));
            case NUMBER -> emit(depth, "NUMBER " + numberValue(leaf.getValue()));
            default -> emit(depth, leaf.getType().name() + " " + leaf.getValue());
        }
    }

    private void emit(int depth, String text) {
        lines.add("  ".repeat(depth) + text);
    }

    private static boolean isGenerator(Node node) {
        for (TreeNode child : node.getChildren()) {
            if (child.is(NodeType.COMP_FOR)) {
                return true;
            }
        }
        return false;
    }

    private static int countMeaningful(Node node) {
        int count = 0;
        for (TreeNode child : node.getChildren()) {
            if (!(child instanceof Leaf && ((Leaf) child).isOp(","))) {
                count++;
            }
        }
        return count;
    }

    /**
     * A string literal as its kind ({@code b}, {@code f} or nothing) and its decoded value with
     * control characters escaped.
     */
    static String stringValue(String literal) {
        int prefixLength = Trees.stringPrefixLength(literal);
        String prefix = literal.substring(0, prefixLength).toLowerCase(Locale.ROOT);
        String kind = (prefix.contains("b") ? "b" : "") + (prefix.contains("f") ? "f" : "");
        return kind + "'" + escapeForDisplay(decode(literal)) + "'";
    }

    /**
     * Docstrings compare line by line with surrounding whitespace removed.
     */
    static String docstringValue(String literal) {
        String decoded = decode(literal);
        StringBuilder normalized = new StringBuilder();
        for (String line : decoded.split("\n", -1)) {
            if (normalized.length() > 0) {
                normalized.append('\n');
            }
            normalized.append(line.strip());
        }
        String prefix = literal.substring(0, Trees.stringPrefixLength(literal)).toLowerCase(Locale.ROOT);
        String kind = (prefix.contains("b") ? "b" : "") + (prefix.contains("f") ? "f" : "");
        return "STRING " + kind + "'" + escapeForDisplay(normalized.toString().strip()) + "'";
    }

    /**
     * The characters a string literal denotes. Raw literals keep their backslashes.
     */
    static String decode(String literal) {
        int prefixLength = Trees.stringPrefixLength(literal);
        String prefix = literal.substring(0, prefixLength).toLowerCase(Locale.ROOT);
        String rest = literal.substring(prefixLength);
        int quoteLength = Trees.hasTripleQuotes(rest) ? 3 : 1;
        String body = rest.substring(quoteLength, rest.length() - quoteLength);
        if (prefix.contains("r")) {
            return body;
        }
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> { }
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000B');
                case 'x' -> i = appendHex(body, i, 2, out, "\\x");
                case 'u' -> i = appendHex(body, i, 4, out, "\\u");
                case 'U' -> i = appendHex(body, i, 8, out, "\\U");
                case 'N' -> i = appendNamed(body, i, out);
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i - 1;
                        while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        out.appendCodePoint(Integer.parseInt(body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        out.append('\\').append(next);
                    }
                }
            }
        }
        return out.toString();
    }

    private static int appendHex(String body, int start, int digits, StringBuilder out, String escape) {
        int end = start + digits;
        if (end > body.length()) {
            out.append(escape);
            return start;
        }
        try {
            out.appendCodePoint(Integer.parseUnsignedInt(body.substring(start, end), 16));
            return end;
        } catch (IllegalArgumentException e) {
            out.append(escape);
            return start;
        }
    }

    private static int appendNamed(String body, int start, StringBuilder out) {
        int close = body.indexOf('}', start);
        if (start >= body.length() || body.charAt(start) != '{' || close < 0) {
            out.append("\\N");
            return start;
        }
        String name = body.substring(start + 1, close);
        try {
            out.appendCodePoint(Character.codePointOf(name));
        } catch (IllegalArgumentException e) {
            out.append("\\N{").append(name.toUpperCase(Locale.ROOT)).append('}');
        }
        return close + 1;
    }

    private static String escapeForDisplay(String value) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\\' -> out.append("\\\\");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }

    /**
     * The value a numeric literal denotes, so that {@code 0XFF}, {@code 0xff} and {@code 255}
     * agree, as do {@code .5} and {@code 0.50}.
     */
    static String numberValue(String literal) {
        String text = literal.toLowerCase(Locale.ROOT).replace("_", "");
        String suffix = "";
        if (text.endsWith("j")) {
            suffix = "j";
            text = text.substring(0, text.length() - 1);
        }
        try {
            if (text.startsWith("0x")) {
                return new BigInteger(text.substring(2), 16) + suffix;
            }
            if (text.startsWith("0o")) {
                return new BigInteger(text.substring(2), 8) + suffix;
            }
            if (text.startsWith("0b")) {
                return new BigInteger(text.substring(2), 2) + suffix;
            }
            if (text.contains(".") || text.contains("e") || !suffix.isEmpty()) {
                BigDecimal value = new BigDecimal(text.startsWith(".") ? "0" + text : text);
                return "float:" + value.stripTrailingZeros().toPlainString() + suffix;
            }
            return new BigInteger(text).toString();
        } catch (NumberFormatException e) {
            return literal;
        }
    }
}
