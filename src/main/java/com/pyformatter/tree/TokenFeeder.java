package com.pyformatter.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.pyformatter.tokenize.Token;
import com.pyformatter.tokenize.TokenType;

/**
 * Turns the token stream into the leaves the parser consumes. Trivia (comments, blank lines,
 * whitespace and backslash continuations) is folded into the prefix of the following leaf.
 * <p>
 * Indentation text moves from the INDENT leaf to the first leaf of the block. Comments that
 * precede a DEDENT but are still indented at the inner block's column stay with the DEDENT
 * leaf so that they remain inside the block.
 */
final class TokenFeeder {

    private TokenFeeder() {
    }

    static List<Leaf> feed(String source, List<Token> tokens) {
        List<Leaf> leaves = new ArrayList<>();
        Deque<Integer> indentColumns = new ArrayDeque<>();
        int consumed = 0;

        for (Token token : tokens) {
            TokenType type = token.getType();
            if (type.isTrivia()) {
                continue;
            }
            String gap = source.substring(consumed, token.getStartOffset());
            switch (type) {
                case INDENT -> {
                    indentColumns.push(token.getValue().length());
                    leaves.add(new Leaf(TokenType.INDENT, "", "", token.getLine(), token.getColumn()));
                    // consumed stays put: the indentation becomes part of the next prefix
                }
                case DEDENT -> {
                    int column = indentColumns.isEmpty() ? 0 : indentColumns.pop();
                    String inner = partiallyConsumePrefix(gap, column);
                    leaves.add(new Leaf(TokenType.DEDENT, "", inner, token.getLine(), token.getColumn()));
                    consumed += inner.length();
                }
                default -> {
                    leaves.add(new Leaf(type, token.getValue(), gap, token.getLine(), token.getColumn()));
                    consumed = token.getEndOffset();
                }
            }
        }
        return leaves;
    }

    /**
     * Takes the leading comment lines of {@code prefix} that are indented at least at
     * {@code column}; stops at the first non-empty line indented less.
     */
    static String partiallyConsumePrefix(String prefix, int column) {
        StringBuilder lines = new StringBuilder();
        StringBuilder currentLine = new StringBuilder();
        int currentColumn = 0;
        boolean waitForNewline = false;
        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            currentLine.append(c);
            if (waitForNewline) {
                if (c == '\n') {
                    if (!currentLine.toString().isBlank() && currentColumn < column) {
                        return lines.toString();
                    }
                    lines.append(currentLine);
                    currentLine.setLength(0);
                    currentColumn = 0;
                    waitForNewline = false;
                }
            } else if (c == ' ') {
                currentColumn++;
            } else if (c == '\t') {
                currentColumn += 4;
            } else if (c == '\n') {
                currentColumn = 0;
            } else if (c != '\f') {
                waitForNewline = true;
            }
        }
        return lines.toString();
    }
}
