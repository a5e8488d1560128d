package com.pyformatter.tokenize;

/**
 * An immutable token with its exact source span.
 */
public final class Token {
    private final TokenType type;
    private final String value;
    private final int line;
    private final int column;
    private final int startOffset;
    private final int endOffset;

    public Token(TokenType type, String value, int line, int column, int startOffset, int endOffset) {
        this.type = type;
        this.value = value;
        this.line = line;
        this.column = column;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    public TokenType getType() { return type; }
    public String getValue() { return value; }
    /** 1-based line of the first character. */
    public int getLine() { return line; }
    /** 0-based column of the first character. */
    public int getColumn() { return column; }
    public int getStartOffset() { return startOffset; }
    public int getEndOffset() { return endOffset; }

    public boolean isOp(String op) {
        return type == TokenType.OP && value.equals(op);
    }

    public boolean isName(String name) {
        return type == TokenType.NAME && value.equals(name);
    }

    @Override
    public String toString() {
        return type + "(" + value.replace("\n", "\\n") + ")@" + line + ":" + column;
    }
}
