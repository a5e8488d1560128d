package com.pyformatter.tokenize;

/**
 * Kinds of tokens produced by {@link Tokenizer}, plus the leaf-only {@link #STANDALONE_COMMENT}.
 */
public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    COMMENT,
    NL,
    NEWLINE,
    INDENT,
    DEDENT,
    ENDMARKER,
    /** A comment (or verbatim region) occupying its own line; never produced by the tokenizer. */
    STANDALONE_COMMENT;

    /**
     * Tokens that only carry trivia and get folded into leaf prefixes.
     */
    public boolean isTrivia() {
        return this == COMMENT || this == NL;
    }
}
