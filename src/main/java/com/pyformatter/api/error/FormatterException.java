package com.pyformatter.api.error;

/**
 * Base class of every failure that stops a single unit of source from being formatted.
 */
public abstract class FormatterException extends Exception {
    private final int line;
    private final int column;

    protected FormatterException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    protected FormatterException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public abstract ErrorCategory getCategory();

    /** 1-based line of the offending construct, 0 when unknown. */
    public int getLine() {
        return line;
    }

    /** 0-based column of the offending construct. */
    public int getColumn() {
        return column;
    }
}
