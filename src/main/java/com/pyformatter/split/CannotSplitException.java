package com.pyformatter.split;

/**
 * Raised by a split strategy that cannot produce a useful result for a line. The transformer
 * catches it and tries the next strategy; it never leaves the split engine.
 */
public class CannotSplitException extends Exception {

    public CannotSplitException(String message) {
        super(message);
    }

    public CannotSplitException(String message, Throwable cause) {
        super(message, cause);
    }
}
