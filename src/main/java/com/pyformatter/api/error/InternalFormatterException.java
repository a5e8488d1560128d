package com.pyformatter.api.error;

/**
 * The formatter itself misbehaved: the output is not equivalent to the input, is not stable,
 * or an invariant of the split engine was violated. The produced output must be discarded.
 */
public class InternalFormatterException extends FormatterException {
    private final String diagnostic;

    public InternalFormatterException(String message, String diagnostic) {
        super(message, 0, 0);
        this.diagnostic = diagnostic;
    }

    public InternalFormatterException(String message, String diagnostic, Throwable cause) {
        super(message, 0, 0, cause);
        this.diagnostic = diagnostic;
    }

    /**
     * A reproducible dump of the problematic stage output.
     */
    public String getDiagnostic() {
        return diagnostic;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.INTERNAL;
    }
}
