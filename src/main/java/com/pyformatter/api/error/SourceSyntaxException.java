package com.pyformatter.api.error;

/**
 * The input cannot be tokenized or parsed under any requested grammar version.
 */
public class SourceSyntaxException extends FormatterException {

    public SourceSyntaxException(String message, int line, int column) {
        super(message + " (" + line + ":" + column + ")", line, column);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.SYNTAX;
    }
}
