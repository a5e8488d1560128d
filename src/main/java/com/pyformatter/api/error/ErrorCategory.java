package com.pyformatter.api.error;

/**
 * Classifies why a unit of source could not be formatted.
 */
public enum ErrorCategory {
    SYNTAX,
    UNSUPPORTED,
    INTERNAL,
    IO
}
