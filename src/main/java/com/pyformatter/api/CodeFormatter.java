package com.pyformatter.api;

/**
 * The formatter boundary: a pure function from source text and options to a result.
 */
public interface CodeFormatter {
    FormatterResult format(String sourceCode, FormatOptions options);
}
