package com.pyformatter.api;

/**
 * Experimental style changes that are off unless explicitly enabled.
 */
public enum Preview {
    /** Always put exactly one blank line after a block of top-level imports. */
    ALWAYS_ONE_NEWLINE_AFTER_IMPORT,
    /** Drop redundant parentheses around a match case guard. */
    REMOVE_REDUNDANT_GUARD_PARENS
}
