package com.pyformatter.api;

/**
 * Language features whose availability depends on the targeted Python version.
 */
public enum Feature {
    F_STRINGS("f-strings"),
    DEBUG_F_STRINGS("self-documenting f-string expressions"),
    NUMERIC_UNDERSCORES("underscores in numeric literals"),
    TRAILING_COMMA_IN_CALL("trailing comma after *args or **kwargs in calls"),
    TRAILING_COMMA_IN_DEF("trailing comma after *args or **kwargs in definitions"),
    ASYNC_KEYWORDS("async/await as reserved keywords"),
    ASSIGNMENT_EXPRESSIONS("assignment expressions"),
    POS_ONLY_ARGUMENTS("positional-only parameters"),
    RELAXED_DECORATORS("relaxed decorator expressions"),
    PATTERN_MATCHING("match statements"),
    UNPACKING_ON_FLOW("unparenthesized unpacking in return and yield"),
    ANN_ASSIGN_EXTENDED_RHS("unparenthesized tuples in annotated assignments"),
    EXCEPT_STAR("except* clauses"),
    VARIADIC_GENERICS("star unpacking in subscripts and annotations"),
    PARENTHESIZED_CONTEXT_MANAGERS("parenthesized context managers"),
    TYPE_PARAMS("type parameter lists and type statements"),
    // Internal only: never detected, never part of a version
    FORCE_OPTIONAL_PARENTHESES("forced optional parentheses");

    private final String description;

    Feature(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
