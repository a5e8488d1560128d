package com.pyformatter.tree;

/**
 * Grammar kinds of composite tree nodes. Names follow the Python grammar productions.
 */
public enum NodeType {
    FILE_INPUT,
    SIMPLE_STMT,
    EXPR_STMT,
    ANNASSIGN,
    DEL_STMT,
    RETURN_STMT,
    RAISE_STMT,
    GLOBAL_STMT,
    IMPORT_NAME,
    IMPORT_FROM,
    IMPORT_AS_NAME,
    IMPORT_AS_NAMES,
    DOTTED_AS_NAME,
    DOTTED_AS_NAMES,
    DOTTED_NAME,
    ASSERT_STMT,
    IF_STMT,
    WHILE_STMT,
    FOR_STMT,
    TRY_STMT,
    EXCEPT_CLAUSE,
    WITH_STMT,
    ASEXPR_TEST,
    FUNCDEF,
    PARAMETERS,
    TYPEDARGSLIST,
    VARARGSLIST,
    TNAME,
    TNAME_STAR,
    CLASSDEF,
    TYPEPARAMS,
    TYPEVAR,
    TYPEVARTUPLE,
    PARAMSPEC,
    TYPE_STMT,
    DECORATOR,
    DECORATORS,
    DECORATED,
    ASYNC_STMT,
    ASYNC_FUNCDEF,
    SUITE,
    MATCH_STMT,
    CASE_BLOCK,
    GUARD,
    ATOM,
    TRAILER,
    POWER,
    FACTOR,
    TERM,
    ARITH_EXPR,
    SHIFT_EXPR,
    AND_EXPR,
    XOR_EXPR,
    EXPR,
    COMPARISON,
    COMP_OP,
    NOT_TEST,
    AND_TEST,
    OR_TEST,
    TEST,
    LAMBDEF,
    NAMEDEXPR_TEST,
    TESTLIST_GEXP,
    LISTMAKER,
    TESTLIST_STAR_EXPR,
    EXPRLIST,
    TESTLIST,
    ARGLIST,
    ARGUMENT,
    SUBSCRIPT,
    SUBSCRIPTLIST,
    SLICEOP,
    DICTSETMAKER,
    COMP_FOR,
    COMP_IF,
    STAR_EXPR,
    YIELD_EXPR,
    YIELD_ARG;

    /**
     * Statements whose header line opens an indented block.
     */
    public boolean isCompoundStatement() {
        return switch (this) {
            case IF_STMT, WHILE_STMT, FOR_STMT, TRY_STMT, WITH_STMT, FUNCDEF, CLASSDEF,
                    ASYNC_STMT, ASYNC_FUNCDEF, DECORATED, MATCH_STMT, CASE_BLOCK -> true;
            default -> false;
        };
    }
}
