package io.github.manjago.h2lang.ast;

/**
 * Inferred type of a function parameter.
 */
public enum ParamType {

    /** Used as a term: binds to a list of commands. Empty when defaulted. */
    COMMAND_SEQUENCE,

    /** Used inside a numeric expression: binds to a number. 0 when defaulted. */
    INTEGER
}
