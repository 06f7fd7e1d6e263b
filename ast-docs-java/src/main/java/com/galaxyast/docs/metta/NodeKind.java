package com.galaxyast.docs.metta;

import java.util.Locale;

/**
 * Node categories of the MeTTa syntax tree.
 */
public enum NodeKind {
    PROGRAM,
    COMMENT,
    EXECUTION,
    EXPRESSION,
    EMPTY_EXPRESSION,
    FUNCTION_DEFINITION,
    FUNCTION_SIGNATURE,
    VARIABLE,
    ATOMSPACE_REF,
    STRING,
    NUMBER,
    OPERATOR,
    ATOM,
    UNKNOWN;

    /** Lower snake case name, e.g. {@code function_definition}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
