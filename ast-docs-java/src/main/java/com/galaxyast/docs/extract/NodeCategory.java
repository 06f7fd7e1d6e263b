package com.galaxyast.docs.extract;

/**
 * Language-neutral role of a syntax node for definition extraction.
 */
public enum NodeCategory {
    CLASS_LIKE,
    FUNCTION_LIKE,
    VARIABLE_LIKE,
    OTHER
}
