package com.galaxyast.docs.metta;

/**
 * Token categories produced by {@link MettaLexer}, listed in match precedence order.
 */
public enum TokenKind {
    COMMENT,
    EXECUTE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    ATOMSPACE,
    VARIABLE,
    STRING,
    NUMBER,
    EQUALS,
    OPERATOR,
    ATOM
}
