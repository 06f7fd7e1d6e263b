package com.galaxyast.docs.metta;

/**
 * A single lexeme of MeTTa source with its position.
 *
 * @param kind   token category
 * @param text   matched source text
 * @param line   1-based line number
 * @param column 0-based offset from the start of the line
 */
public record MettaToken(TokenKind kind, String text, int line, int column) {

    public boolean is(TokenKind expected) {
        return kind == expected;
    }
}
