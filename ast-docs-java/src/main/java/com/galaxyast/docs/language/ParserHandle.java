package com.galaxyast.docs.language;

import com.galaxyast.docs.syntax.ExternalParser;

/**
 * How a file of a given language is parsed: by an external parser, or by the
 * built-in MeTTa front-end.
 */
public sealed interface ParserHandle {

    record External(ExternalParser parser) implements ParserHandle {}

    /** Sentinel for the MeTTa lexer and parser. */
    record Dsl() implements ParserHandle {}

    Dsl DSL = new Dsl();
}
