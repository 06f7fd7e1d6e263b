package com.galaxyast.docs.syntax;

import com.galaxyast.docs.language.Language;

/**
 * A third-party parser for a conventional language.
 */
public interface ExternalParser {

    Language language();

    /**
     * @throws SourceDecoder.DecodeException if the bytes are not valid UTF-8
     */
    SyntaxTree parse(byte[] source);
}
