package com.galaxyast.docs.syntax;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 decoding for source bytes.
 *
 * The MeTTa front-end decodes leniently and drops malformed sequences. External
 * parsers need the exact text their byte offsets refer to, so they decode strictly.
 */
public final class SourceDecoder {

    private SourceDecoder() {}

    public static class DecodeException extends RuntimeException {
        public DecodeException(String message, Throwable cause) { super(message, cause); }
    }

    public static String lossy(byte[] source) {
        return decode(source, CodingErrorAction.IGNORE);
    }

    /**
     * @throws DecodeException if {@code source} is not valid UTF-8
     */
    public static String strict(byte[] source) {
        return decode(source, CodingErrorAction.REPORT);
    }

    private static String decode(byte[] source, CodingErrorAction onError) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(onError)
            .onUnmappableCharacter(onError);
        try {
            return decoder.decode(ByteBuffer.wrap(source)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Source is not valid UTF-8: " + e.getMessage(), e);
        }
    }
}
