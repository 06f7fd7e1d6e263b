package com.galaxyast.docs.metta;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizes MeTTa source text.
 *
 * Alternatives are tried in declaration order at each position, so earlier rules win
 * over later ones for the same prefix ("!=" lexes as EXECUTE followed by EQUALS,
 * "-5" as a NUMBER). Whitespace and newlines are consumed but never emitted.
 * Characters that no rule matches are skipped.
 */
public class MettaLexer {

    private static final Pattern TOKEN_PATTERN = Pattern.compile(String.join("|",
        "(?<COMMENT>;[^\\n]*)",
        "(?<EXECUTE>!)",
        "(?<LPAREN>\\()",
        "(?<RPAREN>\\))",
        "(?<LBRACKET>\\[)",
        "(?<RBRACKET>\\])",
        "(?<ATOMSPACE>&[a-zA-Z_][a-zA-Z0-9_-]*)",
        "(?<VARIABLE>\\$[a-zA-Z_][a-zA-Z0-9_-]*)",
        "(?<STRING>\"(?:[^\"\\\\]|\\\\.)*\")",
        "(?<NUMBER>-?\\d+(?:\\.\\d+)?)",
        "(?<EQUALS>=)",
        "(?<OPERATOR>[+\\-*/><!=]+)",
        "(?<ATOM>[a-zA-Z_][a-zA-Z0-9_-]*!?)",
        "(?<WHITESPACE>[ \\t]+)",
        "(?<NEWLINE>\\n)"
    ));

    private static final TokenKind[] KINDS = TokenKind.values();

    public List<MettaToken> tokenize(String source) {
        List<MettaToken> tokens = new ArrayList<>();
        int line = 1;
        int lineStart = 0;

        Matcher matcher = TOKEN_PATTERN.matcher(source);
        while (matcher.find()) {
            if (matcher.group("NEWLINE") != null) {
                line++;
                lineStart = matcher.end();
                continue;
            }
            if (matcher.group("WHITESPACE") != null) {
                continue;
            }
            TokenKind kind = matchedKind(matcher);
            tokens.add(new MettaToken(kind, matcher.group(), line, matcher.start() - lineStart));
        }
        return tokens;
    }

    private TokenKind matchedKind(Matcher matcher) {
        for (TokenKind kind : KINDS) {
            if (matcher.group(kind.name()) != null) {
                return kind;
            }
        }
        throw new IllegalStateException("No token group matched at offset " + matcher.start());
    }
}
