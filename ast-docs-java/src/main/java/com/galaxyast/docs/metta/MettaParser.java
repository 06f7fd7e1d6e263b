package com.galaxyast.docs.metta;

import com.galaxyast.docs.syntax.SourceDecoder;

import java.util.List;

/**
 * Recursive-descent parser for MeTTa with one token of lookahead.
 *
 * <pre>
 * program      := top_level*
 * top_level    := comment | execution | expression
 * execution    := '!' expression?
 * expression   := '(' ')' | '(' '=' signature body* ')' | '(' element* ')'
 * signature    := '(' atom param* ')'
 * element      := expression | atom_value
 * </pre>
 *
 * Parsing is lenient: a token that cannot start a top-level form is skipped, and
 * running out of tokens inside a form ends that form where the input ends.
 * Instances hold per-parse state and are not thread-safe.
 */
public class MettaParser {

    private final MettaLexer lexer = new MettaLexer();
    private List<MettaToken> tokens = List.of();
    private int current;

    public MettaNode parse(byte[] source) {
        return parse(SourceDecoder.lossy(source));
    }

    public MettaNode parse(String source) {
        tokens = lexer.tokenize(source);
        current = 0;

        MettaNode root = new MettaNode(NodeKind.PROGRAM, "", 1);
        while (!isAtEnd()) {
            MettaNode form = parseTopLevel();
            if (form != null) {
                root.addChild(form);
            }
        }
        return root;
    }

    // --- Token cursor ---

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private MettaToken peek() {
        return isAtEnd() ? null : tokens.get(current);
    }

    private MettaToken advance() {
        return isAtEnd() ? null : tokens.get(current++);
    }

    private boolean check(TokenKind kind) {
        MettaToken token = peek();
        return token != null && token.is(kind);
    }

    // --- Top level ---

    private MettaNode parseTopLevel() {
        MettaToken token = peek();
        switch (token.kind()) {
            case COMMENT -> {
                advance();
                return new MettaNode(NodeKind.COMMENT, token.text().strip(), token.line());
            }
            case EXECUTE -> {
                return parseExecution();
            }
            case LPAREN -> {
                return parseExpression();
            }
            default -> {
                advance();
                return null;
            }
        }
    }

    private MettaNode parseExecution() {
        MettaToken bang = advance();
        MettaNode execution = new MettaNode(NodeKind.EXECUTION, "!", bang.line());
        if (check(TokenKind.LPAREN)) {
            execution.addChild(parseExpression());
        }
        return execution;
    }

    // --- Parenthesized forms ---

    private MettaNode parseExpression() {
        MettaToken open = advance();
        int startLine = open.line();

        if (isAtEnd() || check(TokenKind.RPAREN)) {
            MettaNode empty = new MettaNode(NodeKind.EMPTY_EXPRESSION, "", startLine);
            consumeClosing(empty);
            return empty;
        }

        MettaNode form = check(TokenKind.EQUALS)
            ? parseFunctionDefinition(startLine)
            : parseCall(startLine);
        consumeClosing(form);
        return form;
    }

    private MettaNode parseFunctionDefinition(int startLine) {
        advance(); // '='
        MettaNode definition = new MettaNode(NodeKind.FUNCTION_DEFINITION, "", startLine);

        if (check(TokenKind.LPAREN)) {
            MettaNode signature = parseSignature();
            if (signature != null) {
                definition.addChild(signature);
            }
        }
        parseElementsInto(definition);
        return definition;
    }

    /**
     * Parses {@code (name param*)}. Returns null for {@code ()}, in which case the
     * enclosing definition has no signature.
     */
    private MettaNode parseSignature() {
        MettaToken open = advance();
        if (isAtEnd()) {
            return null;
        }
        if (check(TokenKind.RPAREN)) {
            advance();
            return null;
        }

        MettaNode signature;
        if (check(TokenKind.LPAREN)) {
            // Head is itself a form; keep it as the first child of an unnamed signature.
            signature = new MettaNode(NodeKind.FUNCTION_SIGNATURE, "", open.line());
            signature.addChild(parseExpression());
        } else {
            MettaToken name = advance();
            signature = new MettaNode(NodeKind.FUNCTION_SIGNATURE, name.text(), name.line());
        }
        parseElementsInto(signature);
        consumeClosing(signature);
        return signature;
    }

    private MettaNode parseCall(int startLine) {
        MettaNode call = new MettaNode(NodeKind.EXPRESSION, "", startLine);
        parseElementsInto(call);
        return call;
    }

    private void parseElementsInto(MettaNode parent) {
        while (!isAtEnd() && !check(TokenKind.RPAREN)) {
            parent.addChild(parseElement());
        }
    }

    private void consumeClosing(MettaNode node) {
        if (check(TokenKind.RPAREN)) {
            node.closeAt(advance().line());
        }
    }

    private MettaNode parseElement() {
        return check(TokenKind.LPAREN) ? parseExpression() : parseAtom();
    }

    // --- Atoms ---

    private MettaNode parseAtom() {
        MettaToken token = advance();
        return new MettaNode(atomKind(token.kind()), token.text(), token.line());
    }

    private NodeKind atomKind(TokenKind kind) {
        return switch (kind) {
            case VARIABLE  -> NodeKind.VARIABLE;
            case ATOMSPACE -> NodeKind.ATOMSPACE_REF;
            case STRING    -> NodeKind.STRING;
            case NUMBER    -> NodeKind.NUMBER;
            case OPERATOR  -> NodeKind.OPERATOR;
            case ATOM      -> NodeKind.ATOM;
            default        -> NodeKind.UNKNOWN;
        };
    }
}
