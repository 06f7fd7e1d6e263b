package com.galaxyast.docs.syntax;

/**
 * Zero-based row and column of a position in source text.
 */
public record SyntaxPoint(int row, int column) {}
