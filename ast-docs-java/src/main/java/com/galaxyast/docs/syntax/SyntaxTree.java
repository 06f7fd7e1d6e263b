package com.galaxyast.docs.syntax;

import com.galaxyast.docs.language.Language;

/**
 * Result of an external parse: the root node and the language it was parsed as.
 */
public record SyntaxTree(Language language, SyntaxNode root) {}
