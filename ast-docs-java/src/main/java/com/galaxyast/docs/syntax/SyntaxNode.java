package com.galaxyast.docs.syntax;

import java.util.List;

/**
 * Read-only view of a node in a syntax tree produced by an external parser.
 *
 * Only the capabilities the definition extractor relies on are exposed. Node types
 * are the parser's own names (tree-sitter grammar symbols, JDT node class names).
 */
public interface SyntaxNode {

    String type();

    SyntaxPoint startPoint();

    SyntaxPoint endPoint();

    List<SyntaxNode> children();

    /** Returns the child stored under {@code fieldName}, or null if there is none. */
    SyntaxNode childByFieldName(String fieldName);

    /** Source text covered by this node. */
    String text();
}
