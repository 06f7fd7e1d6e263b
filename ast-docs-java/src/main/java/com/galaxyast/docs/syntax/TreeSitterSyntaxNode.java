package com.galaxyast.docs.syntax;

import org.treesitter.TSNode;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SyntaxNode} over a tree-sitter node. Text is sliced from the UTF-8 source
 * bytes by the node's byte offsets.
 */
final class TreeSitterSyntaxNode implements SyntaxNode {

    private final TSTree tree;   // keeps the native tree alive while nodes are in use
    private final TSNode node;
    private final byte[] source;

    TreeSitterSyntaxNode(TSTree tree, TSNode node, byte[] source) {
        this.tree = tree;
        this.node = node;
        this.source = source;
    }

    @Override
    public String type() {
        return node.getType();
    }

    @Override
    public SyntaxPoint startPoint() {
        return toPoint(node.getStartPoint());
    }

    @Override
    public SyntaxPoint endPoint() {
        return toPoint(node.getEndPoint());
    }

    @Override
    public List<SyntaxNode> children() {
        int count = node.getChildCount();
        List<SyntaxNode> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(new TreeSitterSyntaxNode(tree, node.getChild(i), source));
        }
        return result;
    }

    @Override
    public SyntaxNode childByFieldName(String fieldName) {
        TSNode child = node.getChildByFieldName(fieldName);
        if (child == null || child.isNull()) {
            return null;
        }
        return new TreeSitterSyntaxNode(tree, child, source);
    }

    @Override
    public String text() {
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(source.length, node.getEndByte());
        if (end <= start) {
            return "";
        }
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    private static SyntaxPoint toPoint(TSPoint point) {
        return new SyntaxPoint(point.getRow(), point.getColumn());
    }
}
