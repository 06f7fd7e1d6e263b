package com.galaxyast.docs.syntax;

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.BodyDeclaration;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.Javadoc;
import org.eclipse.jdt.core.dom.LambdaExpression;
import org.eclipse.jdt.core.dom.StructuralPropertyDescriptor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link SyntaxNode} over a JDT DOM node.
 *
 * The node type is the DOM class name ({@code TypeDeclaration}, {@code MethodDeclaration}),
 * fields are the ids of JDT structural properties ({@code name}, {@code body}).
 * Untyped lambda parameters, which JDT models as fragments, are typed
 * {@code LambdaParameter}. A declaration starts after its Javadoc, not at it.
 */
final class JdtSyntaxNode implements SyntaxNode {

    private final CompilationUnit unit;
    private final ASTNode node;
    private final String source;

    JdtSyntaxNode(CompilationUnit unit, ASTNode node, String source) {
        this.unit = unit;
        this.node = node;
        this.source = source;
    }

    @Override
    public String type() {
        if (node.getLocationInParent() == LambdaExpression.PARAMETERS_PROPERTY
                && node.getNodeType() == ASTNode.VARIABLE_DECLARATION_FRAGMENT) {
            return "LambdaParameter";
        }
        return node.getClass().getSimpleName();
    }

    @Override
    public SyntaxPoint startPoint() {
        int start = startOffset();
        return new SyntaxPoint(unit.getLineNumber(start) - 1, Math.max(0, unit.getColumnNumber(start)));
    }

    @Override
    public SyntaxPoint endPoint() {
        int last = Math.max(node.getStartPosition(), node.getStartPosition() + node.getLength() - 1);
        return new SyntaxPoint(unit.getLineNumber(last) - 1, Math.max(0, unit.getColumnNumber(last)) + 1);
    }

    /** First offset of the declaration itself, skipping a leading Javadoc. */
    private int startOffset() {
        if (!(node instanceof BodyDeclaration declaration) || declaration.getJavadoc() == null) {
            return node.getStartPosition();
        }
        Javadoc javadoc = declaration.getJavadoc();
        int afterJavadoc = javadoc.getStartPosition() + javadoc.getLength();
        for (ASTNode child : childNodes()) {
            if (child != javadoc && child.getStartPosition() >= afterJavadoc) {
                return child.getStartPosition();
            }
        }
        return node.getStartPosition();
    }

    @Override
    public List<SyntaxNode> children() {
        List<ASTNode> nodes = childNodes();
        List<SyntaxNode> result = new ArrayList<>(nodes.size());
        for (ASTNode child : nodes) {
            result.add(new JdtSyntaxNode(unit, child, source));
        }
        return result;
    }

    private List<ASTNode> childNodes() {
        List<ASTNode> nodes = new ArrayList<>();
        for (Object property : node.structuralPropertiesForType()) {
            StructuralPropertyDescriptor descriptor = (StructuralPropertyDescriptor) property;
            if (descriptor.isChildProperty()) {
                Object child = node.getStructuralProperty(descriptor);
                if (child != null) {
                    nodes.add((ASTNode) child);
                }
            } else if (descriptor.isChildListProperty()) {
                for (Object child : (List<?>) node.getStructuralProperty(descriptor)) {
                    nodes.add((ASTNode) child);
                }
            }
        }
        nodes.sort(Comparator.comparingInt(ASTNode::getStartPosition));
        return nodes;
    }

    @Override
    public SyntaxNode childByFieldName(String fieldName) {
        for (Object property : node.structuralPropertiesForType()) {
            StructuralPropertyDescriptor descriptor = (StructuralPropertyDescriptor) property;
            if (descriptor.isChildProperty() && descriptor.getId().equals(fieldName)) {
                Object child = node.getStructuralProperty(descriptor);
                return child != null ? new JdtSyntaxNode(unit, (ASTNode) child, source) : null;
            }
        }
        return null;
    }

    @Override
    public String text() {
        int start = Math.max(0, node.getStartPosition());
        int end = Math.min(source.length(), start + node.getLength());
        return end > start ? source.substring(start, end) : "";
    }
}
