package com.galaxyast.docs.extract;

import com.galaxyast.docs.model.ClassDef;
import com.galaxyast.docs.model.CodeDefinitions;
import com.galaxyast.docs.model.FunctionDef;
import com.galaxyast.docs.syntax.SyntaxNode;
import com.galaxyast.docs.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Harvests classes, functions and their variables from an externally parsed tree.
 *
 * The enclosing class is passed down the recursion as a plain parameter: a nested
 * class takes over for its own subtree only, and functions are attached to the
 * innermost class above them. Classes and functions without a name are skipped.
 * The input tree is not modified.
 */
public class DefinitionExtractor {

    public static class ExtractionException extends RuntimeException {
        public ExtractionException(String message) { super(message); }
    }

    public CodeDefinitions extract(SyntaxTree tree) {
        if (tree == null || tree.root() == null) {
            throw new ExtractionException("Syntax tree has no root node");
        }
        SyntaxProfile profile = SyntaxProfile.forLanguage(tree.language())
            .orElseThrow(() -> new ExtractionException(
                "No syntax profile for language: " + tree.language().id()));

        Collected collected = new Collected();
        walk(tree.root(), null, profile, collected);

        List<ClassDef> classes = new ArrayList<>();
        for (ClassScope scope : collected.classes) {
            classes.add(new ClassDef(scope.name, scope.line, scope.functions));
        }
        return new CodeDefinitions(classes, collected.functions);
    }

    private void walk(SyntaxNode node, ClassScope currentClass, SyntaxProfile profile, Collected collected) {
        switch (profile.categoryOf(node)) {
            case CLASS_LIKE -> {
                String name = profile.declaredName(node);
                if (name != null) {
                    currentClass = new ClassScope(name, node.startPoint().row() + 1);
                    collected.classes.add(currentClass);
                }
            }
            case FUNCTION_LIKE -> {
                String name = profile.declaredName(node);
                if (name != null) {
                    FunctionDef function = new FunctionDef(
                        name,
                        node.startPoint().row() + 1,
                        collectVariables(node, profile),
                        lineCount(node));
                    if (currentClass != null) {
                        currentClass.functions.add(function);
                    } else {
                        collected.functions.add(function);
                    }
                }
            }
            default -> { }
        }

        for (SyntaxNode child : node.children()) {
            walk(child, currentClass, profile, collected);
        }
    }

    private List<String> collectVariables(SyntaxNode function, SyntaxProfile profile) {
        List<String> variables = new ArrayList<>();
        collectVariables(function, profile, variables);
        return variables;
    }

    private void collectVariables(SyntaxNode node, SyntaxProfile profile, List<String> variables) {
        if (profile.categoryOf(node) == NodeCategory.VARIABLE_LIKE) {
            String name = profile.boundName(node);
            if (name != null) {
                variables.add(name);
            }
        }
        for (SyntaxNode child : node.children()) {
            collectVariables(child, profile, variables);
        }
    }

    private int lineCount(SyntaxNode node) {
        int start = node.startPoint().row();
        int end = node.endPoint().row();
        if (end < start) {
            throw new ExtractionException(
                "Node " + node.type() + " ends (row " + end + ") before it starts (row " + start + ")");
        }
        return end - start + 1;
    }

    private static final class ClassScope {
        final String name;
        final int line;
        final List<FunctionDef> functions = new ArrayList<>();

        ClassScope(String name, int line) {
            this.name = name;
            this.line = line;
        }
    }

    private static final class Collected {
        final List<ClassScope> classes = new ArrayList<>();
        final List<FunctionDef> functions = new ArrayList<>();
    }
}
