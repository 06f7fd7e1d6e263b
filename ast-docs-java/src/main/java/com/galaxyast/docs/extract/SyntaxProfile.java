package com.galaxyast.docs.extract;

import com.galaxyast.docs.language.Language;
import com.galaxyast.docs.syntax.SyntaxNode;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-language table telling the extractor which node types are classes, functions
 * and variable bindings, and where their names live.
 */
public final class SyntaxProfile {

    /** How the bound name of a variable-like node is found. */
    public enum VariableNaming {
        /** The child stored under the profile's name field. */
        NAME_FIELD,
        /** The first child, e.g. the left-hand side of a Python assignment. */
        FIRST_CHILD
    }

    private static final Map<Language, SyntaxProfile> PROFILES = new EnumMap<>(Language.class);

    static {
        PROFILES.put(Language.PYTHON, new SyntaxProfile(
            List.of("class_definition"),
            List.of("function_definition"),
            List.of("assignment"),
            "name", VariableNaming.FIRST_CHILD));
        PROFILES.put(Language.JAVASCRIPT, new SyntaxProfile(
            List.of("class_declaration", "class_definition", "class"),
            List.of("function_declaration", "method_definition"),
            List.of("variable_declarator"),
            "name", VariableNaming.NAME_FIELD));
        PROFILES.put(Language.JAVA, new SyntaxProfile(
            List.of("TypeDeclaration", "EnumDeclaration", "RecordDeclaration"),
            List.of("MethodDeclaration"),
            List.of("VariableDeclarationFragment"),
            "name", VariableNaming.NAME_FIELD));
    }

    private final Map<String, NodeCategory> categories = new HashMap<>();
    private final String nameField;
    private final VariableNaming variableNaming;

    public SyntaxProfile(List<String> classTypes, List<String> functionTypes, List<String> variableTypes,
                         String nameField, VariableNaming variableNaming) {
        classTypes.forEach(t -> categories.put(t, NodeCategory.CLASS_LIKE));
        functionTypes.forEach(t -> categories.put(t, NodeCategory.FUNCTION_LIKE));
        variableTypes.forEach(t -> categories.put(t, NodeCategory.VARIABLE_LIKE));
        this.nameField = nameField;
        this.variableNaming = variableNaming;
    }

    public static Optional<SyntaxProfile> forLanguage(Language language) {
        return Optional.ofNullable(PROFILES.get(language));
    }

    public NodeCategory categoryOf(SyntaxNode node) {
        return categories.getOrDefault(node.type(), NodeCategory.OTHER);
    }

    /** Name of a class-like or function-like node, or null if it has none. */
    public String declaredName(SyntaxNode node) {
        SyntaxNode name = node.childByFieldName(nameField);
        return name != null ? name.text() : null;
    }

    /** Name bound by a variable-like node, or null if it has none. */
    public String boundName(SyntaxNode node) {
        if (variableNaming == VariableNaming.FIRST_CHILD) {
            List<SyntaxNode> children = node.children();
            return children.isEmpty() ? null : children.get(0).text();
        }
        return declaredName(node);
    }
}
