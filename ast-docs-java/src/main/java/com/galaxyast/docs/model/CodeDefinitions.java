package com.galaxyast.docs.model;

import java.util.List;

/**
 * Classes and top-level functions of a conventional-language file, in source order.
 */
public record CodeDefinitions(
    List<ClassDef> classes,
    List<FunctionDef> functions
) implements Definitions {

    public CodeDefinitions {
        classes = List.copyOf(classes);
        functions = List.copyOf(functions);
    }
}
