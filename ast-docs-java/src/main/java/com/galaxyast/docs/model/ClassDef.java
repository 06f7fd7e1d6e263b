package com.galaxyast.docs.model;

import java.util.List;

public record ClassDef(
    String name,
    int line,                   // 1-based
    List<FunctionDef> functions
) {
    public ClassDef {
        functions = List.copyOf(functions);
    }
}
