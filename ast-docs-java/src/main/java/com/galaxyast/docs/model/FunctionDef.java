package com.galaxyast.docs.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * A function or method of a conventional-language file.
 *
 * @param name      raw name text from the source
 * @param line      1-based start line
 * @param variables assigned or declared names in the body, in order, duplicates kept
 * @param lineCount inclusive number of lines spanned
 */
public record FunctionDef(
    String name,
    int line,
    List<String> variables,
    @SerializedName("line_count") int lineCount
) {
    public FunctionDef {
        variables = List.copyOf(variables);
    }
}
