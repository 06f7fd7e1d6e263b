package com.galaxyast.docs.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * A MeTTa function definition {@code (= (name $p...) body...)}.
 *
 * {@code paramCount} always equals the number of parameters.
 */
public record MettaFunction(
    String name,
    @SerializedName("start_line")  int startLine,
    @SerializedName("end_line")    int endLine,
    List<String> parameters,
    @SerializedName("param_count") int paramCount
) {
    public MettaFunction {
        parameters = List.copyOf(parameters);
        paramCount = parameters.size();
    }

    public MettaFunction(String name, int startLine, int endLine, List<String> parameters) {
        this(name, startLine, endLine, parameters, parameters.size());
    }
}
