package com.galaxyast.docs.model;

import com.google.gson.annotations.SerializedName;

public record MettaSummary(
    @SerializedName("function_count")  int functionCount,
    @SerializedName("expression_count") int expressionCount,
    @SerializedName("execution_count") int executionCount,
    @SerializedName("fact_count")      int factCount,
    @SerializedName("variable_count")  int variableCount,
    @SerializedName("atomspace_count") int atomspaceCount
) {}
