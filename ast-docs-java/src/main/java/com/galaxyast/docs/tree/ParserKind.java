package com.galaxyast.docs.tree;

import com.google.gson.annotations.SerializedName;

public enum ParserKind {
    @SerializedName("external") EXTERNAL,
    @SerializedName("dsl")      DSL
}
