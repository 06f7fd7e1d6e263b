package com.galaxyast.docs.graph;

import com.google.gson.annotations.SerializedName;

public enum Relation {
    @SerializedName("contains")  CONTAINS("contains"),
    @SerializedName("defines")   DEFINES("defines"),
    @SerializedName("hasMethod") HAS_METHOD("hasMethod"),
    @SerializedName("uses")      USES("uses");

    private final String label;

    Relation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
