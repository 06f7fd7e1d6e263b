package com.galaxyast.docs.graph;

public record GraphEdge(String from, String to, Relation relation) {}
