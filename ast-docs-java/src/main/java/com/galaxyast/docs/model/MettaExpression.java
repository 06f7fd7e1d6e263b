package com.galaxyast.docs.model;

public record MettaExpression(int line, String signature) {}
