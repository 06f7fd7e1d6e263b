package com.galaxyast.docs.model;

/**
 * A {@code !(...)} form; {@code expression} is the signature of the executed form.
 */
public record MettaExecution(int line, String expression) {}
