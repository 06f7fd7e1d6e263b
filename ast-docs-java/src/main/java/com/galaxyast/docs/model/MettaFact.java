package com.galaxyast.docs.model;

/**
 * A three-element expression headed by a plain atom, read as subject-predicate-object.
 */
public record MettaFact(int line, String pattern, String subject) {}
