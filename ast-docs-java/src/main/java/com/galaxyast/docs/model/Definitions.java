package com.galaxyast.docs.model;

/**
 * Definitions extracted from one source file.
 */
public sealed interface Definitions permits CodeDefinitions, MettaDefinitions {}
