package com.galaxyast.docs.graph;

/**
 * @param id       path-derived identifier, see {@link GraphIdGenerator}
 * @param type     folder, file, class, function or variable
 * @param name     display name
 * @param language language id for files, null otherwise
 */
public record GraphNode(String id, String type, String name, String language) {}
