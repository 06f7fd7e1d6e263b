package com.galaxyast.docs.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Directed graph of tree nodes and definitions.
 *
 * Simple-graph semantics: adding a node id again replaces its attributes in place,
 * and adding an edge between an already connected ordered pair replaces its
 * relation. Insertion order is kept for both nodes and edges.
 */
public class CodeGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<EdgeKey, Relation> edges = new LinkedHashMap<>();

    public void addNode(GraphNode node) {
        Objects.requireNonNull(node.id(), "graph node id");
        nodes.put(node.id(), node);
    }

    /**
     * @throws IllegalStateException if either endpoint has not been added
     */
    public void addEdge(String from, String to, Relation relation) {
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
            throw new IllegalStateException("Edge references unknown node: " + from + " -> " + to);
        }
        edges.put(new EdgeKey(from, to), Objects.requireNonNull(relation, "relation"));
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<GraphNode> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    public List<GraphEdge> edges() {
        List<GraphEdge> result = new ArrayList<>(edges.size());
        edges.forEach((key, relation) -> result.add(new GraphEdge(key.from(), key.to(), relation)));
        return Collections.unmodifiableList(result);
    }

    public int nodeCount() { return nodes.size(); }
    public int edgeCount() { return edges.size(); }

    public List<GraphEdge> edgesFrom(String id) {
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : edges()) {
            if (edge.from().equals(id)) {
                result.add(edge);
            }
        }
        return result;
    }

    private record EdgeKey(String from, String to) {}
}
