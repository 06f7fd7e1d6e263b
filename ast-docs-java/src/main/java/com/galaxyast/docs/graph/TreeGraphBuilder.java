package com.galaxyast.docs.graph;

import com.galaxyast.docs.model.ClassDef;
import com.galaxyast.docs.model.CodeDefinitions;
import com.galaxyast.docs.model.Definitions;
import com.galaxyast.docs.model.FunctionDef;
import com.galaxyast.docs.model.MettaDefinitions;
import com.galaxyast.docs.model.MettaFunction;
import com.galaxyast.docs.tree.FileNode;
import com.galaxyast.docs.tree.FolderNode;
import com.galaxyast.docs.tree.TreeNode;

/**
 * Converts a finished source tree into a {@link CodeGraph}.
 *
 * Every folder and file becomes a node linked to its parent by {@code contains}.
 * Classes and top-level functions hang off their file by {@code defines}, methods
 * off their class by {@code hasMethod}. With variables enabled, each function also
 * gets a {@code uses} edge to one node per collected variable name.
 * The tree must be fully built and is only read.
 */
public class TreeGraphBuilder {

    private final boolean includeVariables;

    public TreeGraphBuilder() {
        this(false);
    }

    public TreeGraphBuilder(boolean includeVariables) {
        this.includeVariables = includeVariables;
    }

    public CodeGraph build(TreeNode root) {
        CodeGraph graph = new CodeGraph();
        addNode(graph, root, null);
        return graph;
    }

    private void addNode(CodeGraph graph, TreeNode node, String parentId) {
        String nodeId = GraphIdGenerator.forTreeNode(node);
        String language = node instanceof FileNode file ? file.language().orElse(null) : null;
        graph.addNode(new GraphNode(nodeId, node.type(), node.name(), language));

        if (parentId != null) {
            graph.addEdge(parentId, nodeId, Relation.CONTAINS);
        }

        if (node instanceof FileNode file) {
            file.definitions().ifPresent(definitions -> addDefinitions(graph, nodeId, definitions));
        } else if (node instanceof FolderNode folder) {
            for (TreeNode child : folder.children()) {
                addNode(graph, child, nodeId);
            }
        }
    }

    private void addDefinitions(CodeGraph graph, String fileId, Definitions definitions) {
        if (definitions instanceof CodeDefinitions code) {
            for (ClassDef classDef : code.classes()) {
                String classId = GraphIdGenerator.forMember(fileId, classDef.name());
                graph.addNode(new GraphNode(classId, "class", classDef.name(), null));
                graph.addEdge(fileId, classId, Relation.DEFINES);

                for (FunctionDef method : classDef.functions()) {
                    addFunction(graph, classId, method, Relation.HAS_METHOD);
                }
            }
            for (FunctionDef function : code.functions()) {
                addFunction(graph, fileId, function, Relation.DEFINES);
            }
        } else if (definitions instanceof MettaDefinitions metta) {
            for (MettaFunction function : metta.functions()) {
                String functionId = GraphIdGenerator.forMember(fileId, function.name());
                graph.addNode(new GraphNode(functionId, "function", function.name(), null));
                graph.addEdge(fileId, functionId, Relation.DEFINES);
            }
        }
    }

    private void addFunction(CodeGraph graph, String ownerId, FunctionDef function, Relation relation) {
        String functionId = GraphIdGenerator.forMember(ownerId, function.name());
        graph.addNode(new GraphNode(functionId, "function", function.name(), null));
        graph.addEdge(ownerId, functionId, relation);

        if (includeVariables) {
            for (String variable : function.variables()) {
                String variableId = GraphIdGenerator.forVariable(functionId, variable);
                graph.addNode(new GraphNode(variableId, "variable", variable, null));
                graph.addEdge(functionId, variableId, Relation.USES);
            }
        }
    }
}
