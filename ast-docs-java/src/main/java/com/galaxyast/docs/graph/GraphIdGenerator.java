package com.galaxyast.docs.graph;

import com.galaxyast.docs.tree.TreeNode;

/**
 * Generates deterministic node ids from a node's position in the source tree:
 *   &lt;absolute-path&gt;                      (folder, file; name when there is no path)
 *   &lt;file-id&gt;:&lt;class&gt;                     (class)
 *   &lt;class-id&gt;:&lt;method&gt;                   (method)
 *   &lt;file-id&gt;:&lt;function&gt;                  (top-level function)
 *   &lt;function-id&gt;::var::&lt;variable&gt;        (variable)
 */
public final class GraphIdGenerator {

    private GraphIdGenerator() {}

    public static String forTreeNode(TreeNode node) {
        return node.path() != null ? node.path() : node.name();
    }

    public static String forMember(String parentId, String memberName) {
        return parentId + ":" + memberName;
    }

    public static String forVariable(String functionId, String variableName) {
        return functionId + "::var::" + variableName;
    }
}
