package com.galaxyast.docs.tree;

import com.google.gson.annotations.SerializedName;

import java.util.List;

public final class FolderNode implements TreeNode {

    public static final String TYPE = "folder";

    @SerializedName("name")     private final String name;
    @SerializedName("path")     private final String path;
    @SerializedName("type")     private final String type = TYPE;
    @SerializedName("children") private final List<TreeNode> children;

    public FolderNode(String name, String path, List<TreeNode> children) {
        this.name = name;
        this.path = path;
        this.children = List.copyOf(children);
    }

    @Override public String name() { return name; }
    @Override public String path() { return path; }
    @Override public String type() { return type; }

    /** Children ordered by name. */
    public List<TreeNode> children() { return children; }

    @Override
    public String toString() {
        return "FolderNode(" + path + ", " + children.size() + " children)";
    }
}
