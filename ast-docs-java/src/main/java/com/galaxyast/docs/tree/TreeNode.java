package com.galaxyast.docs.tree;

/**
 * A file or folder in the scanned source tree.
 */
public sealed interface TreeNode permits FileNode, FolderNode {

    String name();

    /** Absolute path, or null for nodes built without one. */
    String path();

    /** {@code "file"} or {@code "folder"}. */
    String type();
}
