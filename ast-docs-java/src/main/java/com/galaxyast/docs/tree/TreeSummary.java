package com.galaxyast.docs.tree;

import com.galaxyast.docs.language.Language;

/**
 * File counts over a finished tree.
 */
public record TreeSummary(int totalFiles, int mettaFiles, int otherFiles, int parseErrors) {

    public static TreeSummary of(TreeNode root) {
        int[] counts = new int[4];
        count(root, counts);
        return new TreeSummary(counts[0], counts[1], counts[2], counts[3]);
    }

    private static void count(TreeNode node, int[] counts) {
        if (node instanceof FileNode file) {
            counts[0]++;
            if (file.language().filter(Language.METTA.id()::equals).isPresent()) {
                counts[1]++;
            } else {
                counts[2]++;
            }
            if (file.hasError()) {
                counts[3]++;
            }
        } else if (node instanceof FolderNode folder) {
            for (TreeNode child : folder.children()) {
                count(child, counts);
            }
        }
    }

    public String describe() {
        return "Summary:\n"
            + "   Total files: " + totalFiles + "\n"
            + "   MeTTa files: " + mettaFiles + "\n"
            + "   Other files: " + otherFiles + "\n"
            + "   Parse errors: " + parseErrors;
    }
}
