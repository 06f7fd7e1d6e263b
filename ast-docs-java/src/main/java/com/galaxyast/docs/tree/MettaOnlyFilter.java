package com.galaxyast.docs.tree;

import com.galaxyast.docs.language.Language;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prunes a tree down to its MeTTa files. Folders left without children are dropped,
 * the root included.
 */
public final class MettaOnlyFilter {

    private MettaOnlyFilter() {}

    public static Optional<TreeNode> apply(TreeNode node) {
        if (node instanceof FileNode file) {
            boolean metta = file.language().filter(Language.METTA.id()::equals).isPresent();
            return metta ? Optional.of(file) : Optional.empty();
        }
        FolderNode folder = (FolderNode) node;
        List<TreeNode> kept = new ArrayList<>();
        for (TreeNode child : folder.children()) {
            apply(child).ifPresent(kept::add);
        }
        if (kept.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new FolderNode(folder.name(), folder.path(), kept));
    }
}
