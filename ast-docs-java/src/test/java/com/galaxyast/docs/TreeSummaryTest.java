package com.galaxyast.docs;

import com.galaxyast.docs.language.Language;
import com.galaxyast.docs.model.CodeDefinitions;
import com.galaxyast.docs.model.MettaDefinitions;
import com.galaxyast.docs.tree.FileNode;
import com.galaxyast.docs.tree.FolderNode;
import com.galaxyast.docs.tree.MettaOnlyFilter;
import com.galaxyast.docs.tree.ParserKind;
import com.galaxyast.docs.tree.TreeNode;
import com.galaxyast.docs.tree.TreeSummary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TreeSummaryTest {

    private static final MettaDefinitions NO_METTA =
        new MettaDefinitions(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

    private static FolderNode tree() {
        FolderNode kb = new FolderNode("kb", "/r/kb", List.of(
            FileNode.parsed("a.metta", "/r/kb/a.metta", Language.METTA, NO_METTA, ParserKind.DSL),
            FileNode.failed("b.mta", "/r/kb/b.mta", Language.METTA, "boom")));
        FolderNode src = new FolderNode("src", "/r/src", List.of(
            FileNode.parsed("x.py", "/r/src/x.py", Language.PYTHON,
                new CodeDefinitions(List.of(), List.of()), ParserKind.EXTERNAL),
            FileNode.failed("Y.java", "/r/src/Y.java", Language.JAVA, "bad")));
        FolderNode empty = new FolderNode("empty", "/r/empty", List.of());
        return new FolderNode("r", "/r", List.of(
            FileNode.unrecognized("README.md", "/r/README.md"), empty, kb, src));
    }

    @Test
    void countsFilesByLanguageAndErrors() {
        assertEquals(new TreeSummary(5, 2, 3, 2), TreeSummary.of(tree()));
    }

    @Test
    void singleFileRoot() {
        TreeNode file = FileNode.unrecognized("notes.txt", "/notes.txt");
        assertEquals(new TreeSummary(1, 0, 1, 0), TreeSummary.of(file));
    }

    @Test
    void describeRendersReport() {
        assertEquals(
            "Summary:\n"
                + "   Total files: 5\n"
                + "   MeTTa files: 2\n"
                + "   Other files: 3\n"
                + "   Parse errors: 2",
            TreeSummary.of(tree()).describe());
    }

    @Test
    void mettaOnlyFilterKeepsMettaFilesAndDropsEmptyFolders() {
        FolderNode filtered = (FolderNode) MettaOnlyFilter.apply(tree()).orElseThrow();

        assertEquals("/r", filtered.path());
        assertEquals(1, filtered.children().size());
        FolderNode kb = (FolderNode) filtered.children().get(0);
        assertEquals("kb", kb.name());
        assertEquals(2, kb.children().size());
        assertEquals(new TreeSummary(2, 2, 0, 1), TreeSummary.of(filtered));
    }

    @Test
    void mettaOnlyFilterOnTreeWithoutMettaIsEmpty() {
        FolderNode root = new FolderNode("r", "/r", List.of(FileNode.unrecognized("README.md", "/r/README.md")));
        assertEquals(Optional.empty(), MettaOnlyFilter.apply(root));
    }
}
