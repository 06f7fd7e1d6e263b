package com.galaxyast.docs;

import com.galaxyast.docs.config.DocsConfig;
import com.galaxyast.docs.config.DocsConfigReader;
import com.galaxyast.docs.graph.Relation;
import com.galaxyast.docs.tree.FolderNode;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end run over test-fixtures/sample-project.
 */
class DocsPipelineTest {

    private static final Path SAMPLE = Paths.get(System.getProperty("user.dir"))
        .getParent()
        .resolve("test-fixtures/sample-project")
        .toAbsolutePath()
        .normalize();

    private static DocsConfig config(Path dir, String extra) throws Exception {
        Path file = dir.resolve("ast-docs.json");
        Files.writeString(file, "{\n"
            + "  \"root\": \"" + SAMPLE.toString().replace("\\", "\\\\") + "\",\n"
            + "  \"output\": \"out/ast_summary.json\",\n"
            + "  \"graph_output\": \"out/ast_graph.graphml\",\n"
            + "  \"graph_json_output\": \"out/ast_graph.json\"" + extra + "\n"
            + "}\n");
        return new DocsConfigReader().read(file);
    }

    @Test
    void fullRunWritesTreeAndGraphs(@TempDir Path tmp) throws Exception {
        DocsPipeline.Result result = new DocsPipeline().run(config(tmp, ""));

        assertTrue(Files.exists(tmp.resolve("out/ast_summary.json")));
        assertTrue(Files.exists(tmp.resolve("out/ast_graph.graphml")));
        assertTrue(Files.exists(tmp.resolve("out/ast_graph.json")));

        JsonObject tree = JsonParser.parseString(Files.readString(tmp.resolve("out/ast_summary.json")))
            .getAsJsonObject();
        assertEquals("sample-project", tree.get("name").getAsString());
        assertEquals(4, tree.getAsJsonArray("children").size());

        assertEquals(6, result.summary().totalFiles());
        assertEquals(2, result.summary().mettaFiles());
        assertEquals(4, result.summary().otherFiles());

        String kb = SAMPLE.resolve("kb").toString();
        String family = SAMPLE.resolve("kb/family.metta").toString();
        assertTrue(result.graph().edges().stream().anyMatch(e ->
            e.from().equals(kb) && e.to().equals(family) && e.relation() == Relation.CONTAINS));
        assertTrue(result.graph().node(family + ":grandparent").isPresent());

        String java = SAMPLE.resolve("src/OrderService.java").toString();
        assertTrue(result.graph().node(java + ":OrderService:createOrder").isPresent());
        assertTrue(result.graph().node(java + ":OrderService:Audit").isEmpty());
        assertTrue(result.graph().node(java + ":Audit:record").isPresent());
        assertTrue(result.graph().edges().stream().noneMatch(e -> e.relation() == Relation.USES));
    }

    @Test
    void mettaOnlyRunKeepsOnlyMettaFiles(@TempDir Path tmp) throws Exception {
        DocsPipeline.Result result = new DocsPipeline().run(config(tmp, ",\n  \"metta_only\": true"));

        FolderNode root = (FolderNode) result.tree();
        assertEquals(1, root.children().size());
        assertEquals("kb", root.children().get(0).name());
        assertEquals(2, result.summary().totalFiles());
        assertEquals(2, result.summary().mettaFiles());
        assertEquals(0, result.summary().parseErrors());
    }

    @Test
    void variableRunAddsUsesEdges(@TempDir Path tmp) throws Exception {
        DocsPipeline.Result result = new DocsPipeline()
            .run(config(tmp, ",\n  \"include_variables\": true,\n  \"workers\": 3"));

        String createOrder = SAMPLE.resolve("src/OrderService.java") + ":OrderService:createOrder";
        assertTrue(result.graph().node(createOrder + "::var::total").isPresent());
        assertTrue(result.graph().node(createOrder + "::var::discount").isPresent());
        assertTrue(result.graph().edges().stream().anyMatch(e -> e.relation() == Relation.USES));
    }

    @Test
    void missingRootFailsTheRun(@TempDir Path tmp) {
        DocsConfig cfg = DocsConfig.defaults(tmp.resolve("nowhere"));
        assertThrows(IllegalArgumentException.class, () -> new DocsPipeline().run(cfg));
    }
}
