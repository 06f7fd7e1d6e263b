package com.galaxyast.docs;

import com.galaxyast.docs.config.DocsConfig;
import com.galaxyast.docs.graph.CodeGraph;
import com.galaxyast.docs.graph.TreeGraphBuilder;
import com.galaxyast.docs.language.Language;
import com.galaxyast.docs.language.LanguageRegistry;
import com.galaxyast.docs.output.GraphSerializer;
import com.galaxyast.docs.output.TreeSerializer;
import com.galaxyast.docs.tree.DirectoryWalker;
import com.galaxyast.docs.tree.FileProcessor;
import com.galaxyast.docs.tree.FolderNode;
import com.galaxyast.docs.tree.MettaOnlyFilter;
import com.galaxyast.docs.tree.TreeNode;
import com.galaxyast.docs.tree.TreeSummary;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs a full pass over a source root:
 *   walk, optional MeTTa-only filter, write tree, summarise, build graph, write graph.
 */
public class DocsPipeline {

    public record Result(TreeNode tree, CodeGraph graph, TreeSummary summary) {}

    private final LanguageRegistry registry;

    public DocsPipeline() {
        this(LanguageRegistry.standard());
    }

    public DocsPipeline(LanguageRegistry registry) {
        this.registry = registry;
    }

    public Result run(DocsConfig config) {
        Path root = config.getRoot().toAbsolutePath().normalize();
        System.err.println("[ast-docs] Scanning: " + root);
        System.err.println("[ast-docs] Languages supported: " + registry.availableLanguages().stream()
            .map(Language::id)
            .collect(Collectors.joining(", ")));

        // 1. Walk and parse
        FileProcessor processor = new FileProcessor(registry, config.isDebug());
        TreeNode tree = new DirectoryWalker(processor, config.getWorkers()).walk(root);

        // 2. Optional filter
        if (config.isMettaOnly()) {
            System.err.println("[ast-docs] MeTTa-only mode enabled");
            tree = MettaOnlyFilter.apply(tree).orElseGet(() -> emptyFolder(root));
        }

        // 3. Hierarchical document
        new TreeSerializer().write(tree, config.getOutput());

        TreeSummary summary = TreeSummary.of(tree);
        System.err.println("[ast-docs] " + summary.describe());

        // 4. Graph
        CodeGraph graph = new TreeGraphBuilder(config.isIncludeVariables()).build(tree);
        GraphSerializer graphSerializer = new GraphSerializer();
        graphSerializer.writeGraphMl(graph, config.getGraphOutput());
        if (config.getGraphJsonOutput() != null) {
            graphSerializer.writeJson(graph, config.getGraphJsonOutput());
        }

        System.err.println("[ast-docs] Done.");
        return new Result(tree, graph, summary);
    }

    private static TreeNode emptyFolder(Path root) {
        String name = root.getFileName() != null ? root.getFileName().toString() : root.toString();
        return new FolderNode(name, root.toString(), List.of());
    }
}
