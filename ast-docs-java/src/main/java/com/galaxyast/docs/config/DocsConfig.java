package com.galaxyast.docs.config;

import com.google.gson.annotations.SerializedName;

import java.nio.file.Path;

/**
 * Deserialized form of the run configuration ({@code ast-docs.json}).
 * Paths are resolved against {@link #getBaseDir()}, the directory the file was read from.
 */
public class DocsConfig {

    @SerializedName("root")
    private String root;

    @SerializedName("output")
    private String output;

    @SerializedName("graph_output")
    private String graphOutput;

    /** Optional JSON rendering of the graph; skipped when absent. */
    @SerializedName("graph_json_output")
    private String graphJsonOutput;

    /** Keep only MeTTa files in the tree (default: false). */
    @SerializedName("metta_only")
    private Boolean mettaOnly;

    /** Emit variable nodes and {@code uses} edges (default: false). */
    @SerializedName("include_variables")
    private Boolean includeVariables;

    /** Worker threads for per-file parsing (default: 1, sequential). */
    @SerializedName("workers")
    private Integer workers;

    /** Log per-file failures to stderr (default: false). */
    @SerializedName("debug")
    private Boolean debug;

    private transient Path baseDir = Path.of(".");

    public static DocsConfig defaults(Path baseDir) {
        DocsConfig config = new DocsConfig();
        config.baseDir = baseDir;
        return config;
    }

    DocsConfig withBaseDir(Path baseDir) {
        this.baseDir = baseDir;
        return this;
    }

    public Path getBaseDir()            { return baseDir; }
    public Path getRoot()               { return resolve(root != null ? root : "."); }
    public Path getOutput()             { return resolve(output != null ? output : "docs/ast_summary.json"); }
    public Path getGraphOutput()        { return resolve(graphOutput != null ? graphOutput : "docs/ast_graph.graphml"); }
    public Path getGraphJsonOutput()    { return graphJsonOutput != null ? resolve(graphJsonOutput) : null; }
    public boolean isMettaOnly()        { return mettaOnly != null && mettaOnly; }
    public boolean isIncludeVariables() { return includeVariables != null && includeVariables; }
    public int getWorkers()             { return workers != null && workers > 0 ? workers : 1; }
    public boolean isDebug()            { return debug != null && debug; }

    private Path resolve(String path) {
        return baseDir.resolve(path).normalize();
    }
}
