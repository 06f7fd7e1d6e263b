package com.galaxyast.docs.output;

import com.galaxyast.docs.tree.TreeNode;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the hierarchical document: folders as {@code name, path, type, children},
 * files as {@code name, path, type, language?, definitions?, parser_kind?, parse_error?}.
 * Absent optional fields are omitted. Children keep the tree's name order, so equal
 * trees serialize to identical text.
 */
public class TreeSerializer {

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    public String toJson(TreeNode root) {
        return GSON.toJson(root);
    }

    /**
     * Writes {@code root} to {@code outputFile}, creating parent directories as needed.
     */
    public void write(TreeNode root, Path outputFile) {
        Path parent = outputFile.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + parent, e);
        }

        try (Writer w = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            GSON.toJson(root, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + outputFile + ": " + e.getMessage(), e);
        }
        System.err.println("[ast-docs] tree written: " + outputFile);
    }
}
