package com.galaxyast.docs.tree;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the folder/file tree for a root path.
 *
 * Directory entries are visited depth-first in name order; entries whose name starts
 * with a dot are skipped. With more than one worker the per-file step runs on a
 * fixed pool, and folders are assembled from the finished files in the same sorted
 * order, so the resulting tree does not depend on the worker count.
 * Symbolic links are followed, except a directory link back to one of its own
 * ancestors, which is recorded as an empty folder.
 */
public class DirectoryWalker {

    private final FileProcessor processor;
    private final int workers;

    public DirectoryWalker(FileProcessor processor) {
        this(processor, 1);
    }

    public DirectoryWalker(FileProcessor processor, int workers) {
        this.processor = processor;
        this.workers = Math.max(1, workers);
    }

    /**
     * @throws IllegalArgumentException if {@code root} does not exist
     */
    public TreeNode walk(Path root) {
        Path start = root.toAbsolutePath().normalize();
        if (!Files.exists(start)) {
            throw new IllegalArgumentException("Root path does not exist: " + root);
        }
        if (workers == 1) {
            return plan(start, null, Set.of()).get();
        }
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            return plan(start, pool, Set.of()).get();
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Schedules the subtree rooted at {@code path} and returns a supplier that yields
     * it once every file below has been processed. {@code ancestors} holds the real
     * paths of the directories above {@code path}.
     */
    private Supplier<TreeNode> plan(Path path, ExecutorService pool, Set<Path> ancestors) {
        String name = path.getFileName() != null ? path.getFileName().toString() : path.toString();

        if (Files.isDirectory(path)) {
            List<Supplier<TreeNode>> children = new ArrayList<>();
            Path real = realPath(path);
            if (real != null && ancestors.contains(real)) {
                System.err.println("[ast-docs] WARNING: skipping directory cycle at " + path + " -> " + real);
            } else {
                Set<Path> below = new HashSet<>(ancestors);
                if (real != null) {
                    below.add(real);
                }
                for (Path child : listChildren(path)) {
                    children.add(plan(child, pool, below));
                }
            }
            return () -> new FolderNode(name, path.toString(),
                children.stream().map(Supplier::get).collect(Collectors.toList()));
        }

        if (pool == null) {
            return () -> processor.process(path);
        }
        Future<FileNode> pending = pool.submit(() -> processor.process(path));
        return () -> await(pending, path);
    }

    private static Path realPath(Path directory) {
        try {
            return directory.toRealPath();
        } catch (IOException e) {
            System.err.println("[ast-docs] WARNING: could not resolve " + directory + ": " + e.getMessage());
            return null;
        }
    }

    private List<Path> listChildren(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                .filter(p -> !p.getFileName().toString().startsWith("."))
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[ast-docs] WARNING: could not list directory " + directory + ": " + e.getMessage());
            return List.of();
        }
    }

    private static TreeNode await(Future<FileNode> pending, Path path) {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing " + path, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("File processing escaped its error boundary: " + path, e.getCause());
        }
    }
}
