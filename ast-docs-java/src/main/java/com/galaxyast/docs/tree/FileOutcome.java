package com.galaxyast.docs.tree;

import com.galaxyast.docs.language.Language;
import com.galaxyast.docs.model.Definitions;

/**
 * Result of processing a single file.
 */
public sealed interface FileOutcome {

    /** No language is registered for the file's extension. */
    record Unrecognized() implements FileOutcome {}

    record Parsed(Language language, Definitions definitions, ParserKind parserKind) implements FileOutcome {}

    record Failed(Language language, String reason) implements FileOutcome {}

    default FileNode toNode(String name, String path) {
        if (this instanceof Parsed parsed) {
            return FileNode.parsed(name, path, parsed.language(), parsed.definitions(), parsed.parserKind());
        }
        if (this instanceof Failed failed) {
            return FileNode.failed(name, path, failed.language(), failed.reason());
        }
        return FileNode.unrecognized(name, path);
    }
}
