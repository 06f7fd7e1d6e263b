package com.galaxyast.docs.tree;

import com.galaxyast.docs.extract.DefinitionExtractor;
import com.galaxyast.docs.extract.MettaDefinitionExtractor;
import com.galaxyast.docs.language.Language;
import com.galaxyast.docs.language.LanguageRegistry;
import com.galaxyast.docs.language.ParserHandle;
import com.galaxyast.docs.metta.MettaNode;
import com.galaxyast.docs.metta.MettaParser;
import com.galaxyast.docs.model.Definitions;
import com.galaxyast.docs.syntax.SyntaxTree;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads, parses and extracts one file.
 *
 * Every failure is caught here and turned into a {@link FileOutcome.Failed}; nothing
 * thrown while handling one file escapes {@link #process}. Safe to call from several
 * threads: each call builds its own parser.
 */
public class FileProcessor {

    private final LanguageRegistry registry;
    private final DefinitionExtractor definitionExtractor = new DefinitionExtractor();
    private final MettaDefinitionExtractor mettaExtractor = new MettaDefinitionExtractor();
    private final boolean debug;

    public FileProcessor(LanguageRegistry registry, boolean debug) {
        this.registry = registry;
        this.debug = debug;
    }

    public FileNode process(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        String name = absolute.getFileName() != null ? absolute.getFileName().toString() : absolute.toString();
        return outcomeOf(absolute).toNode(name, absolute.toString());
    }

    public FileOutcome outcomeOf(Path file) {
        Optional<Language> detected = registry.detect(file);
        if (detected.isEmpty()) {
            return new FileOutcome.Unrecognized();
        }
        Language language = detected.get();
        try {
            byte[] source = Files.readAllBytes(file);
            ParserHandle handle = registry.resolveParser(language);
            if (handle instanceof ParserHandle.External external) {
                SyntaxTree tree = external.parser().parse(source);
                Definitions definitions = definitionExtractor.extract(tree);
                return new FileOutcome.Parsed(language, definitions, ParserKind.EXTERNAL);
            }
            MettaNode root = new MettaParser().parse(source);
            return new FileOutcome.Parsed(language, mettaExtractor.extract(root), ParserKind.DSL);
        } catch (IOException e) {
            return failed(file, language, "Could not read file: " + describe(e));
        } catch (RuntimeException | StackOverflowError e) {
            return failed(file, language, describe(e));
        }
    }

    private FileOutcome failed(Path file, Language language, String reason) {
        if (debug) {
            System.err.println("[ast-docs] WARNING: error parsing " + file + ": " + reason);
        }
        return new FileOutcome.Failed(language, reason);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
