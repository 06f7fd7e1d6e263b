package com.galaxyast.docs.language;

import com.galaxyast.docs.syntax.ExternalParser;
import com.galaxyast.docs.syntax.JdtAstParser;
import com.galaxyast.docs.syntax.TreeSitterParser;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps file extensions to languages and hands out parsers for them.
 *
 * Both tables are fixed at construction and only read afterwards, so one registry
 * can serve concurrent walkers. Each {@link #resolveParser} call creates a fresh
 * external parser because the underlying parsers are not thread-safe.
 */
public class LanguageRegistry {

    public static class ParserUnavailableException extends RuntimeException {
        public ParserUnavailableException(String message) { super(message); }
        public ParserUnavailableException(String message, Throwable cause) { super(message, cause); }
    }

    private static final Map<String, Language> STANDARD_EXTENSIONS = Map.of(
        ".py",    Language.PYTHON,
        ".js",    Language.JAVASCRIPT,
        ".java",  Language.JAVA,
        ".metta", Language.METTA,
        ".mta",   Language.METTA
    );

    private final Map<String, Language> extensions;
    private final Map<Language, Supplier<ExternalParser>> parserFactories;

    public LanguageRegistry(Map<String, Language> extensions,
                            Map<Language, Supplier<ExternalParser>> parserFactories) {
        Map<String, Language> normalized = new LinkedHashMap<>();
        extensions.forEach((ext, lang) -> normalized.put(ext.toLowerCase(Locale.ROOT), lang));
        this.extensions = Collections.unmodifiableMap(normalized);
        Map<Language, Supplier<ExternalParser>> factories = new EnumMap<>(Language.class);
        factories.putAll(parserFactories);
        this.parserFactories = Collections.unmodifiableMap(factories);
    }

    /**
     * Registry with the standard extension table: tree-sitter for Python and
     * JavaScript, JDT for Java, the built-in front-end for MeTTa.
     */
    public static LanguageRegistry standard() {
        Map<Language, Supplier<ExternalParser>> factories = new EnumMap<>(Language.class);
        factories.put(Language.PYTHON, TreeSitterParser::python);
        factories.put(Language.JAVASCRIPT, TreeSitterParser::javascript);
        factories.put(Language.JAVA, JdtAstParser::new);
        return new LanguageRegistry(STANDARD_EXTENSIONS, factories);
    }

    /**
     * Detects the language from the file extension (case-insensitive, exact match).
     */
    public Optional<Language> detect(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(extensions.get(name.substring(dot).toLowerCase(Locale.ROOT)));
    }

    public boolean isDsl(Language language) {
        return language == Language.METTA;
    }

    /**
     * @throws ParserUnavailableException if {@code language} needs an external parser
     *         that is not registered or cannot be loaded
     */
    public ParserHandle resolveParser(Language language) {
        if (isDsl(language)) {
            return ParserHandle.DSL;
        }
        Supplier<ExternalParser> factory = parserFactories.get(language);
        if (factory == null) {
            throw new ParserUnavailableException("No parser registered for language: " + language.id());
        }
        try {
            return new ParserHandle.External(factory.get());
        } catch (LinkageError | IllegalStateException e) {
            throw new ParserUnavailableException(
                "Parser for " + language.id() + " could not be loaded: " + e.getMessage(), e);
        }
    }

    /**
     * True if {@link #resolveParser} would succeed for {@code language}.
     */
    public boolean isAvailable(Language language) {
        try {
            resolveParser(language);
            return true;
        } catch (ParserUnavailableException e) {
            return false;
        }
    }

    /** Distinct languages reachable through the extension table, in declaration order. */
    public List<Language> availableLanguages() {
        return extensions.values().stream().distinct().sorted().toList();
    }
}
