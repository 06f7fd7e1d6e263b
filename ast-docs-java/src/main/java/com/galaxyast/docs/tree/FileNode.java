package com.galaxyast.docs.tree;

import com.galaxyast.docs.language.Language;
import com.galaxyast.docs.model.Definitions;
import com.google.gson.annotations.SerializedName;

import java.util.Optional;

/**
 * A file of the scanned tree. Once processed, a file with a detected language
 * carries either definitions or a parse error, never both; a file whose language
 * is unknown carries neither.
 */
public final class FileNode implements TreeNode {

    public static final String TYPE = "file";

    @SerializedName("name")        private final String name;
    @SerializedName("path")        private final String path;
    @SerializedName("type")        private final String type = TYPE;
    @SerializedName("language")    private final String language;        // nullable
    @SerializedName("definitions") private final Definitions definitions; // nullable
    @SerializedName("parser_kind") private final ParserKind parserKind;   // nullable
    @SerializedName("parse_error") private final String parseError;       // nullable

    private FileNode(String name, String path, Language language, Definitions definitions,
                     ParserKind parserKind, String parseError) {
        this.name = name;
        this.path = path;
        this.language = language != null ? language.id() : null;
        this.definitions = definitions;
        this.parserKind = parserKind;
        this.parseError = parseError;
    }

    public static FileNode unrecognized(String name, String path) {
        return new FileNode(name, path, null, null, null, null);
    }

    public static FileNode parsed(String name, String path, Language language,
                                  Definitions definitions, ParserKind parserKind) {
        return new FileNode(name, path, language, definitions, parserKind, null);
    }

    public static FileNode failed(String name, String path, Language language, String parseError) {
        return new FileNode(name, path, language, null, null, parseError);
    }

    @Override public String name() { return name; }
    @Override public String path() { return path; }
    @Override public String type() { return type; }

    public Optional<String> language()          { return Optional.ofNullable(language); }
    public Optional<Definitions> definitions()  { return Optional.ofNullable(definitions); }
    public Optional<ParserKind> parserKind()    { return Optional.ofNullable(parserKind); }
    public Optional<String> parseError()        { return Optional.ofNullable(parseError); }

    public boolean hasError() {
        return parseError != null;
    }

    @Override
    public String toString() {
        return "FileNode(" + path + ", language=" + language
            + (parseError != null ? ", error=" + parseError : "") + ")";
    }
}
