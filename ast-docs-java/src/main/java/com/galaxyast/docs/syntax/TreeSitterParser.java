package com.galaxyast.docs.syntax;

import com.galaxyast.docs.language.Language;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;

/**
 * External parser backed by a tree-sitter grammar.
 *
 * Constructing an instance loads the grammar's native library, so a missing or
 * incompatible library surfaces here rather than on first parse.
 * {@link TSParser} is not thread-safe; use one instance per thread.
 */
public class TreeSitterParser implements ExternalParser {

    private final Language language;
    private final TSParser parser = new TSParser();

    public TreeSitterParser(Language language, TSLanguage grammar) {
        this.language = language;
        if (!parser.setLanguage(grammar)) {
            throw new IllegalStateException(
                "tree-sitter grammar for " + language.id() + " is incompatible with the runtime library");
        }
    }

    public static TreeSitterParser python() {
        return new TreeSitterParser(Language.PYTHON, new TreeSitterPython());
    }

    public static TreeSitterParser javascript() {
        return new TreeSitterParser(Language.JAVASCRIPT, new TreeSitterJavascript());
    }

    @Override
    public Language language() {
        return language;
    }

    @Override
    public SyntaxTree parse(byte[] source) {
        String text = SourceDecoder.strict(source);
        TSTree tree = parser.parseString(null, text);
        return new SyntaxTree(language, new TreeSitterSyntaxNode(tree, tree.getRootNode(), source));
    }
}
