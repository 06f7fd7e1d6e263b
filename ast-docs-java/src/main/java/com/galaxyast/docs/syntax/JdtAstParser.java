package com.galaxyast.docs.syntax;

import com.galaxyast.docs.language.Language;
import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.util.HashMap;
import java.util.Map;

/**
 * Wrapper around Eclipse JDT's ASTParser for Java sources.
 * Parses one file at a time without a classpath; bindings are not resolved.
 */
public class JdtAstParser implements ExternalParser {

    private final Map<String, String> compilerOptions;

    public JdtAstParser() {
        Map<String, String> options = new HashMap<>();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        this.compilerOptions = options;
    }

    @Override
    public Language language() {
        return Language.JAVA;
    }

    @Override
    public SyntaxTree parse(byte[] source) {
        String text = SourceDecoder.strict(source);

        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(false);
        parser.setStatementsRecovery(true);
        parser.setCompilerOptions(compilerOptions);
        parser.setSource(text.toCharArray());

        CompilationUnit unit = (CompilationUnit) parser.createAST(null);
        return new SyntaxTree(Language.JAVA, new JdtSyntaxNode(unit, unit, text));
    }
}
