package com.galaxyast.docs;

import com.galaxyast.docs.extract.DefinitionExtractor;
import com.galaxyast.docs.language.Language;
import com.galaxyast.docs.model.ClassDef;
import com.galaxyast.docs.model.CodeDefinitions;
import com.galaxyast.docs.model.FunctionDef;
import com.galaxyast.docs.syntax.JdtAstParser;
import com.galaxyast.docs.syntax.SourceDecoder;
import com.galaxyast.docs.syntax.SyntaxNode;
import com.galaxyast.docs.syntax.SyntaxPoint;
import com.galaxyast.docs.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionExtractorTest {

    private final DefinitionExtractor extractor = new DefinitionExtractor();

    /** Hand-built node in the shape of a tree-sitter JavaScript tree. */
    private static final class FakeNode implements SyntaxNode {
        private final String type;
        private final String text;
        private final int startRow;
        private final int endRow;
        private final List<SyntaxNode> children;
        private final Map<String, SyntaxNode> fields = new HashMap<>();

        FakeNode(String type, String text, int startRow, int endRow, SyntaxNode... children) {
            this.type = type;
            this.text = text;
            this.startRow = startRow;
            this.endRow = endRow;
            this.children = List.of(children);
        }

        FakeNode field(String name, SyntaxNode child) {
            fields.put(name, child);
            return this;
        }

        @Override public String type()                { return type; }
        @Override public SyntaxPoint startPoint()     { return new SyntaxPoint(startRow, 0); }
        @Override public SyntaxPoint endPoint()       { return new SyntaxPoint(endRow, 1); }
        @Override public List<SyntaxNode> children()  { return children; }
        @Override public SyntaxNode childByFieldName(String name) { return fields.get(name); }
        @Override public String text()                { return text; }
    }

    private static FakeNode ident(String name, int row) {
        return new FakeNode("identifier", name, row, row);
    }

    private static FakeNode named(String type, String name, int startRow, int endRow, SyntaxNode... body) {
        FakeNode id = ident(name, startRow);
        SyntaxNode[] children = new SyntaxNode[body.length + 1];
        children[0] = id;
        System.arraycopy(body, 0, children, 1, body.length);
        return new FakeNode(type, name, startRow, endRow, children).field("name", id);
    }

    private static FakeNode variable(String name, int row) {
        return named("variable_declarator", name, row, row);
    }

    private static SyntaxTree javascript(SyntaxNode... topLevel) {
        return new SyntaxTree(Language.JAVASCRIPT, new FakeNode("program", "", 0, 40, topLevel));
    }

    private static List<String> names(List<FunctionDef> functions) {
        return functions.stream().map(FunctionDef::name).collect(Collectors.toList());
    }

    @Test
    void functionsAttachToInnermostEnclosingClass() {
        SyntaxTree tree = javascript(
            named("class_declaration", "Outer", 0, 20,
                named("method_definition", "first", 1, 3),
                named("class_declaration", "Inner", 4, 8,
                    named("method_definition", "nested", 5, 7)),
                named("method_definition", "last", 9, 12)));

        CodeDefinitions defs = extractor.extract(tree);

        assertEquals(List.of("Outer", "Inner"),
            defs.classes().stream().map(ClassDef::name).collect(Collectors.toList()));
        assertEquals(List.of("first", "last"), names(defs.classes().get(0).functions()));
        assertEquals(List.of("nested"), names(defs.classes().get(1).functions()));
        assertTrue(defs.functions().isEmpty());
    }

    @Test
    void functionsOutsideClassesAreTopLevel() {
        SyntaxTree tree = javascript(
            named("class_declaration", "Cart", 0, 4, named("method_definition", "add", 1, 3)),
            named("function_declaration", "checkout", 6, 9, variable("total", 7)));

        CodeDefinitions defs = extractor.extract(tree);

        assertEquals(List.of(new FunctionDef("checkout", 7, List.of("total"), 4)), defs.functions());
        assertEquals(1, defs.classes().get(0).line());
    }

    @Test
    void variablesAreCollectedFromWholeFunctionSubtreeInOrder() {
        SyntaxTree tree = javascript(
            named("function_declaration", "outer", 0, 10,
                variable("a", 1),
                new FakeNode("statement_block", "", 2, 8,
                    variable("b", 3),
                    named("function_declaration", "inner", 4, 6, variable("c", 5))),
                variable("a", 9)));

        CodeDefinitions defs = extractor.extract(tree);

        assertEquals(List.of("a", "b", "c", "a"), defs.functions().get(0).variables());
        assertEquals(List.of("c"), defs.functions().get(1).variables());
    }

    @Test
    void namelessDeclarationsAreSkipped() {
        SyntaxTree tree = javascript(
            new FakeNode("class", "", 0, 5,
                named("method_definition", "orphan", 1, 3)),
            new FakeNode("function_declaration", "", 6, 7));

        CodeDefinitions defs = extractor.extract(tree);

        assertTrue(defs.classes().isEmpty());
        assertEquals(List.of("orphan"), names(defs.functions()));
    }

    @Test
    void singleLineFunctionSpansOneLine() {
        CodeDefinitions defs = extractor.extract(javascript(named("function_declaration", "f", 3, 3)));
        assertEquals(1, defs.functions().get(0).lineCount());
        assertEquals(4, defs.functions().get(0).line());
    }

    @Test
    void functionEndingBeforeItStartsIsRejected() {
        SyntaxTree tree = javascript(named("function_declaration", "broken", 5, 2));
        assertThrows(DefinitionExtractor.ExtractionException.class, () -> extractor.extract(tree));
    }

    @Test
    void languageWithoutProfileIsRejected() {
        SyntaxTree tree = new SyntaxTree(Language.METTA, new FakeNode("program", "", 0, 0));
        assertThrows(DefinitionExtractor.ExtractionException.class, () -> extractor.extract(tree));
    }

    @Test
    void missingRootIsRejected() {
        assertThrows(DefinitionExtractor.ExtractionException.class,
            () -> extractor.extract(new SyntaxTree(Language.JAVA, null)));
    }

    @Test
    void extractsJavaSourceThroughJdt() {
        String source = String.join("\n",
            "package sample;",
            "",
            "public class OrderService {",
            "    private final String region = \"eu\";",
            "",
            "    public long createOrder(int quantity, long price) {",
            "        long total = quantity * price;",
            "        long discount = total / 10;",
            "        return total - discount;",
            "    }",
            "",
            "    static class Audit {",
            "        void record(String event) {",
            "            String line = event;",
            "        }",
            "    }",
            "}",
            "");
        SyntaxTree tree = new JdtAstParser().parse(source.getBytes(StandardCharsets.UTF_8));

        CodeDefinitions defs = extractor.extract(tree);

        assertEquals(2, defs.classes().size());
        ClassDef service = defs.classes().get(0);
        assertEquals("OrderService", service.name());
        assertEquals(3, service.line());
        assertEquals(List.of(new FunctionDef("createOrder", 6, List.of("total", "discount"), 5)),
            service.functions());

        ClassDef audit = defs.classes().get(1);
        assertEquals("Audit", audit.name());
        assertEquals(List.of(new FunctionDef("record", 13, List.of("line"), 3)), audit.functions());
        assertTrue(defs.functions().isEmpty());
    }

    @Test
    void javaEnumsAndRecordsAreClasses() {
        String source = "enum Color { RED; void paint() {} }\nrecord Point(int x, int y) { int sum() { int s = x + y; return s; } }\n";
        CodeDefinitions defs = extractor.extract(new JdtAstParser().parse(source.getBytes(StandardCharsets.UTF_8)));

        assertEquals(List.of("Color", "Point"),
            defs.classes().stream().map(ClassDef::name).collect(Collectors.toList()));
        assertEquals(List.of("paint"), names(defs.classes().get(0).functions()));
        assertEquals(List.of("s"), defs.classes().get(1).functions().get(0).variables());
    }

    @Test
    void javadocIsNotPartOfTheDeclarationRange() {
        String source = String.join("\n",
            "/**",
            " * Service.",
            " */",
            "public class A {",
            "    /**",
            "     * Doc.",
            "     */",
            "    void m() {",
            "    }",
            "}",
            "");
        CodeDefinitions defs = extractor.extract(new JdtAstParser().parse(source.getBytes(StandardCharsets.UTF_8)));

        ClassDef a = defs.classes().get(0);
        assertEquals(4, a.line());
        assertEquals(List.of(new FunctionDef("m", 8, List.of(), 2)), a.functions());
    }

    @Test
    void annotatedJavadocMethodStartsAtItsAnnotation() {
        String source = String.join("\n",
            "class A {",
            "    /** Doc. */",
            "    @Override",
            "    public String toString() {",
            "        return \"a\";",
            "    }",
            "}",
            "");
        CodeDefinitions defs = extractor.extract(new JdtAstParser().parse(source.getBytes(StandardCharsets.UTF_8)));

        assertEquals(List.of(new FunctionDef("toString", 3, List.of(), 4)), defs.classes().get(0).functions());
    }

    @Test
    void lambdaParametersAreNotVariables() {
        String source = String.join("\n",
            "class A {",
            "    void m(java.util.List<String> l) {",
            "        l.forEach(item -> System.out.println(item));",
            "        java.util.function.BiFunction<Integer, Integer, Integer> add = (x, y) -> {",
            "            int sum = x + y;",
            "            return sum;",
            "        };",
            "    }",
            "}",
            "");
        CodeDefinitions defs = extractor.extract(new JdtAstParser().parse(source.getBytes(StandardCharsets.UTF_8)));

        assertEquals(List.of("add", "sum"), defs.classes().get(0).functions().get(0).variables());
    }

    @Test
    void invalidUtf8IsRejectedByStrictDecoding() {
        byte[] source = {'c', 'l', 'a', 's', 's', ' ', (byte) 0xC3, (byte) 0x28, '{', '}'};
        assertThrows(SourceDecoder.DecodeException.class, () -> new JdtAstParser().parse(source));
    }
}
