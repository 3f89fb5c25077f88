package com.vidnyan.semtree.adapter.out.parser;

import com.vidnyan.semtree.domain.model.SourceText;
import com.vidnyan.semtree.domain.model.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JavaParserCstParserTest {

    private final JavaParserCstParser parser = new JavaParserCstParser();

    private static SyntaxNode child(SyntaxNode parent, String kind) {
        return parent.children().stream()
                .filter(node -> node.kind().equals(kind))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No " + kind + " under " + parent.kind()));
    }

    private static Optional<SyntaxNode> find(SyntaxNode node, String kind) {
        if (node.kind().equals(kind)) {
            return Optional.of(node);
        }
        for (SyntaxNode child : node.children()) {
            Optional<SyntaxNode> found = find(child, kind);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static String text(SourceText source, SyntaxNode node) {
        return source.slice(node.startByte(), node.endByte());
    }

    @Test
    void parse_ShouldNameNodesAfterTheirClassesAndFields() {
        // Arrange
        SourceText source = SourceText.of("class A { int x; }");

        // Act
        SyntaxNode unit = (SyntaxNode) parser.parse(source, "java");

        // Assert
        assertEquals("compilation_unit", unit.kind());
        SyntaxNode type = child(unit, "class_declaration");
        assertEquals("class", type.children().get(0).kind());
        assertFalse(type.children().get(0).isNamed());

        SyntaxNode name = child(type, "simple_name");
        assertEquals("name", name.fieldName());
        assertEquals("A", text(source, name));

        SyntaxNode field = child(type, "field_declaration");
        assertEquals("members", field.fieldName());
        assertEquals(List.of("primitive_type", "variable_declarator", ";"),
                field.children().stream().map(SyntaxNode::kind).toList());
        assertEquals("type", field.children().get(0).fieldName());
        assertEquals("x", text(source, child(field.children().get(1), "simple_name")));
    }

    @Test
    void parse_ShouldDistinguishInterfacesGenericsAndQualifiedNames() {
        // Arrange
        SourceText source = SourceText.of("package a.b;\ninterface I { java.util.List<String> names(); }\n");

        // Act
        SyntaxNode unit = (SyntaxNode) parser.parse(source, "java");

        // Assert
        assertEquals("a.b", text(source, child(child(unit, "package_declaration"), "qualified_name")));
        SyntaxNode type = child(unit, "interface_declaration");
        SyntaxNode generic = find(type, "generic_type").orElseThrow();
        assertEquals("java.util.List<String>", text(source, generic));
        assertEquals(1, generic.startPosition().row());
    }

    @Test
    void parse_ShouldReportByteOffsetsForNonAsciiIdentifiers() {
        // Arrange
        SourceText source = SourceText.of("class Äpfel { }");

        // Act
        SyntaxNode unit = (SyntaxNode) parser.parse(source, "java");

        // Assert
        SyntaxNode name = child(child(unit, "class_declaration"), "simple_name");
        assertEquals(6, name.startByte());
        assertEquals(12, name.endByte());
        assertEquals("Äpfel", text(source, name));
    }

    @Test
    void parse_ShouldMarkUnparsableCodeAsError() {
        // Arrange
        SourceText broken = SourceText.of("class A { void f() { int x = ; } }");
        SourceText garbage = SourceText.of("%%% not java %%%");

        // Act
        SyntaxNode partial = (SyntaxNode) parser.parse(broken, "java");
        SyntaxNode whole = (SyntaxNode) parser.parse(garbage, "java");

        // Assert
        assertTrue(find(partial, "ERROR").isPresent());
        assertEquals("compilation_unit", whole.kind());
        assertEquals(1, whole.children().size());
        assertTrue(whole.children().get(0).isError());
        assertEquals(garbage.byteLength(), whole.children().get(0).endByte());
    }

    @Test
    void snakeCase_ShouldSplitOnCapitals() {
        assertEquals("method_call_expr", JavaParserCstParser.snakeCase("MethodCallExpr"));
        assertEquals("type_arguments", JavaParserCstParser.snakeCase("typeArguments"));
    }
}
