package com.vidnyan.semtree.domain.build;

import com.vidnyan.semtree.domain.model.NameTable;
import com.vidnyan.semtree.domain.model.SemanticNode;
import com.vidnyan.semtree.domain.model.SyntaxNode;
import com.vidnyan.semtree.domain.rule.IdentifierRole;
import com.vidnyan.semtree.domain.rule.RuleTable;
import com.vidnyan.semtree.support.CstBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TypeUnificationTest {

    private final RewritingWalker walker = new RewritingWalker(new NameTable());

    private final RuleTable rules = RuleTable.builder()
            .name("types")
            .identifierKinds(Set.of("identifier"))
            .typeKinds(Set.of("simple_type"))
            .nullableTypeKinds(Set.of("nullable_type"))
            .arrayTypeKinds(Set.of("array_type"))
            .genericTypeKinds(Set.of("generic_type"))
            .typeArgumentKinds(Set.of("type_arguments"))
            .classifier((node, ancestors, special) -> "array_type".equals(ancestors.parentKind())
                    ? IdentifierRole.TYPE
                    : IdentifierRole.NAME)
            .build();

    private SemanticNode typeOf(CstBuilder cst, SyntaxNode type) {
        SemanticNode declaration = walker.build(cst.node("declaration", type), cst.source(), rules);
        return declaration.element("type").orElseThrow();
    }

    private static String ownText(SemanticNode node) {
        return node.children().stream()
                .filter(SemanticNode::isText)
                .map(SemanticNode::text)
                .collect(Collectors.joining());
    }

    @Test
    void simpleType_ShouldNormalizeWhitespace() {
        // Arrange
        CstBuilder cst = CstBuilder.of("unsigned   long");

        // Act
        SemanticNode type = typeOf(cst, cst.leaf("simple_type", "unsigned   long"));

        // Assert
        assertEquals("unsigned long", type.stringValue());
        assertTrue(type.elements().isEmpty());
    }

    @Test
    void genericType_ShouldSplitBaseAndArguments() {
        // Arrange
        CstBuilder cst = CstBuilder.of("Map<String, List<int>>");
        SyntaxNode map = cst.node("generic_type",
                cst.leaf("identifier", "Map"),
                cst.node("type_arguments",
                        cst.token("<"),
                        cst.leaf("simple_type", "String"),
                        cst.token(","),
                        cst.node("generic_type",
                                cst.leaf("identifier", "List"),
                                cst.node("type_arguments",
                                        cst.token("<"), cst.leaf("simple_type", "int"), cst.token(">"))),
                        cst.token(">")));

        // Act
        SemanticNode type = typeOf(cst, map);

        // Assert
        assertTrue(type.hasElement("generic"));
        assertEquals("Map", ownText(type));
        List<SemanticNode> arguments = type.element("arguments").orElseThrow().elements("type");
        assertEquals(2, arguments.size());
        assertEquals("String", arguments.get(0).stringValue());
        SemanticNode list = arguments.get(1);
        assertTrue(list.hasElement("generic"));
        assertEquals("List", ownText(list));
        assertEquals("int", list.element("arguments").orElseThrow().element("type").orElseThrow().stringValue());
    }

    @Test
    void nullableType_ShouldInlineASimpleInnerType() {
        // Arrange
        CstBuilder cst = CstBuilder.of("int?");
        SyntaxNode nullable = cst.node("nullable_type", cst.leaf("simple_type", "int"), cst.token("?"));

        // Act
        SemanticNode type = typeOf(cst, nullable);

        // Assert
        assertTrue(type.element("nullable").orElseThrow().isEmptyMarker());
        assertEquals("int", ownText(type));
        assertEquals(1, type.elements().size());
    }

    @Test
    void arrayType_ShouldInlineAnIdentifierClassifiedAsType() {
        // Arrange
        CstBuilder cst = CstBuilder.of("Foo[]");
        SyntaxNode array = cst.node("array_type", cst.leaf("identifier", "Foo"), cst.token("["), cst.token("]"));

        // Act
        SemanticNode type = typeOf(cst, array);

        // Assert
        assertTrue(type.hasElement("array"));
        assertEquals("Foo", ownText(type));
    }

    @Test
    void arrayType_ShouldNestAStructuredInnerType() {
        // Arrange
        CstBuilder cst = CstBuilder.of("List<int>[]");
        SyntaxNode array = cst.node("array_type",
                cst.node("generic_type",
                        cst.leaf("identifier", "List"),
                        cst.node("type_arguments", cst.token("<"), cst.leaf("simple_type", "int"), cst.token(">"))),
                cst.token("["),
                cst.token("]"));

        // Act
        SemanticNode type = typeOf(cst, array);

        // Assert
        assertTrue(type.hasElement("array"));
        SemanticNode inner = type.element("type").orElseThrow();
        assertTrue(inner.hasElement("generic"));
        assertEquals("List", ownText(inner));
    }
}
