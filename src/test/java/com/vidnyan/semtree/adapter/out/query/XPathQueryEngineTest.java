package com.vidnyan.semtree.adapter.out.query;

import com.vidnyan.semtree.application.port.in.BuildSemanticTreeUseCase.BuildRequest;
import com.vidnyan.semtree.domain.error.QueryException;
import com.vidnyan.semtree.domain.model.QueryMatch;
import com.vidnyan.semtree.domain.model.SemanticDocument;
import com.vidnyan.semtree.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XPathQueryEngineTest {

    private static final String GREETER = """
            class Greeter {
                void hello() { }
                void bye() { }
            }
            """;

    private TestEngine engine;
    private XPathQueryEngine queryEngine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        queryEngine = new XPathQueryEngine();
    }

    private SemanticDocument java(String source) {
        return engine.builder.build(BuildRequest.forSource("java", source));
    }

    @Test
    void evaluate_ShouldMapNodesBackToTheirSourceLocation() {
        // Arrange
        SemanticDocument document = java(GREETER);

        // Act
        List<QueryMatch> matches = queryEngine.evaluate(document, "//method/name");

        // Assert
        assertEquals(2, matches.size());
        QueryMatch hello = matches.get(0);
        assertEquals("hello", hello.value());
        assertEquals(2, hello.line());
        assertEquals(10, hello.column());
        assertEquals(List.of("    void hello() { }"), hello.sourceLines());
        assertEquals("<input>:2:10 hello", hello.format());
        assertEquals("bye", matches.get(1).value());
    }

    @Test
    void evaluate_ShouldStartAtTheFilesRoot() {
        // Arrange
        SemanticDocument document = java(GREETER);

        // Act
        List<QueryMatch> matches = queryEngine.evaluate(document, "/Files/File/unit/class/name");

        // Assert
        assertEquals(1, matches.size());
        assertEquals("Greeter", matches.get(0).value());
    }

    @Test
    void evaluate_ShouldReturnScalarsWithoutLocation() {
        // Arrange
        SemanticDocument document = java(GREETER);

        // Act
        QueryMatch count = queryEngine.evaluate(document, "count(//method)").get(0);
        QueryMatch exists = queryEngine.evaluate(document, "boolean(//class)").get(0);
        QueryMatch name = queryEngine.evaluate(document, "string(//class/name)").get(0);

        // Assert
        assertEquals("2", count.value());
        assertFalse(count.hasLocation());
        assertEquals("true", exists.value());
        assertEquals("Greeter", name.value());
    }

    @Test
    void evaluate_ShouldLocateAttributesByTheirOwnerElement() {
        // Arrange
        SemanticDocument document = java(GREETER);

        // Act
        List<QueryMatch> matches = queryEngine.evaluate(document, "//class/@start");

        // Assert
        assertEquals(1, matches.size());
        assertEquals("1:1", matches.get(0).value());
        assertEquals(1, matches.get(0).line());
    }

    @Test
    void evaluate_ShouldQueryTheDataBranchOfConfigurationFiles() {
        // Arrange
        SemanticDocument document = engine.builder.build(
                BuildRequest.forSource("yaml", "server:\n  port: 8080\n"));

        // Act
        List<QueryMatch> matches = queryEngine.evaluate(document, "/Files/File[@format='yaml']/data/server/port");

        // Assert
        assertEquals(1, matches.size());
        assertEquals("8080", matches.get(0).value());
        assertEquals(2, matches.get(0).line());
        assertEquals(List.of("  port: 8080"), matches.get(0).sourceLines());
    }

    @Test
    void evaluate_ShouldRejectInvalidExpressions() {
        // Arrange
        SemanticDocument document = java(GREETER);

        // Act & Assert
        QueryException thrown = assertThrows(QueryException.class, () -> queryEngine.evaluate(document, "//["));
        assertTrue(thrown.getMessage().startsWith("Invalid query '//['"));
    }

    @Test
    void formatNumber_ShouldPrintWholeNumbersWithoutFraction() {
        assertEquals("3", XPathQueryEngine.formatNumber(3.0));
        assertEquals("2.5", XPathQueryEngine.formatNumber(2.5));
        assertEquals("NaN", XPathQueryEngine.formatNumber(Double.NaN));
    }
}
