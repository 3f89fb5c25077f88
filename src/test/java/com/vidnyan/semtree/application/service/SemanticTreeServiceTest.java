package com.vidnyan.semtree.application.service;

import com.vidnyan.semtree.application.port.in.BuildSemanticTreeUseCase.BuildRequest;
import com.vidnyan.semtree.domain.error.SourceReadException;
import com.vidnyan.semtree.domain.error.UnsupportedLanguageException;
import com.vidnyan.semtree.domain.model.ConfigFormat;
import com.vidnyan.semtree.domain.model.SemanticDocument;
import com.vidnyan.semtree.domain.model.SemanticNode;
import com.vidnyan.semtree.domain.rule.LanguageDefinition;
import com.vidnyan.semtree.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SemanticTreeServiceTest {

    @TempDir
    Path tempDir;

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
    }

    @Test
    void build_ShouldProduceAstAndDataBranchesForJson() {
        // Arrange
        String json = "{\"server\": {\"port\": 8080}, \"tags\": [\"a\", \"b\"], \"my key\": true}";

        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forSource("json", json));

        // Assert
        assertEquals(ConfigFormat.JSON, document.format());
        SemanticNode file = document.fileNode();
        assertEquals("File", file.elementName());
        assertEquals("json", file.attribute("format"));
        assertEquals(List.of("ast", "data"), file.elements().stream().map(SemanticNode::elementName).toList());

        SemanticNode ast = document.ast().orElseThrow();
        assertEquals(3, ast.element("object").orElseThrow().elements("property").size());

        SemanticNode data = document.data().orElseThrow();
        assertEquals("8080", data.element("server").orElseThrow().element("port").orElseThrow().stringValue());
        assertEquals(List.of("a", "b"), data.elements("tags").stream().map(SemanticNode::stringValue).toList());
        SemanticNode sanitized = data.element("my_key").orElseThrow();
        assertEquals("my key", sanitized.attribute("key"));
        assertEquals("true", sanitized.stringValue());
    }

    @Test
    void build_ShouldNotGrowTheSharedNameTable() {
        // Arrange
        int before = engine.names.size();

        // Act
        for (int i = 0; i < 200; i++) {
            engine.builder.build(BuildRequest.forSource("json", "{\"key" + i + "\": " + i + "}"));
            engine.builder.build(BuildRequest.forSource("yaml", "entry_" + i + ": x\n"));
        }

        // Assert
        assertEquals(before, engine.names.size());
        assertFalse(engine.names.contains("key7"));
    }

    @Test
    void build_ShouldKeepSpansOnBothBranches() {
        // Arrange
        String json = "{\n  \"port\": 8080\n}";

        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forSource("json", json));

        // Assert
        SemanticNode astPort = document.ast().orElseThrow().descendants("number").get(0);
        SemanticNode dataPort = document.data().orElseThrow().element("port").orElseThrow();
        assertEquals("2:11", astPort.attribute("start"));
        assertEquals(astPort.span(), dataPort.span());
    }

    @Test
    void build_ShouldProduceRepeatedElementsForYamlSequences() {
        // Arrange
        String yaml = "name: demo\nports:\n  - 80\n  - 443\nempty:\n";

        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forSource("yml", yaml));

        // Assert
        SemanticNode data = document.data().orElseThrow();
        assertEquals("demo", data.element("name").orElseThrow().stringValue());
        assertEquals(List.of("80", "443"), data.elements("ports").stream().map(SemanticNode::stringValue).toList());
        assertTrue(data.element("empty").orElseThrow().children().isEmpty());
        assertEquals("yaml", document.language());
    }

    @Test
    void build_ShouldKeepOneDataElementPerYamlDocument() {
        // Arrange
        String yaml = "a: 1\n---\na: 2\n";

        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forSource("yaml", yaml));

        // Assert
        SemanticNode data = document.data().orElseThrow();
        assertTrue(data.elements("a").isEmpty());
        List<SemanticNode> documents = data.elements("document");
        assertEquals(2, documents.size());
        assertEquals("1", documents.get(0).element("a").orElseThrow().stringValue());
        assertEquals("2", documents.get(1).element("a").orElseThrow().stringValue());
        assertEquals("2:1", documents.get(1).attribute("start"));
    }

    @Test
    void build_ShouldProjectYamlAliasesByName() {
        // Arrange
        String yaml = "base: &port 8080\ncopy: *port\n";

        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forSource("yaml", yaml));

        // Assert
        SemanticNode data = document.data().orElseThrow();
        assertEquals("8080", data.element("base").orElseThrow().stringValue());
        assertEquals("port", data.element("copy").orElseThrow().stringValue());
    }

    @Test
    void build_ShouldWrapUnkeyedJsonArrayElementsInItems() {
        // Arrange
        String json = "[1, [2, 3]]";

        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forSource("json", json));

        // Assert
        SemanticNode data = document.data().orElseThrow();
        List<SemanticNode> items = data.elements("item");
        assertEquals(2, items.size());
        assertEquals("1", items.get(0).stringValue());
        assertEquals("1:2", items.get(0).attribute("start"));

        SemanticNode nested = items.get(1);
        assertEquals("1:5", nested.attribute("start"));
        List<SemanticNode> inner = nested.elements("item");
        assertEquals(List.of("2", "3"), inner.stream().map(SemanticNode::stringValue).toList());
        assertEquals("1:6", inner.get(0).attribute("start"));
        assertEquals("1:9", inner.get(1).attribute("start"));
    }

    @Test
    void build_ShouldWrapUnkeyedYamlSequenceItems() {
        // Arrange
        String yaml = "- a\n- - b\n  - c\n";

        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forSource("yaml", yaml));

        // Assert
        SemanticNode data = document.data().orElseThrow();
        List<SemanticNode> items = data.elements("item");
        assertEquals(2, items.size());
        assertEquals("a", items.get(0).stringValue());
        assertEquals("1:1", items.get(0).attribute("start"));

        SemanticNode nested = items.get(1);
        assertEquals("2:1", nested.attribute("start"));
        List<SemanticNode> inner = nested.elements("item");
        assertEquals(List.of("b", "c"), inner.stream().map(SemanticNode::stringValue).toList());
        assertEquals("2:3", inner.get(0).attribute("start"));
        assertEquals("3:3", inner.get(1).attribute("start"));
    }

    @Test
    void build_ShouldRewriteJavaWithTheJavaTable() {
        // Arrange
        String java = "public class Counter { private int count; int next() { return count + 1; } }";

        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forSource("java", java));

        // Assert
        SemanticNode unit = document.content().orElseThrow();
        assertEquals("unit", unit.elementName());
        SemanticNode type = unit.element("class").orElseThrow();
        assertTrue(type.hasElement("public"));
        assertEquals("Counter", type.element("name").orElseThrow().stringValue());
        assertTrue(type.element("field").orElseThrow().hasElement("private"));
        SemanticNode binary = unit.descendants("binary").get(0);
        assertEquals("+", binary.attribute("op"));
        assertFalse(document.isDualBranch());
    }

    @Test
    void build_ShouldCaptureTheParserTreeInRawMode() {
        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forSource("json", "[1]").raw());

        // Assert
        SemanticNode file = document.fileNode();
        assertFalse(file.hasAttribute("format"));
        SemanticNode root = file.element("document").orElseThrow();
        SemanticNode array = root.element("array").orElseThrow();
        assertEquals("1", array.element("number").orElseThrow().stringValue());
        assertEquals("[1]", array.stringValue());
    }

    @Test
    void build_ShouldDetectTheLanguageAndStripTheByteOrderMark() throws IOException {
        // Arrange
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "\uFEFF{\"debug\": false}");

        // Act
        SemanticDocument document = engine.builder.build(BuildRequest.forFile(file));

        // Assert
        assertEquals("json", document.language());
        assertEquals(file.toString(), document.fileNode().attribute("path"));
        assertEquals("false", document.data().orElseThrow().element("debug").orElseThrow().stringValue());
        assertEquals("1:1", document.ast().orElseThrow().element("object").orElseThrow().attribute("start"));
    }

    @Test
    void build_ShouldRejectUnknownLanguagesAndLanguagesWithoutParser() {
        UnsupportedLanguageException unknown = assertThrows(UnsupportedLanguageException.class,
                () -> engine.builder.build(BuildRequest.forSource("cobol", "x")));
        UnsupportedLanguageException noParser = assertThrows(UnsupportedLanguageException.class,
                () -> engine.builder.build(BuildRequest.forSource("python", "x = 1")));
        UnsupportedLanguageException noExtension = assertThrows(UnsupportedLanguageException.class,
                () -> engine.builder.build(BuildRequest.forFile(tempDir.resolve("README"))));

        assertTrue(unknown.getMessage().contains("cobol"));
        assertTrue(noParser.getMessage().contains("No parser registered"));
        assertTrue(noExtension.getMessage().contains("README"));
    }

    @Test
    void build_ShouldReportUnreadableFiles() throws IOException {
        // Arrange
        Path big = tempDir.resolve("Big.java");
        Files.writeString(big, "class Big { }");
        engine.properties.setMaxFileSize(4);

        // Act & Assert
        SourceReadException tooLarge = assertThrows(SourceReadException.class,
                () -> engine.builder.build(BuildRequest.forFile(big)));
        assertTrue(tooLarge.getMessage().contains("too large"));
        assertThrows(SourceReadException.class,
                () -> engine.builder.build(BuildRequest.forFile(tempDir.resolve("Missing.java"))));
    }

    @Test
    void supportedLanguages_ShouldOnlyListLanguagesWithAParser() {
        // Act
        Set<String> ids = engine.builder.supportedLanguages().stream()
                .map(LanguageDefinition::id)
                .collect(Collectors.toSet());

        // Assert
        assertEquals(Set.of("java", "json", "yaml"), ids);
        assertTrue(engine.builder.supports(Path.of("Main.java")));
        assertFalse(engine.builder.supports(Path.of("main.py")));
    }
}
