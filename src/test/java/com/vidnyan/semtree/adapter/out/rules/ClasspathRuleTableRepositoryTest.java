package com.vidnyan.semtree.adapter.out.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.semtree.adapter.out.rules.classifier.DefaultLanguageCallbacks;
import com.vidnyan.semtree.domain.error.RuleTableException;
import com.vidnyan.semtree.domain.model.ConfigFormat;
import com.vidnyan.semtree.domain.model.NameTable;
import com.vidnyan.semtree.domain.rule.LanguageDefinition;
import com.vidnyan.semtree.domain.rule.RuleTable;
import com.vidnyan.semtree.domain.rule.TreeMode;
import com.vidnyan.semtree.support.TestEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClasspathRuleTableRepositoryTest {

    @TempDir
    Path tempDir;

    private ClasspathRuleTableRepository repositoryAt(Path directory, NameTable names) {
        ClasspathRuleTableRepository repository = new ClasspathRuleTableRepository(
                new ObjectMapper(), List.of(new DefaultLanguageCallbacks()), names);
        ReflectionTestUtils.setField(repository, "rulesPath", directory.toUri() + "*.json");
        return repository;
    }

    @Test
    void loadTables_ShouldLoadEveryBundledLanguage() {
        // Arrange
        TestEngine engine = new TestEngine();

        // Act
        List<String> ids = engine.rules.findAll().stream().map(LanguageDefinition::id).toList();

        // Assert
        assertEquals(Set.of("csharp", "go", "java", "json", "python", "ruby", "rust", "typescript", "yaml"),
                Set.copyOf(ids));
        assertTrue(engine.names.contains("method"));
        assertTrue(engine.names.contains("property"));
    }

    @Test
    void findByLanguage_ShouldMatchIdsAndAliasesIgnoringCase() {
        TestEngine engine = new TestEngine();

        assertEquals("csharp", engine.rules.findByLanguage("C#").orElseThrow().id());
        assertEquals("yaml", engine.rules.findByLanguage("yml").orElseThrow().id());
        assertEquals("typescript", engine.rules.findByLanguage("JavaScript").orElseThrow().id());
        assertTrue(engine.rules.findByLanguage("cobol").isEmpty());
        assertTrue(engine.rules.findByLanguage(null).isEmpty());
    }

    @Test
    void findByPath_ShouldMatchExtensionsIgnoringCase() {
        TestEngine engine = new TestEngine();

        assertEquals("typescript", engine.rules.findByPath(Path.of("web", "App.TSX")).orElseThrow().id());
        assertEquals("java", engine.rules.findByPath(Path.of("Main.java")).orElseThrow().id());
        assertTrue(engine.rules.findByPath(Path.of("Makefile")).isEmpty());
        assertTrue(engine.rules.findByPath(Path.of("archive.")).isEmpty());
    }

    @Test
    void loadTables_ShouldBuildBothBranchesForConfigurationFormats() {
        // Arrange
        TestEngine engine = new TestEngine();

        // Act
        LanguageDefinition json = engine.rules.findByLanguage("json").orElseThrow();

        // Assert
        assertTrue(json.isDualBranch());
        assertEquals(ConfigFormat.JSON, json.format());
        assertEquals(TreeMode.SYNTAX, json.astRules().mode());
        assertEquals(TreeMode.DATA, json.dataRules().mode());
        assertEquals("json.data", json.dataRules().name());
        assertTrue(json.dataRules().wrappedFields().isEmpty());
    }

    @Test
    void loadTables_ShouldSkipUnreadableFiles() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("broken.json"), "{ not json");
        Files.writeString(tempDir.resolve("ini.json"), """
                {
                  "id": "INI",
                  "extensions": ["ini"],
                  "rules": { "renames": { "section": "group" } }
                }
                """);
        ClasspathRuleTableRepository repository = repositoryAt(tempDir, new NameTable());

        // Act
        repository.loadTables();

        // Assert
        assertEquals(1, repository.findAll().size());
        LanguageDefinition ini = repository.findByPath(Path.of("setup.ini")).orElseThrow();
        assertEquals("ini", ini.id());
        assertEquals("group", ini.rules().elementName("section"));
        assertEquals(RuleTable.DEFAULT_WRAPPED_FIELDS, ini.rules().wrappedFields());
    }

    @Test
    void loadTables_ShouldRejectUnknownCallbacks() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("odd.json"), """
                { "id": "odd", "extensions": ["odd"], "callbacks": "missing", "rules": {} }
                """);
        ClasspathRuleTableRepository repository = repositoryAt(tempDir, new NameTable());

        // Act & Assert
        RuleTableException thrown = assertThrows(RuleTableException.class, repository::loadTables);
        assertTrue(thrown.getMessage().contains("missing"));
    }

    @Test
    void loadTables_ShouldRejectUnknownModes() throws IOException {
        Files.writeString(tempDir.resolve("odd.json"), """
                { "id": "odd", "rules": { "mode": "tabular" } }
                """);
        ClasspathRuleTableRepository repository = repositoryAt(tempDir, new NameTable());

        assertThrows(RuleTableException.class, repository::loadTables);
    }

    @Test
    void register_ShouldKeepTablesThatBothRenameAndLiftAnOperator() {
        // Arrange
        NameTable names = new NameTable();
        ClasspathRuleTableRepository repository = repositoryAt(tempDir, names);
        RuleTable rules = RuleTable.builder()
                .name("calc")
                .operatorTokens(Set.of("plus"))
                .renames(Map.of("plus", "add", "number", "num"))
                .build();

        // Act
        repository.register(LanguageDefinition.code("calc", List.of("calc"), rules));

        // Assert
        assertEquals(Set.of("plus"), rules.operatorRenameConflicts());
        assertTrue(repository.findByLanguage("calc").isPresent());
        assertTrue(names.contains("num"));
    }
}
