package com.vidnyan.semtree.scanner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryScannerTest {

    private static final Predicate<Path> JAVA_OR_JSON =
            p -> p.toString().endsWith(".java") || p.toString().endsWith(".json");

    @TempDir
    Path tempDir;

    @Test
    void scanSourceFiles_ShouldFindSupportedFiles() throws IOException {
        // Arrange
        RepositoryScanner scanner = new RepositoryScanner();

        Path mainJava = tempDir.resolve("src/main/java/com/example");
        Files.createDirectories(mainJava);

        Path file1 = mainJava.resolve("Test1.java");
        Path file2 = mainJava.resolve("Test2.java");
        Path config = tempDir.resolve("config.json");
        Path txtFile = mainJava.resolve("readme.txt");

        Files.writeString(file1, "public class Test1 {}");
        Files.writeString(file2, "public class Test2 {}");
        Files.writeString(config, "{}");
        Files.writeString(txtFile, "documentation");

        // Build output is ignored
        Path target = tempDir.resolve("target/classes");
        Files.createDirectories(target);
        Files.writeString(target.resolve("Generated.java"), "public class Generated {}");

        // Act
        List<Path> results = scanner.scanSourceFiles(List.of(tempDir), JAVA_OR_JSON);

        // Assert
        assertEquals(List.of(config, file1, file2), results);
        assertFalse(results.stream().anyMatch(p -> p.endsWith("readme.txt")));
        assertFalse(results.stream().anyMatch(p -> p.endsWith("Generated.java")));
    }

    @Test
    void scanSourceFiles_ShouldAcceptFilesAndSkipMissingRoots() throws IOException {
        // Arrange
        RepositoryScanner scanner = new RepositoryScanner();
        Path file = tempDir.resolve("Root.java");
        Path notes = tempDir.resolve("notes.txt");
        Files.writeString(file, "public class Root {}");
        Files.writeString(notes, "documentation");

        // Act
        List<Path> results = scanner.scanSourceFiles(
                List.of(file, notes, tempDir.resolve("missing"), tempDir), JAVA_OR_JSON);

        // Assert
        assertEquals(List.of(file), results);
    }

    @Test
    void scanSourceFiles_ShouldIgnoreDirectoriesOnlyBelowTheRoot() throws IOException {
        // Arrange
        RepositoryScanner scanner = new RepositoryScanner();
        Path build = tempDir.resolve("build");
        Files.createDirectories(build);
        Path file = build.resolve("Main.java");
        Files.writeString(file, "class Main {}");

        // Act
        List<Path> results = scanner.scanSourceFiles(List.of(build), JAVA_OR_JSON);

        // Assert
        assertEquals(List.of(file), results);
    }
}
