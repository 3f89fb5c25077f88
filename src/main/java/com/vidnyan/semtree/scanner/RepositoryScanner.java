package com.vidnyan.semtree.scanner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Expands files and directories into the list of source files to build.
 * Directories are walked recursively; VCS and build output directories are ignored.
 */
@Slf4j
@Component
public class RepositoryScanner {

    private static final Set<String> IGNORED_DIRECTORIES =
            Set.of(".git", ".hg", ".svn", ".idea", "node_modules", "target", "build", "bin", "obj");

    /**
     * Scan and return every supported source file below the given roots. A root that is a
     * file is returned as is when supported; missing roots are reported and skipped.
     */
    public List<Path> scanSourceFiles(List<Path> roots, Predicate<Path> supported) throws IOException {
        Set<Path> sourceFiles = new LinkedHashSet<>();

        for (Path root : roots) {
            if (Files.isRegularFile(root)) {
                if (supported.test(root)) {
                    sourceFiles.add(root);
                }
                continue;
            }
            if (!Files.isDirectory(root)) {
                log.warn("Skipping missing path: {}", root);
                continue;
            }
            try (Stream<Path> paths = Files.walk(root)) {
                paths.filter(Files::isRegularFile)
                     .filter(p -> !isIgnored(root, p))
                     .filter(supported)
                     .sorted()
                     .forEach(sourceFiles::add);
            }
        }

        return new ArrayList<>(sourceFiles);
    }

    private boolean isIgnored(Path root, Path file) {
        Path relative = root.relativize(file);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (IGNORED_DIRECTORIES.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }
}
