package com.vidnyan.semtree.adapter.in.cli;

import com.vidnyan.semtree.application.port.in.QueryTreesUseCase;
import com.vidnyan.semtree.application.port.in.QueryTreesUseCase.FileError;
import com.vidnyan.semtree.application.port.in.QueryTreesUseCase.FileResult;
import com.vidnyan.semtree.application.port.in.QueryTreesUseCase.QueryRequest;
import com.vidnyan.semtree.application.port.in.QueryTreesUseCase.QueryResult;
import com.vidnyan.semtree.domain.model.QueryMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * CLI Runner for standalone queries.
 * Runs when both semtree.query.path and semtree.query.expression are set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryCliRunner implements CommandLineRunner {

    private static final int MAX_MATCHES = 500;

    private final QueryTreesUseCase queryTreesUseCase;
    private final ConfigurableApplicationContext context;

    @Value("${semtree.query.path:}")
    private String sourcePath;

    @Value("${semtree.query.expression:}")
    private String expression;

    @Value("${semtree.query.show-lines:true}")
    private boolean showLines;

    @Override
    public void run(String... args) {
        if (sourcePath == null || sourcePath.isBlank() || expression == null || expression.isBlank()) {
            log.info("No query specified. Set semtree.query.path and semtree.query.expression properties.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║                 SEMTREE - Semantic Tree Query                ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Paths: {}", truncate(sourcePath, 54));
            log.info("║ Query: {}", truncate(expression, 54));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            List<Path> paths = Arrays.stream(sourcePath.split(","))
                    .map(String::strip)
                    .filter(p -> !p.isEmpty())
                    .map(Path::of)
                    .toList();
            QueryResult result = queryTreesUseCase.query(new QueryRequest(paths, expression, 0, false));

            printResults(result);
            exitCode = result.hasErrors() ? 1 : 0;
        } catch (RuntimeException e) {
            log.error("Query failed: {}", e.getMessage());
            exitCode = 2;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(QueryResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" QUERY RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files scanned:  {}", result.stats().filesScanned());
        log.info(" Files queried:  {}", result.stats().filesQueried());
        log.info(" Files failed:   {}", result.stats().filesFailed());
        log.info(" Matches:        {}", result.stats().matches());
        log.info(" Duration:       {}ms", result.stats().durationMs());
        log.info("───────────────────────────────────────────────────────────────");

        int count = 0;
        for (FileResult file : result.files()) {
            for (QueryMatch match : file.matches()) {
                count++;
                if (count > MAX_MATCHES) {
                    log.info(" ... and {} more matches", result.matchCount() - MAX_MATCHES);
                    break;
                }
                log.info(" {}", match.format());
                if (showLines) {
                    match.sourceLines().forEach(line -> log.info("   | {}", line));
                }
            }
            if (count > MAX_MATCHES) {
                break;
            }
        }

        if (result.hasErrors()) {
            log.info("");
            log.info(" ERRORS:");
            log.info("───────────────────────────────────────────────────────────────");
            for (FileError error : result.errors()) {
                log.warn(" {}: {}", error.path(), error.message());
            }
        }
    }

    private String truncate(String value, int maxLen) {
        if (value.length() <= maxLen)
            return value;
        return "..." + value.substring(value.length() - maxLen + 3);
    }
}
