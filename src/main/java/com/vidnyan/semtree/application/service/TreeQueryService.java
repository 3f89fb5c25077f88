package com.vidnyan.semtree.application.service;

import com.vidnyan.semtree.application.port.in.BuildSemanticTreeUseCase;
import com.vidnyan.semtree.application.port.in.BuildSemanticTreeUseCase.BuildRequest;
import com.vidnyan.semtree.application.port.in.QueryTreesUseCase;
import com.vidnyan.semtree.application.port.out.QueryEngine;
import com.vidnyan.semtree.config.SemtreeProperties;
import com.vidnyan.semtree.domain.error.QueryException;
import com.vidnyan.semtree.domain.error.RuleTableException;
import com.vidnyan.semtree.domain.error.SemanticTreeException;
import com.vidnyan.semtree.domain.error.SourceReadException;
import com.vidnyan.semtree.domain.model.QueryMatch;
import com.vidnyan.semtree.domain.model.SemanticDocument;
import com.vidnyan.semtree.scanner.RepositoryScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Main application service that orchestrates the query workflow.
 * Each file is built and queried on its own worker; trees never outlive their file's query.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TreeQueryService implements QueryTreesUseCase {

    private final BuildSemanticTreeUseCase buildUseCase;
    private final QueryEngine queryEngine;
    private final RepositoryScanner scanner;
    private final SemtreeProperties properties;

    @Override
    public QueryResult query(QueryRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting query '{}' over: {}", request.expression(), request.paths());

        // Step 1: Collect source files
        log.info("Step 1: Scanning source files...");
        List<Path> files;
        try {
            files = scanner.scanSourceFiles(request.paths(), buildUseCase::supports);
        } catch (IOException e) {
            throw new SourceReadException("Failed to scan " + request.paths() + ": " + e.getMessage(), e);
        }
        log.info("Found {} source files", files.size());

        // Step 2: Build and query in parallel
        int threads = Math.max(1, Math.min(concurrency(request), files.size()));
        log.info("Step 2: Building and querying with {} workers...", threads);

        List<FileResult> results = new ArrayList<>();
        List<FileError> errors = new ArrayList<>();
        RuntimeException fatal = null;

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileResult>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> process(file, request)));
            }
            for (int i = 0; i < futures.size(); i++) {
                String path = files.get(i).toString();
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuleTableException || cause instanceof QueryException) {
                        if (fatal == null) {
                            fatal = (RuntimeException) cause;
                        }
                        continue;
                    }
                    log.warn("Failed to process {}: {}", path, cause.getMessage());
                    errors.add(new FileError(path, describe(cause)));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SemanticTreeException("Query interrupted", e);
        } finally {
            executor.shutdownNow();
        }

        if (fatal != null) {
            throw fatal;
        }

        // Step 3: Summarize
        Duration duration = Duration.between(startTime, Instant.now());
        QueryStats stats = new QueryStats(
                files.size(),
                results.size(),
                errors.size(),
                results.stream().mapToInt(r -> r.matches().size()).sum(),
                duration.toMillis()
        );

        log.info("Query complete: {} matches in {} files, {} failed, {}ms",
                stats.matches(), stats.filesQueried(), stats.filesFailed(), stats.durationMs());

        return new QueryResult(List.copyOf(results), List.copyOf(errors), stats);
    }

    @Override
    public List<QueryMatch> querySource(BuildRequest request, String expression) {
        SemanticDocument document = buildUseCase.build(request);
        return queryEngine.evaluate(document, expression);
    }

    private FileResult process(Path file, QueryRequest request) {
        BuildRequest buildRequest = request.rawMode() ? BuildRequest.forFile(file).raw() : BuildRequest.forFile(file);
        SemanticDocument document = buildUseCase.build(buildRequest);
        List<QueryMatch> matches = queryEngine.evaluate(document, request.expression());
        return new FileResult(document.path(), matches);
    }

    private int concurrency(QueryRequest request) {
        return request.concurrency() > 0 ? request.concurrency() : properties.getConcurrency();
    }

    private static String describe(Throwable error) {
        if (error instanceof SemanticTreeException) {
            return error.getMessage();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
