package com.vidnyan.semtree.application.port.in;

import com.vidnyan.semtree.application.port.in.BuildSemanticTreeUseCase.BuildRequest;
import com.vidnyan.semtree.domain.model.QueryMatch;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: build semantic trees for a set of files and run a path query over each.
 */
public interface QueryTreesUseCase {

    QueryResult query(QueryRequest request);

    /**
     * Build one source and query it on the calling thread. Failures propagate.
     */
    List<QueryMatch> querySource(BuildRequest request, String expression);

    /**
     * Query request parameters.
     */
    record QueryRequest(
        List<Path> paths,       // files or directories
        String expression,
        int concurrency,        // 0 = configured default
        boolean rawMode
    ) {
        public static QueryRequest forPath(Path path, String expression) {
            return new QueryRequest(List.of(path), expression, 0, false);
        }
    }

    /**
     * Matches of one file, in document order.
     */
    record FileResult(String path, List<QueryMatch> matches) {}

    /**
     * A file that could not be built or queried.
     */
    record FileError(String path, String message) {}

    /**
     * Query result. File order is unspecified.
     */
    record QueryResult(
        List<FileResult> files,
        List<FileError> errors,
        QueryStats stats
    ) {
        public List<QueryMatch> allMatches() {
            return files.stream().flatMap(file -> file.matches().stream()).toList();
        }

        public int matchCount() {
            return files.stream().mapToInt(file -> file.matches().size()).sum();
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    /**
     * Query statistics.
     */
    record QueryStats(
        int filesScanned,
        int filesQueried,
        int filesFailed,
        int matches,
        long durationMs
    ) {}
}
