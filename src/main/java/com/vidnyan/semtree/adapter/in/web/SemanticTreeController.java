package com.vidnyan.semtree.adapter.in.web;

import com.vidnyan.semtree.application.port.in.BuildSemanticTreeUseCase;
import com.vidnyan.semtree.application.port.in.BuildSemanticTreeUseCase.BuildRequest;
import com.vidnyan.semtree.application.port.in.QueryTreesUseCase;
import com.vidnyan.semtree.domain.error.QueryException;
import com.vidnyan.semtree.domain.error.UnsupportedLanguageException;
import com.vidnyan.semtree.domain.model.QueryMatch;
import com.vidnyan.semtree.domain.rule.LanguageDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for querying inline sources.
 */
@Slf4j
@RestController
@RequestMapping("/api/trees")
@RequiredArgsConstructor
public class SemanticTreeController {

    private final QueryTreesUseCase queryTreesUseCase;
    private final BuildSemanticTreeUseCase buildUseCase;

    @PostMapping("/query")
    public QueryResponse query(@RequestBody QueryRequest request) {
        log.info("Received query request");
        log.info("  Language: {}", request.language());
        log.info("  Query: {}", request.expression());

        BuildRequest buildRequest = BuildRequest.forSource(request.language(), request.source());
        List<QueryMatch> matches = queryTreesUseCase.querySource(
                request.raw() ? buildRequest.raw() : buildRequest, request.expression());

        return new QueryResponse(request.language(), matches.size(), matches);
    }

    @GetMapping("/languages")
    public List<LanguageResponse> languages() {
        return buildUseCase.supportedLanguages().stream()
                .map(LanguageResponse::of)
                .toList();
    }

    @ExceptionHandler({UnsupportedLanguageException.class, QueryException.class})
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(e.getMessage()));
    }

    public record QueryRequest(
        String language,
        String source,
        String expression,
        boolean raw
    ) {}

    public record QueryResponse(
        String language,
        int matchCount,
        List<QueryMatch> matches
    ) {}

    public record LanguageResponse(
        String id,
        List<String> aliases,
        List<String> extensions,
        String format
    ) {
        static LanguageResponse of(LanguageDefinition language) {
            return new LanguageResponse(language.id(), language.aliases(), language.extensions(),
                    language.format() != null ? language.format().tag() : null);
        }
    }

    public record ErrorResponse(String message) {}
}
