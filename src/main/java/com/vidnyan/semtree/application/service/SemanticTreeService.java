package com.vidnyan.semtree.application.service;

import com.vidnyan.semtree.application.port.in.BuildSemanticTreeUseCase;
import com.vidnyan.semtree.application.port.out.CstParser;
import com.vidnyan.semtree.application.port.out.RuleTableRepository;
import com.vidnyan.semtree.config.SemtreeProperties;
import com.vidnyan.semtree.domain.build.DocumentAssembler;
import com.vidnyan.semtree.domain.error.CstParseException;
import com.vidnyan.semtree.domain.error.SourceReadException;
import com.vidnyan.semtree.domain.error.UnsupportedLanguageException;
import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.model.SemanticDocument;
import com.vidnyan.semtree.domain.model.SourceText;
import com.vidnyan.semtree.domain.rule.LanguageDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Builds the semantic tree of one file: language detection, source reading, the external parse
 * and the rule-driven rewrite.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticTreeService implements BuildSemanticTreeUseCase {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final RuleTableRepository ruleTableRepository;
    private final List<CstParser> parsers;
    private final DocumentAssembler documentAssembler;
    private final SemtreeProperties properties;

    @Override
    public SemanticDocument build(BuildRequest request) {
        LanguageDefinition language = resolveLanguage(request);
        CstParser parser = findParser(language)
                .orElseThrow(() -> new UnsupportedLanguageException(
                        "No parser registered for language " + language.id()));

        SourceText source = SourceText.of(request.source() != null ? request.source() : read(request.path()));
        RawNode root = parser.parse(source, language.id());
        if (root == null) {
            throw new CstParseException(parser.getName() + " produced no tree for " + request.path());
        }
        log.debug("Parsed {} as {} with {}", request.path(), language.id(), parser.getName());

        boolean rawMode = request.rawMode() || properties.isRawMode();
        return documentAssembler.assemble(request.path().toString(), language, root, source, rawMode);
    }

    @Override
    public boolean supports(Path path) {
        return ruleTableRepository.findByPath(path)
                .flatMap(this::findParser)
                .isPresent();
    }

    @Override
    public List<LanguageDefinition> supportedLanguages() {
        return ruleTableRepository.findAll().stream()
                .filter(language -> findParser(language).isPresent())
                .toList();
    }

    private LanguageDefinition resolveLanguage(BuildRequest request) {
        if (request.language() != null && !request.language().isBlank()) {
            return ruleTableRepository.findByLanguage(request.language())
                    .orElseThrow(() -> new UnsupportedLanguageException("Unknown language: " + request.language()));
        }
        return ruleTableRepository.findByPath(request.path())
                .orElseThrow(() -> new UnsupportedLanguageException("No language for file: " + request.path()));
    }

    private Optional<CstParser> findParser(LanguageDefinition language) {
        return parsers.stream()
                .filter(p -> p.supports(language.id()))
                .findFirst();
    }

    private String read(Path path) {
        try {
            long size = Files.size(path);
            if (size > properties.getMaxFileSize()) {
                throw new SourceReadException("File too large (" + size + " bytes): " + path, null);
            }
            String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
        } catch (IOException e) {
            throw new SourceReadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }
}
