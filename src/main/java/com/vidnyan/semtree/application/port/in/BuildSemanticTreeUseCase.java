package com.vidnyan.semtree.application.port.in;

import com.vidnyan.semtree.domain.model.SemanticDocument;
import com.vidnyan.semtree.domain.rule.LanguageDefinition;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds the semantic tree of a single source.
 */
public interface BuildSemanticTreeUseCase {

    /**
     * @throws com.vidnyan.semtree.domain.error.SemanticTreeException when the file cannot be built
     */
    SemanticDocument build(BuildRequest request);

    /**
     * True when the file's extension maps to a language that has both a rule table and a parser.
     */
    boolean supports(Path path);

    /**
     * Languages that have both a rule table and a parser.
     */
    List<LanguageDefinition> supportedLanguages();

    /**
     * Build request parameters. A missing language is detected from the path; a missing
     * source is read from the path.
     */
    record BuildRequest(
        Path path,
        String language,
        String source,
        boolean rawMode
    ) {
        public static BuildRequest forFile(Path path) {
            return new BuildRequest(path, null, null, false);
        }

        public static BuildRequest forSource(String language, String source) {
            return new BuildRequest(Path.of("<input>"), language, source, false);
        }

        public BuildRequest raw() {
            return new BuildRequest(path, language, source, true);
        }
    }
}
