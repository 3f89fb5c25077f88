package com.vidnyan.semtree.application.port.out;

import com.vidnyan.semtree.domain.rule.LanguageDefinition;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Port for accessing language rule tables.
 */
public interface RuleTableRepository {

    List<LanguageDefinition> findAll();

    /**
     * Find by language id or alias, case-insensitive.
     */
    Optional<LanguageDefinition> findByLanguage(String language);

    /**
     * Find by the file's extension.
     */
    Optional<LanguageDefinition> findByPath(Path path);
}
