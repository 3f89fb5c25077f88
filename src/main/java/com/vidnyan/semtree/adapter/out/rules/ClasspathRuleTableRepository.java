package com.vidnyan.semtree.adapter.out.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.semtree.adapter.out.rules.classifier.DefaultLanguageCallbacks;
import com.vidnyan.semtree.adapter.out.rules.classifier.LanguageCallbacks;
import com.vidnyan.semtree.application.port.out.RuleTableRepository;
import com.vidnyan.semtree.domain.error.RuleTableException;
import com.vidnyan.semtree.domain.model.ConfigFormat;
import com.vidnyan.semtree.domain.model.NameTable;
import com.vidnyan.semtree.domain.rule.LanguageDefinition;
import com.vidnyan.semtree.domain.rule.RuleTable;
import com.vidnyan.semtree.domain.rule.ScalarStyle;
import com.vidnyan.semtree.domain.rule.TreeMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rule tables stored as JSON on the classpath, one file per language.
 * Tables are loaded once at startup and never change afterwards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClasspathRuleTableRepository implements RuleTableRepository {

    private final ObjectMapper objectMapper;
    private final List<LanguageCallbacks> callbacks;
    private final NameTable nameTable;

    @Value("${semtree.rules.path:classpath*:rules/languages/*.json}")
    private String rulesPath = "classpath*:rules/languages/*.json";

    private final Map<String, LanguageDefinition> languages = new LinkedHashMap<>();
    private final Map<String, LanguageDefinition> byExtension = new HashMap<>();

    @PostConstruct
    public void loadTables() {
        Map<String, LanguageCallbacks> callbacksByName = callbacks.stream()
                .collect(Collectors.toMap(LanguageCallbacks::getName, Function.identity()));
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(rulesPath);

            for (Resource resource : resources) {
                LanguageDto dto;
                try (InputStream in = resource.getInputStream()) {
                    dto = objectMapper.readValue(in, LanguageDto.class);
                } catch (IOException e) {
                    log.warn("Failed to read rule table {}: {}", resource.getFilename(), e.getMessage());
                    continue;
                }
                register(mapToLanguage(dto, callbacksByName));
            }

            log.info("Loaded {} languages from {}", languages.size(), rulesPath);
        } catch (IOException e) {
            throw new RuleTableException("Failed to list rule tables at " + rulesPath, e);
        }
    }

    /**
     * Adds a language built in code, replacing any table with the same id.
     */
    public void register(LanguageDefinition language) {
        for (RuleTable table : language.tables()) {
            Set<String> conflicts = table.operatorRenameConflicts();
            if (!conflicts.isEmpty()) {
                log.warn("Rule table {} lists {} both as operator tokens and renames; operator extraction wins",
                        table.name(), conflicts);
            }
            nameTable.registerAll(table.producedNames());
        }
        languages.put(language.id(), language);
        language.extensions().forEach(ext -> byExtension.put(ext, language));
        log.info("Loaded language: {} ({})", language.id(), String.join(", ", language.extensions()));
    }

    @Override
    public List<LanguageDefinition> findAll() {
        return List.copyOf(languages.values());
    }

    @Override
    public Optional<LanguageDefinition> findByLanguage(String language) {
        if (language == null) {
            return Optional.empty();
        }
        return languages.values().stream()
                .filter(definition -> definition.answersTo(language))
                .findFirst();
    }

    @Override
    public Optional<LanguageDefinition> findByPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(byExtension.get(name.substring(dot + 1).toLowerCase(Locale.ROOT)));
    }

    private LanguageDefinition mapToLanguage(LanguageDto dto, Map<String, LanguageCallbacks> callbacksByName) {
        if (dto.id == null || dto.id.isBlank()) {
            throw new RuleTableException("Rule table without language id");
        }
        String callbackName = dto.callbacks != null ? dto.callbacks : DefaultLanguageCallbacks.NAME;
        LanguageCallbacks languageCallbacks = callbacksByName.get(callbackName);
        if (languageCallbacks == null) {
            throw new RuleTableException("Language " + dto.id + " references unknown callbacks '"
                    + callbackName + "'; registered: " + callbacksByName.keySet());
        }
        String id = dto.id.toLowerCase(Locale.ROOT);
        if (dto.format != null) {
            return new LanguageDefinition(id, dto.aliases, dto.extensions, ConfigFormat.fromTag(dto.format), null,
                    mapTable(id + ".ast", dto.ast, languageCallbacks),
                    mapTable(id + ".data", dto.data, languageCallbacks));
        }
        return new LanguageDefinition(id, dto.aliases, dto.extensions, null,
                mapTable(id, dto.rules, languageCallbacks), null, null);
    }

    private RuleTable mapTable(String name, TableDto dto, LanguageCallbacks languageCallbacks) {
        if (dto == null) {
            throw new RuleTableException("Rule table " + name + " is missing");
        }
        return RuleTable.builder()
                .name(name)
                .mode(mapMode(dto.mode))
                .renames(dto.renames)
                .skipKinds(set(dto.skip))
                .flattenKinds(set(dto.flatten))
                .soleFlattenKinds(set(dto.flattenSingle))
                .operatorKinds(set(dto.operators))
                .operatorTokens(set(dto.operatorTokens))
                .modifierWrapperKinds(set(dto.modifierWrappers))
                .keywordModifierKinds(set(dto.keywordModifierParents))
                .knownModifiers(set(dto.knownModifiers))
                .wrappedFields(dto.wrappedFields != null ? Set.copyOf(dto.wrappedFields) : null)
                .extractNameKinds(set(dto.extractName))
                .identifierKinds(set(dto.identifiers))
                .collapseKinds(set(dto.collapse))
                .typeKinds(dto.types != null ? set(dto.types.simple) : null)
                .nullableTypeKinds(dto.types != null ? set(dto.types.nullable) : null)
                .arrayTypeKinds(dto.types != null ? set(dto.types.array) : null)
                .genericTypeKinds(dto.types != null ? set(dto.types.generic) : null)
                .typeArgumentKinds(dto.types != null ? set(dto.types.argumentLists) : null)
                .typeArgumentFields(dto.types != null ? set(dto.types.argumentFields) : null)
                .pairKinds(set(dto.pairs))
                .sequenceKinds(set(dto.sequences))
                .sequenceItemKinds(set(dto.sequenceItems))
                .scalarKinds(mapScalars(dto.scalars))
                .keyField(dto.keyField)
                .valueField(dto.valueField)
                .classifier(languageCallbacks)
                .context(languageCallbacks)
                .build();
    }

    private TreeMode mapMode(String mode) {
        if (mode == null) return TreeMode.SYNTAX;
        return switch (mode.toUpperCase(Locale.ROOT)) {
            case "DATA" -> TreeMode.DATA;
            case "SYNTAX" -> TreeMode.SYNTAX;
            default -> throw new RuleTableException("Unknown table mode: " + mode);
        };
    }

    private Map<String, ScalarStyle> mapScalars(Map<String, String> scalars) {
        if (scalars == null) return Map.of();
        Map<String, ScalarStyle> styles = new HashMap<>();
        scalars.forEach((kind, style) -> styles.put(kind,
                ScalarStyle.valueOf(style.toUpperCase(Locale.ROOT).replace('-', '_'))));
        return styles;
    }

    private static Set<String> set(List<String> values) {
        return values == null ? Set.of() : Set.copyOf(values);
    }

    // DTO classes for JSON deserialization
    static class LanguageDto {
        public String id;
        public List<String> aliases;
        public List<String> extensions;
        public String format;
        public String callbacks;
        public TableDto rules;
        public TableDto ast;
        public TableDto data;
    }

    static class TableDto {
        public String mode;
        public Map<String, String> renames;
        public List<String> skip;
        public List<String> flatten;
        public List<String> flattenSingle;
        public List<String> operators;
        public List<String> operatorTokens;
        public List<String> modifierWrappers;
        public List<String> keywordModifierParents;
        public List<String> knownModifiers;
        public List<String> wrappedFields;
        public List<String> extractName;
        public List<String> identifiers;
        public List<String> collapse;
        public TypesDto types;
        public List<String> pairs;
        public List<String> sequences;
        public List<String> sequenceItems;
        public Map<String, String> scalars;
        public String keyField;
        public String valueField;
    }

    static class TypesDto {
        public List<String> simple;
        public List<String> nullable;
        public List<String> array;
        public List<String> generic;
        public List<String> argumentLists;
        public List<String> argumentFields;
    }
}
