package com.vidnyan.semtree.domain.rule;

import com.vidnyan.semtree.domain.model.ConfigFormat;

import java.util.List;
import java.util.Locale;

/**
 * A supported language: its id, aliases, file extensions and rule tables. Code languages carry
 * one {@code rules} table; configuration formats carry an {@code ast} and a {@code data} table.
 */
public record LanguageDefinition(
    String id,
    List<String> aliases,
    List<String> extensions,
    ConfigFormat format,
    RuleTable rules,
    RuleTable astRules,
    RuleTable dataRules
) {

    public LanguageDefinition {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        extensions = extensions == null ? List.of() : extensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
        if (format == null && rules == null) {
            throw new IllegalArgumentException("Language " + id + " has no rule table");
        }
        if (format != null && (astRules == null || dataRules == null)) {
            throw new IllegalArgumentException("Configuration format " + id + " needs ast and data tables");
        }
    }

    public static LanguageDefinition code(String id, List<String> extensions, RuleTable rules) {
        return new LanguageDefinition(id, List.of(), extensions, null, rules, null, null);
    }

    public static LanguageDefinition config(String id, List<String> extensions, ConfigFormat format,
                                            RuleTable astRules, RuleTable dataRules) {
        return new LanguageDefinition(id, List.of(), extensions, format, null, astRules, dataRules);
    }

    public boolean isDualBranch() {
        return format != null;
    }

    public boolean answersTo(String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        return id.equals(wanted) || aliases.contains(wanted);
    }

    public List<RuleTable> tables() {
        return isDualBranch() ? List.of(astRules, dataRules) : List.of(rules);
    }
}
