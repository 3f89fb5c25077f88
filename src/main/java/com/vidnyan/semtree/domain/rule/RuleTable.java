package com.vidnyan.semtree.domain.rule;

import lombok.Builder;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Declarative rewrite rules for one language (or one branch of a configuration format).
 * Loaded once, shared read-only across worker threads.
 *
 * @param name                 table id used in logs and errors, e.g. {@code java} or {@code json.data}
 * @param mode                 syntax tree or data projection
 * @param renames              raw kind to element name
 * @param skipKinds            kinds dropped with their whole subtree
 * @param flattenKinds         kinds whose children are spliced into the parent
 * @param soleFlattenKinds     kinds flattened only when no sibling has the same kind
 * @param operatorKinds        parent kinds whose first non-punctuation token becomes {@code op}
 * @param operatorTokens       token kinds that always become {@code op} on their parent
 * @param modifierWrapperKinds kinds whose tokens are modifier keywords
 * @param keywordModifierKinds parent kinds whose direct keyword tokens may be modifiers
 * @param knownModifiers       modifier keyword texts
 * @param wrappedFields        field names promoted to wrapper elements
 * @param extractNameKinds     qualified-name kinds collapsed to their text
 * @param identifierKinds      bare identifier kinds dispatched through the classifier
 * @param collapseKinds        kinds emitted with verbatim text instead of their structure
 * @param typeKinds            simple type kinds
 * @param nullableTypeKinds    nullable type wrappers
 * @param arrayTypeKinds       array type wrappers
 * @param genericTypeKinds     generic type constructs
 * @param typeArgumentKinds    containers of generic arguments
 * @param typeArgumentFields   fields holding generic arguments directly
 * @param pairKinds            mapping entries (data mode)
 * @param sequenceKinds        sequences (data mode)
 * @param sequenceItemKinds    per-item wrappers inside sequences (data mode)
 * @param scalarKinds          scalar kinds and their quoting style
 * @param keyField             field name of a pair's key
 * @param valueField           field name of a pair's value
 * @param classifier           identifier role callback
 * @param context              identifier context callback
 */
@Builder(toBuilder = true)
public record RuleTable(
    String name,
    TreeMode mode,
    Map<String, String> renames,
    Set<String> skipKinds,
    Set<String> flattenKinds,
    Set<String> soleFlattenKinds,
    Set<String> operatorKinds,
    Set<String> operatorTokens,
    Set<String> modifierWrapperKinds,
    Set<String> keywordModifierKinds,
    Set<String> knownModifiers,
    Set<String> wrappedFields,
    Set<String> extractNameKinds,
    Set<String> identifierKinds,
    Set<String> collapseKinds,
    Set<String> typeKinds,
    Set<String> nullableTypeKinds,
    Set<String> arrayTypeKinds,
    Set<String> genericTypeKinds,
    Set<String> typeArgumentKinds,
    Set<String> typeArgumentFields,
    Set<String> pairKinds,
    Set<String> sequenceKinds,
    Set<String> sequenceItemKinds,
    Map<String, ScalarStyle> scalarKinds,
    String keyField,
    String valueField,
    IdentifierClassifier classifier,
    IdentifierContext context
) {

    public static final Set<String> DEFAULT_WRAPPED_FIELDS = Set.of("name", "value", "key");

    public RuleTable {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule table needs a name");
        }
        mode = mode == null ? TreeMode.SYNTAX : mode;
        renames = renames == null ? Map.of() : Map.copyOf(renames);
        skipKinds = copy(skipKinds);
        flattenKinds = copy(flattenKinds);
        soleFlattenKinds = copy(soleFlattenKinds);
        operatorKinds = copy(operatorKinds);
        operatorTokens = copy(operatorTokens);
        modifierWrapperKinds = copy(modifierWrapperKinds);
        keywordModifierKinds = copy(keywordModifierKinds);
        knownModifiers = copy(knownModifiers);
        wrappedFields = wrappedFields == null ? DEFAULT_WRAPPED_FIELDS : Set.copyOf(wrappedFields);
        extractNameKinds = copy(extractNameKinds);
        identifierKinds = copy(identifierKinds);
        collapseKinds = copy(collapseKinds);
        typeKinds = copy(typeKinds);
        nullableTypeKinds = copy(nullableTypeKinds);
        arrayTypeKinds = copy(arrayTypeKinds);
        genericTypeKinds = copy(genericTypeKinds);
        typeArgumentKinds = copy(typeArgumentKinds);
        typeArgumentFields = copy(typeArgumentFields);
        pairKinds = copy(pairKinds);
        sequenceKinds = copy(sequenceKinds);
        sequenceItemKinds = copy(sequenceItemKinds);
        scalarKinds = scalarKinds == null ? Map.of() : Map.copyOf(scalarKinds);
        keyField = keyField == null ? "key" : keyField;
        valueField = valueField == null ? "value" : valueField;
        classifier = classifier == null ? (node, ancestors, special) -> IdentifierRole.NAME : classifier;
        context = context == null ? IdentifierContext.NONE : context;
    }

    /**
     * Element name for a raw kind: the mapped name, else the kind lower-cased.
     */
    public String elementName(String kind) {
        String renamed = renames.get(kind);
        return renamed != null ? renamed : kind.toLowerCase(Locale.ROOT);
    }

    public boolean isTypeConstruct(String kind) {
        return typeKinds.contains(kind)
                || nullableTypeKinds.contains(kind)
                || arrayTypeKinds.contains(kind)
                || genericTypeKinds.contains(kind);
    }

    public boolean isDataMode() {
        return mode == TreeMode.DATA;
    }

    /**
     * Kinds that a token could both be lifted from as an operator and renamed.
     */
    public Set<String> operatorRenameConflicts() {
        Set<String> conflicts = new HashSet<>(operatorTokens);
        conflicts.retainAll(renames.keySet());
        return conflicts;
    }

    /**
     * Every element name this table can produce, for pre-populating the name table.
     */
    public Set<String> producedNames() {
        Set<String> produced = new HashSet<>(renames.values());
        produced.addAll(knownModifiers);
        produced.addAll(wrappedFields);
        produced.addAll(Set.of("name", "type", "op", "error", "field", "key",
                "generic", "nullable", "array", "arguments", "item"));
        return produced;
    }

    private static Set<String> copy(Set<String> values) {
        return values == null ? Set.of() : Set.copyOf(values);
    }
}
