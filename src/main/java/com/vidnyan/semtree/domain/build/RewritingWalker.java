package com.vidnyan.semtree.domain.build;

import com.vidnyan.semtree.domain.error.RuleTableException;
import com.vidnyan.semtree.domain.model.NameTable;
import com.vidnyan.semtree.domain.model.NodeArena;
import com.vidnyan.semtree.domain.model.NodeType;
import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.model.SemanticNode;
import com.vidnyan.semtree.domain.model.SourceText;
import com.vidnyan.semtree.domain.model.Span;
import com.vidnyan.semtree.domain.rule.AncestorChain;
import com.vidnyan.semtree.domain.rule.IdentifierRole;
import com.vidnyan.semtree.domain.rule.RuleTable;
import com.vidnyan.semtree.domain.rule.ScalarStyle;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Single-pass rewrite of a raw CST into a semantic tree, driven by a {@link RuleTable}.
 *
 * <p>Each raw node is handled by the first matching rule: error, skip, flatten, operator token,
 * modifier, wrapped field, extract-name, identifier, type, scalar, data projection (pairs and
 * sequences), collapse, and finally the default element. The walker holds no state between
 * calls and can be shared by worker threads; each call writes only to its own arena.
 */
@RequiredArgsConstructor
public class RewritingWalker {

    public static final String OP = "op";
    public static final String FIELD = "field";
    public static final String KEY = "key";
    public static final String ERROR = "error";
    public static final String ITEM = "item";
    public static final String TYPE = "type";
    public static final String ARGUMENTS = "arguments";

    private static final Set<String> PUNCTUATION = Set.of("(", ")", ",", ";", "{", "}", "[", "]", ":");
    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern BLANKS = Pattern.compile("\\s+");

    private final NameTable names;

    /**
     * Builds a tree in a fresh arena. The root always becomes an element.
     */
    public SemanticNode build(RawNode root, SourceText source, RuleTable table) {
        NodeArena arena = new NodeArena(names);
        int id = new Pass(arena, source, table).root(root);
        return arena.node(id);
    }

    /**
     * Builds a tree whose root element is appended to {@code parent}.
     */
    public int buildInto(RawNode root, SourceText source, RuleTable table, NodeArena arena, int parent) {
        int id = new Pass(arena, source, table).root(root);
        arena.appendChild(parent, id);
        return id;
    }

    /**
     * Emits {@code root} into {@code parent} under the normal rules, so a flattened root
     * contributes only its children.
     */
    public void emitInto(RawNode root, SourceText source, RuleTable table, NodeArena arena, int parent) {
        new Pass(arena, source, table).emit(root, parent, AncestorChain.empty());
    }

    /**
     * State of one build call.
     */
    private static final class Pass {

        private final NodeArena arena;
        private final SourceText source;
        private final RuleTable table;
        private int skipped;

        Pass(NodeArena arena, SourceText source, RuleTable table) {
            this.arena = arena;
            this.source = source;
            this.table = table;
        }

        int root(RawNode node) {
            if (node.isError()) {
                return error(node);
            }
            return element(node, AncestorChain.empty());
        }

        /**
         * Emits one raw node into {@code parent}; {@code chain} holds the node's raw ancestors.
         */
        void emit(RawNode node, int parent, AncestorChain chain) {
            String kind = node.kind();
            if (node.isError()) {
                arena.appendChild(parent, error(node));
                return;
            }
            if (table.skipKinds().contains(kind)) {
                skipped++;
                return;
            }
            if (table.flattenKinds().contains(kind) || soleOfKind(node, chain)) {
                if (node.children().isEmpty()) {
                    arena.appendText(parent, verbatim(node));
                } else {
                    children(node, parent, chain.push(node));
                }
                return;
            }
            if (!node.isNamed()) {
                token(node, parent, chain);
                return;
            }
            if (table.operatorTokens().contains(kind)) {
                String text = verbatim(node).strip();
                addOperator(parent, text);
                arena.appendText(parent, text);
                return;
            }
            if (table.modifierWrapperKinds().contains(kind) && liftModifiers(node, parent, chain)) {
                return;
            }
            String field = node.fieldName();
            if (field != null && table.wrappedFields().contains(field)) {
                wrap(node, field, parent, chain);
                return;
            }
            content(node, parent, chain);
        }

        private void children(RawNode node, int target, AncestorChain childChain) {
            int cursor = node.startByte();
            for (RawNode child : node.children()) {
                if (child.startByte() > cursor && !table.isDataMode()
                        && source.hasWhitespace(cursor, child.startByte())) {
                    space(target);
                }
                emit(child, target, childChain);
                cursor = Math.max(cursor, child.endByte());
            }
        }

        private void space(int target) {
            int last = arena.lastChild(target);
            if (last < 0) {
                return;
            }
            if (arena.type(last) == NodeType.TEXT) {
                String text = arena.text(last);
                if (text.isEmpty() || Character.isWhitespace(text.charAt(text.length() - 1))) {
                    return;
                }
            }
            arena.appendText(target, " ");
        }

        private void token(RawNode node, int target, AncestorChain chain) {
            String text = verbatim(node).strip();
            if (text.isEmpty()) {
                return;
            }
            String parentKind = chain.parentKind();
            if (table.operatorTokens().contains(node.kind())
                    || (parentKind != null && table.operatorKinds().contains(parentKind) && !PUNCTUATION.contains(text))) {
                addOperator(target, text);
                arena.appendText(target, text);
                return;
            }
            if (parentKind != null && table.keywordModifierKinds().contains(parentKind)
                    && table.knownModifiers().contains(text)) {
                marker(target, text);
                return;
            }
            arena.appendText(target, text);
        }

        private void addOperator(int target, String text) {
            if (arena.type(target) != NodeType.ELEMENT) {
                return;
            }
            String existing = arena.attribute(target, OP);
            arena.setAttribute(target, OP, existing == null ? text : existing + " " + text);
        }

        /**
         * Every keyword inside a modifier wrapper becomes a marker; other named content is emitted
         * into the parent. Returns false when the wrapper holds no keyword at all.
         */
        private boolean liftModifiers(RawNode node, int parent, AncestorChain chain) {
            if (node.children().isEmpty()) {
                List<String> words = modifierWords(verbatim(node));
                if (words.isEmpty()) {
                    return false;
                }
                words.forEach(word -> marker(parent, word));
                return true;
            }
            AncestorChain childChain = chain.push(node);
            boolean lifted = false;
            for (RawNode child : node.children()) {
                if (child.children().isEmpty() && !child.isError()) {
                    List<String> words = modifierWords(verbatim(child));
                    if (!words.isEmpty()) {
                        words.forEach(word -> marker(parent, word));
                        lifted = true;
                        continue;
                    }
                }
                if (child.isNamed()) {
                    emit(child, parent, childChain);
                    lifted = true;
                }
            }
            return lifted;
        }

        private List<String> modifierWords(String text) {
            List<String> words = new ArrayList<>();
            for (String word : BLANKS.split(text.strip())) {
                if (WORD.matcher(word).matches()) {
                    words.add(word);
                }
            }
            return words;
        }

        private void marker(int target, String name) {
            arena.appendChild(target, arena.createElement(name));
        }

        private void wrap(RawNode node, String field, int parent, AncestorChain chain) {
            int wrapper = arena.createElement(field);
            content(node, wrapper, chain);
            List<Integer> built = arena.children(wrapper);
            if (built.isEmpty()) {
                return;
            }
            if (built.size() == 1) {
                int only = built.get(0);
                if (arena.type(only) == NodeType.ELEMENT && field.equals(arena.name(only))) {
                    arena.appendChild(parent, only);
                    return;
                }
            }
            arena.appendChild(parent, wrapper);
        }

        /**
         * Rules applied to a named node once skip, flatten, operator, modifier and wrapping are ruled out.
         */
        private void content(RawNode node, int target, AncestorChain chain) {
            String kind = node.kind();
            if (table.extractNameKinds().contains(kind)) {
                arena.appendChild(target, leaf(classify(node, chain).elementName(), leafText(node), node));
                return;
            }
            if (table.identifierKinds().contains(kind)) {
                arena.appendChild(target, leaf(classify(node, chain).elementName(), verbatim(node), node));
                return;
            }
            if (table.isTypeConstruct(kind)) {
                arena.appendChild(target, type(node, chain));
                return;
            }
            ScalarStyle style = table.scalarKinds().get(kind);
            if (style != null) {
                scalar(node, style, target);
                return;
            }
            if (table.isDataMode()) {
                if (table.pairKinds().contains(kind)) {
                    pair(node, target, chain);
                    return;
                }
                if (table.sequenceKinds().contains(kind)) {
                    sequence(node, target, chain);
                    return;
                }
                if (table.sequenceItemKinds().contains(kind)) {
                    int item = spanned(ITEM, node);
                    itemContent(node, item, chain);
                    arena.appendChild(target, item);
                    return;
                }
            }
            if (table.collapseKinds().contains(kind)) {
                int element = leaf(table.elementName(kind), verbatim(node), node);
                fieldAttribute(element, node);
                arena.appendChild(target, element);
                return;
            }
            arena.appendChild(target, element(node, chain));
        }

        /**
         * Default rule: renamed or lower-cased kind, children in order, verbatim text for leaves.
         */
        private int element(RawNode node, AncestorChain chain) {
            int element = spanned(table.elementName(node.kind()), node);
            fieldAttribute(element, node);
            if (node.children().isEmpty()) {
                arena.appendText(element, verbatim(node));
                return element;
            }
            int skippedBefore = skipped;
            children(node, element, chain.push(node));
            if (!hasElementChild(element) && skipped == skippedBefore) {
                arena.clearChildren(element);
                arena.appendText(element, verbatim(node));
            }
            return element;
        }

        private void fieldAttribute(int element, RawNode node) {
            String field = node.fieldName();
            if (field != null && !table.wrappedFields().contains(field)) {
                arena.setAttribute(element, FIELD, field);
            }
        }

        private int error(RawNode node) {
            return leaf(ERROR, verbatim(node), node);
        }

        private IdentifierRole classify(RawNode node, AncestorChain chain) {
            IdentifierRole role;
            try {
                boolean special = table.context().compute(chain);
                role = table.classifier().classify(node, chain, special);
            } catch (RuntimeException e) {
                throw new RuleTableException("Identifier classifier of table '" + table.name()
                        + "' failed on " + node.kind() + " at " + Span.of(node), e);
            }
            if (role == null) {
                throw new RuleTableException("Identifier classifier of table '" + table.name()
                        + "' returned no role for " + node.kind() + " at " + Span.of(node));
            }
            return role;
        }

        // Type unification

        private int type(RawNode node, AncestorChain chain) {
            String kind = node.kind();
            int type = spanned(TYPE, node);
            if (table.typeKinds().contains(kind)) {
                arena.appendText(type, normalizeSpaces(verbatim(node)));
                return type;
            }
            AncestorChain childChain = chain.push(node);
            if (table.genericTypeKinds().contains(kind)) {
                marker(type, "generic");
                arena.appendText(type, genericBase(node));
                int arguments = arena.createElement(ARGUMENTS);
                for (RawNode child : node.children()) {
                    if (table.typeArgumentKinds().contains(child.kind())) {
                        AncestorChain argumentChain = childChain.push(child);
                        for (RawNode argument : child.children()) {
                            if (argument.isNamed()) {
                                emit(argument, arguments, argumentChain);
                            }
                        }
                    } else if (child.isNamed() && child.fieldName() != null
                            && table.typeArgumentFields().contains(child.fieldName())) {
                        emit(child, arguments, childChain);
                    }
                }
                if (!arena.children(arguments).isEmpty()) {
                    arena.appendChild(type, arguments);
                }
                return type;
            }
            marker(type, table.nullableTypeKinds().contains(kind) ? "nullable" : "array");
            RawNode inner = elementType(node);
            if (inner != null) {
                int holder = arena.createElement(TYPE);
                emit(inner, holder, childChain);
                List<Integer> built = arena.children(holder);
                if (built.size() == 1 && isSimpleType(built.get(0))) {
                    arena.appendText(type, arena.node(built.get(0)).stringValue());
                } else {
                    arena.moveChildren(holder, type);
                }
            }
            return type;
        }

        private RawNode elementType(RawNode node) {
            RawNode firstNamed = null;
            for (RawNode child : node.children()) {
                if (!child.isNamed() || table.skipKinds().contains(child.kind())) {
                    continue;
                }
                String kind = child.kind();
                if (table.isTypeConstruct(kind) || table.identifierKinds().contains(kind)
                        || table.extractNameKinds().contains(kind)) {
                    return child;
                }
                if (firstNamed == null) {
                    firstNamed = child;
                }
            }
            return firstNamed;
        }

        private boolean isSimpleType(int id) {
            if (arena.type(id) != NodeType.ELEMENT || !TYPE.equals(arena.name(id))) {
                return false;
            }
            for (int child : arena.children(id)) {
                if (arena.type(child) == NodeType.ELEMENT) {
                    return false;
                }
            }
            return true;
        }

        private String genericBase(RawNode node) {
            int limit = node.endByte();
            for (RawNode child : node.children()) {
                boolean argumentStart = table.typeArgumentKinds().contains(child.kind())
                        || (child.fieldName() != null && table.typeArgumentFields().contains(child.fieldName()))
                        || (!child.isNamed() && "<".equals(verbatim(child).strip()));
                if (argumentStart) {
                    limit = child.startByte();
                    break;
                }
            }
            String base = source.slice(node.startByte(), limit).strip();
            if (base.endsWith("<")) {
                base = base.substring(0, base.length() - 1).strip();
            }
            return BLANKS.matcher(base).replaceAll("");
        }

        // Configuration formats

        private void scalar(RawNode node, ScalarStyle style, int target) {
            String raw = verbatim(node);
            if (table.isDataMode()) {
                arena.appendText(target, ScalarDecoder.decode(raw, style));
                return;
            }
            int element = spanned(table.elementName(node.kind()), node);
            fieldAttribute(element, node);
            arena.appendText(element, ScalarDecoder.strip(raw, style));
            arena.appendChild(target, element);
        }

        /**
         * A sole-flatten kind is spliced only when it is the single child of its kind, so a
         * stream holding several documents keeps one element per document.
         */
        private boolean soleOfKind(RawNode node, AncestorChain chain) {
            if (!table.soleFlattenKinds().contains(node.kind())) {
                return false;
            }
            return chain.parent()
                    .map(parent -> parent.children().stream()
                            .filter(sibling -> sibling.kind().equals(node.kind()))
                            .count() == 1)
                    .orElse(true);
        }

        /**
         * A mapping entry becomes an element named after its key. A sequence value becomes one
         * such element per item.
         */
        private void pair(RawNode node, int target, AncestorChain chain) {
            RawNode key = fieldChild(node, table.keyField());
            if (key == null) {
                arena.appendChild(target, element(node, chain));
                return;
            }
            RawNode value = fieldChild(node, table.valueField());
            String keyText = keyText(key);
            String name = KeySanitizer.sanitize(keyText);
            boolean sanitized = !name.equals(keyText);
            AncestorChain childChain = chain.push(node);

            RawNode sequence = value == null ? null : sequenceOf(value);
            if (sequence != null) {
                List<RawNode> items = items(sequence);
                if (items.isEmpty()) {
                    arena.appendChild(target, keyElement(name, keyText, sanitized, value));
                    return;
                }
                AncestorChain itemChain = childChain.push(sequence);
                for (RawNode item : items) {
                    int element = keyElement(name, keyText, sanitized, item);
                    itemContent(item, element, itemChain);
                    arena.appendChild(target, element);
                }
                return;
            }
            int element = keyElement(name, keyText, sanitized, value != null ? value : node);
            if (value != null) {
                emit(value, element, childChain);
            }
            arena.appendChild(target, element);
        }

        private void sequence(RawNode node, int target, AncestorChain chain) {
            AncestorChain itemChain = chain.push(node);
            for (RawNode item : items(node)) {
                int element = spanned(ITEM, item);
                itemContent(item, element, itemChain);
                arena.appendChild(target, element);
            }
        }

        private void itemContent(RawNode item, int element, AncestorChain chain) {
            if (table.sequenceItemKinds().contains(item.kind())) {
                AncestorChain inner = chain.push(item);
                for (RawNode child : item.children()) {
                    if (child.isNamed()) {
                        emit(child, element, inner);
                    }
                }
                return;
            }
            emit(item, element, chain);
        }

        private List<RawNode> items(RawNode sequence) {
            List<RawNode> items = new ArrayList<>();
            for (RawNode child : sequence.children()) {
                if (child.isNamed() && !table.skipKinds().contains(child.kind())) {
                    items.add(child);
                }
            }
            return items;
        }

        private RawNode sequenceOf(RawNode value) {
            if (table.sequenceKinds().contains(value.kind())) {
                return value;
            }
            if (table.flattenKinds().contains(value.kind())) {
                RawNode only = null;
                for (RawNode child : value.children()) {
                    if (child.isNamed()) {
                        if (only != null) {
                            return null;
                        }
                        only = child;
                    }
                }
                return only == null ? null : sequenceOf(only);
            }
            return null;
        }

        private int keyElement(String name, String keyText, boolean sanitized, RawNode spanSource) {
            int element = spanned(name, spanSource);
            if (sanitized) {
                arena.setAttribute(element, KEY, keyText);
            }
            return element;
        }

        private String keyText(RawNode key) {
            ScalarStyle style = table.scalarKinds().get(key.kind());
            if (style != null) {
                return ScalarDecoder.decode(verbatim(key), style);
            }
            for (RawNode child : key.children()) {
                if (child.isNamed() && table.scalarKinds().containsKey(child.kind())) {
                    return keyText(child);
                }
            }
            return verbatim(key).strip();
        }

        private static RawNode fieldChild(RawNode node, String field) {
            for (RawNode child : node.children()) {
                if (field.equals(child.fieldName())) {
                    return child;
                }
            }
            return null;
        }

        // Helpers

        private int spanned(String name, RawNode node) {
            int element = arena.createElement(name);
            arena.setSpan(element, Span.of(node));
            return element;
        }

        private int leaf(String name, String text, RawNode node) {
            int element = spanned(name, node);
            arena.appendText(element, text);
            return element;
        }

        private boolean hasElementChild(int element) {
            for (int child : arena.children(element)) {
                if (arena.type(child) == NodeType.ELEMENT) {
                    return true;
                }
            }
            return false;
        }

        private String verbatim(RawNode node) {
            return source.slice(node.startByte(), node.endByte());
        }

        private String leafText(RawNode node) {
            if (node.children().isEmpty()) {
                return verbatim(node).strip();
            }
            StringBuilder text = new StringBuilder();
            for (RawNode child : node.children()) {
                text.append(leafText(child));
            }
            return text.toString();
        }

        private static String normalizeSpaces(String text) {
            return BLANKS.matcher(text.strip()).replaceAll(" ");
        }
    }
}
