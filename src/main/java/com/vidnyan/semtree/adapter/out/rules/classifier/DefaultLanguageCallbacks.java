package com.vidnyan.semtree.adapter.out.rules.classifier;

import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.rule.AncestorChain;
import com.vidnyan.semtree.domain.rule.IdentifierRole;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Field- and parent-based classification for grammars that keep types and names in distinct
 * slots: an identifier in a type slot, or directly under a type construct, is a type.
 */
@Component
public class DefaultLanguageCallbacks implements LanguageCallbacks {

    public static final String NAME = "default";

    static final Set<String> TYPE_FIELDS = Set.of(
            "type", "returns", "return_type", "result", "superclass", "interfaces",
            "element", "type_arguments", "bound", "trait"
    );

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public IdentifierRole classify(RawNode node, AncestorChain ancestors, boolean inSpecialContext) {
        if (node.fieldName() != null && TYPE_FIELDS.contains(node.fieldName())) {
            return IdentifierRole.TYPE;
        }
        String parent = ancestors.parentKind();
        if (parent != null && parent.toLowerCase(Locale.ROOT).contains("type")) {
            return IdentifierRole.TYPE;
        }
        return IdentifierRole.NAME;
    }

    @Override
    public boolean compute(AncestorChain ancestors) {
        return false;
    }
}
