package com.vidnyan.semtree.adapter.out.rules.classifier;

import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.rule.AncestorChain;
import com.vidnyan.semtree.domain.rule.IdentifierRole;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * C# reuses {@code identifier} and {@code qualified_name} for declared names, namespaces and
 * type references. Inside a namespace declaration header a qualified name is a name; a method
 * identifier followed by its parameter list is the method name, otherwise the return type.
 */
@Component
public class CSharpLanguageCallbacks implements LanguageCallbacks {

    public static final String NAME = "csharp";

    private static final Set<String> NAMESPACES = Set.of(
            "namespace_declaration", "file_scoped_namespace_declaration");

    private static final Set<String> TYPE_DECLARATIONS = Set.of(
            "class_declaration", "struct_declaration", "interface_declaration", "enum_declaration",
            "record_declaration", "record_struct_declaration", "delegate_declaration");

    private static final Set<String> CALLABLES = Set.of(
            "method_declaration", "constructor_declaration", "destructor_declaration",
            "local_function_statement", "operator_declaration");

    private static final Set<String> DECLARATORS = Set.of(
            "variable_declarator", "parameter", "enum_member_declaration", "type_parameter",
            "property_declaration", "event_declaration", "catch_declaration", "foreach_statement",
            "using_directive", "attribute");

    private static final Set<String> TYPE_CONTEXTS = Set.of(
            "generic_name", "type_argument_list", "base_list", "nullable_type", "array_type",
            "pointer_type", "ref_type", "type_parameter_constraint", "object_creation_expression",
            "typeof_expression", "cast_expression", "is_pattern_expression", "as_expression");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public IdentifierRole classify(RawNode node, AncestorChain ancestors, boolean inNamespace) {
        String parent = ancestors.parentKind();
        if (parent == null) {
            return IdentifierRole.NAME;
        }
        if (inNamespace && ("qualified_name".equals(node.kind()) || "qualified_name".equals(parent)
                || NAMESPACES.contains(parent))) {
            return IdentifierRole.NAME;
        }
        if ("type".equals(node.fieldName()) || "returns".equals(node.fieldName())) {
            return IdentifierRole.TYPE;
        }
        if (CALLABLES.contains(parent)) {
            return followedByParameters(node, ancestors.parent().orElseThrow())
                    ? IdentifierRole.NAME
                    : IdentifierRole.TYPE;
        }
        if (TYPE_DECLARATIONS.contains(parent) || NAMESPACES.contains(parent) || DECLARATORS.contains(parent)) {
            return IdentifierRole.NAME;
        }
        if (TYPE_CONTEXTS.contains(parent)) {
            return IdentifierRole.TYPE;
        }
        return IdentifierRole.NAME;
    }

    /**
     * True while the chain is inside a namespace header and not yet inside a type.
     */
    @Override
    public boolean compute(AncestorChain ancestors) {
        for (RawNode ancestor : ancestors.nodes()) {
            if (TYPE_DECLARATIONS.contains(ancestor.kind()) || CALLABLES.contains(ancestor.kind())) {
                return false;
            }
            if (NAMESPACES.contains(ancestor.kind())) {
                return true;
            }
        }
        return false;
    }

    private static boolean followedByParameters(RawNode node, RawNode parent) {
        List<? extends RawNode> siblings = parent.children();
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i).startByte() == node.startByte() && siblings.get(i).kind().equals(node.kind())) {
                for (int j = i + 1; j < siblings.size(); j++) {
                    RawNode next = siblings.get(j);
                    if (next.isNamed()) {
                        return "parameter_list".equals(next.kind()) || "type_parameter_list".equals(next.kind());
                    }
                }
                return false;
            }
        }
        return false;
    }
}
