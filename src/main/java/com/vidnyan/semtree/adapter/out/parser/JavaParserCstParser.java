package com.vidnyan.semtree.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.JavaToken;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.nodeTypes.NodeWithVariables;
import com.github.javaparser.ast.stmt.UnparsableStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.metamodel.PropertyMetaModel;
import com.vidnyan.semtree.application.port.out.CstParser;
import com.vidnyan.semtree.domain.model.Position;
import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.model.SourceText;
import com.vidnyan.semtree.domain.model.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * JavaParser-based implementation of CstParser.
 *
 * <p>JavaParser builds an abstract tree, so the concrete shape is rebuilt here: node kinds are the
 * snake-cased node class names, field names are the snake-cased property names, and tokens not
 * covered by a child node become unnamed children. Statements JavaParser could not parse become
 * {@code ERROR} nodes.
 */
@Slf4j
@Component
public class JavaParserCstParser implements CstParser {

    private static final String LANGUAGE = "java";

    @Override
    public String getName() {
        return "JavaParser";
    }

    @Override
    public boolean supports(String language) {
        return LANGUAGE.equalsIgnoreCase(language);
    }

    @Override
    public RawNode parse(SourceText source, String language) {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
        ParseResult<CompilationUnit> result = new JavaParser(config).parse(source.text());

        if (result.getResult().isEmpty() || result.getResult().get().getRange().isEmpty()) {
            log.debug("JavaParser produced no tree: {}", result.getProblems());
            return unparsable(source);
        }
        CompilationUnit unit = result.getResult().get();
        if (!result.isSuccessful() && unit.findFirst(UnparsableStmt.class).isEmpty()) {
            log.debug("JavaParser reported {} problems without recovery", result.getProblems().size());
            return unparsable(source);
        }
        return new Conversion(source, tokens(unit, source)).convert(unit, null);
    }

    private static SyntaxNode unparsable(SourceText source) {
        Position start = Position.ORIGIN;
        Position end = source.positionAt(source.length());
        SyntaxNode error = SyntaxNode.leaf(RawNode.ERROR_KIND, start, end);
        return SyntaxNode.named("compilation_unit", start, end, List.of(error));
    }

    private static List<Token> tokens(CompilationUnit unit, SourceText source) {
        List<Token> tokens = new ArrayList<>();
        unit.getTokenRange().ifPresent(range -> {
            for (JavaToken token : range) {
                if (token.getCategory().isWhitespaceOrComment() || token.getText().isEmpty()) {
                    continue;
                }
                token.getRange().ifPresent(r ->
                        tokens.add(new Token(token.getText(), startOffset(source, r), endOffset(source, r))));
            }
        });
        return tokens;
    }

    private static int startOffset(SourceText source, Range range) {
        return source.charOffset(range.begin.line - 1, range.begin.column - 1);
    }

    private static int endOffset(SourceText source, Range range) {
        return source.charOffset(range.end.line - 1, range.end.column - 1) + 1;
    }

    static String kind(Node node) {
        if (node instanceof UnparsableStmt) {
            return RawNode.ERROR_KIND;
        }
        if (node instanceof ClassOrInterfaceDeclaration declaration) {
            return declaration.isInterface() ? "interface_declaration" : "class_declaration";
        }
        if (node instanceof ClassOrInterfaceType type && type.getTypeArguments().isPresent()) {
            return "generic_type";
        }
        if (node instanceof Name) {
            return "qualified_name";
        }
        return snakeCase(node.getMetaModel().getTypeName());
    }

    static String snakeCase(String name) {
        StringBuilder out = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private record Token(String text, int start, int end) {
    }

    private record Child(Node node, String field, int start, int end) {
    }

    /**
     * Conversion of one compilation unit; offsets are character offsets into the source.
     */
    private static final class Conversion {

        private final SourceText source;
        private final List<Token> tokens;

        Conversion(SourceText source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        SyntaxNode convert(Node node, String field) {
            Range range = node.getRange().orElseThrow();
            int start = startOffset(source, range);
            int end = endOffset(source, range);
            String kind = kind(node);

            List<SyntaxNode> children = new ArrayList<>();
            List<Child> childNodes = RawNode.ERROR_KIND.equals(kind) ? List.of() : childNodes(node, start, end);
            if (!childNodes.isEmpty()) {
                int cursor = start;
                for (Child child : childNodes) {
                    if (child.start() < cursor) {
                        continue;
                    }
                    addTokens(children, cursor, child.start());
                    children.add(convert(child.node(), child.field()));
                    cursor = child.end();
                }
                addTokens(children, cursor, end);
            }
            return new SyntaxNode(kind, true, field, source.positionAt(start), source.positionAt(end), children);
        }

        private List<Child> childNodes(Node node, int start, int end) {
            Map<Node, String> fields = fieldNames(node);
            Map<Node, Boolean> seen = new IdentityHashMap<>();
            List<Child> children = new ArrayList<>();
            for (Node child : node.getChildNodes()) {
                if (child instanceof Comment) {
                    continue;
                }
                addChild(children, seen, child, fields.get(child), start, end);
            }
            // declarators share the declaration's type, which lies outside their own range
            if (node instanceof NodeWithVariables<?> withVariables && !withVariables.getVariables().isEmpty()) {
                addChild(children, seen, withVariables.getVariable(0).getType(), "type", start, end);
            }
            children.sort(Comparator.comparingInt(Child::start).thenComparing(Child::end, Comparator.reverseOrder()));
            return children;
        }

        private void addChild(List<Child> children, Map<Node, Boolean> seen, Node child, String field,
                              int start, int end) {
            if (seen.containsKey(child) || child.getRange().isEmpty()) {
                return;
            }
            Range range = child.getRange().get();
            int childStart = startOffset(source, range);
            int childEnd = endOffset(source, range);
            if (childStart < start || childEnd > end) {
                return;
            }
            seen.put(child, Boolean.TRUE);
            children.add(new Child(child, field, childStart, childEnd));
        }

        private void addTokens(List<SyntaxNode> children, int from, int to) {
            for (int i = firstTokenAt(from); i < tokens.size(); i++) {
                Token token = tokens.get(i);
                if (token.start() >= to) {
                    break;
                }
                if (token.end() <= to) {
                    children.add(SyntaxNode.token(token.text(),
                            source.positionAt(token.start()), source.positionAt(token.end())));
                }
            }
        }

        private int firstTokenAt(int offset) {
            int low = 0;
            int high = tokens.size();
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (tokens.get(mid).start() < offset) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }

        private static Map<Node, String> fieldNames(Node node) {
            Map<Node, String> names = new IdentityHashMap<>();
            for (PropertyMetaModel property : node.getMetaModel().getAllPropertyMetaModels()) {
                if (!property.isNode()) {
                    continue;
                }
                Object value = property.getValue(node);
                String field = snakeCase(property.getName());
                if (value instanceof NodeList<?> list) {
                    for (Node element : list) {
                        names.putIfAbsent(element, field);
                    }
                } else if (value instanceof Node child) {
                    names.putIfAbsent(child, field);
                }
            }
            return names;
        }
    }
}
