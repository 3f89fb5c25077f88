package com.vidnyan.semtree.adapter.out.parser;

import com.vidnyan.semtree.application.port.out.CstParser;
import com.vidnyan.semtree.domain.error.CstParseException;
import com.vidnyan.semtree.domain.model.Position;
import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.model.SourceText;
import com.vidnyan.semtree.domain.model.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.events.AliasEvent;
import org.yaml.snakeyaml.events.CollectionStartEvent;
import org.yaml.snakeyaml.events.DocumentEndEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * SnakeYAML-based implementation of CstParser for YAML.
 *
 * <p>The tree is rebuilt from SnakeYAML's event stream: {@code stream}, {@code document},
 * {@code block_mapping} / {@code flow_mapping} with {@code block_mapping_pair} / {@code flow_pair}
 * entries (fields {@code key} and {@code value}), {@code block_sequence} with
 * {@code block_sequence_item} entries, {@code flow_sequence}, and scalar kinds resolved from the
 * scalar's style and implicit type. An empty value leaves the pair without a {@code value} child.
 * A syntax error turns the rest of the stream into one {@code ERROR} node.
 */
@Slf4j
@Component
public class SnakeYamlCstParser implements CstParser {

    private static final String LANGUAGE = "yaml";
    private static final Resolver RESOLVER = new Resolver();

    @Override
    public String getName() {
        return "SnakeYAML";
    }

    @Override
    public boolean supports(String language) {
        return LANGUAGE.equalsIgnoreCase(language);
    }

    @Override
    public RawNode parse(SourceText source, String language) {
        Iterator<Event> events = new Yaml().parse(new StringReader(source.text())).iterator();
        return new EventReader(events, source).stream();
    }

    static String scalarKind(ScalarEvent event) {
        return switch (event.getScalarStyle()) {
            case SINGLE_QUOTED -> "single_quote_scalar";
            case DOUBLE_QUOTED -> "double_quote_scalar";
            case LITERAL, FOLDED -> "block_scalar";
            default -> plainKind(event.getValue());
        };
    }

    private static String plainKind(String value) {
        Tag tag = RESOLVER.resolve(NodeId.scalar, value, true);
        if (Tag.INT.equals(tag)) {
            return "integer_scalar";
        }
        if (Tag.FLOAT.equals(tag)) {
            return "float_scalar";
        }
        if (Tag.BOOL.equals(tag)) {
            return "boolean_scalar";
        }
        if (Tag.NULL.equals(tag)) {
            return "null_scalar";
        }
        return "string_scalar";
    }

    /**
     * Recursive descent over the event stream. Offsets are character offsets into the source.
     */
    private static final class EventReader {

        private final Iterator<Event> events;
        private final SourceText source;
        private final String text;
        private int completed;

        EventReader(Iterator<Event> events, SourceText source) {
            this.events = events;
            this.source = source;
            this.text = source.text();
        }

        SyntaxNode stream() {
            List<SyntaxNode> documents = new ArrayList<>();
            try {
                next();
                Event event;
                while (!((event = next()) instanceof StreamEndEvent)) {
                    if (event instanceof DocumentStartEvent start) {
                        SyntaxNode document = document(start);
                        documents.add(document);
                        completed = offset(document.endPosition());
                    }
                }
            } catch (YAMLException e) {
                log.debug("Malformed YAML: {}", e.getMessage());
                int start = skipBlanks(completed);
                if (start < text.length()) {
                    documents.add(SyntaxNode.leaf(RawNode.ERROR_KIND, position(start), position(text.length())));
                }
            }
            return SyntaxNode.named("stream", Position.ORIGIN, position(text.length()), documents);
        }

        private SyntaxNode document(DocumentStartEvent start) {
            List<SyntaxNode> children = new ArrayList<>();
            int from = offset(start.getStartMark());
            if (start.getExplicit()) {
                children.add(token("---", from));
            }
            Event event = next();
            if (!(event instanceof DocumentEndEvent)) {
                SyntaxNode content = node(event, null);
                if (content != null) {
                    children.add(content);
                }
                event = next();
            }
            int to = children.isEmpty() ? from : offset(children.get(children.size() - 1).endPosition());
            if (event instanceof DocumentEndEvent end && end.getExplicit()) {
                int dots = offset(end.getStartMark());
                children.add(token("...", dots));
                to = dots + 3;
            }
            if (!children.isEmpty()) {
                from = Math.min(from, offset(children.get(0).startPosition()));
            }
            return SyntaxNode.named("document", position(from), position(Math.max(from, to)), children);
        }

        private SyntaxNode node(Event event, String field) {
            SyntaxNode node;
            if (event instanceof ScalarEvent scalar) {
                node = scalar(scalar);
            } else if (event instanceof AliasEvent) {
                int start = offset(event.getStartMark());
                node = SyntaxNode.leaf("alias", position(start), position(offset(event.getEndMark())));
            } else if (event instanceof MappingStartEvent mapping) {
                node = mapping(mapping);
            } else if (event instanceof SequenceStartEvent sequence) {
                node = sequence(sequence);
            } else {
                throw new CstParseException("Unexpected YAML event " + event + " at " + event.getStartMark());
            }
            return node == null || field == null ? node : node.withField(field);
        }

        private SyntaxNode scalar(ScalarEvent event) {
            if (event.getValue().isEmpty() && event.getScalarStyle() == DumperOptions.ScalarStyle.PLAIN) {
                return null;
            }
            int start = contentStart(offset(event.getStartMark()));
            int end = trimEnd(start, offset(event.getEndMark()));
            return SyntaxNode.leaf(scalarKind(event), position(start), position(end));
        }

        private SyntaxNode mapping(MappingStartEvent start) {
            boolean flow = isFlow(start);
            List<SyntaxNode> children = new ArrayList<>();
            if (flow) {
                children.add(token("{", contentStart(offset(start.getStartMark()))));
            }
            Event event;
            while (!((event = next()) instanceof MappingEndEvent)) {
                SyntaxNode key = node(event, "key");
                SyntaxNode value = node(next(), "value");
                SyntaxNode pair = pair(key, value, flow);
                if (pair != null) {
                    if (flow) {
                        comma(children, offset(pair.startPosition()));
                    }
                    children.add(pair);
                }
            }
            return collection(flow ? "flow_mapping" : "block_mapping", start, event, children, flow, "}");
        }

        private SyntaxNode pair(SyntaxNode key, SyntaxNode value, boolean flow) {
            if (key == null && value == null) {
                return null;
            }
            List<SyntaxNode> children = new ArrayList<>();
            int start;
            int end;
            if (key != null) {
                children.add(key);
                start = offset(key.startPosition());
                end = offset(key.endPosition());
            } else {
                start = offset(value.startPosition());
                end = start;
            }
            int colon = skipBlanks(end);
            if (colon < text.length() && text.charAt(colon) == ':') {
                children.add(token(":", colon));
                end = colon + 1;
            }
            if (value != null) {
                children.add(value);
                end = offset(value.endPosition());
            }
            return SyntaxNode.named(flow ? "flow_pair" : "block_mapping_pair", position(start), position(end), children);
        }

        private SyntaxNode sequence(SequenceStartEvent start) {
            boolean flow = isFlow(start);
            List<SyntaxNode> children = new ArrayList<>();
            if (flow) {
                children.add(token("[", contentStart(offset(start.getStartMark()))));
            }
            Event event;
            while (!((event = next()) instanceof SequenceEndEvent)) {
                int anchor = offset(event.getStartMark());
                SyntaxNode item = node(event, null);
                if (flow) {
                    if (item != null) {
                        comma(children, offset(item.startPosition()));
                        children.add(item);
                    }
                } else {
                    children.add(blockItem(item, anchor));
                }
            }
            return collection(flow ? "flow_sequence" : "block_sequence", start, event, children, flow, "]");
        }

        private SyntaxNode blockItem(SyntaxNode item, int anchor) {
            int dash;
            if (item != null) {
                dash = dashBefore(offset(item.startPosition()));
            } else {
                dash = anchor < text.length() && text.charAt(anchor) == '-' ? anchor : dashBefore(anchor);
            }
            List<SyntaxNode> children = new ArrayList<>();
            children.add(token("-", dash));
            int end = dash + 1;
            if (item != null) {
                children.add(item);
                end = offset(item.endPosition());
            }
            return SyntaxNode.named("block_sequence_item", position(dash), position(end), children);
        }

        private SyntaxNode collection(String kind, CollectionStartEvent start, Event end, List<SyntaxNode> children,
                                      boolean flow, String closing) {
            if (flow) {
                int close = offset(end.getStartMark());
                children.add(token(closing, close));
                return SyntaxNode.named(kind, children.get(0).startPosition(), position(close + 1), children);
            }
            if (children.isEmpty()) {
                int at = contentStart(offset(start.getStartMark()));
                return SyntaxNode.named(kind, position(at), position(at), children);
            }
            return SyntaxNode.named(kind, children.get(0).startPosition(),
                    children.get(children.size() - 1).endPosition(), children);
        }

        private void comma(List<SyntaxNode> children, int before) {
            if (children.size() < 2) {
                return;
            }
            int from = offset(children.get(children.size() - 1).endPosition());
            int comma = skipBlanks(from);
            if (comma < before && text.charAt(comma) == ',') {
                children.add(token(",", comma));
            }
        }

        private Event next() {
            if (!events.hasNext()) {
                throw new YAMLException("Unexpected end of YAML event stream");
            }
            return events.next();
        }

        private static boolean isFlow(CollectionStartEvent event) {
            return event.getFlowStyle() == DumperOptions.FlowStyle.FLOW;
        }

        private SyntaxNode token(String symbol, int at) {
            return SyntaxNode.token(symbol, position(at), position(at + symbol.length()));
        }

        /**
         * Skips anchor and tag properties written before a node.
         */
        private int contentStart(int at) {
            int i = at;
            while (i < text.length() && (text.charAt(i) == '&' || text.charAt(i) == '!')) {
                while (i < text.length() && !Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                i = skipBlanks(i);
            }
            return i;
        }

        private int trimEnd(int start, int end) {
            int i = Math.min(end, text.length());
            while (i > start && Character.isWhitespace(text.charAt(i - 1))) {
                i--;
            }
            return i;
        }

        private int dashBefore(int at) {
            int i = Math.min(at, text.length()) - 1;
            while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
                i--;
            }
            return i >= 0 && text.charAt(i) == '-' ? i : Math.min(at, text.length());
        }

        private int skipBlanks(int from) {
            int i = from;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                } else if (c == '#') {
                    int eol = text.indexOf('\n', i);
                    i = eol < 0 ? text.length() : eol + 1;
                } else {
                    break;
                }
            }
            return i;
        }

        private int offset(Mark mark) {
            return source.charOffsetOfCodePoint(mark.getIndex());
        }

        private int offset(Position position) {
            return source.charOffset(position.row(), position.column());
        }

        private Position position(int charOffset) {
            return source.positionAt(charOffset);
        }
    }
}
