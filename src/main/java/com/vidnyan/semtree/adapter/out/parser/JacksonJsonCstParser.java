package com.vidnyan.semtree.adapter.out.parser;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.vidnyan.semtree.application.port.out.CstParser;
import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.model.SourceText;
import com.vidnyan.semtree.domain.model.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson-based implementation of CstParser for JSON.
 *
 * <p>Jackson validates the input and reports the token sequence; token offsets are recovered by
 * scanning the source in step with it. The resulting tree uses the kinds {@code document},
 * {@code object}, {@code pair} (fields {@code key} and {@code value}), {@code array}, {@code string},
 * {@code number}, {@code true}, {@code false} and {@code null}, with punctuation as unnamed tokens.
 * Comments are accepted and dropped.
 */
@Slf4j
@Component
public class JacksonJsonCstParser implements CstParser {

    private static final String LANGUAGE = "json";

    private final JsonFactory factory = JsonFactory.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .build();

    @Override
    public String getName() {
        return "Jackson";
    }

    @Override
    public boolean supports(String language) {
        return LANGUAGE.equalsIgnoreCase(language);
    }

    @Override
    public RawNode parse(SourceText source, String language) {
        String text = source.text();
        try (JsonParser parser = factory.createParser(text)) {
            return new Scan(parser, source).document();
        } catch (IOException e) {
            log.debug("Malformed JSON: {}", e.getMessage());
            int start = Scan.skipTrivia(text, 0);
            SyntaxNode error = SyntaxNode.leaf(RawNode.ERROR_KIND,
                    source.positionAt(start), source.positionAt(text.length()));
            return SyntaxNode.named("document", source.positionAt(0), source.positionAt(text.length()),
                    start < text.length() ? List.of(error) : List.of());
        }
    }

    /**
     * Walks Jackson's token stream while a cursor tracks the same position in the source text.
     */
    private static final class Scan {

        private final JsonParser parser;
        private final SourceText source;
        private final String text;
        private int cursor;

        Scan(JsonParser parser, SourceText source) {
            this.parser = parser;
            this.source = source;
            this.text = source.text();
        }

        SyntaxNode document() throws IOException {
            List<SyntaxNode> values = new ArrayList<>();
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                values.add(value(token, null));
            }
            return SyntaxNode.named("document", source.positionAt(0), source.positionAt(text.length()), values);
        }

        private SyntaxNode value(JsonToken token, String field) throws IOException {
            int start = skipTrivia(text, cursor);
            if (token == null) {
                throw new IOException("Unexpected end of input at offset " + start);
            }
            SyntaxNode node = switch (token) {
                case START_OBJECT -> object(start);
                case START_ARRAY -> array(start);
                case VALUE_STRING -> leaf("string", start, stringEnd(start));
                case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> leaf("number", start, numberEnd(start));
                case VALUE_TRUE -> leaf("true", start, start + 4);
                case VALUE_FALSE -> leaf("false", start, start + 5);
                case VALUE_NULL -> leaf("null", start, start + 4);
                default -> throw new IOException("Unexpected JSON token " + token + " at offset " + start);
            };
            return field == null ? node : node.withField(field);
        }

        private SyntaxNode object(int start) throws IOException {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(punctuation("{", start));
            cursor = start + 1;
            JsonToken token;
            while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
                separator(children);
                int keyStart = skipTrivia(text, cursor);
                SyntaxNode key = leaf("string", keyStart, stringEnd(keyStart)).withField("key");
                int colon = skipTrivia(text, cursor);
                cursor = colon + 1;
                SyntaxNode value = value(parser.nextToken(), "value");
                children.add(new SyntaxNode("pair", true, null, key.startPosition(), value.endPosition(),
                        List.of(key, punctuation(":", colon), value)));
            }
            if (token != JsonToken.END_OBJECT) {
                throw new IOException("Unterminated object at offset " + start);
            }
            return close(children, "}", start, "object");
        }

        private SyntaxNode array(int start) throws IOException {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(punctuation("[", start));
            cursor = start + 1;
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token == null) {
                    throw new IOException("Unterminated array at offset " + start);
                }
                separator(children);
                children.add(value(token, null));
            }
            return close(children, "]", start, "array");
        }

        private void separator(List<SyntaxNode> children) {
            if (children.size() > 1) {
                int comma = skipTrivia(text, cursor);
                if (comma < text.length() && text.charAt(comma) == ',') {
                    children.add(punctuation(",", comma));
                    cursor = comma + 1;
                }
            }
        }

        private SyntaxNode close(List<SyntaxNode> children, String bracket, int start, String kind) {
            int at = skipTrivia(text, cursor);
            children.add(punctuation(bracket, at));
            cursor = at + 1;
            return SyntaxNode.named(kind, source.positionAt(start), source.positionAt(at + 1), children);
        }

        private SyntaxNode leaf(String kind, int start, int end) {
            cursor = end;
            return SyntaxNode.leaf(kind, source.positionAt(start), source.positionAt(end));
        }

        private SyntaxNode punctuation(String symbol, int at) {
            return SyntaxNode.token(symbol, source.positionAt(at), source.positionAt(at + symbol.length()));
        }

        private int stringEnd(int start) {
            int i = start + 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == '"') {
                    return i + 1;
                }
                i++;
            }
            return text.length();
        }

        private int numberEnd(int start) {
            int i = start;
            while (i < text.length() && "0123456789+-.eE".indexOf(text.charAt(i)) >= 0) {
                i++;
            }
            return i;
        }

        /**
         * Offset of the next character that is neither whitespace nor part of a comment.
         */
        static int skipTrivia(String text, int from) {
            int i = from;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                    int eol = text.indexOf('\n', i);
                    i = eol < 0 ? text.length() : eol + 1;
                } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                    int close = text.indexOf("*/", i + 2);
                    i = close < 0 ? text.length() : close + 2;
                } else {
                    return i;
                }
            }
            return i;
        }
    }
}
