package com.vidnyan.semtree.adapter.out.query;

import com.vidnyan.semtree.application.port.out.QueryEngine;
import com.vidnyan.semtree.domain.error.QueryException;
import com.vidnyan.semtree.domain.model.QueryMatch;
import com.vidnyan.semtree.domain.model.SemanticDocument;
import com.vidnyan.semtree.domain.model.SemanticNode;
import com.vidnyan.semtree.domain.model.Span;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Node;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathEvaluationResult;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import javax.xml.xpath.XPathNodes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * XPath 1.0 implementation of QueryEngine using the JDK evaluator.
 */
@Slf4j
@Component
public class XPathQueryEngine implements QueryEngine {

    @Override
    public List<QueryMatch> evaluate(SemanticDocument document, String expression) {
        Document dom = DomProjection.project(document);
        XPath xpath = XPathFactory.newInstance().newXPath();

        XPathEvaluationResult<?> result;
        try {
            result = xpath.evaluateExpression(expression, dom);
        } catch (XPathExpressionException e) {
            throw new QueryException("Invalid query '" + expression + "': " + rootMessage(e), e);
        }

        List<QueryMatch> matches = new ArrayList<>();
        switch (result.type()) {
            case NODESET -> {
                for (Node node : (XPathNodes) result.value()) {
                    matches.add(match(document, node));
                }
            }
            case NODE -> matches.add(match(document, (Node) result.value()));
            case NUMBER -> matches.add(QueryMatch.scalar(document.path(), formatNumber((Number) result.value())));
            default -> matches.add(QueryMatch.scalar(document.path(), String.valueOf(result.value())));
        }
        log.debug("{} matched {} results in {}", expression, matches.size(), document.path());
        return matches;
    }

    private QueryMatch match(SemanticDocument document, Node node) {
        SemanticNode target = DomProjection.semanticNode(node);
        String value = node.getNodeType() == Node.ATTRIBUTE_NODE || target == null
                ? node.getTextContent()
                : target.stringValue();
        Optional<Span> span = target == null ? Optional.empty() : target.resolveSpan();
        if (span.isEmpty()) {
            return QueryMatch.scalar(document.path(), value);
        }
        Span location = span.get();
        return QueryMatch.at(document.path(), location, value,
                document.source().lines(location.start().line(), location.end().line()));
    }

    static String formatNumber(Number number) {
        double value = number.doubleValue();
        if (!Double.isInfinite(value) && value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : error.getMessage();
    }
}
