package com.vidnyan.semtree.adapter.out.query;

import com.vidnyan.semtree.domain.build.KeySanitizer;
import com.vidnyan.semtree.domain.error.QueryException;
import com.vidnyan.semtree.domain.model.SemanticDocument;
import com.vidnyan.semtree.domain.model.SemanticNode;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.Text;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.util.Map;

/**
 * Mirrors a semantic tree into a W3C DOM rooted at {@code Files/File}. Every DOM element and text
 * node keeps a reference to the semantic node it mirrors, so query results map back to spans.
 */
final class DomProjection {

    static final String FILES = "Files";
    private static final String NODE_KEY = "semtree.node";

    private DomProjection() {
    }

    static Document project(SemanticDocument document) {
        Document dom;
        try {
            dom = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new QueryException("No DOM implementation available", e);
        }
        Element files = dom.createElement(FILES);
        dom.appendChild(files);
        files.appendChild(copy(dom, document.fileNode()));
        return dom;
    }

    /**
     * The semantic node behind a DOM node. Attributes resolve to their owner element and the
     * document resolves to the file node.
     */
    static SemanticNode semanticNode(Node node) {
        Node current = node;
        if (current instanceof Attr attribute) {
            current = attribute.getOwnerElement();
        }
        if (current instanceof Document dom) {
            current = dom.getDocumentElement().getFirstChild();
        }
        while (current != null) {
            Object mirrored = current.getUserData(NODE_KEY);
            if (mirrored instanceof SemanticNode semantic) {
                return semantic;
            }
            current = current.getParentNode();
        }
        return null;
    }

    private static Node copy(Document dom, SemanticNode node) {
        if (node.isText()) {
            Text text = dom.createTextNode(node.text());
            text.setUserData(NODE_KEY, node, null);
            return text;
        }
        String name = node.elementName();
        Element element = dom.createElement(KeySanitizer.isValidName(name) ? name : KeySanitizer.sanitize(name));
        for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
            element.setAttribute(attribute.getKey(), attribute.getValue());
        }
        element.setUserData(NODE_KEY, node, null);
        for (SemanticNode child : node.children()) {
            element.appendChild(copy(dom, child));
        }
        return element;
    }
}
