package com.vidnyan.semtree.application.port.out;

import com.vidnyan.semtree.domain.model.RawNode;
import com.vidnyan.semtree.domain.model.SourceText;

/**
 * Port to the external parser producing concrete syntax trees.
 * Implemented by adapters (e.g., JavaParser, Jackson, SnakeYAML).
 */
public interface CstParser {

    /**
     * Parser name for logging.
     */
    String getName();

    boolean supports(String language);

    /**
     * Parse one source. Recoverable syntax errors appear as {@code ERROR} nodes in the tree.
     * @throws com.vidnyan.semtree.domain.error.CstParseException when no tree can be produced
     */
    RawNode parse(SourceText source, String language);
}
