package com.vidnyan.semtree.application.port.out;

import com.vidnyan.semtree.domain.model.QueryMatch;
import com.vidnyan.semtree.domain.model.SemanticDocument;

import java.util.List;

/**
 * Port to the path-query evaluator.
 */
public interface QueryEngine {

    /**
     * Evaluate a query against one file's semantic tree.
     * @throws com.vidnyan.semtree.domain.error.QueryException when the expression is invalid
     */
    List<QueryMatch> evaluate(SemanticDocument document, String expression);
}
