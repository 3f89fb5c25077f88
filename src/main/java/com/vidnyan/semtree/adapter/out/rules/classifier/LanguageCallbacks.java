package com.vidnyan.semtree.adapter.out.rules.classifier;

import com.vidnyan.semtree.domain.rule.IdentifierClassifier;
import com.vidnyan.semtree.domain.rule.IdentifierContext;

/**
 * The two identifier callbacks of a rule table, registered as a bean and referenced by name
 * from the table's {@code callbacks} entry.
 */
public interface LanguageCallbacks extends IdentifierClassifier, IdentifierContext {

    String getName();
}
