package com.vcc.copilot.service;

import com.vcc.copilot.model.ContextDocument;

import java.util.List;

/**
 * Scores context candidates against a query and orders them best-first.
 * Implementations must be deterministic: equal inputs give an equal ordering.
 */
public interface RelevanceRanker {

    List<ContextDocument> rank(String query, List<ContextDocument> candidates);
}
