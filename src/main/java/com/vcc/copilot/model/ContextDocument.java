package com.vcc.copilot.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Request-scoped snippet selected for prompt injection. Never persisted.
 */
public record ContextDocument(
        UUID id,
        DocumentKind kind,
        String sourceLabel,
        String text,
        double baseWeight,
        double score,
        Instant timestamp,
        UUID projectId
) {

    public static ContextDocument unscored(UUID id, DocumentKind kind, String sourceLabel,
                                           String text, Instant timestamp, UUID projectId) {
        double weight = kind.baseWeight();
        return new ContextDocument(id, kind, sourceLabel, text, weight, weight, timestamp, projectId);
    }

    public ContextDocument withScore(double newScore) {
        return new ContextDocument(id, kind, sourceLabel, text, baseWeight, newScore, timestamp, projectId);
    }

    public ContextDocument withText(String newText) {
        return new ContextDocument(id, kind, sourceLabel, newText, baseWeight, score, timestamp, projectId);
    }
}
