package com.vcc.copilot.model;

import java.util.Locale;

/**
 * Source of a context document. Each source carries its own base relevance weight.
 */
public enum DocumentKind {
    CONTAINER(0.9),
    TASK(0.8),
    MESSAGE(0.7),
    FILE(0.6);

    private final double baseWeight;

    DocumentKind(double baseWeight) {
        this.baseWeight = baseWeight;
    }

    public double baseWeight() {
        return baseWeight;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
