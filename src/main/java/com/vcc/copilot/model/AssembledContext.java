package com.vcc.copilot.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ranked context selection plus how many candidates each source contributed before selection.
 */
public record AssembledContext(Map<DocumentKind, Integer> sourceCounts, List<ContextDocument> documents) {

    public static AssembledContext empty() {
        Map<DocumentKind, Integer> counts = new EnumMap<>(DocumentKind.class);
        for (DocumentKind kind : DocumentKind.values()) {
            counts.put(kind, 0);
        }
        return new AssembledContext(counts, List.of());
    }
}
