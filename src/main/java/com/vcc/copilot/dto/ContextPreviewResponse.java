package com.vcc.copilot.dto;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the context preview endpoint. Shows what the copilot would see, without calling it.
 */
public record ContextPreviewResponse(boolean success, Data data) {

    public record Data(String projectId, String query, Map<String, Integer> sourceCounts, List<DocumentPreview> documents) {
    }

    public record DocumentPreview(String source, String type, double relevance, String preview) {
    }

    public static ContextPreviewResponse of(Data data) {
        return new ContextPreviewResponse(true, data);
    }
}
