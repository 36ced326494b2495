package com.vcc.copilot.dto;

import java.util.List;

/**
 * Response DTO for a successful chat turn.
 */
public record ChatResponse(
        boolean success,
        Answer data,
        List<SourceRef> context,
        RateLimitInfo rateLimit
) {
    public record Answer(String message, String model, int tokensUsed) {
    }

    public record SourceRef(String source, double relevance, String type) {
    }

    public static ChatResponse of(Answer data, List<SourceRef> context, RateLimitInfo rateLimit) {
        return new ChatResponse(true, data, context, rateLimit);
    }
}
