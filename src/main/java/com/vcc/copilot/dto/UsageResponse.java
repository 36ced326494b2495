package com.vcc.copilot.dto;

import com.vcc.copilot.model.UsageSnapshot;

import java.time.Instant;

/**
 * Response DTO for today's copilot usage.
 */
public record UsageResponse(boolean success, Data data) {

    public record Data(String tier, Usage usage, Limits limits, long remaining, Instant resetAt) {
    }

    public record Usage(long requestsToday, long tokensToday, long errorCount) {
    }

    public record Limits(int dailyLimit, int maxTokensPerRequest) {
    }

    public static UsageResponse from(UsageSnapshot snapshot) {
        return new UsageResponse(true, new Data(
                snapshot.tier().wireName(),
                new Usage(snapshot.requestsToday(), snapshot.tokensToday(), snapshot.errorCount()),
                new Limits(snapshot.dailyLimit(), snapshot.maxTokensPerRequest()),
                snapshot.remaining(),
                snapshot.resetAt()));
    }
}
