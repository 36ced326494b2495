package com.vcc.copilot.model;

import java.time.Instant;

/**
 * Today's usage totals for one subject.
 */
public record UsageSnapshot(
        ServiceTier tier,
        long requestsToday,
        long tokensToday,
        long errorCount,
        int dailyLimit,
        int maxTokensPerRequest,
        Instant resetAt
) {

    public long remaining() {
        return Math.max(0, dailyLimit - requestsToday);
    }
}
