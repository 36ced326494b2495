package com.vcc.copilot.model;

import java.time.Instant;

/**
 * Result of a quota pre-check for one subject.
 */
public record QuotaStatus(
        boolean allowed,
        ServiceTier tier,
        long used,
        int limit,
        long remaining,
        Instant resetAt
) {

    public static QuotaStatus of(ServiceTier tier, long used, int limit, Instant resetAt) {
        return new QuotaStatus(used < limit, tier, used, limit, Math.max(0, limit - used), resetAt);
    }

    /**
     * Status as it will read once the current request has been recorded.
     */
    public QuotaStatus afterOneRequest() {
        return of(tier, used + 1, limit, resetAt);
    }
}
