package com.vcc.copilot.dto;

import com.vcc.copilot.model.QuotaStatus;

import java.time.Instant;

public record RateLimitInfo(
        String tier,
        long used,
        int dailyLimit,
        long remaining,
        Instant resetAt
) {
    public static RateLimitInfo from(QuotaStatus status) {
        return new RateLimitInfo(status.tier().wireName(), status.used(), status.limit(),
                status.remaining(), status.resetAt());
    }
}
