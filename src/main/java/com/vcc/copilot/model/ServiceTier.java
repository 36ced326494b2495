package com.vcc.copilot.model;

import java.util.Locale;

/**
 * Tenant service tier, ordered from least to most capacity.
 */
public enum ServiceTier {
    FREE,
    STANDARD,
    PREMIUM,
    UNLIMITED;

    /**
     * Parse a stored tier value; unknown or blank values fall back to FREE.
     */
    public static ServiceTier normalize(String value) {
        if (value == null || value.isBlank()) {
            return FREE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return FREE;
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
