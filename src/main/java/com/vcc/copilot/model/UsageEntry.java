package com.vcc.copilot.model;

import com.vcc.copilot.error.ErrorKind;
import java.util.List;
import java.util.UUID;

/**
 * One audit row to append for a copilot request.
 */
public record UsageEntry(
        UUID subjectId,
        UUID tenantId,
        UUID projectId,
        int tokens,
        int creditsCharged,
        String model,
        boolean success,
        ErrorKind errorKind,
        String errorMessage,
        List<String> contextSources,
        long responseTimeMs
) {

    public static UsageEntry success(UUID subjectId, UUID tenantId, UUID projectId, int tokens,
                                     int credits, String model, List<String> sources, long elapsedMs) {
        return new UsageEntry(subjectId, tenantId, projectId, tokens, credits, model, true,
                null, null, sources, elapsedMs);
    }

    public static UsageEntry failure(UUID subjectId, UUID tenantId, UUID projectId, String model,
                                     ErrorKind errorKind, String errorMessage, long elapsedMs) {
        return new UsageEntry(subjectId, tenantId, projectId, 0, 0, model, false,
                errorKind, errorMessage, List.of(), elapsedMs);
    }
}
