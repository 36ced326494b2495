package com.vcc.copilot.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Projects a subject may read. Every content fetch is keyed by these ids.
 */
public record AccessScope(Set<UUID> projectIds) {

    public AccessScope {
        projectIds = Collections.unmodifiableSet(new LinkedHashSet<>(projectIds));
    }

    public static AccessScope empty() {
        return new AccessScope(Set.of());
    }

    public static AccessScope of(Collection<UUID> projectIds) {
        return new AccessScope(new LinkedHashSet<>(projectIds));
    }

    public boolean isEmpty() {
        return projectIds.isEmpty();
    }

    public boolean contains(UUID projectId) {
        return projectIds.contains(projectId);
    }
}
