package com.vcc.copilot.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable identity of an authenticated portal user, resolved from the bearer credential.
 * Downstream components only ever see this object, never the raw credential.
 */
public class PortalPrincipal {

    private final UUID subjectId;
    private final UUID tenantId;
    private final String role;

    public PortalPrincipal(UUID subjectId, UUID tenantId, String role) {
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId");
        this.tenantId = tenantId;
        this.role = role;
    }

    public UUID getSubjectId() {
        return subjectId;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    public String getRole() {
        return role;
    }

    @Override
    public String toString() {
        return "PortalPrincipal{" +
                "subjectId='" + subjectId + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", role='" + role + '\'' +
                '}';
    }
}
