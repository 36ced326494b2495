package com.vcc.copilot.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

@Table("copilot_usage_log")
public class UsageRecordEntity {

    @Id
    @Column("id")
    private UUID id;

    @Column("contact_id")
    private UUID contactId;

    @Column("organization_id")
    private UUID organizationId;

    @Column("project_id")
    private UUID projectId;

    @Column("scope")
    private String scope;

    @Column("message_type")
    private String messageType;

    @Column("tokens_used")
    private Integer tokensUsed;

    @Column("credits_deducted")
    private Integer creditsDeducted;

    @Column("model_used")
    private String modelUsed;

    @Column("success")
    private boolean success;

    @Column("error_kind")
    private String errorKind;

    @Column("error_message")
    private String errorMessage;

    @Column("context_sources")
    private String contextSources;

    @Column("response_time_ms")
    private Integer responseTimeMs;

    @Column("created_at")
    private Instant createdAt;

    public UsageRecordEntity() {
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getContactId() {
        return contactId;
    }

    public void setContactId(UUID contactId) {
        this.contactId = contactId;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(UUID organizationId) {
        this.organizationId = organizationId;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public void setProjectId(UUID projectId) {
        this.projectId = projectId;
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    public String getMessageType() {
        return messageType;
    }

    public void setMessageType(String messageType) {
        this.messageType = messageType;
    }

    public Integer getTokensUsed() {
        return tokensUsed;
    }

    public void setTokensUsed(Integer tokensUsed) {
        this.tokensUsed = tokensUsed;
    }

    public Integer getCreditsDeducted() {
        return creditsDeducted;
    }

    public void setCreditsDeducted(Integer creditsDeducted) {
        this.creditsDeducted = creditsDeducted;
    }

    public String getModelUsed() {
        return modelUsed;
    }

    public void setModelUsed(String modelUsed) {
        this.modelUsed = modelUsed;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(String errorKind) {
        this.errorKind = errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getContextSources() {
        return contextSources;
    }

    public void setContextSources(String contextSources) {
        this.contextSources = contextSources;
    }

    public Integer getResponseTimeMs() {
        return responseTimeMs;
    }

    public void setResponseTimeMs(Integer responseTimeMs) {
        this.responseTimeMs = responseTimeMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
