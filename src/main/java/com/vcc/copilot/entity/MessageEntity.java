package com.vcc.copilot.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Conversation message joined with its conversation. {@code conversation_title} and
 * {@code project_id} are supplied by the join in {@code MessageRepository}.
 */
@Table("messages")
public class MessageEntity {

    @Id
    @Column("id")
    private UUID id;

    @Column("conversation_id")
    private UUID conversationId;

    @Column("conversation_title")
    private String conversationTitle;

    @Column("project_id")
    private UUID projectId;

    @Column("text")
    private String text;

    @Column("is_internal_note")
    private boolean internalNote;

    @Column("created_at")
    private Instant createdAt;

    public MessageEntity() {
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getConversationId() {
        return conversationId;
    }

    public void setConversationId(UUID conversationId) {
        this.conversationId = conversationId;
    }

    public String getConversationTitle() {
        return conversationTitle;
    }

    public void setConversationTitle(String conversationTitle) {
        this.conversationTitle = conversationTitle;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public void setProjectId(UUID projectId) {
        this.projectId = projectId;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public boolean isInternalNote() {
        return internalNote;
    }

    public void setInternalNote(boolean internalNote) {
        this.internalNote = internalNote;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
