package com.vcc.copilot.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Client-visible task row, read only through scoped queries in {@code TaskRepository}.
 */
@Table("todos")
public class TaskEntity {

    @Id
    @Column("id")
    private UUID id;

    @Column("project_id")
    private UUID projectId;

    @Column("title")
    private String title;

    @Column("description")
    private String description;

    @Column("status")
    private String status;

    @Column("priority")
    private String priority;

    @Column("due_date")
    private Instant dueDate;

    @Column("is_visible_to_client")
    private boolean visibleToClient;

    @Column("date_created")
    private Instant dateCreated;

    public TaskEntity() {
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public void setProjectId(UUID projectId) {
        this.projectId = projectId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public Instant getDueDate() {
        return dueDate;
    }

    public void setDueDate(Instant dueDate) {
        this.dueDate = dueDate;
    }

    public boolean isVisibleToClient() {
        return visibleToClient;
    }

    public void setVisibleToClient(boolean visibleToClient) {
        this.visibleToClient = visibleToClient;
    }

    public Instant getDateCreated() {
        return dateCreated;
    }

    public void setDateCreated(Instant dateCreated) {
        this.dateCreated = dateCreated;
    }
}
