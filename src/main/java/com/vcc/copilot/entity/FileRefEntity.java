package com.vcc.copilot.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Shared file metadata (never file bytes). {@code project_id} comes from the
 * {@code project_files} join in {@code FileRefRepository}.
 */
@Table("directus_files")
public class FileRefEntity {

    @Id
    @Column("id")
    private UUID id;

    @Column("project_id")
    private UUID projectId;

    @Column("filename_download")
    private String filenameDownload;

    @Column("title")
    private String title;

    @Column("type")
    private String type;

    @Column("filesize")
    private Long filesize;

    @Column("description")
    private String description;

    @Column("uploaded_on")
    private Instant uploadedOn;

    public FileRefEntity() {
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

    public String getFilenameDownload() {
        return filenameDownload;
    }

    public void setFilenameDownload(String filenameDownload) {
        this.filenameDownload = filenameDownload;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Long getFilesize() {
        return filesize;
    }

    public void setFilesize(Long filesize) {
        this.filesize = filesize;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getUploadedOn() {
        return uploadedOn;
    }

    public void setUploadedOn(Instant uploadedOn) {
        this.uploadedOn = uploadedOn;
    }
}
