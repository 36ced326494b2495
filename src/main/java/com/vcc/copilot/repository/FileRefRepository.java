package com.vcc.copilot.repository;

import com.vcc.copilot.entity.FileRefEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;
import java.util.UUID;

@org.springframework.stereotype.Repository
public interface FileRefRepository extends Repository<FileRefEntity, UUID> {

    @Query("SELECT f.id, pf.project_id, f.filename_download, f.title, f.type, f.filesize, "
            + "f.description, f.uploaded_on "
            + "FROM directus_files f "
            + "JOIN project_files pf ON pf.file_id = f.id "
            + "JOIN projects p ON p.id = pf.project_id AND p.is_client_visible = true "
            + "JOIN project_contacts pc ON pc.project_id = pf.project_id "
            + "AND pc.contact_id = :contactId AND pc.can_view_files = true "
            + "WHERE pf.project_id IN (:projectIds) AND pf.is_client_visible = true "
            + "ORDER BY f.uploaded_on DESC, f.id "
            + "LIMIT :limit")
    Flux<FileRefEntity> findSharedFiles(UUID contactId, Collection<UUID> projectIds, int limit);
}
