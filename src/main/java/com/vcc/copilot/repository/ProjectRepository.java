package com.vcc.copilot.repository;

import com.vcc.copilot.entity.ProjectEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;
import java.util.UUID;

@Repository
public interface ProjectRepository extends ReactiveCrudRepository<ProjectEntity, UUID> {

    /**
     * Client-visible projects the contact holds a grant for.
     */
    @Query("SELECT p.* FROM projects p "
            + "JOIN project_contacts pc ON pc.project_id = p.id "
            + "WHERE pc.contact_id = :contactId AND p.is_client_visible = true "
            + "ORDER BY p.date_created DESC, p.id")
    Flux<ProjectEntity> findAccessibleByContactId(UUID contactId);

    @Query("SELECT p.* FROM projects p "
            + "JOIN project_contacts pc ON pc.project_id = p.id AND pc.contact_id = :contactId "
            + "WHERE p.id IN (:projectIds) AND p.is_client_visible = true "
            + "ORDER BY p.date_created DESC, p.id")
    Flux<ProjectEntity> findScopedDescriptions(UUID contactId, Collection<UUID> projectIds);
}
