package com.vcc.copilot.repository;

import com.vcc.copilot.entity.TaskEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;
import java.util.UUID;

@org.springframework.stereotype.Repository
public interface TaskRepository extends Repository<TaskEntity, UUID> {

    @Query("SELECT t.id, t.project_id, t.title, t.description, t.status, t.priority, t.due_date, "
            + "t.is_visible_to_client, t.date_created "
            + "FROM todos t "
            + "JOIN projects p ON p.id = t.project_id AND p.is_client_visible = true "
            + "JOIN project_contacts pc ON pc.project_id = t.project_id "
            + "AND pc.contact_id = :contactId AND pc.can_view_tasks = true "
            + "WHERE t.project_id IN (:projectIds) AND t.is_visible_to_client = true "
            + "ORDER BY t.date_created DESC, t.id "
            + "LIMIT :limit")
    Flux<TaskEntity> findVisibleTasks(UUID contactId, Collection<UUID> projectIds, int limit);
}
