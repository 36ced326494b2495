package com.vcc.copilot.repository;

import com.vcc.copilot.entity.MessageEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;
import java.util.UUID;

@org.springframework.stereotype.Repository
public interface MessageRepository extends Repository<MessageEntity, UUID> {

    /**
     * Non-internal messages from conversations the contact participates in, on client-visible
     * projects the contact holds a grant for.
     */
    @Query("SELECT m.id, m.conversation_id, c.title AS conversation_title, c.item AS project_id, "
            + "m.text, m.is_internal_note, m.created_at "
            + "FROM messages m "
            + "JOIN conversations c ON c.id = m.conversation_id "
            + "JOIN projects p ON p.id = c.item AND p.is_client_visible = true "
            + "JOIN project_contacts pc ON pc.project_id = c.item AND pc.contact_id = :contactId "
            + "JOIN conversation_participants cp ON cp.conversation_id = c.id AND cp.contact_id = :contactId "
            + "WHERE c.collection = 'projects' AND c.item IN (:projectIds) "
            + "AND m.is_internal_note = false "
            + "ORDER BY m.created_at DESC, m.id "
            + "LIMIT :limit")
    Flux<MessageEntity> findParticipantMessages(UUID contactId, Collection<UUID> projectIds, int limit);
}
