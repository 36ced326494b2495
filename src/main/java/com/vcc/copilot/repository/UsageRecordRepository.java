package com.vcc.copilot.repository;

import com.vcc.copilot.entity.UsageRecordEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface UsageRecordRepository extends ReactiveCrudRepository<UsageRecordEntity, UUID> {

    /**
     * Requests that count against the daily quota. Denied attempts are excluded.
     */
    @Query("SELECT COUNT(*) FROM copilot_usage_log "
            + "WHERE contact_id = :contactId AND created_at >= :since "
            + "AND (error_kind IS NULL OR error_kind <> 'QUOTA_EXCEEDED')")
    Mono<Long> countChargeableSince(UUID contactId, Instant since);

    @Query("SELECT COALESCE(SUM(tokens_used), 0) FROM copilot_usage_log "
            + "WHERE contact_id = :contactId AND created_at >= :since")
    Mono<Long> sumTokensSince(UUID contactId, Instant since);

    @Query("SELECT COUNT(*) FROM copilot_usage_log "
            + "WHERE contact_id = :contactId AND created_at >= :since AND success = false")
    Mono<Long> countFailuresSince(UUID contactId, Instant since);
}
