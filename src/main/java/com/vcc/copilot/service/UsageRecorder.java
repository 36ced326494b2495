package com.vcc.copilot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.copilot.entity.UsageRecordEntity;
import com.vcc.copilot.model.UsageEntry;
import com.vcc.copilot.repository.UsageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Appends one row to the copilot usage log per request, successful or not.
 */
@Service
public class UsageRecorder {
    private static final Logger log = LoggerFactory.getLogger(UsageRecorder.class);

    public static final String SCOPE_PROJECT = "project";
    public static final String SCOPE_PORTAL = "portal";
    public static final String MESSAGE_TYPE_CHAT = "chat";

    static final int MAX_ERROR_MESSAGE_LENGTH = 500;

    private final UsageRecordRepository usageRecordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public UsageRecorder(UsageRecordRepository usageRecordRepository,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.usageRecordRepository = usageRecordRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Insert the usage row. Errors from the insert are logged and propagated.
     */
    public Mono<Void> record(UsageEntry entry) {
        UsageRecordEntity entity = toEntity(entry);
        return usageRecordRepository.save(entity)
                .doOnSuccess(saved -> log.info("Usage: subject={} project={} success={} tokens={} credits={} kind={} elapsedMs={}",
                        entry.subjectId(), entry.projectId(), entry.success(), entry.tokens(),
                        entry.creditsCharged(), entry.errorKind(), entry.responseTimeMs()))
                .doOnError(e -> log.error("Failed to save usage record for subject {}: {}",
                        entry.subjectId(), e.getMessage()))
                .then();
    }

    UsageRecordEntity toEntity(UsageEntry entry) {
        UsageRecordEntity entity = new UsageRecordEntity();
        entity.setContactId(entry.subjectId());
        entity.setOrganizationId(entry.tenantId());
        entity.setProjectId(entry.projectId());
        entity.setScope(entry.projectId() != null ? SCOPE_PROJECT : SCOPE_PORTAL);
        entity.setMessageType(MESSAGE_TYPE_CHAT);
        entity.setTokensUsed(entry.tokens());
        entity.setCreditsDeducted(entry.creditsCharged());
        entity.setModelUsed(entry.model());
        entity.setSuccess(entry.success());
        entity.setErrorKind(entry.errorKind() != null ? entry.errorKind().name() : null);
        entity.setErrorMessage(truncate(entry.errorMessage()));
        entity.setContextSources(sourcesJson(entry));
        entity.setResponseTimeMs((int) Math.min(Integer.MAX_VALUE, Math.max(0, entry.responseTimeMs())));
        entity.setCreatedAt(clock.instant());
        return entity;
    }

    private String sourcesJson(UsageEntry entry) {
        if (entry.contextSources() == null || entry.contextSources().isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(entry.contextSources());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize context sources: {}", e.getMessage());
            return "[]";
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
