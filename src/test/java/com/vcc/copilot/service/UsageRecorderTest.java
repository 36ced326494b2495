package com.vcc.copilot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.copilot.entity.UsageRecordEntity;
import com.vcc.copilot.error.ErrorKind;
import com.vcc.copilot.model.UsageEntry;
import com.vcc.copilot.repository.UsageRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UsageRecorderTest {

    private static final UUID SUBJECT = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-0000000000f1");
    private static final UUID PROJECT = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final Instant NOW = Instant.parse("2026-03-01T15:30:00Z");

    @Mock
    UsageRecordRepository usageRecordRepository;

    private UsageRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new UsageRecorder(usageRecordRepository, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void successRowCarriesTokensCreditsAndSources() {
        when(usageRecordRepository.save(any(UsageRecordEntity.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        UsageEntry entry = UsageEntry.success(SUBJECT, TENANT, PROJECT, 321, 1, "gpt-4o-mini",
                List.of("Project: Website Redesign", "Task: Approve wireframes"), 840);

        StepVerifier.create(recorder.record(entry)).verifyComplete();

        UsageRecordEntity saved = captureSaved();
        assertThat(saved.getContactId()).isEqualTo(SUBJECT);
        assertThat(saved.getOrganizationId()).isEqualTo(TENANT);
        assertThat(saved.getProjectId()).isEqualTo(PROJECT);
        assertThat(saved.getScope()).isEqualTo(UsageRecorder.SCOPE_PROJECT);
        assertThat(saved.getMessageType()).isEqualTo(UsageRecorder.MESSAGE_TYPE_CHAT);
        assertThat(saved.getTokensUsed()).isEqualTo(321);
        assertThat(saved.getCreditsDeducted()).isEqualTo(1);
        assertThat(saved.isSuccess()).isTrue();
        assertThat(saved.getErrorKind()).isNull();
        assertThat(saved.getContextSources())
                .isEqualTo("[\"Project: Website Redesign\",\"Task: Approve wireframes\"]");
        assertThat(saved.getResponseTimeMs()).isEqualTo(840);
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void failureRowHasNoTokensAndKeepsTheErrorKind() {
        when(usageRecordRepository.save(any(UsageRecordEntity.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        UsageEntry entry = UsageEntry.failure(SUBJECT, TENANT, null, "gpt-4o-mini",
                ErrorKind.UPSTREAM_TIMEOUT, "x".repeat(2000), 60_000);

        StepVerifier.create(recorder.record(entry)).verifyComplete();

        UsageRecordEntity saved = captureSaved();
        assertThat(saved.getScope()).isEqualTo(UsageRecorder.SCOPE_PORTAL);
        assertThat(saved.isSuccess()).isFalse();
        assertThat(saved.getTokensUsed()).isZero();
        assertThat(saved.getCreditsDeducted()).isZero();
        assertThat(saved.getErrorKind()).isEqualTo("UPSTREAM_TIMEOUT");
        assertThat(saved.getErrorMessage()).hasSize(UsageRecorder.MAX_ERROR_MESSAGE_LENGTH);
        assertThat(saved.getContextSources()).isEqualTo("[]");
    }

    @Test
    void insertFailurePropagates() {
        when(usageRecordRepository.save(any(UsageRecordEntity.class)))
                .thenReturn(Mono.error(new IllegalStateException("connection reset")));

        UsageEntry entry = UsageEntry.failure(SUBJECT, TENANT, null, null, ErrorKind.INTERNAL, "boom", 5);

        StepVerifier.create(recorder.record(entry))
                .expectErrorMessage("connection reset")
                .verify();
    }

    private UsageRecordEntity captureSaved() {
        ArgumentCaptor<UsageRecordEntity> captor = ArgumentCaptor.forClass(UsageRecordEntity.class);
        verify(usageRecordRepository).save(captor.capture());
        return captor.getValue();
    }
}
