package com.vcc.copilot.web;

import com.vcc.copilot.auth.PortalTokenVerifier;
import com.vcc.copilot.error.AuthException;
import com.vcc.copilot.error.ErrorKind;
import com.vcc.copilot.error.QuotaExceededException;
import com.vcc.copilot.error.UpstreamException;
import com.vcc.copilot.model.ContextDocument;
import com.vcc.copilot.model.DocumentKind;
import com.vcc.copilot.model.GenerationResult;
import com.vcc.copilot.model.PortalPrincipal;
import com.vcc.copilot.model.QuotaStatus;
import com.vcc.copilot.model.ServiceTier;
import com.vcc.copilot.model.UsageSnapshot;
import com.vcc.copilot.service.CopilotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = CopilotController.class)
class CopilotControllerTest {

    private static final String TOKEN = "valid-token";
    private static final UUID SUBJECT = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-0000000000f1");
    private static final UUID PROJECT = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final Instant RESET = Instant.parse("2026-03-02T00:00:00Z");
    private static final String CHAT_BODY =
            "{\"messages\":[{\"role\":\"user\",\"content\":\"When is the website launch?\"}]}";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    CopilotService copilotService;

    @MockBean
    PortalTokenVerifier tokenVerifier;

    private final PortalPrincipal principal = new PortalPrincipal(SUBJECT, TENANT, "client");

    @BeforeEach
    void authenticate() {
        when(tokenVerifier.verify(TOKEN)).thenReturn(principal);
    }

    // ==================== Authentication ====================

    @Test
    void missingCredentialGetsGeneric401() {
        webTestClient.post().uri("/portal/copilot/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(CHAT_BODY)
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error.code").isEqualTo("UNAUTHORIZED")
                .jsonPath("$.error.message").isEqualTo("Authentication required");

        verifyNoInteractions(copilotService);
    }

    @Test
    void expiredCredentialGetsTheSame401() {
        when(tokenVerifier.verify("expired-token"))
                .thenThrow(new AuthException(AuthException.Reason.EXPIRED, "Credential expired"));

        webTestClient.get().uri("/portal/copilot/usage")
                .header(HttpHeaders.AUTHORIZATION, "Bearer expired-token")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("UNAUTHORIZED")
                .jsonPath("$.error.message").isEqualTo("Authentication required");
    }

    // ==================== Chat ====================

    @Test
    void chatReturnsAnswerSourcesAndRateLimitHeaders() {
        ContextDocument doc = ContextDocument.unscored(PROJECT, DocumentKind.CONTAINER,
                "Project: Website Redesign", "Project: Website Redesign", RESET, PROJECT).withScore(1.0);
        CopilotService.ChatResult result = new CopilotService.ChatResult(
                new GenerationResult("Launch is planned for May.", "test-model", 321, "stop"),
                List.of(doc),
                QuotaStatus.of(ServiceTier.FREE, 6, 100, RESET));
        when(copilotService.chat(eq(principal), any())).thenReturn(Mono.just(result));

        webTestClient.post().uri("/portal/copilot/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(CHAT_BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("X-RateLimit-Limit", "100")
                .expectHeader().valueEquals("X-RateLimit-Remaining", "94")
                .expectHeader().valueEquals("X-RateLimit-Reset", String.valueOf(RESET.getEpochSecond()))
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.data.message").isEqualTo("Launch is planned for May.")
                .jsonPath("$.data.model").isEqualTo("test-model")
                .jsonPath("$.data.tokensUsed").isEqualTo(321)
                .jsonPath("$.context[0].source").isEqualTo("Project: Website Redesign")
                .jsonPath("$.context[0].type").isEqualTo("container")
                .jsonPath("$.context[0].relevance").isEqualTo(1.0)
                .jsonPath("$.rateLimit.tier").isEqualTo("free")
                .jsonPath("$.rateLimit.remaining").isEqualTo(94);
    }

    @Test
    void exhaustedQuotaGets429WithUpgradeHint() {
        QuotaStatus exhausted = QuotaStatus.of(ServiceTier.FREE, 100, 100, RESET);
        when(copilotService.chat(eq(principal), any()))
                .thenReturn(Mono.error(new QuotaExceededException(exhausted, "/portal/billing/upgrade")));

        webTestClient.post().uri("/portal/copilot/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(CHAT_BODY)
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals("X-RateLimit-Remaining", "0")
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error.code").isEqualTo("RATE_LIMIT_EXCEEDED")
                .jsonPath("$.rateLimit.remaining").isEqualTo(0)
                .jsonPath("$.rateLimit.dailyLimit").isEqualTo(100)
                .jsonPath("$.blockedUntil").isEqualTo("2026-03-02T00:00:00Z")
                .jsonPath("$.upgradeUrl").isEqualTo("/portal/billing/upgrade");
    }

    @Test
    void upstreamFailureGets503Retryable() {
        when(copilotService.chat(eq(principal), any()))
                .thenReturn(Mono.error(new UpstreamException(ErrorKind.UPSTREAM_UNAVAILABLE, "Provider unavailable")));

        webTestClient.post().uri("/portal/copilot/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(CHAT_BODY)
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("UPSTREAM_UNAVAILABLE")
                .jsonPath("$.error.retryable").isEqualTo(true);
    }

    @Test
    void unparseableBodyGets400() {
        webTestClient.post().uri("/portal/copilot/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"messages\": [")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error.code").isEqualTo("VALIDATION_ERROR");

        verifyNoInteractions(copilotService);
    }

    // ==================== Usage & Preview ====================

    @Test
    void usageReportsTodayAndLimits() {
        when(copilotService.usage(principal))
                .thenReturn(Mono.just(new UsageSnapshot(ServiceTier.STANDARD, 12, 4800, 2, 500, 2048, RESET)));

        webTestClient.get().uri("/portal/copilot/usage")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("X-RateLimit-Limit", "500")
                .expectHeader().valueEquals("X-RateLimit-Remaining", "488")
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.data.tier").isEqualTo("standard")
                .jsonPath("$.data.usage.requestsToday").isEqualTo(12)
                .jsonPath("$.data.usage.tokensToday").isEqualTo(4800)
                .jsonPath("$.data.usage.errorCount").isEqualTo(2)
                .jsonPath("$.data.limits.dailyLimit").isEqualTo(500)
                .jsonPath("$.data.limits.maxTokensPerRequest").isEqualTo(2048)
                .jsonPath("$.data.remaining").isEqualTo(488);
    }

    @Test
    void contextPreviewListsCountsAndTruncatedDocuments() {
        String longText = "x".repeat(250);
        ContextDocument task = ContextDocument.unscored(UUID.randomUUID(), DocumentKind.TASK,
                "Task: Homepage copy", longText, RESET, PROJECT);
        Map<DocumentKind, Integer> counts = new EnumMap<>(DocumentKind.class);
        counts.put(DocumentKind.TASK, 3);
        when(copilotService.previewContext(principal, PROJECT, "homepage"))
                .thenReturn(Mono.just(new CopilotService.ContextPreview(PROJECT, "homepage",
                        counts, List.of(task))));

        webTestClient.get().uri("/portal/copilot/context/{id}?query=homepage", PROJECT)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.projectId").isEqualTo(PROJECT.toString())
                .jsonPath("$.data.query").isEqualTo("homepage")
                .jsonPath("$.data.sourceCounts.task").isEqualTo(3)
                .jsonPath("$.data.sourceCounts.file").isEqualTo(0)
                .jsonPath("$.data.documents[0].source").isEqualTo("Task: Homepage copy")
                .jsonPath("$.data.documents[0].type").isEqualTo("task")
                .jsonPath("$.data.documents[0].preview").isEqualTo("x".repeat(200) + "...");
    }

    @Test
    void requestIdIsEchoedOrAssigned() {
        when(copilotService.usage(principal))
                .thenReturn(Mono.just(new UsageSnapshot(ServiceTier.FREE, 0, 0, 0, 100, 1024, RESET)));

        webTestClient.get().uri("/portal/copilot/usage")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .header(RequestIdFilter.REQUEST_ID_HEADER, "req-42")
                .exchange()
                .expectHeader().valueEquals(RequestIdFilter.REQUEST_ID_HEADER, "req-42");

        webTestClient.get().uri("/portal/copilot/usage")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectHeader().exists(RequestIdFilter.REQUEST_ID_HEADER);
    }
}
