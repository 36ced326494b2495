package com.vcc.copilot.web;

import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.dto.ChatRequest;
import com.vcc.copilot.dto.ChatResponse;
import com.vcc.copilot.dto.ContextPreviewResponse;
import com.vcc.copilot.dto.RateLimitInfo;
import com.vcc.copilot.dto.UsageResponse;
import com.vcc.copilot.model.ContextDocument;
import com.vcc.copilot.model.DocumentKind;
import com.vcc.copilot.model.PortalPrincipal;
import com.vcc.copilot.service.CopilotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Portal copilot API. Authenticated by {@link PortalAuthenticationFilter}.
 */
@RestController
@RequestMapping("/portal/copilot")
public class CopilotController {
    private static final Logger log = LoggerFactory.getLogger(CopilotController.class);

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";

    private final CopilotService copilotService;
    private final int previewChars;

    public CopilotController(CopilotService copilotService, CopilotProperties properties) {
        this.copilotService = copilotService;
        this.previewChars = properties.getContext().getPreviewChars();
    }

    /**
     * Answer a question from the subject's project content.
     * POST /portal/copilot/chat
     */
    @PostMapping(path = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest request, ServerWebExchange exchange) {
        PortalPrincipal principal = PortalAuthenticationFilter.principal(exchange);
        String requestId = RequestIdFilter.requestId(exchange);

        return copilotService.chat(principal, request)
                .map(result -> {
                    List<ChatResponse.SourceRef> sources = result.documents().stream()
                            .map(doc -> new ChatResponse.SourceRef(doc.sourceLabel(), doc.score(), doc.kind().wireName()))
                            .toList();
                    ChatResponse body = ChatResponse.of(
                            new ChatResponse.Answer(result.generation().text(), result.generation().model(),
                                    result.generation().tokensUsed()),
                            sources,
                            RateLimitInfo.from(result.quota()));
                    return ResponseEntity.ok()
                            .headers(rateLimitHeaders(result.quota().limit(), result.quota().remaining(),
                                    result.quota().resetAt()))
                            .body(body);
                })
                .doOnSuccess(r -> log.info("requestId={} subjectId={} chat ok tokens={} sources={}",
                        requestId, principal.getSubjectId(),
                        r.getBody().data().tokensUsed(), r.getBody().context().size()))
                .doOnError(e -> log.info("requestId={} subjectId={} chat failed: {}",
                        requestId, principal.getSubjectId(), e.getMessage()));
    }

    /**
     * Today's usage and limits.
     * GET /portal/copilot/usage
     */
    @GetMapping("/usage")
    public Mono<ResponseEntity<UsageResponse>> usage(ServerWebExchange exchange) {
        PortalPrincipal principal = PortalAuthenticationFilter.principal(exchange);
        String requestId = RequestIdFilter.requestId(exchange);

        return copilotService.usage(principal)
                .map(snapshot -> ResponseEntity.ok()
                        .headers(rateLimitHeaders(snapshot.dailyLimit(), snapshot.remaining(), snapshot.resetAt()))
                        .body(UsageResponse.from(snapshot)))
                .doOnSuccess(r -> log.info("requestId={} subjectId={} usage", requestId, principal.getSubjectId()));
    }

    /**
     * Context the copilot would use for a project, without calling the model.
     * GET /portal/copilot/context/{containerId}?query=
     */
    @GetMapping("/context/{containerId}")
    public Mono<ContextPreviewResponse> context(@PathVariable UUID containerId,
                                                @RequestParam(name = "query", required = false) String query,
                                                ServerWebExchange exchange) {
        PortalPrincipal principal = PortalAuthenticationFilter.principal(exchange);
        String requestId = RequestIdFilter.requestId(exchange);

        return copilotService.previewContext(principal, containerId, query)
                .map(preview -> {
                    Map<String, Integer> counts = new LinkedHashMap<>();
                    for (DocumentKind kind : DocumentKind.values()) {
                        counts.put(kind.wireName(), preview.sourceCounts().getOrDefault(kind, 0));
                    }
                    List<ContextPreviewResponse.DocumentPreview> documents = preview.documents().stream()
                            .map(this::toPreview)
                            .toList();
                    return ContextPreviewResponse.of(new ContextPreviewResponse.Data(
                            containerId.toString(), preview.query(), counts, documents));
                })
                .doOnSuccess(r -> log.info("requestId={} subjectId={} context preview project={} documents={}",
                        requestId, principal.getSubjectId(), containerId, r.data().documents().size()));
    }

    private ContextPreviewResponse.DocumentPreview toPreview(ContextDocument document) {
        String text = document.text() != null ? document.text() : "";
        String preview = text.length() > previewChars ? text.substring(0, previewChars) + "..." : text;
        return new ContextPreviewResponse.DocumentPreview(document.sourceLabel(), document.kind().wireName(),
                document.score(), preview);
    }

    static HttpHeaders rateLimitHeaders(int limit, long remaining, Instant resetAt) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HEADER_LIMIT, String.valueOf(limit));
        headers.set(HEADER_REMAINING, String.valueOf(remaining));
        headers.set(HEADER_RESET, String.valueOf(resetAt.getEpochSecond()));
        return headers;
    }
}
