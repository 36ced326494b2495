package com.vcc.copilot.service;

import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.dto.ChatRequest;
import com.vcc.copilot.entity.ContactEntity;
import com.vcc.copilot.error.AccessDeniedException;
import com.vcc.copilot.error.CopilotException;
import com.vcc.copilot.error.ErrorKind;
import com.vcc.copilot.error.QuotaExceededException;
import com.vcc.copilot.error.ValidationException;
import com.vcc.copilot.model.AccessScope;
import com.vcc.copilot.model.ChatTurn;
import com.vcc.copilot.model.ContextDocument;
import com.vcc.copilot.model.DocumentKind;
import com.vcc.copilot.model.GenerationOptions;
import com.vcc.copilot.model.GenerationResult;
import com.vcc.copilot.model.PortalPrincipal;
import com.vcc.copilot.model.QuotaStatus;
import com.vcc.copilot.model.UsageEntry;
import com.vcc.copilot.model.UsageSnapshot;
import com.vcc.copilot.repository.ContactRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Request orchestration for the portal copilot.
 *
 * <p>Chat flow: subject check, validation, quota pre-check, scope resolution, context assembly,
 * generation, usage recording. Once the subject is known every failure writes a usage row before
 * the error reaches the caller.
 */
@Service
public class CopilotService {
    private static final Logger log = LoggerFactory.getLogger(CopilotService.class);

    private final boolean enabled;
    private final String upgradeUrl;
    private final CopilotProperties properties;
    private final Validator validator;
    private final ContactRepository contactRepository;
    private final QuotaLedger quotaLedger;
    private final AccessScopeResolver accessScopeResolver;
    private final ContextAssembler contextAssembler;
    private final ResponseGenerator responseGenerator;
    private final UsageRecorder usageRecorder;
    private final Clock clock;

    public CopilotService(CopilotProperties properties,
                          Validator validator,
                          ContactRepository contactRepository,
                          QuotaLedger quotaLedger,
                          AccessScopeResolver accessScopeResolver,
                          ContextAssembler contextAssembler,
                          ResponseGenerator responseGenerator,
                          UsageRecorder usageRecorder,
                          Clock clock) {
        this.enabled = properties.isEnabled();
        this.upgradeUrl = properties.getQuota().getUpgradeUrl();
        this.properties = properties;
        this.validator = validator;
        this.contactRepository = contactRepository;
        this.quotaLedger = quotaLedger;
        this.accessScopeResolver = accessScopeResolver;
        this.contextAssembler = contextAssembler;
        this.responseGenerator = responseGenerator;
        this.usageRecorder = usageRecorder;
        this.clock = clock;
        log.info("CopilotService initialized: enabled={}", enabled);
    }

    /**
     * Answer of one chat turn with the sources it was grounded on and the quota as it now reads.
     */
    public record ChatResult(GenerationResult generation, List<ContextDocument> documents, QuotaStatus quota) {
    }

    /**
     * What the copilot would see for a project and query.
     */
    public record ContextPreview(UUID projectId, String query, Map<DocumentKind, Integer> sourceCounts,
                                 List<ContextDocument> documents) {
    }

    // ==================== Chat ====================

    public Mono<ChatResult> chat(PortalPrincipal principal, ChatRequest request) {
        if (!enabled) {
            return Mono.error(disabled());
        }
        return resolveSubject(principal)
                .flatMap(contact -> {
                    Attempt attempt = new Attempt(contact.getId(), contact.getOrganizationId(), clock.millis());
                    return Mono.defer(() -> runChat(attempt, request))
                            .onErrorResume(e -> recordFailure(attempt, e).then(Mono.error(e)));
                });
    }

    private Mono<ChatResult> runChat(Attempt attempt, ChatRequest request) {
        validate(request);
        List<ChatTurn> turns = request.messages().stream()
                .map(m -> new ChatTurn(m.role(), m.content()))
                .toList();
        String query = lastUserMessage(turns);
        UUID requestedProjectId = request.projectUuid();

        return quotaLedger.checkAndReserve(attempt.subjectId, attempt.tenantId)
                .flatMap(quota -> {
                    if (!quota.allowed()) {
                        return Mono.error(new QuotaExceededException(quota, upgradeUrl));
                    }
                    return resolveChatScope(attempt.subjectId, requestedProjectId)
                            .flatMap(scope -> {
                                if (requestedProjectId != null && scope.contains(requestedProjectId)) {
                                    attempt.projectId = requestedProjectId;
                                }
                                GenerationOptions options = responseGenerator.effectiveOptions(
                                        quota.tier(), request.temperature(), request.maxTokens());
                                attempt.model = options.model();
                                return contextAssembler.build(attempt.subjectId, query, scope)
                                        .flatMap(documents -> generateDetached(attempt, turns, documents, options, quota));
                            });
                });
    }

    /**
     * Resolve the requested project; fall back to every accessible project when it is not visible.
     */
    private Mono<AccessScope> resolveChatScope(UUID subjectId, UUID requestedProjectId) {
        return accessScopeResolver.resolve(subjectId, requestedProjectId)
                .flatMap(scope -> {
                    if (scope.isEmpty() && requestedProjectId != null) {
                        log.debug("Requested project {} not in scope for subject {}, using full scope",
                                requestedProjectId, subjectId);
                        return accessScopeResolver.resolve(subjectId, null);
                    }
                    return Mono.just(scope);
                })
                .flatMap(scope -> scope.isEmpty()
                        ? Mono.error(new AccessDeniedException("NO_ACCESSIBLE_PROJECTS",
                                "No projects are available to the copilot for this account"))
                        : Mono.just(scope));
    }

    /**
     * Generation and its usage row keep running if the caller goes away, so provider spend is
     * always accounted.
     */
    private Mono<ChatResult> generateDetached(Attempt attempt, List<ChatTurn> turns,
                                              List<ContextDocument> documents,
                                              GenerationOptions options, QuotaStatus quota) {
        int credits = properties.tierConfig(quota.tier()).getCreditsPerRequest();
        List<String> sources = documents.stream().map(ContextDocument::sourceLabel).toList();

        Mono<ChatResult> work = responseGenerator.respond(turns, documents, options)
                .flatMap(result -> {
                    ChatResult chatResult = new ChatResult(result, documents, quota.afterOneRequest());
                    if (!attempt.markRecorded()) {
                        return Mono.just(chatResult);
                    }
                    UsageEntry entry = UsageEntry.success(attempt.subjectId, attempt.tenantId, attempt.projectId,
                            result.tokensUsed(), credits, result.model(), sources, attempt.elapsed(clock));
                    return usageRecorder.record(entry)
                            .onErrorResume(e -> {
                                log.error("Usage row lost for subject {} after successful answer: {}",
                                        attempt.subjectId, e.getMessage());
                                return Mono.empty();
                            })
                            .thenReturn(chatResult);
                })
                .onErrorResume(e -> recordFailure(attempt, e).then(Mono.error(e)));

        return Mono.defer(() -> Mono.fromFuture(work.toFuture(), true));
    }

    // ==================== Usage ====================

    public Mono<UsageSnapshot> usage(PortalPrincipal principal) {
        if (!enabled) {
            return Mono.error(disabled());
        }
        return resolveSubject(principal)
                .flatMap(contact -> quotaLedger.usage(contact.getId(), contact.getOrganizationId()));
    }

    // ==================== Context Preview ====================

    /**
     * Context the copilot would assemble for one project. Never calls the model and never records
     * usage. An inaccessible project gives an empty preview.
     */
    public Mono<ContextPreview> previewContext(PortalPrincipal principal, UUID projectId, String query) {
        if (!enabled) {
            return Mono.error(disabled());
        }
        String effectiveQuery = query != null ? query.trim() : "";
        return resolveSubject(principal)
                .flatMap(contact -> accessScopeResolver.resolve(contact.getId(), projectId)
                        .flatMap(scope -> contextAssembler.assemble(contact.getId(), effectiveQuery, scope)))
                .map(context -> new ContextPreview(projectId, effectiveQuery,
                        context.sourceCounts(), context.documents()));
    }

    // ==================== Helper Methods ====================

    private Mono<ContactEntity> resolveSubject(PortalPrincipal principal) {
        Mono<ContactEntity> lookup = principal.getTenantId() != null
                ? contactRepository.findByIdAndOrganizationId(principal.getSubjectId(), principal.getTenantId())
                : contactRepository.findById(principal.getSubjectId());
        return lookup.switchIfEmpty(Mono.error(() -> {
            log.warn("No portal contact {} in tenant {}", principal.getSubjectId(), principal.getTenantId());
            return new AccessDeniedException("NO_PORTAL_ACCESS", "Portal access is not enabled for this account");
        }));
    }

    private void validate(ChatRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        Set<ConstraintViolation<ChatRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(ConstraintViolation::getMessage)
                    .findFirst()
                    .orElse("Invalid request");
            throw new ValidationException(message);
        }
    }

    private static String lastUserMessage(List<ChatTurn> turns) {
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (turns.get(i).isUser()) {
                return turns.get(i).content();
            }
        }
        throw new ValidationException("At least one user message is required");
    }

    private Mono<Void> recordFailure(Attempt attempt, Throwable error) {
        if (!attempt.markRecorded()) {
            return Mono.empty();
        }
        ErrorKind kind = CopilotException.kindOf(error);
        String message = error instanceof CopilotException copilotException
                ? copilotException.getReason()
                : error.getClass().getSimpleName();
        UsageEntry entry = UsageEntry.failure(attempt.subjectId, attempt.tenantId, attempt.projectId,
                attempt.model, kind, message, attempt.elapsed(clock));
        return usageRecorder.record(entry)
                .onErrorResume(e -> {
                    log.error("Failure usage row lost for subject {} ({}): {}",
                            attempt.subjectId, kind, e.getMessage());
                    return Mono.empty();
                });
    }

    private static CopilotException disabled() {
        return new CopilotException(ErrorKind.COPILOT_DISABLED, "COPILOT_DISABLED",
                "The copilot is currently disabled");
    }

    /**
     * Per-request accounting state. Written as the pipeline learns more; recorded exactly once.
     */
    private static final class Attempt {
        final UUID subjectId;
        final UUID tenantId;
        final long startedAtMillis;
        final AtomicBoolean recorded = new AtomicBoolean(false);
        volatile UUID projectId;
        volatile String model;

        Attempt(UUID subjectId, UUID tenantId, long startedAtMillis) {
            this.subjectId = subjectId;
            this.tenantId = tenantId;
            this.startedAtMillis = startedAtMillis;
        }

        boolean markRecorded() {
            return recorded.compareAndSet(false, true);
        }

        long elapsed(Clock clock) {
            return Math.max(0, clock.millis() - startedAtMillis);
        }
    }
}
