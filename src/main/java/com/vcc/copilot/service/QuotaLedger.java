package com.vcc.copilot.service;

import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.model.QuotaStatus;
import com.vcc.copilot.model.ServiceTier;
import com.vcc.copilot.model.UsageSnapshot;
import com.vcc.copilot.repository.UsageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Daily request quota per subject, derived on read from the usage log.
 *
 * <p>This is a check, not a reservation: the debit is the usage row written after the request
 * completes. Concurrent requests from one subject can each pass the check, so the effective
 * ceiling is the tier limit plus that subject's in-flight requests.
 *
 * <p>The window is the current UTC day. It resets at the next UTC midnight, which is the
 * {@code resetAt} reported to callers.
 */
@Service
public class QuotaLedger {
    private static final Logger log = LoggerFactory.getLogger(QuotaLedger.class);

    private final UsageRecordRepository usageRecordRepository;
    private final TenantTierService tenantTierService;
    private final CopilotProperties properties;
    private final Clock clock;

    public QuotaLedger(UsageRecordRepository usageRecordRepository,
                       TenantTierService tenantTierService,
                       CopilotProperties properties,
                       Clock clock) {
        this.usageRecordRepository = usageRecordRepository;
        this.tenantTierService = tenantTierService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Check whether the subject may issue another request today.
     *
     * @param subjectId Subject (contact) ID
     * @param tenantId  Owning tenant, selects the tier
     * @return quota status; {@code allowed=false} once used reaches the tier limit
     */
    public Mono<QuotaStatus> checkAndReserve(UUID subjectId, UUID tenantId) {
        Instant now = clock.instant();
        Instant windowStart = windowStart(now);
        Instant resetAt = nextReset(now);

        return tenantTierService.resolveTier(tenantId)
                .flatMap(tier -> usageRecordRepository.countChargeableSince(subjectId, windowStart)
                        .defaultIfEmpty(0L)
                        .map(used -> QuotaStatus.of(tier, used,
                                properties.tierConfig(tier).getRequestsPerDay(), resetAt)))
                .doOnNext(status -> {
                    if (!status.allowed()) {
                        log.info("Quota exhausted for subject {} (tier={}, used={}, limit={})",
                                subjectId, status.tier().wireName(), status.used(), status.limit());
                    } else {
                        log.debug("Quota check for subject {}: used={}/{}", subjectId, status.used(), status.limit());
                    }
                });
    }

    /**
     * Today's usage totals; the three aggregates are queried concurrently.
     */
    public Mono<UsageSnapshot> usage(UUID subjectId, UUID tenantId) {
        Instant now = clock.instant();
        Instant windowStart = windowStart(now);
        Instant resetAt = nextReset(now);

        return tenantTierService.resolveTier(tenantId)
                .flatMap(tier -> Mono.zip(
                                usageRecordRepository.countChargeableSince(subjectId, windowStart).defaultIfEmpty(0L),
                                usageRecordRepository.sumTokensSince(subjectId, windowStart).defaultIfEmpty(0L),
                                usageRecordRepository.countFailuresSince(subjectId, windowStart).defaultIfEmpty(0L))
                        .map(totals -> snapshot(tier, totals.getT1(), totals.getT2(), totals.getT3(), resetAt)));
    }

    private UsageSnapshot snapshot(ServiceTier tier, long requests, long tokens, long errors, Instant resetAt) {
        CopilotProperties.TierConfig config = properties.tierConfig(tier);
        return new UsageSnapshot(tier, requests, tokens, errors,
                config.getRequestsPerDay(), config.getMaxTokensPerRequest(), resetAt);
    }

    static Instant windowStart(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    static Instant nextReset(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
