package com.vcc.copilot.service;

import com.vcc.copilot.model.ServiceTier;
import com.vcc.copilot.repository.OrganizationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Resolves a tenant's service tier.
 * Chain: Redis cache → organizations table → FREE.
 */
@Service
public class TenantTierService {
    private static final Logger log = LoggerFactory.getLogger(TenantTierService.class);

    private final OrganizationRepository organizationRepository;
    private final CacheService cacheService;

    public TenantTierService(OrganizationRepository organizationRepository, CacheService cacheService) {
        this.organizationRepository = organizationRepository;
        this.cacheService = cacheService;
    }

    public Mono<ServiceTier> resolveTier(UUID tenantId) {
        if (tenantId == null) {
            return Mono.just(ServiceTier.FREE);
        }
        return cacheService.getTenantTier(tenantId)
                .switchIfEmpty(Mono.defer(() -> loadAndCache(tenantId)));
    }

    private Mono<ServiceTier> loadAndCache(UUID tenantId) {
        return organizationRepository.findById(tenantId)
                .map(org -> ServiceTier.normalize(org.getCopilotTier()))
                .flatMap(tier -> cacheService.cacheTenantTier(tenantId, tier).thenReturn(tier))
                .doOnNext(tier -> log.debug("Resolved tier from DB: {} -> {}", tenantId, tier))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("No organization {} found, using FREE tier", tenantId);
                    return ServiceTier.FREE;
                }));
    }
}
