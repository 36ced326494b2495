package com.vcc.copilot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.model.ServiceTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Redis cache for tenant tier lookups.
 * Entries are refreshed on miss and expire by TTL; nothing invalidates them mid-flight.
 */
@Service
public class CacheService {
    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration tierTtl;

    public CacheService(ReactiveStringRedisTemplate redisTemplate,
                        ObjectMapper objectMapper,
                        CopilotProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;

        CopilotProperties.CacheConfig cacheConfig = properties.getCache();
        if (cacheConfig != null) {
            this.keyPrefix = cacheConfig.getKeyPrefix() != null ? cacheConfig.getKeyPrefix() : "copilot:";
            this.tierTtl = Duration.ofSeconds(cacheConfig.getTierTtlSeconds());
        } else {
            this.keyPrefix = "copilot:";
            this.tierTtl = Duration.ofHours(1);
        }
    }

    // ==================== Tenant Tier Cache ====================

    /**
     * Get a tenant's tier from cache.
     *
     * @param tenantId Tenant (organization) ID
     * @return tier if cached, empty Mono on miss or cache failure
     */
    public Mono<ServiceTier> getTenantTier(UUID tenantId) {
        String cacheKey = tierKey(tenantId);
        return redisTemplate.opsForValue().get(cacheKey)
                .flatMap(json -> deserialize(json, ServiceTier.class))
                .doOnNext(tier -> log.debug("Cache hit for tenant tier: {} -> {}", tenantId, tier))
                .onErrorResume(e -> {
                    log.warn("Tier cache read failed for {}: {}", tenantId, e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Cache a tenant's tier.
     *
     * @return true if cached successfully
     */
    public Mono<Boolean> cacheTenantTier(UUID tenantId, ServiceTier tier) {
        String cacheKey = tierKey(tenantId);
        return serialize(tier)
                .flatMap(json -> redisTemplate.opsForValue().set(cacheKey, json, tierTtl))
                .doOnSuccess(result -> log.debug("Cached tenant tier: {} -> {}", tenantId, tier))
                .onErrorResume(e -> {
                    log.warn("Failed to cache tenant tier: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    // ==================== Helper Methods ====================

    private String tierKey(UUID tenantId) {
        return keyPrefix + "tier:" + tenantId;
    }

    private <T> Mono<T> deserialize(String json, Class<T> clazz) {
        try {
            return Mono.just(objectMapper.readValue(json, clazz));
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize cache value: {}", e.getMessage());
            return Mono.empty();
        }
    }

    private Mono<String> serialize(Object obj) {
        try {
            return Mono.just(objectMapper.writeValueAsString(obj));
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Failed to serialize for cache", e));
        }
    }
}
