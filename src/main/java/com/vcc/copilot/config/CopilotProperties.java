package com.vcc.copilot.config;

import com.vcc.copilot.model.ServiceTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "copilot")
@Validated
public class CopilotProperties {

    // Whole-subsystem switch, read once at startup
    private boolean enabled = true;

    @Valid
    private UpstreamConfig upstream = new UpstreamConfig();

    @Valid
    private AuthConfig auth = new AuthConfig();

    private Map<ServiceTier, TierConfig> tiers = defaultTiers();

    private ContextConfig context = new ContextConfig();
    private CacheConfig cache = new CacheConfig();
    private QuotaConfig quota = new QuotaConfig();

    // ==================== Getters/Setters ====================

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public UpstreamConfig getUpstream() {
        return upstream;
    }

    public void setUpstream(UpstreamConfig upstream) {
        this.upstream = upstream;
    }

    public AuthConfig getAuth() {
        return auth;
    }

    public void setAuth(AuthConfig auth) {
        this.auth = auth;
    }

    public Map<ServiceTier, TierConfig> getTiers() {
        return tiers;
    }

    public void setTiers(Map<ServiceTier, TierConfig> tiers) {
        this.tiers = tiers;
    }

    public ContextConfig getContext() {
        return context;
    }

    public void setContext(ContextConfig context) {
        this.context = context;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache;
    }

    public QuotaConfig getQuota() {
        return quota;
    }

    public void setQuota(QuotaConfig quota) {
        this.quota = quota;
    }

    /**
     * Limits for a tier, falling back to the FREE tier when the tier is not configured.
     */
    public TierConfig tierConfig(ServiceTier tier) {
        TierConfig config = tiers.get(tier);
        if (config == null) {
            config = tiers.get(ServiceTier.FREE);
        }
        return config != null ? config : new TierConfig(100, 1024, 1);
    }

    private static Map<ServiceTier, TierConfig> defaultTiers() {
        Map<ServiceTier, TierConfig> defaults = new EnumMap<>(ServiceTier.class);
        defaults.put(ServiceTier.FREE, new TierConfig(100, 1024, 1));
        defaults.put(ServiceTier.STANDARD, new TierConfig(500, 2048, 1));
        defaults.put(ServiceTier.PREMIUM, new TierConfig(2000, 4096, 1));
        defaults.put(ServiceTier.UNLIMITED, new TierConfig(10000, 8192, 0));
        return defaults;
    }

    // ==================== Nested Config Classes ====================

    /**
     * LLM provider connection (OpenAI-compatible chat completions).
     */
    public static class UpstreamConfig {
        @NotBlank
        private String baseUrl;

        private String chatPath = "/v1/chat/completions";

        // Rotated round-robin by KeyPool
        private List<String> apiKeys = new ArrayList<>();

        @NotBlank
        private String defaultModel = "gpt-4o-mini";

        private double defaultTemperature = 0.7;

        @Min(1)
        private int timeoutSeconds = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getChatPath() {
            return chatPath;
        }

        public void setChatPath(String chatPath) {
            this.chatPath = chatPath;
        }

        public List<String> getApiKeys() {
            return apiKeys;
        }

        public void setApiKeys(List<String> apiKeys) {
            this.apiKeys = apiKeys;
        }

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public double getDefaultTemperature() {
            return defaultTemperature;
        }

        public void setDefaultTemperature(double defaultTemperature) {
            this.defaultTemperature = defaultTemperature;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    /**
     * Portal credential verification.
     */
    public static class AuthConfig {
        // HS256 secret, Base64 or raw UTF-8
        @NotBlank
        private String jwtSecret;

        // Optional; checked only when set
        private String issuer;

        private String tenantClaim = "tenant_id";

        public String getJwtSecret() {
            return jwtSecret;
        }

        public void setJwtSecret(String jwtSecret) {
            this.jwtSecret = jwtSecret;
        }

        public String getIssuer() {
            return issuer;
        }

        public void setIssuer(String issuer) {
            this.issuer = issuer;
        }

        public String getTenantClaim() {
            return tenantClaim;
        }

        public void setTenantClaim(String tenantClaim) {
            this.tenantClaim = tenantClaim;
        }
    }

    /**
     * Per-tier quota and generation ceilings.
     */
    public static class TierConfig {
        private int requestsPerDay;
        private int maxTokensPerRequest;
        private int creditsPerRequest = 1;

        // Overrides upstream.defaultModel when set
        private String model;

        public TierConfig() {
        }

        public TierConfig(int requestsPerDay, int maxTokensPerRequest, int creditsPerRequest) {
            this.requestsPerDay = requestsPerDay;
            this.maxTokensPerRequest = maxTokensPerRequest;
            this.creditsPerRequest = creditsPerRequest;
        }

        public int getRequestsPerDay() {
            return requestsPerDay;
        }

        public void setRequestsPerDay(int requestsPerDay) {
            this.requestsPerDay = requestsPerDay;
        }

        public int getMaxTokensPerRequest() {
            return maxTokensPerRequest;
        }

        public void setMaxTokensPerRequest(int maxTokensPerRequest) {
            this.maxTokensPerRequest = maxTokensPerRequest;
        }

        public int getCreditsPerRequest() {
            return creditsPerRequest;
        }

        public void setCreditsPerRequest(int creditsPerRequest) {
            this.creditsPerRequest = creditsPerRequest;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    /**
     * Context window assembly.
     */
    public static class ContextConfig {
        private int maxDocuments = 10;
        private int tokenBudget = 4000;
        private int charsPerToken = 4;
        private int taskLimit = 50;
        private int messageLimit = 30;
        private int fileLimit = 20;
        private int previewChars = 200;

        public int getMaxDocuments() {
            return maxDocuments;
        }

        public void setMaxDocuments(int maxDocuments) {
            this.maxDocuments = maxDocuments;
        }

        public int getTokenBudget() {
            return tokenBudget;
        }

        public void setTokenBudget(int tokenBudget) {
            this.tokenBudget = tokenBudget;
        }

        public int getCharsPerToken() {
            return charsPerToken;
        }

        public void setCharsPerToken(int charsPerToken) {
            this.charsPerToken = charsPerToken;
        }

        public int getTaskLimit() {
            return taskLimit;
        }

        public void setTaskLimit(int taskLimit) {
            this.taskLimit = taskLimit;
        }

        public int getMessageLimit() {
            return messageLimit;
        }

        public void setMessageLimit(int messageLimit) {
            this.messageLimit = messageLimit;
        }

        public int getFileLimit() {
            return fileLimit;
        }

        public void setFileLimit(int fileLimit) {
            this.fileLimit = fileLimit;
        }

        public int getPreviewChars() {
            return previewChars;
        }

        public void setPreviewChars(int previewChars) {
            this.previewChars = previewChars;
        }
    }

    /**
     * Cache configuration for Redis.
     */
    public static class CacheConfig {
        // Redis key prefix
        private String keyPrefix = "copilot:";

        // Tenant tier cache TTL in seconds
        private int tierTtlSeconds = 3600;  // 1 hour

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public int getTierTtlSeconds() {
            return tierTtlSeconds;
        }

        public void setTierTtlSeconds(int tierTtlSeconds) {
            this.tierTtlSeconds = tierTtlSeconds;
        }
    }

    /**
     * User-facing quota messaging.
     */
    public static class QuotaConfig {
        private String upgradeUrl = "/portal/billing/upgrade";

        public String getUpgradeUrl() {
            return upgradeUrl;
        }

        public void setUpgradeUrl(String upgradeUrl) {
            this.upgradeUrl = upgradeUrl;
        }
    }
}
