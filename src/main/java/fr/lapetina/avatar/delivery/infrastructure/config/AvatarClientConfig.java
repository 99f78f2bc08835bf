package fr.lapetina.avatar.delivery.infrastructure.config;

import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration object for the avatar delivery client.
 * Designed to be populated from YAML.
 */
public class AvatarClientConfig {

    private ServerConfig server = new ServerConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private RetryConfig retry = new RetryConfig();
    private HealthConfig health = new HealthConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private CacheConfig cache = new CacheConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private ValidationConfig validation = new ValidationConfig();
    private EventsConfig events = new EventsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public HealthConfig getHealth() { return health; }
    public void setHealth(HealthConfig health) { this.health = health; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public EventsConfig getEvents() { return events; }
    public void setEvents(EventsConfig events) { this.events = events; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Builds immutable descriptors from the configured provider list, in declaration order.
     */
    public List<ProviderDescriptor> toDescriptors() {
        List<ProviderDescriptor> descriptors = new ArrayList<>();
        for (ProviderConfig provider : providers) {
            descriptors.add(provider.toDescriptor());
        }
        return descriptors;
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 32;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Individual avatar provider configuration.
     */
    public static class ProviderConfig {
        private String name;
        private String type = "local";
        private String url;
        private String credentialRef;
        private Set<String> languages = new HashSet<>();
        private Set<String> emotions = new HashSet<>();
        private int priority = 1;
        private int maxConcurrent = 0;
        private int bucketCapacity = 0;
        private double refillPerSecond = 0;
        private boolean enabled = true;
        private Map<String, String> metadata = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getCredentialRef() { return credentialRef; }
        public void setCredentialRef(String credentialRef) { this.credentialRef = credentialRef; }

        public Set<String> getLanguages() { return languages; }
        public void setLanguages(Set<String> languages) { this.languages = languages; }

        public Set<String> getEmotions() { return emotions; }
        public void setEmotions(Set<String> emotions) { this.emotions = emotions; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public int getBucketCapacity() { return bucketCapacity; }
        public void setBucketCapacity(int bucketCapacity) { this.bucketCapacity = bucketCapacity; }

        public double getRefillPerSecond() { return refillPerSecond; }
        public void setRefillPerSecond(double refillPerSecond) { this.refillPerSecond = refillPerSecond; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Map<String, String> getMetadata() { return metadata; }
        public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }

        public ProviderDescriptor toDescriptor() {
            return ProviderDescriptor.builder()
                    .name(name)
                    .type(ProviderType.fromConfig(type))
                    .baseUrl(url)
                    .credentialRef(credentialRef)
                    .languages(languages)
                    .emotions(emotions)
                    .priority(priority)
                    .maxConcurrent(maxConcurrent)
                    .bucketCapacity(bucketCapacity)
                    .refillPerSecond(refillPerSecond)
                    .enabled(enabled)
                    .metadata(metadata)
                    .build();
        }
    }

    /**
     * Per-provider retry policy.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long baseDelayMs = 200;
        private long maxDelayMs = 5000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
    }

    /**
     * Health state machine and probe loop configuration.
     */
    public static class HealthConfig {
        private int degradedThreshold = 3;
        private int unhealthyThreshold = 2;
        private int recoveryThreshold = 2;
        private long cooldownBaseMs = 5000;
        private long cooldownMaxMs = 300000;
        private long canaryLeaseMs = 30000;
        private long probeIntervalMs = 10000;
        private long probeJitterMs = 2000;
        private long probeTimeoutMs = 3000;
        private boolean probeEnabled = true;

        public int getDegradedThreshold() { return degradedThreshold; }
        public void setDegradedThreshold(int degradedThreshold) { this.degradedThreshold = degradedThreshold; }

        public int getUnhealthyThreshold() { return unhealthyThreshold; }
        public void setUnhealthyThreshold(int unhealthyThreshold) { this.unhealthyThreshold = unhealthyThreshold; }

        public int getRecoveryThreshold() { return recoveryThreshold; }
        public void setRecoveryThreshold(int recoveryThreshold) { this.recoveryThreshold = recoveryThreshold; }

        public long getCooldownBaseMs() { return cooldownBaseMs; }
        public void setCooldownBaseMs(long cooldownBaseMs) { this.cooldownBaseMs = cooldownBaseMs; }

        public long getCooldownMaxMs() { return cooldownMaxMs; }
        public void setCooldownMaxMs(long cooldownMaxMs) { this.cooldownMaxMs = cooldownMaxMs; }

        public long getCanaryLeaseMs() { return canaryLeaseMs; }
        public void setCanaryLeaseMs(long canaryLeaseMs) { this.canaryLeaseMs = canaryLeaseMs; }

        public long getProbeIntervalMs() { return probeIntervalMs; }
        public void setProbeIntervalMs(long probeIntervalMs) { this.probeIntervalMs = probeIntervalMs; }

        public long getProbeJitterMs() { return probeJitterMs; }
        public void setProbeJitterMs(long probeJitterMs) { this.probeJitterMs = probeJitterMs; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }

        public boolean isProbeEnabled() { return probeEnabled; }
        public void setProbeEnabled(boolean probeEnabled) { this.probeEnabled = probeEnabled; }
    }

    /**
     * Default token bucket applied to providers without an override.
     */
    public static class RateLimitConfig {
        private int bucketCapacity = 10;
        private double refillPerSecond = 5.0;

        public int getBucketCapacity() { return bucketCapacity; }
        public void setBucketCapacity(int bucketCapacity) { this.bucketCapacity = bucketCapacity; }

        public double getRefillPerSecond() { return refillPerSecond; }
        public void setRefillPerSecond(double refillPerSecond) { this.refillPerSecond = refillPerSecond; }
    }

    /**
     * Response cache configuration.
     */
    public static class CacheConfig {
        private boolean enabled = true;
        private long ttlMs = 5000;
        private int maxEntries = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 2000;
        private long attemptTimeoutMs = 10000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxTextLength = 5000;

        public int getMaxTextLength() { return maxTextLength; }
        public void setMaxTextLength(int maxTextLength) { this.maxTextLength = maxTextLength; }
    }

    /**
     * Outcome event ring buffer configuration.
     */
    public static class EventsConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "avatar_client";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
