package fr.lapetina.avatar.delivery;

import com.github.benmanes.caffeine.cache.Ticker;
import fr.lapetina.avatar.delivery.disruptor.DeliveryEventBus;
import fr.lapetina.avatar.delivery.domain.validation.RequestValidator;
import fr.lapetina.avatar.delivery.infrastructure.cache.ResponseCache;
import fr.lapetina.avatar.delivery.infrastructure.config.AvatarClientConfig;
import fr.lapetina.avatar.delivery.infrastructure.config.ConfigLoader;
import fr.lapetina.avatar.delivery.infrastructure.config.CredentialResolver;
import fr.lapetina.avatar.delivery.infrastructure.health.HealthMonitor;
import fr.lapetina.avatar.delivery.infrastructure.health.HealthPolicy;
import fr.lapetina.avatar.delivery.infrastructure.health.HealthProbeScheduler;
import fr.lapetina.avatar.delivery.infrastructure.health.ProviderRegistry;
import fr.lapetina.avatar.delivery.infrastructure.health.ProviderRegistry.ProviderRegistryEvent;
import fr.lapetina.avatar.delivery.infrastructure.http.HttpProviderTransport;
import fr.lapetina.avatar.delivery.infrastructure.http.ProviderTransport;
import fr.lapetina.avatar.delivery.infrastructure.http.adapter.ProviderAdapterFactory;
import fr.lapetina.avatar.delivery.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.avatar.delivery.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.avatar.delivery.infrastructure.retry.BackoffPolicy;
import fr.lapetina.avatar.delivery.infrastructure.retry.RetryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Factory for creating a fully-wired {@link AvatarClient} from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (AvatarClientFactory factory = AvatarClientFactory.create("config.yaml").start()) {
 *     DeliveryResult result = factory.getClient().speak(request);
 * }
 * }</pre>
 */
public class AvatarClientFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AvatarClientFactory.class);

    private final ConfigLoader configLoader;
    private final AvatarClientConfig config;
    private final ProviderRegistry providerRegistry;
    private final HealthMonitor healthMonitor;
    private final RateLimiter rateLimiter;
    private final ResponseCache cache;
    private final MetricsRegistry metricsRegistry;
    private final ProviderTransport transport;
    private final HealthProbeScheduler probeScheduler;
    private final DeliveryEventBus eventBus;
    private final AvatarClient client;

    protected AvatarClientFactory(String configPath, ProviderTransport transportOverride) {
        log.info("Initializing AvatarClientFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        Clock clock = Clock.systemUTC();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.healthMonitor = new HealthMonitor(HealthPolicy.fromConfig(config.getHealth()), clock);
        this.rateLimiter = new RateLimiter(
                config.getRateLimit().getBucketCapacity(),
                config.getRateLimit().getRefillPerSecond(),
                clock
        );

        // Listeners first so the initial registrations create health and rate state
        this.providerRegistry = new ProviderRegistry();
        providerRegistry.addListener(healthMonitor);
        providerRegistry.addListener(rateLimiter);
        providerRegistry.addListener(this::onProviderChanged);
        providerRegistry.replaceAll(config.toDescriptors());

        this.cache = new ResponseCache(
                Duration.ofMillis(config.getCache().getTtlMs()),
                config.getCache().getMaxEntries(),
                clock,
                Ticker.systemTicker(),
                config.getCache().isEnabled()
        );
        metricsRegistry.registerCache(cache,
                c -> c.stats().hitCount(),
                c -> c.stats().missCount(),
                c -> c.stats().size());

        this.transport = transportOverride != null ? transportOverride : createTransport();

        this.probeScheduler = new HealthProbeScheduler(
                providerRegistry,
                healthMonitor,
                transport,
                Duration.ofMillis(config.getHealth().getProbeIntervalMs()),
                Duration.ofMillis(config.getHealth().getProbeJitterMs()),
                Duration.ofMillis(config.getHealth().getProbeTimeoutMs())
        );

        this.eventBus = DeliveryEventBus.builder()
                .ringBufferSize(config.getEvents().getRingBufferSize())
                .waitStrategy(config.getEvents().getWaitStrategy())
                .metricsRegistry(config.getMetrics().isEnabled() ? metricsRegistry : null)
                .build();

        this.client = AvatarClient.builder()
                .registry(providerRegistry)
                .healthMonitor(healthMonitor)
                .rateLimiter(rateLimiter)
                .cache(cache)
                .retryEngine(new RetryEngine(
                        BackoffPolicy.fromConfig(config.getRetry()),
                        transport,
                        Duration.ofMillis(config.getTimeouts().getAttemptTimeoutMs())
                ))
                .validator(new RequestValidator(config.getValidation().getMaxTextLength(), clock))
                .transport(transport)
                .probeScheduler(probeScheduler)
                .eventPublisher(eventBus)
                .clock(clock)
                .build();

        configLoader.addListener(this::onConfigChanged);

        log.info("AvatarClientFactory initialized with {} providers", providerRegistry.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static AvatarClientFactory create(String configPath) {
        return new AvatarClientFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static AvatarClientFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the event bus, the probe loop and the configuration watcher.
     */
    public AvatarClientFactory start() {
        eventBus.start();
        if (config.getHealth().isProbeEnabled()) {
            client.start();
        }
        configLoader.startWatching();
        log.info("Avatar client started");
        return this;
    }

    public AvatarClient getClient() {
        return client;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public DeliveryEventBus getEventBus() {
        return eventBus;
    }

    public ProviderTransport getTransport() {
        return transport;
    }

    public AvatarClientConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private ProviderTransport createTransport() {
        return new HttpProviderTransport(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                new ProviderAdapterFactory(),
                new CredentialResolver()
        );
    }

    private void onProviderChanged(ProviderRegistryEvent event) {
        String name = event.name();
        switch (event.type()) {
            case ADDED, UPDATED -> metricsRegistry.registerProvider(
                    name,
                    () -> healthMonitor.stateOf(name).gaugeValue(),
                    () -> rateLimiter.availableTokens(name)
            );
            case REMOVED -> metricsRegistry.unregisterProvider(name);
        }
    }

    private void onConfigChanged(AvatarClientConfig oldConfig, AvatarClientConfig newConfig) {
        log.info("Configuration changed, applying provider updates...");
        try {
            client.reload(newConfig.toDescriptors());
        } catch (IllegalArgumentException e) {
            log.error("Provider reload rejected, keeping current providers", e);
            return;
        }
        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down AvatarClientFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            client.close();
        } catch (Exception e) {
            log.warn("Error closing avatar client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("AvatarClientFactory shut down");
    }
}
