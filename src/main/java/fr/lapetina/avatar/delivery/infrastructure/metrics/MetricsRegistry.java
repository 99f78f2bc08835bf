package fr.lapetina.avatar.delivery.infrastructure.metrics;

import fr.lapetina.avatar.delivery.domain.event.OutcomeStatus;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Delivery counters by provider and outcome
 * - Delivery latency timers
 * - Per-provider attempt and rate-limit denial counters
 * - Provider health and token gauges
 * - Cache hit/miss counters
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rateLimitedCounters = new ConcurrentHashMap<>();
    private final Map<String, List<Meter>> providerGauges = new ConcurrentHashMap<>();

    private final AtomicLong ringBufferRemaining = new AtomicLong(0);
    private final Counter droppedEvents;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicLong::get)
                .description("Remaining capacity in the outcome event ring buffer")
                .register(registry);

        this.droppedEvents = Counter.builder(prefix + "_events_dropped_total")
                .description("Outcome events dropped because the ring buffer was full")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("avatar_client");
    }

    /**
     * Counts a finished {@code speak} call.
     *
     * @param provider provider that served it, or "none"
     */
    public void incrementDeliveryCount(String provider, OutcomeStatus status) {
        String key = provider + ":" + status.name();
        deliveryCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_deliveries_total")
                        .description("Total number of speak calls by outcome")
                        .tag("provider", provider)
                        .tag("status", status.name())
                        .register(registry)
        ).increment();
    }

    public void recordLatency(OutcomeStatus status, Duration latency) {
        latencyTimers.computeIfAbsent(status.name(), k ->
                Timer.builder(prefix + "_delivery_latency")
                        .description("End-to-end speak latency")
                        .tag("status", status.name())
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts provider calls; {@code outcome} is SUCCESS or an error type name.
     */
    public void incrementAttemptCount(String provider, String outcome, int calls) {
        if (calls <= 0) {
            return;
        }
        String key = provider + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_provider_attempts_total")
                        .description("Total number of calls made to providers")
                        .tag("provider", provider)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment(calls);
    }

    public void incrementErrorCount(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType.name(), k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of failed speak calls by error type")
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRateLimited(String provider) {
        rateLimitedCounters.computeIfAbsent(provider, k ->
                Counter.builder(prefix + "_rate_limited_total")
                        .description("Admissions denied by local rate limiting")
                        .tag("provider", provider)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers health (2=HEALTHY, 1=DEGRADED, 0=UNHEALTHY) and token gauges for a provider.
     */
    public void registerProvider(String provider, Supplier<Number> healthValue, Supplier<Number> availableTokens) {
        unregisterProvider(provider);
        Gauge health = Gauge.builder(prefix + "_provider_health", healthValue, s -> s.get().doubleValue())
                .description("Provider health state (0=UNHEALTHY, 1=DEGRADED, 2=HEALTHY)")
                .tag("provider", provider)
                .strongReference(true)
                .register(registry);
        Gauge tokens = Gauge.builder(prefix + "_provider_tokens", availableTokens, s -> s.get().doubleValue())
                .description("Rate limit tokens currently available")
                .tag("provider", provider)
                .strongReference(true)
                .register(registry);
        providerGauges.put(provider, List.of(health, tokens));
    }

    public void unregisterProvider(String provider) {
        List<Meter> meters = providerGauges.remove(provider);
        if (meters != null) {
            meters.forEach(registry::remove);
        }
    }

    /**
     * Binds hit and miss counters to a stats source.
     */
    public <T> void registerCache(T source, ToDoubleFunction<T> hits, ToDoubleFunction<T> misses, ToDoubleFunction<T> size) {
        FunctionCounter.builder(prefix + "_cache_requests_total", source, hits)
                .description("Response cache lookups")
                .tag("result", "hit")
                .register(registry);
        FunctionCounter.builder(prefix + "_cache_requests_total", source, misses)
                .description("Response cache lookups")
                .tag("result", "miss")
                .register(registry);
        Gauge.builder(prefix + "_cache_size", source, size)
                .description("Entries currently cached")
                .register(registry);
    }

    public void setRingBufferRemaining(long value) {
        ringBufferRemaining.set(value);
    }

    public void incrementDroppedEvents() {
        droppedEvents.increment();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
