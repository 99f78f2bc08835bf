package fr.lapetina.avatar.delivery.infrastructure.health;

import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.HealthSnapshot;
import fr.lapetina.avatar.delivery.domain.model.HealthState;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.infrastructure.http.ProviderTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background liveness probes for DEGRADED and UNHEALTHY providers.
 *
 * Runs on its own single thread, never inline with deliveries. Each cycle
 * is scheduled after the previous one with a random jitter so that several
 * client instances do not probe a recovering provider in lockstep.
 * UNHEALTHY providers are probed only once their cooldown has elapsed, and
 * only if the canary claim succeeds.
 */
public final class HealthProbeScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthProbeScheduler.class);

    private final ProviderRegistry registry;
    private final HealthMonitor healthMonitor;
    private final ProviderTransport transport;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Duration jitter;
    private final Duration probeTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthProbeScheduler(
            ProviderRegistry registry,
            HealthMonitor healthMonitor,
            ProviderTransport transport,
            Duration interval,
            Duration jitter,
            Duration probeTimeout
    ) {
        this.registry = registry;
        this.healthMonitor = healthMonitor;
        this.transport = transport;
        this.interval = interval;
        this.jitter = jitter;
        this.probeTimeout = probeTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-prober");
            t.setDaemon(true);
            return t;
        });
    }

    public HealthProbeScheduler(ProviderRegistry registry, HealthMonitor healthMonitor, ProviderTransport transport) {
        this(registry, healthMonitor, transport, Duration.ofSeconds(10), Duration.ofSeconds(2), Duration.ofSeconds(3));
    }

    /**
     * Starts the probe loop.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduleNext();
            log.info("Health prober started: interval={}, jitter={}", interval, jitter);
        }
    }

    private void scheduleNext() {
        if (!running.get()) {
            return;
        }
        long delay = nextDelayMillis();
        try {
            scheduler.schedule(this::runCycle, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Probe cycle not scheduled, prober is shutting down");
        }
    }

    long nextDelayMillis() {
        long jitterMs = jitter.toMillis();
        long extra = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0;
        return interval.toMillis() + extra;
    }

    private void runCycle() {
        try {
            probeDueProviders();
        } catch (Exception e) {
            log.error("Health probe cycle failed", e);
        } finally {
            scheduleNext();
        }
    }

    /**
     * Probes every enabled provider that is due. Returns the number probed.
     */
    public int probeDueProviders() {
        int probed = 0;
        for (ProviderDescriptor provider : registry.getEnabledProviders()) {
            String name = provider.getName();
            HealthState state = healthMonitor.stateOf(name);
            if (state == HealthState.DEGRADED) {
                probe(provider);
                probed++;
            } else if (state == HealthState.UNHEALTHY && healthMonitor.tryClaimCanary(name)) {
                probe(provider);
                probed++;
            }
        }
        log.debug("Health probe cycle finished: probed={}", probed);
        return probed;
    }

    /**
     * Probes one provider immediately, regardless of state or cooldown.
     *
     * @return the provider's health after the probe, empty if the provider is unknown
     */
    public Optional<HealthSnapshot> checkProvider(String name) {
        Optional<ProviderDescriptor> provider = registry.get(name);
        if (provider.isEmpty()) {
            return Optional.empty();
        }
        probe(provider.get());
        return healthMonitor.snapshot(name);
    }

    private void probe(ProviderDescriptor provider) {
        AttemptOutcome outcome;
        try {
            outcome = transport.probe(provider, probeTimeout);
        } catch (RuntimeException e) {
            log.warn("Health probe threw: provider={}, error={}", provider.getName(), e.getMessage());
            outcome = AttemptOutcome.failure(ErrorType.INTERNAL_ERROR, e.getMessage());
        }
        if (outcome.isSuccess()) {
            log.debug("Health probe passed: provider={}, latencyMs={}", provider.getName(), outcome.latency().toMillis());
        } else {
            log.warn("Health probe failed: provider={}, outcome={}", provider.getName(), outcome);
        }
        healthMonitor.recordProbeResult(provider.getName(), outcome);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Health prober stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
