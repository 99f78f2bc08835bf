package fr.lapetina.avatar.delivery.infrastructure.health;

import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.HealthSnapshot;
import fr.lapetina.avatar.delivery.domain.model.HealthState;
import fr.lapetina.avatar.delivery.infrastructure.health.ProviderRegistry.ProviderRegistryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owner of every provider's health record.
 *
 * Passive signal comes from request outcomes ({@link #recordOutcome}),
 * active signal from the probe loop ({@link #recordProbeResult}).
 * Other components only read snapshots.
 *
 * <p>State machine per provider:
 * <pre>
 *   HEALTHY   --K consecutive failures--&gt; DEGRADED
 *   DEGRADED  --M further failures-------&gt; UNHEALTHY (cooldown starts)
 *   UNHEALTHY --cooldown elapsed, canary or probe success--&gt; DEGRADED
 *   DEGRADED  --N consecutive successes--&gt; HEALTHY
 * </pre>
 * Cooldowns grow exponentially with the number of flaps, up to a cap.
 *
 * <p>Registered as a {@link ProviderRegistry} listener so exactly one record
 * exists per live provider; records survive descriptor updates.
 */
public final class HealthMonitor implements Consumer<ProviderRegistryEvent> {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final Map<String, ProviderHealth> records = new ConcurrentHashMap<>();
    private final List<HealthChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final HealthPolicy policy;
    private final Clock clock;

    public HealthMonitor(HealthPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public HealthMonitor() {
        this(HealthPolicy.defaults(), Clock.systemUTC());
    }

    @Override
    public void accept(ProviderRegistryEvent event) {
        switch (event.type()) {
            case ADDED, UPDATED -> track(event.name());
            case REMOVED -> untrack(event.name());
        }
    }

    /**
     * Starts tracking a provider as HEALTHY; no-op when already tracked.
     */
    public void track(String provider) {
        records.computeIfAbsent(provider, name -> {
            log.debug("Health tracking started: provider={}", name);
            return new ProviderHealth(name, clock.instant());
        });
    }

    public void untrack(String provider) {
        if (records.remove(provider) != null) {
            log.debug("Health tracking stopped: provider={}", provider);
        }
    }

    /**
     * Records the final outcome of a delivery against a provider.
     *
     * Failures whose type does not charge health (local rate limiting,
     * payload rejection, caller deadline) leave the counters untouched and
     * only release a pending canary claim.
     */
    public void recordOutcome(String provider, AttemptOutcome outcome) {
        ProviderHealth record = records.get(provider);
        if (record == null) {
            log.debug("Outcome for untracked provider ignored: provider={}", provider);
            return;
        }
        Instant now = clock.instant();
        if (outcome.isSuccess()) {
            publish(record.recordSuccess(now, policy, false), record, now);
        } else if (outcome.errorType().chargesHealth()) {
            publish(record.recordFailure(now, policy, outcome.toString(), false), record, now);
        } else {
            record.releaseCanary();
        }
    }

    /**
     * Records a liveness probe result. Any non-success counts as a failure.
     */
    public void recordProbeResult(String provider, AttemptOutcome outcome) {
        ProviderHealth record = records.get(provider);
        if (record == null) {
            return;
        }
        Instant now = clock.instant();
        if (outcome.isSuccess()) {
            publish(record.recordSuccess(now, policy, true), record, now);
        } else {
            publish(record.recordFailure(now, policy, outcome.toString(), true), record, now);
        }
    }

    /**
     * Current state; untracked providers read as HEALTHY.
     */
    public HealthState stateOf(String provider) {
        ProviderHealth record = records.get(provider);
        return record != null ? record.state() : HealthState.HEALTHY;
    }

    /**
     * Claims the canary slot of a cooled-down UNHEALTHY provider.
     * At most one claim is outstanding per provider.
     */
    public boolean tryClaimCanary(String provider) {
        ProviderHealth record = records.get(provider);
        return record != null && record.tryClaimCanary(clock.instant(), policy);
    }

    public void releaseCanary(String provider) {
        ProviderHealth record = records.get(provider);
        if (record != null) {
            record.releaseCanary();
        }
    }

    /**
     * True for DEGRADED providers and for UNHEALTHY ones past their cooldown.
     */
    public boolean isProbeDue(String provider) {
        ProviderHealth record = records.get(provider);
        return record != null && record.isProbeDue(clock.instant());
    }

    /**
     * Point-in-time copy of every record, ordered by provider name.
     */
    public Map<String, HealthSnapshot> snapshot() {
        Instant now = clock.instant();
        Map<String, HealthSnapshot> copy = new TreeMap<>();
        records.forEach((name, record) -> copy.put(name, record.snapshot(now, policy)));
        return copy;
    }

    public Optional<HealthSnapshot> snapshot(String provider) {
        ProviderHealth record = records.get(provider);
        return record != null ? Optional.of(record.snapshot(clock.instant(), policy)) : Optional.empty();
    }

    public HealthPolicy getPolicy() {
        return policy;
    }

    public void addListener(HealthChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(HealthChangeListener listener) {
        listeners.remove(listener);
    }

    private void publish(ProviderHealth.Transition transition, ProviderHealth record, Instant now) {
        if (transition == null) {
            return;
        }
        HealthSnapshot snapshot = record.snapshot(now, policy);
        if (transition.to() == HealthState.UNHEALTHY) {
            log.warn("Provider health changed: provider={}, previousHealth={}, newHealth={}, flapCount={}, nextProbeAllowedAt={}",
                    transition.provider(), transition.from(), transition.to(),
                    snapshot.flapCount(), snapshot.nextProbeAllowedAt());
        } else {
            log.info("Provider health changed: provider={}, previousHealth={}, newHealth={}, consecutiveFailures={}",
                    transition.provider(), transition.from(), transition.to(), snapshot.consecutiveFailures());
        }
        for (HealthChangeListener listener : listeners) {
            try {
                listener.onHealthChanged(transition.from(), transition.to(), snapshot);
            } catch (Exception e) {
                log.error("Error notifying health change listener", e);
            }
        }
    }
}
