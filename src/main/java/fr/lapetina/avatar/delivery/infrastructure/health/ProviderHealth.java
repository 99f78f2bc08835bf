package fr.lapetina.avatar.delivery.infrastructure.health;

import fr.lapetina.avatar.delivery.domain.model.HealthSnapshot;
import fr.lapetina.avatar.delivery.domain.model.HealthState;

import java.time.Instant;

/**
 * Mutable health record of one provider.
 *
 * Every method synchronizes on the record itself, so providers never
 * contend with each other. Only {@link HealthMonitor} holds instances.
 */
final class ProviderHealth {

    private final String provider;

    private HealthState state = HealthState.HEALTHY;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    // failures since entering DEGRADED
    private int degradedFailures;
    private int flapCount;
    private Instant lastProbeAt;
    private Instant nextProbeAllowedAt;
    private Instant lastTransitionAt;
    private Instant canaryClaimedAt;
    private String lastError;

    ProviderHealth(String provider, Instant createdAt) {
        this.provider = provider;
        this.lastTransitionAt = createdAt;
    }

    synchronized Transition recordSuccess(Instant now, HealthPolicy policy, boolean probe) {
        HealthState previous = state;
        consecutiveFailures = 0;
        degradedFailures = 0;
        consecutiveSuccesses++;
        if (probe) {
            lastProbeAt = now;
        }

        switch (state) {
            case UNHEALTHY -> {
                // one success only earns DEGRADED
                moveTo(HealthState.DEGRADED, now);
                nextProbeAllowedAt = null;
                canaryClaimedAt = null;
            }
            case DEGRADED -> {
                if (consecutiveSuccesses >= policy.recoveryThreshold()) {
                    moveTo(HealthState.HEALTHY, now);
                }
            }
            case HEALTHY -> {
            }
        }
        return Transition.of(provider, previous, state);
    }

    synchronized Transition recordFailure(Instant now, HealthPolicy policy, String error, boolean probe) {
        HealthState previous = state;
        consecutiveFailures++;
        consecutiveSuccesses = 0;
        lastError = error;
        if (probe) {
            lastProbeAt = now;
        }

        switch (state) {
            case HEALTHY -> {
                if (consecutiveFailures >= policy.degradedThreshold()) {
                    moveTo(HealthState.DEGRADED, now);
                }
            }
            case DEGRADED -> {
                degradedFailures++;
                if (degradedFailures >= policy.unhealthyThreshold()) {
                    moveTo(HealthState.UNHEALTHY, now);
                    startCooldown(now, policy);
                }
            }
            case UNHEALTHY -> {
                // late results from requests started before the transition do not extend the cooldown
                if (probe || canaryClaimedAt != null) {
                    startCooldown(now, policy);
                }
            }
        }
        return Transition.of(provider, previous, state);
    }

    private void startCooldown(Instant now, HealthPolicy policy) {
        flapCount++;
        nextProbeAllowedAt = now.plus(policy.cooldownFor(flapCount));
        canaryClaimedAt = null;
    }

    private void moveTo(HealthState next, Instant now) {
        state = next;
        lastTransitionAt = now;
        degradedFailures = 0;
    }

    /**
     * Claims the single canary slot of an UNHEALTHY provider whose cooldown has elapsed.
     */
    synchronized boolean tryClaimCanary(Instant now, HealthPolicy policy) {
        if (state != HealthState.UNHEALTHY) {
            return false;
        }
        if (nextProbeAllowedAt != null && now.isBefore(nextProbeAllowedAt)) {
            return false;
        }
        if (canaryClaimedAt != null && now.isBefore(canaryClaimedAt.plus(policy.canaryLease()))) {
            return false;
        }
        canaryClaimedAt = now;
        return true;
    }

    synchronized void releaseCanary() {
        canaryClaimedAt = null;
    }

    synchronized HealthState state() {
        return state;
    }

    synchronized boolean isProbeDue(Instant now) {
        return switch (state) {
            case HEALTHY -> false;
            case DEGRADED -> true;
            case UNHEALTHY -> nextProbeAllowedAt == null || !now.isBefore(nextProbeAllowedAt);
        };
    }

    synchronized HealthSnapshot snapshot(Instant now, HealthPolicy policy) {
        boolean canaryInFlight = canaryClaimedAt != null
                && now.isBefore(canaryClaimedAt.plus(policy.canaryLease()));
        return new HealthSnapshot(
                provider,
                state,
                consecutiveFailures,
                consecutiveSuccesses,
                lastProbeAt,
                nextProbeAllowedAt,
                flapCount,
                canaryInFlight,
                lastError,
                lastTransitionAt
        );
    }

    /**
     * State change produced by one recorded outcome, or {@code null} when the state held.
     */
    record Transition(String provider, HealthState from, HealthState to) {
        static Transition of(String provider, HealthState from, HealthState to) {
            return from == to ? null : new Transition(provider, from, to);
        }
    }
}
