package fr.lapetina.avatar.delivery.domain.model;

import java.time.Instant;

/**
 * Read-only copy of one provider's health record.
 *
 * @param nextProbeAllowedAt end of the cooldown for an UNHEALTHY provider, null otherwise
 * @param flapCount          number of times the provider has entered UNHEALTHY
 */
public record HealthSnapshot(
        String provider,
        HealthState state,
        int consecutiveFailures,
        int consecutiveSuccesses,
        Instant lastProbeAt,
        Instant nextProbeAllowedAt,
        int flapCount,
        boolean canaryInFlight,
        String lastError,
        Instant lastTransitionAt
) {
    public boolean isCoolingDown(Instant now) {
        return state == HealthState.UNHEALTHY
                && nextProbeAllowedAt != null
                && now.isBefore(nextProbeAllowedAt);
    }
}
