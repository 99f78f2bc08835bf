package fr.lapetina.avatar.delivery.domain.event;

import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Per-request outcome published for external monitoring.
 *
 * @param providerUsed provider that served the request, null on failure
 * @param errorType    terminal error type, null unless {@code status} is FAILED
 * @param attempts     per-provider outcomes in the order tried (empty for cache hits)
 */
public record DeliveryOutcome(
        String requestId,
        String fingerprint,
        OutcomeStatus status,
        String providerUsed,
        ErrorType errorType,
        List<ProviderAttempt> attempts,
        Duration latency,
        Instant timestamp
) {
    public DeliveryOutcome {
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean isSuccess() {
        return status != OutcomeStatus.FAILED;
    }

    /**
     * Total provider calls made for this request across all candidates.
     */
    public int totalCalls() {
        int total = 0;
        for (ProviderAttempt attempt : attempts) {
            total += attempt.attempts();
        }
        return total;
    }
}
