package fr.lapetina.avatar.delivery.domain.model;

import java.util.Objects;

/**
 * Final outcome of trying one provider for one request, after retries.
 *
 * @param provider provider name
 * @param attempts number of calls actually made (0 when admission was denied)
 * @param outcome  the last classified outcome
 */
public record ProviderAttempt(String provider, int attempts, AttemptOutcome outcome) {

    public ProviderAttempt {
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(outcome, "Outcome is required");
    }

    /**
     * A candidate skipped because local admission control denied it.
     */
    public static ProviderAttempt rateLimited(String provider, String reason) {
        return new ProviderAttempt(provider, 0, AttemptOutcome.failure(ErrorType.RATE_LIMITED, reason));
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public ErrorType errorType() {
        return outcome.errorType();
    }

    @Override
    public String toString() {
        return provider + "(attempts=" + attempts + ", " + outcome + ")";
    }
}
