package fr.lapetina.avatar.delivery.domain.exception;

import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;

import java.util.List;

/**
 * Every candidate was denied admission by local rate limiting.
 * Surfaced instead of blocking the caller.
 */
public final class RateLimitedException extends DeliveryException {

    public RateLimitedException(List<ProviderAttempt> attempts) {
        super(ErrorType.RATE_LIMITED,
                "Delivery capacity exhausted: all " + attempts.size() + " candidate(s) rate limited",
                attempts);
    }
}
