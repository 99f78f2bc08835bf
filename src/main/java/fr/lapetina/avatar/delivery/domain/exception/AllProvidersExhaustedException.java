package fr.lapetina.avatar.delivery.domain.exception;

import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;

import java.util.List;

/**
 * Every candidate provider was tried and none delivered.
 */
public final class AllProvidersExhaustedException extends DeliveryException {

    public AllProvidersExhaustedException(List<ProviderAttempt> attempts) {
        super(ErrorType.ALL_PROVIDERS_EXHAUSTED, "All avatar providers failed: " + attempts, attempts);
    }
}
