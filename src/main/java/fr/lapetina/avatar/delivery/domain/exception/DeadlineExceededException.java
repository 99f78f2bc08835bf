package fr.lapetina.avatar.delivery.domain.exception;

import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;

import java.util.List;

/**
 * The caller's deadline elapsed. Providers are not charged for it.
 */
public final class DeadlineExceededException extends DeliveryException {

    public DeadlineExceededException(String message) {
        super(ErrorType.DEADLINE_EXCEEDED, message);
    }

    public DeadlineExceededException(String message, List<ProviderAttempt> attempts) {
        super(ErrorType.DEADLINE_EXCEEDED, message, attempts);
    }
}
