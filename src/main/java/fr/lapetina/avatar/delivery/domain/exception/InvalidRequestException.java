package fr.lapetina.avatar.delivery.domain.exception;

import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;

import java.util.List;

/**
 * The request itself is defective. Never retried, never failed over.
 */
public final class InvalidRequestException extends DeliveryException {

    public InvalidRequestException(String message) {
        super(ErrorType.INVALID_REQUEST, message);
    }

    public InvalidRequestException(String message, List<ProviderAttempt> attempts) {
        super(ErrorType.INVALID_REQUEST, message, attempts);
    }
}
