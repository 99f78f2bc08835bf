package fr.lapetina.avatar.delivery.domain.exception;

import fr.lapetina.avatar.delivery.domain.model.ErrorType;

/**
 * No enabled provider declares the capabilities the request needs,
 * or all of them are cooling down.
 */
public final class NoAvailableProviderException extends DeliveryException {

    public NoAvailableProviderException(String message) {
        super(ErrorType.NO_AVAILABLE_PROVIDER, message);
    }
}
