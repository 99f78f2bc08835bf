package fr.lapetina.avatar.delivery.domain.exception;

import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;

import java.util.List;

/**
 * Base type for every terminal delivery failure surfaced to the caller.
 *
 * {@link #isRetryLater()} separates "try again later" from "fix the request".
 */
public class DeliveryException extends RuntimeException {

    private final ErrorType errorType;
    private final List<ProviderAttempt> attempts;

    public DeliveryException(ErrorType errorType, String message) {
        this(errorType, message, List.of());
    }

    public DeliveryException(ErrorType errorType, String message, List<ProviderAttempt> attempts) {
        super(message);
        this.errorType = errorType;
        this.attempts = attempts != null ? List.copyOf(attempts) : List.of();
    }

    public DeliveryException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.attempts = List.of();
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Per-provider outcomes gathered before the failure, in the order the providers were tried.
     */
    public List<ProviderAttempt> getAttempts() {
        return attempts;
    }

    public boolean isRetryLater() {
        return !errorType.isCallerFault();
    }
}
