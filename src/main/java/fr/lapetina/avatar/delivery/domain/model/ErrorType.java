package fr.lapetina.avatar.delivery.domain.model;

/**
 * Error taxonomy for avatar deliveries.
 *
 * Each type carries the handling policy the client applies to it:
 * whether the same provider is tried again, whether the next candidate
 * is tried, whether the provider's health is charged, and whether the
 * caller has to fix the request rather than try again later.
 */
public enum ErrorType {

    /** Provider did not answer within the attempt timeout */
    TIMEOUT(false, true, true, true, false),

    /** Connection-level failure (refused, reset, DNS) */
    TRANSPORT_ERROR(false, true, true, true, false),

    /** 5xx-equivalent answer from the provider */
    PROVIDER_SERVER_ERROR(false, true, true, true, false),

    /** Provider refused this particular payload; another provider may accept it */
    PROVIDER_REJECTED(true, false, true, false, false),

    /** Malformed request or bad credentials; nothing downstream can help */
    INVALID_REQUEST(true, false, false, false, true),

    /** Admission denied by local policy or provider-side throttling */
    RATE_LIMITED(false, false, true, false, false),

    /** Every candidate was tried without success */
    ALL_PROVIDERS_EXHAUSTED(false, false, false, false, false),

    /** No configured provider can serve the request */
    NO_AVAILABLE_PROVIDER(false, false, false, false, false),

    /** The caller's own deadline elapsed */
    DEADLINE_EXCEEDED(false, false, false, false, false),

    /** The calling thread was interrupted */
    CANCELLED(false, false, false, false, false),

    /** Unexpected local failure while talking to a provider */
    INTERNAL_ERROR(false, false, true, false, false);

    private final boolean fatal;
    private final boolean retryableOnSameProvider;
    private final boolean triggersFailover;
    private final boolean chargesHealth;
    private final boolean callerFault;

    ErrorType(
            boolean fatal,
            boolean retryableOnSameProvider,
            boolean triggersFailover,
            boolean chargesHealth,
            boolean callerFault
    ) {
        this.fatal = fatal;
        this.retryableOnSameProvider = retryableOnSameProvider;
        this.triggersFailover = triggersFailover;
        this.chargesHealth = chargesHealth;
        this.callerFault = callerFault;
    }

    /**
     * Fatal failures are never retried against the provider that produced them.
     */
    public boolean isFatal() {
        return fatal;
    }

    public boolean isRetryableOnSameProvider() {
        return retryableOnSameProvider;
    }

    public boolean triggersFailover() {
        return triggersFailover;
    }

    /**
     * Whether an outcome of this type counts as a provider failure for health tracking.
     */
    public boolean chargesHealth() {
        return chargesHealth;
    }

    public boolean isCallerFault() {
        return callerFault;
    }
}
