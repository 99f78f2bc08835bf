package fr.lapetina.avatar.delivery.domain.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Classified result of a single attempt against one provider.
 *
 * Drives both the retry loop (retry, fail over, or abort) and the health
 * update for the provider that produced it.
 */
public record AttemptOutcome(
        Kind kind,
        ErrorType errorType,
        int statusCode,
        Map<String, Object> body,
        String message,
        Duration latency
) {
    public enum Kind {
        SUCCESS,
        RETRYABLE_FAILURE,
        FATAL_FAILURE
    }

    public AttemptOutcome {
        Objects.requireNonNull(kind, "Kind is required");
        if (kind != Kind.SUCCESS) {
            Objects.requireNonNull(errorType, "Failures require an error type");
        }
        body = body != null ? Collections.unmodifiableMap(new LinkedHashMap<>(body)) : Map.of();
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public static AttemptOutcome success(int statusCode, Map<String, Object> body, Duration latency) {
        return new AttemptOutcome(Kind.SUCCESS, null, statusCode, body, null, latency);
    }

    /**
     * Creates a failure; fatal or retryable follows from the error type.
     */
    public static AttemptOutcome failure(ErrorType errorType, String message, int statusCode, Duration latency) {
        Kind kind = errorType.isFatal() ? Kind.FATAL_FAILURE : Kind.RETRYABLE_FAILURE;
        return new AttemptOutcome(kind, errorType, statusCode, null, message, latency);
    }

    public static AttemptOutcome failure(ErrorType errorType, String message) {
        return failure(errorType, message, 0, Duration.ZERO);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isFatal() {
        return kind == Kind.FATAL_FAILURE;
    }

    /**
     * True when another attempt against the same provider may succeed.
     */
    public boolean isRetryableOnSameProvider() {
        return kind == Kind.RETRYABLE_FAILURE && errorType.isRetryableOnSameProvider();
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Success{status=" + statusCode + ", latencyMs=" + latency.toMillis() + "}";
        }
        return kind + "{" + errorType
                + (statusCode > 0 ? ", status=" + statusCode : "")
                + (message != null ? ", message=" + message : "")
                + "}";
    }
}
