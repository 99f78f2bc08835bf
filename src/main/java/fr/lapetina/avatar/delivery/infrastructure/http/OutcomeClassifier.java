package fr.lapetina.avatar.delivery.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw provider results onto {@link AttemptOutcome}s.
 *
 * <table>
 *   <tr><th>Result</th><th>Error type</th></tr>
 *   <tr><td>2xx</td><td>success</td></tr>
 *   <tr><td>400, 401, 403, 422</td><td>INVALID_REQUEST</td></tr>
 *   <tr><td>408</td><td>TIMEOUT</td></tr>
 *   <tr><td>429</td><td>RATE_LIMITED</td></tr>
 *   <tr><td>other 4xx</td><td>PROVIDER_REJECTED</td></tr>
 *   <tr><td>5xx</td><td>PROVIDER_SERVER_ERROR</td></tr>
 *   <tr><td>1xx, 3xx</td><td>TRANSPORT_ERROR</td></tr>
 *   <tr><td>timeout exception</td><td>TIMEOUT</td></tr>
 *   <tr><td>I/O exception</td><td>TRANSPORT_ERROR</td></tr>
 *   <tr><td>interrupt</td><td>CANCELLED</td></tr>
 * </table>
 */
public final class OutcomeClassifier {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final int MAX_MESSAGE_LENGTH = 200;

    private OutcomeClassifier() {
    }

    public static AttemptOutcome classify(int statusCode, String body, Duration latency) {
        if (statusCode >= 200 && statusCode < 300) {
            return AttemptOutcome.success(statusCode, parseBody(body), latency);
        }
        ErrorType type = errorTypeFor(statusCode);
        return AttemptOutcome.failure(type, "HTTP " + statusCode + errorDetail(body), statusCode, latency);
    }

    public static ErrorType errorTypeFor(int statusCode) {
        if (statusCode == 400 || statusCode == 401 || statusCode == 403 || statusCode == 422) {
            return ErrorType.INVALID_REQUEST;
        }
        if (statusCode == 408) {
            return ErrorType.TIMEOUT;
        }
        if (statusCode == 429) {
            return ErrorType.RATE_LIMITED;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return ErrorType.PROVIDER_REJECTED;
        }
        if (statusCode >= 500) {
            return ErrorType.PROVIDER_SERVER_ERROR;
        }
        return ErrorType.TRANSPORT_ERROR;
    }

    public static AttemptOutcome classify(Throwable error, Duration latency) {
        Throwable cause = unwrap(error);
        String message = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");

        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return AttemptOutcome.failure(ErrorType.TIMEOUT, message, 0, latency);
        }
        if (cause instanceof ConnectException || cause instanceof IOException) {
            return AttemptOutcome.failure(ErrorType.TRANSPORT_ERROR, message, 0, latency);
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return AttemptOutcome.failure(ErrorType.CANCELLED, message, 0, latency);
        }
        return AttemptOutcome.failure(ErrorType.INTERNAL_ERROR, message, 0, latency);
    }

    /**
     * Parses a JSON object body. Empty bodies give an empty map; anything
     * that is not a JSON object is kept under {@code "raw"}.
     */
    public static Map<String, Object> parseBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = MAPPER.readValue(body, MAP_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            return Map.of("raw", body);
        }
    }

    private static String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        Object error = parseBody(body).get("error");
        String detail = error != null ? error.toString() : body;
        if (detail.length() > MAX_MESSAGE_LENGTH) {
            detail = detail.substring(0, MAX_MESSAGE_LENGTH) + "...";
        }
        return ": " + detail;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
