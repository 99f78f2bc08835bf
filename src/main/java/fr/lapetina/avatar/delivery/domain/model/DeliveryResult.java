package fr.lapetina.avatar.delivery.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Successful delivery of an utterance.
 * Immutable and thread-safe; the same instance may be served from the cache.
 */
public record DeliveryResult(
        String requestId,
        String fingerprint,
        String providerUsed,
        ProviderType providerType,
        int statusCode,
        Map<String, Object> body,
        String mediaReference,
        int attempts,
        Duration latency,
        boolean fromCache,
        Instant deliveredAt
) {
    public DeliveryResult {
        Objects.requireNonNull(fingerprint, "Fingerprint is required");
        Objects.requireNonNull(providerUsed, "Provider is required");
        body = body != null ? Collections.unmodifiableMap(new LinkedHashMap<>(body)) : Map.of();
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (deliveredAt == null) {
            deliveredAt = Instant.now();
        }
    }

    /**
     * Returns this result as served to a later request from the cache.
     */
    public DeliveryResult asCached(String servingRequestId) {
        return new DeliveryResult(
                servingRequestId, fingerprint, providerUsed, providerType, statusCode,
                body, mediaReference, attempts, latency, true, deliveredAt
        );
    }
}
