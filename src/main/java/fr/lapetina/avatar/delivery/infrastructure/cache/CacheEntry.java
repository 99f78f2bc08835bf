package fr.lapetina.avatar.delivery.infrastructure.cache;

import fr.lapetina.avatar.delivery.domain.model.DeliveryResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Memoized successful delivery.
 */
public record CacheEntry(DeliveryResult result, String providerUsed, Instant storedAt, Duration ttl) {

    public Instant expiresAt() {
        return storedAt.plus(ttl);
    }
}
