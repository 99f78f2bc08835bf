package fr.lapetina.avatar.delivery.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import fr.lapetina.avatar.delivery.domain.model.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived memo of successful deliveries keyed by request fingerprint.
 *
 * Absorbs duplicate submissions of the same commentary; it is not a
 * long-lived store. Backed by Caffeine with a per-entry TTL and a size bound.
 * Only successes are ever stored.
 */
public final class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final Cache<String, CacheEntry> cache;
    private final Duration defaultTtl;
    private final Clock clock;
    private final boolean enabled;

    public ResponseCache(Duration defaultTtl, long maxEntries, Clock clock, Ticker ticker, boolean enabled) {
        this.defaultTtl = defaultTtl;
        this.clock = clock;
        this.enabled = enabled;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryTtl())
                .ticker(ticker)
                // evict and expire on the calling thread
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("Response cache initialized: enabled={}, ttl={}, maxEntries={}", enabled, defaultTtl, maxEntries);
    }

    public ResponseCache(Duration defaultTtl, long maxEntries) {
        this(defaultTtl, maxEntries, Clock.systemUTC(), Ticker.systemTicker(), true);
    }

    public Optional<CacheEntry> get(String fingerprint) {
        if (!enabled) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    public void put(String fingerprint, DeliveryResult result) {
        put(fingerprint, result, defaultTtl);
    }

    /**
     * Stores a successful result under a fingerprint.
     *
     * @param ttl lifetime of this entry; non-positive values store nothing
     */
    public void put(String fingerprint, DeliveryResult result, Duration ttl) {
        if (!enabled || ttl == null || ttl.isNegative() || ttl.isZero()) {
            return;
        }
        cache.put(fingerprint, new CacheEntry(result, result.providerUsed(), clock.instant(), ttl));
        log.debug("Result cached: fingerprint={}, provider={}, ttlMs={}", fingerprint, result.providerUsed(), ttl.toMillis());
    }

    public void invalidate(String fingerprint) {
        cache.invalidate(fingerprint);
    }

    public void clear() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        cache.cleanUp();
        log.info("Response cache cleared: entries={}", size);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(size(), stats.hitCount(), stats.missCount(), stats.evictionCount());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private static final class EntryTtl implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
