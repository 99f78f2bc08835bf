package fr.lapetina.avatar.delivery.infrastructure.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket with continuous refill.
 *
 * Tokens are topped up from the elapsed time on every access, so no
 * background ticking is needed. The token count never goes below zero:
 * a consume either takes a whole token or fails.
 *
 * Thread-safe; each bucket is its own monitor.
 */
public final class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final int capacity;
    private final double refillPerSecond;
    private final Clock clock;

    private double tokens;
    private Instant lastRefill;

    public TokenBucket(int capacity, double refillPerSecond, Clock clock) {
        this(capacity, refillPerSecond, clock, capacity);
    }

    TokenBucket(int capacity, double refillPerSecond, Clock clock, double initialTokens) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1: " + capacity);
        }
        if (refillPerSecond <= 0) {
            throw new IllegalArgumentException("Refill rate must be positive: " + refillPerSecond);
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.clock = clock;
        this.tokens = Math.max(0, Math.min(capacity, initialTokens));
        this.lastRefill = clock.instant();
    }

    /**
     * Takes one token if available.
     */
    public synchronized boolean tryConsume() {
        refill();
        if (tokens >= 1) {
            tokens -= 1;
            return true;
        }
        return false;
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    /**
     * Time until the next whole token is available; zero if one is available now.
     */
    public synchronized Duration timeUntilNextToken() {
        refill();
        if (tokens >= 1) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((long) Math.ceil((1 - tokens) / refillPerSecond * NANOS_PER_SECOND));
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        if (elapsedNanos <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsedNanos * refillPerSecond / NANOS_PER_SECOND);
        lastRefill = now;
    }

    /**
     * New bucket with other limits that keeps the tokens currently available, capped at the new capacity.
     */
    public TokenBucket resize(int newCapacity, double newRefillPerSecond) {
        return new TokenBucket(newCapacity, newRefillPerSecond, clock, availableTokens());
    }

    public int getCapacity() {
        return capacity;
    }

    public double getRefillPerSecond() {
        return refillPerSecond;
    }

    @Override
    public String toString() {
        return "TokenBucket{capacity=" + capacity + ", refillPerSecond=" + refillPerSecond + "}";
    }
}
