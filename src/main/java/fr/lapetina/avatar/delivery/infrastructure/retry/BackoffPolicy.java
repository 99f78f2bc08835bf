package fr.lapetina.avatar.delivery.infrastructure.retry;

import fr.lapetina.avatar.delivery.infrastructure.config.AvatarClientConfig;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff with full jitter.
 *
 * <h2>Back-off formula</h2>
 * <pre>
 *   ceiling(n) = min(baseDelay * 2^(n-1), maxDelay)
 *   delay(n)   = random(0, ceiling(n))
 * </pre>
 * where {@code n} is the number of the attempt that just failed.
 *
 * @param maxAttempts total calls allowed against one provider, first call included
 */
public record BackoffPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Backoff must satisfy 0 <= baseDelay <= maxDelay");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(5));
    }

    public static BackoffPolicy fromConfig(AvatarClientConfig.RetryConfig config) {
        return new BackoffPolicy(
                config.getMaxAttempts(),
                Duration.ofMillis(config.getBaseDelayMs()),
                Duration.ofMillis(config.getMaxDelayMs())
        );
    }

    /**
     * Upper bound of the delay after attempt {@code n}.
     */
    public Duration ceiling(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        if (base > (cap >> exponent)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(base << exponent, cap));
    }

    /**
     * Jittered delay after attempt {@code n}, uniformly drawn from {@code [0, ceiling(n)]}.
     */
    public Duration delay(int attempt, Random random) {
        long ceilingMs = ceiling(attempt).toMillis();
        if (ceilingMs == 0) {
            return Duration.ZERO;
        }
        long drawn = (long) (random.nextDouble() * (ceilingMs + 1));
        return Duration.ofMillis(Math.min(drawn, ceilingMs));
    }
}
