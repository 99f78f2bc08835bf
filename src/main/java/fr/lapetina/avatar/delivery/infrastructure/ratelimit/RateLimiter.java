package fr.lapetina.avatar.delivery.infrastructure.ratelimit;

import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.infrastructure.health.ProviderRegistry.ProviderRegistryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Per-provider admission control.
 *
 * Controls:
 * - Throughput, via one token bucket per provider
 * - Concurrency, via an optional in-flight bound per provider
 *
 * {@link #tryAcquire} never blocks. A granted admission must be paired with
 * {@link #release} once the delivery attempt against that provider ends.
 * Denials reflect local policy and are never reported as provider failures.
 */
public final class RateLimiter implements Consumer<ProviderRegistryEvent> {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    /**
     * Result of an admission request.
     */
    public enum Admission {
        GRANTED,
        /** Token bucket empty */
        THROTTLED,
        /** In-flight bound reached */
        AT_CAPACITY;

        public boolean isGranted() {
            return this == GRANTED;
        }
    }

    private final Map<String, ProviderLimits> limits = new ConcurrentHashMap<>();
    private final int defaultCapacity;
    private final double defaultRefillPerSecond;
    private final Clock clock;

    public RateLimiter(int defaultCapacity, double defaultRefillPerSecond, Clock clock) {
        this.defaultCapacity = defaultCapacity;
        this.defaultRefillPerSecond = defaultRefillPerSecond;
        this.clock = clock;
    }

    @Override
    public void accept(ProviderRegistryEvent event) {
        switch (event.type()) {
            case ADDED, UPDATED -> configure(event.descriptor());
            case REMOVED -> limits.remove(event.name());
        }
    }

    /**
     * Creates or reconfigures the limits of a provider. Reconfiguration keeps
     * the tokens and in-flight count it already has.
     */
    public void configure(ProviderDescriptor descriptor) {
        int capacity = descriptor.getBucketCapacity() > 0 ? descriptor.getBucketCapacity() : defaultCapacity;
        double refill = descriptor.getRefillPerSecond() > 0 ? descriptor.getRefillPerSecond() : defaultRefillPerSecond;
        int maxConcurrent = descriptor.getMaxConcurrent();

        limits.compute(descriptor.getName(), (name, existing) -> {
            if (existing == null) {
                log.debug("Rate limits configured: provider={}, capacity={}, refillPerSecond={}, maxConcurrent={}",
                        name, capacity, refill, maxConcurrent);
                return new ProviderLimits(new TokenBucket(capacity, refill, clock), maxConcurrent, new AtomicInteger());
            }
            TokenBucket bucket = existing.bucket();
            if (bucket.getCapacity() != capacity || Double.compare(bucket.getRefillPerSecond(), refill) != 0) {
                bucket = bucket.resize(capacity, refill);
                log.info("Rate limits updated: provider={}, capacity={}, refillPerSecond={}", name, capacity, refill);
            }
            return new ProviderLimits(bucket, maxConcurrent, existing.inFlight());
        });
    }

    /**
     * Asks to start one delivery against a provider.
     * Unknown providers are admitted without limits.
     */
    public Admission tryAcquire(String provider) {
        ProviderLimits providerLimits = limits.get(provider);
        if (providerLimits == null) {
            return Admission.GRANTED;
        }
        if (!providerLimits.tryAcquireSlot()) {
            log.debug("Admission denied: provider={}, reason=at-capacity, inFlight={}/{}",
                    provider, providerLimits.inFlight().get(), providerLimits.maxConcurrent());
            return Admission.AT_CAPACITY;
        }
        if (!providerLimits.bucket().tryConsume()) {
            providerLimits.releaseSlot();
            log.debug("Admission denied: provider={}, reason=throttled", provider);
            return Admission.THROTTLED;
        }
        return Admission.GRANTED;
    }

    /**
     * Ends a granted admission. Tokens are not returned; only the in-flight slot is.
     */
    public void release(String provider) {
        ProviderLimits providerLimits = limits.get(provider);
        if (providerLimits != null) {
            providerLimits.releaseSlot();
        }
    }

    public double availableTokens(String provider) {
        ProviderLimits providerLimits = limits.get(provider);
        return providerLimits != null ? providerLimits.bucket().availableTokens() : 0;
    }

    public int inFlight(String provider) {
        ProviderLimits providerLimits = limits.get(provider);
        return providerLimits != null ? providerLimits.inFlight().get() : 0;
    }

    /**
     * Available tokens per provider, ordered by name.
     */
    public Map<String, Double> availableTokens() {
        Map<String, Double> tokens = new TreeMap<>();
        limits.forEach((name, providerLimits) -> tokens.put(name, providerLimits.bucket().availableTokens()));
        return tokens;
    }

    private record ProviderLimits(TokenBucket bucket, int maxConcurrent, AtomicInteger inFlight) {

        boolean tryAcquireSlot() {
            while (true) {
                int current = inFlight.get();
                if (maxConcurrent > 0 && current >= maxConcurrent) {
                    return false;
                }
                if (inFlight.compareAndSet(current, current + 1)) {
                    return true;
                }
            }
        }

        void releaseSlot() {
            inFlight.updateAndGet(current -> Math.max(0, current - 1));
        }
    }
}
