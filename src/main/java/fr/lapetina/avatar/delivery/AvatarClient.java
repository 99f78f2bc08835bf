package fr.lapetina.avatar.delivery;

import fr.lapetina.avatar.delivery.disruptor.DeliveryEventPublisher;
import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcome;
import fr.lapetina.avatar.delivery.domain.event.OutcomeStatus;
import fr.lapetina.avatar.delivery.domain.exception.AllProvidersExhaustedException;
import fr.lapetina.avatar.delivery.domain.exception.DeadlineExceededException;
import fr.lapetina.avatar.delivery.domain.exception.DeliveryException;
import fr.lapetina.avatar.delivery.domain.exception.InvalidRequestException;
import fr.lapetina.avatar.delivery.domain.exception.RateLimitedException;
import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.DeliveryResult;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.HealthSnapshot;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.selection.HealthTieredSelector;
import fr.lapetina.avatar.delivery.domain.selection.ProviderCandidate;
import fr.lapetina.avatar.delivery.domain.selection.ProviderSelector;
import fr.lapetina.avatar.delivery.domain.validation.RequestValidator;
import fr.lapetina.avatar.delivery.infrastructure.cache.CacheEntry;
import fr.lapetina.avatar.delivery.infrastructure.cache.CacheStats;
import fr.lapetina.avatar.delivery.infrastructure.cache.ResponseCache;
import fr.lapetina.avatar.delivery.infrastructure.health.HealthMonitor;
import fr.lapetina.avatar.delivery.infrastructure.health.HealthProbeScheduler;
import fr.lapetina.avatar.delivery.infrastructure.health.ProviderRegistry;
import fr.lapetina.avatar.delivery.infrastructure.http.ProviderTransport;
import fr.lapetina.avatar.delivery.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.avatar.delivery.infrastructure.retry.RetryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for delivering utterances to avatar providers.
 *
 * <p>{@link #speak(DeliveryRequest)} runs on the caller's thread:
 * cache lookup, candidate selection, rate admission, retries against one
 * provider, failover to the next, health update and cache store. Many
 * callers may speak concurrently; shared state is per provider or per
 * cache entry and no lock is held across a network call.
 *
 * <p>Every instance owns its registry, health and rate state. Two clients
 * never share anything.
 */
public final class AvatarClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AvatarClient.class);

    private final ProviderRegistry registry;
    private final HealthMonitor healthMonitor;
    private final RateLimiter rateLimiter;
    private final ResponseCache cache;
    private final ProviderSelector selector;
    private final RetryEngine retryEngine;
    private final RequestValidator validator;
    private final ProviderTransport transport;
    private final HealthProbeScheduler probeScheduler;
    private final DeliveryEventPublisher eventPublisher;
    private final Clock clock;

    private AvatarClient(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.healthMonitor = Objects.requireNonNull(builder.healthMonitor, "healthMonitor");
        this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter");
        this.cache = Objects.requireNonNull(builder.cache, "cache");
        this.retryEngine = Objects.requireNonNull(builder.retryEngine, "retryEngine");
        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.validator = builder.validator != null ? builder.validator : RequestValidator.withDefaults();
        this.selector = builder.selector != null
                ? builder.selector
                : new HealthTieredSelector(registry, healthMonitor);
        this.probeScheduler = builder.probeScheduler != null
                ? builder.probeScheduler
                : new HealthProbeScheduler(registry, healthMonitor, transport);
        this.eventPublisher = builder.eventPublisher != null ? builder.eventPublisher : DeliveryEventPublisher.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        log.info("AvatarClient created: providers={}, selector={}, maxAttempts={}, cacheEnabled={}",
                registry.size(), selector.getName(), retryEngine.getPolicy().maxAttempts(), cache.isEnabled());
    }

    /**
     * Delivers one utterance.
     *
     * @return the provider's result, possibly served from the cache
     * @throws InvalidRequestException       the request is defective; do not resubmit as is
     * @throws RateLimitedException          every candidate was denied local admission
     * @throws AllProvidersExhaustedException every candidate was tried and failed
     * @throws DeadlineExceededException     the caller's deadline elapsed
     * @throws DeliveryException             any other terminal failure, see {@link DeliveryException#getErrorType()}
     */
    public DeliveryResult speak(DeliveryRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request is required");
        }
        long start = System.nanoTime();
        MDC.put("requestId", request.requestId());
        MDC.put("fingerprint", request.fingerprint());
        try {
            validator.validate(request);

            Optional<CacheEntry> cached = cache.get(request.fingerprint());
            if (cached.isPresent()) {
                DeliveryResult result = cached.get().result().asCached(request.requestId());
                log.debug("Cache hit: requestId={}, provider={}", request.requestId(), result.providerUsed());
                publish(request, OutcomeStatus.CACHE_HIT, result.providerUsed(), null, List.of(), start);
                return result;
            }

            List<ProviderCandidate> candidates = selector.candidates(request);
            Delivery delivery = deliver(request, candidates, start);
            publish(request, OutcomeStatus.DELIVERED, delivery.result().providerUsed(), null, delivery.attempts(), start);
            return delivery.result();
        } catch (DeliveryException e) {
            publish(request, OutcomeStatus.FAILED, null, e.getErrorType(), e.getAttempts(), start);
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected delivery failure: requestId={}", request.requestId(), e);
            publish(request, OutcomeStatus.FAILED, null, ErrorType.INTERNAL_ERROR, List.of(), start);
            throw new DeliveryException(ErrorType.INTERNAL_ERROR, "Unexpected delivery failure: " + e.getMessage(), e);
        } finally {
            MDC.remove("requestId");
            MDC.remove("fingerprint");
        }
    }

    /**
     * Convenience overload for callers that only have the three core fields.
     */
    public DeliveryResult speak(String text, String emotion, String language) {
        return speak(DeliveryRequest.of(text, emotion, language));
    }

    private Delivery deliver(DeliveryRequest request, List<ProviderCandidate> candidates, long start) {
        List<ProviderAttempt> attempts = new ArrayList<>();
        try {
            for (ProviderCandidate candidate : candidates) {
                if (request.isExpired(clock)) {
                    throw new DeadlineExceededException(
                            "Deadline exceeded after " + attempts.size() + " provider(s)", attempts);
                }

                String name = candidate.name();
                RateLimiter.Admission admission = rateLimiter.tryAcquire(name);
                if (!admission.isGranted()) {
                    log.info("Admission denied, trying next provider: requestId={}, provider={}, reason={}",
                            request.requestId(), name, admission);
                    attempts.add(ProviderAttempt.rateLimited(name, admission.name()));
                    continue;
                }

                ProviderAttempt attempt;
                MDC.put("provider", name);
                try {
                    attempt = retryEngine.execute(candidate.descriptor(), request);
                } finally {
                    rateLimiter.release(name);
                    MDC.remove("provider");
                }
                attempts.add(attempt);

                AttemptOutcome outcome = attempt.outcome();
                healthMonitor.recordOutcome(name, outcome);

                if (outcome.isSuccess()) {
                    DeliveryResult result = toResult(request, candidate.descriptor(), attempt, start);
                    cache.put(request.fingerprint(), result);
                    if (attempts.size() > 1) {
                        log.info("Delivered after failover: requestId={}, provider={}, providersTried={}",
                                request.requestId(), name, attempts.size());
                    }
                    return new Delivery(result, attempts);
                }

                ErrorType errorType = outcome.errorType();
                if (errorType == ErrorType.DEADLINE_EXCEEDED) {
                    throw new DeadlineExceededException(outcome.message(), attempts);
                }
                if (errorType == ErrorType.CANCELLED) {
                    throw new DeliveryException(ErrorType.CANCELLED, "Delivery cancelled", attempts);
                }
                if (errorType.isCallerFault()) {
                    log.warn("Request rejected as invalid, aborting: requestId={}, provider={}, outcome={}",
                            request.requestId(), name, outcome);
                    throw new InvalidRequestException(
                            "Provider " + name + " rejected the request: " + outcome.message(), attempts);
                }

                log.info("Provider failed, failing over: requestId={}, provider={}, errorType={}, calls={}",
                        request.requestId(), name, errorType, attempt.attempts());
            }
        } finally {
            releaseUnresolvedCanary(candidates);
        }

        if (attempts.stream().allMatch(a -> a.attempts() == 0 && a.errorType() == ErrorType.RATE_LIMITED)) {
            log.warn("All candidates rate limited: requestId={}, candidates={}", request.requestId(), attempts.size());
            throw new RateLimitedException(attempts);
        }
        log.warn("All providers exhausted: requestId={}, attempts={}", request.requestId(), attempts);
        throw new AllProvidersExhaustedException(attempts);
    }

    private void releaseUnresolvedCanary(List<ProviderCandidate> candidates) {
        for (ProviderCandidate candidate : candidates) {
            if (candidate.canary()) {
                healthMonitor.releaseCanary(candidate.name());
            }
        }
    }

    private DeliveryResult toResult(
            DeliveryRequest request,
            ProviderDescriptor provider,
            ProviderAttempt attempt,
            long start
    ) {
        AttemptOutcome outcome = attempt.outcome();
        return new DeliveryResult(
                request.requestId(),
                request.fingerprint(),
                provider.getName(),
                provider.getType(),
                outcome.statusCode(),
                outcome.body(),
                transport.mediaReference(provider, outcome.body()),
                attempt.attempts(),
                Duration.ofNanos(System.nanoTime() - start),
                false,
                clock.instant()
        );
    }

    private void publish(
            DeliveryRequest request,
            OutcomeStatus status,
            String provider,
            ErrorType errorType,
            List<ProviderAttempt> attempts,
            long start
    ) {
        eventPublisher.publish(new DeliveryOutcome(
                request.requestId(),
                request.fingerprint(),
                status,
                provider,
                errorType,
                attempts,
                Duration.ofNanos(System.nanoTime() - start),
                clock.instant()
        ));
    }

    /**
     * Cache counters, per-provider health and available rate-limit tokens.
     */
    public ClientStats stats() {
        return new ClientStats(cache.stats(), healthMonitor.snapshot(), rateLimiter.availableTokens());
    }

    public void clearCache() {
        cache.clear();
    }

    /**
     * Runs a liveness check against one provider now, ignoring any cooldown.
     *
     * @return the resulting health snapshot, or empty if the provider is unknown
     */
    public Optional<HealthSnapshot> probe(String providerName) {
        return probeScheduler.checkProvider(providerName);
    }

    /**
     * Replaces the provider list. Health and rate state of providers that
     * keep their name carry over; in-flight requests finish against the
     * descriptors they started with.
     */
    public void reload(List<ProviderDescriptor> providers) {
        registry.replaceAll(providers);
        log.info("Providers reloaded: count={}", registry.size());
    }

    public Map<String, HealthSnapshot> snapshot() {
        return healthMonitor.snapshot();
    }

    public List<ProviderDescriptor> providers() {
        return registry.getProviders();
    }

    /**
     * Starts the background probe loop.
     */
    public AvatarClient start() {
        probeScheduler.start();
        return this;
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public ResponseCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        log.info("Shutting down AvatarClient...");
        probeScheduler.close();
        if (eventPublisher instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing event publisher", e);
            }
        }
        transport.close();
        log.info("AvatarClient shut down");
    }

    public static Builder builder() {
        return new Builder();
    }

    private record Delivery(DeliveryResult result, List<ProviderAttempt> attempts) {
    }

    /**
     * Read-only view of the client's shared state.
     */
    public record ClientStats(
            CacheStats cache,
            Map<String, HealthSnapshot> health,
            Map<String, Double> availableTokens
    ) {
    }

    public static final class Builder {
        private ProviderRegistry registry;
        private HealthMonitor healthMonitor;
        private RateLimiter rateLimiter;
        private ResponseCache cache;
        private ProviderSelector selector;
        private RetryEngine retryEngine;
        private RequestValidator validator;
        private ProviderTransport transport;
        private HealthProbeScheduler probeScheduler;
        private DeliveryEventPublisher eventPublisher;
        private Clock clock;

        public Builder registry(ProviderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder healthMonitor(HealthMonitor healthMonitor) {
            this.healthMonitor = healthMonitor;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder cache(ResponseCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder selector(ProviderSelector selector) {
            this.selector = selector;
            return this;
        }

        public Builder retryEngine(RetryEngine retryEngine) {
            this.retryEngine = retryEngine;
            return this;
        }

        public Builder validator(RequestValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder transport(ProviderTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder probeScheduler(HealthProbeScheduler probeScheduler) {
            this.probeScheduler = probeScheduler;
            return this;
        }

        public Builder eventPublisher(DeliveryEventPublisher eventPublisher) {
            this.eventPublisher = eventPublisher;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AvatarClient build() {
            return new AvatarClient(this);
        }
    }
}
