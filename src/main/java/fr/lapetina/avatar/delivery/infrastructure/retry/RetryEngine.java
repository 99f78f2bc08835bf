package fr.lapetina.avatar.delivery.infrastructure.retry;

import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.infrastructure.http.OutcomeClassifier;
import fr.lapetina.avatar.delivery.infrastructure.http.ProviderTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Runs one logical delivery against a single provider with bounded retries.
 *
 * <p>Only failures whose type is retryable on the same provider are retried
 * (timeouts, transport errors, server errors). Everything else ends the
 * loop at once and is handed back for failover or abort.
 *
 * <p>The caller's deadline bounds every call and every backoff sleep. When
 * it runs out the result carries {@link ErrorType#DEADLINE_EXCEEDED}; an
 * interrupt yields {@link ErrorType#CANCELLED}. Neither is the provider's fault.
 *
 * <p>Never throws for provider-side problems and holds no locks.
 */
public final class RetryEngine {

    private static final Logger log = LoggerFactory.getLogger(RetryEngine.class);

    private final BackoffPolicy policy;
    private final ProviderTransport transport;
    private final Duration attemptTimeout;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random random;

    public RetryEngine(
            BackoffPolicy policy,
            ProviderTransport transport,
            Duration attemptTimeout,
            Clock clock,
            Sleeper sleeper,
            Random random
    ) {
        this.policy = policy;
        this.transport = transport;
        this.attemptTimeout = attemptTimeout;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
    }

    public RetryEngine(BackoffPolicy policy, ProviderTransport transport, Duration attemptTimeout) {
        this(policy, transport, attemptTimeout, Clock.systemUTC(), Sleeper.THREAD, new Random());
    }

    /**
     * @return the final outcome for this provider and the number of calls made
     */
    public ProviderAttempt execute(ProviderDescriptor provider, DeliveryRequest request) {
        String name = provider.getName();
        AttemptOutcome last = null;
        int calls = 0;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            Duration remaining = request.remaining(clock);
            if (remaining != null && remaining.isZero()) {
                return deadlineExceeded(name, calls, request, "before attempt " + attempt);
            }
            boolean boundByDeadline = remaining != null && remaining.compareTo(attemptTimeout) < 0;
            Duration timeout = boundByDeadline ? remaining : attemptTimeout;

            last = call(provider, request, timeout);
            calls++;

            if (last.isSuccess()) {
                if (attempt > 1) {
                    log.info("Retry succeeded: provider={}, requestId={}, attempt={}/{}",
                            name, request.requestId(), attempt, policy.maxAttempts());
                }
                return new ProviderAttempt(name, calls, last);
            }
            if (last.errorType() == ErrorType.TIMEOUT && boundByDeadline && request.isExpired(clock)) {
                return deadlineExceeded(name, calls, request, "during attempt " + attempt);
            }
            if (last.errorType() == ErrorType.CANCELLED) {
                return new ProviderAttempt(name, calls, last);
            }

            log.debug("Attempt failed: provider={}, requestId={}, attempt={}/{}, outcome={}",
                    name, request.requestId(), attempt, policy.maxAttempts(), last);

            if (!last.isRetryableOnSameProvider() || attempt == policy.maxAttempts()) {
                break;
            }

            Duration delay = policy.delay(attempt, random);
            Duration left = request.remaining(clock);
            if (left != null && delay.compareTo(left) >= 0) {
                // no room for another try here; the next provider needs no backoff
                log.debug("Backoff exceeds remaining deadline, giving up on provider: provider={}, requestId={}, delay={}ms, left={}ms",
                        name, request.requestId(), delay.toMillis(), left.toMillis());
                break;
            }
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Retry interrupted: provider={}, requestId={}", name, request.requestId());
                return new ProviderAttempt(name, calls, AttemptOutcome.failure(ErrorType.CANCELLED, "Interrupted during backoff"));
            }
        }

        if (last != null && last.isRetryableOnSameProvider()) {
            log.warn("All {} attempts exhausted: provider={}, requestId={}, lastOutcome={}",
                    calls, name, request.requestId(), last);
        }
        return new ProviderAttempt(name, calls, last);
    }

    private AttemptOutcome call(ProviderDescriptor provider, DeliveryRequest request, Duration timeout) {
        long start = System.nanoTime();
        try {
            return transport.send(provider, request, timeout);
        } catch (RuntimeException e) {
            log.error("Transport threw: provider={}, requestId={}", provider.getName(), request.requestId(), e);
            return OutcomeClassifier.classify(e, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private ProviderAttempt deadlineExceeded(String provider, int calls, DeliveryRequest request, String when) {
        log.info("Deadline exceeded: provider={}, requestId={}, when={}", provider, request.requestId(), when);
        return new ProviderAttempt(provider, calls,
                AttemptOutcome.failure(ErrorType.DEADLINE_EXCEEDED, "Caller deadline exceeded " + when));
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }
}
