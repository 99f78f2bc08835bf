package fr.lapetina.avatar.delivery.infrastructure.ratelimit;

import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;
import fr.lapetina.avatar.delivery.infrastructure.health.ProviderRegistry;
import fr.lapetina.avatar.delivery.infrastructure.ratelimit.RateLimiter.Admission;
import fr.lapetina.avatar.delivery.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        rateLimiter = new RateLimiter(2, 1.0, clock);
    }

    private static ProviderDescriptor provider(String name) {
        return ProviderDescriptor.builder().name(name).type(ProviderType.MOCK).build();
    }

    @Nested
    @DisplayName("token bucket admission")
    class TokenAdmission {

        @Test
        @DisplayName("should throttle once the default bucket is drained")
        void shouldThrottleWhenDrained() {
            rateLimiter.configure(provider("duix"));

            assertThat(rateLimiter.tryAcquire("duix")).isEqualTo(Admission.GRANTED);
            rateLimiter.release("duix");
            assertThat(rateLimiter.tryAcquire("duix")).isEqualTo(Admission.GRANTED);
            rateLimiter.release("duix");

            assertThat(rateLimiter.tryAcquire("duix")).isEqualTo(Admission.THROTTLED);
            assertThat(rateLimiter.inFlight("duix")).isZero();
        }

        @Test
        @DisplayName("should admit again after refill without any background task")
        void shouldAdmitAfterRefill() {
            rateLimiter.configure(provider("duix"));
            rateLimiter.tryAcquire("duix");
            rateLimiter.tryAcquire("duix");
            assertThat(rateLimiter.tryAcquire("duix")).isEqualTo(Admission.THROTTLED);

            clock.advanceMillis(1000);

            assertThat(rateLimiter.tryAcquire("duix")).isEqualTo(Admission.GRANTED);
        }

        @Test
        @DisplayName("should use per-provider overrides")
        void shouldUseProviderOverrides() {
            rateLimiter.configure(ProviderDescriptor.builder()
                    .name("akool").type(ProviderType.MOCK).bucketCapacity(5).refillPerSecond(1.0).build());

            assertThat(rateLimiter.availableTokens("akool")).isEqualTo(5.0);
        }

        @Test
        @DisplayName("should keep buckets independent per provider")
        void shouldKeepBucketsIndependent() {
            rateLimiter.configure(provider("a"));
            rateLimiter.configure(provider("b"));
            rateLimiter.tryAcquire("a");
            rateLimiter.tryAcquire("a");

            assertThat(rateLimiter.tryAcquire("a")).isEqualTo(Admission.THROTTLED);
            assertThat(rateLimiter.tryAcquire("b")).isEqualTo(Admission.GRANTED);
        }
    }

    @Nested
    @DisplayName("concurrency bound")
    class ConcurrencyBound {

        @Test
        @DisplayName("should deny at capacity without spending a token")
        void shouldDenyAtCapacity() {
            rateLimiter.configure(ProviderDescriptor.builder()
                    .name("duix").type(ProviderType.MOCK).maxConcurrent(1).bucketCapacity(10).build());

            assertThat(rateLimiter.tryAcquire("duix")).isEqualTo(Admission.GRANTED);
            assertThat(rateLimiter.tryAcquire("duix")).isEqualTo(Admission.AT_CAPACITY);
            assertThat(rateLimiter.availableTokens("duix")).isEqualTo(9.0);

            rateLimiter.release("duix");
            assertThat(rateLimiter.tryAcquire("duix")).isEqualTo(Admission.GRANTED);
        }

        @Test
        @DisplayName("should release the slot when the bucket denies")
        void shouldReleaseSlotOnThrottle() {
            rateLimiter.configure(ProviderDescriptor.builder()
                    .name("duix").type(ProviderType.MOCK).maxConcurrent(5).bucketCapacity(1).build());
            rateLimiter.tryAcquire("duix");

            assertThat(rateLimiter.tryAcquire("duix")).isEqualTo(Admission.THROTTLED);
            assertThat(rateLimiter.inFlight("duix")).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should grant unknown providers")
    void shouldGrantUnknownProviders() {
        assertThat(rateLimiter.tryAcquire("unknown")).isEqualTo(Admission.GRANTED);
    }

    @Test
    @DisplayName("should follow registry reloads and keep tokens of surviving providers")
    void shouldFollowRegistryReloads() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.addListener(rateLimiter);
        registry.replaceAll(List.of(provider("a"), provider("b")));
        rateLimiter.tryAcquire("a");

        registry.replaceAll(List.of(
                ProviderDescriptor.builder().name("a").type(ProviderType.MOCK).priority(9).build()
        ));

        assertThat(rateLimiter.availableTokens()).containsOnlyKeys("a");
        assertThat(rateLimiter.availableTokens("a")).isEqualTo(1.0);
        assertThat(rateLimiter.inFlight("a")).isEqualTo(1);
    }
}
