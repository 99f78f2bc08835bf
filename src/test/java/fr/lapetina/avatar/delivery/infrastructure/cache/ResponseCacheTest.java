package fr.lapetina.avatar.delivery.infrastructure.cache;

import fr.lapetina.avatar.delivery.domain.model.DeliveryResult;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;
import fr.lapetina.avatar.delivery.testing.FakeTicker;
import fr.lapetina.avatar.delivery.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {

    private MutableClock clock;
    private FakeTicker ticker;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        ticker = new FakeTicker();
        cache = new ResponseCache(Duration.ofSeconds(5), 3, clock, ticker, true);
    }

    private static DeliveryResult result(String fingerprint, String provider) {
        return new DeliveryResult("req-" + fingerprint, fingerprint, provider, ProviderType.MOCK, 200,
                Map.of("mock_video_url", "https://mock/" + fingerprint), "https://mock/" + fingerprint,
                1, Duration.ofMillis(40), false, null);
    }

    @Test
    @DisplayName("should return a stored result before its TTL")
    void shouldReturnStoredResult() {
        cache.put("fp-1", result("fp-1", "duix"));

        Optional<CacheEntry> entry = cache.get("fp-1");

        assertThat(entry).isPresent();
        assertThat(entry.get().providerUsed()).isEqualTo("duix");
        assertThat(entry.get().storedAt()).isEqualTo(clock.instant());
        assertThat(entry.get().expiresAt()).isEqualTo(clock.instant().plusSeconds(5));
    }

    @Test
    @DisplayName("should expire entries after the default TTL")
    void shouldExpireAfterTtl() {
        cache.put("fp-1", result("fp-1", "duix"));

        ticker.advance(Duration.ofMillis(4999));
        assertThat(cache.get("fp-1")).isPresent();

        ticker.advance(Duration.ofMillis(1));
        assertThat(cache.get("fp-1")).isEmpty();
    }

    @Test
    @DisplayName("should honour a per-entry TTL")
    void shouldHonourPerEntryTtl() {
        cache.put("short", result("short", "duix"), Duration.ofMillis(100));
        cache.put("long", result("long", "duix"), Duration.ofSeconds(30));

        ticker.advance(Duration.ofSeconds(1));

        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("long")).isPresent();
    }

    @Test
    @DisplayName("should ignore non-positive TTLs")
    void shouldIgnoreNonPositiveTtl() {
        cache.put("fp-1", result("fp-1", "duix"), Duration.ZERO);
        cache.put("fp-2", result("fp-2", "duix"), Duration.ofSeconds(-1));

        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("should stay within capacity")
    void shouldStayWithinCapacity() {
        for (int i = 0; i < 10; i++) {
            cache.put("fp-" + i, result("fp-" + i, "duix"));
        }

        assertThat(cache.size()).isLessThanOrEqualTo(3);
        assertThat(cache.stats().evictionCount()).isGreaterThanOrEqualTo(7);
    }

    @Test
    @DisplayName("should keep the most recently stored entry when over capacity")
    void shouldKeepNewestEntryOnOverflow() {
        ResponseCache bounded = new ResponseCache(Duration.ofSeconds(5), 100, clock, ticker, true);
        for (int i = 0; i < 106; i++) {
            bounded.put("fp-" + i, result("fp-" + i, "duix"));
        }

        assertThat(bounded.size()).isLessThanOrEqualTo(100);
        assertThat(bounded.get("fp-105")).isPresent();
        assertThat(bounded.get("fp-105").get().providerUsed()).isEqualTo("duix");
    }

    @Test
    @DisplayName("should count hits and misses")
    void shouldCountHitsAndMisses() {
        cache.put("fp-1", result("fp-1", "duix"));

        cache.get("fp-1");
        cache.get("fp-1");
        cache.get("fp-2");

        CacheStats stats = cache.stats();
        assertThat(stats.hitCount()).isEqualTo(2);
        assertThat(stats.missCount()).isEqualTo(1);
        assertThat(stats.hitRate()).isCloseTo(2.0 / 3.0, org.assertj.core.data.Offset.offset(1e-9));
    }

    @Test
    @DisplayName("should clear and invalidate")
    void shouldClearAndInvalidate() {
        cache.put("fp-1", result("fp-1", "duix"));
        cache.put("fp-2", result("fp-2", "akool"));

        cache.invalidate("fp-1");
        assertThat(cache.get("fp-1")).isEmpty();

        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("should store and serve nothing when disabled")
    void shouldDoNothingWhenDisabled() {
        ResponseCache disabled = new ResponseCache(Duration.ofSeconds(5), 3, clock, ticker, false);

        disabled.put("fp-1", result("fp-1", "duix"));

        assertThat(disabled.get("fp-1")).isEmpty();
        assertThat(disabled.isEnabled()).isFalse();
    }
}
