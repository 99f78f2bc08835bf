package fr.lapetina.avatar.delivery.domain.model;

import fr.lapetina.avatar.delivery.testing.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryRequestTest {

    @Test
    @DisplayName("should fingerprint the payload only")
    void shouldIgnoreRequestIdAndDeadline() {
        MutableClock clock = new MutableClock();
        DeliveryRequest first = DeliveryRequest.builder()
                .requestId("a").text("Goal!").emotion("excited").language("en").build();
        DeliveryRequest second = DeliveryRequest.builder()
                .requestId("b").text("Goal!").emotion("excited").language("en")
                .timeout(Duration.ofSeconds(3), clock).build();

        assertThat(first.fingerprint()).isEqualTo(second.fingerprint()).hasSize(64);
    }

    @Test
    @DisplayName("should give different fingerprints for different payload fields")
    void shouldDistinguishPayloads() {
        String base = DeliveryRequest.of("Goal!", "excited", "en").fingerprint();

        assertThat(DeliveryRequest.of("Goal!", "happy", "en").fingerprint()).isNotEqualTo(base);
        assertThat(DeliveryRequest.of("Goal!", "excited", "fr").fingerprint()).isNotEqualTo(base);
        assertThat(DeliveryRequest.builder().text("Goal!").emotion("excited").avatarId("x").build().fingerprint())
                .isNotEqualTo(base);
    }

    @Test
    @DisplayName("should keep field boundaries in the fingerprint")
    void shouldSeparateFields() {
        assertThat(DeliveryRequest.fingerprintOf("ab", "c", "en", null, null, null))
                .isNotEqualTo(DeliveryRequest.fingerprintOf("a", "bc", "en", null, null, null));
    }

    @Test
    @DisplayName("should apply defaults and generate a request id")
    void shouldApplyDefaults() {
        DeliveryRequest request = DeliveryRequest.builder().text("Hello").build();

        assertThat(request.emotion()).isEqualTo(DeliveryRequest.DEFAULT_EMOTION);
        assertThat(request.language()).isEqualTo(DeliveryRequest.DEFAULT_LANGUAGE);
        assertThat(request.requestId()).isNotBlank();
        assertThat(request.hasDeadline()).isFalse();
        assertThat(request.remaining(new MutableClock())).isNull();
    }

    @Test
    @DisplayName("should report remaining time, never negative")
    void shouldReportRemaining() {
        MutableClock clock = new MutableClock();
        DeliveryRequest request = DeliveryRequest.builder().text("Hi").timeout(Duration.ofMillis(200), clock).build();

        assertThat(request.remaining(clock)).isEqualTo(Duration.ofMillis(200));
        assertThat(request.isExpired(clock)).isFalse();

        clock.advanceMillis(500);
        assertThat(request.remaining(clock)).isEqualTo(Duration.ZERO);
        assertThat(request.isExpired(clock)).isTrue();
    }
}
