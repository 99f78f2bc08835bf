package fr.lapetina.avatar.delivery.domain.selection;

import fr.lapetina.avatar.delivery.domain.exception.NoAvailableProviderException;
import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.HealthState;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;
import fr.lapetina.avatar.delivery.infrastructure.health.HealthMonitor;
import fr.lapetina.avatar.delivery.infrastructure.health.HealthPolicy;
import fr.lapetina.avatar.delivery.infrastructure.health.ProviderRegistry;
import fr.lapetina.avatar.delivery.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthTieredSelectorTest {

    private MutableClock clock;
    private ProviderRegistry registry;
    private HealthMonitor monitor;
    private HealthTieredSelector selector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ProviderRegistry();
        monitor = new HealthMonitor(HealthPolicy.defaults(), clock);
        registry.addListener(monitor);
        selector = new HealthTieredSelector(registry, monitor);
    }

    private static ProviderDescriptor provider(String name, int priority, String... languages) {
        return ProviderDescriptor.builder()
                .name(name)
                .type(ProviderType.MOCK)
                .priority(priority)
                .languages(Set.of(languages))
                .build();
    }

    private void fail(String provider, int times) {
        for (int i = 0; i < times; i++) {
            monitor.recordOutcome(provider, AttemptOutcome.failure(ErrorType.PROVIDER_SERVER_ERROR, "boom"));
        }
    }

    private List<String> names(DeliveryRequest request) {
        return selector.candidates(request).stream().map(ProviderCandidate::name).toList();
    }

    private static DeliveryRequest english() {
        return DeliveryRequest.of("Goal!", "excited", "en");
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("should order by priority within the healthy tier")
        void shouldOrderByPriority() {
            registry.replaceAll(List.of(provider("low", 1), provider("high", 5), provider("mid", 3)));

            assertThat(names(english())).containsExactly("high", "mid", "low");
        }

        @Test
        @DisplayName("should put DEGRADED providers after HEALTHY ones regardless of priority")
        void shouldPutDegradedLast() {
            registry.replaceAll(List.of(provider("preferred", 10), provider("backup", 1)));
            fail("preferred", 3);

            List<ProviderCandidate> candidates = selector.candidates(english());

            assertThat(candidates).extracting(ProviderCandidate::name).containsExactly("backup", "preferred");
            assertThat(candidates.get(1).state()).isEqualTo(HealthState.DEGRADED);
        }

        @Test
        @DisplayName("should rotate providers that share tier and priority")
        void shouldRotateTies() {
            registry.replaceAll(List.of(provider("a", 1), provider("b", 1), provider("c", 1)));

            Set<String> firsts = new HashSet<>();
            for (int i = 0; i < 3; i++) {
                firsts.add(names(english()).get(0));
            }

            assertThat(firsts).containsExactlyInAnyOrder("a", "b", "c");
        }
    }

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        @DisplayName("should drop providers lacking the requested language")
        void shouldFilterByLanguage() {
            registry.replaceAll(List.of(provider("en-only", 5, "en"), provider("fr-only", 9, "fr")));

            assertThat(names(DeliveryRequest.of("But!", "excited", "fr-FR"))).containsExactly("fr-only");
        }

        @Test
        @DisplayName("should drop disabled providers")
        void shouldDropDisabled() {
            registry.replaceAll(List.of(
                    provider("on", 1),
                    ProviderDescriptor.builder().name("off").type(ProviderType.MOCK).priority(9).enabled(false).build()));

            assertThat(names(english())).containsExactly("on");
        }

        @Test
        @DisplayName("should fail when no provider can serve the request")
        void shouldFailWithoutCapableProvider() {
            registry.replaceAll(List.of(provider("en-only", 1, "en")));

            assertThatThrownBy(() -> selector.candidates(DeliveryRequest.of("Tor!", "excited", "de")))
                    .isInstanceOf(NoAvailableProviderException.class)
                    .hasMessageContaining("language=de");
        }
    }

    @Nested
    @DisplayName("Unhealthy providers")
    class Unhealthy {

        @Test
        @DisplayName("should exclude UNHEALTHY providers during cooldown")
        void shouldExcludeDuringCooldown() {
            registry.replaceAll(List.of(provider("down", 9), provider("up", 1)));
            fail("down", 5);

            assertThat(names(english())).containsExactly("up");
        }

        @Test
        @DisplayName("should offer one canary after cooldown, last in order")
        void shouldOfferCanaryLast() {
            registry.replaceAll(List.of(provider("down", 9), provider("up", 1)));
            fail("down", 5);
            clock.advance(Duration.ofSeconds(6));

            List<ProviderCandidate> first = selector.candidates(english());
            List<ProviderCandidate> second = selector.candidates(english());

            assertThat(first).extracting(ProviderCandidate::name).containsExactly("up", "down");
            assertThat(first.get(1).canary()).isTrue();
            assertThat(second).extracting(ProviderCandidate::name).containsExactly("up");
        }

        @Test
        @DisplayName("should fail when every capable provider is cooling down")
        void shouldFailWhenAllCoolingDown() {
            registry.replaceAll(List.of(provider("only", 1)));
            fail("only", 5);

            assertThatThrownBy(() -> selector.candidates(english()))
                    .isInstanceOf(NoAvailableProviderException.class)
                    .hasMessageContaining("cooling down");
        }
    }
}
