package fr.lapetina.avatar.delivery.disruptor;

import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcome;
import fr.lapetina.avatar.delivery.domain.event.OutcomeStatus;
import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;
import fr.lapetina.avatar.delivery.infrastructure.metrics.MetricsRegistry;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeliveryEventBusTest {

    private DeliveryEventBus bus;
    private MetricsRegistry metrics;

    @AfterEach
    void tearDown() {
        if (bus != null) {
            bus.close();
        }
        if (metrics != null) {
            metrics.close();
        }
    }

    private static DeliveryOutcome delivered(String requestId) {
        return new DeliveryOutcome(requestId, "fp-" + requestId, OutcomeStatus.DELIVERED, "duix", null,
                List.of(
                        new ProviderAttempt("akool", 2, AttemptOutcome.failure(ErrorType.PROVIDER_SERVER_ERROR, "503")),
                        new ProviderAttempt("duix", 1, AttemptOutcome.success(200, Map.of(), Duration.ofMillis(30)))),
                Duration.ofMillis(120), null);
    }

    private static DeliveryOutcome failed(String requestId) {
        return new DeliveryOutcome(requestId, "fp-" + requestId, OutcomeStatus.FAILED, null,
                ErrorType.RATE_LIMITED,
                List.of(ProviderAttempt.rateLimited("duix", "bucket empty")),
                Duration.ofMillis(1), null);
    }

    @Test
    @DisplayName("should deliver published outcomes to listeners")
    void shouldDeliverToListeners() throws InterruptedException {
        List<DeliveryOutcome> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        bus = DeliveryEventBus.builder()
                .ringBufferSize(16)
                .listener(outcome -> {
                    received.add(outcome);
                    latch.countDown();
                })
                .build();
        bus.start();

        assertThat(bus.publish(delivered("r1"))).isTrue();
        assertThat(bus.publish(failed("r2"))).isTrue();

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).extracting(DeliveryOutcome::requestId).containsExactly("r1", "r2");
        assertThat(received.get(0).totalCalls()).isEqualTo(3);
    }

    @Test
    @DisplayName("should record metrics before listeners run")
    void shouldRecordMetrics() throws InterruptedException {
        metrics = new MetricsRegistry("bus_test");
        CountDownLatch latch = new CountDownLatch(2);
        bus = DeliveryEventBus.builder()
                .ringBufferSize(16)
                .metricsRegistry(metrics)
                .listener(outcome -> latch.countDown())
                .build();
        bus.start();

        bus.publish(delivered("r1"));
        bus.publish(failed("r2"));
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(counter("bus_test_deliveries_total", "provider", "duix", "status", "DELIVERED").count())
                .isEqualTo(1.0);
        assertThat(counter("bus_test_provider_attempts_total", "provider", "akool", "outcome", "PROVIDER_SERVER_ERROR").count())
                .isEqualTo(2.0);
        assertThat(counter("bus_test_rate_limited_total", "provider", "duix").count()).isEqualTo(1.0);
        assertThat(counter("bus_test_errors_total", "type", "RATE_LIMITED").count()).isEqualTo(1.0);
        assertThat(metrics.scrape()).contains("bus_test_deliveries_total");
    }

    private Counter counter(String name, String... tags) {
        Counter counter = metrics.getRegistry().find(name).tags(tags).counter();
        assertThat(counter).as("counter %s %s", name, List.of(tags)).isNotNull();
        return counter;
    }

    @Test
    @DisplayName("should keep dispatching when a listener throws")
    void shouldIsolateListenerFailures() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(2);
        bus = DeliveryEventBus.builder()
                .ringBufferSize(16)
                .listener(outcome -> {
                    throw new IllegalStateException("listener bug");
                })
                .listener(outcome -> latch.countDown())
                .build();
        bus.start();

        bus.publish(delivered("r1"));
        bus.publish(delivered("r2"));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("should drop outcomes instead of blocking when the ring buffer is full")
    void shouldDropWhenFull() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        bus = DeliveryEventBus.builder()
                .ringBufferSize(2)
                .listener(outcome -> {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                })
                .build();
        bus.start();

        bus.publish(delivered("first"));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        int accepted = 0;
        for (int i = 0; i < 5; i++) {
            if (bus.publish(delivered("burst-" + i))) {
                accepted++;
            }
        }
        release.countDown();

        assertThat(accepted).isLessThanOrEqualTo(2);
        assertThat(bus.getDroppedEvents()).isEqualTo(5 - accepted);
    }

    @Test
    @DisplayName("should refuse outcomes when not running")
    void shouldRefuseWhenStopped() {
        bus = DeliveryEventBus.builder().ringBufferSize(8).build();

        assertThat(bus.publish(delivered("early"))).isFalse();

        bus.start();
        bus.close();
        assertThat(bus.isRunning()).isFalse();
        assertThat(bus.publish(delivered("late"))).isFalse();
    }

    @Test
    @DisplayName("should reject a ring buffer size that is not a power of two")
    void shouldRejectBadRingSize() {
        assertThatThrownBy(() -> DeliveryEventBus.builder().ringBufferSize(100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
