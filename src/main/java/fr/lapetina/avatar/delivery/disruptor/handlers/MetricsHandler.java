package fr.lapetina.avatar.delivery.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcome;
import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcomeEvent;
import fr.lapetina.avatar.delivery.domain.event.OutcomeStatus;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;
import fr.lapetina.avatar.delivery.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * First stage handler: records metrics for each delivery outcome.
 *
 * Records:
 * - Delivery count by provider and status
 * - End-to-end latency
 * - Provider calls by outcome, and rate-limit denials
 * - Error counts by type
 * - Sets MDC context for structured logging
 */
public final class MetricsHandler implements EventHandler<DeliveryOutcomeEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(DeliveryOutcomeEvent event, long sequence, boolean endOfBatch) {
        DeliveryOutcome outcome = event.getOutcome();
        if (outcome == null) {
            return;
        }
        setupMDC(outcome);
        try {
            recordMetrics(outcome);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(DeliveryOutcome outcome) {
        MDC.put("requestId", outcome.requestId());
        MDC.put("fingerprint", outcome.fingerprint());
        if (outcome.providerUsed() != null) {
            MDC.put("provider", outcome.providerUsed());
        }
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("fingerprint");
        MDC.remove("provider");
    }

    private void recordMetrics(DeliveryOutcome outcome) {
        String provider = outcome.providerUsed() != null ? outcome.providerUsed() : "none";
        metricsRegistry.incrementDeliveryCount(provider, outcome.status());
        metricsRegistry.recordLatency(outcome.status(), outcome.latency());

        for (ProviderAttempt attempt : outcome.attempts()) {
            if (attempt.isSuccess()) {
                metricsRegistry.incrementAttemptCount(attempt.provider(), "SUCCESS", attempt.attempts());
            } else if (attempt.attempts() == 0 && attempt.errorType() == ErrorType.RATE_LIMITED) {
                metricsRegistry.incrementRateLimited(attempt.provider());
            } else {
                metricsRegistry.incrementAttemptCount(attempt.provider(), attempt.errorType().name(), attempt.attempts());
            }
        }

        if (outcome.status() == OutcomeStatus.FAILED && outcome.errorType() != null) {
            metricsRegistry.incrementErrorCount(outcome.errorType());
            log.debug("Delivery failure recorded: errorType={}, providersTried={}",
                    outcome.errorType(), outcome.attempts().size());
        }
    }
}
