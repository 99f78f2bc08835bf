package fr.lapetina.avatar.delivery.disruptor;

import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcome;

/**
 * Sink for per-request outcomes. Publishing never blocks and never throws.
 */
@FunctionalInterface
public interface DeliveryEventPublisher {

    DeliveryEventPublisher NOOP = outcome -> true;

    /**
     * @return false if the outcome was dropped
     */
    boolean publish(DeliveryOutcome outcome);
}
