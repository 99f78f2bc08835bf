package fr.lapetina.avatar.delivery.disruptor;

import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcome;

/**
 * External consumer of per-request outcomes.
 *
 * Called on the event bus consumer thread, never on the caller's thread.
 */
@FunctionalInterface
public interface DeliveryEventListener {

    void onDeliveryOutcome(DeliveryOutcome outcome);
}
