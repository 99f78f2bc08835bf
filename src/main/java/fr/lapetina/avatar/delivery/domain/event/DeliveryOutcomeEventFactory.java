package fr.lapetina.avatar.delivery.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates outcome events in the Disruptor ring buffer.
 */
public final class DeliveryOutcomeEventFactory implements EventFactory<DeliveryOutcomeEvent> {

    @Override
    public DeliveryOutcomeEvent newInstance() {
        return new DeliveryOutcomeEvent();
    }
}
