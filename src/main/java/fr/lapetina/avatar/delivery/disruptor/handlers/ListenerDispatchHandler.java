package fr.lapetina.avatar.delivery.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.avatar.delivery.disruptor.DeliveryEventListener;
import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcome;
import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcomeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Final stage handler: hands each outcome to the registered listeners and
 * clears the event for reuse.
 *
 * A failing listener is logged and does not affect the others.
 */
public final class ListenerDispatchHandler implements EventHandler<DeliveryOutcomeEvent> {

    private static final Logger log = LoggerFactory.getLogger(ListenerDispatchHandler.class);

    private final List<DeliveryEventListener> listeners;

    public ListenerDispatchHandler(List<DeliveryEventListener> listeners) {
        this.listeners = listeners;
    }

    @Override
    public void onEvent(DeliveryOutcomeEvent event, long sequence, boolean endOfBatch) {
        try {
            DeliveryOutcome outcome = event.getOutcome();
            if (outcome == null) {
                return;
            }
            for (DeliveryEventListener listener : listeners) {
                try {
                    listener.onDeliveryOutcome(outcome);
                } catch (Exception e) {
                    log.error("Delivery listener failed: requestId={}, listener={}",
                            outcome.requestId(), listener.getClass().getSimpleName(), e);
                }
            }
        } finally {
            event.clear();
        }
    }
}
