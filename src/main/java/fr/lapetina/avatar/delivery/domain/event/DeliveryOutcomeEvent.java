package fr.lapetina.avatar.delivery.domain.event;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable holder reused across the ring buffer. Handlers read the outcome;
 * the last handler clears the slot.
 */
public final class DeliveryOutcomeEvent {

    private DeliveryOutcome outcome;
    private long sequence = -1;

    public void clear() {
        this.outcome = null;
        this.sequence = -1;
    }

    public void initialize(DeliveryOutcome outcome, long sequence) {
        this.outcome = outcome;
        this.sequence = sequence;
    }

    public DeliveryOutcome getOutcome() {
        return outcome;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "DeliveryOutcomeEvent{" +
                "sequence=" + sequence +
                ", outcome=" + outcome +
                '}';
    }
}
