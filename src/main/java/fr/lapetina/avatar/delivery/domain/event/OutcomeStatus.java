package fr.lapetina.avatar.delivery.domain.event;

/**
 * How a {@code speak} call ended.
 */
public enum OutcomeStatus {
    CACHE_HIT,
    DELIVERED,
    FAILED
}
