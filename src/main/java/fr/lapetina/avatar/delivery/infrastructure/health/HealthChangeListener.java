package fr.lapetina.avatar.delivery.infrastructure.health;

import fr.lapetina.avatar.delivery.domain.model.HealthSnapshot;
import fr.lapetina.avatar.delivery.domain.model.HealthState;

/**
 * Callback for provider health transitions.
 *
 * Invoked on the thread that recorded the outcome, after the provider's
 * record has been updated and its lock released. Implementations must be fast.
 */
@FunctionalInterface
public interface HealthChangeListener {

    void onHealthChanged(HealthState previous, HealthState current, HealthSnapshot snapshot);
}
