package fr.lapetina.avatar.delivery.domain.selection;

import fr.lapetina.avatar.delivery.domain.model.HealthState;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;

/**
 * One entry of an ordered candidate list.
 *
 * @param state  health state observed when the list was built
 * @param canary true for the single UNHEALTHY provider offered after its cooldown
 */
public record ProviderCandidate(ProviderDescriptor descriptor, HealthState state, boolean canary) {

    public String name() {
        return descriptor.getName();
    }
}
