package fr.lapetina.avatar.delivery.domain.selection;

import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;

import java.util.List;

/**
 * Orders providers for one delivery.
 *
 * Implementations must be thread-safe as they are called from every
 * concurrent {@code speak} invocation.
 */
public interface ProviderSelector {

    /**
     * Returns the name of this selector for logging.
     */
    String getName();

    /**
     * Builds the ordered list of providers to try for a request.
     *
     * <p>A returned canary candidate holds the provider's canary claim; the
     * caller must resolve it by recording an outcome or releasing the claim.
     *
     * @return a non-empty list, best candidate first
     * @throws fr.lapetina.avatar.delivery.domain.exception.NoAvailableProviderException
     *         when no provider can serve the request
     */
    List<ProviderCandidate> candidates(DeliveryRequest request);
}
