package fr.lapetina.avatar.delivery.infrastructure.http;

import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;

import java.time.Duration;
import java.util.Map;

/**
 * Performs single calls against a provider.
 *
 * Implementations never throw for provider-side problems: every result,
 * including I/O failures and timeouts, comes back as an {@link AttemptOutcome}.
 * Calls block the calling thread only and must honour interruption.
 */
public interface ProviderTransport extends AutoCloseable {

    /**
     * One speak call.
     *
     * @param timeout upper bound for this call
     */
    AttemptOutcome send(ProviderDescriptor provider, DeliveryRequest request, Duration timeout);

    /**
     * Lightweight liveness check.
     */
    AttemptOutcome probe(ProviderDescriptor provider, Duration timeout);

    /**
     * Provider-specific media reference extracted from a success body, or null.
     */
    default String mediaReference(ProviderDescriptor provider, Map<String, Object> body) {
        return null;
    }

    @Override
    default void close() {
    }
}
