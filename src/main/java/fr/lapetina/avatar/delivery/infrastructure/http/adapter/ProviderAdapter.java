package fr.lapetina.avatar.delivery.infrastructure.http.adapter;

import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;

import java.time.Duration;
import java.util.Map;

/**
 * Wire format of one kind of avatar backend.
 *
 * Adapters are stateless and shared by every provider of their type.
 * They build requests and read responses; sending and classifying is
 * the transport's job.
 */
public interface ProviderAdapter {

    String DEFAULT_PROBE_PATH = "/health";
    String DEFAULT_AVATAR_ID = "default";

    ProviderType type();

    /**
     * Path of the speak endpoint relative to the provider's base URL.
     */
    String defaultSpeakPath();

    default String speakPath(ProviderDescriptor descriptor) {
        return descriptor.metadata("speakPath", defaultSpeakPath());
    }

    default String probePath(ProviderDescriptor descriptor) {
        return descriptor.metadata("probePath", DEFAULT_PROBE_PATH);
    }

    /**
     * Authentication and content headers.
     *
     * @param credential resolved secret, or null when none is configured
     */
    Map<String, String> headers(String credential);

    /**
     * JSON body of the speak call, as a map serialized by the transport.
     */
    Map<String, Object> requestBody(DeliveryRequest request, ProviderDescriptor descriptor);

    /**
     * Translates the canonical emotion tag into this provider's vocabulary.
     */
    String mapEmotion(String emotion);

    /**
     * Provider-specific media reference (URL or task id) from a success body, or null.
     */
    String mediaReference(Map<String, Object> responseBody);

    /**
     * False for adapters that answer in-process.
     */
    default boolean requiresNetwork() {
        return true;
    }

    /**
     * Produces the outcome without network traffic. Only called when
     * {@link #requiresNetwork()} is false.
     */
    default AttemptOutcome respondLocally(DeliveryRequest request, ProviderDescriptor descriptor, Duration timeout) {
        throw new UnsupportedOperationException(type() + " adapter requires network");
    }

    /**
     * Avatar to address: the request's own, else the provider's configured one.
     */
    static String avatarId(DeliveryRequest request, ProviderDescriptor descriptor) {
        if (request.avatarId() != null && !request.avatarId().isBlank()) {
            return request.avatarId();
        }
        return descriptor.metadata("avatarId", DEFAULT_AVATAR_ID);
    }

    static String firstString(Map<String, Object> body, String... keys) {
        for (String key : keys) {
            Object value = body.get(key);
            if (value != null) {
                return value.toString();
            }
        }
        return null;
    }
}
