package fr.lapetina.avatar.delivery.infrastructure.http.adapter;

import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Self-hosted avatar service speaking the canonical
 * {@code {"text", "emotion", "language"}} shape. Emotion tags pass through unchanged.
 */
public final class LocalAdapter implements ProviderAdapter {

    @Override
    public ProviderType type() {
        return ProviderType.LOCAL;
    }

    @Override
    public String defaultSpeakPath() {
        return "/speak";
    }

    @Override
    public Map<String, String> headers(String credential) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        if (credential != null) {
            headers.put("Authorization", "Bearer " + credential);
        }
        return headers;
    }

    @Override
    public Map<String, Object> requestBody(DeliveryRequest request, ProviderDescriptor descriptor) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", request.text());
        body.put("emotion", mapEmotion(request.emotion()));
        body.put("language", request.language());
        return body;
    }

    @Override
    public String mapEmotion(String emotion) {
        return emotion;
    }

    @Override
    public String mediaReference(Map<String, Object> responseBody) {
        return ProviderAdapter.firstString(responseBody, "media_url", "video_url", "audio_url");
    }
}
