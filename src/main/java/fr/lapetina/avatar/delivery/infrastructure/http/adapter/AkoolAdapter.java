package fr.lapetina.avatar.delivery.infrastructure.http.adapter;

import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Akool avatar API. Text goes in {@code input_text}; generation is
 * asynchronous and answered with video and generation ids.
 */
public final class AkoolAdapter implements ProviderAdapter {

    private static final Map<String, String> EMOTIONS = Map.of(
            "neutral", "neutral",
            "happy", "happy",
            "sad", "sad",
            "excited", "excited",
            "serious", "professional",
            "friendly", "warm"
    );

    @Override
    public ProviderType type() {
        return ProviderType.AKOOL;
    }

    @Override
    public String defaultSpeakPath() {
        return "/v1/avatar/speak";
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
        body.put("avatar_id", ProviderAdapter.avatarId(request, descriptor));
        body.put("input_text", request.text());
        body.put("emotion", mapEmotion(request.emotion()));
        body.put("language", request.language());
        if (request.voiceId() != null) {
            body.put("voice_id", request.voiceId());
        }
        return body;
    }

    @Override
    public String mapEmotion(String emotion) {
        return EMOTIONS.getOrDefault(emotion, "neutral");
    }

    @Override
    public String mediaReference(Map<String, Object> responseBody) {
        return ProviderAdapter.firstString(responseBody, "video_id", "generation_id");
    }
}
