package fr.lapetina.avatar.delivery.infrastructure.http.adapter;

import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DUIX digital human API.
 */
public final class DuixAdapter implements ProviderAdapter {

    private static final Map<String, String> EMOTIONS = Map.ofEntries(
            Map.entry("neutral", "neutral"),
            Map.entry("happy", "joy"),
            Map.entry("sad", "sadness"),
            Map.entry("angry", "anger"),
            Map.entry("surprised", "surprise"),
            Map.entry("excited", "excitement"),
            Map.entry("confused", "confusion"),
            Map.entry("serious", "serious"),
            Map.entry("analytical", "thoughtful"),
            Map.entry("friendly", "friendly"),
            Map.entry("playful", "playful")
    );

    @Override
    public ProviderType type() {
        return ProviderType.DUIX;
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
        body.put("text", request.text());
        body.put("emotion", mapEmotion(request.emotion()));
        body.put("language", request.language());
        if (request.voiceId() != null) {
            body.put("voice_id", request.voiceId());
        }
        if (request.gesture() != null) {
            body.put("gesture", request.gesture());
        }
        return body;
    }

    @Override
    public String mapEmotion(String emotion) {
        return EMOTIONS.getOrDefault(emotion, "neutral");
    }

    @Override
    public String mediaReference(Map<String, Object> responseBody) {
        return ProviderAdapter.firstString(responseBody, "avatar_url", "audio_url");
    }
}
