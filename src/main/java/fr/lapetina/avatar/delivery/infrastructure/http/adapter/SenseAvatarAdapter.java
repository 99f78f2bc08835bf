package fr.lapetina.avatar.delivery.infrastructure.http.adapter;

import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SenseAvatar API. Authenticates with an API key header and names the
 * language field {@code lang}.
 */
public final class SenseAvatarAdapter implements ProviderAdapter {

    private static final Map<String, String> EMOTIONS = Map.of(
            "neutral", "normal",
            "happy", "happy",
            "sad", "sad",
            "angry", "angry",
            "surprised", "surprised",
            "excited", "energetic",
            "serious", "formal",
            "friendly", "gentle"
    );

    @Override
    public ProviderType type() {
        return ProviderType.SENSE_AVATAR;
    }

    @Override
    public String defaultSpeakPath() {
        return "/v1/speak";
    }

    @Override
    public Map<String, String> headers(String credential) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        if (credential != null) {
            headers.put("X-API-Key", credential);
        }
        return headers;
    }

    @Override
    public Map<String, Object> requestBody(DeliveryRequest request, ProviderDescriptor descriptor) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("avatar", ProviderAdapter.avatarId(request, descriptor));
        body.put("text", request.text());
        body.put("emotion", mapEmotion(request.emotion()));
        body.put("lang", request.language());
        if (request.voiceId() != null) {
            body.put("voice", request.voiceId());
        }
        return body;
    }

    @Override
    public String mapEmotion(String emotion) {
        return EMOTIONS.getOrDefault(emotion, "normal");
    }

    @Override
    public String mediaReference(Map<String, Object> responseBody) {
        return ProviderAdapter.firstString(responseBody, "video_url", "task_id");
    }
}
