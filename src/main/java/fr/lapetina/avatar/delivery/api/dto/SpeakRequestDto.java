package fr.lapetina.avatar.delivery.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;

import java.time.Clock;
import java.time.Duration;

/**
 * Body of {@code POST /v1/speak}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpeakRequestDto {

    private String text;
    private String emotion;
    private String language;

    @JsonAlias("avatar_id")
    private String avatarId;

    @JsonAlias("voice_id")
    private String voiceId;

    private String gesture;

    @JsonAlias("timeout_ms")
    private Long timeoutMs;

    @JsonAlias("request_id")
    private String requestId;

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getEmotion() { return emotion; }
    public void setEmotion(String emotion) { this.emotion = emotion; }

    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }

    public String getAvatarId() { return avatarId; }
    public void setAvatarId(String avatarId) { this.avatarId = avatarId; }

    public String getVoiceId() { return voiceId; }
    public void setVoiceId(String voiceId) { this.voiceId = voiceId; }

    public String getGesture() { return gesture; }
    public void setGesture(String gesture) { this.gesture = gesture; }

    public Long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(Long timeoutMs) { this.timeoutMs = timeoutMs; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    /**
     * Converts to a domain request. Missing emotion and language take the
     * domain defaults; a positive {@code timeoutMs} becomes the deadline.
     */
    public DeliveryRequest toDeliveryRequest(Clock clock) {
        DeliveryRequest.Builder builder = DeliveryRequest.builder()
                .requestId(requestId)
                .text(text)
                .avatarId(avatarId)
                .voiceId(voiceId)
                .gesture(gesture);
        if (emotion != null) {
            builder.emotion(emotion);
        }
        if (language != null) {
            builder.language(language);
        }
        if (timeoutMs != null && timeoutMs > 0) {
            builder.timeout(Duration.ofMillis(timeoutMs), clock);
        }
        return builder.build();
    }
}
