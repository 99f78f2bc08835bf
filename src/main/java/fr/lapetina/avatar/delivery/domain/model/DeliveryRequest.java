package fr.lapetina.avatar.delivery.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * An utterance to deliver to an avatar provider.
 * Immutable and thread-safe.
 *
 * <p>The fingerprint is a SHA-256 over the payload fields only (text, emotion,
 * language, avatar, voice, gesture); request id and deadline do not take part,
 * so a resubmission of the same commentary maps to the same cache entry.
 */
public record DeliveryRequest(
        String requestId,
        String text,
        String emotion,
        String language,
        String avatarId,
        String voiceId,
        String gesture,
        Instant deadline,
        String fingerprint
) {
    public static final String DEFAULT_EMOTION = "neutral";
    public static final String DEFAULT_LANGUAGE = "en";

    private static final char FIELD_SEPARATOR = '\u001F';

    public DeliveryRequest {
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (fingerprint == null) {
            fingerprint = fingerprintOf(text, emotion, language, avatarId, voiceId, gesture);
        }
    }

    /**
     * Creates a request with no deadline and no optional fields.
     */
    public static DeliveryRequest of(String text, String emotion, String language) {
        return builder().text(text).emotion(emotion).language(language).build();
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    /**
     * Time left before the caller's deadline, or {@code null} when there is none.
     * Never negative.
     */
    public Duration remaining(Clock clock) {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired(Clock clock) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Stable hash over the payload fields.
     */
    public static String fingerprintOf(
            String text,
            String emotion,
            String language,
            String avatarId,
            String voiceId,
            String gesture
    ) {
        StringBuilder canonical = new StringBuilder();
        for (String field : new String[]{text, emotion, language, avatarId, voiceId, gesture}) {
            canonical.append(field != null ? field : "").append(FIELD_SEPARATOR);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String text;
        private String emotion = DEFAULT_EMOTION;
        private String language = DEFAULT_LANGUAGE;
        private String avatarId;
        private String voiceId;
        private String gesture;
        private Instant deadline;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder emotion(String emotion) {
            this.emotion = emotion;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder avatarId(String avatarId) {
            this.avatarId = avatarId;
            return this;
        }

        public Builder voiceId(String voiceId) {
            this.voiceId = voiceId;
            return this;
        }

        public Builder gesture(String gesture) {
            this.gesture = gesture;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        /**
         * Sets the deadline relative to now.
         */
        public Builder timeout(Duration timeout) {
            return timeout(timeout, Clock.systemUTC());
        }

        public Builder timeout(Duration timeout, Clock clock) {
            this.deadline = timeout != null ? clock.instant().plus(timeout) : null;
            return this;
        }

        public DeliveryRequest build() {
            return new DeliveryRequest(
                    requestId, text, emotion, language, avatarId, voiceId, gesture, deadline, null
            );
        }
    }
}
