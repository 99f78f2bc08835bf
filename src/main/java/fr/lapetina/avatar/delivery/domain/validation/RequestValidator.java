package fr.lapetina.avatar.delivery.domain.validation;

import fr.lapetina.avatar.delivery.domain.exception.InvalidRequestException;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.regex.Pattern;

/**
 * Rejects malformed requests before any provider is contacted.
 *
 * Validates:
 * - Text is present and within the configured length
 * - Emotion and language tags are present
 * - Language is a short BCP 47 style tag ("en", "fr-CA")
 * - The caller's deadline has not already passed
 */
public final class RequestValidator {

    private static final Logger log = LoggerFactory.getLogger(RequestValidator.class);

    private static final Pattern LANGUAGE_TAG = Pattern.compile("[A-Za-z]{2,3}(-[A-Za-z0-9]{2,8})*");
    private static final int MAX_TAG_LENGTH = 64;

    public static final int DEFAULT_MAX_TEXT_LENGTH = 5000;

    private final int maxTextLength;
    private final Clock clock;

    public RequestValidator(int maxTextLength, Clock clock) {
        this.maxTextLength = maxTextLength;
        this.clock = clock;
    }

    public static RequestValidator withDefaults() {
        return new RequestValidator(DEFAULT_MAX_TEXT_LENGTH, Clock.systemUTC());
    }

    /**
     * @throws InvalidRequestException describing the first violation found
     */
    public void validate(DeliveryRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request is null");
        }
        try {
            check(request);
        } catch (InvalidRequestException e) {
            log.warn("Validation failed: requestId={}, reason={}", request.requestId(), e.getMessage());
            throw e;
        }
    }

    private void check(DeliveryRequest request) {
        String text = request.text();
        if (text == null || text.isBlank()) {
            throw new InvalidRequestException("Text is required");
        }
        if (text.length() > maxTextLength) {
            throw new InvalidRequestException("Text exceeds maximum length of " + maxTextLength);
        }

        String emotion = request.emotion();
        if (emotion == null || emotion.isBlank()) {
            throw new InvalidRequestException("Emotion is required");
        }
        if (emotion.length() > MAX_TAG_LENGTH) {
            throw new InvalidRequestException("Emotion tag is too long");
        }

        String language = request.language();
        if (language == null || language.isBlank()) {
            throw new InvalidRequestException("Language is required");
        }
        if (!LANGUAGE_TAG.matcher(language).matches()) {
            throw new InvalidRequestException("Invalid language tag: " + language);
        }

        if (request.isExpired(clock)) {
            throw new InvalidRequestException("Deadline already passed: " + request.deadline());
        }
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }
}
