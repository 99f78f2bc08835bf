package fr.lapetina.avatar.delivery.infrastructure.http.adapter;

import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;
import fr.lapetina.avatar.delivery.infrastructure.http.OutcomeClassifier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-process provider for demos and local runs.
 *
 * Echoes the payload after {@code mockDelayMs} (default 100). Setting
 * {@code mockStatus} in the descriptor metadata answers with that HTTP
 * status instead, classified like a real response.
 */
public final class MockAdapter implements ProviderAdapter {

    static final long DEFAULT_DELAY_MS = 100;

    @Override
    public ProviderType type() {
        return ProviderType.MOCK;
    }

    @Override
    public String defaultSpeakPath() {
        return "/speak";
    }

    @Override
    public Map<String, String> headers(String credential) {
        return Map.of();
    }

    @Override
    public Map<String, Object> requestBody(DeliveryRequest request, ProviderDescriptor descriptor) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", request.text());
        body.put("emotion", request.emotion());
        body.put("language", request.language());
        body.put("avatar_id", ProviderAdapter.avatarId(request, descriptor));
        return body;
    }

    @Override
    public String mapEmotion(String emotion) {
        return emotion;
    }

    @Override
    public String mediaReference(Map<String, Object> responseBody) {
        return ProviderAdapter.firstString(responseBody, "mock_video_url");
    }

    @Override
    public boolean requiresNetwork() {
        return false;
    }

    @Override
    public AttemptOutcome respondLocally(DeliveryRequest request, ProviderDescriptor descriptor, Duration timeout) {
        long delayMs = Long.parseLong(descriptor.metadata("mockDelayMs", String.valueOf(DEFAULT_DELAY_MS)));
        if (timeout != null && delayMs > timeout.toMillis()) {
            if (!sleep(timeout.toMillis())) {
                return AttemptOutcome.failure(ErrorType.CANCELLED, "Interrupted");
            }
            return AttemptOutcome.failure(ErrorType.TIMEOUT, "Mock provider slower than timeout", 0, timeout);
        }
        if (!sleep(delayMs)) {
            return AttemptOutcome.failure(ErrorType.CANCELLED, "Interrupted");
        }

        Duration latency = Duration.ofMillis(delayMs);
        String status = descriptor.metadata("mockStatus", null);
        if (status != null) {
            int code = Integer.parseInt(status);
            if (code < 200 || code >= 300) {
                return OutcomeClassifier.classify(code, "{\"error\":\"mock status " + code + "\"}", latency);
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("data", requestBody(request, descriptor));
        body.put("message", "Mock avatar service - request processed successfully");
        body.put("mock_video_url", "https://mock.avatar.local/video/" + ProviderAdapter.avatarId(request, descriptor));
        return AttemptOutcome.success(200, body, latency);
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(Math.max(0, millis));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
