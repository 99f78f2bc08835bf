package fr.lapetina.avatar.delivery.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.avatar.delivery.domain.exception.DeliveryException;
import fr.lapetina.avatar.delivery.domain.model.DeliveryResult;
import fr.lapetina.avatar.delivery.domain.model.ProviderAttempt;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response of {@code POST /v1/speak}, for both outcomes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SpeakResponseDto {

    private String requestId;
    private boolean success;
    private String provider;
    private String providerType;
    private Integer statusCode;
    private String mediaReference;
    private Integer attempts;
    private Long latencyMs;
    private Boolean fromCache;
    private Instant deliveredAt;
    private Map<String, Object> body;

    private String error;
    private String errorType;
    private Boolean retryLater;
    private List<AttemptDto> providerAttempts;

    public static SpeakResponseDto fromResult(DeliveryResult result) {
        SpeakResponseDto dto = new SpeakResponseDto();
        dto.requestId = result.requestId();
        dto.success = true;
        dto.provider = result.providerUsed();
        dto.providerType = result.providerType() != null ? result.providerType().name() : null;
        dto.statusCode = result.statusCode();
        dto.mediaReference = result.mediaReference();
        dto.attempts = result.attempts();
        dto.latencyMs = result.latency().toMillis();
        dto.fromCache = result.fromCache();
        dto.deliveredAt = result.deliveredAt();
        dto.body = result.body();
        return dto;
    }

    public static SpeakResponseDto fromError(String requestId, DeliveryException e) {
        SpeakResponseDto dto = new SpeakResponseDto();
        dto.requestId = requestId;
        dto.success = false;
        dto.error = e.getMessage();
        dto.errorType = e.getErrorType().name();
        dto.retryLater = e.isRetryLater();
        dto.providerAttempts = e.getAttempts().stream().map(AttemptDto::from).toList();
        return dto;
    }

    public String getRequestId() { return requestId; }
    public boolean isSuccess() { return success; }
    public String getProvider() { return provider; }
    public String getProviderType() { return providerType; }
    public Integer getStatusCode() { return statusCode; }
    public String getMediaReference() { return mediaReference; }
    public Integer getAttempts() { return attempts; }
    public Long getLatencyMs() { return latencyMs; }
    public Boolean getFromCache() { return fromCache; }
    public Instant getDeliveredAt() { return deliveredAt; }
    public Map<String, Object> getBody() { return body; }
    public String getError() { return error; }
    public String getErrorType() { return errorType; }
    public Boolean getRetryLater() { return retryLater; }
    public List<AttemptDto> getProviderAttempts() { return providerAttempts; }

    /**
     * Final outcome against one provider.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AttemptDto(String provider, int calls, String outcome, String errorType, String message) {

        static AttemptDto from(ProviderAttempt attempt) {
            return new AttemptDto(
                    attempt.provider(),
                    attempt.attempts(),
                    attempt.outcome().kind().name(),
                    attempt.errorType() != null ? attempt.errorType().name() : null,
                    attempt.outcome().message()
            );
        }
    }
}
