package fr.lapetina.avatar.delivery.infrastructure.http.adapter;

import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.domain.model.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderAdapterTest {

    private static final DeliveryRequest REQUEST = DeliveryRequest.builder()
            .text("Offside, the goal is ruled out")
            .emotion("serious")
            .language("fr")
            .voiceId("voice-7")
            .gesture("point")
            .build();

    private static ProviderDescriptor descriptor(ProviderType type) {
        return ProviderDescriptor.builder()
                .name(type.name().toLowerCase())
                .type(type)
                .baseUrl("http://avatar.test")
                .metadata("avatarId", "studio-anchor")
                .build();
    }

    @ParameterizedTest
    @EnumSource(ProviderType.class)
    @DisplayName("should create an adapter for every provider type")
    void shouldCoverEveryType(ProviderType type) {
        ProviderAdapter adapter = new ProviderAdapterFactory().forType(type);

        assertThat(adapter).isNotNull();
        assertThat(adapter.type()).isEqualTo(type);
    }

    @Nested
    @DisplayName("DUIX")
    class Duix {

        private final DuixAdapter adapter = new DuixAdapter();

        @Test
        @DisplayName("should build the speak body with mapped emotion and optional fields")
        void shouldBuildBody() {
            Map<String, Object> body = adapter.requestBody(REQUEST, descriptor(ProviderType.DUIX));

            assertThat(body)
                    .containsEntry("avatar_id", "studio-anchor")
                    .containsEntry("text", "Offside, the goal is ruled out")
                    .containsEntry("emotion", "serious")
                    .containsEntry("language", "fr")
                    .containsEntry("voice_id", "voice-7")
                    .containsEntry("gesture", "point");
        }

        @Test
        @DisplayName("should fall back to neutral for unknown emotions")
        void shouldFallBackToNeutral() {
            assertThat(adapter.mapEmotion("happy")).isEqualTo("joy");
            assertThat(adapter.mapEmotion("melancholic")).isEqualTo("neutral");
        }

        @Test
        @DisplayName("should omit the auth header without a credential")
        void shouldOmitAuthHeader() {
            assertThat(adapter.headers(null)).containsOnlyKeys("Content-Type");
            assertThat(adapter.headers("k")).containsEntry("Authorization", "Bearer k");
        }
    }

    @Nested
    @DisplayName("SenseAvatar")
    class SenseAvatar {

        private final SenseAvatarAdapter adapter = new SenseAvatarAdapter();

        @Test
        @DisplayName("should use its own field names")
        void shouldUseOwnFieldNames() {
            Map<String, Object> body = adapter.requestBody(REQUEST, descriptor(ProviderType.SENSE_AVATAR));

            assertThat(body)
                    .containsEntry("avatar", "studio-anchor")
                    .containsEntry("lang", "fr")
                    .containsEntry("voice", "voice-7")
                    .containsEntry("emotion", "formal")
                    .doesNotContainKey("gesture");
        }

        @Test
        @DisplayName("should prefer the video url over the task id")
        void shouldReadMediaReference() {
            assertThat(adapter.mediaReference(Map.of("task_id", "t-1", "video_url", "https://v"))).isEqualTo("https://v");
            assertThat(adapter.mediaReference(Map.of("task_id", "t-1"))).isEqualTo("t-1");
            assertThat(adapter.mediaReference(Map.of())).isNull();
        }
    }

    @Nested
    @DisplayName("Akool")
    class Akool {

        private final AkoolAdapter adapter = new AkoolAdapter();

        @Test
        @DisplayName("should send the text as input_text")
        void shouldSendInputText() {
            Map<String, Object> body = adapter.requestBody(REQUEST, descriptor(ProviderType.AKOOL));

            assertThat(body)
                    .containsEntry("input_text", "Offside, the goal is ruled out")
                    .containsEntry("emotion", "professional")
                    .doesNotContainKey("text");
        }

        @Test
        @DisplayName("should let the request's avatar win over the configured one")
        void shouldPreferRequestAvatar() {
            DeliveryRequest withAvatar = DeliveryRequest.builder().text("Hi").avatarId("guest").build();

            assertThat(adapter.requestBody(withAvatar, descriptor(ProviderType.AKOOL)))
                    .containsEntry("avatar_id", "guest");
        }
    }

    @Nested
    @DisplayName("Local")
    class Local {

        @Test
        @DisplayName("should send the canonical body and honour a speak path override")
        void shouldSendCanonicalBody() {
            LocalAdapter adapter = new LocalAdapter();
            ProviderDescriptor descriptor = ProviderDescriptor.builder()
                    .name("local")
                    .type(ProviderType.LOCAL)
                    .baseUrl("http://localhost:8000")
                    .metadata("speakPath", "/api/v2/speak")
                    .build();

            assertThat(adapter.requestBody(REQUEST, descriptor))
                    .containsOnlyKeys("text", "emotion", "language")
                    .containsEntry("emotion", "serious");
            assertThat(adapter.speakPath(descriptor)).isEqualTo("/api/v2/speak");
            assertThat(adapter.probePath(descriptor)).isEqualTo("/health");
        }
    }

    @Nested
    @DisplayName("Mock")
    class Mock {

        private final MockAdapter adapter = new MockAdapter();

        @Test
        @DisplayName("should echo the payload")
        void shouldEchoPayload() {
            ProviderDescriptor descriptor = ProviderDescriptor.builder()
                    .name("mock").type(ProviderType.MOCK).metadata("mockDelayMs", "0").build();

            AttemptOutcome outcome = adapter.respondLocally(REQUEST, descriptor, Duration.ofSeconds(1));

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.body()).containsEntry("status", "success");
            assertThat(adapter.mediaReference(outcome.body()))
                    .isEqualTo("https://mock.avatar.local/video/default");
        }

        @Test
        @DisplayName("should answer a configured error status")
        void shouldAnswerConfiguredStatus() {
            ProviderDescriptor descriptor = ProviderDescriptor.builder()
                    .name("mock").type(ProviderType.MOCK)
                    .metadata("mockDelayMs", "0")
                    .metadata("mockStatus", "503")
                    .build();

            AttemptOutcome outcome = adapter.respondLocally(REQUEST, descriptor, Duration.ofSeconds(1));

            assertThat(outcome.errorType()).isEqualTo(ErrorType.PROVIDER_SERVER_ERROR);
            assertThat(outcome.statusCode()).isEqualTo(503);
        }

        @Test
        @DisplayName("should time out when slower than the timeout")
        void shouldTimeOut() {
            ProviderDescriptor descriptor = ProviderDescriptor.builder()
                    .name("mock").type(ProviderType.MOCK).metadata("mockDelayMs", "5000").build();

            AttemptOutcome outcome = adapter.respondLocally(REQUEST, descriptor, Duration.ofMillis(10));

            assertThat(outcome.errorType()).isEqualTo(ErrorType.TIMEOUT);
        }

        @Test
        @DisplayName("should report cancellation when interrupted while waiting out the timeout")
        void shouldReportCancellationWhenInterrupted() {
            ProviderDescriptor descriptor = ProviderDescriptor.builder()
                    .name("mock").type(ProviderType.MOCK).metadata("mockDelayMs", "5000").build();

            Thread.currentThread().interrupt();
            try {
                AttemptOutcome outcome = adapter.respondLocally(REQUEST, descriptor, Duration.ofMillis(10));

                assertThat(outcome.errorType()).isEqualTo(ErrorType.CANCELLED);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }
    }
}
