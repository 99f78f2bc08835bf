package fr.lapetina.avatar.delivery.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.infrastructure.config.CredentialResolver;
import fr.lapetina.avatar.delivery.infrastructure.http.adapter.ProviderAdapter;
import fr.lapetina.avatar.delivery.infrastructure.http.adapter.ProviderAdapterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP transport for avatar providers.
 *
 * Uses java.net.http.HttpClient in blocking mode: the calling thread is the
 * only thing suspended, and interrupting it aborts the call. The wire
 * format comes from the adapter of the provider's type.
 */
public class HttpProviderTransport implements ProviderTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderTransport.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProviderAdapterFactory adapterFactory;
    private final CredentialResolver credentialResolver;

    public HttpProviderTransport(
            Duration connectTimeout,
            ProviderAdapterFactory adapterFactory,
            CredentialResolver credentialResolver
    ) {
        this.adapterFactory = adapterFactory;
        this.credentialResolver = credentialResolver;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public HttpProviderTransport() {
        this(Duration.ofSeconds(2), new ProviderAdapterFactory(), new CredentialResolver());
    }

    @Override
    public AttemptOutcome send(ProviderDescriptor provider, DeliveryRequest request, Duration timeout) {
        ProviderAdapter adapter = adapterFactory.forType(provider.getType());
        if (!adapter.requiresNetwork()) {
            return adapter.respondLocally(request, provider, timeout);
        }

        HttpRequest httpRequest;
        try {
            httpRequest = buildSpeakRequest(provider, adapter, request, timeout);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build request: provider={}, requestId={}", provider.getName(), request.requestId(), e);
            return AttemptOutcome.failure(ErrorType.INTERNAL_ERROR, "Failed to build request: " + e.getMessage());
        }

        log.debug("Sending request: provider={}, requestId={}, endpoint={}, timeoutMs={}",
                provider.getName(), request.requestId(), httpRequest.uri(), timeout.toMillis());

        long start = System.nanoTime();
        try {
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            AttemptOutcome outcome = OutcomeClassifier.classify(response.statusCode(), response.body(), latency);
            log.debug("Response received: provider={}, requestId={}, status={}, latencyMs={}, outcome={}",
                    provider.getName(), request.requestId(), response.statusCode(), latency.toMillis(), outcome);
            return outcome;
        } catch (Exception e) {
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            AttemptOutcome outcome = OutcomeClassifier.classify(e, latency);
            log.debug("Request failed: provider={}, requestId={}, errorType={}, error={}",
                    provider.getName(), request.requestId(), outcome.errorType(), outcome.message());
            return outcome;
        }
    }

    private HttpRequest buildSpeakRequest(
            ProviderDescriptor provider,
            ProviderAdapter adapter,
            DeliveryRequest request,
            Duration timeout
    ) throws JsonProcessingException {
        String body = objectMapper.writeValueAsString(adapter.requestBody(request, provider));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(resolve(provider.getBaseUrl(), adapter.speakPath(provider)))
                .timeout(timeout)
                .header("X-Request-ID", request.requestId())
                .POST(HttpRequest.BodyPublishers.ofString(body));

        String credential = credentialResolver.resolve(provider.getCredentialRef());
        adapter.headers(credential).forEach(builder::header);
        return builder.build();
    }

    @Override
    public AttemptOutcome probe(ProviderDescriptor provider, Duration timeout) {
        ProviderAdapter adapter = adapterFactory.forType(provider.getType());
        if (!adapter.requiresNetwork()) {
            return AttemptOutcome.success(200, Map.of(), Duration.ZERO);
        }

        URI uri = resolve(provider.getBaseUrl(), adapter.probePath(provider));
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET();
        String credential = credentialResolver.resolve(provider.getCredentialRef());
        adapter.headers(credential).forEach((name, value) -> {
            if (!"Content-Type".equals(name)) {
                builder.header(name, value);
            }
        });

        log.debug("Health probe started: provider={}, uri={}", provider.getName(), uri);
        long start = System.nanoTime();
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            return OutcomeClassifier.classify(response.statusCode(), response.body(),
                    Duration.ofNanos(System.nanoTime() - start));
        } catch (Exception e) {
            return OutcomeClassifier.classify(e, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public String mediaReference(ProviderDescriptor provider, Map<String, Object> body) {
        return adapterFactory.forType(provider.getType()).mediaReference(body);
    }

    static URI resolve(URI baseUrl, String path) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + (path.startsWith("/") ? path : "/" + path));
    }
}
