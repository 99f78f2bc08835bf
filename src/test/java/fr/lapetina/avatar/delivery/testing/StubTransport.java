package fr.lapetina.avatar.delivery.testing;

import fr.lapetina.avatar.delivery.domain.model.AttemptOutcome;
import fr.lapetina.avatar.delivery.domain.model.DeliveryRequest;
import fr.lapetina.avatar.delivery.domain.model.ErrorType;
import fr.lapetina.avatar.delivery.domain.model.ProviderDescriptor;
import fr.lapetina.avatar.delivery.infrastructure.http.ProviderTransport;

import java.time.Duration;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Transport with scripted per-provider outcomes.
 *
 * Queued outcomes are consumed first; once a provider's queue is empty its
 * fallback outcome (success by default) is returned for every call.
 */
public final class StubTransport implements ProviderTransport {

    private final Map<String, Deque<AttemptOutcome>> scripted = new ConcurrentHashMap<>();
    private final Map<String, AttemptOutcome> fallback = new ConcurrentHashMap<>();
    private final Map<String, AttemptOutcome> probeOutcomes = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> sendCounts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> probeCounts = new ConcurrentHashMap<>();
    private final List<String> callOrder = new CopyOnWriteArrayList<>();
    private final List<Duration> timeouts = new CopyOnWriteArrayList<>();
    private volatile BiConsumer<ProviderDescriptor, DeliveryRequest> onSend = (p, r) -> { };
    private volatile boolean closed;

    public static AttemptOutcome ok(String mediaUrl) {
        return AttemptOutcome.success(200, Map.of("media_url", mediaUrl), Duration.ofMillis(5));
    }

    public static AttemptOutcome fail(ErrorType errorType) {
        return AttemptOutcome.failure(errorType, errorType.name().toLowerCase(), statusFor(errorType), Duration.ofMillis(5));
    }

    private static int statusFor(ErrorType errorType) {
        return switch (errorType) {
            case PROVIDER_SERVER_ERROR -> 503;
            case PROVIDER_REJECTED -> 409;
            case INVALID_REQUEST -> 400;
            case RATE_LIMITED -> 429;
            default -> 0;
        };
    }

    public StubTransport script(String provider, AttemptOutcome... outcomes) {
        Deque<AttemptOutcome> queue = scripted.computeIfAbsent(provider, k -> new ConcurrentLinkedDeque<>());
        for (AttemptOutcome outcome : outcomes) {
            queue.addLast(outcome);
        }
        return this;
    }

    public StubTransport always(String provider, AttemptOutcome outcome) {
        fallback.put(provider, outcome);
        return this;
    }

    public StubTransport probeResult(String provider, AttemptOutcome outcome) {
        probeOutcomes.put(provider, outcome);
        return this;
    }

    /**
     * Runs before each send, on the calling thread.
     */
    public StubTransport onSend(BiConsumer<ProviderDescriptor, DeliveryRequest> hook) {
        this.onSend = hook;
        return this;
    }

    @Override
    public AttemptOutcome send(ProviderDescriptor provider, DeliveryRequest request, Duration timeout) {
        String name = provider.getName();
        sendCounts.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
        callOrder.add(name);
        timeouts.add(timeout);
        onSend.accept(provider, request);

        Deque<AttemptOutcome> queue = scripted.get(name);
        if (queue != null) {
            AttemptOutcome next = queue.pollFirst();
            if (next != null) {
                return next;
            }
        }
        return fallback.getOrDefault(name, ok("https://media.test/" + name));
    }

    @Override
    public AttemptOutcome probe(ProviderDescriptor provider, Duration timeout) {
        String name = provider.getName();
        probeCounts.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
        return probeOutcomes.getOrDefault(name, AttemptOutcome.success(200, Map.of(), Duration.ofMillis(1)));
    }

    @Override
    public String mediaReference(ProviderDescriptor provider, Map<String, Object> body) {
        Object value = body.get("media_url");
        return value != null ? value.toString() : null;
    }

    public int calls(String provider) {
        AtomicInteger count = sendCounts.get(provider);
        return count != null ? count.get() : 0;
    }

    public int totalCalls() {
        return callOrder.size();
    }

    public int probes(String provider) {
        AtomicInteger count = probeCounts.get(provider);
        return count != null ? count.get() : 0;
    }

    public List<String> callOrder() {
        return List.copyOf(callOrder);
    }

    public List<Duration> timeouts() {
        return List.copyOf(timeouts);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
