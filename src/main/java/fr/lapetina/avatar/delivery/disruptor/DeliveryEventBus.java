package fr.lapetina.avatar.delivery.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.EventHandlerGroup;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.avatar.delivery.disruptor.handlers.ListenerDispatchHandler;
import fr.lapetina.avatar.delivery.disruptor.handlers.MetricsHandler;
import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcome;
import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcomeEvent;
import fr.lapetina.avatar.delivery.domain.event.DeliveryOutcomeEventFactory;
import fr.lapetina.avatar.delivery.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous outcome stream built on the LMAX Disruptor.
 *
 * Callers of {@code speak} publish one {@link DeliveryOutcome} per request from
 * many threads (MULTI producer). Publishing claims a slot with {@code tryNext},
 * so a full ring drops the outcome and counts it instead of blocking the caller.
 *
 * Consumers run in order: metrics first, then the registered listeners.
 */
public final class DeliveryEventBus implements DeliveryEventPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeliveryEventBus.class);

    private final Disruptor<DeliveryOutcomeEvent> disruptor;
    private final RingBuffer<DeliveryOutcomeEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<DeliveryEventListener> listeners = new CopyOnWriteArrayList<>();
    private final MetricsRegistry metricsRegistry;
    private final AtomicLong droppedEvents = new AtomicLong();

    private DeliveryEventBus(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.listeners.addAll(builder.listeners);

        this.disruptor = new Disruptor<>(
                new DeliveryOutcomeEventFactory(),
                builder.ringBufferSize,
                new DisruptorThreadFactory("delivery-events"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        ListenerDispatchHandler dispatchHandler = new ListenerDispatchHandler(listeners);
        if (metricsRegistry != null) {
            EventHandlerGroup<DeliveryOutcomeEvent> first =
                    disruptor.handleEventsWith(new MetricsHandler(metricsRegistry));
            first.then(dispatchHandler);
        } else {
            disruptor.handleEventsWith(dispatchHandler);
        }
        disruptor.setDefaultExceptionHandler(new DeliveryEventExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DeliveryEventBus created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("DeliveryEventBus started");
        }
    }

    @Override
    public boolean publish(DeliveryOutcome outcome) {
        if (!running.get()) {
            log.debug("DeliveryEventBus not running, outcome discarded: requestId={}", outcome.requestId());
            return false;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            droppedEvents.incrementAndGet();
            if (metricsRegistry != null) {
                metricsRegistry.incrementDroppedEvents();
            }
            log.warn("Outcome event dropped, ring buffer full: requestId={}, status={}",
                    outcome.requestId(), outcome.status());
            return false;
        }

        try {
            ringBuffer.get(sequence).initialize(outcome, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }

        if (metricsRegistry != null) {
            metricsRegistry.setRingBufferRemaining(ringBuffer.remainingCapacity());
        }
        return true;
    }

    public void addListener(DeliveryEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DeliveryEventListener listener) {
        listeners.remove(listener);
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains pending outcomes and stops the consumer threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down DeliveryEventBus...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
                log.info("DeliveryEventBus shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("DeliveryEventBus shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class DeliveryEventExceptionHandler implements ExceptionHandler<DeliveryOutcomeEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, DeliveryOutcomeEvent event) {
            log.error("Exception in outcome handler: sequence={}, event={}", sequence, event, ex);
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during DeliveryEventBus start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during DeliveryEventBus shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private MetricsRegistry metricsRegistry;
        private final List<DeliveryEventListener> listeners = new CopyOnWriteArrayList<>();

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        /**
         * Optional; without it no metrics stage is installed.
         */
        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder listener(DeliveryEventListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public DeliveryEventBus build() {
            return new DeliveryEventBus(this);
        }
    }
}
