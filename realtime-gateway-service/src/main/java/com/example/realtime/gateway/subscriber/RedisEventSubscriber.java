package com.example.realtime.gateway.subscriber;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.EventValidationException;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.util.EventCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Receives events from the configured channel patterns, validates them, and feeds them through
 * the backpressure queue to the batch dispatcher. The queue and drop-rate window belong to this
 * subscriber alone.
 */
@Component
@Slf4j
@Profile("!no-scheduling")
public class RedisEventSubscriber {

    private final ReconnectionManager reconnectionManager;
    private final EventCodec eventCodec;
    private final Clock clock;
    private final List<String> patterns;
    private final int maxEventBytes;
    private final Duration dispatchInterval;

    private final BackpressureQueue queue;
    private final DropRateWindow dropRateWindow;
    private final BatchDispatcher dispatcher;

    private final Counter receivedCounter;
    private final Counter oversizedCounter;
    private final Counter invalidCounter;
    private final Counter overflowCounter;

    private Disposable subscription;
    private Disposable dispatchLoop;

    @Autowired
    public RedisEventSubscriber(ReconnectionManager reconnectionManager,
                                EventDelivery eventDelivery,
                                EventCodec eventCodec,
                                AppProperties appProperties,
                                MeterRegistry meterRegistry) {
        this(reconnectionManager, eventDelivery, eventCodec, appProperties, meterRegistry, Clock.systemUTC());
    }

    RedisEventSubscriber(ReconnectionManager reconnectionManager,
                         EventDelivery eventDelivery,
                         EventCodec eventCodec,
                         AppProperties appProperties,
                         MeterRegistry meterRegistry,
                         Clock clock) {
        AppProperties.Subscriber settings = appProperties.getSubscriber();
        AppProperties.DropRate dropRate = appProperties.getDropRate();
        this.reconnectionManager = reconnectionManager;
        this.eventCodec = eventCodec;
        this.clock = clock;
        this.patterns = List.copyOf(settings.getPatterns());
        this.maxEventBytes = appProperties.getPublisher().getMaxEventBytes();
        this.dispatchInterval = Duration.ofMillis(settings.getDispatchIntervalMs());

        this.queue = new BackpressureQueue(settings.getQueueCapacity());
        this.dropRateWindow = new DropRateWindow(
                Duration.ofMillis(dropRate.getWindowMs()),
                dropRate.getAlertThresholdPercent(),
                Duration.ofMillis(dropRate.getAlertCooldownMs()),
                clock);
        this.dispatcher = new BatchDispatcher(queue, dropRateWindow, eventDelivery,
                new BatchDispatcher.Settings(
                        settings.getBatchSize(),
                        Duration.ofMillis(settings.getDeliveryTimeoutMs()),
                        settings.getMaxDeliveryRetries(),
                        Duration.ofMillis(settings.getStalenessWarningMs()),
                        settings.isStrictOrdering()),
                meterRegistry, clock);

        this.receivedCounter = meterRegistry.counter("realtime.subscriber.received");
        this.oversizedCounter = meterRegistry.counter("realtime.subscriber.rejected", "reason", "size");
        this.invalidCounter = meterRegistry.counter("realtime.subscriber.rejected", "reason", "schema");
        this.overflowCounter = meterRegistry.counter("realtime.subscriber.dropped", "reason", "overflow");
        Gauge.builder("realtime.subscriber.queue.depth", queue, BackpressureQueue::size)
                .description("Events waiting for dispatch.")
                .register(meterRegistry);
        Gauge.builder("realtime.subscriber.drop.rate", dropRateWindow, DropRateWindow::dropRatePercent)
                .description("Percentage of events dropped over the sliding window.")
                .baseUnit("percent")
                .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        subscription = reconnectionManager.maintain(patterns, this::onMessage);
        dispatchLoop = Flux.interval(dispatchInterval)
                .onBackpressureDrop()
                .concatMap(tick -> dispatcher.dispatchBatch())
                .subscribe(delivered -> { },
                        error -> log.error("[SUB_DISPATCH_STOPPED] Dispatch loop terminated: {}", error.getMessage(), error));
        log.info("[SUB_START] Event subscriber started on {} (queue capacity {})", patterns, queue.capacity());
    }

    @PreDestroy
    public void stop() {
        log.info("[SUB_STOP] Stopping event subscriber with {} queued events, {} dropped in total",
                queue.size(), queue.droppedCount());
        if (subscription != null) {
            subscription.dispose();
        }
        if (dispatchLoop != null) {
            dispatchLoop.dispose();
        }
        reconnectionManager.cleanup().block();
    }

    /**
     * Validates one message and queues it. Oversized or malformed messages are discarded here.
     */
    public void onMessage(InboundMessage message) {
        receivedCounter.increment();
        int size = EventCodec.utf8Size(message.payload());
        if (size > maxEventBytes) {
            oversizedCounter.increment();
            log.warn("[SUB_REJECTED] Message on {} is {} bytes, limit is {} bytes", message.channel(), size, maxEventBytes);
            return;
        }
        Event event;
        try {
            event = eventCodec.decode(message.payload());
        } catch (EventValidationException e) {
            invalidCounter.increment();
            log.warn("[SUB_REJECTED] Invalid event on {}: {}", message.channel(), e.getMessage());
            return;
        }
        boolean evicted = queue.offer(new QueuedMessage(message.channel(), event, message.payload(), clock.instant()));
        if (evicted) {
            overflowCounter.increment();
            dropRateWindow.recordDropped();
        }
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("patterns", patterns);
        stats.put("connected", reconnectionManager.isConnected());
        stats.put("consecutiveReconnectFailures", reconnectionManager.getConsecutiveFailures());
        stats.put("queueDepth", queue.size());
        stats.put("queueCapacity", queue.capacity());
        stats.put("queueDropped", queue.droppedCount());
        stats.put("strictOrdering", dispatcher.isStrictOrdering());
        stats.put("dropRate", dropRateWindow.getStats());
        return stats;
    }

    BatchDispatcher dispatcher() {
        return dispatcher;
    }

    BackpressureQueue queue() {
        return queue;
    }

    DropRateWindow dropRateWindow() {
        return dropRateWindow;
    }
}
