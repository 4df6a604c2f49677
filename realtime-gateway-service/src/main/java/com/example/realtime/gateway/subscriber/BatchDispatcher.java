package com.example.realtime.gateway.subscriber;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Takes up to one batch off the queue per cycle and delivers its messages concurrently. One
 * message failing never affects the others. A delivery that times out goes back on the queue
 * (front in strict-ordering mode, back otherwise) until its retries run out, then it is counted
 * as a drop.
 */
@Slf4j
public class BatchDispatcher {

    enum Outcome { DELIVERED, TIMED_OUT, FAILED }

    private final BackpressureQueue queue;
    private final DropRateWindow dropRateWindow;
    private final EventDelivery delivery;
    private final Clock clock;
    private final int batchSize;
    private final Duration deliveryTimeout;
    private final int maxDeliveryRetries;
    private final Duration stalenessThreshold;
    private final boolean strictOrdering;

    private final Counter deliveredCounter;
    private final Counter failedCounter;
    private final Counter timeoutCounter;
    private final Counter lostCounter;
    private final Counter staleCounter;

    public BatchDispatcher(BackpressureQueue queue,
                           DropRateWindow dropRateWindow,
                           EventDelivery delivery,
                           Settings settings,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.queue = queue;
        this.dropRateWindow = dropRateWindow;
        this.delivery = delivery;
        this.clock = clock;
        this.batchSize = settings.batchSize();
        this.deliveryTimeout = settings.deliveryTimeout();
        this.maxDeliveryRetries = settings.maxDeliveryRetries();
        this.stalenessThreshold = settings.stalenessThreshold();
        this.strictOrdering = settings.strictOrdering();
        this.deliveredCounter = meterRegistry.counter("realtime.subscriber.dispatch", "outcome", "delivered");
        this.failedCounter = meterRegistry.counter("realtime.subscriber.dispatch", "outcome", "failed");
        this.timeoutCounter = meterRegistry.counter("realtime.subscriber.dispatch", "outcome", "timeout");
        this.lostCounter = meterRegistry.counter("realtime.subscriber.dispatch", "outcome", "lost");
        this.staleCounter = meterRegistry.counter("realtime.subscriber.stale");
    }

    /**
     * Dispatches one batch.
     * @return the number of messages delivered in this cycle
     */
    public Mono<Integer> dispatchBatch() {
        return Mono.defer(() -> {
            List<QueuedMessage> batch = queue.drain(batchSize);
            if (batch.isEmpty()) {
                return Mono.just(0);
            }
            Instant now = clock.instant();
            batch.forEach(message -> warnIfStale(message, now));

            Map<QueuedMessage, Outcome> outcomes = new IdentityHashMap<>();
            return Flux.fromIterable(batch)
                    .flatMap(message -> deliverOne(message).doOnNext(outcome -> record(outcomes, message, outcome)))
                    .then(Mono.fromCallable(() -> settle(batch, outcomes)));
        });
    }

    public boolean isStrictOrdering() {
        return strictOrdering;
    }

    private Mono<Outcome> deliverOne(QueuedMessage message) {
        return Mono.defer(() -> delivery.deliver(message))
                .timeout(deliveryTimeout)
                .thenReturn(Outcome.DELIVERED)
                .onErrorResume(TimeoutException.class, e -> Mono.just(Outcome.TIMED_OUT))
                .onErrorResume(error -> {
                    log.error("[SUB_DELIVERY_FAILED] Delivery of {} on {} failed: {}",
                            message.getEvent().getType(), message.getChannel(), error.getMessage(), error);
                    return Mono.just(Outcome.FAILED);
                });
    }

    private static void record(Map<QueuedMessage, Outcome> outcomes, QueuedMessage message, Outcome outcome) {
        synchronized (outcomes) {
            outcomes.put(message, outcome);
        }
    }

    private int settle(List<QueuedMessage> batch, Map<QueuedMessage, Outcome> outcomes) {
        int delivered = 0;
        // Walk backwards in strict mode so requeued messages keep their relative order at the head.
        int size = batch.size();
        for (int i = 0; i < size; i++) {
            QueuedMessage message = batch.get(strictOrdering ? size - 1 - i : i);
            Outcome outcome;
            synchronized (outcomes) {
                outcome = outcomes.getOrDefault(message, Outcome.FAILED);
            }
            switch (outcome) {
                case DELIVERED:
                    delivered++;
                    deliveredCounter.increment();
                    dropRateWindow.recordProcessed();
                    break;
                case TIMED_OUT:
                    handleTimeout(message);
                    break;
                default:
                    failedCounter.increment();
                    break;
            }
        }
        return delivered;
    }

    private void handleTimeout(QueuedMessage message) {
        timeoutCounter.increment();
        if (message.getAttempts() < maxDeliveryRetries) {
            QueuedMessage retry = message.nextAttempt();
            boolean evicted = strictOrdering ? queue.offerFirst(retry) : queue.offer(retry);
            if (evicted) {
                dropRateWindow.recordDropped();
            }
            log.warn("[SUB_DELIVERY_TIMEOUT] {} on {} timed out after {}ms, requeued at the {} (retry {}/{})",
                    message.getEvent().getType(), message.getChannel(), deliveryTimeout.toMillis(),
                    strictOrdering ? "front" : "back", retry.getAttempts(), maxDeliveryRetries);
            return;
        }
        lostCounter.increment();
        dropRateWindow.recordDropped();
        log.error("[SUB_EVENT_LOST] EVENT LOST: {} on {} timed out {} times (tenant {}, branch {}, session {})",
                message.getEvent().getType(), message.getChannel(), message.getAttempts() + 1,
                message.getEvent().getTenantId(), message.getEvent().getBranchId(), message.getEvent().getSessionId());
    }

    private void warnIfStale(QueuedMessage message, Instant now) {
        Duration waited = Duration.between(message.getReceivedAt(), now);
        if (waited.compareTo(stalenessThreshold) > 0) {
            staleCounter.increment();
            log.warn("[SUB_STALE] {} on {} waited {}ms in the queue (threshold {}ms, retry {}, queue depth {})",
                    message.getEvent().getType(), message.getChannel(), waited.toMillis(),
                    stalenessThreshold.toMillis(), message.getAttempts(), queue.size());
        }
    }

    /**
     * Dispatch tuning, taken from the subscriber configuration.
     */
    public record Settings(int batchSize,
                           Duration deliveryTimeout,
                           int maxDeliveryRetries,
                           Duration stalenessThreshold,
                           boolean strictOrdering) {
    }
}
