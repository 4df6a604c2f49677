package com.example.realtime.shared.publisher;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.BreakerOpenException;
import com.example.realtime.shared.exception.EventDistributionException;
import com.example.realtime.shared.exception.EventValidationException;
import com.example.realtime.shared.exception.PublishRetriesExhaustedException;
import com.example.realtime.shared.exception.TransientStoreException;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.resilience.DecorrelatedJitterBackoff;
import com.example.realtime.shared.resilience.EventCircuitBreaker;
import com.example.realtime.shared.routing.ChannelRouter;
import com.example.realtime.shared.util.EventCodec;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Publishes events to their routed channels. Every publish passes, in order: size gate,
 * serialization, circuit breaker, send, retry with decorrelated jitter, breaker bookkeeping.
 */
@Service
@Slf4j
public class EventPublisher {

    private final EventTransport transport;
    private final ChannelRouter channelRouter;
    private final EventCodec eventCodec;
    private final EventCircuitBreaker circuitBreaker;
    private final DecorrelatedJitterBackoff backoff;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;
    private final int maxEventBytes;
    private final String streamKey;
    private final Set<String> criticalTypes;

    @Autowired
    public EventPublisher(EventTransport transport,
                          ChannelRouter channelRouter,
                          EventCodec eventCodec,
                          AppProperties appProperties,
                          MeterRegistry meterRegistry) {
        this(transport, channelRouter, eventCodec, appProperties, meterRegistry,
                new EventCircuitBreaker("event-publisher",
                        appProperties.getCircuitBreaker().getFailureThreshold(),
                        Duration.ofMillis(appProperties.getCircuitBreaker().getRecoveryTimeoutMs()),
                        appProperties.getCircuitBreaker().getHalfOpenMaxCalls(),
                        Clock.systemUTC()),
                new DecorrelatedJitterBackoff(
                        appProperties.getPublisher().getRetryBaseDelayMs(),
                        appProperties.getPublisher().getRetryMaxDelayMs()));
    }

    public EventPublisher(EventTransport transport,
                          ChannelRouter channelRouter,
                          EventCodec eventCodec,
                          AppProperties appProperties,
                          MeterRegistry meterRegistry,
                          EventCircuitBreaker circuitBreaker,
                          DecorrelatedJitterBackoff backoff) {
        this.transport = transport;
        this.channelRouter = channelRouter;
        this.eventCodec = eventCodec;
        this.meterRegistry = meterRegistry;
        this.circuitBreaker = circuitBreaker;
        this.backoff = backoff;
        this.maxAttempts = appProperties.getPublisher().getMaxRetries();
        this.maxEventBytes = appProperties.getPublisher().getMaxEventBytes();
        this.streamKey = appProperties.getStream().getKey();
        this.criticalTypes = new HashSet<>(appProperties.getStream().getCriticalTypes());
    }

    /**
     * Publishes the event on every channel the router resolves for it.
     * @return total number of subscribers reached across channels
     */
    public Mono<Long> publish(Event event) {
        return Mono.defer(() -> {
            String payload = encodeWithinLimit(event);
            Set<String> channels = channelRouter.resolve(event);
            return Flux.fromIterable(channels)
                    .concatMap(channel -> publishToChannel(channel, payload))
                    .reduce(0L, Long::sum);
        });
    }

    /**
     * Publishes an already-encoded payload on one channel. The size gate still applies.
     */
    public Mono<Long> publishToChannel(String channel, String payload) {
        return Mono.defer(() -> {
            checkSize(payload, channel);
            return withRetry(channel, () -> transport.publish(channel, payload).defaultIfEmpty(0L))
                    .doOnNext(receivers -> meterRegistry.counter("realtime.publish.sent", "path", "pubsub").increment());
        });
    }

    /**
     * Appends the event to the critical stream, for consumers that need at-least-once delivery.
     * @return the stream entry id
     */
    public Mono<String> publishGuaranteed(Event event) {
        return Mono.defer(() -> {
            String payload = encodeWithinLimit(event);
            return withRetry(streamKey, () -> transport.append(streamKey, payload))
                    .doOnNext(id -> log.debug("[STREAM_APPEND] {} appended to {} as {}", event.getType(), streamKey, id))
                    .doOnNext(id -> meterRegistry.counter("realtime.publish.sent", "path", "stream").increment());
        });
    }

    /**
     * Takes the guaranteed path for critical event types and pub/sub for everything else.
     */
    public Mono<Void> route(Event event) {
        if (isCritical(event)) {
            return publishGuaranteed(event).then();
        }
        return publish(event).then();
    }

    public boolean isCritical(Event event) {
        return criticalTypes.contains(event.getType());
    }

    /**
     * Starts a publish without making the caller wait. The outcome is observed: failures go to
     * the error log and the {@code realtime.publish.background.failures} counter.
     */
    public Disposable publishInBackground(Event event) {
        return publish(event).subscribe(
                receivers -> log.debug("[PUBLISH_BG] {} delivered to {} subscribers", event.getType(), receivers),
                error -> {
                    meterRegistry.counter("realtime.publish.background.failures",
                            "type", event.getType(),
                            "error", error.getClass().getSimpleName()).increment();
                    log.error("[PUBLISH_BG_FAILED] Background publish of {} for tenant {} failed: {}",
                            event.getType(), event.getTenantId(), error.getMessage());
                });
    }

    public Map<String, Object> getCircuitBreakerStats() {
        return circuitBreaker.getStats();
    }

    EventCircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    private String encodeWithinLimit(Event event) {
        String payload = eventCodec.encode(event);
        checkSize(payload, event.getType());
        return payload;
    }

    private void checkSize(String payload, String label) {
        int size = EventCodec.utf8Size(payload);
        if (size > maxEventBytes) {
            meterRegistry.counter("realtime.publish.rejected", "reason", "size").increment();
            log.warn("[PUBLISH_REJECTED] Event {} is {} bytes, limit is {} bytes", label, size, maxEventBytes);
            throw new EventValidationException("Event " + label + " is " + size + " bytes, exceeds limit of " + maxEventBytes);
        }
    }

    private <T> Mono<T> withRetry(String target, Supplier<Mono<T>> call) {
        return attempt(target, call, 0);
    }

    private <T> Mono<T> attempt(String target, Supplier<Mono<T>> call, int attempt) {
        return Mono.defer(() -> {
            if (!circuitBreaker.tryAcquire()) {
                meterRegistry.counter("realtime.publish.rejected", "reason", "breaker_open").increment();
                return Mono.error(new BreakerOpenException(circuitBreaker.getName()));
            }
            // exactly one breaker outcome per granted permit
            AtomicBoolean settled = new AtomicBoolean();
            return call.get()
                    .onErrorMap(error -> !(error instanceof EventDistributionException),
                            error -> new TransientStoreException("Store call for " + target + " failed", error))
                    .doOnNext(result -> {
                        if (settled.compareAndSet(false, true)) {
                            circuitBreaker.recordSuccess();
                        }
                    })
                    .doOnError(TransientStoreException.class, error -> {
                        if (settled.compareAndSet(false, true)) {
                            circuitBreaker.recordFailure(error);
                        }
                    })
                    .doFinally(signal -> {
                        if (settled.compareAndSet(false, true)) {
                            circuitBreaker.releasePermission();
                        }
                    })
                    .onErrorResume(TransientStoreException.class, error -> {
                        int next = attempt + 1;
                        if (next >= maxAttempts) {
                            log.error("[PUBLISH_EXHAUSTED] {} failed after {} attempts: {}", target, next, rootMessage(error));
                            return Mono.error(new PublishRetriesExhaustedException(target, next, error.getCause()));
                        }
                        Duration delay = backoff.delay(attempt);
                        log.warn("[PUBLISH_RETRY] {} attempt {}/{} failed, retrying in {}ms: {}",
                                target, next, maxAttempts, delay.toMillis(), rootMessage(error));
                        return Mono.delay(delay).then(attempt(target, call, next));
                    });
        });
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
