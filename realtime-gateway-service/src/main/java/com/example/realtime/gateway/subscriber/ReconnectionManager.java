package com.example.realtime.gateway.subscriber;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.TransientStoreException;
import com.example.realtime.shared.resilience.DecorrelatedJitterBackoff;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Keeps a pattern subscription alive. When the message stream breaks or ends, the old
 * subscription is closed (bounded by the cleanup timeout), then a new one is opened after a
 * decorrelated-jitter delay. Each attempt must be confirmed within the attempt timeout. Retries
 * never stop; past the fatal threshold every failed attempt is logged as FATAL.
 */
@Component
@Slf4j
public class ReconnectionManager {

    private final PubSubSource source;
    private final DecorrelatedJitterBackoff backoff;
    private final Duration cleanupTimeout;
    private final Duration attemptTimeout;
    private final int fatalAfterAttempts;
    private final Counter reconnectCounter;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicInteger connections = new AtomicInteger();
    private volatile boolean connected;

    public ReconnectionManager(PubSubSource source, AppProperties appProperties, MeterRegistry meterRegistry) {
        AppProperties.Reconnect settings = appProperties.getReconnect();
        this.source = source;
        this.backoff = new DecorrelatedJitterBackoff(settings.getBaseDelayMs(), settings.getMaxDelayMs());
        this.cleanupTimeout = Duration.ofMillis(settings.getCleanupTimeoutMs());
        this.attemptTimeout = Duration.ofMillis(settings.getAttemptTimeoutMs());
        this.fatalAfterAttempts = settings.getFatalAfterAttempts();
        this.reconnectCounter = meterRegistry.counter("realtime.subscriber.reconnects");
    }

    /**
     * Subscribes to {@code patterns} and hands every message to {@code onMessage} until the
     * returned {@link Disposable} is disposed. All patterns are re-issued on every reconnect.
     */
    public Disposable maintain(List<String> patterns, Consumer<InboundMessage> onMessage) {
        Flux<InboundMessage> session = Mono.defer(() -> source.subscribe(patterns))
                .timeout(attemptTimeout)
                .doOnNext(messages -> onSubscribed(patterns))
                .flatMapMany(messages -> messages)
                .concatWith(Flux.error(() -> new TransientStoreException("Pattern subscription stream ended", null)))
                .onErrorResume(error -> {
                    connected = false;
                    return cleanup().then(Mono.error(error));
                });

        return session
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    int failures = consecutiveFailures.incrementAndGet();
                    Duration delay = backoff.delay(failures - 1);
                    reconnectCounter.increment();
                    if (failures >= fatalAfterAttempts) {
                        log.error("[SUB_RECONNECT_FATAL] FATAL: pattern subscription failed {} consecutive times, still retrying in {}ms: {}",
                                failures, delay.toMillis(), signal.failure().getMessage());
                    } else {
                        log.warn("[SUB_RECONNECT] Pattern subscription lost (attempt {}), reconnecting in {}ms: {}",
                                failures, delay.toMillis(), signal.failure().getMessage());
                    }
                    return Mono.delay(delay);
                })))
                .subscribe(onMessage,
                        error -> log.error("[SUB_STOPPED] Pattern subscription terminated: {}", error.getMessage(), error));
    }

    /**
     * Releases the current subscription. Used on shutdown and between reconnect attempts.
     */
    public Mono<Void> cleanup() {
        return source.close()
                .timeout(cleanupTimeout)
                .onErrorResume(error -> {
                    log.warn("[SUB_CLEANUP] Closing the old subscription did not finish cleanly within {}ms: {}",
                            cleanupTimeout.toMillis(), error.getMessage());
                    return Mono.empty();
                });
    }

    public boolean isConnected() {
        return connected;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getConnectionCount() {
        return connections.get();
    }

    private void onSubscribed(List<String> patterns) {
        int previousFailures = consecutiveFailures.getAndSet(0);
        connected = true;
        int count = connections.incrementAndGet();
        if (count == 1) {
            log.info("[SUB_CONNECTED] Subscribed to {}", patterns);
        } else {
            log.info("[SUB_RECONNECTED] Re-subscribed to {} after {} failed attempts", patterns, previousFailures);
        }
    }
}
