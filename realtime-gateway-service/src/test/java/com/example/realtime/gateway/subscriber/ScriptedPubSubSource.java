package com.example.realtime.gateway.subscriber;

import org.springframework.data.redis.RedisConnectionFailureException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fails the first {@code failures} subscribe calls, leaves the next {@code hangs} unconfirmed, then
 * succeeds. The live stream can be fed or broken from the test.
 */
class ScriptedPubSubSource implements PubSubSource {

    final List<List<String>> subscribeCalls = new CopyOnWriteArrayList<>();
    final AtomicInteger closeCalls = new AtomicInteger();
    private final AtomicInteger failures;
    private final AtomicInteger hangs;
    private volatile Sinks.Many<InboundMessage> current;

    ScriptedPubSubSource(int failures, int hangs) {
        this.failures = new AtomicInteger(failures);
        this.hangs = new AtomicInteger(hangs);
    }

    @Override
    public Mono<Flux<InboundMessage>> subscribe(List<String> patterns) {
        return Mono.defer(() -> {
            subscribeCalls.add(List.copyOf(patterns));
            if (failures.getAndDecrement() > 0) {
                return Mono.error(new RedisConnectionFailureException("connection refused"));
            }
            if (hangs.getAndDecrement() > 0) {
                return Mono.never();
            }
            Sinks.Many<InboundMessage> sink = Sinks.many().multicast().onBackpressureBuffer();
            current = sink;
            return Mono.just(sink.asFlux());
        });
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(closeCalls::incrementAndGet);
    }

    void emit(InboundMessage message) {
        current.tryEmitNext(message);
    }

    void breakConnection() {
        current.tryEmitError(new RedisConnectionFailureException("connection reset"));
    }
}
