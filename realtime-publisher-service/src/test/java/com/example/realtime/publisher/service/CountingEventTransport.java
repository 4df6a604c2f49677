package com.example.realtime.publisher.service;

import com.example.realtime.shared.publisher.EventTransport;
import org.springframework.data.redis.RedisConnectionFailureException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records every payload it is handed; fails every call while {@code down} is set. {@code onCall}
 * runs at the start of each call.
 */
class CountingEventTransport implements EventTransport {

    final AtomicInteger calls = new AtomicInteger();
    final List<String> payloads = new CopyOnWriteArrayList<>();
    volatile boolean down;
    volatile Runnable onCall = () -> { };

    @Override
    public Mono<Long> publish(String channel, String payload) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            onCall.run();
            if (down) {
                return Mono.error(new RedisConnectionFailureException("broker unreachable"));
            }
            payloads.add(payload);
            return Mono.just(1L);
        });
    }

    @Override
    public Mono<String> append(String streamKey, String payload) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            onCall.run();
            if (down) {
                return Mono.error(new RedisConnectionFailureException("broker unreachable"));
            }
            payloads.add(payload);
            return Mono.just("1700000000000-" + payloads.size());
        });
    }
}
