package com.example.realtime.gateway.subscriber;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A pattern subscription on the broker.
 */
public interface PubSubSource {

    /**
     * Registers the patterns. The outer {@link Mono} completes once the broker has confirmed the
     * subscription; the inner {@link Flux} carries messages until the connection breaks.
     */
    Mono<Flux<InboundMessage>> subscribe(List<String> patterns);

    /**
     * Unsubscribes and releases the connection held by the last {@link #subscribe} call.
     */
    Mono<Void> close();
}
