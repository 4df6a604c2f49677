package com.example.realtime.gateway.subscriber;

import reactor.core.publisher.Mono;

/**
 * Hands a queued event to every client session subscribed to its channel.
 */
public interface EventDelivery {

    /**
     * @return completes when the event has been handed to every matching session; emits the
     *         number of sessions reached
     */
    Mono<Integer> deliver(QueuedMessage message);
}
