package com.example.realtime.shared.publisher;

import reactor.core.publisher.Mono;

/**
 * Network side of publishing. Implementations perform exactly one store round trip per call.
 */
public interface EventTransport {

    /**
     * Publishes a payload on a pub/sub channel.
     * @return the number of subscribers that received it
     */
    Mono<Long> publish(String channel, String payload);

    /**
     * Appends a payload to a durable stream.
     * @return the id the store assigned to the new entry
     */
    Mono<String> append(String streamKey, String payload);
}
