package com.example.realtime.gateway.subscriber;

/**
 * A raw pub/sub delivery: the concrete channel, the pattern that matched it, and the payload.
 */
public record InboundMessage(String channel, String pattern, String payload) {
}
