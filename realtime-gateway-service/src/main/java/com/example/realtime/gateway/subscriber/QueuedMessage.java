package com.example.realtime.gateway.subscriber;

import com.example.realtime.shared.model.Event;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A validated event waiting for dispatch, with the channel it arrived on and the time it was
 * queued. {@code attempts} counts delivery timeouts so far.
 */
@Getter
@ToString(exclude = "payload")
public final class QueuedMessage {

    private final String channel;
    private final Event event;
    private final String payload;
    private final Instant receivedAt;
    private final int attempts;

    public QueuedMessage(String channel, Event event, String payload, Instant receivedAt) {
        this(channel, event, payload, receivedAt, 0);
    }

    private QueuedMessage(String channel, Event event, String payload, Instant receivedAt, int attempts) {
        this.channel = channel;
        this.event = event;
        this.payload = payload;
        this.receivedAt = receivedAt;
        this.attempts = attempts;
    }

    public QueuedMessage nextAttempt() {
        return new QueuedMessage(channel, event, payload, receivedAt, attempts + 1);
    }
}
