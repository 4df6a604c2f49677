package com.example.realtime.shared.exception;

import lombok.Getter;

/**
 * All publish attempts failed. Carries the attempt count and the last transient cause.
 */
@Getter
public class PublishRetriesExhaustedException extends EventDistributionException {

    private final int attempts;

    public PublishRetriesExhaustedException(String channel, int attempts, Throwable lastCause) {
        super("Publish to channel '" + channel + "' failed after " + attempts + " attempts", lastCause);
        this.attempts = attempts;
    }
}
