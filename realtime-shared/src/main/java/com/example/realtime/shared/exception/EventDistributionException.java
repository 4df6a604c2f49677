package com.example.realtime.shared.exception;

/**
 * Base type for every failure surfaced by the event distribution layer.
 */
public class EventDistributionException extends RuntimeException {

    public EventDistributionException(String message) {
        super(message);
    }

    public EventDistributionException(String message, Throwable cause) {
        super(message, cause);
    }
}
