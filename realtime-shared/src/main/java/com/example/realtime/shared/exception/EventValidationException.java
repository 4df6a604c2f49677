package com.example.realtime.shared.exception;

/**
 * Raised for malformed or oversized events. Thrown before any network call and never retried.
 */
public class EventValidationException extends EventDistributionException {

    public EventValidationException(String message) {
        super(message);
    }

    public EventValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
