package com.example.realtime.shared.exception;

/**
 * Connection or timeout failure talking to the store. Retried with backoff by the caller.
 */
public class TransientStoreException extends EventDistributionException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
