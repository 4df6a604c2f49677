package com.example.realtime.shared.exception;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends EventDistributionException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(String identity, long retryAfterSeconds) {
        super("Too many attempts for '" + identity + "'. Retry in " + retryAfterSeconds + " seconds.");
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
