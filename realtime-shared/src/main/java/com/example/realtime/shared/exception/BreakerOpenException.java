package com.example.realtime.shared.exception;

import lombok.Getter;

@Getter
public class BreakerOpenException extends EventDistributionException {

    private final String breakerName;

    public BreakerOpenException(String breakerName) {
        super("Circuit breaker '" + breakerName + "' is open, call rejected");
        this.breakerName = breakerName;
    }
}
