package com.example.realtime.shared.resilience;

import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry delay drawn uniformly from {@code [base, min(base * 2^attempt, max)]}.
 */
@Getter
public class DecorrelatedJitterBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public DecorrelatedJitterBackoff(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Require 0 < base <= max, got base=" + baseDelayMs + ", max=" + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public Duration delay(int attempt) {
        long upper = upperBoundMs(attempt);
        if (upper <= baseDelayMs) {
            return Duration.ofMillis(baseDelayMs);
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(baseDelayMs, upper + 1));
    }

    public long upperBoundMs(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative");
        }
        // Compare before shifting so large attempts cannot overflow.
        if (attempt >= 62 || baseDelayMs > (maxDelayMs >> attempt)) {
            return maxDelayMs;
        }
        return baseDelayMs << attempt;
    }
}
