package com.example.realtime.shared.security;

/**
 * A counter that is incremented and given an expiry in a single round trip.
 */
public interface AtomicCounterStore {

    /**
     * Increments {@code key}. The first increment of a window starts its expiry; a key found
     * without an expiry is given one.
     */
    CounterState incrementWithExpiry(String key, int windowSeconds);

    void reset(String key);
}
