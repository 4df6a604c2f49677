package com.example.realtime.shared.security;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Result of one atomic increment: the count inside the current window and the seconds left in it.
 */
@Data
@AllArgsConstructor
public class CounterState {
    private final long count;
    private final long ttlSeconds;
}
