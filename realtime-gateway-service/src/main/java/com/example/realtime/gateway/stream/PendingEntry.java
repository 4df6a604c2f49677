package com.example.realtime.gateway.stream;

/**
 * An entry delivered to a consumer of the group but not yet acknowledged.
 */
public record PendingEntry(String id, String consumer, long idleMs, long deliveryCount) {
}
