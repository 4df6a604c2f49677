package com.example.realtime.gateway.stream;

/**
 * One entry of the critical stream. {@code payload} is the encoded event, or {@code null} when
 * the entry has no data field.
 */
public record StreamEntry(String id, String payload) {
}
