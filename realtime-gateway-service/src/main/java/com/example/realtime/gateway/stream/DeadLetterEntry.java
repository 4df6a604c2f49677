package com.example.realtime.gateway.stream;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A critical-stream entry that ran out of deliveries, as kept in the dead-letter stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterEntry {
    /** Id in the dead-letter stream; {@code null} until written. */
    private String id;
    private String originalId;
    private String originalStream;
    private String data;
    private long retryCount;
    private Instant failedAt;
    private String consumer;
}
