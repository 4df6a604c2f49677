package com.example.realtime.shared.model;

import com.example.realtime.shared.util.Constants.OutboxStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Durable record of an event that is due for publication, committed with the business change
 * that produced it. Rows are never deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEvent {
    private Long id;
    private long tenantId;
    private String eventType;
    private String aggregateType;
    private long aggregateId;
    private String payload;
    @Builder.Default
    private OutboxStatus status = OutboxStatus.PENDING;
    private int retryCount;
    private String lastError;
    private OffsetDateTime createdAt;
    private OffsetDateTime claimedAt;
    private OffsetDateTime processedAt;
}
