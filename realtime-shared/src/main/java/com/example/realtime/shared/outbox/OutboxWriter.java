package com.example.realtime.shared.outbox;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.EventValidationException;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.model.OutboxEvent;
import com.example.realtime.shared.util.Constants.AggregateType;
import com.example.realtime.shared.util.EventCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes outbox rows inside the business transaction that produced the event. Must be called
 * with a transaction already open, so the row commits or rolls back with the business data.
 */
@Service
@Slf4j
public class OutboxWriter {

    private final OutboxEventRepository outboxEventRepository;
    private final EventCodec eventCodec;
    private final int maxEventBytes;

    public OutboxWriter(OutboxEventRepository outboxEventRepository, EventCodec eventCodec, AppProperties appProperties) {
        this.outboxEventRepository = outboxEventRepository;
        this.eventCodec = eventCodec;
        this.maxEventBytes = appProperties.getPublisher().getMaxEventBytes();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public long write(Event event, AggregateType aggregateType, long aggregateId) {
        String payload = eventCodec.encode(event);
        int size = EventCodec.utf8Size(payload);
        if (size > maxEventBytes) {
            log.warn("[OUTBOX_REJECTED] Event {} is {} bytes, limit is {} bytes", event.getType(), size, maxEventBytes);
            throw new EventValidationException("Event " + event.getType() + " is " + size + " bytes, exceeds limit of " + maxEventBytes);
        }
        long id = outboxEventRepository.insert(OutboxEvent.builder()
                .tenantId(event.getTenantId())
                .eventType(event.getType())
                .aggregateType(aggregateType.value())
                .aggregateId(aggregateId)
                .payload(payload)
                .build());
        log.debug("[OUTBOX_WRITE] {} for {} {} queued as outbox row {}", event.getType(), aggregateType.value(), aggregateId, id);
        return id;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public long writeRoundEvent(Event event, long roundId) {
        return write(event, AggregateType.ROUND, roundId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public long writeServiceCallEvent(Event event, long serviceCallId) {
        return write(event, AggregateType.SERVICE_CALL, serviceCallId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public long writeBillingEvent(Event event, long checkId) {
        return write(event, AggregateType.CHECK, checkId);
    }
}
