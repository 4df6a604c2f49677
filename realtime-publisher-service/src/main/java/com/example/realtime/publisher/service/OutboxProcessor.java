package com.example.realtime.publisher.service;

import com.example.realtime.shared.aspect.Monitored;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.BreakerOpenException;
import com.example.realtime.shared.exception.EventValidationException;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.model.OutboxEvent;
import com.example.realtime.shared.outbox.OutboxEventRepository;
import com.example.realtime.shared.publisher.EventPublisher;
import com.example.realtime.shared.util.Constants.OutboxStatus;
import com.example.realtime.shared.util.EventCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Drains PENDING outbox rows into the broker. A row is claimed before it is published, so two
 * processors polling the same table never publish the same row twice. Publish failures put the
 * row back to PENDING until the retry ceiling, then park it as FAILED for an operator. A publish
 * refused by the open circuit breaker is not an attempt: the row goes back untouched and the
 * cycle ends.
 */
@Service
@Slf4j
@Profile("!no-scheduling")
public class OutboxProcessor {

    private enum PublishOutcome { PUBLISHED, NOT_PUBLISHED, DEFERRED }

    private final OutboxEventRepository outboxEventRepository;
    private final EventPublisher eventPublisher;
    private final EventCodec eventCodec;
    private final Clock clock;
    private final int batchSize;
    private final int maxRetries;
    private final Counter pollRunsCounter;
    private final Counter publishedCounter;
    private final Counter failedCounter;

    private volatile boolean shuttingDown;

    public OutboxProcessor(OutboxEventRepository outboxEventRepository,
                           EventPublisher eventPublisher,
                           EventCodec eventCodec,
                           AppProperties appProperties,
                           MeterRegistry meterRegistry) {
        this(outboxEventRepository, eventPublisher, eventCodec, appProperties, meterRegistry, Clock.systemUTC());
    }

    OutboxProcessor(OutboxEventRepository outboxEventRepository,
                    EventPublisher eventPublisher,
                    EventCodec eventCodec,
                    AppProperties appProperties,
                    MeterRegistry meterRegistry,
                    Clock clock) {
        this.outboxEventRepository = outboxEventRepository;
        this.eventPublisher = eventPublisher;
        this.eventCodec = eventCodec;
        this.clock = clock;
        this.batchSize = appProperties.getOutbox().getBatchSize();
        this.maxRetries = appProperties.getOutbox().getMaxRetries();
        this.pollRunsCounter = meterRegistry.counter("realtime.outbox.poll.runs.total");
        this.publishedCounter = meterRegistry.counter("realtime.outbox.rows", "outcome", "published");
        this.failedCounter = meterRegistry.counter("realtime.outbox.rows", "outcome", "failed");
    }

    @Monitored("outbox")
    @Scheduled(fixedDelayString = "${realtime.outbox.poll-interval-ms:1000}")
    public void pollOutbox() {
        if (shuttingDown) {
            return;
        }
        int published = processBatch();
        pollRunsCounter.increment();
        if (published > 0) {
            log.debug("[OUTBOX_POLL] Published {} outbox rows", published);
        }
    }

    /**
     * Runs one cycle over the oldest PENDING rows.
     * @return the number of rows this processor published
     */
    public int processBatch() {
        List<OutboxEvent> pending = outboxEventRepository.findPending(batchSize);
        if (pending.isEmpty()) {
            return 0;
        }
        log.trace("[OUTBOX_POLL] Found {} pending outbox rows", pending.size());

        int published = 0;
        for (OutboxEvent row : pending) {
            // Finish the row in hand, but do not start another one once shutdown begins.
            if (shuttingDown) {
                log.info("[OUTBOX_SHUTDOWN] Stopping outbox cycle, {} rows left for the next run", pending.size() - published);
                break;
            }
            if (!outboxEventRepository.claim(row.getId(), now())) {
                log.debug("[OUTBOX_CLAIM] Row {} already claimed by another processor", row.getId());
                continue;
            }
            PublishOutcome outcome = publishClaimed(row);
            if (outcome == PublishOutcome.PUBLISHED) {
                published++;
            } else if (outcome == PublishOutcome.DEFERRED) {
                log.info("[OUTBOX_DEFERRED] Circuit breaker open, leaving remaining rows for a later cycle");
                break;
            }
        }
        return published;
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        log.info("[OUTBOX_SHUTDOWN] Outbox processor stopping");
    }

    boolean isShuttingDown() {
        return shuttingDown;
    }

    private PublishOutcome publishClaimed(OutboxEvent row) {
        Event event;
        try {
            event = eventCodec.decode(row.getPayload());
        } catch (EventValidationException e) {
            // A payload that cannot be decoded will never publish.
            log.error("[OUTBOX_POISON] Outbox row {} ({}) has an undecodable payload: {}", row.getId(), row.getEventType(), e.getMessage());
            if (outboxEventRepository.markAttemptFailed(row.getId(), maxRetries, OutboxStatus.FAILED, e.getMessage(), now())) {
                failedCounter.increment();
            } else {
                logClaimLost(row);
            }
            return PublishOutcome.NOT_PUBLISHED;
        }

        try {
            eventPublisher.route(event).block();
        } catch (BreakerOpenException e) {
            if (!outboxEventRepository.releaseClaim(row.getId())) {
                logClaimLost(row);
            }
            log.debug("[OUTBOX_DEFERRED] Row {} ({}) released, retry count stays at {}", row.getId(), row.getEventType(), row.getRetryCount());
            return PublishOutcome.DEFERRED;
        } catch (RuntimeException e) {
            recordFailure(row, e);
            return PublishOutcome.NOT_PUBLISHED;
        }

        if (!outboxEventRepository.markPublished(row.getId(), now())) {
            // Published, but the claim was taken back in the meantime; the row may publish again.
            logClaimLost(row);
            return PublishOutcome.NOT_PUBLISHED;
        }
        publishedCounter.increment();
        log.debug("[OUTBOX_PUBLISH] Row {} ({}) published", row.getId(), row.getEventType());
        return PublishOutcome.PUBLISHED;
    }

    private void recordFailure(OutboxEvent row, RuntimeException error) {
        int retryCount = row.getRetryCount() + 1;
        if (retryCount >= maxRetries) {
            if (!outboxEventRepository.markAttemptFailed(row.getId(), retryCount, OutboxStatus.FAILED, error.getMessage(), now())) {
                logClaimLost(row);
                return;
            }
            failedCounter.increment();
            log.error("[OUTBOX_FAILED] Row {} ({}) failed {} times and needs manual intervention: {}",
                    row.getId(), row.getEventType(), retryCount, error.getMessage());
        } else {
            if (!outboxEventRepository.markAttemptFailed(row.getId(), retryCount, OutboxStatus.PENDING, error.getMessage(), now())) {
                logClaimLost(row);
                return;
            }
            log.warn("[OUTBOX_RETRY] Row {} ({}) publish attempt {}/{} failed: {}",
                    row.getId(), row.getEventType(), retryCount, maxRetries, error.getMessage());
        }
    }

    private void logClaimLost(OutboxEvent row) {
        log.warn("[OUTBOX_CLAIM_LOST] Row {} ({}) was no longer PROCESSING when its outcome was recorded", row.getId(), row.getEventType());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
