package com.example.realtime.gateway.stream;

import com.example.realtime.gateway.subscriber.EventDelivery;
import com.example.realtime.gateway.subscriber.QueuedMessage;
import com.example.realtime.shared.aspect.Monitored;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.EventValidationException;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.resilience.DecorrelatedJitterBackoff;
import com.example.realtime.shared.routing.ChannelRouter;
import com.example.realtime.shared.util.EventCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * At-least-once consumer of the critical stream. An entry is acknowledged only after it has been
 * delivered on every channel it routes to, or after it has been written to the dead-letter
 * stream. Entries left pending by a crashed or failing consumer are reclaimed once idle.
 */
@Component
@Slf4j
public class CriticalStreamConsumer {

    private static final int PENDING_SCAN_COUNT = 100;

    private final CriticalStreamStore store;
    private final ChannelRouter channelRouter;
    private final EventCodec eventCodec;
    private final EventDelivery delivery;
    private final DecorrelatedJitterBackoff errorBackoff;
    private final Clock clock;

    private final String streamKey;
    private final String consumerName;
    private final int readCount;
    private final Duration block;
    private final int reclaimEveryCycles;
    private final Duration reclaimMinIdle;
    private final int maxDeliveries;
    private final Duration deliveryTimeout;

    private final Counter processedCounter;
    private final Counter invalidCounter;
    private final Counter failedCounter;
    private final Counter reclaimedCounter;
    private final Counter deadLetteredCounter;

    private long cycles;
    private int consecutiveErrors;

    @Autowired
    public CriticalStreamConsumer(CriticalStreamStore store,
                                  ChannelRouter channelRouter,
                                  EventCodec eventCodec,
                                  EventDelivery delivery,
                                  AppProperties appProperties,
                                  MeterRegistry meterRegistry) {
        this(store, channelRouter, eventCodec, delivery, appProperties, meterRegistry, Clock.systemUTC());
    }

    CriticalStreamConsumer(CriticalStreamStore store,
                           ChannelRouter channelRouter,
                           EventCodec eventCodec,
                           EventDelivery delivery,
                           AppProperties appProperties,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        AppProperties.Stream settings = appProperties.getStream();
        this.store = store;
        this.channelRouter = channelRouter;
        this.eventCodec = eventCodec;
        this.delivery = delivery;
        this.clock = clock;
        this.errorBackoff = new DecorrelatedJitterBackoff(settings.getErrorBackoffBaseMs(), settings.getErrorBackoffMaxMs());
        this.streamKey = settings.getKey();
        this.consumerName = settings.getConsumer();
        this.readCount = settings.getReadCount();
        this.block = Duration.ofMillis(settings.getBlockMs());
        this.reclaimEveryCycles = settings.getReclaimEveryCycles();
        this.reclaimMinIdle = Duration.ofMillis(settings.getReclaimMinIdleMs());
        this.maxDeliveries = settings.getMaxDeliveries();
        this.deliveryTimeout = Duration.ofMillis(appProperties.getSubscriber().getDeliveryTimeoutMs());

        this.processedCounter = meterRegistry.counter("realtime.stream.entries", "outcome", "processed");
        this.invalidCounter = meterRegistry.counter("realtime.stream.entries", "outcome", "invalid");
        this.failedCounter = meterRegistry.counter("realtime.stream.entries", "outcome", "failed");
        this.reclaimedCounter = meterRegistry.counter("realtime.stream.reclaimed");
        this.deadLetteredCounter = meterRegistry.counter("realtime.stream.dead_lettered");
    }

    /**
     * Makes sure the group exists and picks up whatever a previous run left pending.
     */
    public void initialize() {
        store.ensureGroup();
        recoverPending();
        log.info("[STREAM_START] Consuming {} as '{}'", streamKey, consumerName);
    }

    /**
     * One read cycle. Every {@code reclaimEveryCycles} cycles the pending list is scanned first.
     * @return the number of entries acknowledged
     */
    @Monitored("stream")
    public int runCycle() {
        cycles++;
        if (cycles % reclaimEveryCycles == 0) {
            recoverPending();
        }
        List<StreamEntry> entries = store.readNew(readCount, block);
        int acked = 0;
        for (StreamEntry entry : entries) {
            if (process(entry)) {
                acked++;
            }
        }
        consecutiveErrors = 0;
        return acked;
    }

    /**
     * Dead-letters entries that exhausted their deliveries, then claims and reprocesses the idle rest.
     * @return the number of entries dead-lettered or reclaimed
     */
    public int recoverPending() {
        List<PendingEntry> pending = store.pending(PENDING_SCAN_COUNT);
        if (pending.isEmpty()) {
            return 0;
        }
        int deadLettered = 0;
        List<String> idle = new ArrayList<>();
        for (PendingEntry entry : pending) {
            if (entry.deliveryCount() > maxDeliveries) {
                if (deadLetter(entry)) {
                    deadLettered++;
                }
            } else if (entry.idleMs() >= reclaimMinIdle.toMillis()) {
                idle.add(entry.id());
            }
        }

        int reclaimed = 0;
        if (!idle.isEmpty()) {
            for (StreamEntry entry : store.claim(reclaimMinIdle, idle)) {
                reclaimed++;
                reclaimedCounter.increment();
                process(entry);
            }
        }
        if (deadLettered > 0 || reclaimed > 0) {
            log.info("[STREAM_RECLAIM] {} pending entries: {} reclaimed, {} dead-lettered", pending.size(), reclaimed, deadLettered);
        }
        return deadLettered + reclaimed;
    }

    /**
     * @return {@code true} if the entry was acknowledged
     */
    boolean process(StreamEntry entry) {
        Event event;
        try {
            event = eventCodec.decode(entry.payload());
        } catch (EventValidationException e) {
            invalidCounter.increment();
            log.error("[STREAM_INVALID] Entry {} on {} is not a valid event and is discarded: {}", entry.id(), streamKey, e.getMessage());
            store.ack(entry.id());
            return true;
        }

        try {
            for (String channel : channelRouter.resolve(event)) {
                delivery.deliver(new QueuedMessage(channel, event, entry.payload(), clock.instant())).block(deliveryTimeout);
            }
        } catch (RuntimeException e) {
            failedCounter.increment();
            log.warn("[STREAM_DELIVERY_FAILED] {} entry {} left pending for redelivery: {}", event.getType(), entry.id(), e.getMessage());
            return false;
        }

        store.ack(entry.id());
        processedCounter.increment();
        log.debug("[STREAM_ACK] {} entry {} delivered and acknowledged", event.getType(), entry.id());
        return true;
    }

    /**
     * Decides how long to wait after a failed cycle. A lost consumer group is recreated at once.
     */
    public Duration onCycleError(RuntimeException error) {
        if (RedisCriticalStreamStore.messageChainContains(error, "NOGROUP")) {
            log.warn("[STREAM_GROUP_LOST] Consumer group on {} is gone, recreating it", streamKey);
            try {
                store.ensureGroup();
                consecutiveErrors = 0;
                return Duration.ZERO;
            } catch (RuntimeException recreateFailure) {
                error = recreateFailure;
            }
        }
        Duration delay = errorBackoff.delay(Math.min(consecutiveErrors, 30));
        consecutiveErrors++;
        log.error("[STREAM_ERROR] Read cycle failed ({} in a row), retrying in {}ms: {}",
                consecutiveErrors, delay.toMillis(), error.getMessage());
        return delay;
    }

    int getConsecutiveErrors() {
        return consecutiveErrors;
    }

    private boolean deadLetter(PendingEntry pending) {
        Optional<StreamEntry> original = store.findById(pending.id());
        DeadLetterEntry entry = DeadLetterEntry.builder()
                .originalId(pending.id())
                .originalStream(streamKey)
                .data(original.map(StreamEntry::payload).orElse(null))
                .retryCount(pending.deliveryCount())
                .failedAt(clock.instant())
                .consumer(pending.consumer())
                .build();
        try {
            String deadLetterId = store.deadLetter(entry);
            store.ack(pending.id());
            deadLetteredCounter.increment();
            log.error("[STREAM_DEAD_LETTER] Entry {} failed {} deliveries and was moved to the dead-letter stream as {}",
                    pending.id(), pending.deliveryCount(), deadLetterId);
            return true;
        } catch (RuntimeException e) {
            log.error("[STREAM_DEAD_LETTER_FAILED] Entry {} stays pending, dead-letter write failed: {}", pending.id(), e.getMessage(), e);
            return false;
        }
    }
}
