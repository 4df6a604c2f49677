package com.example.realtime.gateway.stream;

import com.example.realtime.gateway.subscriber.EventDelivery;
import com.example.realtime.gateway.subscriber.QueuedMessage;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.TransientStoreException;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.routing.ChannelRouter;
import com.example.realtime.shared.util.EventCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CriticalStreamConsumerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private final EventCodec codec = new EventCodec(new ObjectMapper());
    private AppProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryCriticalStreamStore store;
    private final List<QueuedMessage> delivered = new CopyOnWriteArrayList<>();
    private volatile boolean deliveryDown;

    @BeforeEach
    void setup() {
        properties = new AppProperties();
        properties.getStream().setReclaimEveryCycles(3);
        properties.getStream().setErrorBackoffBaseMs(1000);
        properties.getStream().setErrorBackoffMaxMs(30000);
        properties.getSubscriber().setDeliveryTimeoutMs(1000);
        meterRegistry = new SimpleMeterRegistry();
        store = new InMemoryCriticalStreamStore();
    }

    private CriticalStreamConsumer consumer() {
        EventDelivery delivery = message -> Mono.defer(() -> {
            if (deliveryDown) {
                return Mono.error(new IllegalStateException("no route to sessions"));
            }
            delivered.add(message);
            return Mono.just(1);
        });
        return new CriticalStreamConsumer(store, new ChannelRouter(), codec, delivery, properties, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private String paymentApproved() {
        return codec.encode(Event.builder()
                .type("PAYMENT_APPROVED")
                .tenantId(1L)
                .branchId(5L)
                .sessionId(77L)
                .entity(Map.of("check_id", 9))
                .build());
    }

    @Test
    void deliveredEntryIsAcknowledgedAfterEveryRoutedChannel() {
        String id = store.add(paymentApproved());

        assertEquals(1, consumer().runCycle());

        assertEquals(List.of(id), store.acked);
        assertTrue(store.pending.isEmpty());
        List<String> channels = delivered.stream().map(QueuedMessage::getChannel).toList();
        assertEquals(List.of("branch:5:waiters", "branch:5:admin", "session:77"), channels);
    }

    @Test
    void failedDeliveryLeavesTheEntryPending() {
        deliveryDown = true;
        String id = store.add(paymentApproved());

        assertEquals(0, consumer().runCycle());

        assertTrue(store.acked.isEmpty());
        assertTrue(store.pending.containsKey(id));
        assertEquals(1.0, meterRegistry.counter("realtime.stream.entries", "outcome", "failed").count());
    }

    @Test
    void invalidEntriesAreAcknowledgedAndNotRetried() {
        String blank = store.add("");
        String garbage = store.add("{not json");
        String missingTenant = store.add("{\"type\":\"CHECK_PAID\",\"branch_id\":5}");

        assertEquals(3, consumer().runCycle());

        assertEquals(List.of(blank, garbage, missingTenant), store.acked);
        assertTrue(delivered.isEmpty());
        assertEquals(3.0, meterRegistry.counter("realtime.stream.entries", "outcome", "invalid").count());
    }

    @Test
    void entryOverTheDeliveryLimitIsDeadLetteredWithItsHistoryAndAcknowledged() {
        String payload = paymentApproved();
        String id = store.add(payload);
        deliveryDown = true;
        CriticalStreamConsumer consumer = consumer();
        consumer.runCycle();
        store.setDeliveryCount(id, 4);

        assertEquals(1, consumer.recoverPending());

        assertEquals(1, store.deadLetters.size());
        DeadLetterEntry deadLetter = store.deadLetters.get(0);
        assertEquals(id, deadLetter.getOriginalId());
        assertEquals("events:critical", deadLetter.getOriginalStream());
        assertEquals(payload, deadLetter.getData());
        assertEquals(4, deadLetter.getRetryCount());
        assertEquals(NOW, deadLetter.getFailedAt());
        assertEquals(InMemoryCriticalStreamStore.CONSUMER, deadLetter.getConsumer());
        assertEquals(List.of(id), store.acked);
        assertTrue(store.pending.isEmpty());
        assertEquals(1.0, meterRegistry.counter("realtime.stream.dead_lettered").count());

        assertEquals(0, consumer.recoverPending());
    }

    @Test
    void entryAtTheDeliveryLimitIsStillRetried() {
        String id = store.add(paymentApproved());
        deliveryDown = true;
        CriticalStreamConsumer consumer = consumer();
        consumer.runCycle();
        store.setDeliveryCount(id, 3);
        store.setIdle(id, 31_000);
        deliveryDown = false;

        assertEquals(1, consumer.recoverPending());

        assertTrue(store.deadLetters.isEmpty());
        assertEquals(List.of(id), store.acked);
        assertEquals(1.0, meterRegistry.counter("realtime.stream.reclaimed").count());
    }

    @Test
    void failedDeadLetterWriteKeepsTheEntryPending() {
        String id = store.add(paymentApproved());
        deliveryDown = true;
        CriticalStreamConsumer consumer = consumer();
        consumer.runCycle();
        store.setDeliveryCount(id, 4);
        store.failDeadLetterWrites = true;

        assertEquals(0, consumer.recoverPending());

        assertTrue(store.pending.containsKey(id));
        assertTrue(store.acked.isEmpty());
    }

    @Test
    void pendingEntriesAreOnlyReclaimedOnceIdle() {
        String id = store.add(paymentApproved());
        deliveryDown = true;
        CriticalStreamConsumer consumer = consumer();
        consumer.runCycle();
        deliveryDown = false;

        store.setIdle(id, 5_000);
        assertEquals(0, consumer.recoverPending());
        assertFalse(store.acked.contains(id));

        store.setIdle(id, 30_000);
        assertEquals(1, consumer.recoverPending());
        assertEquals(List.of(id), store.acked);
    }

    @Test
    void pendingListIsScannedEveryConfiguredNumberOfCycles() {
        String id = store.add(paymentApproved());
        deliveryDown = true;
        CriticalStreamConsumer consumer = consumer();
        consumer.runCycle();
        deliveryDown = false;
        store.setIdle(id, 60_000);

        consumer.runCycle();
        assertTrue(store.acked.isEmpty());

        consumer.runCycle();
        assertEquals(List.of(id), store.acked);
    }

    @Test
    void initializeCreatesTheGroupAndRecoversLeftovers() {
        String id = store.add(paymentApproved());
        deliveryDown = true;
        consumer().runCycle();
        deliveryDown = false;
        store.setIdle(id, 45_000);

        consumer().initialize();

        assertEquals(1, store.ensureGroupCalls);
        assertEquals(List.of(id), store.acked);
    }

    @Test
    void lostGroupIsRecreatedWithoutBackoff() {
        store.groupExists = false;
        CriticalStreamConsumer consumer = consumer();

        TransientStoreException failure = assertThrows(TransientStoreException.class, consumer::runCycle);

        assertEquals(Duration.ZERO, consumer.onCycleError(failure));
        assertEquals(1, store.ensureGroupCalls);
        assertTrue(store.groupExists);
    }

    @Test
    void otherCycleErrorsBackOffWithJitter() {
        CriticalStreamConsumer consumer = consumer();

        Duration first = consumer.onCycleError(new TransientStoreException("read timed out", null));
        Duration second = consumer.onCycleError(new TransientStoreException("read timed out", null));

        assertEquals(1000, first.toMillis());
        assertTrue(second.toMillis() >= 1000 && second.toMillis() <= 2000);
        assertEquals(2, consumer.getConsecutiveErrors());
        assertEquals(0, store.ensureGroupCalls);
    }
}
