package com.example.realtime.gateway.subscriber;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.publisher.EventPublisher;
import com.example.realtime.shared.resilience.DecorrelatedJitterBackoff;
import com.example.realtime.shared.resilience.EventCircuitBreaker;
import com.example.realtime.shared.resilience.MutableClock;
import com.example.realtime.shared.routing.ChannelRouter;
import com.example.realtime.shared.util.EventCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RedisEventSubscriberTest {

    private final EventCodec codec = new EventCodec(new ObjectMapper());
    private AppProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryBroker broker;
    private final List<QueuedMessage> delivered = new CopyOnWriteArrayList<>();
    private RedisEventSubscriber subscriber;

    @BeforeEach
    void setup() {
        properties = new AppProperties();
        properties.getSubscriber().setPatterns(List.of("branch:*:waiters", "branch:*:admin"));
        properties.getSubscriber().setDispatchIntervalMs(5);
        properties.getReconnect().setBaseDelayMs(1);
        properties.getReconnect().setMaxDelayMs(5);
        meterRegistry = new SimpleMeterRegistry();
        broker = new InMemoryBroker();
    }

    @AfterEach
    void tearDown() {
        if (subscriber != null) {
            subscriber.stop();
        }
    }

    private RedisEventSubscriber subscriber(Clock clock) {
        ReconnectionManager reconnectionManager = new ReconnectionManager(broker, properties, meterRegistry);
        EventDelivery recording = message -> Mono.fromCallable(() -> {
            delivered.add(message);
            return 1;
        });
        return new RedisEventSubscriber(reconnectionManager, recording, codec, properties, meterRegistry, clock);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean(), "condition not met within 5s");
    }

    private static Event orderSubmitted() {
        return Event.builder()
                .type("ORDER_SUBMITTED")
                .tenantId(1L)
                .branchId(5L)
                .sectorId(2L)
                .entity(Map.of("order_id", 42))
                .build();
    }

    @Test
    void publishedEventReachesTheSubscriberOnTheMatchingChannelsOnly() throws InterruptedException {
        subscriber = subscriber(Clock.systemUTC());
        subscriber.start();
        await(() -> Boolean.TRUE.equals(subscriber.getStats().get("connected")));

        EventPublisher publisher = new EventPublisher(broker, new ChannelRouter(), codec, properties, meterRegistry,
                new EventCircuitBreaker("test", 5, Duration.ofSeconds(30), 3, Clock.systemUTC()),
                new DecorrelatedJitterBackoff(1, 5));
        Long receivers = publisher.publish(orderSubmitted()).block();

        assertEquals(2L, receivers);
        await(() -> delivered.size() == 2);
        Set<String> channels = delivered.stream().map(QueuedMessage::getChannel).collect(Collectors.toSet());
        assertEquals(Set.of("branch:5:waiters", "branch:5:admin"), channels);
        delivered.forEach(message -> assertEquals(42, message.getEvent().getEntity().get("order_id")));
    }

    @Test
    void oversizedAndMalformedMessagesAreDiscardedBeforeQueueing() {
        properties.getPublisher().setMaxEventBytes(256);
        subscriber = subscriber(Clock.systemUTC());

        subscriber.onMessage(new InboundMessage("branch:5:waiters", "branch:*:waiters", "{\"type\":\"X\",\"pad\":\"" + "x".repeat(300) + "\"}"));
        subscriber.onMessage(new InboundMessage("branch:5:waiters", "branch:*:waiters", "{not json"));
        subscriber.onMessage(new InboundMessage("branch:5:waiters", "branch:*:waiters", "{\"type\":\"ROUND_READY\",\"branch_id\":5}"));
        subscriber.onMessage(new InboundMessage("branch:5:waiters", "branch:*:waiters", codec.encode(orderSubmitted())));

        assertEquals(1, subscriber.queue().size());
        assertEquals(1.0, meterRegistry.counter("realtime.subscriber.rejected", "reason", "size").count());
        assertEquals(2.0, meterRegistry.counter("realtime.subscriber.rejected", "reason", "schema").count());
        assertEquals(4.0, meterRegistry.counter("realtime.subscriber.received").count());
    }

    @Test
    void overflowIsCountedAsADrop() {
        properties.getSubscriber().setQueueCapacity(2);
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T12:00:00Z"));
        subscriber = subscriber(clock);
        String payload = codec.encode(orderSubmitted());

        for (int i = 0; i < 5; i++) {
            subscriber.onMessage(new InboundMessage("branch:5:waiters", "branch:*:waiters", payload));
        }

        assertEquals(2, subscriber.queue().size());
        assertEquals(3.0, meterRegistry.counter("realtime.subscriber.dropped", "reason", "overflow").count());
        assertEquals(3L, subscriber.dropRateWindow().getStats().get("totalDropped"));
        assertEquals(1L, subscriber.dropRateWindow().alertCount());
    }
}
