package com.example.realtime.gateway.session;

import com.example.realtime.gateway.subscriber.QueuedMessage;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.config.MonitoringConfig;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.routing.ChannelRouter;
import com.example.realtime.shared.util.Constants.ClientRole;
import com.example.realtime.shared.util.EventCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.example.realtime.gateway.session.ClientSessionRegistryTest.waiter;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionDeliveryRouterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EventCodec codec = new EventCodec(objectMapper);
    private final ChannelRouter channelRouter = new ChannelRouter();
    private SimpleMeterRegistry meterRegistry;
    private ClientSessionRegistry registry;
    private SessionDeliveryRouter router;

    @BeforeEach
    void setup() {
        meterRegistry = new SimpleMeterRegistry();
        SseEventFactory factory = new SseEventFactory(objectMapper);
        registry = new ClientSessionRegistry(factory, new MonitoringConfig.RealtimeMetricsCollector(meterRegistry), new AppProperties());
        router = new SessionDeliveryRouter(registry, factory, channelRouter, meterRegistry);
    }

    private List<String> connect(String connectionId, ClientScope scope) {
        List<String> payloads = new CopyOnWriteArrayList<>();
        registry.register(connectionId, scope)
                .filter(event -> "EVENT".equals(event.event()))
                .map(ServerSentEvent::data)
                .subscribe(payloads::add);
        return payloads;
    }

    /** Delivers the event on every channel it routes to, as the dispatcher would. */
    private int deliverEverywhere(Event event) {
        String payload = codec.encode(event);
        int reached = 0;
        for (String channel : channelRouter.resolve(event)) {
            reached += router.deliver(new QueuedMessage(channel, event, payload, Instant.now())).block();
        }
        return reached;
    }

    private static Event event(String type, long tenantId, Long sectorId) {
        return Event.builder()
                .type(type)
                .tenantId(tenantId)
                .branchId(5L)
                .sectorId(sectorId)
                .entity(Map.of("order_id", 42))
                .build();
    }

    @Test
    void sessionsOfAnotherTenantNeverSeeTheEvent() {
        List<String> sameTenant = connect("c1", waiter(7L, 1L, 5L));
        List<String> otherTenant = connect("c2", waiter(8L, 2L, 5L));

        deliverEverywhere(event("ROUND_READY", 1L, null));

        assertEquals(1, sameTenant.size());
        assertTrue(otherTenant.isEmpty());
        assertTrue(meterRegistry.counter("realtime.delivery.skipped", "reason", "tenant").count() > 0);
    }

    @Test
    void sectorWaiterReceivesASectorTargetedEventOnce() {
        List<String> assigned = connect("c1", waiter(7L, 1L, 5L, 2L));
        List<String> unassigned = connect("c2", waiter(8L, 1L, 5L));
        List<String> otherSector = connect("c3", waiter(9L, 1L, 5L, 3L));

        int reached = deliverEverywhere(event("ORDER_SUBMITTED", 1L, 2L));

        assertEquals(1, assigned.size());
        assertEquals(1, unassigned.size());
        assertEquals(1, otherSector.size());
        assertEquals(3, reached);
        assertEquals(1.0, meterRegistry.counter("realtime.delivery.skipped", "reason", "sector_duplicate").count());
    }

    @Test
    void branchWideEventReachesSectorWaitersThroughTheBranchChannel() {
        List<String> assigned = connect("c1", waiter(7L, 1L, 5L, 2L));

        deliverEverywhere(event("ROUND_PENDING", 1L, 2L));

        assertEquals(1, assigned.size());
    }

    @Test
    void payloadIsForwardedUntouched() {
        List<String> received = connect("c1", ClientScope.builder()
                .userId(3L).tenantId(1L).role(ClientRole.ADMIN).branchId(5L).build());
        Event event = event("ENTITY_UPDATED", 1L, null);
        String payload = codec.encode(event);

        int reached = router.deliver(new QueuedMessage("branch:5:admin", event, payload, Instant.now())).block();

        assertEquals(1, reached);
        assertEquals(1, received.size());
        assertEquals(codec.encode(event), received.get(0));
    }
}
