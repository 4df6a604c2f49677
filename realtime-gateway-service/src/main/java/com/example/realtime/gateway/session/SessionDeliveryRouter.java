package com.example.realtime.gateway.session;

import com.example.realtime.gateway.subscriber.EventDelivery;
import com.example.realtime.gateway.subscriber.QueuedMessage;
import com.example.realtime.shared.model.Event;
import com.example.realtime.shared.routing.ChannelNames;
import com.example.realtime.shared.routing.ChannelRouter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Delivers a queued event to the local sessions listening on its channel. Sessions of another
 * tenant never see it. A waiter assigned to the event's sector skips the branch-wide copy
 * because the sector copy reaches them too.
 */
@Component
@Slf4j
public class SessionDeliveryRouter implements EventDelivery {

    private final ClientSessionRegistry registry;
    private final SseEventFactory sseEventFactory;
    private final ChannelRouter channelRouter;
    private final Counter tenantMismatchCounter;
    private final Counter sectorDedupeCounter;

    public SessionDeliveryRouter(ClientSessionRegistry registry,
                                 SseEventFactory sseEventFactory,
                                 ChannelRouter channelRouter,
                                 MeterRegistry meterRegistry) {
        this.registry = registry;
        this.sseEventFactory = sseEventFactory;
        this.channelRouter = channelRouter;
        this.tenantMismatchCounter = meterRegistry.counter("realtime.delivery.skipped", "reason", "tenant");
        this.sectorDedupeCounter = meterRegistry.counter("realtime.delivery.skipped", "reason", "sector_duplicate");
    }

    @Override
    public Mono<Integer> deliver(QueuedMessage message) {
        return Mono.fromCallable(() -> deliverNow(message));
    }

    int deliverNow(QueuedMessage message) {
        Event event = message.getEvent();
        String channel = message.getChannel();
        boolean dedupeSector = isBranchWaiterChannel(channel) && hasSectorCopy(event);
        ServerSentEvent<String> frame = sseEventFactory.createEventMessage(message);

        int reached = 0;
        for (ClientConnection connection : registry.connectionsFor(channel)) {
            ClientScope scope = connection.getScope();
            if (scope.getTenantId() != event.getTenantId()) {
                tenantMismatchCounter.increment();
                log.warn("[DELIVERY_TENANT_MISMATCH] {} of tenant {} not sent to connection {} of tenant {}",
                        event.getType(), event.getTenantId(), connection.getConnectionId(), scope.getTenantId());
                continue;
            }
            if (dedupeSector && scope.getSectorIds().contains(event.getSectorId())) {
                sectorDedupeCounter.increment();
                continue;
            }
            if (registry.emit(connection, frame)) {
                reached++;
            }
        }
        log.debug("[DELIVERY] {} on {} reached {} sessions", event.getType(), channel, reached);
        return reached;
    }

    private boolean hasSectorCopy(Event event) {
        return event.getSectorId() != null
                && channelRouter.resolve(event).contains(ChannelNames.sectorWaiters(event.getSectorId()));
    }

    private static boolean isBranchWaiterChannel(String channel) {
        return channel.startsWith("branch:") && channel.endsWith(":waiters");
    }
}
