package com.example.realtime.gateway.session;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.config.MonitoringConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live SSE connections on this gateway, indexed by the channels they listen to. The index is the
 * inverse of channel routing: given a channel, it answers which connections should see it.
 */
@Service
@Slf4j
public class ClientSessionRegistry {

    private static final int MAX_FAILED_EMITS = 3;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> channelIndex = new ConcurrentHashMap<>();
    private final Map<String, Integer> failedEmitCounts = new ConcurrentHashMap<>();
    private final ReentrantLock indexLock = new ReentrantLock();

    private final SseEventFactory sseEventFactory;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;
    private final Duration heartbeatInterval;

    private Disposable heartbeatSubscription;

    public ClientSessionRegistry(SseEventFactory sseEventFactory,
                                 MonitoringConfig.RealtimeMetricsCollector metricsCollector,
                                 AppProperties appProperties) {
        this.sseEventFactory = sseEventFactory;
        this.metricsCollector = metricsCollector;
        this.heartbeatInterval = Duration.ofMillis(appProperties.getSse().getHeartbeatIntervalMs());
    }

    @PostConstruct
    public void init() {
        heartbeatSubscription = Flux.interval(heartbeatInterval, Schedulers.parallel())
            .doOnNext(tick -> sendHeartbeats())
            .subscribe();
    }

    @PreDestroy
    public void cleanup() {
        log.info("Commencing ClientSessionRegistry graceful shutdown...");
        if (!connections.isEmpty()) {
            log.info("Sending graceful shutdown notice to {} connected clients...", connections.size());
            ServerSentEvent<String> shutdownEvent = sseEventFactory.createShutdownEvent();
            connections.values().forEach(connection -> connection.emit(shutdownEvent));
        }
        if (heartbeatSubscription != null && !heartbeatSubscription.isDisposed()) {
            heartbeatSubscription.dispose();
        }
        new ArrayList<>(connections.keySet()).forEach(this::remove);
        log.info("ClientSessionRegistry cleanup complete.");
    }

    /**
     * Opens an SSE stream for a client and indexes it under every channel of its scope.
     */
    public Flux<ServerSentEvent<String>> register(String connectionId, ClientScope scope) {
        Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().multicast().onBackpressureBuffer();
        ClientConnection connection = new ClientConnection(connectionId, scope, sink);
        Set<String> channels = scope.channels();

        indexLock.lock();
        try {
            ClientConnection previous = connections.put(connectionId, connection);
            if (previous != null) {
                unindex(connectionId, previous.getScope().channels());
                previous.complete();
            }
            index(connectionId, channels);
        } finally {
            indexLock.unlock();
        }

        ServerSentEvent<String> connectedEvent = sseEventFactory.createConnectedEvent(connectionId, channels);
        if (connectedEvent != null) {
            connection.emit(connectedEvent);
        }
        log.info("[SSE_CONNECT] Connection {} registered for user {} (tenant {}, role {}) on {}",
                connectionId, scope.getUserId(), scope.getTenantId(), scope.getRole(), channels);

        return sink.asFlux()
                .doOnCancel(() -> remove(connectionId))
                .doOnTerminate(() -> remove(connectionId));
    }

    public void remove(String connectionId) {
        ClientConnection connection;
        indexLock.lock();
        try {
            connection = connections.remove(connectionId);
            if (connection == null) {
                return;
            }
            unindex(connectionId, connection.getScope().channels());
        } finally {
            indexLock.unlock();
        }
        failedEmitCounts.remove(connectionId);
        connection.complete();
        log.info("Cleanly disconnected connection {} for user {}", connectionId, connection.getScope().getUserId());
    }

    /**
     * Connections listening to {@code channel}.
     */
    public List<ClientConnection> connectionsFor(String channel) {
        Set<String> ids = channelIndex.get(channel);
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        List<ClientConnection> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            ClientConnection connection = connections.get(id);
            if (connection != null) {
                result.add(connection);
            }
        }
        return result;
    }

    /**
     * Re-indexes every connection of a user after their sector assignment changed.
     * @return the number of connections updated
     */
    public int updateSectors(long userId, long tenantId, Collection<Long> sectorIds) {
        int updated = 0;
        indexLock.lock();
        try {
            for (ClientConnection connection : connections.values()) {
                ClientScope scope = connection.getScope();
                if (scope.getUserId() != userId || scope.getTenantId() != tenantId) {
                    continue;
                }
                ClientScope refreshed = scope.toBuilder().clearSectorIds().sectorIds(sectorIds).build();
                unindex(connection.getConnectionId(), scope.channels());
                connection.setScope(refreshed);
                index(connection.getConnectionId(), refreshed.channels());
                updated++;
            }
        } finally {
            indexLock.unlock();
        }
        if (updated > 0) {
            log.info("[SSE_SECTORS] Sectors of user {} (tenant {}) now {} on {} connections", userId, tenantId, sectorIds, updated);
        }
        return updated;
    }

    /**
     * Emits one frame. Three consecutive failed emits on a connection close it.
     * @return {@code true} if the frame was accepted
     */
    public boolean emit(ClientConnection connection, ServerSentEvent<String> event) {
        Sinks.EmitResult result = connection.emit(event);
        String connectionId = connection.getConnectionId();
        if (result.isSuccess()) {
            failedEmitCounts.remove(connectionId);
            return true;
        }
        int failCount = failedEmitCounts.merge(connectionId, 1, Integer::sum);
        log.warn("Failed to emit SSE event for user {}, connection {}. Result: {}. Fail count: {}",
                connection.getScope().getUserId(), connectionId, result, failCount);
        if (failCount >= MAX_FAILED_EMITS) {
            log.warn("Connection {} has failed {} consecutive emits. Proactively cleaning up stale connection.",
                    connectionId, failCount);
            Schedulers.boundedElastic().schedule(() -> remove(connectionId));
        }
        return false;
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("connections", connections.size());
        stats.put("channels", channelIndex.size());
        stats.put("connectionsWithFailedEmits", failedEmitCounts.size());
        return stats;
    }

    void sendHeartbeats() {
        metricsCollector.setGauge("realtime.sse.connections", connections.size());
        if (connections.isEmpty()) {
            return;
        }
        ServerSentEvent<String> heartbeatEvent = sseEventFactory.createHeartbeatEvent();
        if (heartbeatEvent == null) {
            return;
        }
        for (ClientConnection connection : new ArrayList<>(connections.values())) {
            emit(connection, heartbeatEvent);
        }
    }

    private void index(String connectionId, Set<String> channels) {
        for (String channel : channels) {
            channelIndex.computeIfAbsent(channel, key -> ConcurrentHashMap.newKeySet()).add(connectionId);
        }
    }

    private void unindex(String connectionId, Set<String> channels) {
        for (String channel : channels) {
            channelIndex.computeIfPresent(channel, (key, ids) -> {
                ids.remove(connectionId);
                return ids.isEmpty() ? null : ids;
            });
        }
    }
}
