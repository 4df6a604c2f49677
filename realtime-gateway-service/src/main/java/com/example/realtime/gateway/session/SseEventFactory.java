package com.example.realtime.gateway.session;

import com.example.realtime.gateway.subscriber.QueuedMessage;
import com.example.realtime.shared.util.Constants.SseEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SseEventFactory {

    private final ObjectMapper objectMapper;

    /**
     * Builds an SSE frame around a JSON-serialized object.
     * @return the frame, or {@code null} if the data cannot be serialized
     */
    public ServerSentEvent<String> createEvent(SseEventType eventType, String eventId, Object data) {
        try {
            String payload = objectMapper.writeValueAsString(data);
            return ServerSentEvent.<String>builder()
                .event(eventType.name())
                .id(eventId)
                .data(payload)
                .build();
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for SSE event type {}: {}", eventType, e.getMessage());
            return null;
        }
    }

    /**
     * Wraps an already-encoded event. The wire payload is forwarded untouched.
     */
    public ServerSentEvent<String> createEventMessage(QueuedMessage message) {
        return ServerSentEvent.<String>builder()
            .event(SseEventType.EVENT.name())
            .data(message.getPayload())
            .build();
    }

    public ServerSentEvent<String> createHeartbeatEvent() {
        Map<String, String> data = Map.of("timestamp", OffsetDateTime.now().toString());
        return createEvent(SseEventType.HEARTBEAT, null, data);
    }

    public ServerSentEvent<String> createConnectedEvent(String connectionId, Iterable<String> channels) {
        Map<String, Object> data = Map.of(
            "message", "SSE connection established",
            "connectionId", connectionId,
            "channels", channels,
            "timestamp", OffsetDateTime.now().toString()
        );
        return createEvent(SseEventType.CONNECTED, connectionId, data);
    }

    public ServerSentEvent<String> createShutdownEvent() {
        return ServerSentEvent.<String>builder()
               .event(SseEventType.SERVER_SHUTDOWN.name())
               .data("Server is shutting down. Please reconnect momentarily.")
               .build();
    }
}
