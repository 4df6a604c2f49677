package com.example.realtime.shared.util;

import com.example.realtime.shared.exception.EventValidationException;
import com.example.realtime.shared.model.Event;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Compact JSON wire form of {@link Event}. Decoding is strict about JSON types: ids must be
 * integral numbers and text fields must be strings.
 */
@Component
public class EventCodec {

    private final ObjectMapper objectMapper;
    private final ObjectMapper strictReader;

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = strictCopy(objectMapper);
    }

    public String encode(Event event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventValidationException("Event of type " + event.getType() + " is not serializable", e);
        }
    }

    /**
     * Parses and validates a wire payload. Malformed JSON and schema violations both surface as
     * {@link EventValidationException}.
     */
    public Event decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new EventValidationException("Empty event payload");
        }
        try {
            return strictReader.readValue(payload, Event.class);
        } catch (JsonMappingException e) {
            // The constructor's own validation failure arrives wrapped.
            if (e.getCause() instanceof EventValidationException validation) {
                throw validation;
            }
            throw new EventValidationException("Event payload does not match the schema: " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new EventValidationException("Event payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static ObjectMapper strictCopy(ObjectMapper objectMapper) {
        ObjectMapper strict = objectMapper.copy();
        strict.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        strict.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        strict.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return strict;
    }

    public static int utf8Size(String payload) {
        return payload.getBytes(StandardCharsets.UTF_8).length;
    }
}
