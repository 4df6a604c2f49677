package com.example.realtime.shared.model;

import com.example.realtime.shared.exception.EventValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The unit of distribution. Instances are always valid: the constructor rejects missing
 * mandatory fields, negative scope ids and non-positive optional ids.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Event {

    public static final int SCHEMA_VERSION = 1;

    private final String type;
    private final long tenantId;
    private final long branchId;
    private final Long tableId;
    private final Long sessionId;
    private final Long sectorId;
    private final Map<String, Object> entity;
    private final EventActor actor;
    private final String ts;
    private final int v;

    @Builder(toBuilder = true)
    @JsonCreator
    public Event(@JsonProperty("type") String type,
                 @JsonProperty("tenant_id") Long tenantId,
                 @JsonProperty("branch_id") Long branchId,
                 @JsonProperty("table_id") Long tableId,
                 @JsonProperty("session_id") Long sessionId,
                 @JsonProperty("sector_id") Long sectorId,
                 @JsonProperty("entity") Map<String, Object> entity,
                 @JsonProperty("actor") EventActor actor,
                 @JsonProperty("ts") String ts,
                 @JsonProperty("v") Integer v) {
        if (type == null || type.isBlank()) {
            throw new EventValidationException("Event 'type' is required");
        }
        if (tenantId == null || tenantId <= 0) {
            throw new EventValidationException("Event 'tenant_id' must be a positive integer, got " + tenantId);
        }
        if (branchId == null || branchId < 0) {
            throw new EventValidationException("Event 'branch_id' must be zero or positive, got " + branchId);
        }
        requirePositiveIfPresent("table_id", tableId);
        requirePositiveIfPresent("session_id", sessionId);
        requirePositiveIfPresent("sector_id", sectorId);
        if (actor != null && actor.getUserId() != null && actor.getUserId() <= 0) {
            throw new EventValidationException("Event 'actor.user_id' must be positive, got " + actor.getUserId());
        }
        if (v != null && v <= 0) {
            throw new EventValidationException("Event 'v' must be positive, got " + v);
        }

        this.type = type;
        this.tenantId = tenantId;
        this.branchId = branchId;
        this.tableId = tableId;
        this.sessionId = sessionId;
        this.sectorId = sectorId;
        this.entity = entity == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(entity));
        this.actor = actor;
        this.ts = ts == null ? Instant.now().toString() : requireIsoTimestamp(ts);
        this.v = v == null ? SCHEMA_VERSION : v;
    }

    /**
     * Branch id 0 scopes the event to the whole tenant.
     */
    @JsonIgnore
    public boolean isTenantWide() {
        return branchId == 0;
    }

    private static void requirePositiveIfPresent(String field, Long value) {
        if (value != null && value <= 0) {
            throw new EventValidationException("Event '" + field + "' must be positive when present, got " + value);
        }
    }

    private static String requireIsoTimestamp(String ts) {
        try {
            DateTimeFormatter.ISO_DATE_TIME.parse(ts);
            return ts;
        } catch (DateTimeParseException e) {
            throw new EventValidationException("Event 'ts' is not an ISO-8601 timestamp: " + ts, e);
        }
    }
}
