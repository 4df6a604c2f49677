package com.example.realtime.shared.util;

import java.util.Set;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String STREAM_DATA_FIELD = "data";

    public static final class EventTypes {
        private EventTypes() {}

        public static final String ROUND_PENDING = "ROUND_PENDING";
        public static final String ROUND_CONFIRMED = "ROUND_CONFIRMED";
        public static final String ROUND_SUBMITTED = "ROUND_SUBMITTED";
        public static final String ROUND_IN_KITCHEN = "ROUND_IN_KITCHEN";
        public static final String ROUND_READY = "ROUND_READY";
        public static final String ROUND_SERVED = "ROUND_SERVED";
        public static final String ROUND_CANCELED = "ROUND_CANCELED";

        public static final String SERVICE_CALL_CREATED = "SERVICE_CALL_CREATED";
        public static final String SERVICE_CALL_ACKED = "SERVICE_CALL_ACKED";
        public static final String SERVICE_CALL_CLOSED = "SERVICE_CALL_CLOSED";

        public static final String CHECK_REQUESTED = "CHECK_REQUESTED";
        public static final String CHECK_PAID = "CHECK_PAID";
        public static final String PAYMENT_APPROVED = "PAYMENT_APPROVED";
        public static final String PAYMENT_REJECTED = "PAYMENT_REJECTED";
        public static final String PAYMENT_FAILED = "PAYMENT_FAILED";

        public static final String TABLE_SESSION_STARTED = "TABLE_SESSION_STARTED";
        public static final String TABLE_CLEARED = "TABLE_CLEARED";
        public static final String TABLE_STATUS_CHANGED = "TABLE_STATUS_CHANGED";

        public static final String TICKET_IN_PROGRESS = "TICKET_IN_PROGRESS";
        public static final String TICKET_READY = "TICKET_READY";
        public static final String TICKET_DELIVERED = "TICKET_DELIVERED";

        public static final String ENTITY_CREATED = "ENTITY_CREATED";
        public static final String ENTITY_UPDATED = "ENTITY_UPDATED";
        public static final String ENTITY_DELETED = "ENTITY_DELETED";
        public static final String CASCADE_DELETE = "CASCADE_DELETE";

        public static final Set<String> KITCHEN = Set.of(
                ROUND_SUBMITTED, ROUND_IN_KITCHEN, ROUND_READY, ROUND_SERVED,
                TICKET_IN_PROGRESS, TICKET_READY, TICKET_DELIVERED);

        public static final Set<String> SESSION = Set.of(
                ROUND_IN_KITCHEN, ROUND_READY, ROUND_SERVED, ROUND_CANCELED,
                SERVICE_CALL_ACKED, SERVICE_CALL_CLOSED,
                CHECK_REQUESTED, CHECK_PAID, PAYMENT_APPROVED, PAYMENT_REJECTED, PAYMENT_FAILED,
                TABLE_SESSION_STARTED, TABLE_CLEARED, TABLE_STATUS_CHANGED);

        public static final Set<String> ADMIN_ONLY = Set.of(
                ENTITY_CREATED, ENTITY_UPDATED, ENTITY_DELETED, CASCADE_DELETE);

        // Never narrowed to a sector: every waiter of the branch must see these.
        public static final Set<String> BRANCH_WIDE_WAITER = Set.of(
                ROUND_PENDING, TABLE_SESSION_STARTED);
    }

    public enum OutboxStatus {
        PENDING,
        PROCESSING,
        PUBLISHED,
        FAILED
    }

    public enum AggregateType {
        ROUND("round"),
        SERVICE_CALL("service_call"),
        CHECK("check");

        private final String value;

        AggregateType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public enum ClientRole {
        WAITER,
        KITCHEN,
        ADMIN,
        MANAGER,
        DINER
    }

    public enum CircuitState {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    public enum SseEventType {
        CONNECTED,
        EVENT,
        HEARTBEAT,
        SERVER_SHUTDOWN
    }
}
