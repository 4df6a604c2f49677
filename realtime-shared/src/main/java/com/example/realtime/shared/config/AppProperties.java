package com.example.realtime.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
public class AppProperties {

    private final Redis redis = new Redis();
    private final Publisher publisher = new Publisher();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Subscriber subscriber = new Subscriber();
    private final DropRate dropRate = new DropRate();
    private final Reconnect reconnect = new Reconnect();
    private final Outbox outbox = new Outbox();
    private final Stream stream = new Stream();
    private final RateLimit rateLimit = new RateLimit();
    private final Blacklist blacklist = new Blacklist();
    private final SectorCache sectorCache = new SectorCache();
    private final Sse sse = new Sse();

    @Data
    public static class Redis {
        @NotBlank
        private String host = "localhost";
        @Positive
        private int port = 6379;
        private String password;
        @Positive
        private int asyncPoolSize = 50;
        @Positive
        private int blockingPoolSize = 20;
        @Positive
        private long socketTimeoutMs = 5000L;
        @Positive
        private long healthCheckIntervalMs = 30000L;
    }

    @Data
    public static class Publisher {
        @Positive
        private int maxRetries = 3;
        @Positive
        private long retryBaseDelayMs = 500L;
        @Positive
        private long retryMaxDelayMs = 10000L;
        @Positive
        private int maxEventBytes = 64 * 1024;
    }

    @Data
    public static class CircuitBreaker {
        @Positive
        private int failureThreshold = 5;
        @Positive
        private long recoveryTimeoutMs = 30000L;
        @Positive
        private int halfOpenMaxCalls = 3;
    }

    @Data
    public static class Subscriber {
        private List<String> patterns = new ArrayList<>(List.of(
                "branch:*:waiters",
                "branch:*:kitchen",
                "branch:*:admin",
                "sector:*:waiters",
                "session:*",
                "user:*",
                "tenant:*:admin"));
        @Positive
        private int queueCapacity = 500;
        @Positive
        private int batchSize = 50;
        @Positive
        private long dispatchIntervalMs = 10L;
        @Positive
        private long deliveryTimeoutMs = 5000L;
        private int maxDeliveryRetries = 2;
        @Positive
        private long stalenessWarningMs = 5000L;
        private boolean strictOrdering = false;
    }

    @Data
    public static class DropRate {
        @Positive
        private long windowMs = 60000L;
        @Positive
        private double alertThresholdPercent = 5.0;
        @Positive
        private long alertCooldownMs = 300000L;
    }

    @Data
    public static class Reconnect {
        @Positive
        private long cleanupTimeoutMs = 5000L;
        @Positive
        private long attemptTimeoutMs = 15000L;
        @Positive
        private int fatalAfterAttempts = 20;
        @Positive
        private long baseDelayMs = 500L;
        @Positive
        private long maxDelayMs = 10000L;
    }

    @Data
    public static class Outbox {
        @Positive
        private long pollIntervalMs = 1000L;
        @Positive
        private int batchSize = 50;
        @Positive
        private int maxRetries = 5;
        @Positive
        private long staleClaimTimeoutMs = 300000L;
    }

    @Data
    public static class Stream {
        @NotBlank
        private String key = "events:critical";
        @NotBlank
        private String group = "ws_gateway";
        @NotBlank
        private String consumer = "gateway-primary";
        @NotBlank
        private String deadLetterKey = "events:dlq";
        @Positive
        private long deadLetterMaxLen = 1000L;
        @Positive
        private int readCount = 10;
        @Positive
        private long blockMs = 2000L;
        @Positive
        private int reclaimEveryCycles = 30;
        @Positive
        private long reclaimMinIdleMs = 30000L;
        @Positive
        private int maxDeliveries = 3;
        @Positive
        private long errorBackoffBaseMs = 1000L;
        @Positive
        private long errorBackoffMaxMs = 30000L;
        private List<String> criticalTypes = new ArrayList<>(List.of(
                "ROUND_SUBMITTED",
                "PAYMENT_APPROVED",
                "PAYMENT_REJECTED",
                "CHECK_PAID"));
    }

    @Data
    public static class RateLimit {
        @NotBlank
        private String keyPrefix = "ratelimit:login:";
        @Positive
        private int windowSeconds = 60;
        @Positive
        private int maxAttempts = 5;
    }

    @Data
    public static class Blacklist {
        @NotBlank
        private String keyPrefix = "auth:token:blacklist:";
        @NotBlank
        private String userRevokeKeyPrefix = "auth:user:revoked:";
        @Positive
        private long refreshTokenTtlSeconds = 7 * 24 * 3600L;
    }

    @Data
    public static class SectorCache {
        @Positive
        private long ttlMs = 60000L;
        @Positive
        private long maxEntries = 1000L;
    }

    @Data
    public static class Sse {
        @Positive
        private long heartbeatIntervalMs = 30000L;
    }
}
