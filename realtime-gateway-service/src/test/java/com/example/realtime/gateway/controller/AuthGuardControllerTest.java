package com.example.realtime.gateway.controller;

import com.example.realtime.gateway.dto.LoginAttemptRequest;
import com.example.realtime.gateway.dto.TokenRevokeRequest;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.RateLimitExceededException;
import com.example.realtime.shared.exception.TransientStoreException;
import com.example.realtime.shared.security.AtomicCounterStore;
import com.example.realtime.shared.security.CounterState;
import com.example.realtime.shared.security.LoginAttemptLimiter;
import com.example.realtime.shared.security.TokenBlacklistService;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuthGuardControllerTest {

    private final AppProperties properties = new AppProperties();
    private final List<String> storeThreads = new CopyOnWriteArrayList<>();

    private final AtomicCounterStore counterStore = new AtomicCounterStore() {
        private long count;

        @Override
        public synchronized CounterState incrementWithExpiry(String key, int windowSeconds) {
            storeThreads.add(Thread.currentThread().getName());
            count++;
            return new CounterState(count, windowSeconds);
        }

        @Override
        public synchronized void reset(String key) {
            storeThreads.add(Thread.currentThread().getName());
            count = 0;
        }
    };

    private final TokenBlacklistService blacklist = new TokenBlacklistService(null, properties) {
        @Override
        public boolean blacklist(String tokenId, Instant expiresAt) {
            storeThreads.add(Thread.currentThread().getName());
            return true;
        }

        @Override
        public void revokeAllForUser(long userId) {
            storeThreads.add(Thread.currentThread().getName());
        }

        @Override
        public boolean isTokenValid(String tokenId, long userId, Instant issuedAt) {
            storeThreads.add(Thread.currentThread().getName());
            return !"revoked".equals(tokenId);
        }
    };

    private AuthGuardController controller(AtomicCounterStore store) {
        return new AuthGuardController(new LoginAttemptLimiter(store, properties), blacklist);
    }

    @Test
    void storeCallsRunOffTheCallingThread() {
        AuthGuardController controller = controller(counterStore);

        StepVerifier.create(controller.recordLoginAttempt(new LoginAttemptRequest("guest@example.com")))
                .assertNext(response -> assertEquals(1L, response.getBody().getCount()))
                .verifyComplete();
        StepVerifier.create(controller.resetLoginAttempts("guest@example.com"))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(controller.revokeToken(new TokenRevokeRequest("t-1", Instant.now().plusSeconds(60))))
                .assertNext(response -> assertEquals(true, response.getBody().get("blacklisted")))
                .verifyComplete();
        StepVerifier.create(controller.revokeAllForUser(7L))
                .assertNext(response -> assertEquals(HttpStatus.ACCEPTED, response.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(controller.isTokenValid("revoked", 7L, 1_700_000_000L))
                .assertNext(response -> assertEquals(false, response.getBody().get("valid")))
                .verifyComplete();

        assertEquals(5, storeThreads.size());
        for (String thread : storeThreads) {
            assertTrue(thread.startsWith("boundedElastic"), thread);
        }
    }

    @Test
    void handlersDoNothingUntilSubscribed() {
        AuthGuardController controller = controller(counterStore);

        controller.recordLoginAttempt(new LoginAttemptRequest("guest@example.com"));
        controller.isTokenValid("t-1", 7L, 1_700_000_000L);

        assertTrue(storeThreads.isEmpty());
    }

    @Test
    void limiterErrorsArriveAsErrorSignals() {
        AuthGuardController controller = controller(counterStore);
        for (int i = 0; i < properties.getRateLimit().getMaxAttempts(); i++) {
            StepVerifier.create(controller.recordLoginAttempt(new LoginAttemptRequest("guest@example.com")))
                    .expectNextCount(1)
                    .verifyComplete();
        }

        StepVerifier.create(controller.recordLoginAttempt(new LoginAttemptRequest("guest@example.com")))
                .expectError(RateLimitExceededException.class)
                .verify();
    }

    @Test
    void storeOutageArrivesAsErrorSignal() {
        AtomicCounterStore down = new AtomicCounterStore() {
            @Override
            public CounterState incrementWithExpiry(String key, int windowSeconds) {
                throw new TransientStoreException("store unreachable", null);
            }

            @Override
            public void reset(String key) {
                throw new TransientStoreException("store unreachable", null);
            }
        };

        StepVerifier.create(controller(down).recordLoginAttempt(new LoginAttemptRequest("guest@example.com")))
                .expectError(TransientStoreException.class)
                .verify();
    }
}
