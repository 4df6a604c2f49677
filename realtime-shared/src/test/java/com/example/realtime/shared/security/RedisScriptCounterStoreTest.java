package com.example.realtime.shared.security;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.TransientStoreException;
import com.example.realtime.shared.redis.RedisConnectionPoolManager;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisSystemException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RedisScriptCounterStoreTest {

    /**
     * Simulates a store that forgot its script cache once: the first EVALSHA answers NOSCRIPT.
     */
    private static class FlushedCacheStore extends RedisScriptCounterStore {
        final AtomicInteger loads = new AtomicInteger();
        final List<String> evaluatedShas = new CopyOnWriteArrayList<>();
        private final RuntimeException firstFailure;

        FlushedCacheStore(RuntimeException firstFailure) {
            super(new RedisConnectionPoolManager(new AppProperties()));
            this.firstFailure = firstFailure;
        }

        @Override
        protected List<Object> evalSha(String sha, String key, int windowSeconds) {
            evaluatedShas.add(sha);
            if (evaluatedShas.size() == 1) {
                throw firstFailure;
            }
            return List.of(1L, (long) windowSeconds);
        }

        @Override
        protected String loadScript() {
            return "sha-" + loads.incrementAndGet();
        }
    }

    @Test
    void reloadsScriptWhenStoreReportsNoScript() {
        FlushedCacheStore store = new FlushedCacheStore(new RedisSystemException("Error in execution",
                new RuntimeException("NOSCRIPT No matching script. Please use EVAL.")));

        CounterState state = store.incrementWithExpiry("ratelimit:login:a@b.c", 60);

        assertEquals(1, state.getCount());
        assertEquals(60, state.getTtlSeconds());
        assertEquals(2, store.loads.get());
        assertEquals(List.of("sha-1", "sha-2"), store.evaluatedShas);
    }

    @Test
    void otherFailuresAreTransientAndNotReloaded() {
        FlushedCacheStore store = new FlushedCacheStore(new RedisSystemException("Connection reset", new RuntimeException("reset")));

        assertThrows(TransientStoreException.class, () -> store.incrementWithExpiry("k", 60));
        assertEquals(1, store.loads.get());
    }

    @Test
    void detectsNoScriptAnywhereInCauseChain() {
        assertTrue(RedisScriptCounterStore.isNoScript(new RuntimeException("wrapper", new IllegalStateException("NOSCRIPT gone"))));
        assertFalse(RedisScriptCounterStore.isNoScript(new RuntimeException("ERR wrong number of arguments")));
    }

    @Test
    void scriptSetsExpiryOnFirstIncrementAndHealsMissingTtl() {
        String script = RedisScriptCounterStore.INCREMENT_WITH_EXPIRY_SCRIPT;

        assertTrue(script.contains("redis.call('INCR', KEYS[1])"));
        assertTrue(script.contains("if count == 1 then"));
        assertTrue(script.contains("if ttl == -1 then"));
    }
}
