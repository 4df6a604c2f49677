package com.example.realtime.shared.security;

import com.example.realtime.shared.exception.TransientStoreException;
import com.example.realtime.shared.redis.RedisConnectionPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Increment-and-expire as a server-side Lua script invoked by SHA. If the store has lost its
 * script cache (restart, SCRIPT FLUSH) the script is reloaded and the call repeated once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisScriptCounterStore implements AtomicCounterStore {

    static final String INCREMENT_WITH_EXPIRY_SCRIPT =
            "local count = redis.call('INCR', KEYS[1])\n" +
            "if count == 1 then\n" +
            "  redis.call('EXPIRE', KEYS[1], ARGV[1])\n" +
            "end\n" +
            "local ttl = redis.call('TTL', KEYS[1])\n" +
            "if ttl == -1 then\n" +
            "  redis.call('EXPIRE', KEYS[1], ARGV[1])\n" +
            "  ttl = tonumber(ARGV[1])\n" +
            "end\n" +
            "return {count, ttl}";

    private final RedisConnectionPoolManager poolManager;

    private volatile String scriptSha;

    @Override
    public CounterState incrementWithExpiry(String key, int windowSeconds) {
        String sha = scriptSha();
        try {
            return toState(evalSha(sha, key, windowSeconds));
        } catch (RuntimeException e) {
            if (!isNoScript(e)) {
                throw new TransientStoreException("Rate limit increment failed for key " + key, e);
            }
            log.warn("[RATE_LIMIT_SCRIPT_RELOAD] Script {} missing from store cache, reloading", sha);
            scriptSha = null;
            try {
                return toState(evalSha(scriptSha(), key, windowSeconds));
            } catch (RuntimeException retryFailure) {
                throw new TransientStoreException("Rate limit increment failed after script reload for key " + key, retryFailure);
            }
        }
    }

    @Override
    public void reset(String key) {
        poolManager.acquireBlocking().delete(key);
    }

    protected List<Object> evalSha(String sha, String key, int windowSeconds) {
        return poolManager.acquireBlocking().execute((RedisCallback<List<Object>>) connection ->
                connection.scriptingCommands().evalSha(sha, ReturnType.MULTI, 1,
                        key.getBytes(StandardCharsets.UTF_8),
                        String.valueOf(windowSeconds).getBytes(StandardCharsets.UTF_8)));
    }

    protected String loadScript() {
        return poolManager.acquireBlocking().execute((RedisCallback<String>) connection ->
                connection.scriptingCommands().scriptLoad(INCREMENT_WITH_EXPIRY_SCRIPT.getBytes(StandardCharsets.UTF_8)));
    }

    private String scriptSha() {
        String sha = scriptSha;
        if (sha == null) {
            sha = loadScript();
            scriptSha = sha;
            log.debug("[RATE_LIMIT_SCRIPT_LOAD] Loaded increment script as {}", sha);
        }
        return sha;
    }

    private static CounterState toState(List<Object> result) {
        if (result == null || result.size() < 2) {
            throw new TransientStoreException("Unexpected rate limit script result: " + result, null);
        }
        return new CounterState(((Number) result.get(0)).longValue(), ((Number) result.get(1)).longValue());
    }

    static boolean isNoScript(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains("NOSCRIPT")) {
                return true;
            }
        }
        return false;
    }
}
