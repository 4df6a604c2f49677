package com.example.realtime.shared.security;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.RateLimitExceededException;
import com.example.realtime.shared.exception.TransientStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Fixed-window throttle for login attempts keyed by identity (normally an email address).
 * If the store is unreachable the attempt is refused: the store error propagates to the caller.
 */
@Service
@Slf4j
public class LoginAttemptLimiter {

    private final AtomicCounterStore counterStore;
    private final String keyPrefix;
    private final int windowSeconds;
    private final int maxAttempts;

    public LoginAttemptLimiter(AtomicCounterStore counterStore, AppProperties appProperties) {
        this.counterStore = counterStore;
        this.keyPrefix = appProperties.getRateLimit().getKeyPrefix();
        this.windowSeconds = appProperties.getRateLimit().getWindowSeconds();
        this.maxAttempts = appProperties.getRateLimit().getMaxAttempts();
    }

    /**
     * Records one attempt.
     * @return the counter after this attempt
     * @throws RateLimitExceededException if the attempt is over the limit; carries the seconds
     *         until the window resets
     * @throws TransientStoreException if the counter could not be read; the attempt is not allowed
     */
    public CounterState recordAttempt(String identity) {
        String key = keyFor(identity);
        CounterState state;
        try {
            state = counterStore.incrementWithExpiry(key, windowSeconds);
        } catch (TransientStoreException e) {
            log.error("[RATE_LIMIT_UNAVAILABLE] Could not check rate limit for {}, refusing attempt: {}", identity, e.getMessage());
            throw e;
        }
        if (state.getCount() > maxAttempts) {
            long retryAfter = state.getTtlSeconds() > 0 ? state.getTtlSeconds() : windowSeconds;
            log.warn("[RATE_LIMIT_EXCEEDED] {} made {} attempts in {}s window, retry after {}s",
                    identity, state.getCount(), windowSeconds, retryAfter);
            throw new RateLimitExceededException(identity, retryAfter);
        }
        return state;
    }

    public void reset(String identity) {
        counterStore.reset(keyFor(identity));
    }

    String keyFor(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Rate limit identity must not be blank");
        }
        return keyPrefix + identity.trim().toLowerCase(Locale.ROOT);
    }
}
