package com.example.realtime.shared.security;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.redis.RedisConnectionPoolManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Revoked-token lookups. {@link #isTokenValid} is fail-closed: any store error yields "invalid".
 */
@Service
@Slf4j
public class TokenBlacklistService {

    private final RedisConnectionPoolManager poolManager;
    private final AppProperties.Blacklist settings;
    private final Clock clock;

    @Autowired
    public TokenBlacklistService(RedisConnectionPoolManager poolManager, AppProperties appProperties) {
        this(poolManager, appProperties, Clock.systemUTC());
    }

    TokenBlacklistService(RedisConnectionPoolManager poolManager, AppProperties appProperties, Clock clock) {
        this.poolManager = poolManager;
        this.settings = appProperties.getBlacklist();
        this.clock = clock;
    }

    /**
     * Blacklists a token until it would have expired anyway.
     * @return false if the token has already expired and nothing was written
     */
    public boolean blacklist(String tokenId, Instant expiresAt) {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        if (remaining.isZero() || remaining.isNegative()) {
            log.debug("Token {} already expired, not blacklisting", tokenId);
            return false;
        }
        long ttlSeconds = Math.max(1L, remaining.getSeconds());
        poolManager.acquireBlocking().opsForValue().set(blacklistKey(tokenId), "1", Duration.ofSeconds(ttlSeconds));
        log.info("[TOKEN_BLACKLISTED] Token {} blacklisted for {}s", tokenId, ttlSeconds);
        return true;
    }

    /**
     * Revokes every token issued to the user before now, for as long as a refresh token can live.
     */
    public void revokeAllForUser(long userId) {
        Instant now = clock.instant();
        poolManager.acquireBlocking().opsForValue().set(userRevokeKey(userId), now.toString(),
                Duration.ofSeconds(settings.getRefreshTokenTtlSeconds()));
        log.info("[TOKEN_REVOKE_ALL] All tokens of user {} issued before {} revoked", userId, now);
    }

    /**
     * Checks the token's own blacklist entry and the user's revoke-all timestamp in one pipelined
     * round trip.
     */
    public boolean isTokenValid(String tokenId, long userId, Instant issuedAt) {
        try {
            StringRedisTemplate template = poolManager.acquireBlocking();
            byte[] tokenKey = blacklistKey(tokenId).getBytes(StandardCharsets.UTF_8);
            byte[] revokeKey = userRevokeKey(userId).getBytes(StandardCharsets.UTF_8);
            List<Object> results = template.executePipelined((RedisCallback<Object>) connection -> {
                connection.keyCommands().exists(tokenKey);
                connection.stringCommands().get(revokeKey);
                return null;
            });

            if (Boolean.TRUE.equals(results.get(0))) {
                log.debug("Token {} is blacklisted", tokenId);
                return false;
            }
            Object revokedAt = results.get(1);
            if (revokedAt != null && issuedAt.isBefore(Instant.parse(revokedAt.toString()))) {
                log.debug("Token {} of user {} issued before revoke-all at {}", tokenId, userId, revokedAt);
                return false;
            }
            return true;
        } catch (Exception e) {
            log.error("[TOKEN_CHECK_FAILED] Blacklist lookup failed for token {}, treating as invalid: {}", tokenId, e.getMessage());
            return false;
        }
    }

    private String blacklistKey(String tokenId) {
        return settings.getKeyPrefix() + tokenId;
    }

    private String userRevokeKey(long userId) {
        return settings.getUserRevokeKeyPrefix() + userId;
    }
}
