package com.example.realtime.shared.redis;

import com.example.realtime.shared.config.AppProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulConnection;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the two Redis connection pools: a large non-blocking one for reactive call sites and a
 * small one for call sites that must block. Each pool is created lazily on first acquire under
 * a double-checked lock; the pools never share a lock.
 */
@Slf4j
@Component
public class RedisConnectionPoolManager {

    static final String ASYNC_POOL_NAME = "realtime-async";
    static final String BLOCKING_POOL_NAME = "realtime-blocking";

    private final AppProperties.Redis settings;

    private final ReentrantLock asyncLock = new ReentrantLock();
    private final Object blockingMonitor = new Object();

    private volatile AsyncPool asyncPool;
    private volatile BlockingPool blockingPool;

    public RedisConnectionPoolManager(AppProperties appProperties) {
        this.settings = appProperties.getRedis();
    }

    public ReactiveStringRedisTemplate acquireAsync() {
        return asyncPool().template;
    }

    /**
     * The non-blocking pool's connection factory, for components such as listener containers
     * that manage their own connections.
     */
    public ReactiveRedisConnectionFactory asyncConnectionFactory() {
        return asyncPool().connectionFactory;
    }

    public StringRedisTemplate acquireBlocking() {
        BlockingPool pool = blockingPool;
        if (pool == null) {
            synchronized (blockingMonitor) {
                pool = blockingPool;
                if (pool == null) {
                    LettuceConnectionFactory factory = createConnectionFactory(BLOCKING_POOL_NAME, settings.getBlockingPoolSize());
                    StringRedisTemplate template = new StringRedisTemplate(factory);
                    pool = new BlockingPool(factory, template);
                    blockingPool = pool;
                    log.info("[POOL_INIT] Blocking Redis pool created: max {} connections to {}:{}",
                            settings.getBlockingPoolSize(), settings.getHost(), settings.getPort());
                }
            }
        }
        return pool.template;
    }

    public boolean isAsyncInitialized() {
        return asyncPool != null;
    }

    public boolean isBlockingInitialized() {
        return blockingPool != null;
    }

    /**
     * Closes both pools and returns the manager to its uninitialized state. Safe to call repeatedly.
     */
    @PreDestroy
    public void shutdown() {
        asyncLock.lock();
        try {
            AsyncPool pool = asyncPool;
            asyncPool = null;
            if (pool != null) {
                close(ASYNC_POOL_NAME, pool.connectionFactory);
            }
        } finally {
            asyncLock.unlock();
        }

        synchronized (blockingMonitor) {
            BlockingPool pool = blockingPool;
            blockingPool = null;
            if (pool != null) {
                close(BLOCKING_POOL_NAME, pool.connectionFactory);
            }
        }
    }

    /**
     * Builds and starts a pooled Lettuce factory. Connections are opened on demand; idle ones are
     * probed every health-check interval and evicted when dead.
     */
    protected LettuceConnectionFactory createConnectionFactory(String poolName, int maxConnections) {
        GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxConnections);
        poolConfig.setMaxIdle(maxConnections);
        poolConfig.setMinIdle(0);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setTimeBetweenEvictionRuns(Duration.ofMillis(settings.getHealthCheckIntervalMs()));

        Duration timeout = Duration.ofMillis(settings.getSocketTimeoutMs());
        LettuceClientConfiguration clientConfiguration = LettucePoolingClientConfiguration.builder()
                .poolConfig(poolConfig)
                .commandTimeout(timeout)
                .clientName(poolName)
                .clientOptions(ClientOptions.builder()
                        .autoReconnect(true)
                        .socketOptions(SocketOptions.builder()
                                .connectTimeout(timeout)
                                .keepAlive(true)
                                .build())
                        .build())
                .build();

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(settings.getHost(), settings.getPort());
        if (StringUtils.hasText(settings.getPassword())) {
            standalone.setPassword(RedisPassword.of(settings.getPassword()));
        }

        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, clientConfiguration);
        factory.setShareNativeConnection(false);
        factory.afterPropertiesSet();
        return factory;
    }

    private AsyncPool asyncPool() {
        AsyncPool pool = asyncPool;
        if (pool == null) {
            asyncLock.lock();
            try {
                pool = asyncPool;
                if (pool == null) {
                    LettuceConnectionFactory factory = createConnectionFactory(ASYNC_POOL_NAME, settings.getAsyncPoolSize());
                    pool = new AsyncPool(factory, new ReactiveStringRedisTemplate(factory));
                    asyncPool = pool;
                    log.info("[POOL_INIT] Async Redis pool created: max {} connections to {}:{}",
                            settings.getAsyncPoolSize(), settings.getHost(), settings.getPort());
                }
            } finally {
                asyncLock.unlock();
            }
        }
        return pool;
    }

    private void close(String poolName, LettuceConnectionFactory factory) {
        try {
            factory.destroy();
            log.info("[POOL_CLOSE] Redis pool '{}' closed", poolName);
        } catch (RuntimeException e) {
            log.warn("[POOL_CLOSE] Error closing Redis pool '{}': {}", poolName, e.getMessage());
        }
    }

    private static final class AsyncPool {
        private final LettuceConnectionFactory connectionFactory;
        private final ReactiveStringRedisTemplate template;

        private AsyncPool(LettuceConnectionFactory connectionFactory, ReactiveStringRedisTemplate template) {
            this.connectionFactory = connectionFactory;
            this.template = template;
        }
    }

    private static final class BlockingPool {
        private final LettuceConnectionFactory connectionFactory;
        private final StringRedisTemplate template;

        private BlockingPool(LettuceConnectionFactory connectionFactory, StringRedisTemplate template) {
            this.connectionFactory = connectionFactory;
            this.template = template;
        }
    }
}
