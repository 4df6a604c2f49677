package com.example.realtime.gateway.subscriber;

import com.example.realtime.shared.redis.RedisConnectionPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.ReactiveRedisMessageListenerContainer;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Pattern subscription over a listener container built on the async pool. Each
 * {@link #subscribe} opens a fresh container so a broken connection is never reused.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisPubSubSource implements PubSubSource {

    private final RedisConnectionPoolManager poolManager;

    private volatile ReactiveRedisMessageListenerContainer container;

    @Override
    public Mono<Flux<InboundMessage>> subscribe(List<String> patterns) {
        return Mono.defer(() -> {
            ReactiveRedisMessageListenerContainer listenerContainer =
                    new ReactiveRedisMessageListenerContainer(poolManager.asyncConnectionFactory());
            container = listenerContainer;
            PatternTopic[] topics = patterns.stream().map(PatternTopic::new).toArray(PatternTopic[]::new);
            log.debug("[SUB_PSUBSCRIBE] Subscribing to {}", patterns);
            return listenerContainer.receiveLater(topics)
                    .map(messages -> messages.map(message ->
                            new InboundMessage(message.getChannel(), message.getPattern(), message.getMessage())));
        });
    }

    @Override
    public Mono<Void> close() {
        return Mono.defer(() -> {
            ReactiveRedisMessageListenerContainer current = container;
            container = null;
            if (current == null) {
                return Mono.empty();
            }
            return current.destroyLater();
        });
    }
}
