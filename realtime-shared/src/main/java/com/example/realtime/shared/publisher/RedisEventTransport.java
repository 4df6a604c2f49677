package com.example.realtime.shared.publisher;

import com.example.realtime.shared.redis.RedisConnectionPoolManager;
import com.example.realtime.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class RedisEventTransport implements EventTransport {

    private final RedisConnectionPoolManager poolManager;

    @Override
    public Mono<Long> publish(String channel, String payload) {
        return Mono.defer(() -> poolManager.acquireAsync().convertAndSend(channel, payload));
    }

    @Override
    public Mono<String> append(String streamKey, String payload) {
        return Mono.defer(() -> poolManager.acquireAsync()
                        .opsForStream()
                        .add(StreamRecords.newRecord()
                                .in(streamKey)
                                .ofMap(Map.of(Constants.STREAM_DATA_FIELD, payload))))
                .map(RecordId::getValue);
    }
}
