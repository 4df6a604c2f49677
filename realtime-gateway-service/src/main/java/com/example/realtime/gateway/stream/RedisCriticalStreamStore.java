package com.example.realtime.gateway.stream;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.TransientStoreException;
import com.example.realtime.shared.redis.RedisConnectionPoolManager;
import com.example.realtime.shared.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis Streams implementation on the blocking pool. Reads block the calling thread, so this
 * store is only used from the stream worker thread and from bounded-elastic admin calls.
 */
@Component
@Slf4j
public class RedisCriticalStreamStore implements CriticalStreamStore {

    private static final String ORIGINAL_ID = "original_id";
    private static final String ORIGINAL_STREAM = "original_stream";
    private static final String RETRY_COUNT = "retry_count";
    private static final String FAILED_AT = "failed_at";
    private static final String CONSUMER = "consumer";

    private final RedisConnectionPoolManager poolManager;
    private final String streamKey;
    private final String group;
    private final String consumerName;
    private final String deadLetterKey;
    private final long deadLetterMaxLen;

    public RedisCriticalStreamStore(RedisConnectionPoolManager poolManager, AppProperties appProperties) {
        AppProperties.Stream settings = appProperties.getStream();
        this.poolManager = poolManager;
        this.streamKey = settings.getKey();
        this.group = settings.getGroup();
        this.consumerName = settings.getConsumer();
        this.deadLetterKey = settings.getDeadLetterKey();
        this.deadLetterMaxLen = settings.getDeadLetterMaxLen();
    }

    @Override
    public void ensureGroup() {
        try {
            ops().createGroup(streamKey, ReadOffset.latest(), group);
            log.info("[STREAM_GROUP] Created consumer group '{}' on {}", group, streamKey);
        } catch (DataAccessException e) {
            if (!messageChainContains(e, "BUSYGROUP")) {
                throw new TransientStoreException("Creating consumer group " + group + " on " + streamKey + " failed", e);
            }
            log.debug("[STREAM_GROUP] Consumer group '{}' already exists on {}", group, streamKey);
        }
    }

    @Override
    public List<StreamEntry> readNew(int count, Duration block) {
        List<MapRecord<String, Object, Object>> records = call("read", () -> ops().read(
                Consumer.from(group, consumerName),
                StreamReadOptions.empty().count(count).block(block),
                StreamOffset.create(streamKey, ReadOffset.lastConsumed())));
        return toEntries(records);
    }

    @Override
    public List<PendingEntry> pending(int count) {
        PendingMessages messages = call("pending", () -> ops().pending(streamKey, group, Range.unbounded(), count));
        List<PendingEntry> entries = new ArrayList<>();
        if (messages == null) {
            return entries;
        }
        for (PendingMessage message : messages) {
            entries.add(new PendingEntry(
                    message.getIdAsString(),
                    message.getConsumerName(),
                    message.getElapsedTimeSinceLastDelivery().toMillis(),
                    message.getTotalDeliveryCount()));
        }
        return entries;
    }

    @Override
    public List<StreamEntry> claim(Duration minIdle, List<String> ids) {
        RecordId[] recordIds = ids.stream().map(RecordId::of).toArray(RecordId[]::new);
        return toEntries(call("claim", () -> ops().claim(streamKey, group, consumerName, minIdle, recordIds)));
    }

    @Override
    public Optional<StreamEntry> findById(String id) {
        List<MapRecord<String, Object, Object>> records = call("range", () -> ops().range(streamKey, Range.closed(id, id)));
        return toEntries(records).stream().findFirst();
    }

    @Override
    public void ack(String id) {
        call("ack", () -> ops().acknowledge(streamKey, group, id));
    }

    @Override
    public String deadLetter(DeadLetterEntry entry) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(ORIGINAL_ID, entry.getOriginalId());
        fields.put(ORIGINAL_STREAM, entry.getOriginalStream());
        fields.put(Constants.STREAM_DATA_FIELD, entry.getData() != null ? entry.getData() : "");
        fields.put(RETRY_COUNT, String.valueOf(entry.getRetryCount()));
        fields.put(FAILED_AT, entry.getFailedAt().toString());
        fields.put(CONSUMER, entry.getConsumer());
        RecordId id = call("dead-letter", () -> ops().add(deadLetterKey, fields));
        call("trim", () -> ops().trim(deadLetterKey, deadLetterMaxLen, true));
        return id.getValue();
    }

    @Override
    public List<DeadLetterEntry> listDeadLetters(int limit) {
        List<MapRecord<String, Object, Object>> records = call("dead-letter range",
                () -> ops().reverseRange(deadLetterKey, Range.unbounded(), Limit.limit().count(limit)));
        List<DeadLetterEntry> entries = new ArrayList<>();
        if (records == null) {
            return entries;
        }
        for (MapRecord<String, Object, Object> record : records) {
            Map<Object, Object> value = record.getValue();
            entries.add(DeadLetterEntry.builder()
                    .id(record.getId().getValue())
                    .originalId(field(value, ORIGINAL_ID))
                    .originalStream(field(value, ORIGINAL_STREAM))
                    .data(field(value, Constants.STREAM_DATA_FIELD))
                    .retryCount(parseLong(field(value, RETRY_COUNT)))
                    .failedAt(parseInstant(field(value, FAILED_AT)))
                    .consumer(field(value, CONSUMER))
                    .build());
        }
        return entries;
    }

    private StreamOperations<String, Object, Object> ops() {
        return poolManager.acquireBlocking().opsForStream();
    }

    private <T> T call(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            throw new TransientStoreException("Stream " + operation + " on " + streamKey + " failed", e);
        }
    }

    private static List<StreamEntry> toEntries(List<MapRecord<String, Object, Object>> records) {
        List<StreamEntry> entries = new ArrayList<>();
        if (records == null) {
            return entries;
        }
        for (MapRecord<String, Object, Object> record : records) {
            entries.add(new StreamEntry(record.getId().getValue(), field(record.getValue(), Constants.STREAM_DATA_FIELD)));
        }
        return entries;
    }

    private static String field(Map<Object, Object> value, String name) {
        Object field = value.get(name);
        return field != null ? field.toString() : null;
    }

    private static long parseLong(String value) {
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("[STREAM_DLQ] Unreadable retry count '{}'", value);
            return 0L;
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("[STREAM_DLQ] Unreadable failure timestamp '{}'", value);
            return null;
        }
    }

    static boolean messageChainContains(Throwable error, String marker) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause.getMessage() != null && cause.getMessage().contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
