package com.example.realtime.gateway.stream;

import com.example.realtime.shared.exception.TransientStoreException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One consumer group over an in-memory stream. Idle times are set by the test.
 */
class InMemoryCriticalStreamStore implements CriticalStreamStore {

    static final String CONSUMER = "gateway-test";

    final Map<String, String> entries = new LinkedHashMap<>();
    final Map<String, PendingEntry> pending = new LinkedHashMap<>();
    final List<String> acked = new ArrayList<>();
    final List<DeadLetterEntry> deadLetters = new ArrayList<>();
    int ensureGroupCalls;
    boolean groupExists = true;
    boolean failDeadLetterWrites;
    private int delivered;
    private long sequence;

    String add(String payload) {
        String id = "1700000000000-" + sequence++;
        entries.put(id, payload);
        return id;
    }

    void setIdle(String id, long idleMs) {
        PendingEntry entry = pending.get(id);
        pending.put(id, new PendingEntry(id, entry.consumer(), idleMs, entry.deliveryCount()));
    }

    void setDeliveryCount(String id, long deliveryCount) {
        PendingEntry entry = pending.get(id);
        pending.put(id, new PendingEntry(id, entry.consumer(), entry.idleMs(), deliveryCount));
    }

    @Override
    public void ensureGroup() {
        ensureGroupCalls++;
        groupExists = true;
    }

    @Override
    public List<StreamEntry> readNew(int count, Duration block) {
        if (!groupExists) {
            throw new TransientStoreException("Stream read failed",
                    new IllegalStateException("NOGROUP No such key 'events:critical' or consumer group 'ws_gateway'"));
        }
        List<StreamEntry> result = new ArrayList<>();
        List<String> ids = new ArrayList<>(entries.keySet());
        while (delivered < ids.size() && result.size() < count) {
            String id = ids.get(delivered++);
            pending.put(id, new PendingEntry(id, CONSUMER, 0, 1));
            result.add(new StreamEntry(id, entries.get(id)));
        }
        return result;
    }

    @Override
    public List<PendingEntry> pending(int count) {
        List<PendingEntry> result = new ArrayList<>(pending.values());
        return result.size() > count ? result.subList(0, count) : result;
    }

    @Override
    public List<StreamEntry> claim(Duration minIdle, List<String> ids) {
        List<StreamEntry> result = new ArrayList<>();
        for (String id : ids) {
            PendingEntry entry = pending.get(id);
            if (entry != null && entry.idleMs() >= minIdle.toMillis()) {
                pending.put(id, new PendingEntry(id, CONSUMER, 0, entry.deliveryCount() + 1));
                result.add(new StreamEntry(id, entries.get(id)));
            }
        }
        return result;
    }

    @Override
    public Optional<StreamEntry> findById(String id) {
        return entries.containsKey(id) ? Optional.of(new StreamEntry(id, entries.get(id))) : Optional.empty();
    }

    @Override
    public void ack(String id) {
        pending.remove(id);
        acked.add(id);
    }

    @Override
    public String deadLetter(DeadLetterEntry entry) {
        if (failDeadLetterWrites) {
            throw new TransientStoreException("dead-letter write failed", null);
        }
        String id = "dlq-" + (deadLetters.size() + 1);
        entry.setId(id);
        deadLetters.add(entry);
        return id;
    }

    @Override
    public List<DeadLetterEntry> listDeadLetters(int limit) {
        List<DeadLetterEntry> newestFirst = new ArrayList<>(deadLetters);
        Collections.reverse(newestFirst);
        return newestFirst.size() > limit ? newestFirst.subList(0, limit) : newestFirst;
    }
}
