package com.example.realtime.gateway.stream;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Consumer-group access to the critical event stream and its dead-letter stream. Store failures
 * surface as {@link com.example.realtime.shared.exception.TransientStoreException}.
 */
public interface CriticalStreamStore {

    /**
     * Creates the consumer group, and the stream with it, if missing.
     */
    void ensureGroup();

    /**
     * Entries never delivered to any consumer of the group, waiting up to {@code block}.
     */
    List<StreamEntry> readNew(int count, Duration block);

    List<PendingEntry> pending(int count);

    /**
     * Transfers idle pending entries to this consumer. Entries claimed by someone else in the
     * meantime are left out.
     */
    List<StreamEntry> claim(Duration minIdle, List<String> ids);

    Optional<StreamEntry> findById(String id);

    void ack(String id);

    /**
     * Appends to the dead-letter stream, trimming it to its maximum length.
     * @return the dead-letter entry id
     */
    String deadLetter(DeadLetterEntry entry);

    /**
     * Newest dead-letter entries first.
     */
    List<DeadLetterEntry> listDeadLetters(int limit);
}
