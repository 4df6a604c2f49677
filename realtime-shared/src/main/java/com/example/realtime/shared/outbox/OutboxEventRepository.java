package com.example.realtime.shared.outbox;

import com.example.realtime.shared.model.OutboxEvent;
import com.example.realtime.shared.util.Constants.OutboxStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class OutboxEventRepository {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<OutboxEvent> ROW_MAPPER = (rs, rowNum) -> OutboxEvent.builder()
            .id(rs.getLong("id"))
            .tenantId(rs.getLong("tenant_id"))
            .eventType(rs.getString("event_type"))
            .aggregateType(rs.getString("aggregate_type"))
            .aggregateId(rs.getLong("aggregate_id"))
            .payload(rs.getString("payload"))
            .status(OutboxStatus.valueOf(rs.getString("status")))
            .retryCount(rs.getInt("retry_count"))
            .lastError(rs.getString("last_error"))
            .createdAt(toOffsetDateTime(rs.getTimestamp("created_at")))
            .claimedAt(toOffsetDateTime(rs.getTimestamp("claimed_at")))
            .processedAt(toOffsetDateTime(rs.getTimestamp("processed_at")))
            .build();

    /**
     * Inserts a new PENDING row. Runs in the caller's transaction when one is active.
     * @return the generated id
     */
    public long insert(OutboxEvent event) {
        String sql = "INSERT INTO outbox_event (tenant_id, event_type, aggregate_type, aggregate_id, payload, status, retry_count, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, 0, ?)";
        OffsetDateTime createdAt = event.getCreatedAt() != null ? event.getCreatedAt() : OffsetDateTime.now(ZoneOffset.UTC);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, event.getTenantId());
            ps.setString(2, event.getEventType());
            ps.setString(3, event.getAggregateType());
            ps.setLong(4, event.getAggregateId());
            ps.setString(5, event.getPayload());
            ps.setString(6, OutboxStatus.PENDING.name());
            ps.setTimestamp(7, Timestamp.from(createdAt.toInstant()));
            return ps;
        }, keyHolder);
        return extractId(keyHolder);
    }

    /**
     * Oldest PENDING rows first.
     */
    public List<OutboxEvent> findPending(int limit) {
        String sql = "SELECT * FROM outbox_event WHERE status = ? ORDER BY created_at, id LIMIT ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, OutboxStatus.PENDING.name(), limit);
    }

    /**
     * Flips a row from PENDING to PROCESSING. The status predicate makes the claim atomic across
     * processor instances: exactly one caller sees {@code true}.
     */
    public boolean claim(long id, OffsetDateTime claimedAt) {
        String sql = "UPDATE outbox_event SET status = ?, claimed_at = ? WHERE id = ? AND status = ?";
        return jdbcTemplate.update(sql,
                OutboxStatus.PROCESSING.name(), Timestamp.from(claimedAt.toInstant()), id, OutboxStatus.PENDING.name()) == 1;
    }

    public boolean markPublished(long id, OffsetDateTime processedAt) {
        String sql = "UPDATE outbox_event SET status = ?, processed_at = ?, last_error = NULL WHERE id = ? AND status = ?";
        return jdbcTemplate.update(sql,
                OutboxStatus.PUBLISHED.name(), Timestamp.from(processedAt.toInstant()), id, OutboxStatus.PROCESSING.name()) == 1;
    }

    /**
     * Records a failed publish on a claimed row, moving it back to PENDING or, once the retry
     * ceiling is reached, to FAILED.
     */
    public boolean markAttemptFailed(long id, int retryCount, OutboxStatus nextStatus, String error, OffsetDateTime at) {
        String sql = "UPDATE outbox_event SET status = ?, retry_count = ?, last_error = ?, processed_at = ? WHERE id = ? AND status = ?";
        Timestamp processedAt = nextStatus == OutboxStatus.FAILED ? Timestamp.from(at.toInstant()) : null;
        return jdbcTemplate.update(sql,
                nextStatus.name(), retryCount, truncate(error), processedAt, id, OutboxStatus.PROCESSING.name()) == 1;
    }

    /**
     * Hands a claimed row back to PENDING without touching its retry budget.
     */
    public boolean releaseClaim(long id) {
        String sql = "UPDATE outbox_event SET status = ?, claimed_at = NULL WHERE id = ? AND status = ?";
        return jdbcTemplate.update(sql, OutboxStatus.PENDING.name(), id, OutboxStatus.PROCESSING.name()) == 1;
    }

    /**
     * Returns rows stuck in PROCESSING since before {@code claimedBefore} to PENDING.
     */
    public int releaseStaleClaims(OffsetDateTime claimedBefore) {
        String sql = "UPDATE outbox_event SET status = ?, claimed_at = NULL WHERE status = ? AND claimed_at < ?";
        return jdbcTemplate.update(sql,
                OutboxStatus.PENDING.name(), OutboxStatus.PROCESSING.name(), Timestamp.from(claimedBefore.toInstant()));
    }

    /**
     * Puts a FAILED row back in the queue with a fresh retry budget.
     */
    public boolean requeueFailed(long id) {
        String sql = "UPDATE outbox_event SET status = ?, retry_count = 0, last_error = NULL, processed_at = NULL WHERE id = ? AND status = ?";
        return jdbcTemplate.update(sql, OutboxStatus.PENDING.name(), id, OutboxStatus.FAILED.name()) == 1;
    }

    public Optional<OutboxEvent> findById(long id) {
        List<OutboxEvent> rows = jdbcTemplate.query("SELECT * FROM outbox_event WHERE id = ?", ROW_MAPPER, id);
        return rows.stream().findFirst();
    }

    public List<OutboxEvent> findByStatus(OutboxStatus status, int limit) {
        String sql = "SELECT * FROM outbox_event WHERE status = ? ORDER BY created_at DESC, id DESC LIMIT ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, status.name(), limit);
    }

    public List<OutboxEvent> findByTenantAndStatus(long tenantId, OutboxStatus status, int limit) {
        String sql = "SELECT * FROM outbox_event WHERE tenant_id = ? AND status = ? ORDER BY created_at DESC, id DESC LIMIT ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, tenantId, status.name(), limit);
    }

    public Map<OutboxStatus, Long> countByStatus() {
        Map<OutboxStatus, Long> counts = new EnumMap<>(OutboxStatus.class);
        for (OutboxStatus status : OutboxStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcTemplate.query("SELECT status, COUNT(*) AS cnt FROM outbox_event GROUP BY status", rs -> {
            counts.put(OutboxStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
        });
        return counts;
    }

    private static long extractId(KeyHolder keyHolder) {
        Map<String, Object> keys = keyHolder.getKeys();
        if (keys == null || keys.isEmpty()) {
            throw new IllegalStateException("Outbox insert returned no generated id");
        }
        Object id = keys.size() == 1
                ? keys.values().iterator().next()
                : keys.entrySet().stream()
                    .filter(entry -> "id".equalsIgnoreCase(entry.getKey()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Outbox insert returned no id column"));
        return ((Number) id).longValue();
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    private static OffsetDateTime toOffsetDateTime(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant().atOffset(ZoneOffset.UTC);
    }
}
