package com.example.realtime.gateway.routing;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Which sectors of the floor each waiter is currently assigned to.
 */
@Repository
@RequiredArgsConstructor
public class SectorAssignmentRepository {

    private final JdbcTemplate jdbcTemplate;

    public List<Long> findSectorIds(long userId, long tenantId) {
        String sql = "SELECT sector_id FROM sector_assignment WHERE user_id = ? AND tenant_id = ? ORDER BY sector_id";
        return jdbcTemplate.queryForList(sql, Long.class, userId, tenantId);
    }

    /**
     * @return {@code false} if the assignment already existed
     */
    public boolean assign(long userId, long tenantId, long sectorId) {
        String sql = "INSERT INTO sector_assignment (user_id, tenant_id, sector_id) VALUES (?, ?, ?)";
        try {
            return jdbcTemplate.update(sql, userId, tenantId, sectorId) > 0;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public boolean unassign(long userId, long tenantId, long sectorId) {
        String sql = "DELETE FROM sector_assignment WHERE user_id = ? AND tenant_id = ? AND sector_id = ?";
        return jdbcTemplate.update(sql, userId, tenantId, sectorId) > 0;
    }
}
