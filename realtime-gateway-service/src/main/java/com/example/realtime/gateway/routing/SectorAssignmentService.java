package com.example.realtime.gateway.routing;

import com.example.realtime.gateway.session.ClientSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Changes a waiter's sector assignment and brings the cache and any open connections in line.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SectorAssignmentService {

    private final SectorAssignmentRepository repository;
    private final SectorCache sectorCache;
    private final ClientSessionRegistry sessionRegistry;

    public List<Long> assign(long userId, long tenantId, long sectorId) {
        if (repository.assign(userId, tenantId, sectorId)) {
            log.info("[SECTOR_ASSIGN] User {} of tenant {} assigned to sector {}", userId, tenantId, sectorId);
        }
        return refresh(userId, tenantId);
    }

    public List<Long> unassign(long userId, long tenantId, long sectorId) {
        if (repository.unassign(userId, tenantId, sectorId)) {
            log.info("[SECTOR_UNASSIGN] User {} of tenant {} removed from sector {}", userId, tenantId, sectorId);
        }
        return refresh(userId, tenantId);
    }

    /**
     * Drops the cached assignment, reloads it and re-indexes the user's open connections.
     */
    public List<Long> refresh(long userId, long tenantId) {
        sectorCache.invalidate(userId, tenantId);
        List<Long> sectors = sectorCache.get(userId, tenantId);
        sessionRegistry.updateSectors(userId, tenantId, sectors);
        return sectors;
    }
}
