package com.example.realtime.gateway.routing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-through cache of waiter sector assignments. Entries expire after the configured TTL and
 * are dropped explicitly whenever an assignment changes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SectorCache {

    private final Cache<SectorKey, List<Long>> sectorAssignmentCache;
    private final SectorAssignmentRepository repository;

    public List<Long> get(long userId, long tenantId) {
        return sectorAssignmentCache.get(new SectorKey(userId, tenantId),
                key -> List.copyOf(repository.findSectorIds(key.userId(), key.tenantId())));
    }

    public void invalidate(long userId, long tenantId) {
        sectorAssignmentCache.invalidate(new SectorKey(userId, tenantId));
        log.debug("[SECTOR_CACHE] Invalidated sectors of user {} in tenant {}", userId, tenantId);
    }

    public long size() {
        sectorAssignmentCache.cleanUp();
        return sectorAssignmentCache.estimatedSize();
    }

    public Map<String, Object> getStats() {
        CacheStats stats = sectorAssignmentCache.stats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("size", size());
        result.put("hitCount", stats.hitCount());
        result.put("missCount", stats.missCount());
        result.put("evictionCount", stats.evictionCount());
        return result;
    }
}
