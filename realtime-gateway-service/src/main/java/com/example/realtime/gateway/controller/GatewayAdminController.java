package com.example.realtime.gateway.controller;

import com.example.realtime.gateway.routing.SectorAssignmentService;
import com.example.realtime.gateway.routing.SectorCache;
import com.example.realtime.gateway.session.ClientSessionRegistry;
import com.example.realtime.gateway.stream.CriticalStreamStore;
import com.example.realtime.gateway.stream.DeadLetterEntry;
import com.example.realtime.gateway.subscriber.RedisEventSubscriber;
import com.example.realtime.shared.publisher.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/gateway")
@RequiredArgsConstructor
@Slf4j
public class GatewayAdminController {

    private final ObjectProvider<RedisEventSubscriber> subscriber;
    private final EventPublisher eventPublisher;
    private final ClientSessionRegistry sessionRegistry;
    private final CriticalStreamStore criticalStreamStore;
    private final SectorCache sectorCache;
    private final SectorAssignmentService sectorAssignmentService;

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        RedisEventSubscriber eventSubscriber = subscriber.getIfAvailable();
        stats.put("subscriber", eventSubscriber != null ? eventSubscriber.getStats() : Map.of("running", false));
        stats.put("circuitBreaker", eventPublisher.getCircuitBreakerStats());
        stats.put("sessions", sessionRegistry.getStats());
        stats.put("sectorCache", sectorCache.getStats());
        return ResponseEntity.ok(stats);
    }

    @GetMapping("/dead-letters")
    public ResponseEntity<List<DeadLetterEntry>> getDeadLetters(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(criticalStreamStore.listDeadLetters(limit));
    }

    @PutMapping("/sectors/{tenantId}/{userId}/{sectorId}")
    public ResponseEntity<List<Long>> assignSector(@PathVariable long tenantId, @PathVariable long userId, @PathVariable long sectorId) {
        return ResponseEntity.ok(sectorAssignmentService.assign(userId, tenantId, sectorId));
    }

    @DeleteMapping("/sectors/{tenantId}/{userId}/{sectorId}")
    public ResponseEntity<List<Long>> unassignSector(@PathVariable long tenantId, @PathVariable long userId, @PathVariable long sectorId) {
        return ResponseEntity.ok(sectorAssignmentService.unassign(userId, tenantId, sectorId));
    }

    @PostMapping("/sectors/{tenantId}/{userId}/invalidate")
    public ResponseEntity<List<Long>> invalidateSectors(@PathVariable long tenantId, @PathVariable long userId) {
        log.info("[SECTOR_CACHE] Operator invalidated sectors of user {} in tenant {}", userId, tenantId);
        return ResponseEntity.ok(sectorAssignmentService.refresh(userId, tenantId));
    }
}
