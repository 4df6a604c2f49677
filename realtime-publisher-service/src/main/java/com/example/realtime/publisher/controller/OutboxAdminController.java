package com.example.realtime.publisher.controller;

import com.example.realtime.shared.model.OutboxEvent;
import com.example.realtime.shared.outbox.OutboxEventRepository;
import com.example.realtime.shared.publisher.EventPublisher;
import com.example.realtime.shared.util.Constants.OutboxStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/outbox")
@RequiredArgsConstructor
@Slf4j
public class OutboxAdminController {

    private final OutboxEventRepository outboxEventRepository;
    private final EventPublisher eventPublisher;

    @GetMapping("/failed")
    public ResponseEntity<List<OutboxEvent>> getFailedEvents(@RequestParam(required = false) Long tenantId,
                                                             @RequestParam(defaultValue = "100") int limit) {
        List<OutboxEvent> rows = tenantId == null
                ? outboxEventRepository.findByStatus(OutboxStatus.FAILED, limit)
                : outboxEventRepository.findByTenantAndStatus(tenantId, OutboxStatus.FAILED, limit);
        return ResponseEntity.ok(rows);
    }

    @PostMapping("/{id}/requeue")
    public ResponseEntity<Void> requeue(@PathVariable long id) {
        if (!outboxEventRepository.requeueFailed(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No FAILED outbox row with id " + id);
        }
        log.info("[OUTBOX_REQUEUE] Row {} requeued by operator", id);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("rows", outboxEventRepository.countByStatus());
        stats.put("circuitBreaker", eventPublisher.getCircuitBreakerStats());
        return ResponseEntity.ok(stats);
    }
}
