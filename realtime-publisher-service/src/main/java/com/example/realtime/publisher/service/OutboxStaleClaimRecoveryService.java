package com.example.realtime.publisher.service;

import com.example.realtime.shared.aspect.Monitored;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.outbox.OutboxEventRepository;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Returns rows left in PROCESSING by a processor that died mid-publish to PENDING.
 */
@Service
@Slf4j
@Profile("!no-scheduling")
public class OutboxStaleClaimRecoveryService {

    private final OutboxEventRepository outboxEventRepository;
    private final long staleClaimTimeoutMs;
    private final Clock clock;

    public OutboxStaleClaimRecoveryService(OutboxEventRepository outboxEventRepository, AppProperties appProperties) {
        this(outboxEventRepository, appProperties, Clock.systemUTC());
    }

    OutboxStaleClaimRecoveryService(OutboxEventRepository outboxEventRepository, AppProperties appProperties, Clock clock) {
        this.outboxEventRepository = outboxEventRepository;
        this.staleClaimTimeoutMs = appProperties.getOutbox().getStaleClaimTimeoutMs();
        this.clock = clock;
    }

    @Monitored("scheduler")
    @Scheduled(fixedRate = 60000)
    @SchedulerLock(name = "releaseStaleOutboxClaims", lockAtLeastFor = "PT50S", lockAtMostFor = "PT55S")
    public int releaseStaleClaims() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minusNanos(staleClaimTimeoutMs * 1_000_000L);
        int released = outboxEventRepository.releaseStaleClaims(cutoff);
        if (released > 0) {
            log.warn("[OUTBOX_STALE_CLAIM] Released {} rows claimed before {}", released, cutoff);
        } else {
            log.trace("No stale outbox claims found.");
        }
        return released;
    }
}
