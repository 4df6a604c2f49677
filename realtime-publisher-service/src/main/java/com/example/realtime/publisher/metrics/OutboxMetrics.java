package com.example.realtime.publisher.metrics;

import com.example.realtime.shared.outbox.OutboxEventRepository;
import com.example.realtime.shared.util.Constants.OutboxStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exports the outbox backlog per status. FAILED rows need an operator.
 */
@Component
@RequiredArgsConstructor
public class OutboxMetrics implements MeterBinder {

    private final OutboxEventRepository outboxEventRepository;

    @Override
    public void bindTo(MeterRegistry registry) {
        for (OutboxStatus status : OutboxStatus.values()) {
            Gauge.builder("realtime.outbox.size", this, metrics -> metrics.countFor(status))
                    .description("The current number of outbox rows in this status.")
                    .tag("status", status.name())
                    .register(registry);
        }
    }

    double countFor(OutboxStatus status) {
        Long count = outboxEventRepository.countByStatus().get(status);
        return count != null ? count.doubleValue() : 0.0;
    }
}
