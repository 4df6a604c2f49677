package com.example.realtime.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public RealtimeMetricsCollector realtimeMetricsCollector(MeterRegistry registry) {
        return new RealtimeMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths do not re-register them.
     */
    public static class RealtimeMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public RealtimeMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            counters.computeIfAbsent(key(name, tags), k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long durationMs, String... tags) {
            timers.computeIfAbsent(key(name, tags), k -> Timer.builder(name).tags(tags).register(registry))
                    .record(durationMs, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, long value, String... tags) {
            gauges.computeIfAbsent(key(name, tags), k -> {
                AtomicLong gauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), gauge);
                return gauge;
            }).set(value);
        }

        private static String key(String name, String... tags) {
            return name + "_" + String.join("_", tags);
        }
    }
}
