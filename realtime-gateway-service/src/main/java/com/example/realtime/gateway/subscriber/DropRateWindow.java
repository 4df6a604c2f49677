package com.example.realtime.gateway.subscriber;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding window of processed and dropped events. A drop that pushes the window's drop rate
 * above the threshold raises an alert, at most once per cooldown.
 */
@Slf4j
public class DropRateWindow {

    private static final int MAX_SAMPLES = 60_000;

    private final Clock clock;
    private final long windowMs;
    private final double alertThresholdPercent;
    private final long alertCooldownMs;

    private final ReentrantLock lock = new ReentrantLock();
    // Each sample: {timestampMs, processed, dropped}
    private final ArrayDeque<long[]> samples = new ArrayDeque<>();
    private long windowProcessed;
    private long windowDropped;
    private long totalProcessed;
    private long totalDropped;
    private long lastAlertAtMs = Long.MIN_VALUE;
    private long alertCount;

    public DropRateWindow(Duration window, double alertThresholdPercent, Duration alertCooldown, Clock clock) {
        this.windowMs = window.toMillis();
        this.alertThresholdPercent = alertThresholdPercent;
        this.alertCooldownMs = alertCooldown.toMillis();
        this.clock = clock;
    }

    public void recordProcessed() {
        lock.lock();
        try {
            long now = clock.millis();
            evictExpired(now);
            add(now, 1, 0);
            totalProcessed++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if this drop raised an alert
     */
    public boolean recordDropped() {
        lock.lock();
        try {
            long now = clock.millis();
            evictExpired(now);
            add(now, 0, 1);
            totalDropped++;
            return checkAlert(now);
        } finally {
            lock.unlock();
        }
    }

    public double dropRatePercent() {
        lock.lock();
        try {
            evictExpired(clock.millis());
            return ratePercent();
        } finally {
            lock.unlock();
        }
    }

    public long alertCount() {
        lock.lock();
        try {
            return alertCount;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> getStats() {
        lock.lock();
        try {
            evictExpired(clock.millis());
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("totalProcessed", totalProcessed);
            stats.put("totalDropped", totalDropped);
            stats.put("windowProcessed", windowProcessed);
            stats.put("windowDropped", windowDropped);
            stats.put("windowDropRatePercent", ratePercent());
            stats.put("alertThresholdPercent", alertThresholdPercent);
            stats.put("alertCount", alertCount);
            return stats;
        } finally {
            lock.unlock();
        }
    }

    private boolean checkAlert(long now) {
        if (lastAlertAtMs != Long.MIN_VALUE && now - lastAlertAtMs < alertCooldownMs) {
            return false;
        }
        double rate = ratePercent();
        if (rate <= alertThresholdPercent) {
            return false;
        }
        lastAlertAtMs = now;
        alertCount++;
        log.error("[SUB_DROP_ALERT] Event drop rate {}% exceeds {}% over the last {}s ({} dropped, {} processed, alert #{})",
                String.format("%.2f", rate), alertThresholdPercent, windowMs / 1000, windowDropped, windowProcessed, alertCount);
        return true;
    }

    private void add(long now, long processed, long dropped) {
        if (samples.size() >= MAX_SAMPLES) {
            long[] oldest = samples.pollFirst();
            windowProcessed -= oldest[1];
            windowDropped -= oldest[2];
        }
        samples.addLast(new long[]{now, processed, dropped});
        windowProcessed += processed;
        windowDropped += dropped;
    }

    private void evictExpired(long now) {
        long cutoff = now - windowMs;
        while (!samples.isEmpty() && samples.peekFirst()[0] < cutoff) {
            long[] expired = samples.pollFirst();
            windowProcessed -= expired[1];
            windowDropped -= expired[2];
        }
    }

    private double ratePercent() {
        long total = windowProcessed + windowDropped;
        return total == 0 ? 0.0 : (windowDropped * 100.0) / total;
    }
}
