package com.example.realtime.gateway.subscriber;

import com.example.realtime.shared.resilience.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DropRateWindowTest {

    private MutableClock clock;
    private DropRateWindow window;

    @BeforeEach
    void setup() {
        clock = new MutableClock(Instant.parse("2024-01-01T12:00:00Z"));
        window = new DropRateWindow(Duration.ofSeconds(60), 5.0, Duration.ofMinutes(5), clock);
    }

    private void processed(int n) {
        for (int i = 0; i < n; i++) {
            window.recordProcessed();
        }
    }

    @Test
    void dropsAtOrBelowThresholdRaiseNoAlert() {
        processed(95);
        for (int i = 0; i < 5; i++) {
            assertFalse(window.recordDropped());
        }
        assertEquals(5.0, window.dropRatePercent(), 0.0001);
        assertEquals(0, window.alertCount());
    }

    @Test
    void crossingTheThresholdRaisesOneAlertPerCooldown() {
        processed(90);
        boolean raised = false;
        for (int i = 0; i < 10; i++) {
            raised |= window.recordDropped();
        }
        assertTrue(raised);
        assertEquals(1, window.alertCount());

        clock.advance(Duration.ofSeconds(30));
        assertFalse(window.recordDropped());
        assertEquals(1, window.alertCount());

        clock.advance(Duration.ofMinutes(5));
        processed(10);
        assertTrue(window.recordDropped());
        assertEquals(2, window.alertCount());
    }

    @Test
    void samplesOutsideTheWindowNoLongerCount() {
        processed(10);
        window.recordDropped();
        assertTrue(window.dropRatePercent() > 5.0);

        clock.advance(Duration.ofSeconds(61));
        assertEquals(0.0, window.dropRatePercent(), 0.0001);

        processed(1);
        Map<String, Object> stats = window.getStats();
        assertEquals(11L, stats.get("totalProcessed"));
        assertEquals(1L, stats.get("totalDropped"));
        assertEquals(1L, stats.get("windowProcessed"));
        assertEquals(0L, stats.get("windowDropped"));
    }
}
