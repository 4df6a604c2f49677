package com.example.realtime.gateway.stream;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs the stream consumer on a dedicated thread, since every read blocks.
 */
@Component
@Slf4j
@Profile("!no-scheduling")
@RequiredArgsConstructor
public class CriticalStreamWorker {

    private static final long SHUTDOWN_WAIT_MS = 5000L;

    private final CriticalStreamConsumer consumer;

    private volatile boolean running;
    private Thread thread;

    @PostConstruct
    public void start() {
        running = true;
        thread = new Thread(this::runLoop, "critical-stream-consumer");
        thread.setDaemon(true);
        thread.start();
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(SHUTDOWN_WAIT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[STREAM_STOP] Critical stream consumer stopped");
    }

    public boolean isRunning() {
        return running && thread != null && thread.isAlive();
    }

    void runLoop() {
        boolean initialized = false;
        while (running) {
            try {
                if (!initialized) {
                    consumer.initialize();
                    initialized = true;
                }
                consumer.runCycle();
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                Duration delay = consumer.onCycleError(e);
                if (!sleep(delay)) {
                    break;
                }
            }
        }
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
