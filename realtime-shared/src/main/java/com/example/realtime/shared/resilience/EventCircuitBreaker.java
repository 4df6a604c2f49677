package com.example.realtime.shared.resilience;

import com.example.realtime.shared.util.Constants.CircuitState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Three-state breaker guarding calls to the store, on a resilience4j count-based window.
 * A window of {@code failureThreshold} calls at a 100% failure rate opens it, which is the same
 * as that many consecutive failures. HALF_OPEN hands out {@code halfOpenMaxCalls} trial permits;
 * the first trial outcome decides: one success closes, one failure reopens.
 */
@Slf4j
public class EventCircuitBreaker {

    @Getter
    private final String name;
    private final CircuitBreaker delegate;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Instant lastFailureAt;

    public EventCircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, int halfOpenMaxCalls, Clock clock) {
        this.name = name;
        this.clock = clock;
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(recoveryTimeout)
                .permittedNumberOfCallsInHalfOpenState(halfOpenMaxCalls)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        this.delegate = new CircuitBreakerStateMachine(name, config, clock);
        this.delegate.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.StateTransition transition = event.getStateTransition();
            if (transition.getToState() == CircuitBreaker.State.OPEN) {
                log.warn("[BREAKER_OPEN] Circuit breaker '{}' {} -> OPEN, retry in {}ms",
                        name, transition.getFromState(), recoveryTimeout.toMillis());
            } else {
                log.info("[BREAKER_TRANSITION] Circuit breaker '{}' {} -> {}",
                        name, transition.getFromState(), transition.getToState());
            }
        });
    }

    /**
     * @return true if the caller may attempt the call. An OPEN breaker whose recovery timeout has
     * elapsed moves to HALF_OPEN on the next acquire. Every granted permit must end in exactly
     * one of {@link #recordSuccess()}, {@link #recordFailure(Throwable)} or {@link #releasePermission()}.
     */
    public boolean tryAcquire() {
        return delegate.tryAcquirePermission();
    }

    public void recordSuccess() {
        lock.lock();
        try {
            delegate.onSuccess(0, TimeUnit.NANOSECONDS);
            if (delegate.getState() == CircuitBreaker.State.HALF_OPEN) {
                delegate.transitionToClosedState();
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure(Throwable cause) {
        lock.lock();
        try {
            lastFailureAt = clock.instant();
            delegate.onError(0, TimeUnit.NANOSECONDS, cause);
            if (delegate.getState() == CircuitBreaker.State.HALF_OPEN) {
                delegate.transitionToOpenState();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a permit whose call ended without an outcome (cancelled or completed empty).
     */
    public void releasePermission() {
        delegate.releasePermission();
    }

    public CircuitState getState() {
        switch (delegate.getState()) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }

    public Map<String, Object> getStats() {
        CircuitBreaker.Metrics metrics = delegate.getMetrics();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("name", name);
        stats.put("state", getState().name());
        stats.put("failureCount", metrics.getNumberOfFailedCalls());
        stats.put("bufferedCalls", metrics.getNumberOfBufferedCalls());
        stats.put("rejectedCount", metrics.getNumberOfNotPermittedCalls());
        stats.put("lastFailureAt", lastFailureAt);
        return stats;
    }
}
