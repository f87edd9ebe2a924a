package com.querylab.search.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closed / open / half-open breaker for a degradable dependency.
 *
 * <p>Every check and update runs under the breaker's monitor, so a threshold crossing produces
 * exactly one transition no matter how many callers fail at once. The open to half-open move is
 * evaluated lazily by {@link #canExecute()}; the call that performs it is admitted as the first trial call.
 *
 * <p>Request, blocked and transition totals are lifetime counters and survive {@link #reset()}.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration openTimeout;
    private final int halfOpenMaxCalls;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int halfOpenCalls;
    private long totalBlocked;
    private long totalRequests;
    private long transitionCount;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private Instant lastStateChange;

    public CircuitBreaker(String name, int failureThreshold, Duration openTimeout, int halfOpenMaxCalls, Clock clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openTimeout = openTimeout == null || openTimeout.isNegative() ? Duration.ZERO : openTimeout;
        this.halfOpenMaxCalls = Math.max(1, halfOpenMaxCalls);
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized boolean isClosed() {
        return state == CircuitState.CLOSED;
    }

    public synchronized boolean isOpen() {
        return state == CircuitState.OPEN;
    }

    public synchronized boolean isHalfOpen() {
        return state == CircuitState.HALF_OPEN;
    }

    public synchronized boolean canExecute() {
        totalRequests++;
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (openTimeoutElapsed()) {
                    transitionTo(CircuitState.HALF_OPEN);
                    halfOpenCalls = 1;
                    return true;
                }
                totalBlocked++;
                return false;
            default:
                if (halfOpenCalls < halfOpenMaxCalls) {
                    halfOpenCalls++;
                    return true;
                }
                totalBlocked++;
                return false;
        }
    }

    public synchronized void recordSuccess() {
        successCount++;
        lastSuccessTime = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.CLOSED);
            failureCount = 0;
        }
    }

    public synchronized void recordFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.OPEN);
        } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            transitionTo(CircuitState.OPEN);
        }
    }

    public synchronized void reset() {
        state = CircuitState.CLOSED;
        failureCount = 0;
        successCount = 0;
        halfOpenCalls = 0;
        lastFailureTime = null;
        lastSuccessTime = null;
        lastStateChange = clock.instant();
        log.info("circuit breaker '{}' reset", name);
    }

    public synchronized CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(
            name,
            state,
            failureCount,
            successCount,
            halfOpenCalls,
            lastFailureTime,
            lastSuccessTime,
            lastStateChange,
            totalBlocked,
            totalRequests,
            transitionCount
        );
    }

    /**
     * Runs {@code action} when the breaker admits it. The fallback is returned when the call is
     * blocked or throws; a thrown exception counts as a failure.
     */
    public <T> T execute(Supplier<T> action, Supplier<T> fallback) {
        if (!canExecute()) {
            return fallback.get();
        }
        try {
            T result = action.get();
            recordSuccess();
            return result;
        } catch (RuntimeException e) {
            recordFailure();
            log.warn("circuit breaker '{}' call failed: {}", name, e.getMessage());
            return fallback.get();
        }
    }

    private boolean openTimeoutElapsed() {
        if (lastFailureTime == null) {
            return true;
        }
        return !clock.instant().isBefore(lastFailureTime.plus(openTimeout));
    }

    private void transitionTo(CircuitState next) {
        if (state == next) {
            return;
        }
        CircuitState previous = state;
        state = next;
        transitionCount++;
        lastStateChange = clock.instant();
        if (next == CircuitState.HALF_OPEN) {
            halfOpenCalls = 0;
        }
        log.info("circuit breaker '{}' transitioned {} -> {}", name, previous.value(), next.value());
    }
}
