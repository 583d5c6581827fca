package com.project.pvb.storage;

import com.project.pvb.crypto.ErrorLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding remote storage fetches.
 *
 * States:
 * - CLOSED: requests pass through
 * - OPEN: the remote is failing, requests are refused
 * - HALF_OPEN: probing for recovery
 *
 * Transitions:
 * - CLOSED -> OPEN after failureThreshold consecutive failures
 * - OPEN -> HALF_OPEN once openDuration has elapsed
 * - HALF_OPEN -> CLOSED after successThreshold consecutive successes
 * - HALF_OPEN -> OPEN on any failure
 */
public class CircuitBreaker {

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration openDuration;
    private final Clock clock;

    private final AtomicReference<State> state;
    private final AtomicInteger failureCount;
    private final AtomicInteger successCount;
    private final AtomicReference<Instant> lastFailureTime;
    private final AtomicReference<Instant> stateChangedTime;

    public CircuitBreaker(String name) {
        this(name, 5, 3, Duration.ofSeconds(30), Clock.systemUTC());
    }

    /**
     * @param name             identifier for logging
     * @param failureThreshold failures before opening the circuit
     * @param successThreshold successes in half-open before closing it
     * @param openDuration     how long to stay open before probing
     * @param clock            time source
     */
    public CircuitBreaker(String name, int failureThreshold, int successThreshold,
                          Duration openDuration, Clock clock) {
        if (failureThreshold <= 0 || successThreshold <= 0) {
            throw new IllegalArgumentException("Thresholds must be positive");
        }

        this.name = name;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.openDuration = openDuration;
        this.clock = clock;

        this.state = new AtomicReference<>(State.CLOSED);
        this.failureCount = new AtomicInteger(0);
        this.successCount = new AtomicInteger(0);
        this.lastFailureTime = new AtomicReference<>(Instant.MIN);
        this.stateChangedTime = new AtomicReference<>(clock.instant());
    }

    /**
     * Run an operation through the breaker.
     *
     * @throws CircuitBreakerOpenException if the circuit is open
     */
    public <T> T executeChecked(CheckedSupplier<T> operation) throws Exception {
        if (!canExecute()) {
            throw new CircuitBreakerOpenException(
                String.format("Circuit breaker '%s' is OPEN. Last failure: %s",
                    name, lastFailureTime.get())
            );
        }

        try {
            T result = operation.get();
            recordSuccess();
            return result;
        } catch (Exception e) {
            recordFailure();
            throw e;
        }
    }

    public boolean canExecute() {
        switch (state.get()) {
            case CLOSED:
            case HALF_OPEN:
                return true;
            case OPEN:
                if (shouldTransitionToHalfOpen()) {
                    transitionTo(State.HALF_OPEN);
                    return true;
                }
                return false;
            default:
                return false;
        }
    }

    public void recordSuccess() {
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            int successes = successCount.incrementAndGet();
            if (successes >= successThreshold) {
                transitionTo(State.CLOSED);
            }
        } else if (currentState == State.CLOSED) {
            failureCount.set(0);
        }
    }

    public void recordFailure() {
        lastFailureTime.set(clock.instant());
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            transitionTo(State.OPEN);
        } else if (currentState == State.CLOSED) {
            int failures = failureCount.incrementAndGet();
            if (failures >= failureThreshold) {
                transitionTo(State.OPEN);
            }
        }
    }

    private boolean shouldTransitionToHalfOpen() {
        return !clock.instant().isBefore(stateChangedTime.get().plus(openDuration));
    }

    private synchronized void transitionTo(State newState) {
        State oldState = state.get();
        if (oldState != newState) {
            state.set(newState);
            stateChangedTime.set(clock.instant());

            if (newState == State.CLOSED) {
                failureCount.set(0);
            }
            successCount.set(0);

            ErrorLogger.logInfo("CircuitBreaker:" + name, "State changed: " + oldState + " -> " + newState);
        }
    }

    public State getState() {
        if (state.get() == State.OPEN && shouldTransitionToHalfOpen()) {
            transitionTo(State.HALF_OPEN);
        }
        return state.get();
    }

    public String getName() {
        return name;
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public void reset() {
        transitionTo(State.CLOSED);
    }

    public void trip() {
        transitionTo(State.OPEN);
    }

    @FunctionalInterface
    public interface CheckedSupplier<T> {
        T get() throws Exception;
    }

    public static class CircuitBreakerOpenException extends RuntimeException {
        public CircuitBreakerOpenException(String message) {
            super(message);
        }
    }
}
