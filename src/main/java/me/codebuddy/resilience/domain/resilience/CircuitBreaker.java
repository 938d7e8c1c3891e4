package me.codebuddy.resilience.domain.resilience;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.codebuddy.resilience.domain.model.CircuitBreakerSnapshot;
import me.codebuddy.resilience.domain.model.CircuitState;
import me.codebuddy.resilience.port.outbound.ResilienceMetricsPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

/**
 * Per-dependency circuit breaker with exponential recovery backoff and
 * gradual traffic ramp-up.
 *
 * <p>
 * State machine:
 * <ul>
 * <li><b>CLOSED</b> - every call is forwarded. {@code failureThreshold}
 * consecutive failures open the circuit.</li>
 * <li><b>OPEN</b> - calls are rejected with {@link CircuitOpenException}
 * without invoking the operation. Once {@code now - openedAt} reaches the
 * current backoff, the next call moves the breaker to half-open before it is
 * evaluated.</li>
 * <li><b>HALF_OPEN</b> - a call is admitted with probability
 * {@code trafficPercentage} (starting at the floor) and only while fewer than
 * {@code halfOpenMaxCalls} probes are outstanding. Each success raises the
 * percentage linearly by {@code trafficStep}; {@code successThreshold}
 * consecutive successes close the circuit. A single failure re-opens it and
 * multiplies the backoff.</li>
 * </ul>
 *
 * <p>
 * All bookkeeping happens under a lock owned by this breaker; the operation
 * itself and the metrics callbacks run outside it. Outcomes of calls admitted
 * before the last transition only update counters, so a late result cannot
 * act on a state it never observed.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final DoubleSupplier random;
    private final ResilienceMetricsPort metrics;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private Instant lastFailureTime;
    private Instant openedAt;
    private int backoffExponent;
    private Duration currentBackoff;
    private double trafficPercentage = 1.0;
    private int halfOpenInFlight;
    private long generation;

    private long totalCalls;
    private long totalSuccesses;
    private long totalFailures;
    private long totalRejected;
    private long stateTransitions;
    private final Deque<Instant> failureHistory = new ArrayDeque<>();

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, DoubleSupplier random,
            ResilienceMetricsPort metrics) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = config.validate();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.metrics = metrics != null ? metrics : ResilienceMetricsPort.NOOP;
        this.currentBackoff = config.getBaseBackoff();
    }

    /**
     * Runs the operation if the breaker admits it and feeds the outcome back
     * into the state machine.
     *
     * @throws CircuitOpenException
     *             if the breaker rejects the call
     */
    public <T> T call(Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation must not be null");
        Permit permit = acquirePermission();
        boolean recorded = false;
        try {
            T result = operation.call();
            onSuccess(permit);
            recorded = true;
            return result;
        } catch (Exception e) {
            if (!config.isExcluded(e)) {
                onFailure(permit);
                recorded = true;
            }
            throw e;
        } finally {
            if (!recorded) {
                releaseProbe(permit);
            }
        }
    }

    /**
     * Returns the breaker to its initial CLOSED state. Lifetime counters are
     * kept.
     */
    public void reset() {
        CircuitBreakerSnapshot snapshot;
        lock.lock();
        try {
            state = CircuitState.CLOSED;
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
            lastFailureTime = null;
            openedAt = null;
            backoffExponent = 0;
            currentBackoff = config.getBaseBackoff();
            trafficPercentage = 1.0;
            halfOpenInFlight = 0;
            generation++;
            failureHistory.clear();
            snapshot = snapshotLocked(clock.instant());
        } finally {
            lock.unlock();
        }
        log.info("[CircuitBreaker:{}] Reset to CLOSED", name);
        metrics.recordCircuitBreakerState(snapshot);
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot getSnapshot() {
        lock.lock();
        try {
            return snapshotLocked(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private Permit acquirePermission() {
        CircuitState observed;
        CircuitBreakerSnapshot transition = null;
        CircuitOpenException rejection = null;
        Permit permit = null;

        lock.lock();
        try {
            totalCalls++;
            Instant now = clock.instant();
            if (state == CircuitState.OPEN && isBackoffElapsed(now)) {
                transitionToHalfOpen();
                transition = snapshotLocked(now);
            }
            observed = state;

            if (state == CircuitState.OPEN) {
                rejection = rejectLocked(now, "Circuit breaker is OPEN for " + name + ". Failures: "
                        + consecutiveFailures + "/" + config.getFailureThreshold() + ". Retry after "
                        + remainingBackoff(now).toMillis() + "ms");
            } else if (state == CircuitState.HALF_OPEN) {
                if (random.getAsDouble() >= trafficPercentage) {
                    rejection = rejectLocked(now, "Circuit breaker is HALF_OPEN for " + name
                            + ". Traffic limited to " + formatPercent(trafficPercentage));
                } else if (halfOpenInFlight >= config.getHalfOpenMaxCalls()) {
                    rejection = rejectLocked(now, "Circuit breaker is HALF_OPEN for " + name
                            + " and at probe capacity (" + config.getHalfOpenMaxCalls() + ")");
                } else {
                    halfOpenInFlight++;
                    permit = new Permit(generation, true);
                }
            } else {
                permit = new Permit(generation, false);
            }
        } finally {
            lock.unlock();
        }

        metrics.recordCircuitBreakerCall(name, observed);
        if (transition != null) {
            metrics.recordCircuitBreakerState(transition);
        }
        if (rejection != null) {
            log.debug("[CircuitBreaker:{}] Rejected call: {}", name, rejection.getMessage());
            metrics.recordCircuitBreakerRejection(name, observed);
            throw rejection;
        }
        return permit;
    }

    private void onSuccess(Permit permit) {
        CircuitBreakerSnapshot snapshot;
        lock.lock();
        try {
            totalSuccesses++;
            consecutiveFailures = 0;
            releaseProbeLocked(permit);
            if (permit.generation() == generation) {
                if (state == CircuitState.HALF_OPEN) {
                    consecutiveSuccesses++;
                    trafficPercentage = Math.min(1.0, trafficPercentage + config.getTrafficStep());
                    if (consecutiveSuccesses >= config.getSuccessThreshold()) {
                        transitionToClosed();
                    }
                } else if (state == CircuitState.CLOSED) {
                    backoffExponent = 0;
                    currentBackoff = config.getBaseBackoff();
                }
            }
            snapshot = snapshotLocked(clock.instant());
        } finally {
            lock.unlock();
        }
        metrics.recordCircuitBreakerState(snapshot);
    }

    private void onFailure(Permit permit) {
        CircuitBreakerSnapshot snapshot;
        lock.lock();
        try {
            Instant now = clock.instant();
            totalFailures++;
            lastFailureTime = now;
            failureHistory.addLast(now);
            while (failureHistory.size() > config.getFailureHistorySize()) {
                failureHistory.removeFirst();
            }
            releaseProbeLocked(permit);
            if (permit.generation() == generation) {
                consecutiveFailures++;
                if (state == CircuitState.HALF_OPEN) {
                    backoffExponent++;
                    transitionToOpen(now);
                } else if (state == CircuitState.CLOSED && consecutiveFailures >= config.getFailureThreshold()) {
                    backoffExponent = 0;
                    transitionToOpen(now);
                }
            }
            snapshot = snapshotLocked(now);
        } finally {
            lock.unlock();
        }
        metrics.recordCircuitBreakerFailure(name);
        metrics.recordCircuitBreakerState(snapshot);
    }

    private void releaseProbe(Permit permit) {
        if (!permit.probe()) {
            return;
        }
        lock.lock();
        try {
            releaseProbeLocked(permit);
        } finally {
            lock.unlock();
        }
    }

    private void releaseProbeLocked(Permit permit) {
        if (permit.probe() && permit.generation() == generation && halfOpenInFlight > 0) {
            halfOpenInFlight--;
        }
    }

    private void transitionToOpen(Instant now) {
        state = CircuitState.OPEN;
        openedAt = now;
        currentBackoff = config.backoffFor(backoffExponent);
        consecutiveSuccesses = 0;
        trafficPercentage = config.getTrafficFloor();
        halfOpenInFlight = 0;
        generation++;
        stateTransitions++;
        log.warn("[CircuitBreaker:{}] OPEN after {} consecutive failures, backoff {}ms", name,
                consecutiveFailures, currentBackoff.toMillis());
    }

    private void transitionToHalfOpen() {
        state = CircuitState.HALF_OPEN;
        consecutiveSuccesses = 0;
        halfOpenInFlight = 0;
        trafficPercentage = config.getTrafficFloor();
        generation++;
        stateTransitions++;
        log.info("[CircuitBreaker:{}] HALF_OPEN, testing recovery with {} traffic", name,
                formatPercent(trafficPercentage));
    }

    private void transitionToClosed() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        openedAt = null;
        backoffExponent = 0;
        currentBackoff = config.getBaseBackoff();
        trafficPercentage = 1.0;
        halfOpenInFlight = 0;
        generation++;
        stateTransitions++;
        log.info("[CircuitBreaker:{}] CLOSED, dependency recovered", name);
    }

    private CircuitOpenException rejectLocked(Instant now, String message) {
        totalRejected++;
        Duration retryAfter = state == CircuitState.OPEN ? remainingBackoff(now) : Duration.ZERO;
        return new CircuitOpenException(name, state, retryAfter, message);
    }

    private boolean isBackoffElapsed(Instant now) {
        return openedAt == null || !now.isBefore(openedAt.plus(currentBackoff));
    }

    private Duration remainingBackoff(Instant now) {
        if (openedAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, openedAt.plus(currentBackoff));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private CircuitBreakerSnapshot snapshotLocked(Instant now) {
        Duration timeInOpen = state == CircuitState.OPEN && openedAt != null
                ? Duration.between(openedAt, now)
                : Duration.ZERO;
        return CircuitBreakerSnapshot.builder()
                .name(name)
                .state(state)
                .consecutiveFailures(consecutiveFailures)
                .consecutiveSuccesses(consecutiveSuccesses)
                .lastFailureTime(lastFailureTime)
                .openedAt(openedAt)
                .currentBackoffSeconds(currentBackoff.toNanos() / 1_000_000_000.0)
                .trafficPercentage(trafficPercentage)
                .totalCalls(totalCalls)
                .totalSuccesses(totalSuccesses)
                .totalFailures(totalFailures)
                .totalRejected(totalRejected)
                .stateTransitions(stateTransitions)
                .timeInOpenState(timeInOpen)
                .recentFailures(failureHistory.size())
                .build();
    }

    private static String formatPercent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
    }

    private record Permit(long generation, boolean probe) {
    }
}
