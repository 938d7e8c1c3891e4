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
import me.codebuddy.resilience.domain.model.TimeoutOutcome;
import me.codebuddy.resilience.domain.model.TimeoutRecord;
import me.codebuddy.resilience.domain.model.TimeoutStats;
import me.codebuddy.resilience.port.outbound.ResilienceMetricsPort;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds how long callers wait for one dependency and keeps its recent call
 * durations.
 *
 * <p>
 * The operation runs on the supplied executor while the caller waits on the
 * returned future. On timeout the future is abandoned, not cancelled: the
 * operation keeps running and is responsible for its own cancellation.
 *
 * <p>
 * Every completed wait (success, failure or timeout) appends a
 * {@link TimeoutRecord} to a bounded history used by
 * {@link #detectCascadingTimeouts(int)}. The history is diagnostic only.
 */
@Slf4j
public class TimeoutPolicy {

    private static final int RECENT_RECORDS = 10;
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final String name;
    private final TimeoutConfig config;
    private final ExecutorService executor;
    private final Clock clock;
    private final ResilienceMetricsPort metrics;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<TimeoutRecord> history = new ArrayDeque<>();
    private final AtomicInteger activeCalls = new AtomicInteger();

    private long totalCalls;
    private long totalTimeouts;
    private double totalDurationSeconds;

    public TimeoutPolicy(String name, TimeoutConfig config, ExecutorService executor, Clock clock,
            ResilienceMetricsPort metrics) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = config.validate();
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = metrics != null ? metrics : ResilienceMetricsPort.NOOP;
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        return execute(operation, null);
    }

    /**
     * Runs the operation, waiting at most the effective timeout.
     *
     * @param timeoutOverride
     *            optional per-call timeout, clamped to the configured bounds
     * @throws OperationTimeoutException
     *             if the operation did not complete in time
     */
    public <T> T execute(Callable<T> operation, Duration timeoutOverride) throws Exception {
        Objects.requireNonNull(operation, "operation must not be null");
        Duration timeout = config.resolve(timeoutOverride);
        long startNanos = System.nanoTime();
        Future<T> future = executor.submit(operation);
        activeCalls.incrementAndGet();
        try {
            T result = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            long elapsedNanos = System.nanoTime() - startNanos;
            record(elapsedNanos, timeout, TimeoutOutcome.SUCCESS);
            if (elapsedNanos > timeout.toNanos() * config.getSlowCallRatio()) {
                log.warn("[Timeout:{}] Call took {}ms, over {}% of its {}ms timeout. Potential cascading timeout",
                        name, TimeUnit.NANOSECONDS.toMillis(elapsedNanos),
                        Math.round(config.getSlowCallRatio() * 100), timeout.toMillis());
            }
            return result;
        } catch (ExecutionException e) {
            record(System.nanoTime() - startNanos, timeout, TimeoutOutcome.FAILURE);
            throw unwrap(e);
        } catch (TimeoutException e) {
            record(System.nanoTime() - startNanos, timeout, TimeoutOutcome.TIMEOUT);
            log.error("[Timeout:{}] Timed out after {}ms", name, timeout.toMillis());
            throw new OperationTimeoutException(name, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } finally {
            activeCalls.decrementAndGet();
        }
    }

    /**
     * Whether the most recent {@code windowSize} durations rise monotonically
     * and the last one exceeds the first by more than the cascade ratio.
     */
    public boolean detectCascadingTimeouts(int windowSize) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2, got " + windowSize);
        }
        lock.lock();
        try {
            if (history.size() < windowSize) {
                return false;
            }
            List<TimeoutRecord> records = new ArrayList<>(history);
            List<TimeoutRecord> window = records.subList(records.size() - windowSize, records.size());
            double previous = window.get(0).observedDurationSeconds();
            for (int i = 1; i < window.size(); i++) {
                double current = window.get(i).observedDurationSeconds();
                if (current < previous) {
                    return false;
                }
                previous = current;
            }
            double first = window.get(0).observedDurationSeconds();
            double last = window.get(window.size() - 1).observedDurationSeconds();
            return last > first * config.getCascadeRatio();
        } finally {
            lock.unlock();
        }
    }

    public List<TimeoutRecord> getHistory() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public TimeoutStats getStats() {
        lock.lock();
        try {
            List<TimeoutRecord> records = new ArrayList<>(history);
            List<TimeoutRecord> recent = records.subList(Math.max(0, records.size() - RECENT_RECORDS),
                    records.size());
            return TimeoutStats.builder()
                    .dependencyName(name)
                    .defaultTimeout(config.getDefaultTimeout())
                    .totalCalls(totalCalls)
                    .totalTimeouts(totalTimeouts)
                    .activeCalls(activeCalls.get())
                    .averageDurationSeconds(totalCalls > 0 ? totalDurationSeconds / totalCalls : 0.0)
                    .recentRecords(List.copyOf(recent))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public TimeoutConfig getConfig() {
        return config;
    }

    private void record(long elapsedNanos, Duration timeout, TimeoutOutcome outcome) {
        TimeoutRecord timeoutRecord = TimeoutRecord.builder()
                .dependencyName(name)
                .observedDurationSeconds(elapsedNanos / NANOS_PER_SECOND)
                .configuredTimeoutSeconds(timeout.toNanos() / NANOS_PER_SECOND)
                .outcome(outcome)
                .timestamp(clock.instant())
                .build();
        lock.lock();
        try {
            totalCalls++;
            totalDurationSeconds += timeoutRecord.observedDurationSeconds();
            if (outcome == TimeoutOutcome.TIMEOUT) {
                totalTimeouts++;
            }
            history.addLast(timeoutRecord);
            while (history.size() > config.getHistorySize()) {
                history.removeFirst();
            }
        } finally {
            lock.unlock();
        }
        metrics.recordTimeoutCall(timeoutRecord);
    }

    private static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception exception) {
            return exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return e;
    }
}
