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
import me.codebuddy.resilience.domain.model.BulkheadSnapshot;
import me.codebuddy.resilience.port.outbound.ResilienceMetricsPort;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission gate bounding concurrent operations of one resource pool.
 *
 * <p>
 * Up to {@code capacity} operations run at once. Further callers wait in a
 * FIFO queue of at most {@code queueCapacity} entries for up to
 * {@code queueTimeout}; a released slot is handed directly to the oldest
 * waiter. Callers that find the queue full, or whose wait expires, get a
 * {@link BulkheadFullException}.
 *
 * <p>
 * The lock guards only the counters and the queue. Waiting releases it, and
 * the operation runs without it.
 */
@Slf4j
public class Bulkhead {

    private final String poolName;
    private final BulkheadConfig config;
    private final ResilienceMetricsPort metrics;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Waiter> waiters = new ArrayDeque<>();

    private int activeCount;
    private long totalAdmitted;
    private long totalRejected;
    private long queueTimeouts;

    public Bulkhead(String poolName, BulkheadConfig config, ResilienceMetricsPort metrics) {
        this.poolName = Objects.requireNonNull(poolName, "poolName must not be null");
        this.config = config.validate();
        this.metrics = metrics != null ? metrics : ResilienceMetricsPort.NOOP;
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation must not be null");
        acquire();
        try {
            return operation.call();
        } finally {
            release();
        }
    }

    /**
     * Takes a slot, waiting in the queue if needed.
     *
     * @throws BulkheadFullException
     *             if the queue is full or the wait timed out
     * @throws InterruptedException
     *             if interrupted while queued
     */
    void acquire() throws InterruptedException {
        BulkheadFullException rejection = null;
        BulkheadSnapshot snapshot;

        lock.lock();
        try {
            if (activeCount < config.getCapacity() && waiters.isEmpty()) {
                activeCount++;
                totalAdmitted++;
            } else if (config.getQueueTimeout().isZero() || waiters.size() >= config.getQueueCapacity()) {
                totalRejected++;
                rejection = new BulkheadFullException(poolName, config.getCapacity(), config.getQueueCapacity(),
                        false, "Bulkhead " + poolName + " is at capacity (" + config.getCapacity()
                                + " active, " + waiters.size() + " queued)");
            } else {
                rejection = awaitSlotLocked();
            }
            snapshot = snapshotLocked();
        } finally {
            lock.unlock();
        }

        metrics.recordBulkheadState(snapshot);
        if (rejection != null) {
            log.debug("[Bulkhead:{}] {}", poolName, rejection.getMessage());
            metrics.recordBulkheadRejection(poolName);
            throw rejection;
        }
    }

    /**
     * Frees a slot, handing it to the oldest waiter if there is one.
     */
    void release() {
        BulkheadSnapshot snapshot;
        lock.lock();
        try {
            releaseLocked();
            snapshot = snapshotLocked();
        } finally {
            lock.unlock();
        }
        metrics.recordBulkheadState(snapshot);
    }

    public BulkheadSnapshot getSnapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public String getPoolName() {
        return poolName;
    }

    public BulkheadConfig getConfig() {
        return config;
    }

    private BulkheadFullException awaitSlotLocked() throws InterruptedException {
        Waiter waiter = new Waiter(lock.newCondition());
        waiters.addLast(waiter);
        long remainingNanos = config.getQueueTimeout().toNanos();
        try {
            while (!waiter.admitted) {
                if (remainingNanos <= 0L) {
                    waiters.remove(waiter);
                    totalRejected++;
                    queueTimeouts++;
                    return new BulkheadFullException(poolName, config.getCapacity(), config.getQueueCapacity(),
                            true, "Bulkhead " + poolName + " queue timeout after "
                                    + config.getQueueTimeout().toMillis() + "ms");
                }
                remainingNanos = waiter.condition.awaitNanos(remainingNanos);
            }
            return null;
        } catch (InterruptedException e) {
            if (waiter.admitted) {
                releaseLocked();
            } else {
                waiters.remove(waiter);
            }
            throw e;
        }
    }

    private void releaseLocked() {
        Waiter next = waiters.pollFirst();
        if (next != null) {
            next.admitted = true;
            totalAdmitted++;
            next.condition.signal();
        } else if (activeCount > 0) {
            activeCount--;
        }
    }

    private BulkheadSnapshot snapshotLocked() {
        return BulkheadSnapshot.builder()
                .poolName(poolName)
                .capacity(config.getCapacity())
                .queueCapacity(config.getQueueCapacity())
                .activeCount(activeCount)
                .queuedCount(waiters.size())
                .totalAdmitted(totalAdmitted)
                .totalRejected(totalRejected)
                .queueTimeouts(queueTimeouts)
                .build();
    }

    private static final class Waiter {
        private final Condition condition;
        private boolean admitted;

        private Waiter(Condition condition) {
            this.condition = condition;
        }
    }
}
