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

/**
 * The pool was at capacity and the caller could not be queued, or waited
 * longer than the queue timeout.
 */
public class BulkheadFullException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    private final int capacity;
    private final int queueCapacity;
    private final boolean queueTimedOut;

    public BulkheadFullException(String poolName, int capacity, int queueCapacity, boolean queueTimedOut,
            String message) {
        super(poolName, message);
        this.capacity = capacity;
        this.queueCapacity = queueCapacity;
        this.queueTimedOut = queueTimedOut;
    }

    public String getPoolName() {
        return getDependencyName();
    }

    public int getCapacity() {
        return capacity;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public boolean isQueueTimedOut() {
        return queueTimedOut;
    }
}
