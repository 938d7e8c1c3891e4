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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bulkhead configuration for one resource pool.
 */
@Value
@Builder(toBuilder = true)
public class BulkheadConfig {

    @Builder.Default
    int capacity = 10;

    @Builder.Default
    int queueCapacity = 100;

    /**
     * Maximum wait for a slot. Zero rejects immediately when the pool is full.
     */
    @Builder.Default
    Duration queueTimeout = Duration.ofSeconds(30);

    public static BulkheadConfig defaults() {
        return BulkheadConfig.builder().build();
    }

    public BulkheadConfig validate() {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must be >= 0, got " + queueCapacity);
        }
        if (queueTimeout == null || queueTimeout.isNegative()) {
            throw new IllegalArgumentException("queueTimeout must be a non-negative duration");
        }
        return this;
    }
}
