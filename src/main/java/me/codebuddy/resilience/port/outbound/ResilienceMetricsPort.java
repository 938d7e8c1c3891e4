package me.codebuddy.resilience.port.outbound;

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

import me.codebuddy.resilience.domain.model.BulkheadSnapshot;
import me.codebuddy.resilience.domain.model.CircuitBreakerSnapshot;
import me.codebuddy.resilience.domain.model.CircuitState;
import me.codebuddy.resilience.domain.model.TimeoutRecord;

/**
 * Observability collaborator notified by the resilience toolkit.
 *
 * <p>
 * Implementations are invoked on the calling thread, never while a policy
 * lock is held, and must not block.
 *
 * @see me.codebuddy.resilience.adapter.outbound.metrics.MicrometerResilienceMetrics
 */
public interface ResilienceMetricsPort {

    ResilienceMetricsPort NOOP = new ResilienceMetricsPort() {
    };

    /**
     * A call was evaluated by a breaker in the given state.
     */
    default void recordCircuitBreakerCall(String dependencyName, CircuitState state) {
    }

    /**
     * A call was rejected without invoking the operation.
     */
    default void recordCircuitBreakerRejection(String dependencyName, CircuitState state) {
    }

    /**
     * A call failed and counted against the breaker.
     */
    default void recordCircuitBreakerFailure(String dependencyName) {
    }

    /**
     * Breaker state after a transition or a recorded outcome.
     */
    default void recordCircuitBreakerState(CircuitBreakerSnapshot snapshot) {
    }

    default void recordBulkheadState(BulkheadSnapshot snapshot) {
    }

    default void recordBulkheadRejection(String poolName) {
    }

    /**
     * A call bounded by the timeout layer completed, failed or timed out.
     */
    default void recordTimeoutCall(TimeoutRecord timeoutRecord) {
    }

    default void recordRetryAttempt(String dependencyName, int attempt, boolean succeeded) {
    }
}
