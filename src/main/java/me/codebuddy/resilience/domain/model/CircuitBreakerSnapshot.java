package me.codebuddy.resilience.domain.model;

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

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a single circuit breaker.
 */
@Builder
public record CircuitBreakerSnapshot(
        String name,
        CircuitState state,
        int consecutiveFailures,
        int consecutiveSuccesses,
        Instant lastFailureTime,
        Instant openedAt,
        double currentBackoffSeconds,
        double trafficPercentage,
        long totalCalls,
        long totalSuccesses,
        long totalFailures,
        long totalRejected,
        long stateTransitions,
        Duration timeInOpenState,
        int recentFailures) {
}
