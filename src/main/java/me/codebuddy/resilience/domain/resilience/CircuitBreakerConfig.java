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
import java.util.Set;

/**
 * Circuit breaker configuration for one dependency.
 */
@Value
@Builder(toBuilder = true)
public class CircuitBreakerConfig {

    @Builder.Default
    int failureThreshold = 5;

    @Builder.Default
    int successThreshold = 2;

    @Builder.Default
    Duration baseBackoff = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(300);

    @Builder.Default
    double backoffMultiplier = 2.0;

    /**
     * Share of calls admitted right after entering half-open.
     */
    @Builder.Default
    double trafficFloor = 0.1;

    /**
     * Linear increase of the admitted share per half-open success.
     */
    @Builder.Default
    double trafficStep = 0.1;

    /**
     * Hard cap on concurrently outstanding half-open probes.
     */
    @Builder.Default
    int halfOpenMaxCalls = 1;

    /**
     * Failures that are rethrown without counting against the breaker.
     */
    @Builder.Default
    Set<Class<? extends Throwable>> excludedExceptions = Set.of();

    @Builder.Default
    int failureHistorySize = 100;

    public static CircuitBreakerConfig defaults() {
        return CircuitBreakerConfig.builder().build();
    }

    public boolean isExcluded(Throwable failure) {
        return ExceptionMatcher.matchesAny(failure, excludedExceptions);
    }

    /**
     * Backoff after the given number of consecutive re-openings since the last
     * full recovery: {@code min(maxBackoff, baseBackoff * multiplier^exponent)}.
     */
    public Duration backoffFor(int exponent) {
        double nanos = baseBackoff.toNanos() * Math.pow(backoffMultiplier, exponent);
        double capped = Math.min(nanos, maxBackoff.toNanos());
        return Duration.ofNanos(Math.round(capped));
    }

    public CircuitBreakerConfig validate() {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, got " + successThreshold);
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1, got " + halfOpenMaxCalls);
        }
        if (baseBackoff == null || baseBackoff.isNegative() || maxBackoff == null || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff durations must be non-negative");
        }
        if (baseBackoff.compareTo(maxBackoff) > 0) {
            throw new IllegalArgumentException("baseBackoff must not exceed maxBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got " + backoffMultiplier);
        }
        if (trafficFloor <= 0.0 || trafficFloor > 1.0) {
            throw new IllegalArgumentException("trafficFloor must be within (0, 1], got " + trafficFloor);
        }
        if (trafficStep < 0.0 || trafficStep > 1.0) {
            throw new IllegalArgumentException("trafficStep must be within [0, 1], got " + trafficStep);
        }
        if (failureHistorySize < 1) {
            throw new IllegalArgumentException("failureHistorySize must be >= 1, got " + failureHistorySize);
        }
        return this;
    }
}
