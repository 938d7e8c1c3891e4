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
 * Timeout configuration for one dependency.
 */
@Value
@Builder(toBuilder = true)
public class TimeoutConfig {

    @Builder.Default
    Duration defaultTimeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration minTimeout = Duration.ofMillis(100);

    @Builder.Default
    Duration maxTimeout = Duration.ofSeconds(300);

    /**
     * Number of duration records kept per dependency.
     */
    @Builder.Default
    int historySize = 100;

    /**
     * Growth across a window, last over first, that flags cascading timeouts.
     */
    @Builder.Default
    double cascadeRatio = 1.5;

    /**
     * Share of the timeout above which a successful call is logged as slow.
     */
    @Builder.Default
    double slowCallRatio = 0.9;

    public static TimeoutConfig defaults() {
        return TimeoutConfig.builder().build();
    }

    /**
     * Effective timeout: the override if given, else the default, clamped to
     * {@code [minTimeout, maxTimeout]}.
     */
    public Duration resolve(Duration override) {
        Duration requested = override != null ? override : defaultTimeout;
        if (requested.compareTo(minTimeout) < 0) {
            return minTimeout;
        }
        if (requested.compareTo(maxTimeout) > 0) {
            return maxTimeout;
        }
        return requested;
    }

    public TimeoutConfig validate() {
        if (defaultTimeout == null || minTimeout == null || maxTimeout == null) {
            throw new IllegalArgumentException("timeouts must not be null");
        }
        if (minTimeout.isNegative() || minTimeout.isZero()) {
            throw new IllegalArgumentException("minTimeout must be positive");
        }
        if (minTimeout.compareTo(maxTimeout) > 0) {
            throw new IllegalArgumentException("minTimeout must not exceed maxTimeout");
        }
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1, got " + historySize);
        }
        if (cascadeRatio < 1.0) {
            throw new IllegalArgumentException("cascadeRatio must be >= 1.0, got " + cascadeRatio);
        }
        if (slowCallRatio <= 0.0 || slowCallRatio > 1.0) {
            throw new IllegalArgumentException("slowCallRatio must be within (0, 1], got " + slowCallRatio);
        }
        return this;
    }
}
