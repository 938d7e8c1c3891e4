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
import me.codebuddy.resilience.domain.model.RetryStrategy;

import java.time.Duration;
import java.util.Set;

/**
 * Retry configuration for one dependency.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(60);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    RetryStrategy strategy = RetryStrategy.EXPONENTIAL;

    @Builder.Default
    double jitterRatio = 0.1;

    /**
     * Failures that may be retried. Empty means every failure.
     */
    @Builder.Default
    Set<Class<? extends Throwable>> retryableExceptions = Set.of(Exception.class);

    /**
     * Failures that abort immediately. Takes precedence over
     * {@link #retryableExceptions}.
     */
    @Builder.Default
    Set<Class<? extends Throwable>> nonRetryableExceptions = Set.of();

    @Builder.Default
    boolean idempotencyEnabled = true;

    @Builder.Default
    Duration idempotencyTtl = Duration.ofHours(1);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public boolean isRetryable(Throwable failure) {
        if (ExceptionMatcher.matchesAny(failure, nonRetryableExceptions)) {
            return false;
        }
        if (retryableExceptions == null || retryableExceptions.isEmpty()) {
            return true;
        }
        return ExceptionMatcher.matchesAny(failure, retryableExceptions);
    }

    public RetryPolicy validate() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        requireNonNegative(baseDelay, "baseDelay");
        requireNonNegative(maxDelay, "maxDelay");
        requireNonNegative(idempotencyTtl, "idempotencyTtl");
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        if (jitterRatio < 0.0 || jitterRatio > 1.0) {
            throw new IllegalArgumentException("jitterRatio must be within [0, 1], got " + jitterRatio);
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy must not be null");
        }
        return this;
    }

    private static void requireNonNegative(Duration value, String field) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be a non-negative duration");
        }
    }
}
