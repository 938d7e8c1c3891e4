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

import me.codebuddy.resilience.domain.model.RetryStrategy;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Delay-before-retry calculation.
 *
 * <p>
 * The raw delay for attempt {@code n} (1-based, the attempt that just failed)
 * is:
 * <ul>
 * <li>{@link RetryStrategy#EXPONENTIAL}: {@code base * multiplier^(n-1)}</li>
 * <li>{@link RetryStrategy#LINEAR}: {@code base * n}</li>
 * <li>{@link RetryStrategy#FIXED}: {@code base}</li>
 * </ul>
 * It is clamped to {@code maxDelay}, then perturbed by a symmetric jitter of
 * up to {@code delay * jitterRatio} in either direction and floored at zero.
 */
public class BackoffPolicy {

    private final RetryStrategy strategy;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public BackoffPolicy(RetryStrategy strategy, Duration baseDelay, Duration maxDelay, double multiplier,
            double jitterRatio, DoubleSupplier random) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        this.multiplier = multiplier;
        this.jitterRatio = jitterRatio;
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public static BackoffPolicy of(RetryPolicy policy, DoubleSupplier random) {
        return new BackoffPolicy(policy.getStrategy(), policy.getBaseDelay(), policy.getMaxDelay(),
                policy.getMultiplier(), policy.getJitterRatio(), random);
    }

    /**
     * Delay to wait after the given failed attempt, jitter included.
     */
    public Duration computeDelay(int attempt) {
        double delayNanos = clampedDelayNanos(attempt);
        if (jitterRatio > 0) {
            double amount = delayNanos * jitterRatio;
            double offset = (random.getAsDouble() * 2.0 - 1.0) * amount;
            delayNanos = Math.max(0.0, delayNanos + offset);
        }
        return Duration.ofNanos(Math.round(delayNanos));
    }

    /**
     * Delay for the given attempt before jitter is applied.
     */
    public Duration computeBaseDelay(int attempt) {
        return Duration.ofNanos(Math.round(clampedDelayNanos(attempt)));
    }

    private double clampedDelayNanos(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        double base = baseDelay.toNanos();
        double raw = switch (strategy) {
        case EXPONENTIAL -> base * Math.pow(multiplier, attempt - 1.0);
        case LINEAR -> base * attempt;
        case FIXED -> base;
        };
        return Math.min(raw, maxDelay.toNanos());
    }
}
