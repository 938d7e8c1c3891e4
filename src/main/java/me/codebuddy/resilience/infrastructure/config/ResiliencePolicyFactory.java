package me.codebuddy.resilience.infrastructure.config;

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

import me.codebuddy.resilience.domain.resilience.BulkheadConfig;
import me.codebuddy.resilience.domain.resilience.CircuitBreakerConfig;
import me.codebuddy.resilience.domain.resilience.RetryPolicy;
import me.codebuddy.resilience.domain.resilience.TimeoutConfig;
import me.codebuddy.resilience.infrastructure.config.ResilienceProperties.DependencyProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds validated policy configurations from {@link ResilienceProperties},
 * merging per-dependency overrides onto the defaults.
 */
public class ResiliencePolicyFactory {

    private final ResilienceProperties properties;

    public ResiliencePolicyFactory(ResilienceProperties properties) {
        this.properties = properties;
    }

    public CircuitBreakerConfig circuitBreakerConfig(String dependencyName) {
        DependencyProperties o = override(dependencyName);
        DependencyProperties d = properties.getDefaults();
        return CircuitBreakerConfig.builder()
                .failureThreshold(pick(o.getFailureThreshold(), d.getFailureThreshold()))
                .successThreshold(pick(o.getSuccessThreshold(), d.getSuccessThreshold()))
                .baseBackoff(pick(o.getBaseBackoff(), d.getBaseBackoff()))
                .maxBackoff(pick(o.getMaxBackoff(), d.getMaxBackoff()))
                .backoffMultiplier(pick(o.getBackoffMultiplier(), d.getBackoffMultiplier()))
                .trafficFloor(pick(o.getTrafficFloor(), d.getTrafficFloor()))
                .trafficStep(pick(o.getTrafficStep(), d.getTrafficStep()))
                .halfOpenMaxCalls(pick(o.getHalfOpenMaxCalls(), d.getHalfOpenMaxCalls()))
                .excludedExceptions(resolveClasses(pick(o.getExcludedExceptions(), d.getExcludedExceptions())))
                .build()
                .validate();
    }

    public BulkheadConfig bulkheadConfig(String dependencyName) {
        DependencyProperties o = override(dependencyName);
        DependencyProperties d = properties.getDefaults();
        return BulkheadConfig.builder()
                .capacity(pick(o.getBulkheadCapacity(), d.getBulkheadCapacity()))
                .queueCapacity(pick(o.getQueueCapacity(), d.getQueueCapacity()))
                .queueTimeout(pick(o.getQueueTimeout(), d.getQueueTimeout()))
                .build()
                .validate();
    }

    public RetryPolicy retryPolicy(String dependencyName) {
        DependencyProperties o = override(dependencyName);
        DependencyProperties d = properties.getDefaults();
        return RetryPolicy.builder()
                .maxAttempts(pick(o.getMaxAttempts(), d.getMaxAttempts()))
                .baseDelay(pick(o.getRetryBaseDelay(), d.getRetryBaseDelay()))
                .maxDelay(pick(o.getRetryMaxDelay(), d.getRetryMaxDelay()))
                .multiplier(pick(o.getRetryMultiplier(), d.getRetryMultiplier()))
                .strategy(pick(o.getRetryStrategy(), d.getRetryStrategy()))
                .jitterRatio(pick(o.getJitterRatio(), d.getJitterRatio()))
                .retryableExceptions(resolveClasses(pick(o.getRetryableExceptions(), d.getRetryableExceptions())))
                .nonRetryableExceptions(
                        resolveClasses(pick(o.getNonRetryableExceptions(), d.getNonRetryableExceptions())))
                .idempotencyEnabled(pick(o.getIdempotencyEnabled(), d.getIdempotencyEnabled()))
                .idempotencyTtl(pick(o.getIdempotencyTtl(), d.getIdempotencyTtl()))
                .build()
                .validate();
    }

    public TimeoutConfig timeoutConfig(String dependencyName) {
        DependencyProperties o = override(dependencyName);
        DependencyProperties d = properties.getDefaults();
        return TimeoutConfig.builder()
                .defaultTimeout(pick(o.getDefaultTimeout(), d.getDefaultTimeout()))
                .minTimeout(pick(o.getMinTimeout(), d.getMinTimeout()))
                .maxTimeout(pick(o.getMaxTimeout(), d.getMaxTimeout()))
                .historySize(pick(o.getHistorySize(), d.getHistorySize()))
                .cascadeRatio(pick(o.getCascadeRatio(), d.getCascadeRatio()))
                .build()
                .validate();
    }

    private DependencyProperties override(String dependencyName) {
        if (dependencyName == null) {
            return new DependencyProperties();
        }
        DependencyProperties props = properties.getDependencies().get(dependencyName);
        return props != null ? props : new DependencyProperties();
    }

    private static <T> T pick(T override, T fallback) {
        if (override != null) {
            return override;
        }
        if (fallback == null) {
            throw new IllegalStateException("resilience.defaults is missing a required value");
        }
        return fallback;
    }

    static Set<Class<? extends Throwable>> resolveClasses(List<String> classNames) {
        Set<Class<? extends Throwable>> classes = new LinkedHashSet<>();
        if (classNames == null) {
            return classes;
        }
        for (String className : classNames) {
            if (className == null || className.isBlank()) {
                continue;
            }
            try {
                Class<?> type = Class.forName(className.trim());
                if (!Throwable.class.isAssignableFrom(type)) {
                    throw new IllegalStateException(className + " is not a Throwable");
                }
                classes.add(type.asSubclass(Throwable.class));
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException("Unknown exception class in resilience configuration: " + className,
                        e);
            }
        }
        return classes;
    }
}
