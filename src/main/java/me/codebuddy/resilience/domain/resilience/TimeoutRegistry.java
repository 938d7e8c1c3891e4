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
import me.codebuddy.resilience.port.outbound.ResilienceMetricsPort;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One {@link TimeoutPolicy} per dependency name, sharing a daemon executor
 * that runs the bounded operations.
 */
@Slf4j
public class TimeoutRegistry extends AbstractPolicyRegistry<TimeoutConfig, TimeoutPolicy> {

    private final Clock clock;
    private final ResilienceMetricsPort metrics;
    private final ExecutorService executor;

    public TimeoutRegistry(TimeoutConfig defaultConfig, Clock clock, ResilienceMetricsPort metrics) {
        this(defaultConfig, clock, metrics, newDaemonExecutor());
    }

    public TimeoutRegistry(TimeoutConfig defaultConfig, Clock clock, ResilienceMetricsPort metrics,
            ExecutorService executor) {
        super(defaultConfig.validate());
        this.clock = clock;
        this.metrics = metrics;
        this.executor = executor;
    }

    public <T> T execute(String dependencyName, Callable<T> operation) throws Exception {
        return getOrCreate(dependencyName).execute(operation, null);
    }

    public <T> T execute(String dependencyName, Callable<T> operation, Duration timeoutOverride) throws Exception {
        return getOrCreate(dependencyName).execute(operation, timeoutOverride);
    }

    /**
     * Cascading-timeout signal for a dependency; {@code false} for unknown
     * names.
     */
    public boolean detectCascadingTimeouts(String dependencyName, int windowSize) {
        return find(dependencyName)
                .map(policy -> policy.detectCascadingTimeouts(windowSize))
                .orElse(false);
    }

    public void shutdown() {
        log.info("[TimeoutRegistry] Shutting down timeout executor");
        executor.shutdownNow();
        try {
            executor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    protected TimeoutPolicy create(String name, TimeoutConfig config) {
        log.debug("[TimeoutRegistry] Creating timeout policy '{}' (default {}ms)", name,
                config.getDefaultTimeout().toMillis());
        return new TimeoutPolicy(name, config, executor, clock, metrics);
    }

    private static ExecutorService newDaemonExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "resilience-timeout-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
