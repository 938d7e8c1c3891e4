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
import java.util.concurrent.Callable;
import java.util.function.DoubleSupplier;

/**
 * One {@link CircuitBreaker} per dependency name.
 */
@Slf4j
public class CircuitBreakerRegistry extends AbstractPolicyRegistry<CircuitBreakerConfig, CircuitBreaker> {

    private final Clock clock;
    private final DoubleSupplier random;
    private final ResilienceMetricsPort metrics;

    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Clock clock, DoubleSupplier random,
            ResilienceMetricsPort metrics) {
        super(defaultConfig.validate());
        this.clock = clock;
        this.random = random;
        this.metrics = metrics;
    }

    public <T> T call(String dependencyName, Callable<T> operation) throws Exception {
        return getOrCreate(dependencyName).call(operation);
    }

    /**
     * Resets the breaker for the name if it exists.
     *
     * @return whether a breaker was reset
     */
    public boolean reset(String dependencyName) {
        return find(dependencyName)
                .map(breaker -> {
                    breaker.reset();
                    return true;
                })
                .orElse(false);
    }

    public void resetAll() {
        log.info("[CircuitBreakerRegistry] Resetting {} circuit breakers", getAll().size());
        getAll().values().forEach(CircuitBreaker::reset);
    }

    @Override
    protected CircuitBreaker create(String name, CircuitBreakerConfig config) {
        log.debug("[CircuitBreakerRegistry] Creating circuit breaker '{}'", name);
        return new CircuitBreaker(name, config, clock, random, metrics);
    }
}
