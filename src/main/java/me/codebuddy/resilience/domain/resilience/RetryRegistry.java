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
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.DoubleSupplier;

/**
 * One {@link RetryExecutor}, and therefore one idempotency store, per
 * dependency name.
 */
@Slf4j
public class RetryRegistry extends AbstractPolicyRegistry<RetryPolicy, RetryExecutor> {

    private final Clock clock;
    private final DoubleSupplier random;
    private final Sleeper sleeper;
    private final ResilienceMetricsPort metrics;

    public RetryRegistry(RetryPolicy defaultPolicy, Clock clock, DoubleSupplier random, Sleeper sleeper,
            ResilienceMetricsPort metrics) {
        super(defaultPolicy.validate());
        this.clock = clock;
        this.random = random;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public <T> T execute(String dependencyName, Callable<T> operation, String idempotencyKey) throws Exception {
        return getOrCreate(dependencyName).execute(operation, idempotencyKey);
    }

    /**
     * Live result stored under the key by the dependency's executor.
     */
    public Optional<Object> findStoredResult(String dependencyName, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        IdempotencyStore store = getOrCreate(dependencyName).getIdempotencyStore();
        return store != null ? store.find(idempotencyKey) : Optional.empty();
    }

    /**
     * Evicts expired idempotency entries across all executors.
     *
     * @return number of evicted entries
     */
    public int cleanupIdempotency() {
        int evicted = 0;
        for (RetryExecutor executor : getAll().values()) {
            IdempotencyStore store = executor.getIdempotencyStore();
            if (store != null) {
                evicted += store.cleanup();
            }
        }
        return evicted;
    }

    @Override
    protected RetryExecutor create(String name, RetryPolicy policy) {
        log.debug("[RetryRegistry] Creating retry executor '{}' ({} attempts, {})", name, policy.getMaxAttempts(),
                policy.getStrategy());
        IdempotencyStore store = policy.isIdempotencyEnabled()
                ? new IdempotencyStore(policy.getIdempotencyTtl(), clock)
                : null;
        return new RetryExecutor(name, policy, BackoffPolicy.of(policy, random), store, sleeper, metrics);
    }
}
