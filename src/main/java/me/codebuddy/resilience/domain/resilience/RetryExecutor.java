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

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Repeats an operation under a {@link RetryPolicy}.
 *
 * <p>
 * When an idempotency key is supplied and a live result is cached under it,
 * the cached result is returned without invoking the operation. Otherwise the
 * operation runs up to {@code maxAttempts} times, sleeping for the
 * {@link BackoffPolicy} delay between attempts. Non-retryable failures
 * propagate unchanged; when every attempt fails, a
 * {@link RetryExhaustedException} wrapping the last failure is thrown. A
 * successful result is stored under the key before it is returned.
 *
 * <p>
 * Concurrent calls with the same key share one execution: later callers wait
 * for the running call and receive its result or its failure.
 *
 * <p>
 * Keys are never derived implicitly. Use {@link IdempotencyKeys} when the
 * operation's arguments are stable.
 */
@Slf4j
public class RetryExecutor {

    private final String name;
    private final RetryPolicy policy;
    private final BackoffPolicy backoffPolicy;
    private final IdempotencyStore idempotencyStore;
    private final Sleeper sleeper;
    private final ResilienceMetricsPort metrics;
    private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public RetryExecutor(String name, RetryPolicy policy, BackoffPolicy backoffPolicy,
            IdempotencyStore idempotencyStore, Sleeper sleeper, ResilienceMetricsPort metrics) {
        this.name = name;
        this.policy = policy.validate();
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy must not be null");
        this.idempotencyStore = policy.isIdempotencyEnabled() ? idempotencyStore : null;
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
        this.metrics = metrics != null ? metrics : ResilienceMetricsPort.NOOP;
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        return execute(operation, null);
    }

    @SuppressWarnings("unchecked")
    public <T> T execute(Callable<T> operation, String idempotencyKey) throws Exception {
        Objects.requireNonNull(operation, "operation must not be null");
        boolean keyed = idempotencyStore != null && idempotencyKey != null && !idempotencyKey.isBlank();
        if (!keyed) {
            return attempt(operation);
        }

        Optional<Object> cached = idempotencyStore.find(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("[Retry:{}] Returning stored result for idempotency key {}", name, abbreviate(idempotencyKey));
            return (T) cached.get();
        }

        CompletableFuture<Object> own = new CompletableFuture<>();
        CompletableFuture<Object> running = inFlight.putIfAbsent(idempotencyKey, own);
        if (running != null) {
            log.debug("[Retry:{}] Joining in-flight call for idempotency key {}", name, abbreviate(idempotencyKey));
            return (T) join(running);
        }

        try {
            T result = attempt(operation);
            idempotencyStore.store(idempotencyKey, result);
            own.complete(result);
            return result;
        } catch (Throwable t) {
            own.completeExceptionally(t);
            throw t;
        } finally {
            inFlight.remove(idempotencyKey, own);
        }
    }

    private <T> T attempt(Callable<T> operation) throws Exception {
        int maxAttempts = policy.getMaxAttempts();
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                T result = operation.call();
                metrics.recordRetryAttempt(name, attempt, true);
                if (attempt > 1) {
                    log.info("[Retry:{}] Succeeded on attempt {}/{}", name, attempt, maxAttempts);
                }
                return result;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                metrics.recordRetryAttempt(name, attempt, false);
                if (!policy.isRetryable(e)) {
                    log.warn("[Retry:{}] Attempt {} failed with non-retryable {}: {}", name, attempt,
                            e.getClass().getSimpleName(), e.getMessage());
                    throw e;
                }
                lastFailure = e;
                if (attempt < maxAttempts) {
                    Duration delay = backoffPolicy.computeDelay(attempt);
                    log.warn("[Retry:{}] Attempt {}/{} failed: {}. Retrying in {}ms", name, attempt, maxAttempts,
                            e.getMessage(), delay.toMillis());
                    sleep(delay);
                }
            }
        }

        log.error("[Retry:{}] Failed after {} attempts", name, maxAttempts);
        throw new RetryExhaustedException(name, maxAttempts, lastFailure);
    }

    private static Object join(CompletableFuture<Object> running) throws Exception {
        try {
            return running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    public String getName() {
        return name;
    }

    /**
     * Idempotency store backing this executor, or {@code null} when
     * idempotency is disabled.
     */
    public IdempotencyStore getIdempotencyStore() {
        return idempotencyStore;
    }

    private void sleep(Duration delay) throws InterruptedException {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static String abbreviate(String key) {
        return key.length() > 16 ? key.substring(0, 16) + "..." : key;
    }
}
