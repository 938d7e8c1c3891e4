package me.codebuddy.resilience.domain.service;

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
import me.codebuddy.resilience.domain.model.ProtectOptions;
import me.codebuddy.resilience.domain.model.ResilienceLayer;
import me.codebuddy.resilience.domain.resilience.BulkheadRegistry;
import me.codebuddy.resilience.domain.resilience.CircuitBreakerRegistry;
import me.codebuddy.resilience.domain.resilience.RetryRegistry;
import me.codebuddy.resilience.domain.resilience.TimeoutRegistry;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Entry point for outbound calls to named dependencies.
 *
 * <p>
 * {@link #protect(String, Callable, ProtectOptions)} wraps the operation in
 * the configured layers, outermost first. The default composition is
 * bulkhead, circuit breaker, timeout, retry: the bulkhead admits the caller,
 * the breaker gates the call, the timeout bounds the whole retried unit and
 * retry repeats the innermost attempt.
 *
 * <p>
 * Failures raised by a layer ({@code BulkheadFullException},
 * {@code CircuitOpenException}, {@code OperationTimeoutException},
 * {@code RetryExhaustedException}) and failures of the operation propagate to
 * the caller unchanged.
 *
 * <p>
 * When the composition includes retry and the call carries an idempotency key
 * with a live stored result, that result is returned before any layer runs.
 * Such a call is not admitted by the bulkhead and is not an outcome for the
 * circuit breaker.
 */
@Slf4j
public class ResilienceService {

    public static final List<ResilienceLayer> DEFAULT_COMPOSITION = List.of(
            ResilienceLayer.BULKHEAD,
            ResilienceLayer.CIRCUIT_BREAKER,
            ResilienceLayer.TIMEOUT,
            ResilienceLayer.RETRY);

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final BulkheadRegistry bulkheadRegistry;
    private final TimeoutRegistry timeoutRegistry;
    private final RetryRegistry retryRegistry;
    private final List<ResilienceLayer> composition;

    public ResilienceService(CircuitBreakerRegistry circuitBreakerRegistry, BulkheadRegistry bulkheadRegistry,
            TimeoutRegistry timeoutRegistry, RetryRegistry retryRegistry, List<ResilienceLayer> composition) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.bulkheadRegistry = bulkheadRegistry;
        this.timeoutRegistry = timeoutRegistry;
        this.retryRegistry = retryRegistry;
        this.composition = validateComposition(composition);
        log.info("[Resilience] Layer composition: {}", this.composition);
    }

    public <T> T protect(String dependencyName, Callable<T> operation) throws Exception {
        return protect(dependencyName, operation, ProtectOptions.none());
    }

    @SuppressWarnings("unchecked")
    public <T> T protect(String dependencyName, Callable<T> operation, ProtectOptions options) throws Exception {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependency name must not be blank");
        }
        Objects.requireNonNull(operation, "operation must not be null");
        ProtectOptions safeOptions = options != null ? options : ProtectOptions.none();

        if (composition.contains(ResilienceLayer.RETRY)) {
            Optional<Object> stored = retryRegistry.findStoredResult(dependencyName, safeOptions.idempotencyKey());
            if (stored.isPresent()) {
                log.debug("[Resilience] Serving stored result for {} without calling the dependency",
                        dependencyName);
                return (T) stored.get();
            }
        }

        Callable<T> chain = operation;
        for (int i = composition.size() - 1; i >= 0; i--) {
            chain = wrap(composition.get(i), dependencyName, chain, safeOptions);
        }
        return chain.call();
    }

    public List<ResilienceLayer> getComposition() {
        return composition;
    }

    private <T> Callable<T> wrap(ResilienceLayer layer, String dependencyName, Callable<T> inner,
            ProtectOptions options) {
        return switch (layer) {
        case BULKHEAD -> () -> bulkheadRegistry.execute(dependencyName, inner);
        case CIRCUIT_BREAKER -> () -> circuitBreakerRegistry.call(dependencyName, inner);
        case TIMEOUT -> () -> timeoutRegistry.execute(dependencyName, inner, options.timeout());
        case RETRY -> () -> retryRegistry.execute(dependencyName, inner, options.idempotencyKey());
        };
    }

    private static List<ResilienceLayer> validateComposition(List<ResilienceLayer> composition) {
        if (composition == null || composition.isEmpty()) {
            return DEFAULT_COMPOSITION;
        }
        Set<ResilienceLayer> seen = EnumSet.noneOf(ResilienceLayer.class);
        for (ResilienceLayer layer : composition) {
            if (layer == null || !seen.add(layer)) {
                throw new IllegalArgumentException("composition must list each layer at most once: " + composition);
            }
        }
        return List.copyOf(composition);
    }
}
