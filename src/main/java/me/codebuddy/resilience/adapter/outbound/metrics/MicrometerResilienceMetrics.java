package me.codebuddy.resilience.adapter.outbound.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import me.codebuddy.resilience.domain.model.BulkheadSnapshot;
import me.codebuddy.resilience.domain.model.CircuitBreakerSnapshot;
import me.codebuddy.resilience.domain.model.CircuitState;
import me.codebuddy.resilience.domain.model.TimeoutOutcome;
import me.codebuddy.resilience.domain.model.TimeoutRecord;
import me.codebuddy.resilience.port.outbound.ResilienceMetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes resilience toolkit state to a Micrometer {@link MeterRegistry}.
 *
 * <p>
 * Gauges are registered once per dependency and backed by atomics updated
 * from snapshots; counters and timers are looked up per event.
 */
@Component
@Slf4j
public class MicrometerResilienceMetrics implements ResilienceMetricsPort {

    private static final String DEPENDENCY = "dependency";
    private static final String POOL = "pool";

    private final MeterRegistry meterRegistry;
    private final Map<String, BreakerGauges> breakerGauges = new ConcurrentHashMap<>();
    private final Map<String, BulkheadGauges> bulkheadGauges = new ConcurrentHashMap<>();

    public MicrometerResilienceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    @Override
    public void recordCircuitBreakerCall(String dependencyName, CircuitState state) {
        Counter.builder("resilience.circuit_breaker.calls")
                .description("Calls evaluated by a circuit breaker")
                .tags(Tags.of(DEPENDENCY, dependencyName, "state", stateTag(state)))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordCircuitBreakerRejection(String dependencyName, CircuitState state) {
        Counter.builder("resilience.circuit_breaker.rejections")
                .description("Calls rejected without invoking the operation")
                .tags(Tags.of(DEPENDENCY, dependencyName, "state", stateTag(state)))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordCircuitBreakerFailure(String dependencyName) {
        Counter.builder("resilience.circuit_breaker.failures")
                .description("Failures counted by a circuit breaker")
                .tags(Tags.of(DEPENDENCY, dependencyName))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordCircuitBreakerState(CircuitBreakerSnapshot snapshot) {
        BreakerGauges gauges = breakerGauges.computeIfAbsent(snapshot.name(), this::registerBreakerGauges);
        gauges.state.set(snapshot.state().getCode());
        gauges.consecutiveFailures.set(snapshot.consecutiveFailures());
        gauges.backoffSeconds.set(snapshot.currentBackoffSeconds());
        gauges.trafficPercentage.set(snapshot.trafficPercentage());
    }

    @Override
    public void recordBulkheadState(BulkheadSnapshot snapshot) {
        BulkheadGauges gauges = bulkheadGauges.computeIfAbsent(snapshot.poolName(), this::registerBulkheadGauges);
        gauges.active.set(snapshot.activeCount());
        gauges.queued.set(snapshot.queuedCount());
    }

    @Override
    public void recordBulkheadRejection(String poolName) {
        Counter.builder("resilience.bulkhead.rejections")
                .description("Operations rejected by a bulkhead")
                .tags(Tags.of(POOL, poolName))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordTimeoutCall(TimeoutRecord timeoutRecord) {
        Tags tags = Tags.of(DEPENDENCY, timeoutRecord.dependencyName(),
                "outcome", timeoutRecord.outcome().name().toLowerCase(Locale.ROOT));
        Timer.builder("resilience.timeout.duration")
                .description("Observed duration of calls bounded by the timeout layer")
                .tags(tags)
                .register(meterRegistry)
                .record(Duration.ofNanos(Math.round(timeoutRecord.observedDurationSeconds() * 1_000_000_000.0)));
        if (timeoutRecord.outcome() == TimeoutOutcome.TIMEOUT) {
            Counter.builder("resilience.timeout.occurrences")
                    .description("Calls that exceeded their timeout")
                    .tags(Tags.of(DEPENDENCY, timeoutRecord.dependencyName()))
                    .register(meterRegistry)
                    .increment();
        }
    }

    @Override
    public void recordRetryAttempt(String dependencyName, int attempt, boolean succeeded) {
        Counter.builder("resilience.retry.attempts")
                .description("Attempts made by the retry executor")
                .tags(Tags.of(DEPENDENCY, dependencyName, "outcome", succeeded ? "success" : "failure"))
                .register(meterRegistry)
                .increment();
    }

    private BreakerGauges registerBreakerGauges(String dependencyName) {
        log.debug("[Metrics] Registering circuit breaker gauges for '{}'", dependencyName);
        Tags tags = Tags.of(DEPENDENCY, dependencyName);
        BreakerGauges gauges = new BreakerGauges();
        Gauge.builder("resilience.circuit_breaker.state", gauges.state, AtomicInteger::doubleValue)
                .description("Circuit breaker state (0=closed,1=open,2=half_open)")
                .tags(tags)
                .register(meterRegistry);
        Gauge.builder("resilience.circuit_breaker.failure_count", gauges.consecutiveFailures,
                AtomicInteger::doubleValue)
                .description("Current consecutive failure count")
                .tags(tags)
                .register(meterRegistry);
        Gauge.builder("resilience.circuit_breaker.backoff_seconds", gauges.backoffSeconds, AtomicReference::get)
                .description("Current recovery backoff in seconds")
                .tags(tags)
                .register(meterRegistry);
        Gauge.builder("resilience.circuit_breaker.traffic_percentage", gauges.trafficPercentage,
                AtomicReference::get)
                .description("Share of calls admitted while half open")
                .tags(tags)
                .register(meterRegistry);
        return gauges;
    }

    private BulkheadGauges registerBulkheadGauges(String poolName) {
        Tags tags = Tags.of(POOL, poolName);
        BulkheadGauges gauges = new BulkheadGauges();
        Gauge.builder("resilience.bulkhead.active", gauges.active, AtomicInteger::doubleValue)
                .description("Operations currently executing in a bulkhead")
                .tags(tags)
                .register(meterRegistry);
        Gauge.builder("resilience.bulkhead.queued", gauges.queued, AtomicInteger::doubleValue)
                .description("Callers waiting for a bulkhead slot")
                .tags(tags)
                .register(meterRegistry);
        return gauges;
    }

    private static String stateTag(CircuitState state) {
        return state.name().toLowerCase(Locale.ROOT);
    }

    private static final class BreakerGauges {
        private final AtomicInteger state = new AtomicInteger();
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private final AtomicReference<Double> backoffSeconds = new AtomicReference<>(0.0);
        private final AtomicReference<Double> trafficPercentage = new AtomicReference<>(1.0);
    }

    private static final class BulkheadGauges {
        private final AtomicInteger active = new AtomicInteger();
        private final AtomicInteger queued = new AtomicInteger();
    }
}
