package me.codebuddy.resilience.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.codebuddy.resilience.adapter.inbound.web.dto.ResilienceOverviewResponse;
import me.codebuddy.resilience.adapter.inbound.web.dto.TimeoutStatusResponse;
import me.codebuddy.resilience.domain.model.BulkheadSnapshot;
import me.codebuddy.resilience.domain.model.CircuitBreakerSnapshot;
import me.codebuddy.resilience.domain.model.CircuitState;
import me.codebuddy.resilience.domain.model.FeatureFlag;
import me.codebuddy.resilience.domain.model.FeatureState;
import me.codebuddy.resilience.domain.model.ResilienceLayer;
import me.codebuddy.resilience.domain.resilience.Bulkhead;
import me.codebuddy.resilience.domain.resilience.BulkheadRegistry;
import me.codebuddy.resilience.domain.resilience.CircuitBreaker;
import me.codebuddy.resilience.domain.resilience.CircuitBreakerRegistry;
import me.codebuddy.resilience.domain.resilience.TimeoutPolicy;
import me.codebuddy.resilience.domain.resilience.TimeoutRegistry;
import me.codebuddy.resilience.domain.service.FeatureFlagService;
import me.codebuddy.resilience.domain.service.ResilienceService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Operational view of circuit breakers, bulkheads, timeouts and feature
 * flags, plus manual breaker reset and flag toggling.
 */
@RestController
@RequestMapping("/api/resilience")
@RequiredArgsConstructor
public class ResilienceController {

    static final int CASCADE_WINDOW = 5;

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final BulkheadRegistry bulkheadRegistry;
    private final TimeoutRegistry timeoutRegistry;
    private final FeatureFlagService featureFlagService;
    private final ResilienceService resilienceService;

    @GetMapping
    public Mono<ResponseEntity<ResilienceOverviewResponse>> getOverview() {
        List<CircuitBreakerSnapshot> breakers = circuitBreakerSnapshots();
        int open = (int) breakers.stream().filter(s -> s.state() == CircuitState.OPEN).count();
        int halfOpen = (int) breakers.stream().filter(s -> s.state() == CircuitState.HALF_OPEN).count();

        ResilienceOverviewResponse response = ResilienceOverviewResponse.builder()
                .openCircuits(open)
                .halfOpenCircuits(halfOpen)
                .composition(resilienceService.getComposition().stream().map(ResilienceLayer::name).toList())
                .circuitBreakers(breakers)
                .bulkheads(bulkheadSnapshots())
                .timeouts(timeoutStatuses())
                .features(featureFlagService.getFlags())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    // ===== Circuit breakers =====

    @GetMapping("/circuit-breakers")
    public Mono<ResponseEntity<List<CircuitBreakerSnapshot>>> getCircuitBreakers() {
        return Mono.just(ResponseEntity.ok(circuitBreakerSnapshots()));
    }

    @GetMapping("/circuit-breakers/{name}")
    public Mono<ResponseEntity<CircuitBreakerSnapshot>> getCircuitBreaker(@PathVariable String name) {
        return circuitBreakerRegistry.find(name)
                .map(breaker -> Mono.just(ResponseEntity.ok(breaker.getSnapshot())))
                .orElse(Mono.just(ResponseEntity.notFound().build()));
    }

    @PostMapping("/circuit-breakers/{name}/reset")
    public Mono<ResponseEntity<CircuitBreakerSnapshot>> resetCircuitBreaker(@PathVariable String name) {
        if (!circuitBreakerRegistry.reset(name)) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(circuitBreakerRegistry.getOrCreate(name).getSnapshot()));
    }

    @PostMapping("/circuit-breakers/reset")
    public Mono<ResponseEntity<ResetResponse>> resetAllCircuitBreakers() {
        int count = circuitBreakerRegistry.getAll().size();
        circuitBreakerRegistry.resetAll();
        return Mono.just(ResponseEntity.ok(new ResetResponse(count)));
    }

    // ===== Bulkheads and timeouts =====

    @GetMapping("/bulkheads")
    public Mono<ResponseEntity<List<BulkheadSnapshot>>> getBulkheads() {
        return Mono.just(ResponseEntity.ok(bulkheadSnapshots()));
    }

    @GetMapping("/timeouts")
    public Mono<ResponseEntity<List<TimeoutStatusResponse>>> getTimeouts() {
        return Mono.just(ResponseEntity.ok(timeoutStatuses()));
    }

    // ===== Feature flags =====

    @GetMapping("/features")
    public Mono<ResponseEntity<List<FeatureFlag>>> getFeatures() {
        return Mono.just(ResponseEntity.ok(featureFlagService.getFlags()));
    }

    @PutMapping("/features/{name}")
    public Mono<ResponseEntity<FeatureFlag>> setFeatureState(@PathVariable String name,
            @RequestParam String state) {
        FeatureState featureState = parseState(state);
        if (!featureFlagService.setState(name, featureState)) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return featureFlagService.getFlag(name)
                .map(flag -> Mono.just(ResponseEntity.ok(flag)))
                .orElse(Mono.just(ResponseEntity.notFound().build()));
    }

    private List<CircuitBreakerSnapshot> circuitBreakerSnapshots() {
        return circuitBreakerRegistry.getAll().values().stream()
                .map(CircuitBreaker::getSnapshot)
                .toList();
    }

    private List<BulkheadSnapshot> bulkheadSnapshots() {
        return bulkheadRegistry.getAll().values().stream()
                .map(Bulkhead::getSnapshot)
                .toList();
    }

    private List<TimeoutStatusResponse> timeoutStatuses() {
        return timeoutRegistry.getAll().values().stream()
                .map(this::toTimeoutStatus)
                .toList();
    }

    private TimeoutStatusResponse toTimeoutStatus(TimeoutPolicy policy) {
        return TimeoutStatusResponse.builder()
                .stats(policy.getStats())
                .cascading(policy.detectCascadingTimeouts(CASCADE_WINDOW))
                .build();
    }

    private static FeatureState parseState(String state) {
        if (state == null || state.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "state is required");
        }
        try {
            return FeatureState.valueOf(state.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown feature state: " + state);
        }
    }

    public record ResetResponse(int reset) {
    }
}
