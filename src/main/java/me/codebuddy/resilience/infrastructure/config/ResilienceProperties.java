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

import lombok.Data;
import me.codebuddy.resilience.domain.model.ResilienceLayer;
import me.codebuddy.resilience.domain.model.RetryStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resilience toolkit configuration, bound from {@code resilience.*}.
 *
 * <p>
 * {@link #defaults} holds the process-wide policy used for every dependency
 * without an explicit entry. Each entry in {@link #dependencies} overrides
 * only the fields it sets; unset fields inherit the defaults.
 *
 * <pre>
 * resilience:
 *   defaults:
 *     failure-threshold: 5
 *   dependencies:
 *     source-control-api:
 *       failure-threshold: 3
 *       default-timeout: 10s
 * </pre>
 */
@ConfigurationProperties(prefix = "resilience")
@Data
public class ResilienceProperties {

    private DependencyProperties defaults = DependencyProperties.withDefaults();
    private Map<String, DependencyProperties> dependencies = new LinkedHashMap<>();
    private List<ResilienceLayer> composition = new ArrayList<>(List.of(
            ResilienceLayer.BULKHEAD,
            ResilienceLayer.CIRCUIT_BREAKER,
            ResilienceLayer.TIMEOUT,
            ResilienceLayer.RETRY));
    private Duration idempotencyCleanupInterval = Duration.ofMinutes(5);

    /**
     * Per-dependency policy. Every field is nullable so that overrides can be
     * merged onto {@link ResilienceProperties#getDefaults()}.
     */
    @Data
    public static class DependencyProperties {

        // ==================== CIRCUIT BREAKER ====================
        private Integer failureThreshold;
        private Integer successThreshold;
        private Duration baseBackoff;
        private Duration maxBackoff;
        private Double backoffMultiplier;
        private Double trafficFloor;
        private Double trafficStep;
        private Integer halfOpenMaxCalls;
        private List<String> excludedExceptions;

        // ==================== BULKHEAD ====================
        private Integer bulkheadCapacity;
        private Integer queueCapacity;
        private Duration queueTimeout;

        // ==================== RETRY ====================
        private Integer maxAttempts;
        private Duration retryBaseDelay;
        private Duration retryMaxDelay;
        private Double retryMultiplier;
        private RetryStrategy retryStrategy;
        private Double jitterRatio;
        private List<String> retryableExceptions;
        private List<String> nonRetryableExceptions;
        private Boolean idempotencyEnabled;
        private Duration idempotencyTtl;

        // ==================== TIMEOUT ====================
        private Duration defaultTimeout;
        private Duration minTimeout;
        private Duration maxTimeout;
        private Integer historySize;
        private Double cascadeRatio;

        static DependencyProperties withDefaults() {
            DependencyProperties props = new DependencyProperties();
            props.setFailureThreshold(5);
            props.setSuccessThreshold(2);
            props.setBaseBackoff(Duration.ofSeconds(1));
            props.setMaxBackoff(Duration.ofSeconds(300));
            props.setBackoffMultiplier(2.0);
            props.setTrafficFloor(0.1);
            props.setTrafficStep(0.1);
            props.setHalfOpenMaxCalls(1);
            props.setExcludedExceptions(new ArrayList<>(List.of("java.lang.IllegalArgumentException")));
            props.setBulkheadCapacity(10);
            props.setQueueCapacity(100);
            props.setQueueTimeout(Duration.ofSeconds(30));
            props.setMaxAttempts(3);
            props.setRetryBaseDelay(Duration.ofSeconds(1));
            props.setRetryMaxDelay(Duration.ofSeconds(60));
            props.setRetryMultiplier(2.0);
            props.setRetryStrategy(RetryStrategy.EXPONENTIAL);
            props.setJitterRatio(0.1);
            props.setRetryableExceptions(new ArrayList<>(List.of("java.lang.Exception")));
            props.setNonRetryableExceptions(new ArrayList<>(List.of("java.lang.IllegalArgumentException")));
            props.setIdempotencyEnabled(true);
            props.setIdempotencyTtl(Duration.ofHours(1));
            props.setDefaultTimeout(Duration.ofSeconds(30));
            props.setMinTimeout(Duration.ofMillis(100));
            props.setMaxTimeout(Duration.ofSeconds(300));
            props.setHistorySize(100);
            props.setCascadeRatio(1.5);
            return props;
        }
    }
}
