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
import me.codebuddy.resilience.domain.model.FeatureFlag;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs features through their registered {@link DegradationStrategy}.
 *
 * <p>
 * Resolution order for {@link #execute(String, Object)}:
 * <ol>
 * <li>flag disabled: fallback, or {@link FeatureDisabledException}</li>
 * <li>fresh cached result for the feature and input</li>
 * <li>primary implementation, caching its result</li>
 * <li>on primary failure: fallback (cached), else the primary failure</li>
 * </ol>
 */
@Service
@Slf4j
public class GracefulDegradationService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    private final FeatureFlagService featureFlagService;
    private final FallbackCache cache;
    private final Map<String, DegradationStrategy<?, ?>> strategies = new ConcurrentHashMap<>();

    public GracefulDegradationService(FeatureFlagService featureFlagService, Clock clock) {
        this.featureFlagService = featureFlagService;
        this.cache = new FallbackCache(clock, DEFAULT_CACHE_TTL);
    }

    public void register(DegradationStrategy<?, ?> strategy) {
        strategies.put(strategy.getFeatureName(), strategy);
        if (strategy.getFeatureFlag() != null && featureFlagService.getFlag(strategy.getFeatureFlag()).isEmpty()) {
            featureFlagService.register(FeatureFlag.builder()
                    .name(strategy.getFeatureFlag())
                    .fallbackEnabled(strategy.hasFallback())
                    .cacheEnabled(strategy.isCacheEnabled())
                    .build());
        }
        log.info("[Degradation] Registered strategy for feature '{}' (fallback: {})", strategy.getFeatureName(),
                strategy.hasFallback());
    }

    @SuppressWarnings("unchecked")
    public <I, O> O execute(String featureName, I input) throws Exception {
        DegradationStrategy<I, O> strategy = (DegradationStrategy<I, O>) strategies.get(featureName);
        if (strategy == null) {
            throw new IllegalArgumentException("No degradation strategy registered for feature: " + featureName);
        }

        String flag = strategy.getFeatureFlag();
        if (flag != null && featureFlagService.isDisabled(flag)) {
            log.info("[Degradation] Feature '{}' is disabled via feature flag", featureName);
            if (strategy.hasFallback()) {
                return strategy.getFallback().apply(input);
            }
            throw new FeatureDisabledException(featureName);
        }
        if (flag != null && featureFlagService.isDegraded(flag)) {
            log.debug("[Degradation] Feature '{}' is in degraded mode", featureName);
        }

        String cacheKey = featureName + ":" + input;
        if (strategy.isCacheEnabled()) {
            Optional<Object> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                return (O) cached.get();
            }
        }

        try {
            O result = strategy.getPrimary().apply(input);
            cacheResult(strategy, cacheKey, result);
            return result;
        } catch (Exception e) {
            log.warn("[Degradation] Primary implementation failed for '{}': {}", featureName, e.getMessage());
            if (!strategy.hasFallback()) {
                throw e;
            }
            log.info("[Degradation] Using fallback for '{}'", featureName);
            O result = strategy.getFallback().apply(input);
            cacheResult(strategy, cacheKey, result);
            return result;
        }
    }

    public int cleanupCache() {
        return cache.cleanup();
    }

    public FallbackCache getCache() {
        return cache;
    }

    private void cacheResult(DegradationStrategy<?, ?> strategy, String cacheKey, Object result) {
        if (strategy.isCacheEnabled()) {
            cache.put(cacheKey, result, strategy.getCacheTtl());
        }
    }
}
