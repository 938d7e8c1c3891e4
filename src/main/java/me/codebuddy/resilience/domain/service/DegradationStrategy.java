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

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * How a feature degrades when its primary implementation fails.
 */
@Getter
@Builder
public class DegradationStrategy<I, O> {

    private final String featureName;
    private final DegradableCall<I, O> primary;
    private final DegradableCall<I, O> fallback;
    @Builder.Default
    private final boolean cacheEnabled = true;
    @Builder.Default
    private final Duration cacheTtl = Duration.ofMinutes(5);
    /**
     * Optional feature flag gating the primary implementation.
     */
    private final String featureFlag;

    public boolean hasFallback() {
        return fallback != null;
    }
}
