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

import me.codebuddy.resilience.domain.model.CircuitState;

import java.time.Duration;

/**
 * The breaker rejected the call without invoking the operation.
 */
public class CircuitOpenException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    private final CircuitState state;
    private final Duration retryAfter;

    public CircuitOpenException(String dependencyName, CircuitState state, Duration retryAfter, String message) {
        super(dependencyName, message);
        this.state = state;
        this.retryAfter = retryAfter;
    }

    public CircuitState getState() {
        return state;
    }

    /**
     * Estimated wait before the breaker admits probes again. Zero while
     * half-open.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
