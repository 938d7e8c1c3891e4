package me.codebuddy.resilience.domain.model;

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

/**
 * Circuit breaker states. The numeric code is the value published on the
 * state gauge.
 */
public enum CircuitState {

    CLOSED(0), OPEN(1), HALF_OPEN(2);

    private final int code;

    CircuitState(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
