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

/**
 * All attempts failed. The cause is the failure of the last attempt.
 */
public class RetryExhaustedException extends ResilienceException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public RetryExhaustedException(String dependencyName, int attempts, Throwable lastFailure) {
        super(dependencyName, "Operation for " + dependencyName + " failed after " + attempts + " attempts: "
                + (lastFailure != null ? lastFailure.getMessage() : "unknown"), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
