package me.codebuddy.resilience;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for CodeBuddy Resilience.
 *
 * <p>
 * Protects calls to external dependencies (source-control APIs, model
 * providers, repositories) with composable layers:
 *
 * <ul>
 * <li><b>Circuit Breaker</b> - fails fast while a dependency is unhealthy,
 * with exponential backoff and gradual traffic ramp-up on recovery</li>
 * <li><b>Bulkhead</b> - bounded concurrency with a FIFO wait queue</li>
 * <li><b>Timeout</b> - bounded waits with duration history and cascading
 * timeout detection</li>
 * <li><b>Retry</b> - backoff strategies with jitter and an idempotency
 * store</li>
 * <li><b>Graceful Degradation</b> - feature flags, fallbacks and a fallback
 * cache</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code resilience.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ResilienceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResilienceApplication.class, args);
    }

}
