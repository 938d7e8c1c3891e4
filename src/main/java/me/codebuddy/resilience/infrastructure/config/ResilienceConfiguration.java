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

import lombok.extern.slf4j.Slf4j;
import me.codebuddy.resilience.domain.resilience.BulkheadRegistry;
import me.codebuddy.resilience.domain.resilience.CircuitBreakerRegistry;
import me.codebuddy.resilience.domain.resilience.RetryRegistry;
import me.codebuddy.resilience.domain.resilience.Sleeper;
import me.codebuddy.resilience.domain.resilience.TimeoutRegistry;
import me.codebuddy.resilience.domain.service.ResilienceService;
import me.codebuddy.resilience.port.outbound.ResilienceMetricsPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Wires the resilience registries and the protect facade.
 *
 * <p>
 * Registries are ordinary beans injected into collaborators, never static
 * state. Every dependency listed under {@code resilience.dependencies} is
 * registered with each registry at startup.
 */
@Configuration
@Slf4j
public class ResilienceConfiguration {

    @Bean
    public ResiliencePolicyFactory resiliencePolicyFactory(ResilienceProperties properties) {
        return new ResiliencePolicyFactory(properties);
    }

    @Bean
    public DoubleSupplier resilienceRandom() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties properties,
            ResiliencePolicyFactory factory, Clock clock, DoubleSupplier resilienceRandom,
            ResilienceMetricsPort metrics) {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(factory.circuitBreakerConfig(null), clock,
                resilienceRandom, metrics);
        for (String name : properties.getDependencies().keySet()) {
            registry.register(name, factory.circuitBreakerConfig(name));
        }
        return registry;
    }

    @Bean
    public BulkheadRegistry bulkheadRegistry(ResilienceProperties properties, ResiliencePolicyFactory factory,
            ResilienceMetricsPort metrics) {
        BulkheadRegistry registry = new BulkheadRegistry(factory.bulkheadConfig(null), metrics);
        for (String name : properties.getDependencies().keySet()) {
            registry.register(name, factory.bulkheadConfig(name));
        }
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    public TimeoutRegistry timeoutRegistry(ResilienceProperties properties, ResiliencePolicyFactory factory,
            Clock clock, ResilienceMetricsPort metrics) {
        TimeoutRegistry registry = new TimeoutRegistry(factory.timeoutConfig(null), clock, metrics);
        for (String name : properties.getDependencies().keySet()) {
            registry.register(name, factory.timeoutConfig(name));
        }
        return registry;
    }

    @Bean
    public RetryRegistry retryRegistry(ResilienceProperties properties, ResiliencePolicyFactory factory,
            Clock clock, DoubleSupplier resilienceRandom, ResilienceMetricsPort metrics) {
        RetryRegistry registry = new RetryRegistry(factory.retryPolicy(null), clock, resilienceRandom,
                Sleeper.THREAD, metrics);
        for (String name : properties.getDependencies().keySet()) {
            registry.register(name, factory.retryPolicy(name));
        }
        return registry;
    }

    @Bean
    public ResilienceService resilienceService(CircuitBreakerRegistry circuitBreakerRegistry,
            BulkheadRegistry bulkheadRegistry, TimeoutRegistry timeoutRegistry, RetryRegistry retryRegistry,
            ResilienceProperties properties) {
        log.info("[Resilience] Configured dependencies: {}", properties.getDependencies().keySet());
        return new ResilienceService(circuitBreakerRegistry, bulkheadRegistry, timeoutRegistry, retryRegistry,
                properties.getComposition());
    }
}
