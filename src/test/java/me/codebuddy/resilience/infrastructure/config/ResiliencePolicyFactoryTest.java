package me.codebuddy.resilience.infrastructure.config;

import me.codebuddy.resilience.domain.model.RetryStrategy;
import me.codebuddy.resilience.domain.resilience.BulkheadConfig;
import me.codebuddy.resilience.domain.resilience.CircuitBreakerConfig;
import me.codebuddy.resilience.domain.resilience.RetryPolicy;
import me.codebuddy.resilience.domain.resilience.TimeoutConfig;
import me.codebuddy.resilience.infrastructure.config.ResilienceProperties.DependencyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResiliencePolicyFactoryTest {

    private ResilienceProperties properties;
    private ResiliencePolicyFactory factory;

    @BeforeEach
    void setUp() {
        properties = new ResilienceProperties();
        factory = new ResiliencePolicyFactory(properties);
    }

    @Test
    void shouldBuildDefaultsMatchingDocumentedValues() {
        CircuitBreakerConfig breaker = factory.circuitBreakerConfig(null);
        BulkheadConfig bulkhead = factory.bulkheadConfig(null);
        RetryPolicy retry = factory.retryPolicy(null);
        TimeoutConfig timeout = factory.timeoutConfig(null);

        assertEquals(5, breaker.getFailureThreshold());
        assertEquals(2, breaker.getSuccessThreshold());
        assertEquals(Duration.ofSeconds(300), breaker.getMaxBackoff());
        assertEquals(10, bulkhead.getCapacity());
        assertEquals(100, bulkhead.getQueueCapacity());
        assertEquals(3, retry.getMaxAttempts());
        assertEquals(RetryStrategy.EXPONENTIAL, retry.getStrategy());
        assertEquals(Duration.ofHours(1), retry.getIdempotencyTtl());
        assertEquals(Duration.ofSeconds(30), timeout.getDefaultTimeout());
        assertEquals(Duration.ofMillis(100), timeout.getMinTimeout());
    }

    @Test
    void shouldMergeDependencyOverridesOntoDefaults() {
        DependencyProperties override = new DependencyProperties();
        override.setFailureThreshold(3);
        override.setDefaultTimeout(Duration.ofSeconds(10));
        override.setRetryStrategy(RetryStrategy.LINEAR);
        properties.getDependencies().put("source-control-api", override);

        assertEquals(3, factory.circuitBreakerConfig("source-control-api").getFailureThreshold());
        assertEquals(2, factory.circuitBreakerConfig("source-control-api").getSuccessThreshold());
        assertEquals(Duration.ofSeconds(10), factory.timeoutConfig("source-control-api").getDefaultTimeout());
        assertEquals(RetryStrategy.LINEAR, factory.retryPolicy("source-control-api").getStrategy());
        assertEquals(5, factory.circuitBreakerConfig("other").getFailureThreshold());
    }

    @Test
    void shouldResolveExceptionClassNames() {
        properties.getDefaults().setNonRetryableExceptions(List.of("java.lang.IllegalStateException"));

        RetryPolicy retry = factory.retryPolicy(null);

        assertFalse(retry.isRetryable(new IllegalStateException("invalid")));
        assertTrue(retry.isRetryable(new IOException("reset")));
    }

    @Test
    void shouldFailFastOnUnknownExceptionClass() {
        properties.getDefaults().setExcludedExceptions(List.of("com.example.NoSuchException"));

        assertThrows(IllegalStateException.class, () -> factory.circuitBreakerConfig(null));
    }

    @Test
    void shouldRejectNonThrowableClass() {
        properties.getDefaults().setExcludedExceptions(List.of("java.lang.String"));

        assertThrows(IllegalStateException.class, () -> factory.circuitBreakerConfig(null));
    }

    @Test
    void shouldFailFastOnInvalidValues() {
        properties.getDefaults().setBulkheadCapacity(0);

        assertThrows(IllegalArgumentException.class, () -> factory.bulkheadConfig(null));
    }
}
