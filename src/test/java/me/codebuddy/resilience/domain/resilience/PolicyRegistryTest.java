package me.codebuddy.resilience.domain.resilience;

import me.codebuddy.resilience.domain.model.CircuitState;
import me.codebuddy.resilience.port.outbound.ResilienceMetricsPort;
import me.codebuddy.resilience.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyRegistryTest {

    private MutableClock clock;
    private CircuitBreakerRegistry circuitBreakers;
    private TimeoutRegistry timeouts;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        circuitBreakers = new CircuitBreakerRegistry(CircuitBreakerConfig.builder().failureThreshold(2).build(),
                clock, () -> 0.0, ResilienceMetricsPort.NOOP);
        timeouts = new TimeoutRegistry(TimeoutConfig.defaults(), clock, ResilienceMetricsPort.NOOP);
    }

    @AfterEach
    void tearDown() {
        timeouts.shutdown();
    }

    private void failOnce(String name) {
        assertThrows(IOException.class, () -> circuitBreakers.call(name, () -> {
            throw new IOException("down");
        }));
    }

    @Test
    void shouldReturnSameInstancePerName() {
        assertSame(circuitBreakers.getOrCreate("source-control-api"),
                circuitBreakers.getOrCreate("source-control-api"));
    }

    @Test
    void shouldIsolateStatePerDependency() throws Exception {
        failOnce("source-control-api");
        failOnce("source-control-api");

        assertEquals(CircuitState.OPEN, circuitBreakers.getOrCreate("source-control-api").getState());
        assertEquals("ok", circuitBreakers.call("model-provider", () -> "ok"));
        assertEquals(CircuitState.CLOSED, circuitBreakers.getOrCreate("model-provider").getState());
    }

    @Test
    void shouldUseRegisteredConfigOverDefault() {
        circuitBreakers.register("repository-store", CircuitBreakerConfig.builder().failureThreshold(1).build());

        failOnce("repository-store");

        assertEquals(CircuitState.OPEN, circuitBreakers.getOrCreate("repository-store").getState());
        assertEquals(2, circuitBreakers.getConfig("unknown").getFailureThreshold());
    }

    @Test
    void shouldUseExplicitConfigOnlyWhenCreating() {
        CircuitBreakerConfig strict = CircuitBreakerConfig.builder().failureThreshold(1).build();
        CircuitBreakerConfig lenient = CircuitBreakerConfig.builder().failureThreshold(50).build();

        CircuitBreaker created = circuitBreakers.getOrCreate("model-provider", strict);
        CircuitBreaker existing = circuitBreakers.getOrCreate("model-provider", lenient);

        assertSame(created, existing);
        assertSame(strict, existing.getConfig());
        assertEquals(2, circuitBreakers.getConfig("model-provider").getFailureThreshold());
    }

    @Test
    void shouldKeepLiveInstanceWhenConfigIsRegisteredAgain() {
        failOnce("source-control-api");
        failOnce("source-control-api");
        CircuitBreaker breaker = circuitBreakers.getOrCreate("source-control-api");
        CircuitBreakerConfig original = breaker.getConfig();

        circuitBreakers.register("source-control-api", CircuitBreakerConfig.builder().failureThreshold(100).build());

        CircuitBreaker after = circuitBreakers.getOrCreate("source-control-api");
        assertSame(breaker, after);
        assertSame(original, after.getConfig());
        assertEquals(CircuitState.OPEN, after.getState());
        assertEquals(2, after.getSnapshot().totalFailures());

        assertTrue(circuitBreakers.remove("source-control-api"));
        assertEquals(100, circuitBreakers.getOrCreate("source-control-api").getConfig().getFailureThreshold());
    }

    @Test
    void shouldResetSingleAndAllBreakers() {
        failOnce("a");
        failOnce("a");
        failOnce("b");
        failOnce("b");

        assertTrue(circuitBreakers.reset("a"));
        assertFalse(circuitBreakers.reset("missing"));
        assertEquals(CircuitState.CLOSED, circuitBreakers.getOrCreate("a").getState());
        assertEquals(CircuitState.OPEN, circuitBreakers.getOrCreate("b").getState());

        circuitBreakers.resetAll();
        assertEquals(CircuitState.CLOSED, circuitBreakers.getOrCreate("b").getState());
    }

    @Test
    void shouldListInstancesSortedByName() {
        circuitBreakers.getOrCreate("zeta");
        circuitBreakers.getOrCreate("alpha");

        assertEquals(List.of("alpha", "zeta"), List.copyOf(circuitBreakers.getAll().keySet()));
        assertTrue(circuitBreakers.find("alpha").isPresent());
        assertTrue(circuitBreakers.remove("alpha"));
        assertTrue(circuitBreakers.find("alpha").isEmpty());
    }

    @Test
    void shouldRejectBlankName() {
        assertThrows(IllegalArgumentException.class, () -> circuitBreakers.getOrCreate(" "));
    }

    @Test
    void shouldReportNoCascadeForUnknownTimeoutPolicy() throws Exception {
        assertFalse(timeouts.detectCascadingTimeouts("unknown", 3));
        assertEquals("ok", timeouts.execute("model-provider", () -> "ok", Duration.ofSeconds(1)));
        assertEquals(1, timeouts.getOrCreate("model-provider").getStats().totalCalls());
    }

    @Test
    void shouldCleanupIdempotencyAcrossExecutors() throws Exception {
        RetryRegistry retries = new RetryRegistry(RetryPolicy.builder().idempotencyTtl(Duration.ofMinutes(1)).build(),
                clock, () -> 0.5, delay -> {
                }, ResilienceMetricsPort.NOOP);
        retries.execute("a", () -> "x", "key-1");
        retries.execute("b", () -> "y", "key-2");

        clock.advance(Duration.ofMinutes(2));

        assertEquals(2, retries.cleanupIdempotency());
    }
}
