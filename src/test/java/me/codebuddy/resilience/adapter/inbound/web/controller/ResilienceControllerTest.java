package me.codebuddy.resilience.adapter.inbound.web.controller;

import me.codebuddy.resilience.adapter.inbound.web.dto.ResilienceOverviewResponse;
import me.codebuddy.resilience.domain.model.CircuitBreakerSnapshot;
import me.codebuddy.resilience.domain.model.CircuitState;
import me.codebuddy.resilience.domain.model.FeatureFlag;
import me.codebuddy.resilience.domain.model.FeatureState;
import me.codebuddy.resilience.domain.resilience.BulkheadConfig;
import me.codebuddy.resilience.domain.resilience.BulkheadRegistry;
import me.codebuddy.resilience.domain.resilience.CircuitBreakerConfig;
import me.codebuddy.resilience.domain.resilience.CircuitBreakerRegistry;
import me.codebuddy.resilience.domain.resilience.RetryPolicy;
import me.codebuddy.resilience.domain.resilience.RetryRegistry;
import me.codebuddy.resilience.domain.resilience.TimeoutConfig;
import me.codebuddy.resilience.domain.resilience.TimeoutRegistry;
import me.codebuddy.resilience.domain.service.FeatureFlagService;
import me.codebuddy.resilience.domain.service.ResilienceService;
import me.codebuddy.resilience.port.outbound.ResilienceMetricsPort;
import me.codebuddy.resilience.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResilienceControllerTest {

    private CircuitBreakerRegistry circuitBreakers;
    private BulkheadRegistry bulkheads;
    private TimeoutRegistry timeouts;
    private FeatureFlagService featureFlags;
    private ResilienceController controller;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        circuitBreakers = new CircuitBreakerRegistry(CircuitBreakerConfig.builder().failureThreshold(1).build(),
                clock, () -> 0.0, ResilienceMetricsPort.NOOP);
        bulkheads = new BulkheadRegistry(BulkheadConfig.defaults(), ResilienceMetricsPort.NOOP);
        timeouts = new TimeoutRegistry(TimeoutConfig.defaults(), clock, ResilienceMetricsPort.NOOP);
        RetryRegistry retries = new RetryRegistry(RetryPolicy.defaults(), clock, () -> 0.5, delay -> {
        }, ResilienceMetricsPort.NOOP);
        featureFlags = new FeatureFlagService();
        ResilienceService resilienceService = new ResilienceService(circuitBreakers, bulkheads, timeouts, retries,
                null);
        controller = new ResilienceController(circuitBreakers, bulkheads, timeouts, featureFlags, resilienceService);
    }

    @AfterEach
    void tearDown() {
        timeouts.shutdown();
    }

    private void openCircuit(String name) {
        assertThrows(IOException.class, () -> circuitBreakers.call(name, () -> {
            throw new IOException("down");
        }));
    }

    @Test
    void shouldSummarizeOverview() throws Exception {
        openCircuit("source-control-api");
        circuitBreakers.call("model-provider", () -> "ok");
        bulkheads.execute("model-provider", () -> "ok");
        timeouts.execute("model-provider", () -> "ok");
        featureFlags.register(FeatureFlag.builder().name("review-summary").build());

        StepVerifier.create(controller.getOverview())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ResilienceOverviewResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(1, body.getOpenCircuits());
                    assertEquals(0, body.getHalfOpenCircuits());
                    assertEquals(List.of("BULKHEAD", "CIRCUIT_BREAKER", "TIMEOUT", "RETRY"), body.getComposition());
                    assertEquals(2, body.getCircuitBreakers().size());
                    assertEquals(1, body.getBulkheads().size());
                    assertEquals(1, body.getTimeouts().size());
                    assertFalse(body.getTimeouts().get(0).isCascading());
                    assertEquals(1, body.getFeatures().size());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnCircuitBreakerByName() {
        openCircuit("source-control-api");

        StepVerifier.create(controller.getCircuitBreaker("source-control-api"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    CircuitBreakerSnapshot body = response.getBody();
                    assertNotNull(body);
                    assertEquals(CircuitState.OPEN, body.state());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownCircuitBreaker() {
        StepVerifier.create(controller.getCircuitBreaker("unknown"))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(controller.resetCircuitBreaker("unknown"))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldResetCircuitBreaker() {
        openCircuit("source-control-api");

        StepVerifier.create(controller.resetCircuitBreaker("source-control-api"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(CircuitState.CLOSED, response.getBody().state());
                })
                .verifyComplete();
    }

    @Test
    void shouldResetAllCircuitBreakers() {
        openCircuit("a");
        openCircuit("b");

        StepVerifier.create(controller.resetAllCircuitBreakers())
                .assertNext(response -> assertEquals(2, response.getBody().reset()))
                .verifyComplete();
        assertEquals(CircuitState.CLOSED, circuitBreakers.getOrCreate("a").getState());
        assertEquals(CircuitState.CLOSED, circuitBreakers.getOrCreate("b").getState());
    }

    // ===== Feature flags =====

    @Test
    void shouldUpdateFeatureState() {
        featureFlags.register(FeatureFlag.builder().name("review-summary").build());

        StepVerifier.create(controller.setFeatureState("review-summary", "disabled"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(FeatureState.DISABLED, response.getBody().getState());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownFeature() {
        StepVerifier.create(controller.setFeatureState("missing", "ENABLED"))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownFeatureState() {
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.setFeatureState("review-summary", "sometimes"));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
    }
}
