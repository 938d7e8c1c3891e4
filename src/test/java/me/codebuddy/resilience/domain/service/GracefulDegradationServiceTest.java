package me.codebuddy.resilience.domain.service;

import me.codebuddy.resilience.domain.model.FeatureState;
import me.codebuddy.resilience.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GracefulDegradationServiceTest {

    private MutableClock clock;
    private FeatureFlagService featureFlags;
    private GracefulDegradationService service;
    private AtomicInteger primaryCalls;
    private boolean primaryHealthy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        featureFlags = new FeatureFlagService();
        service = new GracefulDegradationService(featureFlags, clock);
        primaryCalls = new AtomicInteger();
        primaryHealthy = true;
    }

    private String summarize(String diff) throws IOException {
        primaryCalls.incrementAndGet();
        if (!primaryHealthy) {
            throw new IOException("model provider unavailable");
        }
        return "summary of " + diff;
    }

    private void registerSummaries(boolean withFallback, boolean cacheEnabled) {
        service.register(DegradationStrategy.<String, String>builder()
                .featureName("review-summary")
                .primary(this::summarize)
                .fallback(withFallback ? diff -> "summary unavailable" : null)
                .cacheEnabled(cacheEnabled)
                .cacheTtl(Duration.ofMinutes(5))
                .featureFlag("review-summary")
                .build());
    }

    @Test
    void shouldRegisterFeatureFlagForStrategy() {
        registerSummaries(true, true);

        assertTrue(featureFlags.getFlag("review-summary").isPresent());
        assertTrue(featureFlags.getFlag("review-summary").get().isFallbackEnabled());
    }

    @Test
    void shouldServeCachedResultWithinTtl() throws Exception {
        registerSummaries(true, true);

        assertEquals("summary of d1", service.execute("review-summary", "d1"));
        assertEquals("summary of d1", service.execute("review-summary", "d1"));
        assertEquals(1, primaryCalls.get());

        clock.advance(Duration.ofMinutes(6));
        service.execute("review-summary", "d1");
        assertEquals(2, primaryCalls.get());
    }

    @Test
    void shouldUseFallbackWhenPrimaryFails() throws Exception {
        registerSummaries(true, false);
        primaryHealthy = false;

        assertEquals("summary unavailable", service.execute("review-summary", "d1"));
        assertEquals(1, primaryCalls.get());
    }

    @Test
    void shouldRethrowPrimaryFailureWithoutFallback() {
        registerSummaries(false, false);
        primaryHealthy = false;

        IOException failure = assertThrows(IOException.class, () -> service.execute("review-summary", "d1"));
        assertEquals("model provider unavailable", failure.getMessage());
    }

    @Test
    void shouldSkipPrimaryWhenFlagIsDisabled() throws Exception {
        registerSummaries(true, true);
        featureFlags.setState("review-summary", FeatureState.DISABLED);

        assertEquals("summary unavailable", service.execute("review-summary", "d1"));
        assertEquals(0, primaryCalls.get());
    }

    @Test
    void shouldThrowWhenDisabledWithoutFallback() {
        registerSummaries(false, true);
        featureFlags.setState("review-summary", FeatureState.DISABLED);

        assertThrows(FeatureDisabledException.class, () -> service.execute("review-summary", "d1"));
    }

    @Test
    void shouldStillCallPrimaryWhenDegraded() throws Exception {
        registerSummaries(true, false);
        featureFlags.setState("review-summary", FeatureState.DEGRADED);

        assertEquals("summary of d1", service.execute("review-summary", "d1"));
    }

    @Test
    void shouldRejectUnknownFeature() {
        assertThrows(IllegalArgumentException.class, () -> service.execute("unknown", "x"));
    }

    @Test
    void shouldEvictExpiredEntriesOnCleanup() throws Exception {
        registerSummaries(true, true);
        service.execute("review-summary", "d1");
        service.execute("review-summary", "d2");

        clock.advance(Duration.ofMinutes(10));

        assertEquals(2, service.cleanupCache());
        assertEquals(0, service.getCache().size());
        assertFalse(service.getCache().get("review-summary:d1").isPresent());
    }
}
