package me.codebuddy.resilience.maintenance;

import me.codebuddy.resilience.domain.resilience.RetryRegistry;
import me.codebuddy.resilience.domain.service.GracefulDegradationService;
import me.codebuddy.resilience.infrastructure.config.ResilienceProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResilienceMaintenanceSchedulerTest {

    private RetryRegistry retryRegistry;
    private GracefulDegradationService degradationService;
    private ResilienceProperties properties;
    private ResilienceMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        retryRegistry = mock(RetryRegistry.class);
        degradationService = mock(GracefulDegradationService.class);
        properties = new ResilienceProperties();
        scheduler = new ResilienceMaintenanceScheduler(retryRegistry, degradationService, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void shouldCleanupBothCaches() {
        scheduler.cleanup();

        verify(retryRegistry).cleanupIdempotency();
        verify(degradationService).cleanupCache();
    }

    @Test
    void shouldContinueWhenCleanupFails() {
        when(retryRegistry.cleanupIdempotency()).thenThrow(new IllegalStateException("boom"));

        scheduler.cleanup();

        verify(retryRegistry).cleanupIdempotency();
    }

    @Test
    void shouldRunPeriodicallyOnceStarted() {
        properties.setIdempotencyCleanupInterval(Duration.ofMillis(20));

        scheduler.init();

        verify(retryRegistry, timeout(2000).atLeastOnce()).cleanupIdempotency();
        verify(degradationService, timeout(2000).atLeastOnce()).cleanupCache();
    }

    @Test
    void shouldNotScheduleWhenIntervalIsZero() {
        properties.setIdempotencyCleanupInterval(Duration.ZERO);

        scheduler.init();

        verify(retryRegistry, never()).cleanupIdempotency();
    }
}
