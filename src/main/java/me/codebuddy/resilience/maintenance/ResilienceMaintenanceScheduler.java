package me.codebuddy.resilience.maintenance;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.codebuddy.resilience.domain.resilience.RetryRegistry;
import me.codebuddy.resilience.domain.service.GracefulDegradationService;
import me.codebuddy.resilience.infrastructure.config.ResilienceProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically evicts expired idempotency entries and fallback cache entries.
 * Reads already evict lazily; this bounds memory for keys that are never read
 * again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResilienceMaintenanceScheduler {

    private final RetryRegistry retryRegistry;
    private final GracefulDegradationService degradationService;
    private final ResilienceProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> cleanupTask;

    @PostConstruct
    public void init() {
        Duration interval = properties.getIdempotencyCleanupInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            log.info("[ResilienceMaintenance] Cleanup disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "resilience-maintenance");
            t.setDaemon(true);
            return t;
        });

        long intervalMillis = interval.toMillis();
        cleanupTask = scheduler.scheduleAtFixedRate(
                this::cleanup,
                intervalMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS);

        log.info("[ResilienceMaintenance] Started with cleanup interval: {}", interval);
    }

    void cleanup() {
        try {
            int idempotencyEvicted = retryRegistry.cleanupIdempotency();
            int fallbackEvicted = degradationService.cleanupCache();
            if (idempotencyEvicted > 0 || fallbackEvicted > 0) {
                log.debug("[ResilienceMaintenance] Evicted {} idempotency entries, {} fallback entries",
                        idempotencyEvicted, fallbackEvicted);
            }
        } catch (RuntimeException e) {
            log.error("[ResilienceMaintenance] Cleanup failed", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[ResilienceMaintenance] Shut down");
    }
}
