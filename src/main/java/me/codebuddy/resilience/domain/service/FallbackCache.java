package me.codebuddy.resilience.domain.service;

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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of responses served when a dependency is unavailable.
 */
@Slf4j
public class FallbackCache {

    private final Clock clock;
    private final Duration defaultTtl;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public FallbackCache(Clock clock, Duration defaultTtl) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    public Optional<Object> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        log.debug("[FallbackCache] Hit for key {}", key);
        return Optional.of(entry.value());
    }

    public void put(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        entries.put(key, new Entry(value, clock.instant(), effectiveTtl));
    }

    public int cleanup() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }

    private record Entry(Object value, Instant storedAt, Duration ttl) {

        boolean isExpired(Instant now) {
            return Duration.between(storedAt, now).compareTo(ttl) > 0;
        }
    }
}
