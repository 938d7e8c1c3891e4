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

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Time-bounded cache of results keyed by idempotency key.
 *
 * <p>
 * An entry expires once {@code now - storedAt > ttl}. Expired entries are
 * dropped lazily on lookup and in bulk by {@link #cleanup()}. {@code null}
 * results are never stored.
 */
@Slf4j
public class IdempotencyStore {

    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public IdempotencyStore(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a non-negative duration");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<Object> find(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    public void store(String key, Object result) {
        if (result == null) {
            return;
        }
        entries.put(key, new Entry(result, clock.instant()));
    }

    /**
     * Drops every expired entry.
     *
     * @return number of evicted entries
     */
    public int cleanup() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> isExpired(entry, now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            log.debug("[Idempotency] Evicted {} expired entries", evicted);
        }
        return Math.max(0, evicted);
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(Entry entry, Instant now) {
        return Duration.between(entry.storedAt(), now).compareTo(ttl) > 0;
    }

    private record Entry(Object result, Instant storedAt) {
    }
}
