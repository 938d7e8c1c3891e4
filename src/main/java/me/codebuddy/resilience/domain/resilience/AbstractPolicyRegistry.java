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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily creates and caches one policy instance per dependency name.
 *
 * <p>
 * Instances are built from the configuration registered for the name, or
 * from the registry default. Registering a configuration is idempotent and
 * never touches an instance that already exists; the new configuration only
 * applies to instances created later (for example after {@link #remove}).
 *
 * @param <C>
 *            configuration type
 * @param <P>
 *            policy type
 */
public abstract class AbstractPolicyRegistry<C, P> {

    private final Map<String, P> instances = new ConcurrentHashMap<>();
    private final Map<String, C> configs = new ConcurrentHashMap<>();
    private final C defaultConfig;

    protected AbstractPolicyRegistry(C defaultConfig) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig must not be null");
    }

    public void register(String name, C config) {
        configs.put(requireName(name), Objects.requireNonNull(config, "config must not be null"));
    }

    public C getDefaultConfig() {
        return defaultConfig;
    }

    /**
     * Configuration a new instance for the name would be created with.
     */
    public C getConfig(String name) {
        return configs.getOrDefault(requireName(name), defaultConfig);
    }

    public P getOrCreate(String name) {
        return getOrCreate(name, null);
    }

    /**
     * Returns the instance for the name, creating it from {@code config} (or the
     * registered configuration when {@code config} is null) if absent.
     */
    public P getOrCreate(String name, C config) {
        String key = requireName(name);
        P existing = instances.get(key);
        if (existing != null) {
            return existing;
        }
        return instances.computeIfAbsent(key, n -> create(n, config != null ? config : getConfig(n)));
    }

    public Optional<P> find(String name) {
        return Optional.ofNullable(instances.get(requireName(name)));
    }

    /**
     * All live instances ordered by name.
     */
    public Map<String, P> getAll() {
        return Collections.unmodifiableMap(new TreeMap<>(instances));
    }

    public boolean remove(String name) {
        return instances.remove(requireName(name)) != null;
    }

    protected abstract P create(String name, C config);

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("dependency name must not be blank");
        }
        return name;
    }
}
