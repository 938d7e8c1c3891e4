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
import me.codebuddy.resilience.domain.model.FeatureFlag;
import me.codebuddy.resilience.domain.model.FeatureState;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feature flags for non-critical features. Unregistered flags count as
 * enabled.
 */
@Service
@Slf4j
public class FeatureFlagService {

    private final Map<String, FeatureFlag> flags = new ConcurrentHashMap<>();

    public void register(FeatureFlag flag) {
        flags.put(flag.getName(), flag);
    }

    public boolean isEnabled(String flagName) {
        FeatureFlag flag = flags.get(flagName);
        return flag == null || flag.getState() == FeatureState.ENABLED;
    }

    public boolean isDisabled(String flagName) {
        FeatureFlag flag = flags.get(flagName);
        return flag != null && flag.getState() == FeatureState.DISABLED;
    }

    public boolean isDegraded(String flagName) {
        FeatureFlag flag = flags.get(flagName);
        return flag != null && flag.getState() == FeatureState.DEGRADED;
    }

    public Optional<FeatureFlag> getFlag(String flagName) {
        return Optional.ofNullable(flags.get(flagName));
    }

    public List<FeatureFlag> getFlags() {
        return flags.values().stream()
                .sorted(Comparator.comparing(FeatureFlag::getName))
                .toList();
    }

    /**
     * @return whether the flag exists
     */
    public boolean setState(String flagName, FeatureState state) {
        FeatureFlag updated = flags.computeIfPresent(flagName, (name, flag) -> flag.toBuilder()
                .state(state)
                .build());
        if (updated == null) {
            return false;
        }
        log.info("[FeatureFlags] Feature flag '{}' set to {}", flagName, state);
        return true;
    }
}
