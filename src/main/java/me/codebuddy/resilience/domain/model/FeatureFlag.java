package me.codebuddy.resilience.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Immutable flag value. State changes replace the registered instance.
 */
@Value
@Builder(toBuilder = true)
public class FeatureFlag {

    String name;
    @Builder.Default
    FeatureState state = FeatureState.ENABLED;
    String description;
    @Builder.Default
    boolean fallbackEnabled = true;
    @Builder.Default
    boolean cacheEnabled = true;
}
