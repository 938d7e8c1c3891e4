package me.codebuddy.resilience.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.codebuddy.resilience.domain.model.BulkheadSnapshot;
import me.codebuddy.resilience.domain.model.CircuitBreakerSnapshot;
import me.codebuddy.resilience.domain.model.FeatureFlag;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResilienceOverviewResponse {
    private int openCircuits;
    private int halfOpenCircuits;
    private List<String> composition;
    private List<CircuitBreakerSnapshot> circuitBreakers;
    private List<BulkheadSnapshot> bulkheads;
    private List<TimeoutStatusResponse> timeouts;
    private List<FeatureFlag> features;
}
