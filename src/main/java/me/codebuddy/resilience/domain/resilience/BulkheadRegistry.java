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
import me.codebuddy.resilience.port.outbound.ResilienceMetricsPort;

import java.util.concurrent.Callable;

/**
 * One {@link Bulkhead} per resource pool name.
 */
@Slf4j
public class BulkheadRegistry extends AbstractPolicyRegistry<BulkheadConfig, Bulkhead> {

    private final ResilienceMetricsPort metrics;

    public BulkheadRegistry(BulkheadConfig defaultConfig, ResilienceMetricsPort metrics) {
        super(defaultConfig.validate());
        this.metrics = metrics;
    }

    public <T> T execute(String poolName, Callable<T> operation) throws Exception {
        return getOrCreate(poolName).execute(operation);
    }

    @Override
    protected Bulkhead create(String name, BulkheadConfig config) {
        log.debug("[BulkheadRegistry] Creating bulkhead '{}' (capacity {}, queue {})", name, config.getCapacity(),
                config.getQueueCapacity());
        return new Bulkhead(name, config, metrics);
    }
}
