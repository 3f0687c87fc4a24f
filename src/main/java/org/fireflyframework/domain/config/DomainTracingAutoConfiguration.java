/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.domain.config;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.domain.core.observability.CommandSchedulingTracer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.Order;

/**
 * Auto-configuration for Micrometer Observation tracing of command scheduling.
 *
 * <p>Activated when Micrometer Observation is on the classpath and an
 * {@code ObservationRegistry} bean is available. The tracer is the outermost middleware.
 */
@Slf4j
@AutoConfiguration(before = DomainAutoConfiguration.class)
@ConditionalOnClass(ObservationRegistry.class)
@ConditionalOnBean(ObservationRegistry.class)
@ConditionalOnProperty(name = "firefly.domain.tracing.enabled", havingValue = "true", matchIfMissing = true)
public class DomainTracingAutoConfiguration {

    @Bean
    @Order(100)
    @ConditionalOnMissingBean
    public CommandSchedulingTracer commandSchedulingTracer(ObservationRegistry observationRegistry) {
        log.info("[domain] Tracing initialized with ObservationRegistry");
        return new CommandSchedulingTracer(observationRegistry);
    }
}
