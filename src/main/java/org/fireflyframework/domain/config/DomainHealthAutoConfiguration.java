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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.domain.core.health.EventStoreHealthIndicator;
import org.fireflyframework.domain.persistence.EventStore;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the event store health indicator.
 *
 * <p>Activated when Spring Boot Actuator is on the classpath.
 */
@Slf4j
@AutoConfiguration(after = DomainAutoConfiguration.class)
@ConditionalOnClass(ReactiveHealthIndicator.class)
@ConditionalOnBean(EventStore.class)
@ConditionalOnProperty(name = "firefly.domain.health.enabled", havingValue = "true", matchIfMissing = true)
public class DomainHealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EventStoreHealthIndicator eventStoreHealthIndicator(EventStore eventStore) {
        log.info("[domain] Event store health indicator initialized");
        return new EventStoreHealthIndicator(eventStore);
    }
}
