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

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.domain.core.resilience.CircuitBreakerMiddleware;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.Order;

/**
 * Auto-configuration for resilience4j circuit breaking around command delivery.
 *
 * <p>Activated when resilience4j is on the classpath and a {@code CircuitBreakerRegistry}
 * bean is available.
 */
@Slf4j
@AutoConfiguration(before = DomainAutoConfiguration.class)
@ConditionalOnClass(CircuitBreakerRegistry.class)
@ConditionalOnBean(CircuitBreakerRegistry.class)
@ConditionalOnProperty(name = "firefly.domain.resilience.enabled", havingValue = "true", matchIfMissing = true)
public class DomainResilienceAutoConfiguration {

    @Bean
    @Order(200)
    @ConditionalOnMissingBean
    public CircuitBreakerMiddleware circuitBreakerMiddleware(CircuitBreakerRegistry registry) {
        log.info("[domain] Circuit breaker middleware initialized");
        return new CircuitBreakerMiddleware(registry);
    }
}
