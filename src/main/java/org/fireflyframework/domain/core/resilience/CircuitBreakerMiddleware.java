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

package org.fireflyframework.domain.core.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.fireflyframework.domain.core.scheduling.CommandScheduler;
import org.fireflyframework.domain.core.scheduling.CommandSchedulingMiddleware;
import org.fireflyframework.domain.core.scheduling.ScheduledCommand;
import reactor.core.publisher.Mono;

/**
 * Guards deliveries with one circuit breaker per target type. Only error signals count
 * as failures, so commands rejected by their target (a {@code CommandFailed} result) do
 * not trip the breaker; failing commits and timeouts do.
 */
public class CircuitBreakerMiddleware implements CommandSchedulingMiddleware {
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public CircuitBreakerMiddleware(CircuitBreakerRegistry circuitBreakerRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @Override
    public <T> Mono<Void> deliver(ScheduledCommand<T> command, CommandScheduler<T> next) {
        CircuitBreaker cb = getCircuitBreaker(command.getCommand().targetType());
        return next.deliver(command).transformDeferred(CircuitBreakerOperator.of(cb));
    }

    public CircuitBreaker getCircuitBreaker(Class<?> targetType) {
        return circuitBreakerRegistry.circuitBreaker("commands." + targetType.getSimpleName());
    }

    public void resetCircuitBreaker(Class<?> targetType) {
        getCircuitBreaker(targetType).reset();
    }
}
