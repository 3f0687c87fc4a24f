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

package org.fireflyframework.domain.core.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps target types to their schedulers. Every registered scheduler is wrapped in the
 * registry's middleware chain once, at registration.
 */
@Slf4j
public class CommandSchedulerRegistry implements CommandSchedulerResolver {

    private final List<CommandSchedulingMiddleware> middleware;
    private final Map<Class<?>, CommandScheduler<?>> schedulers = new ConcurrentHashMap<>();

    public CommandSchedulerRegistry() {
        this(List.of());
    }

    public CommandSchedulerRegistry(List<? extends CommandSchedulingMiddleware> middleware) {
        this.middleware = List.copyOf(middleware);
    }

    public <T> CommandScheduler<T> register(Class<T> targetType, CommandScheduler<T> scheduler) {
        CommandScheduler<T> pipeline = CommandSchedulerPipeline.compose(scheduler, middleware);
        if (schedulers.putIfAbsent(targetType, pipeline) != null) {
            throw new IllegalStateException("A command scheduler is already registered for " + targetType.getName());
        }
        log.info("[commands] Registered scheduler for {} with {} middleware", targetType.getSimpleName(), middleware.size());
        return pipeline;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> CommandScheduler<T> resolve(Class<T> targetType) {
        CommandScheduler<?> scheduler = schedulers.get(targetType);
        if (scheduler == null) {
            throw new IllegalArgumentException("No command scheduler registered for " + targetType.getName());
        }
        return (CommandScheduler<T>) scheduler;
    }

    public boolean isRegistered(Class<?> targetType) {
        return schedulers.containsKey(targetType);
    }

    public Set<Class<?>> registeredTypes() {
        return Set.copyOf(schedulers.keySet());
    }

    public List<CommandSchedulingMiddleware> getMiddleware() {
        return middleware;
    }
}
