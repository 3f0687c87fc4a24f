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

import org.fireflyframework.domain.core.aggregate.EventSourcedAggregate;
import org.fireflyframework.domain.core.idempotency.IdempotencyChecker;
import org.fireflyframework.domain.core.observability.CommandSchedulingEvents;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Function;

/**
 * Builds in-process schedulers with the shared collaborators and registers them, so
 * each returned scheduler is already wrapped in the registry's middleware.
 */
public class CommandSchedulerFactory {

    private final CommandSchedulerRegistry registry;
    private final IdempotencyChecker idempotencyChecker;
    private final CommandPreconditionVerifier preconditionVerifier;
    private final CommandRedeliveryHandler redeliveryHandler;
    private final CommandSchedulingEvents events;
    private final Duration preconditionTimeout;
    private final Duration deliveryTimeout;

    public CommandSchedulerFactory(CommandSchedulerRegistry registry, IdempotencyChecker idempotencyChecker,
                                   CommandPreconditionVerifier preconditionVerifier,
                                   CommandRedeliveryHandler redeliveryHandler, CommandSchedulingEvents events,
                                   Duration preconditionTimeout, Duration deliveryTimeout) {
        this.registry = registry;
        this.idempotencyChecker = idempotencyChecker;
        this.preconditionVerifier = preconditionVerifier;
        this.redeliveryHandler = redeliveryHandler;
        this.events = events;
        this.preconditionTimeout = preconditionTimeout;
        this.deliveryTimeout = deliveryTimeout;
    }

    /**
     * Scheduler for an event-sourced aggregate type. {@code commit} runs after each
     * successful application; pass {@code null} to leave the new events pending.
     */
    public <A extends EventSourcedAggregate> CommandScheduler<A> forAggregate(
            Class<A> aggregateType, AggregateResolver<A> resolver, Function<A, Mono<Void>> commit) {
        return register(aggregateType, new AggregateCommandTarget<>(resolver, idempotencyChecker, commit));
    }

    public <T> CommandScheduler<T> forTarget(Class<T> targetType, Function<String, Mono<T>> resolver) {
        return register(targetType, new DirectCommandTarget<>(resolver));
    }

    private <T> CommandScheduler<T> register(Class<T> targetType, ScheduledCommandTarget<T> target) {
        InProcessCommandScheduler<T> scheduler = InProcessCommandScheduler.builder(targetType, target)
                .preconditionVerifier(preconditionVerifier)
                .redeliveryHandler(redeliveryHandler)
                .resolver(registry)
                .events(events)
                .preconditionTimeout(preconditionTimeout)
                .deliveryTimeout(deliveryTimeout)
                .build();
        return registry.register(targetType, scheduler);
    }
}
