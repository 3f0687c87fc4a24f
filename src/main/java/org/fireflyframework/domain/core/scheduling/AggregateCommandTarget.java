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
import org.fireflyframework.domain.core.aggregate.EventSourcedAggregate;
import org.fireflyframework.domain.core.command.Command;
import org.fireflyframework.domain.core.exception.AggregateNotFoundException;
import org.fireflyframework.domain.core.exception.DuplicateCommandException;
import org.fireflyframework.domain.core.idempotency.IdempotencyChecker;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Delivers commands to event-sourced aggregates: resolves the aggregate, rejects
 * commands whose token is already recorded, applies the command and runs the optional
 * commit step.
 *
 * <p>Without a commit step the new events stay pending on the resolved instance and
 * the caller is responsible for committing them. When the commit step fails or is cancelled its
 * error propagates, the command stays non-terminal and the uncommitted events are discarded
 * so that a retry with the same token is not mistaken for a duplicate.
 */
@Slf4j
public class AggregateCommandTarget<A extends EventSourcedAggregate> implements ScheduledCommandTarget<A> {

    private final AggregateResolver<A> resolver;
    private final IdempotencyChecker idempotencyChecker;
    private final Function<A, Mono<Void>> commit;

    public AggregateCommandTarget(AggregateResolver<A> resolver, IdempotencyChecker idempotencyChecker) {
        this(resolver, idempotencyChecker, aggregate -> Mono.empty());
    }

    public AggregateCommandTarget(AggregateResolver<A> resolver, IdempotencyChecker idempotencyChecker,
                                  Function<A, Mono<Void>> commit) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.idempotencyChecker = Objects.requireNonNull(idempotencyChecker, "idempotencyChecker");
        this.commit = commit != null ? commit : aggregate -> Mono.empty();
    }

    @Override
    public Mono<Void> applyScheduledCommand(ScheduledCommand<A> command) {
        UUID aggregateId = command.getAggregateId()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Command " + command.commandName() + " has no aggregate linkage"));
        return resolver.resolve(aggregateId)
                .flatMap(aggregate -> apply(aggregate, command).thenReturn(true))
                .switchIfEmpty(Mono.fromCallable(() -> {
                    command.failed(new AggregateNotFoundException(aggregateId));
                    return false;
                }))
                .then();
    }

    private Mono<Void> apply(A aggregate, ScheduledCommand<A> scheduled) {
        Command<A> command = scheduled.getCommand();
        return idempotencyChecker.hasToken(aggregate, command.getToken())
                .flatMap(duplicate -> {
                    if (duplicate) {
                        scheduled.failed(new DuplicateCommandException(scheduled.getTargetId(), command.getToken()));
                        return Mono.<Void>empty();
                    }
                    long before = aggregate.version();
                    try {
                        command.applyTo(aggregate);
                    } catch (RuntimeException e) {
                        scheduled.failed(e);
                        return Mono.<Void>empty();
                    }
                    log.debug("[commands] Applied {} to aggregateId={} version {} -> {}",
                            scheduled.commandName(), aggregate.getId(), before, aggregate.version());
                    return Mono.defer(() -> commit.apply(aggregate))
                            .doOnError(e -> {
                                log.warn("[commands] Commit of {} failed for aggregateId={}: {}",
                                        scheduled.commandName(), aggregate.getId(), e.toString());
                                aggregate.discardPendingEvents();
                            })
                            .doOnCancel(aggregate::discardPendingEvents)
                            .then(Mono.<Void>fromRunnable(scheduled::succeeded));
                });
    }
}
