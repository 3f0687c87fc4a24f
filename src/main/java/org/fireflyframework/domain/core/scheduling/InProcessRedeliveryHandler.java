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
import org.fireflyframework.domain.core.clock.DomainClock;
import org.fireflyframework.domain.core.dlq.DeadLetterService;
import org.fireflyframework.domain.core.model.RetryPolicy;
import org.fireflyframework.domain.core.observability.CommandSchedulingEvents;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;

/**
 * Redelivers commands in-process after an exponential back-off by scheduling them
 * again through the resolved pipeline. Once the retry policy is exhausted the command
 * is dead-lettered and left non-terminal. A redelivery that fails is handed back to the
 * same policy. Pending redeliveries do not survive a restart.
 */
@Slf4j
public class InProcessRedeliveryHandler implements CommandRedeliveryHandler {

    private final RetryPolicy retryPolicy;
    private final RedeliveryScheduler scheduler;
    private final CommandSchedulerResolver resolver;
    private final DeadLetterService deadLetterService;
    private final CommandSchedulingEvents events;

    public InProcessRedeliveryHandler(RetryPolicy retryPolicy, RedeliveryScheduler scheduler,
                                      CommandSchedulerResolver resolver, DeadLetterService deadLetterService,
                                      CommandSchedulingEvents events) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.deadLetterService = deadLetterService;
        this.events = events != null ? events : new CommandSchedulingEvents() {};
    }

    @Override
    public <T> Mono<Void> deliverSoon(ScheduledCommand<T> command, RedeliveryContext context) {
        return Mono.defer(() -> {
            if (!retryPolicy.shouldRetry(context.attempt())) {
                events.onRedeliveryExhausted(command.commandName(), command.getTargetId(), context.attempt());
                if (deadLetterService == null) {
                    log.warn("[commands] Giving up on command={} targetId={} after {} attempts",
                            command.commandName(), command.getTargetId(), context.attempt());
                    return Mono.empty();
                }
                return deadLetterService.deadLetter(command, context).then();
            }
            Duration delay = retryPolicy.calculateDelay(context.attempt() - 1);
            scheduler.schedule(taskId(command), () -> redeliver(command, context), delay);
            events.onRedeliveryRequested(command.commandName(), command.getTargetId(), context.attempt(), delay.toMillis());
            return Mono.empty();
        });
    }

    public void cancel(ScheduledCommand<?> command) {
        scheduler.cancel(taskId(command));
    }

    private <T> void redeliver(ScheduledCommand<T> command, RedeliveryContext previous) {
        @SuppressWarnings("unchecked")
        Class<T> targetType = (Class<T>) command.getCommand().targetType();
        resolver.resolve(targetType).schedule(command)
                .onErrorResume(e -> retryAfterFailure(command, previous, e))
                .subscribe(
                        v -> {},
                        e -> log.error("[commands] Redelivery of command={} targetId={} could not be rescheduled: {}",
                                command.commandName(), command.getTargetId(), e.getMessage(), e));
    }

    private <T> Mono<Void> retryAfterFailure(ScheduledCommand<T> command, RedeliveryContext previous, Throwable error) {
        if (command.isTerminal()) {
            log.warn("[commands] Redelivery of command={} targetId={} failed after a terminal result: {}",
                    command.commandName(), command.getTargetId(), error.toString());
            return Mono.empty();
        }
        // the attempt always advances, even when the failure happened before delivery counted one
        int attempt = Math.max(previous.attempt() + 1, command.getDeliveryAttempts());
        log.warn("[commands] Redelivery of command={} targetId={} failed on attempt {}: {}",
                command.commandName(), command.getTargetId(), attempt, error.toString());
        var context = new RedeliveryContext(RedeliveryReason.DELIVERY_FAILED, error, attempt, DomainClock.now());
        return deliverSoon(command, context);
    }

    private static String taskId(ScheduledCommand<?> command) {
        return "redeliver:" + command.getId();
    }
}
