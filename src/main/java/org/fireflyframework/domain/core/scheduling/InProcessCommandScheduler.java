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
import org.fireflyframework.domain.core.exception.DeferredSchedulingNotSupportedException;
import org.fireflyframework.domain.core.exception.DuplicateCommandException;
import org.fireflyframework.domain.core.exception.PreconditionEvaluationException;
import org.fireflyframework.domain.core.observability.CommandSchedulingEvents;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;

/**
 * Scheduler with no means of waking up later. Due commands that may be delivered
 * during scheduling are delivered immediately once their precondition holds, through
 * the resolved pipeline so that middleware wraps the delivery; unsatisfied commands
 * are handed to the redelivery handler; anything else is rejected with
 * {@link DeferredSchedulingNotSupportedException}.
 */
@Slf4j
public class InProcessCommandScheduler<T> implements CommandScheduler<T> {

    private final Class<T> targetType;
    private final ScheduledCommandTarget<T> target;
    private final CommandPreconditionVerifier preconditionVerifier;
    private final CommandRedeliveryHandler redeliveryHandler;
    private final CommandSchedulerResolver resolver;
    private final CommandSchedulingEvents events;
    private final Duration preconditionTimeout;
    private final Duration deliveryTimeout;

    private InProcessCommandScheduler(Builder<T> builder) {
        this.targetType = Objects.requireNonNull(builder.targetType, "targetType");
        this.target = Objects.requireNonNull(builder.target, "target");
        this.preconditionVerifier = builder.preconditionVerifier != null
                ? builder.preconditionVerifier : CommandPreconditionVerifier.alwaysSatisfied();
        this.redeliveryHandler = Objects.requireNonNull(builder.redeliveryHandler, "redeliveryHandler");
        this.resolver = builder.resolver;
        this.events = builder.events != null ? builder.events : new CommandSchedulingEvents() {};
        this.preconditionTimeout = builder.preconditionTimeout;
        this.deliveryTimeout = builder.deliveryTimeout;
    }

    public static <T> Builder<T> builder(Class<T> targetType, ScheduledCommandTarget<T> target) {
        return new Builder<>(targetType, target);
    }

    public Class<T> getTargetType() {
        return targetType;
    }

    @Override
    public Mono<Void> schedule(ScheduledCommand<T> command) {
        return Mono.defer(() -> {
            boolean deliverable = command.getCommand().canBeDeliveredDuringScheduling()
                    && !command.getCommand().requiresDurableScheduling();
            boolean due = command.isDue();
            events.onScheduleRequested(command.commandName(), command.getTargetId(), due);

            if (deliverable && due) {
                int attempt = command.recordDeliveryAttempt();
                return evaluatePrecondition(command).flatMap(outcome -> outcome.satisfied()
                        ? pipeline().deliver(command)
                        : handOff(command, outcome, attempt));
            }
            if (!command.isTerminal()) {
                events.onDeferredSchedulingRejected(command.commandName(), command.getTargetId());
                return Mono.error(new DeferredSchedulingNotSupportedException(
                        command.commandName(), command.getTargetId()));
            }
            log.debug("[commands] Ignoring terminal command id={} result={}", command.getId(), command.getResult());
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> deliver(ScheduledCommand<T> command) {
        return Mono.defer(() -> {
            if (command.isTerminal()) {
                log.debug("[commands] Skipping delivery of terminal command id={}", command.getId());
                return Mono.empty();
            }
            long start = System.nanoTime();
            Mono<Void> delivery = target.applyScheduledCommand(command);
            if (deliveryTimeout != null) {
                delivery = delivery.timeout(deliveryTimeout);
            }
            return delivery.doOnSuccess(v -> reportOutcome(command, start));
        });
    }

    private void reportOutcome(ScheduledCommand<T> command, long startNanos) {
        long latencyMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        CommandResult result = command.getResult();
        if (result instanceof CommandSucceeded) {
            events.onDelivered(command.commandName(), command.getTargetId(), latencyMs);
        } else if (result instanceof CommandFailed failed) {
            if (failed.error() instanceof DuplicateCommandException duplicate) {
                events.onDuplicateCommand(command.commandName(), command.getTargetId(), duplicate.getToken());
            }
            events.onDeliveryFailed(command.commandName(), command.getTargetId(), failed.error(), latencyMs);
        }
    }

    private Mono<PreconditionOutcome> evaluatePrecondition(ScheduledCommand<T> command) {
        Mono<Boolean> check = Mono.defer(() -> preconditionVerifier.isPreconditionSatisfied(command));
        if (preconditionTimeout != null) {
            check = check.timeout(preconditionTimeout);
        }
        return check
                .map(satisfied -> Boolean.TRUE.equals(satisfied)
                        ? PreconditionOutcome.SATISFIED : PreconditionOutcome.UNSATISFIED)
                .defaultIfEmpty(PreconditionOutcome.UNSATISFIED)
                .onErrorResume(e -> {
                    log.warn("[commands] Precondition evaluation failed for command={} targetId={}: {}",
                            command.commandName(), command.getTargetId(), e.toString());
                    return Mono.just(PreconditionOutcome.failed(
                            new PreconditionEvaluationException(command.getTargetId(), e)));
                });
    }

    private Mono<Void> handOff(ScheduledCommand<T> command, PreconditionOutcome outcome, int attempt) {
        events.onPreconditionUnsatisfied(command.commandName(), command.getTargetId(), outcome.reason(), attempt);
        var context = new RedeliveryContext(outcome.reason(), outcome.cause(), attempt, DomainClock.now());
        return redeliveryHandler.deliverSoon(command, context);
    }

    private CommandScheduler<T> pipeline() {
        return resolver != null ? resolver.resolve(targetType) : this;
    }

    private record PreconditionOutcome(boolean satisfied, RedeliveryReason reason, Throwable cause) {
        static final PreconditionOutcome SATISFIED = new PreconditionOutcome(true, null, null);
        static final PreconditionOutcome UNSATISFIED =
                new PreconditionOutcome(false, RedeliveryReason.PRECONDITION_UNSATISFIED, null);

        static PreconditionOutcome failed(Throwable cause) {
            return new PreconditionOutcome(false, RedeliveryReason.PRECONDITION_EVALUATION_FAILED, cause);
        }
    }

    public static final class Builder<T> {
        private final Class<T> targetType;
        private final ScheduledCommandTarget<T> target;
        private CommandPreconditionVerifier preconditionVerifier;
        private CommandRedeliveryHandler redeliveryHandler;
        private CommandSchedulerResolver resolver;
        private CommandSchedulingEvents events;
        private Duration preconditionTimeout;
        private Duration deliveryTimeout;

        private Builder(Class<T> targetType, ScheduledCommandTarget<T> target) {
            this.targetType = targetType;
            this.target = target;
        }

        public Builder<T> preconditionVerifier(CommandPreconditionVerifier verifier) {
            this.preconditionVerifier = verifier;
            return this;
        }

        public Builder<T> redeliveryHandler(CommandRedeliveryHandler handler) {
            this.redeliveryHandler = handler;
            return this;
        }

        /**
         * Resolver used to find the composed pipeline for immediate deliveries. Without
         * one the scheduler delivers directly.
         */
        public Builder<T> resolver(CommandSchedulerResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder<T> events(CommandSchedulingEvents events) {
            this.events = events;
            return this;
        }

        public Builder<T> preconditionTimeout(Duration timeout) {
            this.preconditionTimeout = timeout;
            return this;
        }

        public Builder<T> deliveryTimeout(Duration timeout) {
            this.deliveryTimeout = timeout;
            return this;
        }

        public InProcessCommandScheduler<T> build() {
            return new InProcessCommandScheduler<>(this);
        }
    }
}
