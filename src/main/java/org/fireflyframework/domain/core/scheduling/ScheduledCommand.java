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

import org.fireflyframework.domain.core.clock.DomainClock;
import org.fireflyframework.domain.core.command.Command;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A command plus its delivery metadata. The result is set exactly once; a command
 * with a result is terminal.
 *
 * @param <T> target type of the command
 */
public final class ScheduledCommand<T> {

    private final String id;
    private final Command<T> command;
    private final String targetId;
    private final UUID aggregateId;
    private final Instant dueTime;
    private final DeliveryPrecondition precondition;
    private final AtomicReference<CommandResult> result = new AtomicReference<>();
    private final AtomicInteger deliveryAttempts = new AtomicInteger();

    public ScheduledCommand(Command<T> command, String targetId, Instant dueTime, DeliveryPrecondition precondition) {
        this.id = UUID.randomUUID().toString();
        this.command = Objects.requireNonNull(command, "command");
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId must not be blank");
        }
        this.targetId = targetId;
        this.aggregateId = command.targetsEventSourcedAggregate() ? UUID.fromString(targetId) : null;
        this.dueTime = dueTime;
        this.precondition = precondition;
    }

    public static <T> ScheduledCommand<T> forAggregate(Command<T> command, UUID aggregateId) {
        return forAggregate(command, aggregateId, null);
    }

    public static <T> ScheduledCommand<T> forAggregate(Command<T> command, UUID aggregateId, Instant dueTime) {
        return new ScheduledCommand<>(command, Objects.requireNonNull(aggregateId, "aggregateId").toString(), dueTime, null);
    }

    public static <T> ScheduledCommand<T> forTarget(Command<T> command, String targetId, Instant dueTime) {
        return new ScheduledCommand<>(command, targetId, dueTime, null);
    }

    public String getId() { return id; }
    public Command<T> getCommand() { return command; }
    public String getTargetId() { return targetId; }
    public Instant getDueTime() { return dueTime; }
    public int getDeliveryAttempts() { return deliveryAttempts.get(); }

    /**
     * Aggregate linkage; empty when the command's target is not event-sourced.
     */
    public Optional<UUID> getAggregateId() {
        return Optional.ofNullable(aggregateId);
    }

    public Optional<DeliveryPrecondition> getPrecondition() {
        return Optional.ofNullable(precondition);
    }

    public ScheduledCommand<T> withPrecondition(DeliveryPrecondition precondition) {
        return new ScheduledCommand<>(command, targetId, dueTime, precondition);
    }

    public String commandName() {
        return command.commandName();
    }

    public boolean isDue() {
        return isDue(DomainClock.current());
    }

    /**
     * Due when not terminal and either unscheduled or scheduled at or before {@code clock}'s now.
     */
    public boolean isDue(Clock clock) {
        if (isTerminal()) {
            return false;
        }
        return dueTime == null || !dueTime.isAfter(clock.instant());
    }

    public CommandResult getResult() {
        return result.get();
    }

    public boolean isTerminal() {
        return result.get() != null;
    }

    public void succeeded() {
        setResult(new CommandSucceeded(DomainClock.now()));
    }

    public void failed(Throwable error) {
        setResult(new CommandFailed(error, DomainClock.now()));
    }

    public void setResult(CommandResult commandResult) {
        Objects.requireNonNull(commandResult, "commandResult");
        if (!result.compareAndSet(null, commandResult)) {
            throw new IllegalStateException("Scheduled command " + id + " already has result " + result.get());
        }
    }

    int recordDeliveryAttempt() {
        return deliveryAttempts.incrementAndGet();
    }

    @Override
    public String toString() {
        return "ScheduledCommand{id=" + id + ", command=" + commandName() + ", targetId=" + targetId
                + ", dueTime=" + dueTime + ", result=" + result.get() + "}";
    }
}
