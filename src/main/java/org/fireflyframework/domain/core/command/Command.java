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

package org.fireflyframework.domain.core.command;

import org.fireflyframework.domain.core.aggregate.EventSourcedAggregate;
import org.fireflyframework.domain.core.exception.CommandValidationException;
import org.springframework.core.ResolvableType;

import java.util.Objects;

/**
 * An intent to change a target of type {@code T}.
 *
 * <p>Subclasses implement {@link #handle(Object)}; callers go through
 * {@link #applyTo(Object)}, which validates first. While a command applies to an
 * {@link EventSourcedAggregate}, every event it records carries the command's token.
 *
 * @param <T> target type, resolved from the subclass's generic signature
 */
public abstract class Command<T> {

    private final String token;
    private final Class<?> targetType;

    protected Command() {
        this(null);
    }

    protected Command(String token) {
        this.token = token;
        Class<?> resolved = ResolvableType.forClass(getClass()).as(Command.class).resolveGeneric(0);
        if (resolved == null) {
            throw new IllegalStateException("Cannot resolve the target type of command " + getClass().getName()
                    + "; declare it as a concrete subclass of Command<T>");
        }
        this.targetType = resolved;
    }

    /**
     * Idempotency token, or {@code null} when the command makes no idempotency claim.
     */
    public String getToken() {
        return token;
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    public Class<?> targetType() {
        return targetType;
    }

    public boolean targetsEventSourcedAggregate() {
        return EventSourcedAggregate.class.isAssignableFrom(targetType);
    }

    public String commandName() {
        return getClass().getSimpleName();
    }

    /**
     * Whether the scheduler may deliver this command in the same call that schedules it.
     */
    public boolean canBeDeliveredDuringScheduling() {
        return true;
    }

    /**
     * Whether the command must be persisted by a durable scheduler before delivery.
     */
    public boolean requiresDurableScheduling() {
        return false;
    }

    public CommandValidator<T> validator() {
        return CommandValidator.none();
    }

    protected abstract void handle(T target);

    /**
     * Validates this command against {@code target} without applying it.
     */
    public final ValidationReport validate(T target) {
        Objects.requireNonNull(target, "target");
        return validator().validate(this, target);
    }

    public final boolean isValidTo(T target) {
        return !validate(target).hasFailures();
    }

    public final void applyTo(T target) {
        ValidationReport report = validate(target);
        if (report.hasFailures()) {
            throw new CommandValidationException(commandName(), report.failures());
        }
        if (target instanceof EventSourcedAggregate aggregate) {
            aggregate.withCommandToken(token, () -> handle(target));
        } else {
            handle(target);
        }
    }

    @Override
    public String toString() {
        return commandName() + "{token=" + token + "}";
    }
}
