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

package org.fireflyframework.domain.core.dlq;

import org.fireflyframework.domain.core.clock.DomainClock;
import org.fireflyframework.domain.core.scheduling.RedeliveryContext;
import org.fireflyframework.domain.core.scheduling.RedeliveryReason;
import org.fireflyframework.domain.core.scheduling.ScheduledCommand;

import java.time.Instant;
import java.util.UUID;

/**
 * A command that exhausted its redeliveries. The entry keeps the scheduled command
 * itself, which is still non-terminal and may be scheduled again.
 */
public record DeadLetterEntry(
        String id,
        String scheduledCommandId,
        String commandName,
        String targetId,
        RedeliveryReason reason,
        String errorMessage,
        String errorType,
        int attempts,
        ScheduledCommand<?> command,
        int retryCount,
        Instant createdAt,
        Instant lastRetriedAt
) {
    public static DeadLetterEntry create(ScheduledCommand<?> command, RedeliveryContext context) {
        Throwable error = context.cause();
        return new DeadLetterEntry(
                UUID.randomUUID().toString(), command.getId(), command.commandName(), command.getTargetId(),
                context.reason(),
                error != null ? error.getMessage() : null,
                error != null ? error.getClass().getName() : null,
                context.attempt(), command, 0, DomainClock.now(), null);
    }

    public DeadLetterEntry withRetry() {
        return new DeadLetterEntry(id, scheduledCommandId, commandName, targetId, reason, errorMessage, errorType,
                attempts, command, retryCount + 1, createdAt, DomainClock.now());
    }
}
