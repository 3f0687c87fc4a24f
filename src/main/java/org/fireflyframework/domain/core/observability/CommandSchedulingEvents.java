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

package org.fireflyframework.domain.core.observability;

import org.fireflyframework.domain.core.scheduling.RedeliveryReason;

public interface CommandSchedulingEvents {
    // Scheduling
    default void onScheduleRequested(String commandName, String targetId, boolean due) {}
    default void onPreconditionUnsatisfied(String commandName, String targetId, RedeliveryReason reason, int attempt) {}
    default void onDeferredSchedulingRejected(String commandName, String targetId) {}

    // Delivery
    default void onDelivered(String commandName, String targetId, long latencyMs) {}
    default void onDeliveryFailed(String commandName, String targetId, Throwable error, long latencyMs) {}
    default void onDuplicateCommand(String commandName, String targetId, String token) {}

    // Redelivery
    default void onRedeliveryRequested(String commandName, String targetId, int attempt, long delayMs) {}
    default void onRedeliveryExhausted(String commandName, String targetId, int attempts) {}

    // DLQ
    default void onDeadLettered(String commandName, String targetId, Throwable error) {}
}
