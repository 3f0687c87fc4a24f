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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.domain.core.scheduling.RedeliveryReason;

@Slf4j
public class CommandSchedulingLoggerEvents implements CommandSchedulingEvents {
    @Override
    public void onScheduleRequested(String commandName, String targetId, boolean due) {
        log.debug("[commands] schedule.requested command={} targetId={} due={}", commandName, targetId, due);
    }
    @Override
    public void onPreconditionUnsatisfied(String commandName, String targetId, RedeliveryReason reason, int attempt) {
        log.info("[commands] precondition.unsatisfied command={} targetId={} reason={} attempt={}", commandName, targetId, reason, attempt);
    }
    @Override
    public void onDeferredSchedulingRejected(String commandName, String targetId) {
        log.warn("[commands] deferred.rejected command={} targetId={}", commandName, targetId);
    }
    @Override
    public void onDelivered(String commandName, String targetId, long latencyMs) {
        log.info("[commands] delivered command={} targetId={} latencyMs={}", commandName, targetId, latencyMs);
    }
    @Override
    public void onDeliveryFailed(String commandName, String targetId, Throwable error, long latencyMs) {
        log.warn("[commands] delivery.failed command={} targetId={} latencyMs={} error={}", commandName, targetId, latencyMs, error.getMessage());
    }
    @Override
    public void onDuplicateCommand(String commandName, String targetId, String token) {
        log.info("[commands] duplicate command={} targetId={} token={}", commandName, targetId, token);
    }
    @Override
    public void onRedeliveryRequested(String commandName, String targetId, int attempt, long delayMs) {
        log.info("[commands] redelivery.requested command={} targetId={} attempt={} delayMs={}", commandName, targetId, attempt, delayMs);
    }
    @Override
    public void onRedeliveryExhausted(String commandName, String targetId, int attempts) {
        log.warn("[commands] redelivery.exhausted command={} targetId={} attempts={}", commandName, targetId, attempts);
    }
    @Override
    public void onDeadLettered(String commandName, String targetId, Throwable error) {
        log.error("[commands] dead-lettered command={} targetId={} error={}", commandName, targetId, error != null ? error.getMessage() : null);
    }
}
