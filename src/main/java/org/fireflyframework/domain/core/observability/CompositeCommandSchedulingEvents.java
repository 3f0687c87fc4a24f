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

import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeCommandSchedulingEvents implements CommandSchedulingEvents {
    private final List<CommandSchedulingEvents> delegates;

    public CompositeCommandSchedulingEvents(List<CommandSchedulingEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<CommandSchedulingEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onScheduleRequested(String commandName, String targetId, boolean due) { safeForEach(d -> d.onScheduleRequested(commandName, targetId, due)); }
    @Override public void onPreconditionUnsatisfied(String commandName, String targetId, RedeliveryReason reason, int attempt) { safeForEach(d -> d.onPreconditionUnsatisfied(commandName, targetId, reason, attempt)); }
    @Override public void onDeferredSchedulingRejected(String commandName, String targetId) { safeForEach(d -> d.onDeferredSchedulingRejected(commandName, targetId)); }
    @Override public void onDelivered(String commandName, String targetId, long latencyMs) { safeForEach(d -> d.onDelivered(commandName, targetId, latencyMs)); }
    @Override public void onDeliveryFailed(String commandName, String targetId, Throwable error, long latencyMs) { safeForEach(d -> d.onDeliveryFailed(commandName, targetId, error, latencyMs)); }
    @Override public void onDuplicateCommand(String commandName, String targetId, String token) { safeForEach(d -> d.onDuplicateCommand(commandName, targetId, token)); }
    @Override public void onRedeliveryRequested(String commandName, String targetId, int attempt, long delayMs) { safeForEach(d -> d.onRedeliveryRequested(commandName, targetId, attempt, delayMs)); }
    @Override public void onRedeliveryExhausted(String commandName, String targetId, int attempts) { safeForEach(d -> d.onRedeliveryExhausted(commandName, targetId, attempts)); }
    @Override public void onDeadLettered(String commandName, String targetId, Throwable error) { safeForEach(d -> d.onDeadLettered(commandName, targetId, error)); }
}
