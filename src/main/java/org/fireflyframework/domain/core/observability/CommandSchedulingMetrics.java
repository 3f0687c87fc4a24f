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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.domain.core.scheduling.RedeliveryReason;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class CommandSchedulingMetrics implements CommandSchedulingEvents {
    private static final String PREFIX = "firefly.domain.commands";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public CommandSchedulingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onScheduleRequested(String commandName, String targetId, boolean due) {
        counter("scheduled", "command", commandName, "due", String.valueOf(due)).increment();
    }

    @Override
    public void onPreconditionUnsatisfied(String commandName, String targetId, RedeliveryReason reason, int attempt) {
        counter("precondition.unsatisfied", "command", commandName, "reason", reason.name()).increment();
    }

    @Override
    public void onDeferredSchedulingRejected(String commandName, String targetId) {
        counter("deferred.rejected", "command", commandName).increment();
    }

    @Override
    public void onDelivered(String commandName, String targetId, long latencyMs) {
        counter("delivered", "command", commandName, "success", "true").increment();
        timer("delivery.duration", "command", commandName).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onDeliveryFailed(String commandName, String targetId, Throwable error, long latencyMs) {
        counter("delivered", "command", commandName, "success", "false").increment();
        timer("delivery.duration", "command", commandName).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onDuplicateCommand(String commandName, String targetId, String token) {
        counter("duplicates", "command", commandName).increment();
    }

    @Override
    public void onRedeliveryRequested(String commandName, String targetId, int attempt, long delayMs) {
        counter("redeliveries", "command", commandName).increment();
    }

    @Override
    public void onRedeliveryExhausted(String commandName, String targetId, int attempts) {
        counter("redeliveries.exhausted", "command", commandName).increment();
    }

    @Override
    public void onDeadLettered(String commandName, String targetId, Throwable error) {
        counter("dlq.entries", "command", commandName).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
