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

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One-shot delayed task runner backing in-process redelivery. A task id has at most
 * one pending run; scheduling it again replaces the earlier run.
 */
@Slf4j
public class RedeliveryScheduler {
    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledFuture<?>> scheduledTasks = new ConcurrentHashMap<>();

    public RedeliveryScheduler(int threadPoolSize) {
        var counter = new AtomicInteger(0);
        this.executor = Executors.newScheduledThreadPool(threadPoolSize, r -> {
            Thread t = new Thread(r, "command-redelivery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void schedule(String taskId, Runnable task, Duration delay) {
        long delayMs = Math.max(0, delay.toMillis());
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        synchronized (scheduledTasks) {
            self[0] = executor.schedule(() -> {
                synchronized (scheduledTasks) {
                    scheduledTasks.remove(taskId, self[0]);
                }
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("[scheduler] Task '{}' failed: {}", taskId, e.getMessage(), e);
                }
            }, delayMs, TimeUnit.MILLISECONDS);
            var existing = scheduledTasks.put(taskId, self[0]);
            if (existing != null) {
                existing.cancel(false);
            }
        }
        log.debug("[scheduler] Scheduled task '{}' in {}ms", taskId, delayMs);
    }

    public void cancel(String taskId) {
        var future = scheduledTasks.remove(taskId);
        if (future != null) {
            future.cancel(false);
            log.info("[scheduler] Cancelled task '{}'", taskId);
        }
    }

    public boolean isScheduled(String taskId) {
        return scheduledTasks.containsKey(taskId);
    }

    public void shutdown() {
        scheduledTasks.values().forEach(f -> f.cancel(false));
        scheduledTasks.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[scheduler] Redelivery scheduler shutdown completed");
    }

    public int activeTaskCount() {
        return scheduledTasks.size();
    }
}
