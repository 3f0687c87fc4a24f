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

package org.fireflyframework.domain.unit.scheduling;

import org.fireflyframework.domain.core.scheduling.RedeliveryScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RedeliverySchedulerTest {

    private final RedeliveryScheduler scheduler = new RedeliveryScheduler(1);

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void scheduledTask_runsAndIsForgotten() throws InterruptedException {
        var latch = new CountDownLatch(1);

        scheduler.schedule("task", latch::countDown, Duration.ofMillis(10));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(50);
        assertThat(scheduler.isScheduled("task")).isFalse();
        assertThat(scheduler.activeTaskCount()).isZero();
    }

    @Test
    void cancel_preventsExecution() throws InterruptedException {
        var runs = new AtomicInteger();

        scheduler.schedule("task", runs::incrementAndGet, Duration.ofMillis(200));
        assertThat(scheduler.isScheduled("task")).isTrue();
        scheduler.cancel("task");

        Thread.sleep(400);
        assertThat(runs).hasValue(0);
        assertThat(scheduler.isScheduled("task")).isFalse();
    }

    @Test
    void reschedulingSameId_replacesEarlierTask() throws InterruptedException {
        var runs = new AtomicInteger();
        var latch = new CountDownLatch(1);

        scheduler.schedule("task", runs::incrementAndGet, Duration.ofMillis(200));
        scheduler.schedule("task", latch::countDown, Duration.ofMillis(10));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(400);
        assertThat(runs).hasValue(0);
    }

    @Test
    void failingTask_doesNotKillScheduler() throws InterruptedException {
        var latch = new CountDownLatch(1);

        scheduler.schedule("boom", () -> { throw new IllegalStateException("boom"); }, Duration.ZERO);
        scheduler.schedule("next", latch::countDown, Duration.ofMillis(10));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
    }
}
