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

import org.fireflyframework.domain.core.dlq.DeadLetterService;
import org.fireflyframework.domain.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.domain.core.model.RetryPolicy;
import org.fireflyframework.domain.core.observability.CommandSchedulingEvents;
import org.fireflyframework.domain.core.scheduling.*;
import org.fireflyframework.domain.fixtures.AddItem;
import org.fireflyframework.domain.fixtures.Order;
import org.fireflyframework.domain.fixtures.Orders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class InProcessRedeliveryHandlerTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(10), 2.0, 0.0);
    private RedeliveryScheduler scheduler;
    private CommandSchedulerResolver resolver;
    private CommandScheduler<Order> orderScheduler;
    private InMemoryDeadLetterStore deadLetterStore;
    private CommandSchedulingEvents events;
    private InProcessRedeliveryHandler handler;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        scheduler = mock(RedeliveryScheduler.class);
        resolver = mock(CommandSchedulerResolver.class);
        orderScheduler = mock(CommandScheduler.class);
        when(resolver.resolve(Order.class)).thenReturn(orderScheduler);
        when(orderScheduler.schedule(any())).thenReturn(Mono.empty());
        deadLetterStore = new InMemoryDeadLetterStore();
        events = mock(CommandSchedulingEvents.class);
        handler = new InProcessRedeliveryHandler(policy, scheduler, resolver,
                new DeadLetterService(deadLetterStore, events), events);
    }

    private static ScheduledCommand<Order> command() {
        return ScheduledCommand.forAggregate(new AddItem("sku", 1), UUID.randomUUID());
    }

    private static RedeliveryContext context(int attempt) {
        return new RedeliveryContext(RedeliveryReason.PRECONDITION_UNSATISFIED, null, attempt, Orders.T0);
    }

    @Test
    void retryableAttempt_schedulesRedeliveryWithBackoff() {
        var command = command();

        StepVerifier.create(handler.deliverSoon(command, context(2))).verifyComplete();

        verify(scheduler).schedule(eq("redeliver:" + command.getId()), any(Runnable.class), eq(Duration.ofMillis(200)));
        verify(events).onRedeliveryRequested("AddItem", command.getTargetId(), 2, 200L);
        verifyNoInteractions(orderScheduler);
    }

    @Test
    void redelivery_reschedulesThroughResolvedPipeline() {
        var command = command();
        StepVerifier.create(handler.deliverSoon(command, context(1))).verifyComplete();

        var task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(anyString(), task.capture(), eq(Duration.ofMillis(100)));
        task.getValue().run();

        verify(resolver).resolve(Order.class);
        verify(orderScheduler).schedule(command);
    }

    @Test
    void failedRedelivery_isHandedBackToRetryPolicy() {
        when(orderScheduler.schedule(any())).thenReturn(Mono.error(new IllegalStateException("commit rejected")));
        var command = command();
        StepVerifier.create(handler.deliverSoon(command, context(1))).verifyComplete();

        var task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(anyString(), task.capture(), eq(Duration.ofMillis(100)));
        assertThatCode(() -> task.getValue().run()).doesNotThrowAnyException();

        verify(scheduler).schedule(eq("redeliver:" + command.getId()), any(Runnable.class), eq(Duration.ofMillis(200)));
        verify(events).onRedeliveryRequested("AddItem", command.getTargetId(), 2, 200L);
        assertThat(command.isTerminal()).isFalse();
    }

    @Test
    void failedRedelivery_onLastAttempt_deadLettersWithCause() {
        when(orderScheduler.schedule(any())).thenReturn(Mono.error(new IllegalStateException("commit rejected")));
        var command = command();
        StepVerifier.create(handler.deliverSoon(command, context(2))).verifyComplete();

        var task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(anyString(), task.capture(), eq(Duration.ofMillis(200)));
        task.getValue().run();

        verify(scheduler, times(1)).schedule(anyString(), any(), any());
        verify(events).onRedeliveryExhausted("AddItem", command.getTargetId(), 3);
        StepVerifier.create(deadLetterStore.findAll())
                .assertNext(entry -> {
                    assertThat(entry.reason()).isEqualTo(RedeliveryReason.DELIVERY_FAILED);
                    assertThat(entry.attempts()).isEqualTo(3);
                    assertThat(entry.errorMessage()).isEqualTo("commit rejected");
                })
                .verifyComplete();
        assertThat(command.isTerminal()).isFalse();
    }

    @Test
    void failedRedelivery_ofTerminalCommand_isNotRetried() {
        var command = command();
        when(orderScheduler.schedule(any())).thenAnswer(invocation -> {
            command.failed(new IllegalStateException("rejected"));
            return Mono.error(new IllegalStateException("late failure"));
        });
        StepVerifier.create(handler.deliverSoon(command, context(1))).verifyComplete();

        var task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(anyString(), task.capture(), any());
        task.getValue().run();

        verify(scheduler, times(1)).schedule(anyString(), any(), any());
        StepVerifier.create(deadLetterStore.count()).expectNext(0L).verifyComplete();
    }

    @Test
    void exhaustedAttempts_deadLetterTheCommand() {
        var command = command();

        StepVerifier.create(handler.deliverSoon(command, context(3))).verifyComplete();

        verify(scheduler, never()).schedule(anyString(), any(), any());
        verify(events).onRedeliveryExhausted("AddItem", command.getTargetId(), 3);
        StepVerifier.create(deadLetterStore.findAll())
                .assertNext(entry -> {
                    assertThat(entry.scheduledCommandId()).isEqualTo(command.getId());
                    assertThat(entry.attempts()).isEqualTo(3);
                })
                .verifyComplete();
        assertThat(command.isTerminal()).isFalse();
    }

    @Test
    void exhaustedAttempts_withoutDeadLetterService_onlyGiveUp() {
        var withoutDlq = new InProcessRedeliveryHandler(policy, scheduler, resolver, null, events);

        StepVerifier.create(withoutDlq.deliverSoon(command(), context(5))).verifyComplete();

        verify(scheduler, never()).schedule(anyString(), any(), any());
        verify(events).onRedeliveryExhausted(eq("AddItem"), anyString(), eq(5));
    }

    @Test
    void cancel_removesPendingRedelivery() {
        var command = command();

        handler.cancel(command);

        verify(scheduler).cancel("redeliver:" + command.getId());
    }
}
