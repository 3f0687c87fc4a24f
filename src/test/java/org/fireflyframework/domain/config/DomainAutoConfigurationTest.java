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

package org.fireflyframework.domain.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import org.fireflyframework.domain.core.aggregate.AggregateType;
import org.fireflyframework.domain.core.aggregate.AggregateTypeRegistry;
import org.fireflyframework.domain.core.dlq.DeadLetterService;
import org.fireflyframework.domain.core.health.EventStoreHealthIndicator;
import org.fireflyframework.domain.core.idempotency.TokenLookup;
import org.fireflyframework.domain.core.model.RetryPolicy;
import org.fireflyframework.domain.core.observability.CommandSchedulingEvents;
import org.fireflyframework.domain.core.observability.CommandSchedulingLoggerEvents;
import org.fireflyframework.domain.core.observability.CommandSchedulingTracer;
import org.fireflyframework.domain.core.observability.CompositeCommandSchedulingEvents;
import org.fireflyframework.domain.core.resilience.CircuitBreakerMiddleware;
import org.fireflyframework.domain.core.scheduling.CommandRedeliveryHandler;
import org.fireflyframework.domain.core.scheduling.CommandScheduler;
import org.fireflyframework.domain.core.scheduling.CommandSchedulerFactory;
import org.fireflyframework.domain.core.scheduling.CommandSchedulerRegistry;
import org.fireflyframework.domain.core.scheduling.CommandPreconditionVerifier;
import org.fireflyframework.domain.core.scheduling.InProcessRedeliveryHandler;
import org.fireflyframework.domain.core.scheduling.ScheduledCommand;
import org.fireflyframework.domain.core.scheduling.TokenPreconditionVerifier;
import org.fireflyframework.domain.fixtures.AddItem;
import org.fireflyframework.domain.fixtures.Order;
import org.fireflyframework.domain.fixtures.Orders;
import org.fireflyframework.domain.persistence.EventSourcedRepository;
import org.fireflyframework.domain.persistence.EventStore;
import org.fireflyframework.domain.persistence.EventStoreTokenLookup;
import org.fireflyframework.domain.persistence.InMemoryEventStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class DomainAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DomainAutoConfiguration.class,
                    DomainResilienceAutoConfiguration.class,
                    DomainTracingAutoConfiguration.class,
                    DomainHealthAutoConfiguration.class));

    @Test
    void defaults_wireInMemoryRuntime() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(EventStore.class);
            assertThat(context.getBean(EventStore.class)).isInstanceOf(InMemoryEventStore.class);
            // the in-memory store answers token lookups itself
            assertThat(context.getBean(TokenLookup.class)).isSameAs(context.getBean(EventStore.class));
            assertThat(context.getBean(CommandPreconditionVerifier.class)).isInstanceOf(TokenPreconditionVerifier.class);
            assertThat(context.getBean(CommandRedeliveryHandler.class)).isInstanceOf(InProcessRedeliveryHandler.class);
            assertThat(context).hasSingleBean(DeadLetterService.class);
            assertThat(context).hasSingleBean(CommandSchedulerFactory.class);
            assertThat(context).hasSingleBean(EventStoreHealthIndicator.class);
            assertThat(context.getBean(CommandSchedulerRegistry.class).getMiddleware()).isEmpty();
            assertThat(context.getBean(CommandSchedulingEvents.class)).isInstanceOf(CommandSchedulingLoggerEvents.class);
        });
    }

    @Test
    void meterRegistry_addsMetricsToComposite() {
        contextRunner.withUserConfiguration(MeterRegistryConfig.class).run(context ->
                assertThat(context.getBean(CommandSchedulingEvents.class))
                        .isInstanceOf(CompositeCommandSchedulingEvents.class));
    }

    @Test
    void metricsDisabled_keepsLoggerOnly() {
        contextRunner.withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("firefly.domain.metrics.enabled=false")
                .run(context -> assertThat(context.getBean(CommandSchedulingEvents.class))
                        .isInstanceOf(CommandSchedulingLoggerEvents.class));
    }

    @Test
    void dlqDisabled_redeliveryStillAvailable() {
        contextRunner.withPropertyValues("firefly.domain.dlq.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(DeadLetterService.class);
            assertThat(context).hasSingleBean(InProcessRedeliveryHandler.class);
        });
    }

    @Test
    void customEventStore_isScannedForTokens() {
        contextRunner.withUserConfiguration(CustomEventStoreConfig.class).run(context -> {
            assertThat(context).doesNotHaveBean(InMemoryEventStore.class);
            assertThat(context.getBean(TokenLookup.class)).isInstanceOf(EventStoreTokenLookup.class);
        });
    }

    @Test
    void tracingAndResilience_formOrderedMiddlewareChain() {
        contextRunner.withUserConfiguration(ObservabilityConfig.class).run(context -> {
            var middleware = context.getBean(CommandSchedulerRegistry.class).getMiddleware();
            assertThat(middleware).hasSize(2);
            assertThat(middleware.get(0)).isInstanceOf(CommandSchedulingTracer.class);
            assertThat(middleware.get(1)).isInstanceOf(CircuitBreakerMiddleware.class);
        });
    }

    @Test
    void tracingDisabled_leavesOnlyCircuitBreaker() {
        contextRunner.withUserConfiguration(ObservabilityConfig.class)
                .withPropertyValues("firefly.domain.tracing.enabled=false")
                .run(context -> assertThat(context.getBean(CommandSchedulerRegistry.class).getMiddleware())
                        .singleElement().isInstanceOf(CircuitBreakerMiddleware.class));
    }

    @Test
    void healthIndicator_reportsUp() {
        contextRunner.run(context ->
                StepVerifier.create(context.getBean(EventStoreHealthIndicator.class).health())
                        .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.UP))
                        .verifyComplete());
    }

    @Test
    void properties_bindIntoRetryPolicy() {
        contextRunner.withPropertyValues(
                        "firefly.domain.redelivery.max-attempts=5",
                        "firefly.domain.redelivery.initial-delay=2s",
                        "firefly.domain.redelivery.max-delay=1m",
                        "firefly.domain.scheduling.precondition-timeout=3s")
                .run(context -> {
                    RetryPolicy policy = context.getBean(RetryPolicy.class);
                    assertThat(policy.maxAttempts()).isEqualTo(5);
                    assertThat(policy.initialDelay()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(policy.maxDelay()).isEqualTo(Duration.ofMinutes(1));
                    assertThat(context.getBean(DomainProperties.class).getScheduling().getPreconditionTimeout())
                            .isEqualTo(Duration.ofSeconds(3));
                });
    }

    @Test
    void aggregateTypeBeans_areRegistered() {
        contextRunner.withUserConfiguration(OrderTypeConfig.class).run(context -> {
            AggregateTypeRegistry registry = context.getBean(AggregateTypeRegistry.class);
            assertThat(registry.findByName("Order")).isPresent();
            assertThat(registry.get(Order.class).supportsSnapshots()).isTrue();
        });
    }

    @Test
    void wiredFactory_deliversCommandsEndToEnd() {
        contextRunner.withUserConfiguration(OrderTypeConfig.class).run(context -> {
            EventStore store = context.getBean(EventStore.class);
            AggregateType<Order> type = context.getBean(AggregateTypeRegistry.class).get(Order.class);
            var repository = new EventSourcedRepository<>(type, store);
            CommandScheduler<Order> scheduler = context.getBean(CommandSchedulerFactory.class)
                    .forAggregate(Order.class, repository::get, order -> repository.save(order).then());

            Order order = type.create(UUID.randomUUID());
            order.place("alice");
            repository.save(order).block();
            var first = ScheduledCommand.forAggregate(new AddItem("sku-1", 1, "add-1"), order.getId());
            var replay = ScheduledCommand.forAggregate(new AddItem("sku-1", 1, "add-1"), order.getId());

            StepVerifier.create(scheduler.schedule(first).then(scheduler.schedule(replay))).verifyComplete();

            assertThat(first.getResult().isSuccess()).isTrue();
            assertThat(replay.getResult().isSuccess()).isFalse();
            StepVerifier.create(store.version(order.getId())).expectNext(2L).verifyComplete();
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomEventStoreConfig {
        @Bean
        EventStore customEventStore() {
            return mock(EventStore.class);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ObservabilityConfig {
        @Bean
        ObservationRegistry observationRegistry() {
            return ObservationRegistry.create();
        }

        @Bean
        CircuitBreakerRegistry circuitBreakerRegistry() {
            return CircuitBreakerRegistry.ofDefaults();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class OrderTypeConfig {
        @Bean
        AggregateType<Order> orderType() {
            return Orders.type();
        }
    }
}
