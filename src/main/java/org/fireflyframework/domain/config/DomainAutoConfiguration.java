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

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.domain.core.aggregate.AggregateType;
import org.fireflyframework.domain.core.aggregate.AggregateTypeRegistry;
import org.fireflyframework.domain.core.dlq.DeadLetterService;
import org.fireflyframework.domain.core.dlq.DeadLetterStore;
import org.fireflyframework.domain.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.domain.core.idempotency.IdempotencyChecker;
import org.fireflyframework.domain.core.idempotency.TokenLookup;
import org.fireflyframework.domain.core.model.RetryPolicy;
import org.fireflyframework.domain.core.observability.CommandSchedulingEvents;
import org.fireflyframework.domain.core.observability.CommandSchedulingLoggerEvents;
import org.fireflyframework.domain.core.observability.CommandSchedulingMetrics;
import org.fireflyframework.domain.core.observability.CompositeCommandSchedulingEvents;
import org.fireflyframework.domain.core.scheduling.CommandPreconditionVerifier;
import org.fireflyframework.domain.core.scheduling.CommandRedeliveryHandler;
import org.fireflyframework.domain.core.scheduling.CommandSchedulerFactory;
import org.fireflyframework.domain.core.scheduling.CommandSchedulerRegistry;
import org.fireflyframework.domain.core.scheduling.CommandSchedulingMiddleware;
import org.fireflyframework.domain.core.scheduling.InProcessRedeliveryHandler;
import org.fireflyframework.domain.core.scheduling.RedeliveryScheduler;
import org.fireflyframework.domain.core.scheduling.TokenPreconditionVerifier;
import org.fireflyframework.domain.core.snapshot.InMemorySnapshotRepository;
import org.fireflyframework.domain.core.snapshot.SnapshotRepository;
import org.fireflyframework.domain.persistence.EventStore;
import org.fireflyframework.domain.persistence.EventStoreTokenLookup;
import org.fireflyframework.domain.persistence.InMemoryEventStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Main auto-configuration for the domain runtime.
 *
 * <p>Wires the event store, snapshot repository, idempotency check, command scheduling
 * pipeline, in-process redelivery, DLQ and observability. Every bean backs off when the
 * application defines its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DomainProperties.class)
public class DomainAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(CommandSchedulingEvents.class)
    public CommandSchedulingEvents commandSchedulingEvents(DomainProperties properties,
                                                           ObjectProvider<MeterRegistry> meterRegistry) {
        List<CommandSchedulingEvents> delegates = new ArrayList<>();
        delegates.add(new CommandSchedulingLoggerEvents());
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null && properties.getMetrics().isEnabled()) {
            log.info("[domain] Command scheduling metrics enabled");
            delegates.add(new CommandSchedulingMetrics(registry));
        }
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeCommandSchedulingEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    public InMemoryEventStore eventStore() {
        log.info("[domain] Using in-memory event store (default)");
        return new InMemoryEventStore();
    }

    @Bean
    @ConditionalOnMissingBean(TokenLookup.class)
    public TokenLookup tokenLookup(EventStore eventStore) {
        log.info("[domain] Using event-store scan for authoritative token lookups");
        return new EventStoreTokenLookup(eventStore);
    }

    @Bean
    @ConditionalOnMissingBean(SnapshotRepository.class)
    public InMemorySnapshotRepository snapshotRepository() {
        log.info("[domain] Using in-memory snapshot repository (default)");
        return new InMemorySnapshotRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyChecker idempotencyChecker(TokenLookup tokenLookup) {
        return new IdempotencyChecker(tokenLookup);
    }

    @Bean
    @ConditionalOnMissingBean(CommandPreconditionVerifier.class)
    public CommandPreconditionVerifier commandPreconditionVerifier(TokenLookup tokenLookup) {
        return new TokenPreconditionVerifier(tokenLookup);
    }

    @Bean
    @ConditionalOnMissingBean
    public AggregateTypeRegistry aggregateTypeRegistry(DomainProperties properties,
                                                       ObjectProvider<AggregateType<?>> aggregateTypes) {
        var idempotency = properties.getIdempotency();
        var registry = new AggregateTypeRegistry(idempotency.getExpectedTokens(), idempotency.getFalsePositiveProbability());
        aggregateTypes.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandSchedulerRegistry commandSchedulerRegistry(ObjectProvider<CommandSchedulingMiddleware> middleware) {
        List<CommandSchedulingMiddleware> chain = middleware.orderedStream().collect(Collectors.toList());
        log.info("[domain] Command scheduling pipeline: {}", chain.stream()
                .map(m -> m.getClass().getSimpleName()).collect(Collectors.toList()));
        return new CommandSchedulerRegistry(chain);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy commandRetryPolicy(DomainProperties properties) {
        var redelivery = properties.getRedelivery();
        return new RetryPolicy(redelivery.getMaxAttempts(), redelivery.getInitialDelay(), redelivery.getMaxDelay(),
                redelivery.getMultiplier(), redelivery.getJitterFactor());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedeliveryScheduler redeliveryScheduler(DomainProperties properties) {
        int poolSize = properties.getRedelivery().getThreadPoolSize();
        log.info("[domain] Redelivery scheduler initialized with thread pool size: {}", poolSize);
        return new RedeliveryScheduler(poolSize);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterStore deadLetterStore() {
        return new InMemoryDeadLetterStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.domain.dlq.enabled", havingValue = "true", matchIfMissing = true)
    public DeadLetterService deadLetterService(DeadLetterStore store, CommandSchedulingEvents events) {
        log.info("[domain] Dead letter queue service initialized");
        return new DeadLetterService(store, events);
    }

    @Bean
    @ConditionalOnMissingBean(CommandRedeliveryHandler.class)
    public InProcessRedeliveryHandler commandRedeliveryHandler(RetryPolicy retryPolicy, RedeliveryScheduler scheduler,
                                                               CommandSchedulerRegistry registry,
                                                               ObjectProvider<DeadLetterService> deadLetterService,
                                                               CommandSchedulingEvents events) {
        log.info("[domain] In-process redelivery initialized with maxAttempts={}", retryPolicy.maxAttempts());
        return new InProcessRedeliveryHandler(retryPolicy, scheduler, registry,
                deadLetterService.getIfAvailable(), events);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandSchedulerFactory commandSchedulerFactory(CommandSchedulerRegistry registry,
                                                           IdempotencyChecker idempotencyChecker,
                                                           CommandPreconditionVerifier preconditionVerifier,
                                                           CommandRedeliveryHandler redeliveryHandler,
                                                           CommandSchedulingEvents events,
                                                           DomainProperties properties) {
        var scheduling = properties.getScheduling();
        return new CommandSchedulerFactory(registry, idempotencyChecker, preconditionVerifier, redeliveryHandler,
                events, scheduling.getPreconditionTimeout(), scheduling.getDeliveryTimeout());
    }
}
