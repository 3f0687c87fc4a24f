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

package org.fireflyframework.domain.core.aggregate;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.domain.core.idempotency.TokenFilter;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of aggregate type descriptors, keyed by class and by name. Types started
 * through {@link #define(Class, Function)} inherit the registry's token filter sizing.
 */
@Slf4j
public class AggregateTypeRegistry {

    private final Map<Class<?>, AggregateType<?>> byClass = new ConcurrentHashMap<>();
    private final Map<String, AggregateType<?>> byName = new ConcurrentHashMap<>();
    private final int expectedTokens;
    private final double falsePositiveProbability;

    public AggregateTypeRegistry() {
        this(TokenFilter.DEFAULT_EXPECTED_TOKENS, TokenFilter.DEFAULT_FALSE_POSITIVE_PROBABILITY);
    }

    public AggregateTypeRegistry(int expectedTokens, double falsePositiveProbability) {
        this.expectedTokens = expectedTokens;
        this.falsePositiveProbability = falsePositiveProbability;
    }

    public <A extends EventSourcedAggregate> AggregateType.Builder<A> define(Class<A> aggregateClass,
                                                                          Function<UUID, A> factory) {
        return AggregateType.builder(aggregateClass, factory).tokenFilter(expectedTokens, falsePositiveProbability);
    }

    public synchronized <A extends EventSourcedAggregate> AggregateTypeRegistry register(AggregateType<A> type) {
        AggregateType<?> sameClass = byClass.get(type.aggregateClass());
        if (sameClass != null && sameClass != type) {
            throw new IllegalStateException("Aggregate class " + type.aggregateClass().getName()
                    + " is already registered as '" + sameClass.name() + "'");
        }
        AggregateType<?> sameName = byName.get(type.name());
        if (sameName != null && sameName != type) {
            throw new IllegalStateException("Aggregate type name '" + type.name() + "' is already registered for "
                    + sameName.aggregateClass().getName());
        }
        byName.put(type.name(), type);
        byClass.put(type.aggregateClass(), type);
        log.info("[aggregate] Registered aggregate type '{}' ({})", type.name(), type.aggregateClass().getName());
        return this;
    }

    @SuppressWarnings("unchecked")
    public <A extends EventSourcedAggregate> AggregateType<A> get(Class<A> aggregateClass) {
        AggregateType<?> type = byClass.get(aggregateClass);
        if (type == null) {
            throw new IllegalArgumentException("No aggregate type registered for " + aggregateClass.getName());
        }
        return (AggregateType<A>) type;
    }

    public Optional<AggregateType<?>> findByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Collection<AggregateType<?>> getAll() {
        return Collections.unmodifiableCollection(byName.values());
    }

    public int size() {
        return byName.size();
    }
}
