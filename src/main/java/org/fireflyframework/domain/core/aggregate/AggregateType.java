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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.domain.core.clock.DomainClock;
import org.fireflyframework.domain.core.event.DomainEvent;
import org.fireflyframework.domain.core.exception.InvalidVersionException;
import org.fireflyframework.domain.core.exception.PendingEventsException;
import org.fireflyframework.domain.core.idempotency.TokenFilter;
import org.fireflyframework.domain.core.snapshot.Snapshot;
import org.fireflyframework.domain.core.snapshot.SnapshotSerializer;
import org.fireflyframework.domain.core.snapshot.SnapshotStrategy;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Explicit descriptor of an event-sourced aggregate type: how to instantiate it, how
 * to capture and restore its snapshot state, and how its token filter is sized.
 *
 * <p>All reconstruction goes through this descriptor, so no reflection is needed to
 * rebuild an aggregate from events or from a snapshot.
 *
 * @param <A> aggregate type
 */
@Slf4j
public final class AggregateType<A extends EventSourcedAggregate> {

    private final Class<A> aggregateClass;
    private final String name;
    private final Function<UUID, A> factory;
    private final SnapshotStrategy<A, ?> snapshotStrategy;
    private final ObjectMapper objectMapper;
    private final Supplier<TokenFilter> tokenFilterFactory;

    private AggregateType(Builder<A> builder) {
        this.aggregateClass = builder.aggregateClass;
        this.name = builder.name != null ? builder.name : builder.aggregateClass.getSimpleName();
        this.factory = Objects.requireNonNull(builder.factory, "factory");
        this.snapshotStrategy = builder.snapshotStrategy;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : SnapshotSerializer.defaultObjectMapper();
        int expected = builder.expectedTokens;
        double fpp = builder.falsePositiveProbability;
        this.tokenFilterFactory = () -> TokenFilter.create(expected, fpp);
    }

    public static <A extends EventSourcedAggregate> Builder<A> builder(Class<A> aggregateClass, Function<UUID, A> factory) {
        return new Builder<>(aggregateClass, factory);
    }

    public Class<A> aggregateClass() { return aggregateClass; }
    public String name() { return name; }
    public boolean supportsSnapshots() { return snapshotStrategy != null; }

    /**
     * New aggregate with no history.
     */
    public A create(UUID id) {
        A aggregate = factory.apply(id);
        if (aggregate == null || !aggregate.getId().equals(id)) {
            throw new IllegalStateException("Factory for " + name + " did not produce an aggregate with id " + id);
        }
        aggregate.useTokenFilterFactory(tokenFilterFactory);
        return aggregate;
    }

    /**
     * Aggregate whose state is the replay of {@code events}, which become its committed history.
     */
    public A fromHistory(UUID id, Iterable<? extends DomainEvent> events) {
        A aggregate = create(id);
        aggregate.sourceFromHistory(events);
        return aggregate;
    }

    /**
     * Aggregate restored from {@code snapshot} with {@code deltaEvents} applied on top.
     * Delta events at or below the snapshot version are skipped.
     */
    public A fromSnapshot(Snapshot snapshot, Iterable<? extends DomainEvent> deltaEvents) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (!name.equals(snapshot.aggregateTypeName())) {
            throw new IllegalArgumentException("Snapshot of type " + snapshot.aggregateTypeName()
                    + " cannot source aggregate type " + name);
        }
        A aggregate = create(snapshot.aggregateId());
        restore(aggregate, requireSnapshotStrategy(), snapshot.state());
        aggregate.sourceFromSnapshot(snapshot, deltaEvents);
        return aggregate;
    }

    /**
     * Independent aggregate equal to {@code aggregate} as it was at {@code version},
     * built from history and pending events with sequence numbers up to {@code version}.
     * The source aggregate is not modified.
     *
     * @throws InvalidVersionException if the aggregate was sourced from a snapshot later than {@code version}
     */
    public A asOfVersion(A aggregate, long version) {
        List<DomainEvent> events = aggregate.historyAndPending()
                .filter(e -> e.getSequenceNumber() <= version)
                .collect(Collectors.toList());
        Snapshot snapshot = aggregate.getSourceSnapshot().orElse(null);
        if (snapshot != null) {
            if (snapshot.version() > version) {
                throw new InvalidVersionException(aggregate.getId(), version, snapshot.version());
            }
            return fromSnapshot(snapshot, events);
        }
        return fromHistory(aggregate.getId(), events);
    }

    /**
     * Captures a snapshot of a fully committed aggregate.
     *
     * @throws PendingEventsException if the aggregate has pending events
     */
    public Snapshot createSnapshot(A aggregate) {
        if (aggregate.hasPendingEvents()) {
            throw new PendingEventsException(aggregate.getId(), "createSnapshot");
        }
        JsonNode state = capture(aggregate, requireSnapshotStrategy());
        Snapshot snapshot = new Snapshot(aggregate.getId(), name, aggregate.version(),
                DomainClock.now(), aggregate.tokenFilter(), state);
        log.debug("[aggregate] Captured snapshot type={} aggregateId={} version={}",
                name, aggregate.getId(), snapshot.version());
        return snapshot;
    }

    private <S> JsonNode capture(A aggregate, SnapshotStrategy<A, S> strategy) {
        return objectMapper.valueToTree(strategy.captureState(aggregate));
    }

    private <S> void restore(A aggregate, SnapshotStrategy<A, S> strategy, JsonNode state) {
        try {
            strategy.restoreState(aggregate, objectMapper.treeToValue(state, strategy.stateType()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to restore snapshot state of " + name
                    + " aggregate " + aggregate.getId(), e);
        }
    }

    private SnapshotStrategy<A, ?> requireSnapshotStrategy() {
        if (snapshotStrategy == null) {
            throw new IllegalStateException("Aggregate type " + name + " has no snapshot strategy");
        }
        return snapshotStrategy;
    }

    @Override
    public String toString() {
        return "AggregateType{" + name + "}";
    }

    public static final class Builder<A extends EventSourcedAggregate> {
        private final Class<A> aggregateClass;
        private final Function<UUID, A> factory;
        private String name;
        private SnapshotStrategy<A, ?> snapshotStrategy;
        private ObjectMapper objectMapper;
        private int expectedTokens = TokenFilter.DEFAULT_EXPECTED_TOKENS;
        private double falsePositiveProbability = TokenFilter.DEFAULT_FALSE_POSITIVE_PROBABILITY;

        private Builder(Class<A> aggregateClass, Function<UUID, A> factory) {
            this.aggregateClass = Objects.requireNonNull(aggregateClass, "aggregateClass");
            this.factory = factory;
        }

        public Builder<A> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<A> snapshots(SnapshotStrategy<A, ?> strategy) {
            this.snapshotStrategy = strategy;
            return this;
        }

        public Builder<A> objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder<A> tokenFilter(int expectedTokens, double falsePositiveProbability) {
            if (expectedTokens <= 0) throw new IllegalArgumentException("expectedTokens must be > 0");
            if (falsePositiveProbability <= 0 || falsePositiveProbability >= 1) {
                throw new IllegalArgumentException("falsePositiveProbability must be in (0, 1)");
            }
            this.expectedTokens = expectedTokens;
            this.falsePositiveProbability = falsePositiveProbability;
            return this;
        }

        public AggregateType<A> build() {
            return new AggregateType<>(this);
        }
    }
}
