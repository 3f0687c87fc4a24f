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

package org.fireflyframework.domain.persistence;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.domain.core.aggregate.AggregateType;
import org.fireflyframework.domain.core.aggregate.EventSourcedAggregate;
import org.fireflyframework.domain.core.event.DomainEvent;
import org.fireflyframework.domain.core.snapshot.Snapshot;
import org.fireflyframework.domain.core.snapshot.SnapshotRepository;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Loads and commits aggregates of one type against an {@link EventStore}.
 *
 * <p>When a {@link SnapshotRepository} is configured, {@link #get(UUID)} sources the
 * aggregate from the latest snapshot plus the events stored after it; such aggregates
 * have no event history available.
 */
@Slf4j
public class EventSourcedRepository<A extends EventSourcedAggregate> {

    private final AggregateType<A> aggregateType;
    private final EventStore eventStore;
    private final SnapshotRepository snapshotRepository;

    public EventSourcedRepository(AggregateType<A> aggregateType, EventStore eventStore) {
        this(aggregateType, eventStore, null);
    }

    public EventSourcedRepository(AggregateType<A> aggregateType, EventStore eventStore,
                                  SnapshotRepository snapshotRepository) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.snapshotRepository = snapshotRepository;
    }

    public AggregateType<A> getAggregateType() {
        return aggregateType;
    }

    /**
     * The aggregate as currently stored, or empty when nothing was ever stored for it.
     */
    public Mono<A> get(UUID aggregateId) {
        Mono<A> fromHistory = getFromHistory(aggregateId);
        if (snapshotRepository == null || !aggregateType.supportsSnapshots()) {
            return fromHistory;
        }
        return snapshotRepository.findLatest(aggregateId)
                .flatMap(snapshot -> eventStore.load(aggregateId, snapshot.version()).collectList()
                        .map(delta -> aggregateType.fromSnapshot(snapshot, delta)))
                .switchIfEmpty(fromHistory);
    }

    /**
     * Aggregate rebuilt from its full stored history, ignoring snapshots.
     */
    public Mono<A> getFromHistory(UUID aggregateId) {
        return eventStore.load(aggregateId).collectList()
                .filter(events -> !events.isEmpty())
                .map(events -> aggregateType.fromHistory(aggregateId, events));
    }

    /**
     * Commits pending events, expecting the stream to be at the version the first pending
     * event was recorded against, then folds them into history.
     */
    public Mono<A> save(A aggregate) {
        return Mono.defer(() -> {
            List<DomainEvent> pending = aggregate.getPendingEvents();
            if (pending.isEmpty()) {
                return Mono.just(aggregate);
            }
            long expectedVersion = pending.get(0).getSequenceNumber() - 1;
            return eventStore.append(aggregateType.name(), aggregate.getId(), List.copyOf(pending), expectedVersion)
                    .doOnNext(stored -> {
                        aggregate.confirmSave();
                        log.debug("[repository] Saved {} aggregateId={} version={}",
                                aggregateType.name(), aggregate.getId(), aggregate.version());
                    })
                    .thenReturn(aggregate);
        });
    }

    /**
     * Merges events stored since the aggregate's version into it.
     */
    public Mono<A> refresh(A aggregate) {
        return eventStore.load(aggregate.getId(), aggregate.version()).collectList()
                .map(events -> {
                    aggregate.update(events);
                    return aggregate;
                });
    }

    /**
     * Captures a snapshot of the committed aggregate and stores it.
     */
    public Mono<Snapshot> snapshot(A aggregate) {
        if (snapshotRepository == null) {
            return Mono.error(new IllegalStateException("No snapshot repository configured for " + aggregateType.name()));
        }
        return Mono.fromCallable(() -> aggregateType.createSnapshot(aggregate))
                .flatMap(snapshot -> snapshotRepository.save(snapshot).thenReturn(snapshot));
    }
}
