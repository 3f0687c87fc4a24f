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
import org.fireflyframework.domain.core.event.DomainEvent;
import org.fireflyframework.domain.core.exception.ConcurrencyException;
import org.fireflyframework.domain.core.idempotency.TokenLookup;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event store held in memory. Appends are serialized, so store ids follow append order
 * across all aggregates. Also answers the authoritative token lookup from the stored
 * tokens.
 */
@Slf4j
public class InMemoryEventStore implements EventStore, TokenLookup {

    private final Map<UUID, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final Map<UUID, Set<String>> tokens = new ConcurrentHashMap<>();
    private final List<StoredEvent> allEvents = new CopyOnWriteArrayList<>();
    private long lastId;

    @Override
    public Mono<List<StoredEvent>> append(String streamName, UUID aggregateId, List<? extends DomainEvent> events,
                                          long expectedVersion) {
        return Mono.fromCallable(() -> doAppend(streamName, aggregateId, events, expectedVersion));
    }

    private synchronized List<StoredEvent> doAppend(String streamName, UUID aggregateId,
                                                    List<? extends DomainEvent> events, long expectedVersion) {
        List<StoredEvent> stream = streams.getOrDefault(aggregateId, List.of());
        long actualVersion = stream.isEmpty() ? 0L : stream.get(stream.size() - 1).sequenceNumber();
        if (actualVersion != expectedVersion) {
            throw new ConcurrencyException(aggregateId, expectedVersion, actualVersion);
        }
        if (!stream.isEmpty() && !stream.get(0).streamName().equals(streamName)) {
            throw new IllegalArgumentException("Aggregate " + aggregateId + " belongs to stream "
                    + stream.get(0).streamName() + ", not " + streamName);
        }
        long next = expectedVersion + 1;
        for (DomainEvent event : events) {
            if (!aggregateId.equals(event.getAggregateId())) {
                throw new IllegalArgumentException("Event " + event.eventType() + " belongs to aggregate "
                        + event.getAggregateId() + ", not " + aggregateId);
            }
            if (event.getSequenceNumber() != next++) {
                throw new IllegalArgumentException("Event " + event.eventType() + " has sequence number "
                        + event.getSequenceNumber() + ", expected " + (next - 1));
            }
        }
        List<StoredEvent> stored = new ArrayList<>(events.size());
        for (DomainEvent event : events) {
            stored.add(StoredEvent.of(++lastId, streamName, event));
        }
        streams.computeIfAbsent(aggregateId, k -> new CopyOnWriteArrayList<>()).addAll(stored);
        Set<String> aggregateTokens = tokens.computeIfAbsent(aggregateId, k -> ConcurrentHashMap.newKeySet());
        for (DomainEvent event : events) {
            if (event.hasToken()) {
                aggregateTokens.add(event.getToken());
            }
        }
        allEvents.addAll(stored);
        log.debug("[event-store] Appended {} event(s) stream={} aggregateId={} version={}",
                stored.size(), streamName, aggregateId, expectedVersion + stored.size());
        return List.copyOf(stored);
    }

    @Override
    public Flux<DomainEvent> load(UUID aggregateId, long afterVersion) {
        return Flux.defer(() -> Flux.fromIterable(streams.getOrDefault(aggregateId, List.of())))
                .filter(e -> e.sequenceNumber() > afterVersion)
                .map(StoredEvent::event);
    }

    @Override
    public Mono<Long> version(UUID aggregateId) {
        return Mono.fromCallable(() -> {
            List<StoredEvent> stream = streams.getOrDefault(aggregateId, List.of());
            return stream.isEmpty() ? 0L : stream.get(stream.size() - 1).sequenceNumber();
        });
    }

    @Override
    public Flux<StoredEvent> readAll(long afterId) {
        return Flux.defer(() -> Flux.fromIterable(allEvents))
                .filter(e -> e.id() > afterId);
    }

    @Override
    public Mono<Boolean> hasBeenRecorded(UUID aggregateId, String token) {
        return Mono.fromCallable(() -> tokens.getOrDefault(aggregateId, Set.of()).contains(token));
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    // Test helpers
    public int size() { return allEvents.size(); }
    public synchronized void clear() {
        streams.clear();
        tokens.clear();
        allEvents.clear();
        lastId = 0;
    }
}
