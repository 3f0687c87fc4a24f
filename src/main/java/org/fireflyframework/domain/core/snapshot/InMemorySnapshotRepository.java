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

package org.fireflyframework.domain.core.snapshot;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps serialized snapshots in memory, so every read hands out an independent copy.
 */
@Slf4j
public class InMemorySnapshotRepository implements SnapshotRepository {

    private final SnapshotSerializer serializer;
    private final ConcurrentHashMap<UUID, CopyOnWriteArrayList<StoredSnapshot>> store = new ConcurrentHashMap<>();

    public InMemorySnapshotRepository() {
        this(new SnapshotSerializer());
    }

    public InMemorySnapshotRepository(SnapshotSerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public Mono<Void> save(Snapshot snapshot) {
        return Mono.fromRunnable(() -> {
            store.computeIfAbsent(snapshot.aggregateId(), k -> new CopyOnWriteArrayList<>())
                    .add(new StoredSnapshot(snapshot.version(), serializer.serialize(snapshot)));
            log.debug("[snapshot] Saved snapshot aggregateId={} version={}", snapshot.aggregateId(), snapshot.version());
        });
    }

    @Override
    public Mono<Snapshot> findLatest(UUID aggregateId) {
        return findLatest(aggregateId, Long.MAX_VALUE);
    }

    @Override
    public Mono<Snapshot> findLatest(UUID aggregateId, long maxVersion) {
        return Mono.fromCallable(() -> store.getOrDefault(aggregateId, new CopyOnWriteArrayList<>()).stream()
                        .filter(s -> s.version() <= maxVersion)
                        .max(Comparator.comparingLong(StoredSnapshot::version))
                        .map(s -> serializer.deserialize(s.data()))
                        .orElse(null));
    }

    @Override
    public Mono<Long> delete(UUID aggregateId) {
        return Mono.fromCallable(() -> {
            List<StoredSnapshot> removed = store.remove(aggregateId);
            return removed != null ? (long) removed.size() : 0L;
        });
    }

    public int size() {
        return store.values().stream().mapToInt(List::size).sum();
    }

    private record StoredSnapshot(long version, byte[] data) {}
}
