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

import org.fireflyframework.domain.core.event.DomainEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Durable, append-only store of aggregate events.
 */
public interface EventStore {

    /**
     * Appends sequenced events to the aggregate's stream.
     *
     * @param expectedVersion version of the stream the events were recorded against
     * @return the stored records, in order
     * @throws org.fireflyframework.domain.core.exception.ConcurrencyException (as an error signal)
     *         when the stream's version differs from {@code expectedVersion}
     */
    Mono<List<StoredEvent>> append(String streamName, UUID aggregateId, List<? extends DomainEvent> events,
                                   long expectedVersion);

    /**
     * Events of the aggregate in sequence order.
     */
    default Flux<DomainEvent> load(UUID aggregateId) {
        return load(aggregateId, 0L);
    }

    /**
     * Events of the aggregate with a sequence number greater than {@code afterVersion}.
     */
    Flux<DomainEvent> load(UUID aggregateId, long afterVersion);

    /**
     * Current stream version; {@code 0} for an unknown aggregate.
     */
    Mono<Long> version(UUID aggregateId);

    /**
     * Every stored event with an id greater than {@code afterId}, in store order.
     */
    Flux<StoredEvent> readAll(long afterId);

    Mono<Boolean> isHealthy();
}
