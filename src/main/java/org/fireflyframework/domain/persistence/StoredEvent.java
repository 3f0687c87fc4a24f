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

import java.time.Instant;
import java.util.UUID;

/**
 * An event as held by an event store. {@code id} is the store-wide position, assigned
 * from 1 in append order.
 */
public record StoredEvent(
        long id,
        String streamName,
        UUID aggregateId,
        long sequenceNumber,
        String eventType,
        String token,
        Instant timestamp,
        DomainEvent event
) {
    public static StoredEvent of(long id, String streamName, DomainEvent event) {
        return new StoredEvent(id, streamName, event.getAggregateId(), event.getSequenceNumber(),
                event.eventType(), event.getToken(), event.getTimestamp(), event);
    }
}
