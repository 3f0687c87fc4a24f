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

import org.fireflyframework.domain.core.idempotency.TokenLookup;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Authoritative token lookup that scans the aggregate's stored events. Used when the
 * event store does not index tokens itself.
 */
public class EventStoreTokenLookup implements TokenLookup {

    private final EventStore eventStore;

    public EventStoreTokenLookup(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    @Override
    public Mono<Boolean> hasBeenRecorded(UUID aggregateId, String token) {
        return eventStore.load(aggregateId)
                .any(event -> token.equals(event.getToken()));
    }
}
