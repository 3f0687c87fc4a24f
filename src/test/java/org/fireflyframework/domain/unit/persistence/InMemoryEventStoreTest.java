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

package org.fireflyframework.domain.unit.persistence;

import org.fireflyframework.domain.core.aggregate.AggregateType;
import org.fireflyframework.domain.core.event.DomainEvent;
import org.fireflyframework.domain.core.exception.ConcurrencyException;
import org.fireflyframework.domain.fixtures.ItemAdded;
import org.fireflyframework.domain.fixtures.Order;
import org.fireflyframework.domain.fixtures.Orders;
import org.fireflyframework.domain.persistence.InMemoryEventStore;
import org.fireflyframework.domain.persistence.StoredEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class InMemoryEventStoreTest {

    private final AggregateType<Order> type = Orders.type();
    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
    }

    private Order placedWithItem(String token) {
        Order order = type.create(UUID.randomUUID());
        order.place("alice");
        order.withCommandToken(token, () -> order.addItem("sku-1", 1));
        return order;
    }

    @Test
    void append_thenLoad_returnsEventsInOrder() {
        Order order = placedWithItem("t-1");

        StepVerifier.create(store.append("Order", order.getId(), order.getPendingEvents(), 0))
                .assertNext(stored -> assertThat(stored).extracting(StoredEvent::sequenceNumber).containsExactly(1L, 2L))
                .verifyComplete();

        StepVerifier.create(store.load(order.getId()).map(DomainEvent::getSequenceNumber))
                .expectNext(1L, 2L)
                .verifyComplete();
        StepVerifier.create(store.version(order.getId())).expectNext(2L).verifyComplete();
    }

    @Test
    void load_afterVersion_skipsOlderEvents() {
        Order order = placedWithItem("t-1");
        store.append("Order", order.getId(), order.getPendingEvents(), 0).block();

        StepVerifier.create(store.load(order.getId(), 1).map(DomainEvent::eventType))
                .expectNext("ItemAdded")
                .verifyComplete();
    }

    @Test
    void unknownAggregate_hasNoEventsAndVersionZero() {
        UUID id = UUID.randomUUID();

        StepVerifier.create(store.load(id)).verifyComplete();
        StepVerifier.create(store.version(id)).expectNext(0L).verifyComplete();
    }

    @Test
    void append_atStaleVersion_failsWithConcurrencyConflict() {
        Order order = placedWithItem("t-1");
        store.append("Order", order.getId(), order.getPendingEvents(), 0).block();

        StepVerifier.create(store.append("Order", order.getId(), order.getPendingEvents(), 0))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(ConcurrencyException.class)
                        .hasFieldOrPropertyWithValue("expectedVersion", 0L)
                        .hasFieldOrPropertyWithValue("actualVersion", 2L))
                .verify();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void append_withGap_isRejected() {
        UUID id = UUID.randomUUID();
        var event = Orders.stored(new ItemAdded("sku", 1), id, 3, null);

        StepVerifier.create(store.append("Order", id, List.of(event), 0))
                .expectError(IllegalArgumentException.class)
                .verify();
        assertThat(store.size()).isZero();
    }

    @Test
    void append_ofForeignEvent_isRejected() {
        var event = Orders.stored(new ItemAdded("sku", 1), UUID.randomUUID(), 1, null);

        StepVerifier.create(store.append("Order", UUID.randomUUID(), List.of(event), 0))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void append_toAnotherStreamName_isRejected() {
        Order order = placedWithItem("t-1");
        store.append("Order", order.getId(), order.getPendingEvents().subList(0, 1), 0).block();

        StepVerifier.create(store.append("Invoice", order.getId(), order.getPendingEvents().subList(1, 2), 1))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void tokens_areRecordedPerAggregate() {
        Order order = placedWithItem("t-1");
        store.append("Order", order.getId(), order.getPendingEvents(), 0).block();

        StepVerifier.create(store.hasBeenRecorded(order.getId(), "t-1")).expectNext(true).verifyComplete();
        StepVerifier.create(store.hasBeenRecorded(order.getId(), "t-2")).expectNext(false).verifyComplete();
        StepVerifier.create(store.hasBeenRecorded(UUID.randomUUID(), "t-1")).expectNext(false).verifyComplete();
    }

    @Test
    void readAll_assignsGlobalIdsAcrossStreams() {
        Order first = placedWithItem("a");
        Order second = placedWithItem("b");
        store.append("Order", first.getId(), first.getPendingEvents(), 0).block();
        store.append("Order", second.getId(), second.getPendingEvents(), 0).block();

        StepVerifier.create(store.readAll(0).map(StoredEvent::id).collectList())
                .expectNext(List.of(1L, 2L, 3L, 4L))
                .verifyComplete();
        StepVerifier.create(store.readAll(2).map(StoredEvent::aggregateId))
                .expectNext(second.getId(), second.getId())
                .verifyComplete();
    }

    @Test
    void clear_forgetsEverything() {
        Order order = placedWithItem("t-1");
        store.append("Order", order.getId(), order.getPendingEvents(), 0).block();

        store.clear();

        assertThat(store.size()).isZero();
        StepVerifier.create(store.hasBeenRecorded(order.getId(), "t-1")).expectNext(false).verifyComplete();
        StepVerifier.create(store.isHealthy()).expectNext(true).verifyComplete();
    }
}
