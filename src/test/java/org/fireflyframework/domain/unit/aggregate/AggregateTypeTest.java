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

package org.fireflyframework.domain.unit.aggregate;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.fireflyframework.domain.core.aggregate.AggregateType;
import org.fireflyframework.domain.core.clock.DomainClock;
import org.fireflyframework.domain.core.event.DomainEvent;
import org.fireflyframework.domain.core.exception.HistoryUnavailableException;
import org.fireflyframework.domain.core.exception.InvalidVersionException;
import org.fireflyframework.domain.core.exception.PendingEventsException;
import org.fireflyframework.domain.core.idempotency.ProbabilisticAnswer;
import org.fireflyframework.domain.core.idempotency.TokenFilter;
import org.fireflyframework.domain.core.snapshot.Snapshot;
import org.fireflyframework.domain.fixtures.ItemAdded;
import org.fireflyframework.domain.fixtures.Order;
import org.fireflyframework.domain.fixtures.OrderPlaced;
import org.fireflyframework.domain.fixtures.Orders;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.fireflyframework.domain.fixtures.Orders.stored;

class AggregateTypeTest {

    private final AggregateType<Order> type = Orders.type();
    private final UUID id = UUID.randomUUID();

    @AfterEach
    void resetClock() {
        DomainClock.reset();
    }

    private List<DomainEvent> history() {
        return List.of(
                stored(new OrderPlaced("alice"), id, 1, null),
                stored(new ItemAdded("sku-1", 1), id, 2, "token-2"),
                stored(new ItemAdded("sku-2", 2), id, 3, "token-3"));
    }

    @Test
    void fromHistory_replaysEventsAsCommittedHistory() {
        Order order = type.fromHistory(id, history());

        assertThat(order.getId()).isEqualTo(id);
        assertThat(order.version()).isEqualTo(3);
        assertThat(order.hasPendingEvents()).isFalse();
        assertThat(order.getCustomer()).isEqualTo("alice");
        assertThat(order.getItems()).containsEntry("sku-1", 1).containsEntry("sku-2", 2);
        assertThat(order.wasSourcedFromSnapshot()).isFalse();
    }

    @Test
    void create_rejectsFactoryProducingAnotherId() {
        var broken = AggregateType.builder(Order.class, ignored -> new Order(UUID.randomUUID())).build();

        assertThatThrownBy(() -> broken.create(id)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void asOfVersion_truncatesWithoutMutatingSource() {
        Order order = type.fromHistory(id, history());
        order.addItem("sku-3", 3);

        Order truncated = type.asOfVersion(order, 2);

        assertThat(truncated).isNotSameAs(order);
        assertThat(truncated.version()).isEqualTo(2);
        assertThat(truncated.getItems()).containsOnlyKeys("sku-1");
        assertThat(order.version()).isEqualTo(4);
        assertThat(order.getPendingEvents()).hasSize(1);
        assertThat(order.getItems()).containsOnlyKeys("sku-1", "sku-2", "sku-3");
    }

    @Test
    void asOfVersion_includesPendingEventsUpToVersion() {
        Order order = type.fromHistory(id, history());
        order.addItem("sku-3", 3);

        Order truncated = type.asOfVersion(order, 4);

        assertThat(truncated.version()).isEqualTo(4);
        assertThat(truncated.getItems()).containsOnlyKeys("sku-1", "sku-2", "sku-3");
    }

    @Test
    void asOfVersion_isIdempotent() {
        Order order = type.fromHistory(id, history());

        Order once = type.asOfVersion(order, 2);
        Order twice = type.asOfVersion(once, 2);

        assertThat(twice.version()).isEqualTo(once.version());
        assertThat(twice.getItems()).isEqualTo(once.getItems());
        assertThat(twice.getCustomer()).isEqualTo(once.getCustomer());
        assertThat(twice.events().map(DomainEvent::getSequenceNumber))
                .containsExactlyElementsOf(once.events().map(DomainEvent::getSequenceNumber).toList());
    }

    @Test
    void createSnapshot_rejectsPendingEvents() {
        Order order = type.fromHistory(id, history());
        order.addItem("sku-3", 1);

        assertThatThrownBy(() -> type.createSnapshot(order))
                .isInstanceOf(PendingEventsException.class);
    }

    @Test
    void createSnapshot_stampsVersionTimeTypeAndTokens() {
        Order order = type.fromHistory(id, history());

        Snapshot snapshot;
        try (var ignored = DomainClock.use(Clock.fixed(Orders.T0, ZoneOffset.UTC))) {
            snapshot = type.createSnapshot(order);
        }

        assertThat(snapshot.aggregateId()).isEqualTo(id);
        assertThat(snapshot.aggregateTypeName()).isEqualTo("Order");
        assertThat(snapshot.version()).isEqualTo(3);
        assertThat(snapshot.lastUpdated()).isEqualTo(Orders.T0);
        assertThat(snapshot.tokenFilter().mightContain("token-2")).isEqualTo(ProbabilisticAnswer.POSSIBLY_PRESENT);
        assertThat(snapshot.tokenFilter().mightContain("token-3")).isEqualTo(ProbabilisticAnswer.POSSIBLY_PRESENT);
        assertThat(snapshot.state().get("customer").asText()).isEqualTo("alice");
    }

    @Test
    void createSnapshot_withoutStrategy_fails() {
        var plain = AggregateType.builder(Order.class, Order::new).build();
        Order order = plain.fromHistory(id, history());

        assertThat(plain.supportsSnapshots()).isFalse();
        assertThatThrownBy(() -> plain.createSnapshot(order)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fromSnapshot_restoresStateAndAppliesDelta() {
        Snapshot snapshot = type.createSnapshot(type.fromHistory(id, history()));

        Order restored = type.fromSnapshot(snapshot, List.of(
                stored(new ItemAdded("sku-2", 2), id, 3, "token-3"),
                stored(new ItemAdded("sku-4", 4), id, 4, "token-4")));

        assertThat(restored.wasSourcedFromSnapshot()).isTrue();
        assertThat(restored.getSourceSnapshot()).contains(snapshot);
        assertThat(restored.version()).isEqualTo(4);
        assertThat(restored.getItems()).containsEntry("sku-2", 2).containsEntry("sku-4", 4);
        assertThat(restored.getEventHistory()).extracting(DomainEvent::getSequenceNumber).containsExactly(4L);
        assertThatThrownBy(restored::events).isInstanceOf(HistoryUnavailableException.class);
    }

    @Test
    void fromSnapshot_withoutDelta_hasSnapshotVersion() {
        Snapshot snapshot = type.createSnapshot(type.fromHistory(id, history()));

        Order restored = type.fromSnapshot(snapshot, List.of());

        assertThat(restored.version()).isEqualTo(3);
        assertThat(restored.getCustomer()).isEqualTo("alice");
    }

    @Test
    void snapshotSourcedAggregate_hasNoHistory() {
        Order restored = type.fromSnapshot(type.createSnapshot(type.fromHistory(id, history())), List.of());

        assertThatThrownBy(restored::events)
                .isInstanceOf(HistoryUnavailableException.class)
                .hasFieldOrPropertyWithValue("aggregateId", id);
    }

    @Test
    void snapshotSourcedAggregate_reusesAndExtendsSnapshotTokens() {
        Snapshot snapshot = type.createSnapshot(type.fromHistory(id, history()));
        Order restored = type.fromSnapshot(snapshot, List.of(stored(new ItemAdded("sku-4", 4), id, 4, "token-4")));
        restored.withCommandToken("token-5", () -> restored.addItem("sku-5", 5));
        restored.confirmSave();

        assertThat(restored.tokenFilter().mightContain("token-2")).isEqualTo(ProbabilisticAnswer.POSSIBLY_PRESENT);
        assertThat(restored.tokenFilter().mightContain("token-4")).isEqualTo(ProbabilisticAnswer.POSSIBLY_PRESENT);
        assertThat(restored.tokenFilter().mightContain("token-5")).isEqualTo(ProbabilisticAnswer.POSSIBLY_PRESENT);

        Snapshot next = type.createSnapshot(restored);
        assertThat(next.version()).isEqualTo(5);
        assertThat(next.tokenFilter().mightContain("token-3")).isEqualTo(ProbabilisticAnswer.POSSIBLY_PRESENT);
    }

    @Test
    void asOfVersion_beforeSnapshot_failsWithInvalidVersion() {
        Snapshot snapshot = type.createSnapshot(type.fromHistory(id, history()));
        Order restored = type.fromSnapshot(snapshot, List.of(stored(new ItemAdded("sku-4", 4), id, 4, null)));

        assertThatThrownBy(() -> type.asOfVersion(restored, 2))
                .isInstanceOf(InvalidVersionException.class)
                .hasFieldOrPropertyWithValue("snapshotVersion", 3L)
                .hasFieldOrPropertyWithValue("requestedVersion", 2L);
    }

    @Test
    void asOfVersion_atOrAfterSnapshot_rebuildsFromSnapshotPlusDelta() {
        Snapshot snapshot = type.createSnapshot(type.fromHistory(id, history()));
        Order restored = type.fromSnapshot(snapshot, List.of(stored(new ItemAdded("sku-4", 4), id, 4, null)));
        restored.addItem("sku-5", 5);

        Order atSnapshot = type.asOfVersion(restored, 3);
        Order withPending = type.asOfVersion(restored, 5);

        assertThat(atSnapshot.version()).isEqualTo(3);
        assertThat(atSnapshot.wasSourcedFromSnapshot()).isTrue();
        assertThat(atSnapshot.getItems()).doesNotContainKey("sku-4");
        assertThat(withPending.version()).isEqualTo(5);
        assertThat(withPending.getItems()).containsKeys("sku-4", "sku-5");
        assertThat(restored.getPendingEvents()).hasSize(1);
    }

    @Test
    void fromSnapshot_rejectsSnapshotOfAnotherType() {
        var foreign = new Snapshot(id, "Invoice", 1, Orders.T0, TokenFilter.create(),
                JsonNodeFactory.instance.objectNode());

        assertThatThrownBy(() -> type.fromSnapshot(foreign, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invoice");
    }
}
