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
import org.fireflyframework.domain.core.clock.DomainClock;
import org.fireflyframework.domain.core.event.DomainEvent;
import org.fireflyframework.domain.core.event.EventSequence;
import org.fireflyframework.domain.core.exception.HistoryUnavailableException;
import org.fireflyframework.domain.core.exception.PendingEventsException;
import org.fireflyframework.domain.core.exception.UnstoredEventException;
import org.fireflyframework.domain.core.idempotency.ProbabilisticAnswer;
import org.fireflyframework.domain.core.idempotency.TokenFilter;
import org.fireflyframework.domain.core.snapshot.Snapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Entity whose state is derived by replaying an ordered event history.
 *
 * <p>Committed events live in the event history; events recorded in the current
 * in-memory session accumulate as pending events until {@link #confirmSave()} folds
 * them into history. The aggregate version is the larger of the two sequences'
 * versions. Subclasses mutate their state only in {@link #apply(DomainEvent)}.
 *
 * <p>Instances are not thread-safe: callers guarantee a single writer per aggregate id.
 */
@Slf4j
public abstract class EventSourcedAggregate {

    private final UUID id;
    private EventSequence eventHistory = new EventSequence();
    private final EventSequence pendingEvents = new EventSequence();
    private Snapshot sourceSnapshot;
    private TokenFilter committedTokens;
    private Supplier<TokenFilter> tokenFilterFactory = TokenFilter::create;
    private String commandToken;

    protected EventSourcedAggregate(UUID id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    /**
     * Mutates aggregate state for one event. Called for replayed, merged and newly
     * recorded events alike.
     */
    protected abstract void apply(DomainEvent event);

    /**
     * Records a new fact: stamps identity, sequence number and the active command token,
     * applies it and appends it to the pending events.
     */
    protected void record(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        if (event.getAggregateId() == null) {
            event.setAggregateId(id);
        } else if (!event.getAggregateId().equals(id)) {
            throw new IllegalArgumentException("Event " + event.eventType() + " belongs to aggregate "
                    + event.getAggregateId() + ", not " + id);
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(DomainClock.now());
        }
        if (commandToken != null && !event.hasToken()) {
            event.setToken(commandToken);
        }
        event.setSequenceNumber(version() + 1);
        apply(event);
        pendingEvents.add(event);
        log.debug("[aggregate] Recorded {} aggregateId={} sequenceNumber={}",
                event.eventType(), id, event.getSequenceNumber());
    }

    /**
     * Runs {@code action} with {@code token} stamped on every event it records.
     */
    public void withCommandToken(String token, Runnable action) {
        String previous = commandToken;
        commandToken = token == null || token.isBlank() ? previous : token;
        try {
            action.run();
        } finally {
            commandToken = previous;
        }
    }

    public UUID getId() {
        return id;
    }

    public long version() {
        return Math.max(eventHistory.version(), pendingEvents.version());
    }

    /**
     * Committed events held in memory. For a snapshot-sourced aggregate these are only
     * the events applied after the snapshot's version; use {@link #events()} when the
     * full history is required.
     */
    public List<DomainEvent> getEventHistory() {
        return eventHistory.asList();
    }

    public List<DomainEvent> getPendingEvents() {
        return pendingEvents.asList();
    }

    public boolean hasPendingEvents() {
        return !pendingEvents.isEmpty();
    }

    public boolean wasSourcedFromSnapshot() {
        return sourceSnapshot != null;
    }

    public Optional<Snapshot> getSourceSnapshot() {
        return Optional.ofNullable(sourceSnapshot);
    }

    /**
     * Event history followed by pending events, in sequence order.
     *
     * @throws HistoryUnavailableException if the aggregate was sourced from a snapshot
     */
    public Stream<DomainEvent> events() {
        if (sourceSnapshot != null) {
            throw new HistoryUnavailableException(id);
        }
        return Stream.concat(eventHistory.stream(), pendingEvents.stream());
    }

    /**
     * Merges externally committed events into an aggregate that has no pending events.
     * Every supplied event must carry a sequence number, including ones at or below the
     * current version; those are then skipped and the rest are applied in sequence order
     * and committed.
     */
    public void update(Iterable<? extends DomainEvent> newEvents) {
        Objects.requireNonNull(newEvents, "newEvents");
        if (hasPendingEvents()) {
            throw new PendingEventsException(id, "update");
        }
        List<DomainEvent> candidates = new ArrayList<>();
        for (DomainEvent event : newEvents) {
            if (!event.isSequenced()) {
                throw new UnstoredEventException(id, event.eventType());
            }
            candidates.add(event);
        }
        long startingVersion = version();
        candidates.stream()
                .filter(e -> e.getSequenceNumber() > startingVersion)
                .sorted(Comparator.comparingLong(DomainEvent::getSequenceNumber))
                .forEach(e -> {
                    pendingEvents.add(e);
                    apply(e);
                });
        confirmSave();
        if (version() > startingVersion) {
            log.debug("[aggregate] Updated aggregateId={} from version {} to {}", id, startingVersion, version());
        }
    }

    /**
     * Folds pending events into the event history once they are durably stored.
     */
    public void confirmSave() {
        for (DomainEvent event : pendingEvents.drain()) {
            eventHistory.add(event);
            if (committedTokens != null) {
                committedTokens.add(event.getToken());
            }
        }
    }

    /**
     * Drops events recorded since the last save without committing them, after a failed
     * commit. State already mutated by those events is not rolled back, so the instance
     * should be sourced again before it serves anything but a retry of the same command.
     *
     * @return the discarded events
     */
    public List<DomainEvent> discardPendingEvents() {
        List<DomainEvent> discarded = pendingEvents.drain();
        if (!discarded.isEmpty()) {
            log.debug("[aggregate] Discarded {} uncommitted events aggregateId={}", discarded.size(), id);
        }
        return discarded;
    }

    /**
     * Filter of every token in committed history. A snapshot-sourced aggregate starts
     * from its snapshot's filter and extends it as events are appended; otherwise the
     * filter is derived from the in-memory history.
     */
    public TokenFilter tokenFilter() {
        return committedTokens().copy();
    }

    public ProbabilisticAnswer checkToken(String token) {
        if (token == null || token.isBlank()) {
            return ProbabilisticAnswer.DEFINITELY_ABSENT;
        }
        boolean pending = pendingEvents.stream().anyMatch(e -> token.equals(e.getToken()));
        if (pending) {
            return ProbabilisticAnswer.DEFINITELY_PRESENT;
        }
        return committedTokens().mightContain(token);
    }

    private TokenFilter committedTokens() {
        if (committedTokens == null) {
            TokenFilter filter = tokenFilterFactory.get();
            eventHistory.stream().map(DomainEvent::getToken).forEach(filter::add);
            committedTokens = filter;
        }
        return committedTokens;
    }

    // --- Reconstruction hooks used by AggregateType ---

    void useTokenFilterFactory(Supplier<TokenFilter> factory) {
        this.tokenFilterFactory = Objects.requireNonNull(factory, "factory");
    }

    Stream<DomainEvent> historyAndPending() {
        return Stream.concat(eventHistory.stream(), pendingEvents.stream());
    }

    void sourceFromHistory(Iterable<? extends DomainEvent> events) {
        replay(events);
    }

    void sourceFromSnapshot(Snapshot snapshot, Iterable<? extends DomainEvent> deltaEvents) {
        this.sourceSnapshot = snapshot;
        this.eventHistory = new EventSequence(snapshot.version());
        this.committedTokens = snapshot.tokenFilter();
        replay(deltaEvents);
    }

    private void replay(Iterable<? extends DomainEvent> events) {
        List<DomainEvent> ordered = new ArrayList<>();
        for (DomainEvent event : events) {
            if (!event.isSequenced()) {
                throw new UnstoredEventException(id, event.eventType());
            }
            ordered.add(event);
        }
        long baseline = eventHistory.version();
        ordered.stream()
                .filter(e -> e.getSequenceNumber() > baseline)
                .sorted(Comparator.comparingLong(DomainEvent::getSequenceNumber))
                .forEach(e -> {
                    apply(e);
                    eventHistory.add(e);
                    if (committedTokens != null) {
                        committedTokens.add(e.getToken());
                    }
                });
    }
}
