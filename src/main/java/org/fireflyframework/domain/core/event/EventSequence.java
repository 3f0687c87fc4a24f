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

package org.fireflyframework.domain.core.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Ordered, append-only sequence of events for one aggregate.
 *
 * <p>{@link #version()} is the sequence number of the last event, or the baseline the
 * sequence was started from when it is empty (zero for a fresh aggregate, the snapshot
 * version for one restored from a snapshot). Appended events must be sequenced and
 * strictly increasing.
 */
public final class EventSequence implements Iterable<DomainEvent> {

    private final long baseline;
    private final List<DomainEvent> events = new ArrayList<>();

    public EventSequence() {
        this(0L);
    }

    public EventSequence(long baseline) {
        if (baseline < 0) {
            throw new IllegalArgumentException("baseline must be >= 0");
        }
        this.baseline = baseline;
    }

    public void add(DomainEvent event) {
        long last = version();
        if (!event.isSequenced()) {
            throw new IllegalArgumentException("Cannot append unsequenced event " + event.eventType());
        }
        if (event.getSequenceNumber() <= last) {
            throw new IllegalArgumentException("Event sequence number " + event.getSequenceNumber()
                    + " must be greater than current version " + last);
        }
        events.add(event);
    }

    public long version() {
        return events.isEmpty() ? baseline : events.get(events.size() - 1).getSequenceNumber();
    }

    public long baseline() {
        return baseline;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    public Stream<DomainEvent> stream() {
        return events.stream();
    }

    public List<DomainEvent> asList() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Removes every event, returning what was held. Used when pending events are folded
     * into history.
     */
    public List<DomainEvent> drain() {
        List<DomainEvent> drained = List.copyOf(events);
        events.clear();
        return drained;
    }

    @Override
    public Iterator<DomainEvent> iterator() {
        return asList().iterator();
    }
}
