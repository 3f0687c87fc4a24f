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

import java.time.Instant;
import java.util.UUID;

/**
 * Base type for facts recorded by an {@code EventSourcedAggregate}.
 *
 * <p>Identity fields are stamped by the aggregate when the event is recorded. Once an
 * event carries a non-zero sequence number it is immutable; a sequence number of
 * {@code 0} means the event was never stored. Subclasses hold the payload as their own
 * (final) fields.
 */
public abstract class DomainEvent {

    private UUID aggregateId;
    private long sequenceNumber;
    private String token;
    private Instant timestamp;

    protected DomainEvent() {}

    protected DomainEvent(UUID aggregateId, long sequenceNumber, String token, Instant timestamp) {
        this.aggregateId = aggregateId;
        this.sequenceNumber = sequenceNumber;
        this.token = token;
        this.timestamp = timestamp;
    }

    public UUID getAggregateId() { return aggregateId; }
    public long getSequenceNumber() { return sequenceNumber; }
    public String getToken() { return token; }
    public Instant getTimestamp() { return timestamp; }

    public boolean isSequenced() {
        return sequenceNumber != 0;
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    /**
     * Name used in logs and stored-event records.
     */
    public String eventType() {
        return getClass().getSimpleName();
    }

    public void setAggregateId(UUID aggregateId) {
        ensureMutable();
        this.aggregateId = aggregateId;
    }

    public void setSequenceNumber(long sequenceNumber) {
        ensureMutable();
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("sequenceNumber must be >= 0");
        }
        this.sequenceNumber = sequenceNumber;
    }

    public void setToken(String token) {
        ensureMutable();
        this.token = token;
    }

    public void setTimestamp(Instant timestamp) {
        ensureMutable();
        this.timestamp = timestamp;
    }

    private void ensureMutable() {
        if (sequenceNumber != 0) {
            throw new IllegalStateException(eventType() + " #" + sequenceNumber + " is sequenced and cannot be modified");
        }
    }

    @Override
    public String toString() {
        return eventType() + "{aggregateId=" + aggregateId + ", sequenceNumber=" + sequenceNumber
                + ", token=" + token + ", timestamp=" + timestamp + "}";
    }
}
