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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.fireflyframework.domain.core.idempotency.TokenFilter;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable point-in-time materialization of an aggregate at {@code version}.
 *
 * <p>{@code state} is the aggregate-specific blob produced by its snapshot strategy;
 * {@code tokenFilter} reflects every idempotency token committed up to {@code version}.
 * Both are defensively copied on the way in and out.
 */
public record Snapshot(
        UUID aggregateId,
        String aggregateTypeName,
        long version,
        Instant lastUpdated,
        TokenFilter tokenFilter,
        JsonNode state
) {
    public Snapshot {
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(aggregateTypeName, "aggregateTypeName");
        if (version < 0) throw new IllegalArgumentException("version must be >= 0");
        tokenFilter = tokenFilter != null ? tokenFilter.copy() : TokenFilter.create();
        state = state != null ? state.deepCopy() : NullNode.getInstance();
    }

    @Override
    public TokenFilter tokenFilter() {
        return tokenFilter.copy();
    }

    @Override
    public JsonNode state() {
        return state.deepCopy();
    }
}
