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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.domain.core.idempotency.TokenFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/**
 * Serializes {@link Snapshot}s to and from JSON. The token filter travels as the
 * base64 encoding of its binary form.
 */
public class SnapshotSerializer {

    private final ObjectMapper mapper;

    public SnapshotSerializer() {
        this(defaultObjectMapper());
    }

    public SnapshotSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public byte[] serialize(Snapshot snapshot) {
        ObjectNode node = mapper.createObjectNode();
        node.put("aggregateId", snapshot.aggregateId().toString());
        node.put("aggregateTypeName", snapshot.aggregateTypeName());
        node.put("version", snapshot.version());
        node.put("lastUpdated", snapshot.lastUpdated() != null ? snapshot.lastUpdated().toString() : null);
        node.put("tokenFilter", Base64.getEncoder().encodeToString(snapshot.tokenFilter().toBytes()));
        node.set("state", snapshot.state());
        try {
            return mapper.writeValueAsBytes(node);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize snapshot of " + snapshot.aggregateId(), e);
        }
    }

    public Snapshot deserialize(byte[] data) {
        try {
            JsonNode node = mapper.readTree(data);
            JsonNode lastUpdated = node.get("lastUpdated");
            return new Snapshot(
                    UUID.fromString(node.get("aggregateId").asText()),
                    node.get("aggregateTypeName").asText(),
                    node.get("version").asLong(),
                    lastUpdated == null || lastUpdated.isNull() ? null : Instant.parse(lastUpdated.asText()),
                    TokenFilter.fromBytes(Base64.getDecoder().decode(node.get("tokenFilter").asText())),
                    node.get("state"));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize snapshot", e);
        }
    }
}
