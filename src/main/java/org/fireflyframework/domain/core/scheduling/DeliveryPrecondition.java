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

package org.fireflyframework.domain.core.scheduling;

import java.util.Objects;
import java.util.UUID;

/**
 * Delivery gate: the command may only be delivered once {@code token} has been
 * recorded on aggregate {@code aggregateId}.
 */
public record DeliveryPrecondition(UUID aggregateId, String token) {
    public DeliveryPrecondition {
        Objects.requireNonNull(aggregateId, "aggregateId");
        if (token == null || token.isBlank()) throw new IllegalArgumentException("token must not be blank");
    }
}
