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

import java.time.Instant;
import java.util.Objects;

/**
 * Why a command was handed off for redelivery.
 *
 * @param attempt number of scheduling attempts made so far, this one included
 * @param cause   failure of the precondition check or of the redelivery; {@code null}
 *                for {@link RedeliveryReason#PRECONDITION_UNSATISFIED}
 */
public record RedeliveryContext(RedeliveryReason reason, Throwable cause, int attempt, Instant requestedAt) {
    public RedeliveryContext {
        Objects.requireNonNull(reason, "reason");
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
    }
}
