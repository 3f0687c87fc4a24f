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

package org.fireflyframework.domain.core.exception;

import java.util.UUID;

public final class ConcurrencyException extends DomainException {
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyException(UUID aggregateId, long expectedVersion, long actualVersion) {
        super("Aggregate " + aggregateId + " expected at version " + expectedVersion
                + " but stored version is " + actualVersion, "DOMAIN_CONCURRENCY_CONFLICT");
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
