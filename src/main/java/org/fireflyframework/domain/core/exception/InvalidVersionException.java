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

public final class InvalidVersionException extends DomainException {
    private final long requestedVersion;
    private final long snapshotVersion;

    public InvalidVersionException(UUID aggregateId, long requestedVersion, long snapshotVersion) {
        super("Snapshot version " + snapshotVersion + " of aggregate " + aggregateId
                        + " is later than requested version " + requestedVersion
                        + "; source the aggregate from an earlier snapshot or from events",
                "DOMAIN_INVALID_VERSION");
        this.requestedVersion = requestedVersion;
        this.snapshotVersion = snapshotVersion;
    }

    public long getRequestedVersion() {
        return requestedVersion;
    }

    public long getSnapshotVersion() {
        return snapshotVersion;
    }
}
