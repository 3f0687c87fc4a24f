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

import reactor.core.publisher.Mono;

import java.util.UUID;

public interface SnapshotRepository {

    Mono<Void> save(Snapshot snapshot);

    /**
     * Latest snapshot for the aggregate, or empty when none was taken.
     */
    Mono<Snapshot> findLatest(UUID aggregateId);

    /**
     * Latest snapshot whose version does not exceed {@code maxVersion}.
     */
    Mono<Snapshot> findLatest(UUID aggregateId, long maxVersion);

    Mono<Long> delete(UUID aggregateId);
}
