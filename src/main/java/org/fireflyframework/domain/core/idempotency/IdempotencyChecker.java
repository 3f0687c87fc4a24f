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

package org.fireflyframework.domain.core.idempotency;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.domain.core.aggregate.EventSourcedAggregate;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Two-tier duplicate detection: the aggregate's token filter rules tokens out
 * synchronously, and only a {@link ProbabilisticAnswer#POSSIBLY_PRESENT} answer pays for
 * the authoritative {@link TokenLookup}.
 */
@Slf4j
public class IdempotencyChecker {

    private final TokenLookup tokenLookup;

    public IdempotencyChecker(TokenLookup tokenLookup) {
        this.tokenLookup = Objects.requireNonNull(tokenLookup, "tokenLookup");
    }

    public Mono<Boolean> hasToken(EventSourcedAggregate aggregate, String token) {
        Objects.requireNonNull(aggregate, "aggregate");
        if (token == null || token.isBlank()) {
            return Mono.just(false);
        }
        ProbabilisticAnswer answer = aggregate.checkToken(token);
        return switch (answer) {
            case DEFINITELY_ABSENT -> Mono.just(false);
            case DEFINITELY_PRESENT -> Mono.just(true);
            case POSSIBLY_PRESENT -> Mono.defer(() -> tokenLookup.hasBeenRecorded(aggregate.getId(), token))
                    .defaultIfEmpty(false)
                    .doOnNext(recorded -> log.debug(
                            "[idempotency] Authoritative lookup aggregateId={} token={} recorded={}",
                            aggregate.getId(), token, recorded));
        };
    }
}
