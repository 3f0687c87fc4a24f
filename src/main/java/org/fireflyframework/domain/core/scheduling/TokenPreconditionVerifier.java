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

import org.fireflyframework.domain.core.idempotency.TokenLookup;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Satisfied when the command carries no {@link DeliveryPrecondition}, or when the
 * precondition's token has been recorded on its aggregate.
 */
public class TokenPreconditionVerifier implements CommandPreconditionVerifier {

    private final TokenLookup tokenLookup;

    public TokenPreconditionVerifier(TokenLookup tokenLookup) {
        this.tokenLookup = Objects.requireNonNull(tokenLookup, "tokenLookup");
    }

    @Override
    public Mono<Boolean> isPreconditionSatisfied(ScheduledCommand<?> command) {
        return command.getPrecondition()
                .map(p -> tokenLookup.hasBeenRecorded(p.aggregateId(), p.token()).defaultIfEmpty(false))
                .orElseGet(() -> Mono.just(true));
    }
}
