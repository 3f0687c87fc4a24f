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

import org.fireflyframework.domain.core.exception.DomainException;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Function;

/**
 * Delivers commands to targets that are not event-sourced. No idempotency check is
 * made; such targets own their own duplicate handling.
 */
public class DirectCommandTarget<T> implements ScheduledCommandTarget<T> {

    private final Function<String, Mono<T>> resolver;

    public DirectCommandTarget(Function<String, Mono<T>> resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public Mono<Void> applyScheduledCommand(ScheduledCommand<T> command) {
        return resolver.apply(command.getTargetId())
                .map(target -> {
                    try {
                        command.getCommand().applyTo(target);
                        command.succeeded();
                    } catch (RuntimeException e) {
                        command.failed(e);
                    }
                    return true;
                })
                .switchIfEmpty(Mono.fromCallable(() -> {
                    command.failed(new DomainException("Target " + command.getTargetId() + " not found",
                            "DOMAIN_TARGET_NOT_FOUND"));
                    return false;
                }))
                .then();
    }
}
