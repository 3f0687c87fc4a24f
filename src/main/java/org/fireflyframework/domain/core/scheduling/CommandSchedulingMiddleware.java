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

import reactor.core.publisher.Mono;

/**
 * Wraps scheduling and delivery of every command. Each method receives the rest of
 * the chain as {@code next}; the defaults pass straight through.
 */
public interface CommandSchedulingMiddleware {

    default <T> Mono<Void> schedule(ScheduledCommand<T> command, CommandScheduler<T> next) {
        return next.schedule(command);
    }

    default <T> Mono<Void> deliver(ScheduledCommand<T> command, CommandScheduler<T> next) {
        return next.deliver(command);
    }
}
