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
 * Schedules and delivers commands to targets of type {@code T}.
 */
public interface CommandScheduler<T> {

    /**
     * Delivers the command now when it is due, deliverable during scheduling and its
     * precondition holds; otherwise hands it off or rejects it.
     */
    Mono<Void> schedule(ScheduledCommand<T> command);

    /**
     * Applies the command to its target, leaving a terminal result on the command.
     */
    Mono<Void> deliver(ScheduledCommand<T> command);
}
