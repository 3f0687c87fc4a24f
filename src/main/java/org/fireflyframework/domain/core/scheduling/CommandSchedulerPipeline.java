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

import java.util.List;

/**
 * Composes middleware around a scheduler. The first middleware in the list is the
 * outermost one.
 */
public final class CommandSchedulerPipeline {

    private CommandSchedulerPipeline() {}

    public static <T> CommandScheduler<T> compose(CommandScheduler<T> scheduler,
                                                  List<? extends CommandSchedulingMiddleware> middleware) {
        CommandScheduler<T> current = scheduler;
        for (int i = middleware.size() - 1; i >= 0; i--) {
            current = new Link<>(middleware.get(i), current);
        }
        return current;
    }

    private static final class Link<T> implements CommandScheduler<T> {
        private final CommandSchedulingMiddleware middleware;
        private final CommandScheduler<T> next;

        private Link(CommandSchedulingMiddleware middleware, CommandScheduler<T> next) {
            this.middleware = middleware;
            this.next = next;
        }

        @Override
        public Mono<Void> schedule(ScheduledCommand<T> command) {
            return Mono.defer(() -> middleware.schedule(command, next));
        }

        @Override
        public Mono<Void> deliver(ScheduledCommand<T> command) {
            return Mono.defer(() -> middleware.deliver(command, next));
        }
    }
}
