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

package org.fireflyframework.domain.core.observability;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.fireflyframework.domain.core.scheduling.CommandScheduler;
import org.fireflyframework.domain.core.scheduling.CommandSchedulingMiddleware;
import org.fireflyframework.domain.core.scheduling.ScheduledCommand;
import reactor.core.publisher.Mono;

public class CommandSchedulingTracer implements CommandSchedulingMiddleware {
    private final ObservationRegistry observationRegistry;

    public CommandSchedulingTracer(ObservationRegistry observationRegistry) {
        this.observationRegistry = observationRegistry;
    }

    @Override
    public <T> Mono<Void> schedule(ScheduledCommand<T> command, CommandScheduler<T> next) {
        return trace("domain.command.schedule", command, next.schedule(command));
    }

    @Override
    public <T> Mono<Void> deliver(ScheduledCommand<T> command, CommandScheduler<T> next) {
        return trace("domain.command.deliver", command, next.deliver(command));
    }

    private <T> Mono<Void> trace(String name, ScheduledCommand<T> command, Mono<Void> mono) {
        return Mono.defer(() -> {
            Observation observation = Observation.createNotStarted(name, observationRegistry)
                    .lowCardinalityKeyValue("domain.command", command.commandName())
                    .lowCardinalityKeyValue("domain.target", command.getCommand().targetType().getSimpleName())
                    .highCardinalityKeyValue("domain.targetId", command.getTargetId())
                    .highCardinalityKeyValue("domain.scheduledCommandId", command.getId());
            return mono.doOnSubscribe(s -> observation.start())
                       .doOnError(observation::error)
                       .doOnTerminate(() -> {
                           if (command.getResult() != null) {
                               observation.highCardinalityKeyValue("domain.result",
                                       command.getResult().isSuccess() ? "succeeded" : "failed");
                           }
                           observation.stop();
                       });
        });
    }
}
