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

package org.fireflyframework.domain.core.command;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Validation rule evaluated against a command and its target before the command applies.
 *
 * @param <T> target type
 */
@FunctionalInterface
public interface CommandValidator<T> {

    ValidationReport validate(Command<T> command, T target);

    static <T> CommandValidator<T> none() {
        return (command, target) -> ValidationReport.valid();
    }

    static <T> CommandValidator<T> rule(BiPredicate<Command<T>, T> satisfied, String failureMessage) {
        return (command, target) -> satisfied.test(command, target)
                ? ValidationReport.valid()
                : ValidationReport.failure(failureMessage);
    }

    /**
     * Runs both validators and reports the union of their failures.
     */
    default CommandValidator<T> and(CommandValidator<T> other) {
        return (command, target) -> {
            List<String> failures = new ArrayList<>(validate(command, target).failures());
            failures.addAll(other.validate(command, target).failures());
            return new ValidationReport(failures);
        };
    }
}
