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

import java.util.List;

/**
 * A command's validator rejected it; nothing was applied to the target.
 */
public final class CommandValidationException extends DomainException {
    private final String commandName;
    private final List<String> failures;

    public CommandValidationException(String commandName, List<String> failures) {
        super("Command " + commandName + " failed validation: " + String.join("; ", failures),
                "DOMAIN_COMMAND_INVALID");
        this.commandName = commandName;
        this.failures = List.copyOf(failures);
    }

    public String getCommandName() {
        return commandName;
    }

    public List<String> getFailures() {
        return failures;
    }
}
