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

import java.util.List;

/**
 * Outcome of command validation. An empty failure list means the command may be applied.
 */
public record ValidationReport(List<String> failures) {

    private static final ValidationReport VALID = new ValidationReport(List.of());

    public ValidationReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static ValidationReport valid() {
        return VALID;
    }

    public static ValidationReport failure(String... failures) {
        return new ValidationReport(List.of(failures));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
