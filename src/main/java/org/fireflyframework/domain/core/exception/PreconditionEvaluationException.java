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

/**
 * Wraps an abnormal failure of a precondition check. Never terminal: the scheduler
 * treats it as an unsatisfied precondition and hands the command off for redelivery.
 */
public final class PreconditionEvaluationException extends DomainException {

    public PreconditionEvaluationException(String targetId, Throwable cause) {
        super("Precondition evaluation failed for " + targetId + ": " + cause.getMessage(),
                "DOMAIN_PRECONDITION_EVALUATION_FAILED", cause);
    }
}
