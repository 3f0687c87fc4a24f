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
 * Raised when a command's idempotency token has already been recorded on its target.
 * Delivery records it as a failed result instead of throwing it past the scheduler.
 */
public final class DuplicateCommandException extends DomainException {
    private final String targetId;
    private final String token;

    public DuplicateCommandException(String targetId, String token) {
        super("Command with token '" + token + "' was already applied to " + targetId, "DOMAIN_DUPLICATE_COMMAND");
        this.targetId = targetId;
        this.token = token;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getToken() {
        return token;
    }
}
