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

package org.fireflyframework.domain.core.clock;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide logical clock used for event timestamps, snapshot stamps and due-time
 * checks. Production code runs on the system UTC clock; tests install a substitute for
 * the duration of a scope and the previous clock comes back when the scope closes.
 *
 * <pre>{@code
 * try (var ignored = DomainClock.use(Clock.fixed(instant, ZoneOffset.UTC))) {
 *     assertThat(command.isDue()).isTrue();
 * }
 * }</pre>
 */
@Slf4j
public final class DomainClock {

    private static final Clock DEFAULT = Clock.systemUTC();
    private static final AtomicReference<Clock> CURRENT = new AtomicReference<>(DEFAULT);

    private DomainClock() {}

    public static Instant now() {
        return CURRENT.get().instant();
    }

    public static Clock current() {
        return CURRENT.get();
    }

    public static boolean isOverridden() {
        return CURRENT.get() != DEFAULT;
    }

    /**
     * Installs {@code clock} as the process-wide clock until the returned scope is closed.
     */
    public static Scope use(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        Clock previous = CURRENT.getAndSet(clock);
        log.debug("[clock] Installed clock {} (previous {})", clock, previous);
        return new Scope(clock, previous);
    }

    public static void reset() {
        CURRENT.set(DEFAULT);
    }

    public static final class Scope implements AutoCloseable {
        private final Clock installed;
        private final Clock previous;

        private Scope(Clock installed, Clock previous) {
            this.installed = installed;
            this.previous = previous;
        }

        @Override
        public void close() {
            if (!CURRENT.compareAndSet(installed, previous)) {
                log.warn("[clock] Scope closed out of order; restoring default clock");
                CURRENT.set(DEFAULT);
            }
        }
    }
}
