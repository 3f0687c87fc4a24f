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

package org.fireflyframework.domain.core.idempotency;

import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Probabilistic set of idempotency tokens backed by a Guava {@link BloomFilter}.
 *
 * <p>Answers {@link ProbabilisticAnswer#DEFINITELY_ABSENT} or
 * {@link ProbabilisticAnswer#POSSIBLY_PRESENT}; it never produces false negatives.
 * Tokens cannot be removed. Instances are mutable and not thread-safe; share them
 * through {@link #copy()}.
 */
public final class TokenFilter {

    public static final int DEFAULT_EXPECTED_TOKENS = 10_000;
    public static final double DEFAULT_FALSE_POSITIVE_PROBABILITY = 0.001;

    private final BloomFilter<CharSequence> filter;

    private TokenFilter(BloomFilter<CharSequence> filter) {
        this.filter = filter;
    }

    public static TokenFilter create() {
        return create(DEFAULT_EXPECTED_TOKENS, DEFAULT_FALSE_POSITIVE_PROBABILITY);
    }

    public static TokenFilter create(int expectedTokens, double falsePositiveProbability) {
        return new TokenFilter(BloomFilter.create(
                Funnels.stringFunnel(StandardCharsets.UTF_8), expectedTokens, falsePositiveProbability));
    }

    /**
     * Adds a token. Blank tokens carry no idempotency claim and are ignored.
     */
    public void add(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        filter.put(token);
    }

    public ProbabilisticAnswer mightContain(String token) {
        if (token == null || token.isBlank()) {
            return ProbabilisticAnswer.DEFINITELY_ABSENT;
        }
        return filter.mightContain(token)
                ? ProbabilisticAnswer.POSSIBLY_PRESENT
                : ProbabilisticAnswer.DEFINITELY_ABSENT;
    }

    public long approximateTokenCount() {
        return filter.approximateElementCount();
    }

    public double expectedFalsePositiveProbability() {
        return filter.expectedFpp();
    }

    public TokenFilter copy() {
        return new TokenFilter(filter.copy());
    }

    public byte[] toBytes() {
        var out = new ByteArrayOutputStream();
        try {
            filter.writeTo(out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write token filter", e);
        }
        return out.toByteArray();
    }

    public static TokenFilter fromBytes(byte[] data) {
        Objects.requireNonNull(data, "data");
        try {
            return new TokenFilter(BloomFilter.readFrom(
                    new ByteArrayInputStream(data), Funnels.stringFunnel(StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read token filter", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenFilter other)) return false;
        return filter.equals(other.filter);
    }

    @Override
    public int hashCode() {
        return filter.hashCode();
    }

    @Override
    public String toString() {
        return "TokenFilter{approximateTokens=" + approximateTokenCount() + "}";
    }
}
