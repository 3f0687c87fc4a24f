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

package org.fireflyframework.domain.config;

import org.fireflyframework.domain.core.idempotency.TokenFilter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the event-sourced domain runtime.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   domain:
 *     scheduling:
 *       precondition-timeout: 10s
 *       delivery-timeout: 30s
 *     redelivery:
 *       max-attempts: 3
 *       initial-delay: 1s
 *       max-delay: 5m
 *       multiplier: 2.0
 *       jitter-factor: 0.0
 *       thread-pool-size: 2
 *     idempotency:
 *       expected-tokens: 10000
 *       false-positive-probability: 0.001
 *     health:
 *       enabled: true
 *     metrics:
 *       enabled: true
 *     tracing:
 *       enabled: true
 *     resilience:
 *       enabled: true
 *     dlq:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.domain")
public class DomainProperties {

    @NestedConfigurationProperty
    private SchedulingProperties scheduling = new SchedulingProperties();

    @NestedConfigurationProperty
    private RedeliveryProperties redelivery = new RedeliveryProperties();

    @NestedConfigurationProperty
    private IdempotencyProperties idempotency = new IdempotencyProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private TracingProperties tracing = new TracingProperties();

    @NestedConfigurationProperty
    private ResilienceProperties resilience = new ResilienceProperties();

    @NestedConfigurationProperty
    private DlqProperties dlq = new DlqProperties();

    // --- Getters and Setters ---

    public SchedulingProperties getScheduling() { return scheduling; }
    public void setScheduling(SchedulingProperties scheduling) { this.scheduling = scheduling; }

    public RedeliveryProperties getRedelivery() { return redelivery; }
    public void setRedelivery(RedeliveryProperties redelivery) { this.redelivery = redelivery; }

    public IdempotencyProperties getIdempotency() { return idempotency; }
    public void setIdempotency(IdempotencyProperties idempotency) { this.idempotency = idempotency; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public TracingProperties getTracing() { return tracing; }
    public void setTracing(TracingProperties tracing) { this.tracing = tracing; }

    public ResilienceProperties getResilience() { return resilience; }
    public void setResilience(ResilienceProperties resilience) { this.resilience = resilience; }

    public DlqProperties getDlq() { return dlq; }
    public void setDlq(DlqProperties dlq) { this.dlq = dlq; }

    // --- Nested property classes ---

    public static class SchedulingProperties {
        private Duration preconditionTimeout = Duration.ofSeconds(10);
        private Duration deliveryTimeout = Duration.ofSeconds(30);

        public Duration getPreconditionTimeout() { return preconditionTimeout; }
        public void setPreconditionTimeout(Duration preconditionTimeout) { this.preconditionTimeout = preconditionTimeout; }

        public Duration getDeliveryTimeout() { return deliveryTimeout; }
        public void setDeliveryTimeout(Duration deliveryTimeout) { this.deliveryTimeout = deliveryTimeout; }
    }

    public static class RedeliveryProperties {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private double jitterFactor = 0.0;
        private int threadPoolSize = 2;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }

        public int getThreadPoolSize() { return threadPoolSize; }
        public void setThreadPoolSize(int threadPoolSize) { this.threadPoolSize = threadPoolSize; }
    }

    public static class IdempotencyProperties {
        private int expectedTokens = TokenFilter.DEFAULT_EXPECTED_TOKENS;
        private double falsePositiveProbability = TokenFilter.DEFAULT_FALSE_POSITIVE_PROBABILITY;

        public int getExpectedTokens() { return expectedTokens; }
        public void setExpectedTokens(int expectedTokens) { this.expectedTokens = expectedTokens; }

        public double getFalsePositiveProbability() { return falsePositiveProbability; }
        public void setFalsePositiveProbability(double falsePositiveProbability) { this.falsePositiveProbability = falsePositiveProbability; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class TracingProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class ResilienceProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class DlqProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
