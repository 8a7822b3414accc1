/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.gorgon.ratelimit;

import dev.mars.gorgon.config.GorgonConfiguration;

import java.time.Duration;
import java.util.Objects;

/**
 * Static limits configured for a single provider.
 * A {@code requestsPerPeriod} of zero or less disables throughput limiting.
 */
public final class ProviderLimits {

    private final int maxConcurrent;
    private final int requestsPerPeriod;
    private final Duration period;
    private final double decreaseFactor;
    private final Duration recoveryWindow;

    private ProviderLimits(Builder builder) {
        if (builder.maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        if (builder.decreaseFactor <= 0.0 || builder.decreaseFactor >= 1.0) {
            throw new IllegalArgumentException("decreaseFactor must be between 0 and 1 (exclusive)");
        }
        this.maxConcurrent = builder.maxConcurrent;
        this.requestsPerPeriod = builder.requestsPerPeriod;
        this.period = Objects.requireNonNull(builder.period, "Period cannot be null");
        this.decreaseFactor = builder.decreaseFactor;
        this.recoveryWindow = Objects.requireNonNull(builder.recoveryWindow, "Recovery window cannot be null");
    }

    public static ProviderLimits fromConfiguration(GorgonConfiguration configuration, String provider) {
        return builder()
                .maxConcurrent(configuration.getProviderMaxConcurrent(provider))
                .requestsPerPeriod(configuration.getProviderRequestsPerPeriod(provider))
                .period(Duration.ofMillis(configuration.getProviderPeriodMs(provider)))
                .decreaseFactor(configuration.getRateLimitDecreaseFactor())
                .recoveryWindow(Duration.ofMillis(configuration.getRateLimitRecoveryWindowMs()))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getRequestsPerPeriod() {
        return requestsPerPeriod;
    }

    public boolean isThroughputLimited() {
        return requestsPerPeriod > 0;
    }

    public Duration getPeriod() {
        return period;
    }

    public double getDecreaseFactor() {
        return decreaseFactor;
    }

    public Duration getRecoveryWindow() {
        return recoveryWindow;
    }

    @Override
    public String toString() {
        return "ProviderLimits{" +
               "maxConcurrent=" + maxConcurrent +
               ", requestsPerPeriod=" + requestsPerPeriod +
               ", period=" + period +
               ", decreaseFactor=" + decreaseFactor +
               ", recoveryWindow=" + recoveryWindow +
               '}';
    }

    public static class Builder {
        private int maxConcurrent = 4;
        private int requestsPerPeriod = 0;
        private Duration period = Duration.ofMinutes(1);
        private double decreaseFactor = 0.5;
        private Duration recoveryWindow = Duration.ofSeconds(30);

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder requestsPerPeriod(int requestsPerPeriod) {
            this.requestsPerPeriod = requestsPerPeriod;
            return this;
        }

        public Builder period(Duration period) {
            this.period = period;
            return this;
        }

        public Builder decreaseFactor(double decreaseFactor) {
            this.decreaseFactor = decreaseFactor;
            return this;
        }

        public Builder recoveryWindow(Duration recoveryWindow) {
            this.recoveryWindow = recoveryWindow;
            return this;
        }

        public ProviderLimits build() {
            return new ProviderLimits(this);
        }
    }
}
