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

package dev.mars.gorgon.workflow.engine;

import dev.mars.gorgon.config.GorgonConfiguration;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-run scheduling options. Defaults come from {@link GorgonConfiguration}.
 */
public final class ExecutionOptions {

    private final int maxConcurrency;
    private final Duration defaultStepTimeout;
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;
    private final boolean pauseAtCheckpoints;
    private final boolean deleteCheckpointOnCompletion;
    private final Duration cancelGracePeriod;
    private final String executionId;

    private ExecutionOptions(Builder builder) {
        if (builder.maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        this.maxConcurrency = builder.maxConcurrency;
        this.defaultStepTimeout = Objects.requireNonNull(builder.defaultStepTimeout, "Default step timeout cannot be null");
        this.retryBaseDelay = Objects.requireNonNull(builder.retryBaseDelay, "Retry base delay cannot be null");
        this.retryMaxDelay = Objects.requireNonNull(builder.retryMaxDelay, "Retry max delay cannot be null");
        this.pauseAtCheckpoints = builder.pauseAtCheckpoints;
        this.deleteCheckpointOnCompletion = builder.deleteCheckpointOnCompletion;
        this.cancelGracePeriod = Objects.requireNonNull(builder.cancelGracePeriod, "Cancel grace period cannot be null");
        this.executionId = builder.executionId;
    }

    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public static ExecutionOptions fromConfiguration(GorgonConfiguration configuration) {
        return builder(configuration).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(GorgonConfiguration configuration) {
        return new Builder()
                .maxConcurrency(configuration.getMaxConcurrentSteps())
                .defaultStepTimeout(Duration.ofMillis(configuration.getDefaultStepTimeoutMs()))
                .retryBaseDelay(Duration.ofMillis(configuration.getRetryBaseDelayMs()))
                .retryMaxDelay(Duration.ofMillis(configuration.getRetryMaxDelayMs()))
                .deleteCheckpointOnCompletion(configuration.isDeleteCheckpointOnCompletion());
    }

    public Builder toBuilder() {
        return new Builder()
                .maxConcurrency(maxConcurrency)
                .defaultStepTimeout(defaultStepTimeout)
                .retryBaseDelay(retryBaseDelay)
                .retryMaxDelay(retryMaxDelay)
                .pauseAtCheckpoints(pauseAtCheckpoints)
                .deleteCheckpointOnCompletion(deleteCheckpointOnCompletion)
                .cancelGracePeriod(cancelGracePeriod)
                .executionId(executionId);
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Duration getDefaultStepTimeout() {
        return defaultStepTimeout;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    /**
     * Whether checkpoint steps halt the run. When false they succeed and execution continues.
     */
    public boolean isPauseAtCheckpoints() {
        return pauseAtCheckpoints;
    }

    public boolean isDeleteCheckpointOnCompletion() {
        return deleteCheckpointOnCompletion;
    }

    /**
     * How long a cancelled step may take to unwind before its thread is interrupted.
     */
    public Duration getCancelGracePeriod() {
        return cancelGracePeriod;
    }

    public Optional<String> getExecutionId() {
        return Optional.ofNullable(executionId);
    }

    /**
     * Backoff before retry number {@code attempt + 1}: {@code min(base * 2^attempt, max)}.
     */
    public Duration backoff(int attempt) {
        long max = retryMaxDelay.toMillis();
        if (attempt >= Long.SIZE - 1) {
            return Duration.ofMillis(max);
        }
        long delay;
        try {
            delay = Math.multiplyExact(retryBaseDelay.toMillis(), 1L << Math.max(0, attempt));
        } catch (ArithmeticException e) {
            delay = max;
        }
        return Duration.ofMillis(Math.min(delay, max));
    }

    @Override
    public String toString() {
        return "ExecutionOptions{" +
               "maxConcurrency=" + maxConcurrency +
               ", defaultStepTimeout=" + defaultStepTimeout +
               ", retryBaseDelay=" + retryBaseDelay +
               ", retryMaxDelay=" + retryMaxDelay +
               ", pauseAtCheckpoints=" + pauseAtCheckpoints +
               '}';
    }

    public static class Builder {
        private int maxConcurrency = 8;
        private Duration defaultStepTimeout = Duration.ofMinutes(5);
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration retryMaxDelay = Duration.ofSeconds(30);
        private boolean pauseAtCheckpoints = true;
        private boolean deleteCheckpointOnCompletion = true;
        private Duration cancelGracePeriod = Duration.ofSeconds(2);
        private String executionId;

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder defaultStepTimeout(Duration defaultStepTimeout) {
            this.defaultStepTimeout = defaultStepTimeout;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder retryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
            return this;
        }

        public Builder pauseAtCheckpoints(boolean pauseAtCheckpoints) {
            this.pauseAtCheckpoints = pauseAtCheckpoints;
            return this;
        }

        public Builder deleteCheckpointOnCompletion(boolean deleteCheckpointOnCompletion) {
            this.deleteCheckpointOnCompletion = deleteCheckpointOnCompletion;
            return this;
        }

        public Builder cancelGracePeriod(Duration cancelGracePeriod) {
            this.cancelGracePeriod = cancelGracePeriod;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
