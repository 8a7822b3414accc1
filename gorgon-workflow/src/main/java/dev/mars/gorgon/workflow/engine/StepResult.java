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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import dev.mars.gorgon.workflow.StepKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one step: status, timing, raw output, the bindings merged into the context,
 * error detail and the retries it consumed. Group steps carry their sub-step results
 * as children, in declaration (or input) order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
@JsonDeserialize(builder = StepResult.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StepResult {

    private final String stepId;
    private final StepKind kind;
    private final StepStatus status;
    private final Instant startedAt;
    private final Instant endedAt;
    private final Object rawOutput;
    private final Map<String, Object> outputs;
    private final StepError error;
    private final int retryCount;
    private final long tokensUsed;
    private final List<StepResult> children;

    private StepResult(Builder builder) {
        this.stepId = Objects.requireNonNull(builder.stepId, "Step ID cannot be null");
        this.kind = builder.kind;
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.startedAt = builder.startedAt;
        this.endedAt = builder.endedAt;
        this.rawOutput = builder.rawOutput;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.error = builder.error;
        this.retryCount = Math.max(0, builder.retryCount);
        this.tokensUsed = Math.max(0, builder.tokensUsed);
        this.children = List.copyOf(builder.children);
    }

    public static Builder builder(String stepId) {
        return new Builder().stepId(stepId);
    }

    public static StepResult pending(String stepId, StepKind kind) {
        return builder(stepId).kind(kind).status(StepStatus.PENDING).build();
    }

    public static StepResult skipped(String stepId, StepKind kind, StepError reason) {
        Instant now = Instant.now();
        return builder(stepId).kind(kind).status(StepStatus.SKIPPED)
                .startedAt(now).endedAt(now).error(reason).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String getStepId() {
        return stepId;
    }

    public StepKind getKind() {
        return kind;
    }

    public StepStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    /**
     * Gets the handler's primary result, e.g. a completion text or a fan-out result list.
     */
    public Object getRawOutput() {
        return rawOutput;
    }

    /**
     * Gets the bindings this step merged into the variable context.
     */
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    /**
     * Gets the failure detail, or the reason a skipped step did not run. Null on success.
     */
    public StepError getError() {
        return error;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public long getTokensUsed() {
        return tokensUsed;
    }

    public List<StepResult> getChildren() {
        return children;
    }

    @JsonIgnore
    public Duration getDuration() {
        if (startedAt == null || endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }

    @JsonIgnore
    public boolean isSucceeded() {
        return status == StepStatus.SUCCEEDED;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == StepStatus.FAILED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepResult that = (StepResult) o;
        return retryCount == that.retryCount &&
               tokensUsed == that.tokensUsed &&
               stepId.equals(that.stepId) &&
               kind == that.kind &&
               status == that.status &&
               Objects.equals(startedAt, that.startedAt) &&
               Objects.equals(endedAt, that.endedAt) &&
               Objects.equals(rawOutput, that.rawOutput) &&
               outputs.equals(that.outputs) &&
               Objects.equals(error, that.error) &&
               children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, kind, status, startedAt, endedAt, outputs, error, retryCount);
    }

    @Override
    public String toString() {
        return "StepResult{" +
               "stepId='" + stepId + '\'' +
               ", status=" + status.getValue() +
               ", retryCount=" + retryCount +
               (error != null ? ", error=" + error : "") +
               (children.isEmpty() ? "" : ", children=" + children.size()) +
               '}';
    }

    /**
     * Builder for creating StepResult instances.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String stepId;
        private StepKind kind;
        private StepStatus status = StepStatus.PENDING;
        private Instant startedAt;
        private Instant endedAt;
        private Object rawOutput;
        private Map<String, Object> outputs = new LinkedHashMap<>();
        private StepError error;
        private int retryCount;
        private long tokensUsed;
        private List<StepResult> children = new ArrayList<>();

        public Builder() {
        }

        private Builder(StepResult existing) {
            this.stepId = existing.stepId;
            this.kind = existing.kind;
            this.status = existing.status;
            this.startedAt = existing.startedAt;
            this.endedAt = existing.endedAt;
            this.rawOutput = existing.rawOutput;
            this.outputs = new LinkedHashMap<>(existing.outputs);
            this.error = existing.error;
            this.retryCount = existing.retryCount;
            this.tokensUsed = existing.tokensUsed;
            this.children = new ArrayList<>(existing.children);
        }

        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder kind(StepKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(StepStatus status) {
            this.status = status;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder endedAt(Instant endedAt) {
            this.endedAt = endedAt;
            return this;
        }

        public Builder rawOutput(Object rawOutput) {
            this.rawOutput = rawOutput;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = outputs != null ? new LinkedHashMap<>(outputs) : new LinkedHashMap<>();
            return this;
        }

        public Builder error(StepError error) {
            this.error = error;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder tokensUsed(long tokensUsed) {
            this.tokensUsed = tokensUsed;
            return this;
        }

        public Builder children(List<StepResult> children) {
            this.children = children != null ? new ArrayList<>(children) : new ArrayList<>();
            return this;
        }

        public StepResult build() {
            return new StepResult(this);
        }
    }
}
