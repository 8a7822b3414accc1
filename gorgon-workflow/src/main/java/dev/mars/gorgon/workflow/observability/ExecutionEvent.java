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

package dev.mars.gorgon.workflow.observability;

import dev.mars.gorgon.workflow.StepKind;
import dev.mars.gorgon.workflow.engine.StepStatus;
import dev.mars.gorgon.workflow.engine.WorkflowStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle notification emitted by the engine. Step fields are absent on workflow events.
 */
public final class ExecutionEvent {

    public enum Type {
        WORKFLOW_STARTED,
        STEP_STARTED,
        STEP_RETRYING,
        STEP_FINISHED,
        STEP_THROTTLED,
        WORKFLOW_FINISHED
    }

    private final Type type;
    private final String executionId;
    private final String workflowId;
    private final String stepId;
    private final StepKind stepKind;
    private final StepStatus stepStatus;
    private final WorkflowStatus workflowStatus;
    private final Instant timestamp;
    private final Duration duration;
    private final long tokensUsed;
    private final int attempt;
    private final String errorKind;
    private final String message;

    private ExecutionEvent(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "Type cannot be null");
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(builder.workflowId, "Workflow ID cannot be null");
        this.stepId = builder.stepId;
        this.stepKind = builder.stepKind;
        this.stepStatus = builder.stepStatus;
        this.workflowStatus = builder.workflowStatus;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.duration = builder.duration;
        this.tokensUsed = builder.tokensUsed;
        this.attempt = builder.attempt;
        this.errorKind = builder.errorKind;
        this.message = builder.message;
    }

    public static Builder builder(Type type, String executionId, String workflowId) {
        return new Builder(type, executionId, workflowId);
    }

    public Type getType() {
        return type;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public Optional<String> getStepId() {
        return Optional.ofNullable(stepId);
    }

    public Optional<StepKind> getStepKind() {
        return Optional.ofNullable(stepKind);
    }

    public Optional<StepStatus> getStepStatus() {
        return Optional.ofNullable(stepStatus);
    }

    public Optional<WorkflowStatus> getWorkflowStatus() {
        return Optional.ofNullable(workflowStatus);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Optional<Duration> getDuration() {
        return Optional.ofNullable(duration);
    }

    public long getTokensUsed() {
        return tokensUsed;
    }

    public int getAttempt() {
        return attempt;
    }

    public Optional<String> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return "ExecutionEvent{" +
               "type=" + type +
               ", executionId='" + executionId + '\'' +
               (stepId != null ? ", stepId='" + stepId + '\'' : "") +
               (stepStatus != null ? ", stepStatus=" + stepStatus : "") +
               (workflowStatus != null ? ", workflowStatus=" + workflowStatus : "") +
               '}';
    }

    public static class Builder {
        private final Type type;
        private final String executionId;
        private final String workflowId;
        private String stepId;
        private StepKind stepKind;
        private StepStatus stepStatus;
        private WorkflowStatus workflowStatus;
        private Instant timestamp;
        private Duration duration;
        private long tokensUsed;
        private int attempt;
        private String errorKind;
        private String message;

        private Builder(Type type, String executionId, String workflowId) {
            this.type = type;
            this.executionId = executionId;
            this.workflowId = workflowId;
        }

        public Builder step(String stepId, StepKind stepKind) {
            this.stepId = stepId;
            this.stepKind = stepKind;
            return this;
        }

        public Builder stepStatus(StepStatus stepStatus) {
            this.stepStatus = stepStatus;
            return this;
        }

        public Builder workflowStatus(WorkflowStatus workflowStatus) {
            this.workflowStatus = workflowStatus;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder tokensUsed(long tokensUsed) {
            this.tokensUsed = tokensUsed;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder errorKind(String errorKind) {
            this.errorKind = errorKind;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public ExecutionEvent build() {
            return new ExecutionEvent(this);
        }
    }
}
