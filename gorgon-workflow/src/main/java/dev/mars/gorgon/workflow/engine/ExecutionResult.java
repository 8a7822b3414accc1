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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Final (or paused) result of one workflow execution: overall status, a per-step breakdown
 * in declaration order, the merged variable context and any workflow-level error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-05
 * @version 1.0
 */
public final class ExecutionResult {

    private final String workflowId;
    private final String executionId;
    private final WorkflowStatus status;
    private final Map<String, StepResult> stepResults;
    private final Map<String, Object> variables;
    private final Map<String, Object> outputs;
    private final long totalTokens;
    private final String checkpointId;
    private final WorkflowError error;
    private final Instant startedAt;
    private final Instant endedAt;

    private ExecutionResult(Builder builder) {
        this.workflowId = Objects.requireNonNull(builder.workflowId, "Workflow ID cannot be null");
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.stepResults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stepResults));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.totalTokens = builder.totalTokens;
        this.checkpointId = builder.checkpointId;
        this.error = builder.error;
        this.startedAt = builder.startedAt;
        this.endedAt = builder.endedAt;
    }

    public static Builder builder(String workflowId, String executionId) {
        return new Builder().workflowId(workflowId).executionId(executionId);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    /**
     * Gets the step results keyed by step id, in declaration order.
     */
    public Map<String, StepResult> getStepResults() {
        return stepResults;
    }

    public Optional<StepResult> getStepResult(String stepId) {
        return Optional.ofNullable(stepResults.get(stepId));
    }

    public List<StepResult> getSteps() {
        return new ArrayList<>(stepResults.values());
    }

    /**
     * Gets the final merged variable context.
     */
    public Map<String, Object> getVariables() {
        return variables;
    }

    /**
     * Gets the declared workflow outputs copied from the final context.
     */
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public long getTotalTokens() {
        return totalTokens;
    }

    public Optional<String> getCheckpointId() {
        return Optional.ofNullable(checkpointId);
    }

    public Optional<WorkflowError> getError() {
        return Optional.ofNullable(error);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public Duration getDuration() {
        if (startedAt == null || endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }

    public boolean isSuccessful() {
        return status == WorkflowStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
               "workflowId='" + workflowId + '\'' +
               ", executionId='" + executionId + '\'' +
               ", status=" + status.getValue() +
               ", steps=" + stepResults.values() +
               (checkpointId != null ? ", checkpointId='" + checkpointId + '\'' : "") +
               (error != null ? ", error=" + error : "") +
               '}';
    }

    public static class Builder {
        private String workflowId;
        private String executionId;
        private WorkflowStatus status = WorkflowStatus.PENDING;
        private final Map<String, StepResult> stepResults = new LinkedHashMap<>();
        private final Map<String, Object> variables = new LinkedHashMap<>();
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private long totalTokens;
        private String checkpointId;
        private WorkflowError error;
        private Instant startedAt;
        private Instant endedAt;

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder stepResult(StepResult result) {
            this.stepResults.put(result.getStepId(), result);
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            if (variables != null) {
                this.variables.putAll(variables);
            }
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            if (outputs != null) {
                this.outputs.putAll(outputs);
            }
            return this;
        }

        public Builder totalTokens(long totalTokens) {
            this.totalTokens = totalTokens;
            return this;
        }

        public Builder checkpointId(String checkpointId) {
            this.checkpointId = checkpointId;
            return this;
        }

        public Builder error(WorkflowError error) {
            this.error = error;
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

        public ExecutionResult build() {
            return new ExecutionResult(this);
        }
    }
}
