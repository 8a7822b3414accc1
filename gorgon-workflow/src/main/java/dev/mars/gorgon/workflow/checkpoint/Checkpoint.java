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

package dev.mars.gorgon.workflow.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import dev.mars.gorgon.workflow.engine.StepResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Serialized state of a paused execution: the variable context, the steps already finished,
 * the frontier still to run, and the step results recorded so far.
 * <p>
 * A checkpoint is self-contained; resuming needs only the checkpoint and the workflow
 * definition it was taken from.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
@JsonDeserialize(builder = Checkpoint.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Checkpoint {

    private final String checkpointId;
    private final String executionId;
    private final String workflowId;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Map<String, Object> context;
    private final List<String> completedStepIds;
    private final List<String> bypassedStepIds;
    private final List<String> frontier;
    private final List<StepResult> stepResults;
    private final long totalTokens;

    private Checkpoint(Builder builder) {
        this.checkpointId = builder.checkpointId != null ? builder.checkpointId : UUID.randomUUID().toString();
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(builder.workflowId, "Workflow ID cannot be null");
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.startedAt = builder.startedAt;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
        this.completedStepIds = List.copyOf(builder.completedStepIds);
        this.bypassedStepIds = List.copyOf(builder.bypassedStepIds);
        this.frontier = List.copyOf(builder.frontier);
        this.stepResults = List.copyOf(builder.stepResults);
        this.totalTokens = builder.totalTokens;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Gets the ids of steps with a terminal result, in completion order.
     */
    public List<String> getCompletedStepIds() {
        return completedStepIds;
    }

    /**
     * Gets the ids of completed steps that were skipped as untaken condition branches.
     */
    public List<String> getBypassedStepIds() {
        return bypassedStepIds;
    }

    /**
     * Gets the ids of steps not yet run, in layer order.
     */
    public List<String> getFrontier() {
        return frontier;
    }

    public List<StepResult> getStepResults() {
        return stepResults;
    }

    public long getTotalTokens() {
        return totalTokens;
    }

    public Set<String> completedSet() {
        return new LinkedHashSet<>(completedStepIds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Checkpoint that = (Checkpoint) o;
        return totalTokens == that.totalTokens &&
               checkpointId.equals(that.checkpointId) &&
               executionId.equals(that.executionId) &&
               workflowId.equals(that.workflowId) &&
               Objects.equals(context, that.context) &&
               completedStepIds.equals(that.completedStepIds) &&
               frontier.equals(that.frontier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkpointId, executionId, workflowId);
    }

    @Override
    public String toString() {
        return "Checkpoint{" +
               "checkpointId='" + checkpointId + '\'' +
               ", executionId='" + executionId + '\'' +
               ", workflowId='" + workflowId + '\'' +
               ", completed=" + completedStepIds.size() +
               ", frontier=" + frontier +
               ", createdAt=" + createdAt +
               '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String checkpointId;
        private String executionId;
        private String workflowId;
        private Instant createdAt;
        private Instant startedAt;
        private Map<String, Object> context = new LinkedHashMap<>();
        private List<String> completedStepIds = new ArrayList<>();
        private List<String> bypassedStepIds = new ArrayList<>();
        private List<String> frontier = new ArrayList<>();
        private List<StepResult> stepResults = new ArrayList<>();
        private long totalTokens;

        public Builder checkpointId(String checkpointId) {
            this.checkpointId = checkpointId;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
            return this;
        }

        public Builder completedStepIds(List<String> completedStepIds) {
            this.completedStepIds = completedStepIds != null ? new ArrayList<>(completedStepIds) : new ArrayList<>();
            return this;
        }

        public Builder bypassedStepIds(List<String> bypassedStepIds) {
            this.bypassedStepIds = bypassedStepIds != null ? new ArrayList<>(bypassedStepIds) : new ArrayList<>();
            return this;
        }

        public Builder frontier(List<String> frontier) {
            this.frontier = frontier != null ? new ArrayList<>(frontier) : new ArrayList<>();
            return this;
        }

        public Builder stepResults(List<StepResult> stepResults) {
            this.stepResults = stepResults != null ? new ArrayList<>(stepResults) : new ArrayList<>();
            return this;
        }

        public Builder totalTokens(long totalTokens) {
            this.totalTokens = totalTokens;
            return this;
        }

        public Checkpoint build() {
            return new Checkpoint(this);
        }
    }
}
