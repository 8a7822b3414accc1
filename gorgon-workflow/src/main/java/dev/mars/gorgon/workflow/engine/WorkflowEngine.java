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

import dev.mars.gorgon.workflow.DependencyGraph;
import dev.mars.gorgon.workflow.GraphException;
import dev.mars.gorgon.workflow.VariableContext;
import dev.mars.gorgon.workflow.WorkflowDefinition;
import dev.mars.gorgon.workflow.checkpoint.Checkpoint;
import dev.mars.gorgon.workflow.checkpoint.CheckpointException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for executing workflows and resuming them from checkpoints.
 */
public interface WorkflowEngine {

    /**
     * Executes a workflow definition with default options.
     *
     * @param definition the workflow definition to execute
     * @param inputs values for the workflow's declared inputs
     * @return future containing the execution result
     * @throws GraphException if the step graph is invalid; nothing is executed
     */
    CompletableFuture<ExecutionResult> execute(WorkflowDefinition definition, Map<String, Object> inputs)
            throws GraphException;

    /**
     * Executes a workflow definition.
     *
     * @param definition the workflow definition to execute
     * @param inputs values for the workflow's declared inputs
     * @param options scheduling options for this run
     * @return future containing the execution result
     * @throws GraphException if the step graph is invalid; nothing is executed
     */
    CompletableFuture<ExecutionResult> execute(WorkflowDefinition definition, Map<String, Object> inputs,
                                               ExecutionOptions options) throws GraphException;

    /**
     * Executes an already built graph against a caller-supplied context. The context is
     * updated as steps complete.
     *
     * @param graph the validated step graph
     * @param context the variable context to run against
     * @param options scheduling options for this run
     * @return future containing the execution result
     */
    CompletableFuture<ExecutionResult> execute(DependencyGraph graph, VariableContext context,
                                               ExecutionOptions options);

    /**
     * Resumes a paused execution from its checkpoint.
     *
     * @param checkpoint the checkpoint taken when the execution paused
     * @param definition the workflow definition the checkpoint was taken from
     * @return future containing the execution result
     * @throws GraphException if the step graph is invalid
     * @throws CheckpointException if the checkpoint does not match the definition
     */
    CompletableFuture<ExecutionResult> resume(Checkpoint checkpoint, WorkflowDefinition definition)
            throws GraphException, CheckpointException;

    /**
     * Resumes a paused execution from its checkpoint.
     *
     * @param checkpoint the checkpoint taken when the execution paused
     * @param definition the workflow definition the checkpoint was taken from
     * @param options scheduling options for the resumed run
     * @return future containing the execution result
     * @throws GraphException if the step graph is invalid
     * @throws CheckpointException if the checkpoint does not match the definition
     */
    CompletableFuture<ExecutionResult> resume(Checkpoint checkpoint, WorkflowDefinition definition,
                                              ExecutionOptions options) throws GraphException, CheckpointException;

    /**
     * Loads a checkpoint from the engine's store and resumes it. A checkpoint that cannot be
     * loaded yields a failed result with error kind {@link WorkflowErrorKind#CHECKPOINT_CORRUPT}.
     *
     * @param checkpointId the checkpoint id
     * @param definition the workflow definition the checkpoint was taken from
     * @return future containing the execution result
     * @throws GraphException if the step graph is invalid
     */
    CompletableFuture<ExecutionResult> resume(String checkpointId, WorkflowDefinition definition)
            throws GraphException;

    /**
     * Gets the status of a running execution.
     *
     * @param executionId the execution ID
     * @return the current status, or empty if the execution is not running
     */
    Optional<WorkflowStatus> getStatus(String executionId);

    /**
     * Asks a running execution to pause at the next layer boundary.
     *
     * @param executionId the execution ID
     * @return true if the execution was running and the request was recorded
     */
    boolean pause(String executionId);

    /**
     * Cancels a running execution. In-flight steps are signalled and given a grace period
     * to stop; no further steps start.
     *
     * @param executionId the execution ID
     * @return true if the execution was running
     */
    boolean cancel(String executionId);

    /**
     * Shuts down the engine.
     */
    void shutdown();
}
