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
import dev.mars.gorgon.workflow.DependencyGraph;
import dev.mars.gorgon.workflow.DependencyGraphBuilder;
import dev.mars.gorgon.workflow.GraphException;
import dev.mars.gorgon.workflow.InputSpec;
import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.VariableContext;
import dev.mars.gorgon.workflow.VariableResolver;
import dev.mars.gorgon.workflow.WorkflowDefinition;
import dev.mars.gorgon.workflow.checkpoint.Checkpoint;
import dev.mars.gorgon.workflow.checkpoint.CheckpointException;
import dev.mars.gorgon.workflow.checkpoint.CheckpointStore;
import dev.mars.gorgon.workflow.checkpoint.InMemoryCheckpointStore;
import dev.mars.gorgon.workflow.executor.StepExecutorRegistry;
import dev.mars.gorgon.workflow.observability.AsyncEventDispatcher;
import dev.mars.gorgon.workflow.observability.ExecutionEvent;
import dev.mars.gorgon.workflow.observability.ExecutionEventListener;
import dev.mars.gorgon.workflow.observability.MetricsEventListener;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link WorkflowEngine}: runs each execution on a shared cached thread pool,
 * dispatching layers through a {@link GraphRunner} and saving a checkpoint whenever an
 * execution pauses.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
public class DefaultWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = Logger.getLogger(DefaultWorkflowEngine.class.getName());

    private final StepExecutorRegistry registry;
    private final CheckpointStore checkpointStore;
    private final GorgonConfiguration configuration;
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();
    private final ExecutorService executorService;
    private final AsyncEventDispatcher eventDispatcher;
    private final Map<String, ExecutionState> activeExecutions = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    public DefaultWorkflowEngine(StepExecutorRegistry registry) {
        this(registry, new InMemoryCheckpointStore(), new GorgonConfiguration());
    }

    public DefaultWorkflowEngine(StepExecutorRegistry registry, CheckpointStore checkpointStore,
                                 GorgonConfiguration configuration) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "Checkpoint store cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.executorService = Executors.newCachedThreadPool(new WorkerThreadFactory());
        this.eventDispatcher = new AsyncEventDispatcher();
        if (configuration.isMetricsEnabled()) {
            eventDispatcher.addListener(new MetricsEventListener());
        }
    }

    public void addListener(ExecutionEventListener listener) {
        eventDispatcher.addListener(listener);
    }

    public void removeListener(ExecutionEventListener listener) {
        eventDispatcher.removeListener(listener);
    }

    public CheckpointStore getCheckpointStore() {
        return checkpointStore;
    }

    public StepExecutorRegistry getRegistry() {
        return registry;
    }

    @Override
    public CompletableFuture<ExecutionResult> execute(WorkflowDefinition definition, Map<String, Object> inputs)
            throws GraphException {
        return execute(definition, inputs, ExecutionOptions.fromConfiguration(configuration));
    }

    @Override
    public CompletableFuture<ExecutionResult> execute(WorkflowDefinition definition, Map<String, Object> inputs,
                                                      ExecutionOptions options) throws GraphException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        DependencyGraph graph = graphBuilder.build(definition);

        Map<String, Object> variables = new LinkedHashMap<>(definition.getVariables());
        List<String> missing = applyInputs(definition, inputs, variables);
        String executionId = options.getExecutionId().orElseGet(() -> UUID.randomUUID().toString());
        ExecutionState state = newState(executionId, definition.getId(), options, definition);

        if (!missing.isEmpty()) {
            String message = "Missing required input(s): " + String.join(", ", missing);
            logger.warning("Workflow " + definition.getId() + " not started: " + message);
            return CompletableFuture.completedFuture(notStartedResult(state, graph, variables,
                    new WorkflowError(WorkflowErrorKind.MISSING_INPUT, message)));
        }
        return launch(state, graph, new VariableContext(variables), definition, null);
    }

    @Override
    public CompletableFuture<ExecutionResult> execute(DependencyGraph graph, VariableContext context,
                                                      ExecutionOptions options) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        Objects.requireNonNull(context, "Context cannot be null");
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        String executionId = options.getExecutionId().orElseGet(() -> UUID.randomUUID().toString());
        ExecutionState state = newState(executionId, graph.getWorkflowId(), options, null);
        return launch(state, graph, context, null, null);
    }

    @Override
    public CompletableFuture<ExecutionResult> resume(Checkpoint checkpoint, WorkflowDefinition definition)
            throws GraphException, CheckpointException {
        return resume(checkpoint, definition, ExecutionOptions.fromConfiguration(configuration));
    }

    @Override
    public CompletableFuture<ExecutionResult> resume(Checkpoint checkpoint, WorkflowDefinition definition,
                                                     ExecutionOptions options)
            throws GraphException, CheckpointException {
        Objects.requireNonNull(checkpoint, "Checkpoint cannot be null");
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        DependencyGraph graph = graphBuilder.build(definition);
        if (!checkpoint.getWorkflowId().equals(definition.getId())) {
            throw new CheckpointException(CheckpointException.Kind.CORRUPT, checkpoint.getCheckpointId(),
                    "Checkpoint " + checkpoint.getCheckpointId() + " belongs to workflow " + checkpoint.getWorkflowId()
                    + ", not " + definition.getId());
        }
        for (String stepId : checkpoint.getCompletedStepIds()) {
            if (!graph.contains(stepId)) {
                throw new CheckpointException(CheckpointException.Kind.CORRUPT, checkpoint.getCheckpointId(),
                        "Checkpoint " + checkpoint.getCheckpointId() + " records unknown step '" + stepId + "'");
            }
        }

        ExecutionOptions resumeOptions = options.toBuilder().executionId(checkpoint.getExecutionId()).build();
        ExecutionState state = newState(checkpoint.getExecutionId(), definition.getId(), resumeOptions, definition,
                checkpoint.getStartedAt() != null ? checkpoint.getStartedAt() : Instant.now());
        Map<String, StepResult> recorded = new LinkedHashMap<>();
        checkpoint.getStepResults().forEach(result -> recorded.put(result.getStepId(), result));
        for (String stepId : checkpoint.getCompletedStepIds()) {
            StepResult result = recorded.get(stepId);
            if (result == null) {
                throw new CheckpointException(CheckpointException.Kind.CORRUPT, checkpoint.getCheckpointId(),
                        "Checkpoint " + checkpoint.getCheckpointId() + " has no result for completed step '" + stepId + "'");
            }
            state.getResults().put(stepId, result);
            state.getCompleted().add(stepId);
        }
        state.getBypassed().addAll(checkpoint.getBypassedStepIds());
        state.addTokens(checkpoint.getTotalTokens());

        logger.info("Resuming execution " + checkpoint.getExecutionId() + " of workflow " + definition.getId()
                + " from checkpoint " + checkpoint.getCheckpointId() + "; frontier "
                + graph.frontier(state.getCompleted()));
        return launch(state, graph, new VariableContext(checkpoint.getContext()), definition,
                checkpoint.getCheckpointId());
    }

    @Override
    public CompletableFuture<ExecutionResult> resume(String checkpointId, WorkflowDefinition definition)
            throws GraphException {
        try {
            return resume(checkpointStore.load(checkpointId), definition);
        } catch (CheckpointException e) {
            logger.warning("Cannot resume from checkpoint " + checkpointId + ": " + e.getMessage());
            Instant now = Instant.now();
            return CompletableFuture.completedFuture(
                    ExecutionResult.builder(definition.getId(), UUID.randomUUID().toString())
                            .status(WorkflowStatus.FAILED)
                            .checkpointId(checkpointId)
                            .error(new WorkflowError(WorkflowErrorKind.CHECKPOINT_CORRUPT, e.getMessage()))
                            .startedAt(now)
                            .endedAt(now)
                            .build());
        }
    }

    @Override
    public Optional<WorkflowStatus> getStatus(String executionId) {
        ExecutionState state = activeExecutions.get(executionId);
        return state != null ? Optional.of(state.getStatus()) : Optional.empty();
    }

    @Override
    public boolean pause(String executionId) {
        ExecutionState state = activeExecutions.get(executionId);
        if (state != null && state.getStatus().isActive()) {
            logger.info("Pause requested for execution " + executionId);
            return state.requestPause() || state.isPauseRequested();
        }
        return false;
    }

    @Override
    public boolean cancel(String executionId) {
        ExecutionState state = activeExecutions.get(executionId);
        if (state != null && state.getStatus().isActive()) {
            logger.info("Cancelling workflow execution: " + executionId);
            state.getToken().cancel();
            return true;
        }
        return false;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        activeExecutions.values().forEach(state -> state.getToken().cancel());
        executorService.shutdown();
        eventDispatcher.close();
        logger.info("DefaultWorkflowEngine shutdown initiated");
    }

    private CompletableFuture<ExecutionResult> launch(ExecutionState state, DependencyGraph graph,
                                                      VariableContext context, WorkflowDefinition definition,
                                                      String resumedCheckpointId) {
        if (activeExecutions.putIfAbsent(state.getExecutionId(), state) != null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Execution " + state.getExecutionId() + " is already running"));
        }
        return CompletableFuture.supplyAsync(
                () -> run(state, graph, context, definition, resumedCheckpointId), executorService)
                .whenComplete((result, error) -> activeExecutions.remove(state.getExecutionId()));
    }

    private ExecutionResult run(ExecutionState state, DependencyGraph graph, VariableContext context,
                                WorkflowDefinition definition, String resumedCheckpointId) {
        String executionId = state.getExecutionId();
        state.setStatus(WorkflowStatus.RUNNING);
        state.publish(state.event(ExecutionEvent.Type.WORKFLOW_STARTED).workflowStatus(WorkflowStatus.RUNNING).build());
        logger.info("Starting workflow execution: " + executionId + " (workflow " + state.getWorkflowId()
                + ", " + graph.size() + " steps, " + graph.getLayers().size() + " layers)");

        GraphRunner runner = new GraphRunner(state, registry, executorService);
        GraphRunner.Outcome outcome;
        try {
            outcome = runner.runTopLevel(graph, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = new GraphRunner.Outcome(GraphRunner.Stop.CANCELLED, "Execution interrupted", false);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Workflow execution failed: " + executionId + " - " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Workflow execution exception details for: " + executionId, e);
            }
            return finish(state, graph, context, definition, WorkflowStatus.FAILED,
                    new WorkflowError(WorkflowErrorKind.INTERNAL_ERROR, e.getMessage()), null);
        }

        switch (outcome.getStop()) {
            case NONE:
                deleteConsumedCheckpoint(state, resumedCheckpointId);
                return finish(state, graph, context, definition, WorkflowStatus.COMPLETED, null, null);
            case PAUSED:
                try {
                    String checkpointId = checkpointStore.save(checkpoint(state, graph, context));
                    logger.info("Execution " + executionId + " paused at checkpoint " + checkpointId);
                    return finish(state, graph, context, definition, WorkflowStatus.PAUSED, null, checkpointId);
                } catch (CheckpointException e) {
                    logger.log(Level.SEVERE, "Failed to save checkpoint for execution " + executionId + ": " + e.getMessage());
                    return finish(state, graph, context, definition, WorkflowStatus.FAILED,
                            new WorkflowError(WorkflowErrorKind.INTERNAL_ERROR, e.getMessage()), null);
                }
            case ABORTED:
                return finish(state, graph, context, definition, WorkflowStatus.FAILED,
                        new WorkflowError(WorkflowErrorKind.ABORTED_BY_POLICY, outcome.getMessage()), null);
            case CANCELLED:
                return finish(state, graph, context, definition, WorkflowStatus.FAILED,
                        new WorkflowError(WorkflowErrorKind.CANCELLED, outcome.getMessage()), null);
            case TIMED_OUT:
                return finish(state, graph, context, definition, WorkflowStatus.FAILED,
                        new WorkflowError(WorkflowErrorKind.GLOBAL_TIMEOUT_EXCEEDED, outcome.getMessage()), null);
            case BUDGET_EXCEEDED:
                return finish(state, graph, context, definition, WorkflowStatus.FAILED,
                        new WorkflowError(WorkflowErrorKind.BUDGET_EXCEEDED, outcome.getMessage()), null);
            default:
                throw new IllegalStateException("Unhandled stop: " + outcome.getStop());
        }
    }

    private ExecutionResult finish(ExecutionState state, DependencyGraph graph, VariableContext context,
                                   WorkflowDefinition definition, WorkflowStatus status, WorkflowError error,
                                   String checkpointId) {
        state.setStatus(status);
        Instant endedAt = Instant.now();
        Map<String, Object> variables = context.snapshot();

        ExecutionResult.Builder builder = ExecutionResult.builder(state.getWorkflowId(), state.getExecutionId())
                .status(status)
                .variables(variables)
                .outputs(collectOutputs(definition, variables))
                .totalTokens(state.getTotalTokens())
                .checkpointId(checkpointId)
                .error(error)
                .startedAt(state.getStartedAt())
                .endedAt(endedAt);
        for (StepDefinition step : graph.getSteps()) {
            StepResult result = state.getResults().get(step.getId());
            if (result == null) {
                result = status == WorkflowStatus.PAUSED
                        ? StepResult.pending(step.getId(), step.getKind())
                        : StepResult.skipped(step.getId(), step.getKind(), new StepError(StepErrorKind.CANCELLED,
                                "Not started: " + (error != null ? error.getMessage() : "execution ended")));
            }
            builder.stepResult(result);
        }
        ExecutionResult result = builder.build();

        state.publish(state.event(ExecutionEvent.Type.WORKFLOW_FINISHED)
                .workflowStatus(status)
                .duration(Duration.between(state.getStartedAt(), endedAt))
                .tokensUsed(state.getTotalTokens())
                .errorKind(error != null ? error.getKind().name() : null)
                .message(error != null ? error.getMessage() : null)
                .build());
        if (status == WorkflowStatus.FAILED) {
            logger.warning("Workflow execution " + state.getExecutionId() + " failed: " + error);
        } else {
            logger.info("Workflow execution completed: " + state.getExecutionId() + " with status: " + status.getValue());
        }
        return result;
    }

    private Checkpoint checkpoint(ExecutionState state, DependencyGraph graph, VariableContext context) {
        List<String> completed;
        synchronized (state.getCompleted()) {
            completed = new ArrayList<>(state.getCompleted());
        }
        List<String> bypassed;
        synchronized (state.getBypassed()) {
            bypassed = new ArrayList<>(state.getBypassed());
        }
        List<StepResult> results = new ArrayList<>();
        for (String stepId : completed) {
            results.add(state.getResults().get(stepId));
        }
        return Checkpoint.builder()
                .executionId(state.getExecutionId())
                .workflowId(state.getWorkflowId())
                .startedAt(state.getStartedAt())
                .context(context.snapshot())
                .completedStepIds(completed)
                .bypassedStepIds(bypassed)
                .frontier(graph.frontier(state.getCompleted()))
                .stepResults(results)
                .totalTokens(state.getTotalTokens())
                .build();
    }

    private void deleteConsumedCheckpoint(ExecutionState state, String checkpointId) {
        if (checkpointId == null || !state.getOptions().isDeleteCheckpointOnCompletion()) {
            return;
        }
        try {
            checkpointStore.delete(checkpointId);
        } catch (CheckpointException e) {
            logger.warning("Failed to delete checkpoint " + checkpointId + " after completion: " + e.getMessage());
        }
    }

    private ExecutionState newState(String executionId, String workflowId, ExecutionOptions options,
                                    WorkflowDefinition definition) {
        return newState(executionId, workflowId, options, definition, Instant.now());
    }

    private ExecutionState newState(String executionId, String workflowId, ExecutionOptions options,
                                    WorkflowDefinition definition, Instant startedAt) {
        int maxConcurrency = options.getMaxConcurrency();
        Instant deadline = null;
        Long tokenBudget = null;
        if (definition != null) {
            if (definition.getMaxConcurrency().isPresent()) {
                maxConcurrency = definition.getMaxConcurrency().getAsInt();
            }
            deadline = definition.getTimeout().map(timeout -> Instant.now().plus(timeout)).orElse(null);
            tokenBudget = definition.getTokenBudget().isPresent() ? definition.getTokenBudget().getAsLong() : null;
        }
        return new ExecutionState(executionId, workflowId, options, Math.max(1, maxConcurrency), startedAt,
                deadline, tokenBudget, eventDispatcher::publish);
    }

    /**
     * Copies supplied inputs into the variables, filling declared defaults.
     *
     * @return names of required inputs with neither a value nor a default
     */
    private static List<String> applyInputs(WorkflowDefinition definition, Map<String, Object> inputs,
                                            Map<String, Object> variables) {
        if (inputs != null) {
            variables.putAll(inputs);
        }
        List<String> missing = new ArrayList<>();
        for (InputSpec input : definition.getInputs().values()) {
            if (inputs != null && inputs.containsKey(input.getName())) {
                continue;
            }
            Optional<Object> defaultValue = input.getDefaultValue();
            if (defaultValue.isPresent()) {
                variables.put(input.getName(), defaultValue.get());
            } else if (input.isRequired()) {
                missing.add(input.getName());
            }
        }
        return missing;
    }

    private static Map<String, Object> collectOutputs(WorkflowDefinition definition, Map<String, Object> variables) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        if (definition == null) {
            return outputs;
        }
        for (String name : definition.getOutputs()) {
            VariableResolver.lookup(variables, name).ifPresent(value -> outputs.put(name, value));
        }
        return outputs;
    }

    private ExecutionResult notStartedResult(ExecutionState state, DependencyGraph graph,
                                             Map<String, Object> variables, WorkflowError error) {
        Instant now = Instant.now();
        ExecutionResult.Builder builder = ExecutionResult.builder(state.getWorkflowId(), state.getExecutionId())
                .status(WorkflowStatus.FAILED)
                .variables(variables)
                .error(error)
                .startedAt(now)
                .endedAt(now);
        for (StepDefinition step : graph.getSteps()) {
            builder.stepResult(StepResult.skipped(step.getId(), step.getKind(),
                    new StepError(StepErrorKind.CANCELLED, "Not started: " + error.getMessage())));
        }
        return builder.build();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "gorgon-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
