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
import dev.mars.gorgon.workflow.DependencyGraphBuilder;
import dev.mars.gorgon.workflow.FailurePolicy;
import dev.mars.gorgon.workflow.GraphException;
import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.StepKind;
import dev.mars.gorgon.workflow.VariableContext;
import dev.mars.gorgon.workflow.executor.NestedExecutor;
import dev.mars.gorgon.workflow.executor.StepExecutorRegistry;
import dev.mars.gorgon.workflow.executor.StepInstance;
import dev.mars.gorgon.workflow.executor.SubGraphResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Drives a dependency graph layer by layer.
 * <p>
 * Each layer is dispatched against one snapshot of the context, so steps in a layer never
 * see each other's outputs. Once every dispatched step has a terminal result, bindings are
 * merged in declaration order; when two steps bind the same name the later-declared step
 * wins. The same code runs nested graphs for group steps, with its own context copy and
 * concurrency ceiling.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
final class GraphRunner implements NestedExecutor {

    private static final Logger logger = Logger.getLogger(GraphRunner.class.getName());

    enum Stop {
        NONE,
        ABORTED,
        PAUSED,
        CANCELLED,
        TIMED_OUT,
        BUDGET_EXCEEDED
    }

    static final class Outcome {
        private final Stop stop;
        private final String message;
        private final boolean checkpointReached;

        Outcome(Stop stop, String message, boolean checkpointReached) {
            this.stop = stop;
            this.message = message;
            this.checkpointReached = checkpointReached;
        }

        Stop getStop() {
            return stop;
        }

        String getMessage() {
            return message;
        }

        boolean isCheckpointReached() {
            return checkpointReached;
        }
    }

    private final ExecutionState state;
    private final StepRunner stepRunner;
    private final ExecutorService workerPool;
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();

    GraphRunner(ExecutionState state, StepExecutorRegistry registry, ExecutorService workerPool) {
        this.state = state;
        this.workerPool = workerPool;
        this.stepRunner = new StepRunner(state, registry, workerPool, this);
    }

    /**
     * Runs the top-level graph, skipping steps already recorded as completed in the state.
     * Steps left unrun are recorded as pending when pausing and as skipped otherwise.
     */
    Outcome runTopLevel(DependencyGraph graph, VariableContext context) throws InterruptedException {
        Scope scope = new Scope(graph, context, state.getMaxConcurrency(), false, true, state.getToken(),
                state.getResults(), state.getCompleted(), state.getBypassed());
        for (String stepId : state.getCompleted()) {
            StepResult previous = state.getResults().get(stepId);
            graph.getStep(stepId).ifPresent(step -> recordBranchChoice(scope, step, previous));
        }

        Outcome outcome = runLayers(scope);
        if (outcome.getStop() == Stop.PAUSED) {
            for (StepDefinition step : graph.getSteps()) {
                if (!scope.completed.contains(step.getId())) {
                    scope.results.put(step.getId(), StepResult.pending(step.getId(), step.getKind()));
                }
            }
        } else if (outcome.getStop() != Stop.NONE) {
            skipRemaining(scope, outcome.getMessage());
        }
        return outcome;
    }

    @Override
    public SubGraphResult runGraph(String parentId, List<StepDefinition> steps, Map<String, Object> variables,
                                   int maxWorkers, boolean failFast, CancellationToken token)
            throws GraphException, InterruptedException {
        DependencyGraph graph = graphBuilder.build(parentId, steps);
        Scope scope = new Scope(graph, new VariableContext(variables), maxWorkers, failFast, false, token,
                Collections.synchronizedMap(new LinkedHashMap<>()),
                Collections.synchronizedSet(new LinkedHashSet<>()),
                Collections.synchronizedSet(new LinkedHashSet<>()));
        Outcome outcome = runLayers(scope);
        if (outcome.getStop() != Stop.NONE) {
            skipRemaining(scope, outcome.getMessage());
        }
        List<StepResult> ordered = new ArrayList<>();
        String failure = outcome.getMessage();
        for (StepDefinition step : graph.getSteps()) {
            StepResult result = scope.results.get(step.getId());
            ordered.add(result);
            if (failure == null && result.isFailed() && step.getOnFailure() != FailurePolicy.SKIP) {
                failure = "Step '" + step.getId() + "' failed: "
                        + (result.getError() != null ? result.getError().getMessage() : "unknown error");
            }
        }
        return new SubGraphResult(ordered, scope.bindings, failure != null, failure);
    }

    @Override
    public List<StepResult> runInstances(List<StepInstance> instances, int maxConcurrent, boolean failFast,
                                         CancellationToken token) throws InterruptedException {
        Semaphore permits = new Semaphore(Math.max(1, maxConcurrent));
        AtomicBoolean halted = new AtomicBoolean(false);
        List<Future<StepResult>> futures = new ArrayList<>(instances.size());
        StepResult[] results = new StepResult[instances.size()];

        for (int i = 0; i < instances.size(); i++) {
            StepInstance instance = instances.get(i);
            StepDefinition step = instance.getStep();
            if (halted.get() || token.isCancelled()) {
                results[i] = notStarted(step, halted.get() ? "an earlier item failed" : "execution cancelled");
                futures.add(null);
                continue;
            }
            permits.acquire();
            if (halted.get() || token.isCancelled()) {
                permits.release();
                results[i] = notStarted(step, halted.get() ? "an earlier item failed" : "execution cancelled");
                futures.add(null);
                continue;
            }
            futures.add(workerPool.submit(() -> {
                try {
                    StepResult result = stepRunner.run(step, instance.getVariables(), token);
                    if (failFast && result.isFailed()) {
                        halted.set(true);
                    }
                    return result;
                } finally {
                    permits.release();
                }
            }));
        }

        List<StepResult> ordered = new ArrayList<>(instances.size());
        for (int i = 0; i < instances.size(); i++) {
            Future<StepResult> future = futures.get(i);
            ordered.add(future != null ? await(future, instances.get(i).getStep()) : results[i]);
        }
        return ordered;
    }

    private Outcome runLayers(Scope scope) throws InterruptedException {
        boolean checkpointReached = false;
        for (List<StepDefinition> layer : scope.graph.getLayers()) {
            List<StepDefinition> pending = layer.stream()
                    .filter(step -> !scope.completed.contains(step.getId()))
                    .collect(Collectors.toList());
            if (pending.isEmpty()) {
                continue;
            }

            Outcome boundary = checkBoundary(scope);
            if (boundary != null) {
                return boundary;
            }

            if (scope.topLevel) {
                logger.fine("Execution " + state.getExecutionId() + " dispatching layer "
                        + scope.graph.getLayerIndex(pending.get(0).getId()) + ": "
                        + pending.stream().map(StepDefinition::getId).collect(Collectors.toList()));
            }
            LayerResult layerResult = runLayer(scope, pending);
            checkpointReached |= layerResult.checkpointReached;

            if (layerResult.haltMessage != null) {
                return new Outcome(scope.token.isCancelled() ? Stop.CANCELLED : Stop.ABORTED,
                        layerResult.haltMessage, checkpointReached);
            }
            if (scope.topLevel && layerResult.checkpointReached && state.getOptions().isPauseAtCheckpoints()
                    && hasRemaining(scope)) {
                return new Outcome(Stop.PAUSED, "Paused at checkpoint", true);
            }
        }
        if (scope.token.isCancelled() && hasRemaining(scope)) {
            return new Outcome(Stop.CANCELLED, "Execution cancelled", checkpointReached);
        }
        return new Outcome(Stop.NONE, null, checkpointReached);
    }

    private Outcome checkBoundary(Scope scope) {
        if (scope.token.isCancelled()) {
            return new Outcome(Stop.CANCELLED, "Execution cancelled", false);
        }
        if (!scope.topLevel) {
            return null;
        }
        if (state.isPauseRequested()) {
            return new Outcome(Stop.PAUSED, "Paused on request", false);
        }
        if (state.isPastDeadline()) {
            return new Outcome(Stop.TIMED_OUT, "Workflow timeout exceeded", false);
        }
        if (state.isBudgetExhausted()) {
            return new Outcome(Stop.BUDGET_EXCEEDED, "Token budget of " + state.getTokenBudget()
                    + " exhausted after " + state.getTotalTokens() + " tokens", false);
        }
        return null;
    }

    private LayerResult runLayer(Scope scope, List<StepDefinition> pending) throws InterruptedException {
        Map<String, Object> snapshot = scope.context.snapshot();
        Semaphore permits = new Semaphore(Math.max(1, scope.maxWorkers));
        AtomicReference<String> halt = new AtomicReference<>();
        Map<String, Future<StepResult>> dispatched = new LinkedHashMap<>();
        Map<String, StepResult> immediate = new LinkedHashMap<>();

        for (StepDefinition step : pending) {
            if (isBypassed(scope, step)) {
                immediate.put(step.getId(), StepResult.skipped(step.getId(), step.getKind(),
                        new StepError(StepErrorKind.BRANCH_NOT_TAKEN, "Condition branch not taken")));
                continue;
            }
            if (halt.get() != null || scope.token.isCancelled()) {
                immediate.put(step.getId(), notStarted(step, reason(scope, halt.get())));
                continue;
            }
            permits.acquire();
            if (halt.get() != null || scope.token.isCancelled()) {
                permits.release();
                immediate.put(step.getId(), notStarted(step, reason(scope, halt.get())));
                continue;
            }
            dispatched.put(step.getId(), workerPool.submit(() -> {
                try {
                    StepResult result = stepRunner.run(step, snapshot, scope.token);
                    if (haltsGroup(scope, step, result)) {
                        halt.compareAndSet(null, "Step '" + step.getId() + "' failed: "
                                + (result.getError() != null ? result.getError().getMessage() : "unknown error"));
                    }
                    return result;
                } finally {
                    permits.release();
                }
            }));
        }

        Map<String, StepResult> finished = new LinkedHashMap<>();
        for (StepDefinition step : pending) {
            Future<StepResult> future = dispatched.get(step.getId());
            finished.put(step.getId(), future != null ? await(future, step) : immediate.get(step.getId()));
        }

        LayerResult layerResult = new LayerResult();
        for (StepDefinition step : pending) {
            StepResult result = finished.get(step.getId());
            if (result.getStatus() == StepStatus.SUCCEEDED && !result.getOutputs().isEmpty()) {
                scope.context.merge(result.getOutputs());
                scope.bindings.putAll(result.getOutputs());
            }
            scope.results.put(step.getId(), result);
            scope.completed.add(step.getId());
            if (immediate.containsKey(step.getId())
                    && result.getError() != null
                    && result.getError().getKind() == StepErrorKind.BRANCH_NOT_TAKEN) {
                scope.bypassed.add(step.getId());
            }
            recordBranchChoice(scope, step, result);
            if (scope.topLevel) {
                state.addTokens(result.getTokensUsed());
            }
            if (step.getKind() == StepKind.CHECKPOINT && result.getStatus() == StepStatus.SUCCEEDED) {
                layerResult.checkpointReached = true;
            }
        }
        layerResult.haltMessage = halt.get();
        if (layerResult.haltMessage == null && scope.token.isCancelled()) {
            layerResult.haltMessage = "Execution cancelled";
        }
        return layerResult;
    }

    private StepResult await(Future<StepResult> future, StepDefinition step) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.severe("Unexpected failure running step " + step.getId() + ": " + cause);
            return StepResult.builder(step.getId())
                    .kind(step.getKind())
                    .status(StepStatus.FAILED)
                    .endedAt(Instant.now())
                    .error(new StepError(StepErrorKind.TOOL_INVOCATION_FAILED, String.valueOf(cause.getMessage())))
                    .build();
        }
    }

    /**
     * At top level a failure halts unless the step's policy is skip. Inside a group only
     * fail-fast halts; siblings of a failed sub-step otherwise run to completion.
     */
    private static boolean haltsGroup(Scope scope, StepDefinition step, StepResult result) {
        if (!result.isFailed()) {
            return false;
        }
        return scope.topLevel ? step.getOnFailure() != FailurePolicy.SKIP : scope.failFast;
    }

    private static boolean isBypassed(Scope scope, StepDefinition step) {
        if (scope.untaken.contains(step.getId())) {
            return true;
        }
        Set<String> dependencies = scope.graph.getDependencies(step.getId());
        return !dependencies.isEmpty() && scope.bypassed.containsAll(dependencies);
    }

    /**
     * After a condition step, marks the branch it did not select. A condition that did not
     * succeed selects neither branch.
     */
    private static void recordBranchChoice(Scope scope, StepDefinition step, StepResult result) {
        if (step.getKind() != StepKind.CONDITION || result == null) {
            return;
        }
        boolean evaluated = result.getStatus() == StepStatus.SUCCEEDED;
        boolean selectedTrue = evaluated && Boolean.TRUE.equals(result.getRawOutput());
        if (!evaluated || !selectedTrue) {
            step.getTrueStep().ifPresent(scope.untaken::add);
        }
        if (!evaluated || selectedTrue) {
            step.getFalseStep().ifPresent(scope.untaken::add);
        }
    }

    private static boolean hasRemaining(Scope scope) {
        return scope.graph.getSteps().stream().anyMatch(step -> !scope.completed.contains(step.getId()));
    }

    private static void skipRemaining(Scope scope, String reason) {
        for (StepDefinition step : scope.graph.getSteps()) {
            if (!scope.completed.contains(step.getId())) {
                scope.results.put(step.getId(), notStarted(step, reason));
            }
        }
    }

    private static StepResult notStarted(StepDefinition step, String reason) {
        return StepResult.skipped(step.getId(), step.getKind(),
                new StepError(StepErrorKind.CANCELLED, "Not started: " + reason));
    }

    private static String reason(Scope scope, String halt) {
        return halt != null ? halt : "execution cancelled";
    }

    private static final class LayerResult {
        private String haltMessage;
        private boolean checkpointReached;
    }

    private static final class Scope {
        private final DependencyGraph graph;
        private final VariableContext context;
        private final int maxWorkers;
        private final boolean failFast;
        private final boolean topLevel;
        private final CancellationToken token;
        private final Map<String, StepResult> results;
        private final Set<String> completed;
        private final Set<String> bypassed;
        private final Set<String> untaken = Collections.synchronizedSet(new HashSet<>());
        private final Map<String, Object> bindings = new LinkedHashMap<>();

        Scope(DependencyGraph graph, VariableContext context, int maxWorkers, boolean failFast, boolean topLevel,
              CancellationToken token, Map<String, StepResult> results, Set<String> completed, Set<String> bypassed) {
            this.graph = graph;
            this.context = context;
            this.maxWorkers = maxWorkers;
            this.failFast = failFast;
            this.topLevel = topLevel;
            this.token = token;
            this.results = results;
            this.completed = completed;
            this.bypassed = bypassed;
        }
    }
}
