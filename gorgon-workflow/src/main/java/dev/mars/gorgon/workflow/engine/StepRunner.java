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

import dev.mars.gorgon.workflow.ConditionSpec;
import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.TemplateResolutionException;
import dev.mars.gorgon.workflow.VariableResolver;
import dev.mars.gorgon.workflow.executor.NestedExecutor;
import dev.mars.gorgon.workflow.executor.StepContext;
import dev.mars.gorgon.workflow.executor.StepExecutorRegistry;
import dev.mars.gorgon.workflow.executor.StepFailureException;
import dev.mars.gorgon.workflow.executor.StepHandler;
import dev.mars.gorgon.workflow.executor.StepOutcome;
import dev.mars.gorgon.workflow.observability.ExecutionEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a single step to a terminal result: evaluates its guard, resolves its parameters,
 * invokes its handler under the step timeout and retries retryable failures with
 * exponential backoff.
 * <p>
 * The runner never throws; every failure ends up in the returned {@link StepResult}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
final class StepRunner {

    private static final Logger logger = Logger.getLogger(StepRunner.class.getName());

    private static final long POLL_MILLIS = 50;

    private final ExecutionState state;
    private final StepExecutorRegistry registry;
    private final ExecutorService workerPool;
    private final NestedExecutor nestedExecutor;

    StepRunner(ExecutionState state, StepExecutorRegistry registry, ExecutorService workerPool,
               NestedExecutor nestedExecutor) {
        this.state = state;
        this.registry = registry;
        this.workerPool = workerPool;
        this.nestedExecutor = nestedExecutor;
    }

    StepResult run(StepDefinition step, Map<String, Object> variables, CancellationToken token) {
        Instant startedAt = Instant.now();
        state.publish(state.event(ExecutionEvent.Type.STEP_STARTED).step(step.getId(), step.getKind()).build());
        StepResult result = runAttempts(step, variables, token, startedAt);
        state.publish(state.event(ExecutionEvent.Type.STEP_FINISHED)
                .step(step.getId(), step.getKind())
                .stepStatus(result.getStatus())
                .duration(result.getDuration())
                .tokensUsed(result.getTokensUsed())
                .attempt(result.getRetryCount())
                .errorKind(result.getError() != null ? result.getError().getKind().name() : null)
                .message(result.getError() != null ? result.getError().getMessage() : null)
                .build());
        return result;
    }

    private StepResult runAttempts(StepDefinition step, Map<String, Object> variables,
                                   CancellationToken token, Instant startedAt) {
        Optional<ConditionSpec> guard = step.getCondition();
        if (guard.isPresent()) {
            try {
                if (!guard.get().evaluate(variables)) {
                    logger.fine("Skipping step " + step.getId() + ": condition " + guard.get() + " not met");
                    return StepResult.skipped(step.getId(), step.getKind(),
                            new StepError(StepErrorKind.CONDITION_NOT_MET, "Condition not met: " + guard.get()));
                }
            } catch (IllegalArgumentException e) {
                return failed(step, startedAt, StepErrorKind.CONDITION_FAILED, e.getMessage(), 0, List.of());
            }
        }

        Optional<StepHandler> handler = registry.get(step.getKind());
        if (handler.isEmpty()) {
            return failed(step, startedAt, StepErrorKind.UNKNOWN_STEP_KIND,
                    "No handler registered for step kind '" + step.getKind().getValue() + "'", 0, List.of());
        }

        Duration timeout = step.getTimeout().orElse(state.getOptions().getDefaultStepTimeout());
        int maxAttempts = step.getMaxRetries() + 1;
        StepErrorKind lastKind = StepErrorKind.TOOL_INVOCATION_FAILED;
        String lastMessage = null;
        List<StepResult> lastChildren = List.of();
        int attempt = 0;

        while (true) {
            if (token.isCancelled()) {
                return failed(step, startedAt, StepErrorKind.CANCELLED, "Execution cancelled", attempt, lastChildren);
            }

            Map<String, Object> params;
            try {
                params = new VariableResolver(variables, step.getOptionalVariables()).resolveParams(step.getParams());
            } catch (TemplateResolutionException e) {
                return failed(step, startedAt, StepErrorKind.TEMPLATE_RESOLUTION_FAILED, e.getMessage(), attempt, List.of());
            }

            CancellationToken attemptToken = token.child();
            StepContext context = StepContext.builder()
                    .executionId(state.getExecutionId())
                    .workflowId(state.getWorkflowId())
                    .step(step)
                    .params(params)
                    .variables(variables)
                    .timeout(timeout)
                    .attempt(attempt)
                    .cancellationToken(attemptToken)
                    .nestedExecutor(nestedExecutor)
                    .registry(registry)
                    .build();
            try {
                StepOutcome outcome = invoke(handler.get(), context, timeout, attemptToken);
                return succeeded(step, startedAt, outcome, attempt);
            } catch (StepFailureException e) {
                lastKind = e.getKind();
                lastMessage = e.getMessage();
                lastChildren = e.getChildren();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return failed(step, startedAt, StepErrorKind.CANCELLED, "Interrupted", attempt, lastChildren);
            } finally {
                token.release(attemptToken);
            }

            if (lastKind == StepErrorKind.RATE_LIMITED) {
                state.publish(state.event(ExecutionEvent.Type.STEP_THROTTLED)
                        .step(step.getId(), step.getKind()).attempt(attempt).message(lastMessage).build());
            }
            if (!lastKind.isRetryable() || attempt + 1 >= maxAttempts || token.isCancelled()) {
                return failed(step, startedAt, lastKind, lastMessage, attempt, lastChildren);
            }

            Duration backoff = state.getOptions().backoff(attempt);
            logger.warning("Step " + step.getId() + " attempt " + (attempt + 1) + "/" + maxAttempts + " failed with "
                    + lastKind + ": " + lastMessage + "; retrying in " + backoff.toMillis() + "ms");
            state.publish(state.event(ExecutionEvent.Type.STEP_RETRYING)
                    .step(step.getId(), step.getKind())
                    .attempt(attempt)
                    .errorKind(lastKind.name())
                    .message(lastMessage)
                    .build());
            if (!sleep(backoff, token)) {
                return failed(step, startedAt, StepErrorKind.CANCELLED, "Cancelled during retry backoff",
                        attempt, lastChildren);
            }
            attempt++;
        }
    }

    /**
     * Runs the handler on a worker thread and waits for it under the step timeout. A cancelled
     * attempt is given the grace period to return before its thread is interrupted; whatever
     * it returns after cancellation is discarded.
     */
    private StepOutcome invoke(StepHandler handler, StepContext context, Duration timeout,
                               CancellationToken attemptToken) throws InterruptedException {
        CountDownLatch finished = new CountDownLatch(1);
        FutureTask<StepOutcome> task = new FutureTask<>(() -> handler.execute(context)) {
            @Override
            protected void done() {
                finished.countDown();
            }
        };
        workerPool.execute(task);

        long deadline = System.nanoTime() + timeout.toNanos();
        long cancelDeadline = Long.MAX_VALUE;
        try {
            while (!finished.await(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                long now = System.nanoTime();
                if (now - deadline >= 0) {
                    task.cancel(true);
                    attemptToken.cancel();
                    throw new StepFailureException(StepErrorKind.TIMEOUT,
                            "Step '" + context.getStepId() + "' exceeded timeout of " + timeout);
                }
                if (attemptToken.isCancelled() && cancelDeadline == Long.MAX_VALUE) {
                    cancelDeadline = now + state.getOptions().getCancelGracePeriod().toNanos();
                }
                if (cancelDeadline != Long.MAX_VALUE && now - cancelDeadline >= 0) {
                    task.cancel(true);
                    throw new StepFailureException(StepErrorKind.CANCELLED, "Step '" + context.getStepId() + "' cancelled");
                }
            }
            StepOutcome outcome = task.get();
            if (attemptToken.isCancelled()) {
                throw new StepFailureException(StepErrorKind.CANCELLED, "Step '" + context.getStepId() + "' cancelled");
            }
            return outcome;
        } catch (InterruptedException e) {
            task.cancel(true);
            attemptToken.cancel();
            throw e;
        } catch (CancellationException e) {
            throw new StepFailureException(StepErrorKind.CANCELLED, "Step '" + context.getStepId() + "' cancelled", e);
        } catch (ExecutionException e) {
            throw translate(context, e.getCause());
        }
    }

    private static StepFailureException translate(StepContext context, Throwable cause) {
        if (cause instanceof StepFailureException) {
            return (StepFailureException) cause;
        }
        if (cause instanceof TemplateResolutionException) {
            return new StepFailureException(StepErrorKind.TEMPLATE_RESOLUTION_FAILED, cause.getMessage(), cause);
        }
        if (cause instanceof InterruptedException) {
            return new StepFailureException(StepErrorKind.CANCELLED,
                    "Step '" + context.getStepId() + "' interrupted", cause);
        }
        logger.log(Level.WARNING, "Handler for step " + context.getStepId() + " threw " + cause);
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Handler exception details for step " + context.getStepId(), cause);
        }
        return new StepFailureException(StepErrorKind.TOOL_INVOCATION_FAILED,
                cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause), cause);
    }

    private static boolean sleep(Duration delay, CancellationToken token) {
        long until = System.nanoTime() + delay.toNanos();
        try {
            while (!token.isCancelled()) {
                long remaining = until - System.nanoTime();
                if (remaining <= 0) {
                    return true;
                }
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_MILLIS)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private StepResult succeeded(StepDefinition step, Instant startedAt, StepOutcome outcome, int attempt) {
        return StepResult.builder(step.getId())
                .kind(step.getKind())
                .status(StepStatus.SUCCEEDED)
                .startedAt(startedAt)
                .endedAt(Instant.now())
                .rawOutput(outcome.getPrimary())
                .outputs(bindings(step, outcome))
                .retryCount(attempt)
                .tokensUsed(tokens(outcome))
                .children(outcome.getChildren())
                .build();
    }

    private static StepResult failed(StepDefinition step, Instant startedAt, StepErrorKind kind, String message,
                                     int retries, List<StepResult> children) {
        return StepResult.builder(step.getId())
                .kind(step.getKind())
                .status(StepStatus.FAILED)
                .startedAt(startedAt)
                .endedAt(Instant.now())
                .error(new StepError(kind, message))
                .retryCount(retries)
                .tokensUsed(children.stream().mapToLong(StepResult::getTokensUsed).sum())
                .children(children)
                .build();
    }

    /**
     * Computes what the step writes back: exports first, then each declared output. The
     * first declared output receives the primary result when the handler emitted no
     * value under that name.
     */
    static Map<String, Object> bindings(StepDefinition step, StepOutcome outcome) {
        Map<String, Object> bindings = new LinkedHashMap<>(outcome.getExports());
        List<String> declared = step.getOutputs();
        for (int i = 0; i < declared.size(); i++) {
            String name = declared.get(i);
            if (outcome.getOutputs().containsKey(name)) {
                bindings.put(name, outcome.getOutputs().get(name));
            } else if (i == 0 && outcome.getPrimary() != null) {
                bindings.put(name, outcome.getPrimary());
            } else {
                logger.fine("Step " + step.getId() + " declared output '" + name + "' but produced no value for it");
            }
        }
        return bindings;
    }

    private static long tokens(StepOutcome outcome) {
        if (outcome.getTokensUsed() > 0) {
            return outcome.getTokensUsed();
        }
        Object reported = outcome.getOutputs().get("tokens_used");
        return reported instanceof Number ? ((Number) reported).longValue() : 0;
    }
}
