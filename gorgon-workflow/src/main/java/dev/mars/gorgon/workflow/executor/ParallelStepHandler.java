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

package dev.mars.gorgon.workflow.executor;

import dev.mars.gorgon.workflow.GraphException;
import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.engine.StepErrorKind;
import dev.mars.gorgon.workflow.engine.StepResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Handler for {@code parallel} steps: runs the nested steps as their own graph.
 * <p>
 * Parameters: {@code max_workers} (default 4), {@code fail_fast} (default false) and
 * {@code strategy} ({@code threading}, {@code asyncio} or {@code process}). The strategy is
 * a scheduling hint only; every strategy runs on the engine's worker pool.
 * The nested steps' bindings are exported to the enclosing context.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-07
 * @version 1.0
 */
public class ParallelStepHandler implements StepHandler {

    private static final Logger logger = Logger.getLogger(ParallelStepHandler.class.getName());

    static final int DEFAULT_MAX_WORKERS = 4;

    @Override
    public StepOutcome execute(StepContext context) throws InterruptedException {
        List<StepDefinition> steps = context.getStep().getSteps();
        if (steps.isEmpty()) {
            throw new StepFailureException(StepErrorKind.INVALID_PARAMETERS,
                    "Parallel step '" + context.getStepId() + "' has no nested steps");
        }
        NestedExecutor nested = requireNested(context);
        int maxWorkers = Math.max(1, context.getInt("max_workers", DEFAULT_MAX_WORKERS));
        boolean failFast = context.getBoolean("fail_fast", false);
        logger.fine("Parallel step " + context.getStepId() + " running " + steps.size() + " steps, strategy="
                + context.getString("strategy", "threading") + ", maxWorkers=" + maxWorkers + ", failFast=" + failFast);

        SubGraphResult result;
        try {
            result = nested.runGraph(context.getStepId(), steps, context.getVariables(), maxWorkers, failFast,
                    context.getCancellationToken());
        } catch (GraphException e) {
            throw new StepFailureException(StepErrorKind.INVALID_PARAMETERS, e.getMessage(), e);
        }

        if (result.isFailed()) {
            throw new StepFailureException(StepErrorKind.TOOL_INVOCATION_FAILED,
                    "Parallel step '" + context.getStepId() + "' failed: " + result.getFailureMessage(),
                    result.getResults());
        }

        Map<String, Object> perStep = new LinkedHashMap<>();
        for (StepResult child : result.getResults()) {
            perStep.put(child.getStepId(), child.isSucceeded() ? child.getOutputs() : errorOf(child));
        }
        return StepOutcome.builder()
                .primary(perStep)
                .output("parallel_results", perStep)
                .exports(result.getBindings())
                .tokensUsed(result.getTokensUsed())
                .children(result.getResults())
                .build();
    }

    static NestedExecutor requireNested(StepContext context) {
        return context.getNestedExecutor().orElseThrow(() -> new StepFailureException(
                StepErrorKind.INVALID_PARAMETERS,
                "Step '" + context.getStepId() + "' needs nested execution, which is unavailable here"));
    }

    private static Map<String, Object> errorOf(StepResult child) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", child.getStatus().getValue());
        if (child.getError() != null) {
            error.put("error", child.getError().getMessage());
        }
        return error;
    }
}
