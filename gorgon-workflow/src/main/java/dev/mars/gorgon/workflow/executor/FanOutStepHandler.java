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

import dev.mars.gorgon.workflow.FailurePolicy;
import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.VariableResolver;
import dev.mars.gorgon.workflow.engine.StepErrorKind;
import dev.mars.gorgon.workflow.engine.StepResult;
import dev.mars.gorgon.workflow.engine.StepStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handler for {@code fan_out} steps: runs the step's template once per item of a list.
 * <p>
 * Parameters: {@code items} (a list, or the name of a context variable holding one),
 * {@code item_variable} (default {@code item}; the index is bound as
 * {@code <item_variable>_index}), {@code max_concurrent} (default 4) and {@code fail_fast}.
 * Instance {@code i} runs as step {@code <id>[i]}. The {@code results} output holds one
 * entry per item in input order; items whose instance did not succeed hold null.
 */
public class FanOutStepHandler implements StepHandler {

    static final int DEFAULT_MAX_CONCURRENT = 4;

    @Override
    public StepOutcome execute(StepContext context) throws InterruptedException {
        Scatter scatter = scatter(context);
        List<Object> results = scatter.values();
        return StepOutcome.builder()
                .primary(results)
                .output("results", results)
                .output("count", results.size())
                .output("failed", scatter.failedCount())
                .tokensUsed(scatter.tokensUsed())
                .children(scatter.instances)
                .build();
    }

    /**
     * Runs the template over every item and returns the instance results. Shared with
     * map-reduce for its map phase.
     */
    static Scatter scatter(StepContext context) throws InterruptedException {
        StepDefinition step = context.getStep();
        StepDefinition template = step.getTemplate().orElseThrow(() -> new StepFailureException(
                StepErrorKind.INVALID_PARAMETERS, "Step '" + step.getId() + "' requires a template"));
        List<?> items = resolveItems(context);
        String itemVariable = context.getString("item_variable", "item");
        int maxConcurrent = Math.max(1, context.getInt("max_concurrent", DEFAULT_MAX_CONCURRENT));
        boolean failFast = context.getBoolean("fail_fast", false);

        List<StepInstance> instances = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Map<String, Object> scope = new LinkedHashMap<>(context.getVariables());
            scope.put(itemVariable, items.get(i));
            scope.put(itemVariable + "_index", i);
            StepDefinition instance = template.toBuilder()
                    .id(step.getId() + "[" + i + "]")
                    .clearDependencies()
                    .build();
            instances.add(new StepInstance(instance, scope));
        }

        List<StepResult> results = items.isEmpty()
                ? List.of()
                : ParallelStepHandler.requireNested(context)
                        .runInstances(instances, maxConcurrent, failFast, context.getCancellationToken());
        Scatter scatter = new Scatter(results);
        if (scatter.failedCount() > 0 && (failFast || template.getOnFailure() != FailurePolicy.SKIP)) {
            throw new StepFailureException(StepErrorKind.TOOL_INVOCATION_FAILED,
                    scatter.failedCount() + " of " + results.size() + " items of step '" + step.getId() + "' failed",
                    results);
        }
        return scatter;
    }

    private static List<?> resolveItems(StepContext context) {
        Object items = context.getParams().get("items");
        if (items instanceof String) {
            Optional<Object> bound = VariableResolver.lookup(context.getVariables(), ((String) items).trim());
            items = bound.orElse(null);
        }
        if (!(items instanceof List)) {
            throw new StepFailureException(StepErrorKind.INVALID_PARAMETERS,
                    "Step '" + context.getStepId() + "' requires 'items' to be a list or the name of a list variable");
        }
        return (List<?>) items;
    }

    /**
     * Gets the value an instance contributes to the ordered results list.
     */
    static Object valueOf(StepResult instance) {
        if (instance.getStatus() != StepStatus.SUCCEEDED) {
            return null;
        }
        if (instance.getRawOutput() != null) {
            return instance.getRawOutput();
        }
        return instance.getOutputs().isEmpty() ? null : instance.getOutputs();
    }

    static final class Scatter {
        final List<StepResult> instances;

        Scatter(List<StepResult> instances) {
            this.instances = instances;
        }

        List<Object> values() {
            List<Object> values = new ArrayList<>(instances.size());
            instances.forEach(instance -> values.add(valueOf(instance)));
            return values;
        }

        long failedCount() {
            return instances.stream().filter(r -> r.getStatus() == StepStatus.FAILED).count();
        }

        long tokensUsed() {
            return instances.stream().mapToLong(StepResult::getTokensUsed).sum();
        }
    }
}
