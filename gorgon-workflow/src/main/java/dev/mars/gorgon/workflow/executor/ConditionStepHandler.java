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

import dev.mars.gorgon.workflow.ConditionSpec;
import dev.mars.gorgon.workflow.engine.StepErrorKind;

/**
 * Handler for {@code condition} steps. Evaluates the {@code field}/{@code operator}/{@code value}
 * predicate and reports the selected branch; the scheduler bypasses the other one.
 */
public class ConditionStepHandler implements StepHandler {

    @Override
    public StepOutcome execute(StepContext context) {
        ConditionSpec condition;
        boolean result;
        try {
            condition = ConditionSpec.fromMap(context.getParams());
            result = condition.evaluate(context.getVariables());
        } catch (IllegalArgumentException e) {
            throw new StepFailureException(StepErrorKind.CONDITION_FAILED,
                    "Condition of step '" + context.getStepId() + "' could not be evaluated: " + e.getMessage(), e);
        }
        String selected = result
                ? context.getStep().getTrueStep().orElse(null)
                : context.getStep().getFalseStep().orElse(null);
        return StepOutcome.builder()
                .primary(result)
                .output("result", result)
                .output("selected_step", selected)
                .build();
    }
}
