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

import dev.mars.gorgon.workflow.engine.StepErrorKind;

import java.util.Objects;

/**
 * Handler for {@code shell} steps.
 */
public class ShellStepHandler implements StepHandler {

    private final StepInvoker invoker;

    public ShellStepHandler(StepInvoker invoker) {
        this.invoker = Objects.requireNonNull(invoker, "Invoker cannot be null");
    }

    @Override
    public StepOutcome execute(StepContext context) throws InterruptedException {
        InvocationResult result = invoker.invoke(Invocation.from(context, null));
        if (!result.isSuccessful()) {
            throw new StepFailureException(StepErrorKind.TOOL_INVOCATION_FAILED,
                    result.getError().orElse("Command failed"));
        }
        return StepOutcome.builder()
                .primary(result.getRaw())
                .outputs(result.getOutputs())
                .tokensUsed(result.getTokensUsed())
                .build();
    }
}
