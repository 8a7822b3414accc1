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

/**
 * Handler for {@code checkpoint} steps. It does no work itself; the scheduler saves the run
 * and pauses once the layer holding a succeeded checkpoint step has finished. Checkpoint
 * steps are only accepted at the top level of a workflow.
 */
public class CheckpointStepHandler implements StepHandler {

    @Override
    public StepOutcome execute(StepContext context) {
        return StepOutcome.builder()
                .primary(context.getStepId())
                .output("checkpoint", context.getStepId())
                .build();
    }
}
