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
 * Executes one attempt of a step of a particular kind.
 * <p>
 * Handlers receive fully resolved parameters and a read-only snapshot of the variable
 * context. They never write to the context; the scheduler merges the returned outcome.
 * Implementations must be safe to call concurrently.
 */
@FunctionalInterface
public interface StepHandler {

    /**
     * Runs the step.
     *
     * @throws StepFailureException if the attempt failed
     * @throws InterruptedException if the attempt was interrupted by timeout or cancellation
     */
    StepOutcome execute(StepContext context) throws InterruptedException;
}
