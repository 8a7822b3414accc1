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
import dev.mars.gorgon.workflow.engine.CancellationToken;
import dev.mars.gorgon.workflow.engine.StepResult;

import java.util.List;
import java.util.Map;

/**
 * Lets group handlers re-enter the scheduler for their nested steps.
 */
public interface NestedExecutor {

    /**
     * Builds and runs a nested graph against its own copy of {@code variables}.
     *
     * @param maxWorkers ceiling on concurrently running nested steps
     * @param failFast when true, the first failure skips nested steps not yet started
     */
    SubGraphResult runGraph(String parentId, List<StepDefinition> steps, Map<String, Object> variables,
                            int maxWorkers, boolean failFast, CancellationToken token)
            throws GraphException, InterruptedException;

    /**
     * Runs independent step instances, each against its own variables. Results are
     * returned in instance order regardless of completion order; instances skipped
     * by {@code failFast} are reported as skipped.
     */
    List<StepResult> runInstances(List<StepInstance> instances, int maxConcurrent, boolean failFast,
                                  CancellationToken token) throws InterruptedException;
}
