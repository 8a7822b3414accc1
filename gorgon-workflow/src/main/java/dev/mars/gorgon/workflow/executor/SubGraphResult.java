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

import dev.mars.gorgon.workflow.engine.StepResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of running a nested step graph on behalf of a group step.
 */
public final class SubGraphResult {

    private final List<StepResult> results;
    private final Map<String, Object> bindings;
    private final boolean failed;
    private final String failureMessage;

    public SubGraphResult(List<StepResult> results, Map<String, Object> bindings,
                          boolean failed, String failureMessage) {
        this.results = List.copyOf(results);
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.failed = failed;
        this.failureMessage = failureMessage;
    }

    /**
     * Gets the nested step results in declaration order.
     */
    public List<StepResult> getResults() {
        return results;
    }

    /**
     * Gets the bindings the nested steps merged, in merge order.
     */
    public Map<String, Object> getBindings() {
        return bindings;
    }

    public boolean isFailed() {
        return failed;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public long getTokensUsed() {
        return results.stream().mapToLong(StepResult::getTokensUsed).sum();
    }
}
