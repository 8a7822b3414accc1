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

/**
 * Classification of step failures. Failures are local to the step and handled by its
 * failure policy.
 */
public enum StepErrorKind {

    TIMEOUT(true),
    TOOL_INVOCATION_FAILED(true),
    TEMPLATE_RESOLUTION_FAILED(false),
    RATE_LIMITED(true),
    CANCELLED(false),
    CONDITION_FAILED(false),
    INVALID_PARAMETERS(false),
    UNKNOWN_STEP_KIND(false),
    /** Skip reason: the step's guard condition evaluated false. */
    CONDITION_NOT_MET(false),
    /** Skip reason: the step lies on a condition branch that was not selected. */
    BRANCH_NOT_TAKEN(false);

    private final boolean retryable;

    StepErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether another attempt can succeed where this one failed. Deterministic failures
     * such as a missing variable are not retried.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
