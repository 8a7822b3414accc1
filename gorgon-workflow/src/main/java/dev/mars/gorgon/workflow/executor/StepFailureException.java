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
import dev.mars.gorgon.workflow.engine.StepResult;

import java.util.List;
import java.util.Objects;

/**
 * Raised by step handlers and invokers when a step attempt fails. The step runner turns it
 * into a failed step result and applies the step's failure policy.
 */
public class StepFailureException extends RuntimeException {

    private final StepErrorKind kind;
    private final List<StepResult> children;

    public StepFailureException(StepErrorKind kind, String message) {
        this(kind, message, List.of());
    }

    /**
     * Creates a failure for a group step, keeping the results of its nested steps.
     */
    public StepFailureException(StepErrorKind kind, String message, List<StepResult> children) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.children = List.copyOf(children);
    }

    public StepFailureException(StepErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.children = List.of();
    }

    public StepErrorKind getKind() {
        return kind;
    }

    public List<StepResult> getChildren() {
        return children;
    }
}
