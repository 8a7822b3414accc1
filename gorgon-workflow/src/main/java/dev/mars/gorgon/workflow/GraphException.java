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

package dev.mars.gorgon.workflow;

import dev.mars.gorgon.core.exceptions.GorgonException;

import java.util.List;

/**
 * Thrown when a step list cannot be turned into a valid dependency graph.
 * No partially built graph is ever returned alongside this exception.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class GraphException extends GorgonException {

    public enum Kind {
        CYCLE_DETECTED,
        UNKNOWN_DEPENDENCY,
        DUPLICATE_ID,
        MISPLACED_CHECKPOINT
    }

    private final Kind kind;
    private final List<String> stepIds;

    public GraphException(Kind kind, String message, List<String> stepIds) {
        super(message);
        this.kind = kind;
        this.stepIds = stepIds != null ? List.copyOf(stepIds) : List.of();
    }

    public static GraphException cycle(List<String> path) {
        return new GraphException(Kind.CYCLE_DETECTED,
                "Circular dependency detected: " + String.join(" -> ", path), path);
    }

    public static GraphException unknownDependency(String stepId, String missing) {
        return new GraphException(Kind.UNKNOWN_DEPENDENCY,
                "Step '" + stepId + "' references unknown step '" + missing + "'", List.of(stepId, missing));
    }

    public static GraphException duplicateId(String stepId) {
        return new GraphException(Kind.DUPLICATE_ID,
                "Duplicate step id '" + stepId + "'", List.of(stepId));
    }

    public static GraphException misplacedCheckpoint(String parentId, String stepId) {
        return new GraphException(Kind.MISPLACED_CHECKPOINT,
                "Checkpoint step '" + stepId + "' is nested in '" + parentId
                        + "'; checkpoints are only allowed at the top level", List.of(parentId, stepId));
    }

    /**
     * Wraps a failure found in the nested steps of a group step.
     */
    public static GraphException nested(String parentId, GraphException cause) {
        GraphException wrapped = new GraphException(cause.kind,
                "In nested steps of '" + parentId + "': " + cause.getMessage(), cause.stepIds);
        wrapped.initCause(cause);
        return wrapped;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets the ids involved. For a cycle this is the cycle path, first id repeated at the end.
     */
    public List<String> getStepIds() {
        return stepIds;
    }
}
