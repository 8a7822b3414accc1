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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Enumeration of workflow execution statuses.
 */
public enum WorkflowStatus {

    /**
     * Accepted but not yet scheduled.
     */
    PENDING,

    /**
     * Layers are being dispatched.
     */
    RUNNING,

    /**
     * Every layer ran without an aborting failure.
     */
    COMPLETED,

    /**
     * Halted by a failure policy, a workflow-level limit or cancellation.
     */
    FAILED,

    /**
     * Halted at a checkpoint; can be resumed.
     */
    PAUSED;

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Checks if the status represents an active state.
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
