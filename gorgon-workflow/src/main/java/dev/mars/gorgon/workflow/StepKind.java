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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The kinds of step a workflow can contain. Each kind is dispatched to one handler
 * registered in the step executor registry.
 */
public enum StepKind {

    TOOL_CALL("tool_call"),
    SHELL("shell"),
    CONDITION("condition"),
    PARALLEL("parallel"),
    FAN_OUT("fan_out"),
    FAN_IN("fan_in"),
    MAP_REDUCE("map_reduce"),
    CHECKPOINT("checkpoint");

    private final String value;

    StepKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether steps of this kind carry nested step definitions.
     */
    public boolean isGroup() {
        return this == PARALLEL || this == FAN_OUT || this == MAP_REDUCE;
    }

    /**
     * Resolves a kind from its YAML name. Provider-named tool steps such as
     * {@code openai} or {@code claude_code} map to {@link #TOOL_CALL}.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static StepKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Step type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (StepKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        if (defaultProviderFor(normalized) != null) {
            return TOOL_CALL;
        }
        throw new IllegalArgumentException("Unknown step type: " + value);
    }

    /**
     * Gets the provider implied by a provider-named step type, or null.
     */
    public static String defaultProviderFor(String type) {
        if (type == null) {
            return null;
        }
        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "claude_code":
            case "anthropic":
                return "anthropic";
            case "openai":
                return "openai";
            case "gemini":
                return "gemini";
            default:
                return null;
        }
    }
}
