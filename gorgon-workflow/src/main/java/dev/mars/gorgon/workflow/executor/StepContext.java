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

import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.engine.CancellationToken;
import dev.mars.gorgon.workflow.engine.StepErrorKind;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a handler sees for one step attempt.
 */
public final class StepContext {

    private final String executionId;
    private final String workflowId;
    private final StepDefinition step;
    private final Map<String, Object> params;
    private final Map<String, Object> variables;
    private final Duration timeout;
    private final int attempt;
    private final CancellationToken cancellationToken;
    private final NestedExecutor nestedExecutor;
    private final StepExecutorRegistry registry;

    private StepContext(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.workflowId = Objects.requireNonNull(builder.workflowId, "Workflow ID cannot be null");
        this.step = Objects.requireNonNull(builder.step, "Step cannot be null");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.timeout = Objects.requireNonNull(builder.timeout, "Timeout cannot be null");
        this.attempt = builder.attempt;
        this.cancellationToken = builder.cancellationToken != null ? builder.cancellationToken : new CancellationToken();
        this.nestedExecutor = builder.nestedExecutor;
        this.registry = builder.registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .executionId(executionId)
                .workflowId(workflowId)
                .step(step)
                .params(params)
                .variables(variables)
                .timeout(timeout)
                .attempt(attempt)
                .cancellationToken(cancellationToken)
                .nestedExecutor(nestedExecutor)
                .registry(registry);
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public StepDefinition getStep() {
        return step;
    }

    public String getStepId() {
        return step.getId();
    }

    /**
     * Gets the step's parameters with every variable reference resolved.
     */
    public Map<String, Object> getParams() {
        return params;
    }

    /**
     * Gets a read-only snapshot of the variable context taken before the step's layer ran.
     */
    public Map<String, Object> getVariables() {
        return variables;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Zero-based attempt number.
     */
    public int getAttempt() {
        return attempt;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public Optional<NestedExecutor> getNestedExecutor() {
        return Optional.ofNullable(nestedExecutor);
    }

    public Optional<StepExecutorRegistry> getRegistry() {
        return Optional.ofNullable(registry);
    }

    public String getString(String name) {
        Object value = params.get(name);
        return value != null ? value.toString() : null;
    }

    public String getString(String name, String defaultValue) {
        String value = getString(name);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets a required string parameter.
     *
     * @throws StepFailureException with INVALID_PARAMETERS if absent or blank
     */
    public String requireString(String name) {
        String value = getString(name);
        if (value == null || value.isBlank()) {
            throw new StepFailureException(StepErrorKind.INVALID_PARAMETERS,
                    "Step '" + step.getId() + "' requires parameter '" + name + "'");
        }
        return value;
    }

    public int getInt(String name, int defaultValue) {
        Object value = params.get(name);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new StepFailureException(StepErrorKind.INVALID_PARAMETERS,
                        "Parameter '" + name + "' of step '" + step.getId() + "' must be an integer: " + value, e);
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = params.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null ? Boolean.parseBoolean(value.toString().trim()) : defaultValue;
    }

    public static class Builder {
        private String executionId;
        private String workflowId;
        private StepDefinition step;
        private Map<String, Object> params = Map.of();
        private Map<String, Object> variables = Map.of();
        private Duration timeout = Duration.ofMinutes(5);
        private int attempt;
        private CancellationToken cancellationToken;
        private NestedExecutor nestedExecutor;
        private StepExecutorRegistry registry;

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder step(StepDefinition step) {
            this.step = step;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params != null ? params : Map.of();
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = variables != null ? variables : Map.of();
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public Builder nestedExecutor(NestedExecutor nestedExecutor) {
            this.nestedExecutor = nestedExecutor;
            return this;
        }

        public Builder registry(StepExecutorRegistry registry) {
            this.registry = registry;
            return this;
        }

        public StepContext build() {
            return new StepContext(this);
        }
    }
}
