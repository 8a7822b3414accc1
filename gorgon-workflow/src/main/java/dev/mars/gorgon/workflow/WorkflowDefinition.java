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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Immutable workflow definition as loaded from YAML or built in code.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public final class WorkflowDefinition {

    private final String id;
    private final String name;
    private final String description;
    private final String version;
    private final Map<String, Object> variables;
    private final Map<String, InputSpec> inputs;
    private final List<String> outputs;
    private final Long tokenBudget;
    private final Duration timeout;
    private final Integer maxConcurrency;
    private final List<StepDefinition> steps;

    private WorkflowDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Workflow ID cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description;
        this.version = builder.version != null ? builder.version : "1.0";
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputs));
        this.outputs = List.copyOf(builder.outputs);
        this.tokenBudget = builder.tokenBudget;
        this.timeout = builder.timeout;
        this.maxConcurrency = builder.maxConcurrency;
        this.steps = List.copyOf(builder.steps);
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public String getVersion() {
        return version;
    }

    /**
     * Gets the initial variable bindings. Values may be null.
     */
    public Map<String, Object> getVariables() {
        return variables;
    }

    public Map<String, InputSpec> getInputs() {
        return inputs;
    }

    /**
     * Gets the context variable names copied into the execution result's outputs.
     */
    public List<String> getOutputs() {
        return outputs;
    }

    public OptionalLong getTokenBudget() {
        return tokenBudget != null ? OptionalLong.of(tokenBudget) : OptionalLong.empty();
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public OptionalInt getMaxConcurrency() {
        return maxConcurrency != null ? OptionalInt.of(maxConcurrency) : OptionalInt.empty();
    }

    public List<StepDefinition> getSteps() {
        return steps;
    }

    public Optional<StepDefinition> getStep(String stepId) {
        return steps.stream().filter(step -> step.getId().equals(stepId)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return id.equals(that.id) &&
               name.equals(that.name) &&
               version.equals(that.version) &&
               Objects.equals(description, that.description) &&
               variables.equals(that.variables) &&
               inputs.equals(that.inputs) &&
               outputs.equals(that.outputs) &&
               Objects.equals(tokenBudget, that.tokenBudget) &&
               Objects.equals(timeout, that.timeout) &&
               Objects.equals(maxConcurrency, that.maxConcurrency) &&
               steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, version, steps);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", version='" + version + '\'' +
               ", steps=" + steps.size() +
               '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private String version;
        private final Map<String, Object> variables = new LinkedHashMap<>();
        private final Map<String, InputSpec> inputs = new LinkedHashMap<>();
        private final List<String> outputs = new ArrayList<>();
        private Long tokenBudget;
        private Duration timeout;
        private Integer maxConcurrency;
        private final List<StepDefinition> steps = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder variable(String name, Object value) {
            this.variables.put(name, value);
            return this;
        }

        public Builder variables(Map<String, ?> variables) {
            if (variables != null) {
                this.variables.putAll(variables);
            }
            return this;
        }

        public Builder input(InputSpec input) {
            this.inputs.put(input.getName(), input);
            return this;
        }

        public Builder output(String name) {
            this.outputs.add(name);
            return this;
        }

        public Builder outputs(List<String> names) {
            if (names != null) {
                this.outputs.addAll(names);
            }
            return this;
        }

        public Builder tokenBudget(Long tokenBudget) {
            this.tokenBudget = tokenBudget;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxConcurrency(Integer maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder step(StepDefinition step) {
            this.steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder steps(List<StepDefinition> steps) {
            if (steps != null) {
                steps.forEach(this::step);
            }
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
