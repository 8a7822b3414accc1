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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable definition of a single workflow step.
 * <p>
 * Parameter values are raw: strings may hold {@code ${name}} or {@code {{name}}} references
 * that are resolved against the variable context when the step runs. Group kinds carry
 * their nested definitions in {@link #getSteps()} (parallel) or {@link #getTemplate()}
 * (fan-out and map-reduce).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public final class StepDefinition {

    private final String id;
    private final StepKind kind;
    private final Map<String, Object> params;
    private final List<String> dependsOn;
    private final String nextStep;
    private final FailurePolicy onFailure;
    private final int maxRetries;
    private final Duration timeout;
    private final List<String> outputs;
    private final Set<String> optionalVariables;
    private final ConditionSpec condition;
    private final String provider;
    private final List<StepDefinition> steps;
    private final StepDefinition template;

    private StepDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Step ID cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Step ID cannot be blank");
        }
        this.kind = Objects.requireNonNull(builder.kind, "Step kind cannot be null");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.dependsOn = List.copyOf(builder.dependsOn);
        this.nextStep = builder.nextStep;
        this.onFailure = builder.onFailure != null ? builder.onFailure : FailurePolicy.ABORT;
        this.maxRetries = Math.max(0, builder.maxRetries);
        this.timeout = builder.timeout;
        this.outputs = List.copyOf(builder.outputs);
        this.optionalVariables = Set.copyOf(builder.optionalVariables);
        this.condition = builder.condition;
        this.provider = builder.provider;
        this.steps = List.copyOf(builder.steps);
        this.template = builder.template;
    }

    public static Builder builder(String id, StepKind kind) {
        return new Builder().id(id).kind(kind);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String getId() {
        return id;
    }

    public StepKind getKind() {
        return kind;
    }

    /**
     * Gets the raw, unresolved parameters. Map values preserve YAML structure.
     */
    public Map<String, Object> getParams() {
        return params;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public Optional<String> getNextStep() {
        return Optional.ofNullable(nextStep);
    }

    public FailurePolicy getOnFailure() {
        return onFailure;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * Gets the declared output variable names. The first name receives the step's primary
     * result when the executor does not emit a value under that name.
     */
    public List<String> getOutputs() {
        return outputs;
    }

    public Set<String> getOptionalVariables() {
        return optionalVariables;
    }

    /**
     * Gets the guard evaluated before the step runs; a false guard skips the step.
     */
    public Optional<ConditionSpec> getCondition() {
        return Optional.ofNullable(condition);
    }

    public Optional<String> getProvider() {
        return Optional.ofNullable(provider);
    }

    public List<StepDefinition> getSteps() {
        return steps;
    }

    public Optional<StepDefinition> getTemplate() {
        return Optional.ofNullable(template);
    }

    /**
     * Branch target taken when a condition step evaluates to true.
     */
    public Optional<String> getTrueStep() {
        return stringParam("true_step");
    }

    /**
     * Branch target taken when a condition step evaluates to false.
     */
    public Optional<String> getFalseStep() {
        return stringParam("false_step");
    }

    private Optional<String> stringParam(String name) {
        if (kind != StepKind.CONDITION) {
            return Optional.empty();
        }
        Object value = params.get(name);
        return value == null || value.toString().isBlank() ? Optional.empty() : Optional.of(value.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepDefinition that = (StepDefinition) o;
        return maxRetries == that.maxRetries &&
               id.equals(that.id) &&
               kind == that.kind &&
               params.equals(that.params) &&
               dependsOn.equals(that.dependsOn) &&
               Objects.equals(nextStep, that.nextStep) &&
               onFailure == that.onFailure &&
               Objects.equals(timeout, that.timeout) &&
               outputs.equals(that.outputs) &&
               optionalVariables.equals(that.optionalVariables) &&
               Objects.equals(condition, that.condition) &&
               Objects.equals(provider, that.provider) &&
               steps.equals(that.steps) &&
               Objects.equals(template, that.template);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, params, dependsOn, nextStep, onFailure, maxRetries, timeout, outputs);
    }

    @Override
    public String toString() {
        return "StepDefinition{" +
               "id='" + id + '\'' +
               ", kind=" + kind.getValue() +
               ", dependsOn=" + dependsOn +
               (nextStep != null ? ", nextStep='" + nextStep + '\'' : "") +
               ", onFailure=" + onFailure.getValue() +
               '}';
    }

    public static class Builder {
        private String id;
        private StepKind kind;
        private final Map<String, Object> params = new LinkedHashMap<>();
        private final List<String> dependsOn = new ArrayList<>();
        private String nextStep;
        private FailurePolicy onFailure = FailurePolicy.ABORT;
        private int maxRetries;
        private Duration timeout;
        private final List<String> outputs = new ArrayList<>();
        private final Set<String> optionalVariables = new LinkedHashSet<>();
        private ConditionSpec condition;
        private String provider;
        private final List<StepDefinition> steps = new ArrayList<>();
        private StepDefinition template;

        public Builder() {
        }

        private Builder(StepDefinition existing) {
            this.id = existing.id;
            this.kind = existing.kind;
            this.params.putAll(existing.params);
            this.dependsOn.addAll(existing.dependsOn);
            this.nextStep = existing.nextStep;
            this.onFailure = existing.onFailure;
            this.maxRetries = existing.maxRetries;
            this.timeout = existing.timeout;
            this.outputs.addAll(existing.outputs);
            this.optionalVariables.addAll(existing.optionalVariables);
            this.condition = existing.condition;
            this.provider = existing.provider;
            this.steps.addAll(existing.steps);
            this.template = existing.template;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(StepKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder param(String name, Object value) {
            this.params.put(name, value);
            return this;
        }

        public Builder params(Map<String, ?> params) {
            if (params != null) {
                this.params.putAll(params);
            }
            return this;
        }

        public Builder dependsOn(String... ids) {
            this.dependsOn.addAll(List.of(ids));
            return this;
        }

        public Builder dependsOn(List<String> ids) {
            if (ids != null) {
                this.dependsOn.addAll(ids);
            }
            return this;
        }

        /**
         * Drops {@code depends_on} and {@code next_step}, e.g. when stamping out fan-out instances.
         */
        public Builder clearDependencies() {
            this.dependsOn.clear();
            this.nextStep = null;
            return this;
        }

        public Builder nextStep(String nextStep) {
            this.nextStep = nextStep;
            return this;
        }

        public Builder onFailure(FailurePolicy onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder outputs(String... names) {
            this.outputs.addAll(List.of(names));
            return this;
        }

        public Builder outputs(List<String> names) {
            if (names != null) {
                this.outputs.addAll(names);
            }
            return this;
        }

        public Builder optionalVariables(String... names) {
            this.optionalVariables.addAll(List.of(names));
            return this;
        }

        public Builder optionalVariables(Set<String> names) {
            if (names != null) {
                this.optionalVariables.addAll(names);
            }
            return this;
        }

        public Builder condition(ConditionSpec condition) {
            this.condition = condition;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder step(StepDefinition step) {
            this.steps.add(Objects.requireNonNull(step, "Nested step cannot be null"));
            return this;
        }

        public Builder steps(List<StepDefinition> steps) {
            if (steps != null) {
                steps.forEach(this::step);
            }
            return this;
        }

        public Builder template(StepDefinition template) {
            this.template = template;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(this);
        }
    }
}
