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
 * Validated, layered dependency graph of the steps of one workflow (or one nested group).
 * <p>
 * Instances are produced only by {@link DependencyGraphBuilder} and are immutable. Layer 0
 * holds the steps with no dependencies; every dependency of a step in layer N lies in a
 * layer below N. Steps inside a layer keep their declaration order.
 */
public final class DependencyGraph {

    private final String workflowId;
    private final List<StepDefinition> steps;
    private final Map<String, StepDefinition> stepsById;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;
    private final List<List<StepDefinition>> layers;
    private final Map<String, Integer> layerIndex;
    private final Map<String, Integer> declarationIndex;

    DependencyGraph(String workflowId, List<StepDefinition> steps, Map<String, Set<String>> dependencies,
                    List<List<StepDefinition>> layers) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.steps = List.copyOf(steps);

        Map<String, StepDefinition> byId = new LinkedHashMap<>();
        Map<String, Integer> declaration = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            byId.put(steps.get(i).getId(), steps.get(i));
            declaration.put(steps.get(i).getId(), i);
        }
        this.stepsById = Collections.unmodifiableMap(byId);
        this.declarationIndex = Collections.unmodifiableMap(declaration);

        Map<String, Set<String>> deps = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        for (StepDefinition step : steps) {
            reverse.put(step.getId(), new LinkedHashSet<>());
        }
        for (StepDefinition step : steps) {
            Set<String> stepDeps = dependencies.getOrDefault(step.getId(), Set.of());
            deps.put(step.getId(), Collections.unmodifiableSet(new LinkedHashSet<>(stepDeps)));
            for (String dependency : stepDeps) {
                reverse.get(dependency).add(step.getId());
            }
        }
        reverse.replaceAll((id, set) -> Collections.unmodifiableSet(set));
        this.dependencies = Collections.unmodifiableMap(deps);
        this.dependents = Collections.unmodifiableMap(reverse);

        List<List<StepDefinition>> frozen = new ArrayList<>();
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < layers.size(); i++) {
            frozen.add(List.copyOf(layers.get(i)));
            for (StepDefinition step : layers.get(i)) {
                index.put(step.getId(), i);
            }
        }
        this.layers = List.copyOf(frozen);
        this.layerIndex = Collections.unmodifiableMap(index);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    /**
     * Gets all steps in declaration order.
     */
    public List<StepDefinition> getSteps() {
        return steps;
    }

    public Optional<StepDefinition> getStep(String stepId) {
        return Optional.ofNullable(stepsById.get(stepId));
    }

    public boolean contains(String stepId) {
        return stepsById.containsKey(stepId);
    }

    public int size() {
        return steps.size();
    }

    /**
     * Gets the normalized dependencies of a step: explicit {@code depends_on}, the step whose
     * {@code next_step} names it, and the condition step whose branch targets it.
     */
    public Set<String> getDependencies(String stepId) {
        return dependencies.getOrDefault(stepId, Set.of());
    }

    public Set<String> getDependents(String stepId) {
        return dependents.getOrDefault(stepId, Set.of());
    }

    public List<List<StepDefinition>> getLayers() {
        return layers;
    }

    public int getLayerIndex(String stepId) {
        Integer index = layerIndex.get(stepId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        return index;
    }

    public int getDeclarationIndex(String stepId) {
        Integer index = declarationIndex.get(stepId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        return index;
    }

    /**
     * Gets the ids of steps not in {@code completed}, in layer order.
     */
    public List<String> frontier(Set<String> completed) {
        List<String> remaining = new ArrayList<>();
        for (List<StepDefinition> layer : layers) {
            for (StepDefinition step : layer) {
                if (!completed.contains(step.getId())) {
                    remaining.add(step.getId());
                }
            }
        }
        return remaining;
    }

    @Override
    public String toString() {
        List<List<String>> layerIds = new ArrayList<>();
        for (List<StepDefinition> layer : layers) {
            List<String> ids = new ArrayList<>();
            layer.forEach(step -> ids.add(step.getId()));
            layerIds.add(ids);
        }
        return "DependencyGraph{" +
               "workflowId='" + workflowId + '\'' +
               ", layers=" + layerIds +
               '}';
    }
}
