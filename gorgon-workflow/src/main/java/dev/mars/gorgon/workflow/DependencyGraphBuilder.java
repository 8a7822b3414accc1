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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds a {@link DependencyGraph} from a list of step definitions.
 * <p>
 * Edges come from {@code depends_on}, from {@code next_step} (the successor depends on the
 * step naming it) and from condition branches (each branch target depends on the condition
 * step). Validation rejects duplicate ids, references to unknown steps and cycles; nested
 * group steps are validated recursively with the same rules and may not contain checkpoint
 * steps. Layers are computed with Kahn's algorithm.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class DependencyGraphBuilder {

    private static final Logger logger = Logger.getLogger(DependencyGraphBuilder.class.getName());

    private static final String ANONYMOUS_WORKFLOW = "anonymous";

    public DependencyGraph build(WorkflowDefinition definition) throws GraphException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        return build(definition.getId(), definition.getSteps());
    }

    public DependencyGraph build(List<StepDefinition> steps) throws GraphException {
        return build(ANONYMOUS_WORKFLOW, steps);
    }

    public DependencyGraph build(String workflowId, List<StepDefinition> steps) throws GraphException {
        Objects.requireNonNull(steps, "Steps cannot be null");

        Map<String, StepDefinition> byId = indexSteps(steps);
        Map<String, Set<String>> dependencies = normalizeDependencies(steps, byId);
        detectCycles(steps, dependencies);
        validateNested(steps);

        List<List<StepDefinition>> layers = computeLayers(steps, dependencies);
        DependencyGraph graph = new DependencyGraph(workflowId, steps, dependencies, layers);
        logger.fine("Built " + graph);
        return graph;
    }

    private Map<String, StepDefinition> indexSteps(List<StepDefinition> steps) throws GraphException {
        Map<String, StepDefinition> byId = new LinkedHashMap<>();
        for (StepDefinition step : steps) {
            if (byId.putIfAbsent(step.getId(), step) != null) {
                throw GraphException.duplicateId(step.getId());
            }
        }
        return byId;
    }

    private Map<String, Set<String>> normalizeDependencies(List<StepDefinition> steps,
                                                           Map<String, StepDefinition> byId) throws GraphException {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (StepDefinition step : steps) {
            dependencies.put(step.getId(), new LinkedHashSet<>());
        }
        for (StepDefinition step : steps) {
            for (String dependency : step.getDependsOn()) {
                requireKnown(byId, step.getId(), dependency);
                dependencies.get(step.getId()).add(dependency);
            }
            if (step.getNextStep().isPresent()) {
                String successor = step.getNextStep().get();
                requireKnown(byId, step.getId(), successor);
                dependencies.get(successor).add(step.getId());
            }
            for (String target : branchTargets(step)) {
                requireKnown(byId, step.getId(), target);
                dependencies.get(target).add(step.getId());
            }
        }
        return dependencies;
    }

    private static List<String> branchTargets(StepDefinition step) {
        List<String> targets = new ArrayList<>(2);
        step.getTrueStep().ifPresent(targets::add);
        step.getFalseStep().ifPresent(targets::add);
        return targets;
    }

    private static void requireKnown(Map<String, StepDefinition> byId, String stepId, String reference)
            throws GraphException {
        if (!byId.containsKey(reference)) {
            throw GraphException.unknownDependency(stepId, reference);
        }
    }

    // Depth-first search with an explicit path so the reported cycle names every step on it.
    private void detectCycles(List<StepDefinition> steps, Map<String, Set<String>> dependencies)
            throws GraphException {
        Set<String> visited = new HashSet<>();
        for (StepDefinition step : steps) {
            if (!visited.contains(step.getId())) {
                visit(step.getId(), dependencies, visited, new LinkedHashSet<>());
            }
        }
    }

    private void visit(String stepId, Map<String, Set<String>> dependencies, Set<String> visited,
                       LinkedHashSet<String> path) throws GraphException {
        path.add(stepId);
        for (String dependency : dependencies.get(stepId)) {
            if (path.contains(dependency)) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String onPath : path) {
                    if (onPath.equals(dependency)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(onPath);
                    }
                }
                cycle.add(dependency);
                throw GraphException.cycle(cycle);
            }
            if (!visited.contains(dependency)) {
                visit(dependency, dependencies, visited, path);
            }
        }
        path.remove(stepId);
        visited.add(stepId);
    }

    private void validateNested(List<StepDefinition> steps) throws GraphException {
        for (StepDefinition step : steps) {
            // A checkpoint can only pause the top-level scheduler.
            for (StepDefinition child : step.getSteps()) {
                if (child.getKind() == StepKind.CHECKPOINT) {
                    throw GraphException.misplacedCheckpoint(step.getId(), child.getId());
                }
            }
            if (step.getTemplate().isPresent() && step.getTemplate().get().getKind() == StepKind.CHECKPOINT) {
                throw GraphException.misplacedCheckpoint(step.getId(), step.getTemplate().get().getId());
            }
            try {
                if (!step.getSteps().isEmpty()) {
                    build(step.getId(), step.getSteps());
                }
                if (step.getTemplate().isPresent()) {
                    build(step.getId(), List.of(step.getTemplate().get()));
                }
            } catch (GraphException e) {
                throw GraphException.nested(step.getId(), e);
            }
        }
    }

    private List<List<StepDefinition>> computeLayers(List<StepDefinition> steps,
                                                     Map<String, Set<String>> dependencies) {
        Map<String, Integer> declaration = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            String id = steps.get(i).getId();
            declaration.put(id, i);
            inDegree.put(id, dependencies.get(id).size());
            dependents.put(id, new ArrayList<>());
        }
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                dependents.get(dependency).add(entry.getKey());
            }
        }

        Map<String, StepDefinition> byId = new HashMap<>();
        steps.forEach(step -> byId.put(step.getId(), step));

        List<List<StepDefinition>> layers = new ArrayList<>();
        Deque<String> ready = new ArrayDeque<>();
        for (StepDefinition step : steps) {
            if (inDegree.get(step.getId()) == 0) {
                ready.add(step.getId());
            }
        }
        while (!ready.isEmpty()) {
            List<String> current = new ArrayList<>(ready);
            ready.clear();
            current.sort(Comparator.comparing(declaration::get));

            List<StepDefinition> layer = new ArrayList<>();
            for (String id : current) {
                layer.add(byId.get(id));
                for (String dependent : dependents.get(id)) {
                    int remaining = inDegree.merge(dependent, -1, Integer::sum);
                    if (remaining == 0) {
                        ready.add(dependent);
                    }
                }
            }
            layers.add(layer);
        }
        return layers;
    }
}
