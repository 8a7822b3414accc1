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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow source backed by a map, for tests and embedded use.
 */
public class InMemoryWorkflowSource implements WorkflowSource {

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    public InMemoryWorkflowSource register(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        definitions.put(definition.getId(), definition);
        return this;
    }

    @Override
    public WorkflowDefinition load(String workflowId) throws WorkflowSourceException {
        WorkflowDefinition definition = definitions.get(workflowId);
        if (definition == null) {
            throw new WorkflowSourceException(workflowId, "Workflow not found: " + workflowId);
        }
        return definition;
    }

    @Override
    public List<String> listWorkflowIds() {
        List<String> ids = new ArrayList<>(definitions.keySet());
        ids.sort(String::compareTo);
        return ids;
    }
}
