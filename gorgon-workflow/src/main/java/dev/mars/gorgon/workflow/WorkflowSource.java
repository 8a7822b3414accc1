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

import java.util.List;

/**
 * Read-only access to stored workflow definitions.
 */
public interface WorkflowSource {

    /**
     * Loads a workflow definition by id.
     *
     * @throws WorkflowSourceException if no such workflow exists or it cannot be read
     */
    WorkflowDefinition load(String workflowId) throws WorkflowSourceException;

    /**
     * Lists the ids of the workflows this source can load.
     */
    List<String> listWorkflowIds() throws WorkflowSourceException;
}
