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

/**
 * Exception thrown when a workflow definition cannot be parsed or is structurally invalid.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class WorkflowParseException extends GorgonException {

    private final String workflowId;
    private final String fieldPath;

    public WorkflowParseException(String message) {
        this(null, null, message, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public WorkflowParseException(String fieldPath, String message) {
        this(null, fieldPath, message, null);
    }

    public WorkflowParseException(String fieldPath, String message, Throwable cause) {
        this(null, fieldPath, message, cause);
    }

    public WorkflowParseException(String workflowId, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
        this.fieldPath = fieldPath;
    }

    /**
     * Returns a copy whose field path is prefixed with {@code parent}, e.g. {@code steps[2]}.
     */
    public WorkflowParseException within(String parent) {
        String path = fieldPath == null ? parent : parent + "." + fieldPath;
        return new WorkflowParseException(workflowId, path, rawMessage(), getCause());
    }

    public WorkflowParseException forWorkflow(String id) {
        return new WorkflowParseException(id, fieldPath, rawMessage(), getCause());
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    private String rawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (workflowId != null) {
            sb.append("Workflow '").append(workflowId).append("': ");
        }
        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }
        sb.append(super.getMessage());
        return sb.toString();
    }
}
