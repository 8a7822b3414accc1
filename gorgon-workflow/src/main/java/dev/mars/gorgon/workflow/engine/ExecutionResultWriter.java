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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Renders an {@link ExecutionResult} into the JSON document consumed downstream:
 * workflow id, status, one entry per step and the final variable snapshot.
 */
public class ExecutionResultWriter {

    private static final Logger logger = Logger.getLogger(ExecutionResultWriter.class.getName());

    private final ObjectMapper objectMapper;

    public ExecutionResultWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Map<String, Object> toMap(ExecutionResult result) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("workflowId", result.getWorkflowId());
        document.put("executionId", result.getExecutionId());
        document.put("status", result.getStatus().getValue());

        List<Map<String, Object>> steps = new ArrayList<>();
        for (StepResult step : result.getSteps()) {
            steps.add(stepEntry(step));
        }
        document.put("steps", steps);
        document.put("variables", result.getVariables());
        document.put("outputs", result.getOutputs());
        document.put("totalTokens", result.getTotalTokens());
        document.put("checkpointId", result.getCheckpointId().orElse(null));
        document.put("error", result.getError().map(error -> errorEntry(error.getKind().name(), error.getMessage()))
                .orElse(null));
        document.put("startedAt", result.getStartedAt());
        document.put("endedAt", result.getEndedAt());
        return document;
    }

    public String toJson(ExecutionResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toMap(result));
    }

    public void write(ExecutionResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(result));
        logger.fine("Wrote execution result " + result.getExecutionId() + " to " + file);
    }

    /**
     * Reads a document written by {@link #write} back as a plain map.
     */
    public Map<String, Object> read(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() { });
    }

    private static Map<String, Object> stepEntry(StepResult step) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", step.getStepId());
        entry.put("type", step.getKind() != null ? step.getKind().getValue() : null);
        entry.put("status", step.getStatus().getValue());
        entry.put("startedAt", step.getStartedAt());
        entry.put("endedAt", step.getEndedAt());
        entry.put("outputs", step.getOutputs());
        entry.put("error", step.getError() != null
                ? errorEntry(step.getError().getKind().name(), step.getError().getMessage()) : null);
        entry.put("retryCount", step.getRetryCount());
        entry.put("tokensUsed", step.getTokensUsed());
        if (!step.getChildren().isEmpty()) {
            List<Map<String, Object>> children = new ArrayList<>();
            step.getChildren().forEach(child -> children.add(stepEntry(child)));
            entry.put("children", children);
        }
        return entry;
    }

    private static Map<String, Object> errorEntry(String kind, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", kind);
        error.put("message", message);
        return error;
    }
}
