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

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses workflow definitions using SnakeYAML with the safe constructor.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = Logger.getLogger(YamlWorkflowDefinitionParser.class.getName());

    private final Yaml yaml;
    private final DependencyGraphBuilder graphBuilder;

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.graphBuilder = new DependencyGraphBuilder();
    }

    @Override
    public WorkflowDefinition parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + file, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws WorkflowParseException {
        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        Map<String, Object> data = asMap(loaded);
        String id = getStringValue(data, "id", getStringValue(data, "name"));
        if (id == null || id.isBlank()) {
            throw new WorkflowParseException("id", "Workflow id or name is required");
        }
        try {
            WorkflowDefinition definition = parseWorkflow(id, data);
            logger.fine("Parsed workflow " + definition.getId() + " with " + definition.getSteps().size() + " steps");
            return definition;
        } catch (WorkflowParseException e) {
            throw e.forWorkflow(id);
        }
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();
        if (definition.getSteps().isEmpty()) {
            result.addWarning("steps", "No steps defined");
        }
        validateSteps("steps", definition.getSteps(), false, result);

        try {
            graphBuilder.build(definition);
        } catch (GraphException e) {
            result.addError("steps", e.getMessage());
        }
        for (String output : definition.getOutputs()) {
            boolean produced = definition.getVariables().containsKey(output)
                    || definition.getInputs().containsKey(output)
                    || declaresOutput(definition.getSteps(), output);
            if (!produced) {
                result.addWarning("outputs", "Output '" + output + "' is not produced by any step");
            }
        }
        return result;
    }

    private WorkflowDefinition parseWorkflow(String id, Map<String, Object> data) throws WorkflowParseException {
        WorkflowDefinition.Builder builder = WorkflowDefinition.builder(id)
                .name(getStringValue(data, "name", id))
                .description(getStringValue(data, "description"))
                .version(getStringValue(data, "version", "1.0"))
                .variables(getMapValue(data, "variables"))
                .outputs(parseStringList(data.get("outputs")));

        for (InputSpec input : parseInputs(getMapValue(data, "inputs"))) {
            builder.input(input);
        }
        if (data.get("token_budget") != null) {
            builder.tokenBudget(getLongValue(data, "token_budget"));
        }
        if (data.get("timeout") != null) {
            builder.timeout(parseDuration("timeout", data.get("timeout")));
        }
        if (data.get("max_concurrency") != null) {
            builder.maxConcurrency((int) getLongValue(data, "max_concurrency"));
        }
        builder.steps(parseSteps(data.get("steps")));
        return builder.build();
    }

    private List<InputSpec> parseInputs(Map<String, Object> data) throws WorkflowParseException {
        List<InputSpec> inputs = new ArrayList<>();
        if (data == null) {
            return inputs;
        }
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map) {
                Map<String, Object> spec = asMap(value);
                boolean hasDefault = spec.containsKey("default");
                boolean required = getBooleanValue(spec, "required", !hasDefault);
                inputs.add(new InputSpec(entry.getKey(), required, spec.get("default"),
                        getStringValue(spec, "description")));
            } else if (value == null) {
                inputs.add(InputSpec.required(entry.getKey()));
            } else {
                throw new WorkflowParseException("inputs." + entry.getKey(), "Input must be a mapping");
            }
        }
        return inputs;
    }

    private List<StepDefinition> parseSteps(Object value) throws WorkflowParseException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException("steps", "Steps must be a list");
        }
        List<?> list = (List<?>) value;
        List<StepDefinition> steps = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            try {
                if (!(list.get(i) instanceof Map)) {
                    throw new WorkflowParseException("Step must be a mapping");
                }
                steps.add(parseStep(asMap(list.get(i))));
            } catch (WorkflowParseException e) {
                throw e.within("steps[" + i + "]");
            }
        }
        return steps;
    }

    private StepDefinition parseStep(Map<String, Object> data) throws WorkflowParseException {
        String id = getStringValue(data, "id");
        if (id == null || id.isBlank()) {
            throw new WorkflowParseException("id", "Step id is required");
        }
        String type = getStringValue(data, "type");
        if (type == null) {
            throw new WorkflowParseException("type", "Step type is required");
        }

        StepKind kind;
        FailurePolicy onFailure;
        try {
            kind = StepKind.fromValue(type);
            onFailure = FailurePolicy.fromValue(getStringValue(data, "on_failure"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException("type", e.getMessage());
        }

        StepDefinition.Builder builder = StepDefinition.builder(id, kind)
                .params(getMapValue(data, "params"))
                .dependsOn(parseStringList(data.get("depends_on")))
                .nextStep(getStringValue(data, "next_step"))
                .onFailure(onFailure)
                .maxRetries((int) getLongValue(data, "max_retries", 0))
                .outputs(parseStringList(data.get("outputs")))
                .optionalVariables(new LinkedHashSet<>(parseStringList(data.get("optional_vars"))))
                .provider(getStringValue(data, "provider", StepKind.defaultProviderFor(type)));

        if (data.get("timeout") != null) {
            builder.timeout(parseDuration("timeout", data.get("timeout")));
        }
        if (data.get("condition") != null) {
            try {
                builder.condition(ConditionSpec.fromMap(getMapValue(data, "condition")));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException("condition", e.getMessage());
            }
        }
        builder.steps(parseSteps(data.get("steps")));
        if (data.get("template") != null) {
            Map<String, Object> template = getMapValue(data, "template");
            if (template == null) {
                throw new WorkflowParseException("template", "Template must be a mapping");
            }
            if (!template.containsKey("id")) {
                template = new LinkedHashMap<>(template);
                template.put("id", id + "_item");
            }
            try {
                builder.template(parseStep(template));
            } catch (WorkflowParseException e) {
                throw e.within("template");
            }
        }
        return builder.build();
    }

    private void validateSteps(String path, List<StepDefinition> steps, boolean nested, ValidationResult result) {
        for (int i = 0; i < steps.size(); i++) {
            validateStep(path + "[" + i + "]", steps.get(i), nested, result);
        }
    }

    private void validateStep(String stepPath, StepDefinition step, boolean nested, ValidationResult result) {
        Map<String, Object> params = step.getParams();
        if (nested && step.getKind() == StepKind.CHECKPOINT) {
            result.addError(stepPath + ".type", "Checkpoint steps are only allowed at the top level of a workflow");
        }
        switch (step.getKind()) {
            case SHELL:
                if (params.get("command") == null) {
                    result.addError(stepPath + ".params.command", "Shell step requires a command");
                }
                break;
            case CONDITION:
                if (params.get("field") == null) {
                    result.addError(stepPath + ".params.field", "Condition step requires a field");
                }
                break;
            case PARALLEL:
                if (step.getSteps().isEmpty()) {
                    result.addError(stepPath + ".steps", "Parallel step requires nested steps");
                }
                break;
            case FAN_OUT:
            case MAP_REDUCE:
                if (step.getTemplate().isEmpty()) {
                    result.addError(stepPath + ".template", "Step requires a template");
                }
                if (params.get("items") == null) {
                    result.addError(stepPath + ".params.items", "Step requires an items variable");
                }
                break;
            case FAN_IN:
                if (params.get("input") == null) {
                    result.addError(stepPath + ".params.input", "Fan-in step requires an input variable");
                }
                break;
            default:
                break;
        }
        if (step.getOnFailure() == FailurePolicy.RETRY && step.getMaxRetries() == 0) {
            result.addWarning(stepPath + ".max_retries", "Retry policy with max_retries 0 never retries");
        }
        validateSteps(stepPath + ".steps", step.getSteps(), true, result);
        if (step.getTemplate().isPresent()) {
            validateStep(stepPath + ".template", step.getTemplate().get(), true, result);
        }
    }

    private static boolean declaresOutput(List<StepDefinition> steps, String name) {
        for (StepDefinition step : steps) {
            if (step.getOutputs().contains(name) || declaresOutput(step.getSteps(), name)) {
                return true;
            }
        }
        return false;
    }

    // Utility methods for safe type conversion
    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? asMap(value) : null;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private long getLongValue(Map<String, Object> data, String key) throws WorkflowParseException {
        return getLongValue(data, key, 0);
    }

    private long getLongValue(Map<String, Object> data, String key, long defaultValue) throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(key, "Expected a whole number but got '" + value + "'");
        }
    }

    private List<String> parseStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        } else {
            result.add(value.toString());
        }
        return result;
    }

    private Duration parseDuration(String field, Object value) throws WorkflowParseException {
        if (value instanceof Number) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        String trimmed = value.toString().trim().toLowerCase(Locale.ROOT);
        try {
            if (trimmed.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2)));
            } else if (trimmed.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else if (trimmed.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else if (trimmed.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(trimmed.substring(0, trimmed.length() - 1)));
            } else {
                return Duration.ofSeconds(Long.parseLong(trimmed));
            }
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(field, "Invalid duration '" + value + "'");
        }
    }
}
