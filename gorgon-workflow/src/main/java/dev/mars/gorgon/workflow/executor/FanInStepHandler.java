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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.StepKind;
import dev.mars.gorgon.workflow.VariableResolver;
import dev.mars.gorgon.workflow.engine.StepErrorKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Handler for {@code fan_in} steps: reduces a list, usually a fan-out's results, to one value.
 * <p>
 * Parameters: {@code input} (a list, or the name of a context variable holding one) and
 * {@code method}. With {@code concat} (the default) null entries are dropped, strings are
 * joined with {@code separator} (default newline), lists are flattened and anything else is
 * collected into a list. Any other method ({@code tool}, or a provider name such as
 * {@code claude_code}) hands the whole list to the tool-call handler as the {@code items}
 * parameter, with its JSON form appended to {@code prompt}. The reduced value is output as
 * {@code result}.
 */
public class FanInStepHandler implements StepHandler {

    static final String CONCAT = "concat";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public StepOutcome execute(StepContext context) throws InterruptedException {
        List<?> items = resolveInput(context, context.getParams().get("input"), "input");
        return aggregate(context, items, context.getParams());
    }

    /**
     * Reduces {@code items} as directed by {@code params}. Shared with map-reduce for its
     * reduce phase.
     */
    static StepOutcome aggregate(StepContext context, List<?> items, Map<String, Object> params)
            throws InterruptedException {
        String method = params.get("method") != null
                ? params.get("method").toString().trim().toLowerCase(Locale.ROOT)
                : CONCAT;
        if (CONCAT.equals(method)) {
            Object result = concat(items, params.get("separator") != null ? params.get("separator").toString() : "\n");
            return StepOutcome.builder()
                    .primary(result)
                    .output("result", result)
                    .output("count", items.size())
                    .build();
        }
        return delegateToTool(context, method, items, params);
    }

    static Object concat(List<?> items, String separator) {
        List<Object> present = items.stream().filter(Objects::nonNull).collect(Collectors.toList());
        if (!present.isEmpty() && present.stream().allMatch(item -> item instanceof CharSequence)) {
            return present.stream().map(Object::toString).collect(Collectors.joining(separator));
        }
        List<Object> flattened = new ArrayList<>();
        for (Object item : present) {
            if (item instanceof List) {
                flattened.addAll((List<?>) item);
            } else {
                flattened.add(item);
            }
        }
        return flattened;
    }

    private static StepOutcome delegateToTool(StepContext context, String method, List<?> items,
                                              Map<String, Object> params) throws InterruptedException {
        String provider = StepKind.defaultProviderFor(method);
        if (provider == null && !"tool".equals(method) && !"tool_call".equals(method)) {
            throw new StepFailureException(StepErrorKind.INVALID_PARAMETERS,
                    "Unknown aggregation method '" + method + "' for step '" + context.getStepId() + "'");
        }
        StepHandler toolHandler = context.getRegistry()
                .flatMap(registry -> registry.get(StepKind.TOOL_CALL))
                .orElseThrow(() -> new StepFailureException(StepErrorKind.INVALID_PARAMETERS,
                        "Step '" + context.getStepId() + "' aggregates with a tool but no tool handler is registered"));

        String serialized;
        try {
            serialized = MAPPER.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new StepFailureException(StepErrorKind.INVALID_PARAMETERS,
                    "Items of step '" + context.getStepId() + "' cannot be serialized: " + e.getOriginalMessage(), e);
        }

        Map<String, Object> toolParams = new LinkedHashMap<>(params);
        toolParams.remove("input");
        toolParams.remove("method");
        toolParams.put("items", items);
        String prompt = params.get("prompt") != null ? params.get("prompt").toString() : "";
        toolParams.put("prompt", prompt.isEmpty() ? serialized : prompt + "\n\n" + serialized);

        StepDefinition.Builder toolStep = context.getStep().toBuilder().kind(StepKind.TOOL_CALL);
        Object explicitProvider = params.get("provider");
        if (explicitProvider != null) {
            toolStep.provider(explicitProvider.toString());
        } else if (provider != null) {
            toolStep.provider(provider);
        }
        StepOutcome outcome = toolHandler.execute(context.toBuilder()
                .step(toolStep.build())
                .params(toolParams)
                .build());
        Object result = outcome.getPrimary() != null ? outcome.getPrimary() : outcome.getOutputs();
        return StepOutcome.builder()
                .primary(result)
                .outputs(outcome.getOutputs())
                .output("result", result)
                .output("count", items.size())
                .tokensUsed(outcome.getTokensUsed())
                .build();
    }

    static List<?> resolveInput(StepContext context, Object input, String paramName) {
        if (input instanceof String) {
            input = VariableResolver.lookup(context.getVariables(), ((String) input).trim()).orElse(null);
        }
        if (!(input instanceof List)) {
            throw new StepFailureException(StepErrorKind.INVALID_PARAMETERS,
                    "Step '" + context.getStepId() + "' requires '" + paramName
                    + "' to be a list or the name of a list variable");
        }
        return (List<?>) input;
    }
}
