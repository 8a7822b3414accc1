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

import dev.mars.gorgon.ratelimit.RateLimiter;
import dev.mars.gorgon.workflow.StepKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Lookup table from step kind to handler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public class StepExecutorRegistry {

    private static final Logger logger = Logger.getLogger(StepExecutorRegistry.class.getName());

    private final Map<StepKind, StepHandler> handlers = new EnumMap<>(StepKind.class);

    /**
     * Creates a registry with the built-in handlers for every kind.
     *
     * @param toolInvoker invoker for tool calls; when null, tool_call steps have no handler
     * @param rateLimiter limiter consulted before each tool call; may be null
     */
    public static StepExecutorRegistry withDefaults(StepInvoker toolInvoker, RateLimiter rateLimiter) {
        StepExecutorRegistry registry = new StepExecutorRegistry();
        if (toolInvoker != null) {
            registry.register(StepKind.TOOL_CALL, new ToolCallStepHandler(toolInvoker, rateLimiter));
        }
        registry.register(StepKind.SHELL, new ShellStepHandler(new ShellCommandInvoker()));
        registry.register(StepKind.CONDITION, new ConditionStepHandler());
        registry.register(StepKind.PARALLEL, new ParallelStepHandler());
        registry.register(StepKind.FAN_OUT, new FanOutStepHandler());
        registry.register(StepKind.FAN_IN, new FanInStepHandler());
        registry.register(StepKind.MAP_REDUCE, new MapReduceStepHandler());
        registry.register(StepKind.CHECKPOINT, new CheckpointStepHandler());
        return registry;
    }

    /**
     * Registers a handler, replacing any existing handler for the kind.
     */
    public StepExecutorRegistry register(StepKind kind, StepHandler handler) {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        StepHandler previous = handlers.put(kind, handler);
        if (previous != null) {
            logger.fine("Replaced handler for step kind " + kind.getValue());
        }
        return this;
    }

    public Optional<StepHandler> get(StepKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    public boolean supports(StepKind kind) {
        return handlers.containsKey(kind);
    }
}
