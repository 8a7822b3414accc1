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

import dev.mars.gorgon.workflow.StepDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A step paired with the private variable scope it runs against, such as one fan-out item.
 */
public final class StepInstance {

    private final StepDefinition step;
    private final Map<String, Object> variables;

    public StepInstance(StepDefinition step, Map<String, Object> variables) {
        this.step = Objects.requireNonNull(step, "Step cannot be null");
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public StepDefinition getStep() {
        return step;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }
}
