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

import dev.mars.gorgon.workflow.engine.StepResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a successful step attempt produced.
 * <p>
 * {@code outputs} are candidate bindings filtered by the step's declared outputs;
 * {@code exports} are merged unconditionally (used by group steps to surface the bindings
 * of their nested steps).
 */
public final class StepOutcome {

    private final Object primary;
    private final Map<String, Object> outputs;
    private final Map<String, Object> exports;
    private final long tokensUsed;
    private final List<StepResult> children;

    private StepOutcome(Builder builder) {
        this.primary = builder.primary;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        this.exports = Collections.unmodifiableMap(new LinkedHashMap<>(builder.exports));
        this.tokensUsed = builder.tokensUsed;
        this.children = List.copyOf(builder.children);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StepOutcome of(Object primary) {
        return builder().primary(primary).build();
    }

    public static StepOutcome of(Object primary, Map<String, Object> outputs) {
        return builder().primary(primary).outputs(outputs).build();
    }

    public Object getPrimary() {
        return primary;
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public Map<String, Object> getExports() {
        return exports;
    }

    public long getTokensUsed() {
        return tokensUsed;
    }

    public List<StepResult> getChildren() {
        return children;
    }

    public static class Builder {
        private Object primary;
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private final Map<String, Object> exports = new LinkedHashMap<>();
        private long tokensUsed;
        private List<StepResult> children = List.of();

        public Builder primary(Object primary) {
            this.primary = primary;
            return this;
        }

        public Builder output(String name, Object value) {
            this.outputs.put(name, value);
            return this;
        }

        public Builder outputs(Map<String, ?> outputs) {
            if (outputs != null) {
                this.outputs.putAll(outputs);
            }
            return this;
        }

        public Builder exports(Map<String, ?> exports) {
            if (exports != null) {
                this.exports.putAll(exports);
            }
            return this;
        }

        public Builder tokensUsed(long tokensUsed) {
            this.tokensUsed = tokensUsed;
            return this;
        }

        public Builder children(List<StepResult> children) {
            this.children = children != null ? children : List.of();
            return this;
        }

        public StepOutcome build() {
            return new StepOutcome(this);
        }
    }
}
