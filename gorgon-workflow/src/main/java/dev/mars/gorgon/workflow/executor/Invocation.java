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

import dev.mars.gorgon.workflow.StepKind;
import dev.mars.gorgon.workflow.engine.CancellationToken;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single call to an external capability: a provider request or a shell command.
 */
public final class Invocation {

    private final String stepId;
    private final StepKind kind;
    private final String provider;
    private final Map<String, Object> params;
    private final Duration timeout;
    private final CancellationToken cancellationToken;

    public Invocation(String stepId, StepKind kind, String provider, Map<String, Object> params,
                      Duration timeout, CancellationToken cancellationToken) {
        this.stepId = Objects.requireNonNull(stepId, "Step ID cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.provider = provider;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.timeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
        this.cancellationToken = cancellationToken != null ? cancellationToken : new CancellationToken();
    }

    public static Invocation from(StepContext context, String provider) {
        return new Invocation(context.getStepId(), context.getStep().getKind(), provider,
                context.getParams(), context.getTimeout(), context.getCancellationToken());
    }

    public String getStepId() {
        return stepId;
    }

    public StepKind getKind() {
        return kind;
    }

    public String getProvider() {
        return provider;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    @Override
    public String toString() {
        return "Invocation{" +
               "stepId='" + stepId + '\'' +
               ", kind=" + kind +
               ", provider='" + provider + '\'' +
               ", timeout=" + timeout +
               '}';
    }
}
