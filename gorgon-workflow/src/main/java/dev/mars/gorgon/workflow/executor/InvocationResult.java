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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * What an external call returned. A provider-side rate-limit rejection is reported with
 * {@link #isRateLimited()} so it can be told apart from other failures.
 */
public final class InvocationResult {

    private final Map<String, Object> outputs;
    private final Object raw;
    private final String error;
    private final boolean rateLimited;
    private final long tokensUsed;

    private InvocationResult(Map<String, Object> outputs, Object raw, String error,
                             boolean rateLimited, long tokensUsed) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs != null ? outputs : Map.of()));
        this.raw = raw;
        this.error = error;
        this.rateLimited = rateLimited;
        this.tokensUsed = Math.max(0, tokensUsed);
    }

    public static InvocationResult success(Object raw) {
        return new InvocationResult(Map.of(), raw, null, false, 0);
    }

    public static InvocationResult success(Object raw, Map<String, Object> outputs) {
        return new InvocationResult(outputs, raw, null, false, 0);
    }

    public static InvocationResult success(Object raw, Map<String, Object> outputs, long tokensUsed) {
        return new InvocationResult(outputs, raw, null, false, tokensUsed);
    }

    public static InvocationResult failure(String error) {
        return new InvocationResult(Map.of(), null, error, false, 0);
    }

    public static InvocationResult failure(String error, Map<String, Object> outputs) {
        return new InvocationResult(outputs, null, error, false, 0);
    }

    public static InvocationResult rateLimited(String error) {
        return new InvocationResult(Map.of(), null, error, true, 0);
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public Object getRaw() {
        return raw;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccessful() {
        return error == null && !rateLimited;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }

    public long getTokensUsed() {
        return tokensUsed;
    }

    @Override
    public String toString() {
        return "InvocationResult{" +
               "successful=" + isSuccessful() +
               ", rateLimited=" + rateLimited +
               (error != null ? ", error='" + error + '\'' : "") +
               ", tokensUsed=" + tokensUsed +
               '}';
    }
}
