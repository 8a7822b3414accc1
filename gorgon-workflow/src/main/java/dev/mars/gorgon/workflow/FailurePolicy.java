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

import java.util.Locale;

/**
 * What the scheduler does when a step ends in failure.
 */
public enum FailurePolicy {

    /**
     * Stop dispatching; the workflow fails once in-flight siblings finish.
     */
    ABORT,

    /**
     * Record the failure and let dependents run.
     */
    SKIP,

    /**
     * Retry up to the step's retry limit, then behave as {@link #ABORT}.
     */
    RETRY;

    public static FailurePolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ABORT;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "abort":
            case "fail":
                return ABORT;
            case "skip":
            case "continue":
                return SKIP;
            case "retry":
                return RETRY;
            default:
                throw new IllegalArgumentException("Unknown failure policy: " + value);
        }
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
