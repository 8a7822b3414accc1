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

import dev.mars.gorgon.workflow.observability.ExecutionEvent;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Mutable bookkeeping for one top-level execution, shared by the engine, the graph runner
 * and the step runner.
 */
final class ExecutionState {

    private final String executionId;
    private final String workflowId;
    private final ExecutionOptions options;
    private final int maxConcurrency;
    private final Instant startedAt;
    private final Instant deadline;
    private final Long tokenBudget;
    private final Consumer<ExecutionEvent> events;

    private final CancellationToken token = new CancellationToken();
    private final AtomicBoolean pauseRequested = new AtomicBoolean(false);
    private final AtomicLong totalTokens = new AtomicLong();
    private final Map<String, StepResult> results = new ConcurrentHashMap<>();
    private final Set<String> completed = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<String> bypassed = Collections.synchronizedSet(new LinkedHashSet<>());
    private volatile WorkflowStatus status = WorkflowStatus.PENDING;

    ExecutionState(String executionId, String workflowId, ExecutionOptions options, int maxConcurrency,
                   Instant startedAt, Instant deadline, Long tokenBudget, Consumer<ExecutionEvent> events) {
        this.executionId = executionId;
        this.workflowId = workflowId;
        this.options = options;
        this.maxConcurrency = maxConcurrency;
        this.startedAt = startedAt;
        this.deadline = deadline;
        this.tokenBudget = tokenBudget;
        this.events = events;
    }

    String getExecutionId() {
        return executionId;
    }

    String getWorkflowId() {
        return workflowId;
    }

    ExecutionOptions getOptions() {
        return options;
    }

    int getMaxConcurrency() {
        return maxConcurrency;
    }

    Instant getStartedAt() {
        return startedAt;
    }

    boolean isPastDeadline() {
        return deadline != null && Instant.now().isAfter(deadline);
    }

    boolean isBudgetExhausted() {
        return tokenBudget != null && totalTokens.get() >= tokenBudget;
    }

    Long getTokenBudget() {
        return tokenBudget;
    }

    CancellationToken getToken() {
        return token;
    }

    boolean requestPause() {
        return pauseRequested.compareAndSet(false, true);
    }

    boolean isPauseRequested() {
        return pauseRequested.get();
    }

    long addTokens(long tokens) {
        return totalTokens.addAndGet(tokens);
    }

    long getTotalTokens() {
        return totalTokens.get();
    }

    Map<String, StepResult> getResults() {
        return results;
    }

    Set<String> getCompleted() {
        return completed;
    }

    Set<String> getBypassed() {
        return bypassed;
    }

    WorkflowStatus getStatus() {
        return status;
    }

    void setStatus(WorkflowStatus status) {
        this.status = status;
    }

    void publish(ExecutionEvent event) {
        events.accept(event);
    }

    ExecutionEvent.Builder event(ExecutionEvent.Type type) {
        return ExecutionEvent.builder(type, executionId, workflowId);
    }
}
