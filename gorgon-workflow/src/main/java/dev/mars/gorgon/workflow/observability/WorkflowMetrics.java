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

package dev.mars.gorgon.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the Gorgon workflow engine.
 *
 * Provides:
 * - gorgon.workflow.active (gauge) - Currently running executions
 * - gorgon.workflow.total (counter) - Executions started
 * - gorgon.workflow.completed / failed / paused (counters) - Executions by outcome
 * - gorgon.workflow.steps.total / failed / retried (counters) - Step attempts
 * - gorgon.ratelimit.throttled (counter) - Provider throttle signals
 * - gorgon.workflow.duration.seconds, gorgon.workflow.step.duration.seconds (histograms)
 * - gorgon.workflow.tokens (histogram) - Tokens used per execution
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "gorgon-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsPaused;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final LongCounter stepsRetried;
    private final LongCounter throttled;

    private final DoubleHistogram workflowDuration;
    private final DoubleHistogram stepDuration;
    private final LongHistogram tokensPerWorkflow;

    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> STEP_KIND_KEY = AttributeKey.stringKey("step.kind");
    private static final AttributeKey<String> STATUS_KEY = AttributeKey.stringKey("status");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    /**
     * Creates metrics on the given meter. Tests pass an SDK meter backed by an in-memory reader.
     */
    public WorkflowMetrics(Meter meter) {
        workflowsTotal = meter.counterBuilder("gorgon.workflow.total")
                .setDescription("Total number of workflow executions started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("gorgon.workflow.completed")
                .setDescription("Number of successfully completed workflow executions")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("gorgon.workflow.failed")
                .setDescription("Number of failed workflow executions")
                .setUnit("1")
                .build();

        workflowsPaused = meter.counterBuilder("gorgon.workflow.paused")
                .setDescription("Number of workflow executions paused at a checkpoint")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("gorgon.workflow.steps.total")
                .setDescription("Total number of workflow steps finished")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("gorgon.workflow.steps.failed")
                .setDescription("Number of failed workflow steps")
                .setUnit("1")
                .build();

        stepsRetried = meter.counterBuilder("gorgon.workflow.steps.retried")
                .setDescription("Number of step retries")
                .setUnit("1")
                .build();

        throttled = meter.counterBuilder("gorgon.ratelimit.throttled")
                .setDescription("Number of provider rate-limit signals")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("gorgon.workflow.duration.seconds")
                .setDescription("Workflow execution duration in seconds")
                .setUnit("s")
                .build();

        stepDuration = meter.histogramBuilder("gorgon.workflow.step.duration.seconds")
                .setDescription("Step duration in seconds")
                .setUnit("s")
                .build();

        tokensPerWorkflow = meter.histogramBuilder("gorgon.workflow.tokens")
                .setDescription("Tokens used per workflow execution")
                .setUnit("1")
                .ofLongs()
                .build();

        meter.gaugeBuilder("gorgon.workflow.active")
                .setDescription("Number of currently running workflow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.fine("WorkflowMetrics initialized");
    }

    /**
     * Get the shared instance registered on the global OpenTelemetry meter provider.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowId) {
        workflowsTotal.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowId, double durationSeconds, long tokens) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = Attributes.of(WORKFLOW_ID_KEY, workflowId, STATUS_KEY, "completed");
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
        tokensPerWorkflow.record(tokens, attrs);
    }

    public void recordWorkflowFailed(String workflowId, double durationSeconds, String failureReason) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(STATUS_KEY, "failed")
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        workflowsFailed.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowPaused(String workflowId) {
        activeWorkflows.decrementAndGet();
        workflowsPaused.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
    }

    public void recordStepFinished(String workflowId, String stepKind, String status, double durationSeconds) {
        Attributes attrs = Attributes.of(WORKFLOW_ID_KEY, workflowId, STEP_KIND_KEY, stepKind, STATUS_KEY, status);
        stepsTotal.add(1, attrs);
        stepDuration.record(durationSeconds, attrs);
    }

    public void recordStepFailed(String workflowId, String stepKind, String failureReason) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(STEP_KIND_KEY, stepKind)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        stepsFailed.add(1, attrs);
    }

    public void recordStepRetried(String workflowId, String stepKind) {
        stepsRetried.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId, STEP_KIND_KEY, stepKind));
    }

    public void recordThrottled(String workflowId, String stepKind) {
        throttled.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId, STEP_KIND_KEY, stepKind));
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }
}
