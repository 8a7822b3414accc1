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

import dev.mars.gorgon.workflow.StepKind;
import dev.mars.gorgon.workflow.engine.StepStatus;
import dev.mars.gorgon.workflow.engine.WorkflowStatus;

import java.time.Duration;
import java.util.Objects;

/**
 * Feeds execution events into {@link WorkflowMetrics}.
 */
public class MetricsEventListener implements ExecutionEventListener {

    private final WorkflowMetrics metrics;

    public MetricsEventListener() {
        this(WorkflowMetrics.getInstance());
    }

    public MetricsEventListener(WorkflowMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        String workflowId = event.getWorkflowId();
        String kind = event.getStepKind().map(StepKind::getValue).orElse("unknown");
        double seconds = event.getDuration().map(Duration::toMillis).orElse(0L) / 1000.0;
        switch (event.getType()) {
            case WORKFLOW_STARTED:
                metrics.recordWorkflowStarted(workflowId);
                break;
            case STEP_RETRYING:
                metrics.recordStepRetried(workflowId, kind);
                break;
            case STEP_THROTTLED:
                metrics.recordThrottled(workflowId, kind);
                break;
            case STEP_FINISHED:
                StepStatus status = event.getStepStatus().orElse(StepStatus.PENDING);
                metrics.recordStepFinished(workflowId, kind, status.getValue(), seconds);
                if (status == StepStatus.FAILED) {
                    metrics.recordStepFailed(workflowId, kind, event.getErrorKind().orElse(null));
                }
                break;
            case WORKFLOW_FINISHED:
                WorkflowStatus workflowStatus = event.getWorkflowStatus().orElse(WorkflowStatus.FAILED);
                if (workflowStatus == WorkflowStatus.COMPLETED) {
                    metrics.recordWorkflowCompleted(workflowId, seconds, event.getTokensUsed());
                } else if (workflowStatus == WorkflowStatus.PAUSED) {
                    metrics.recordWorkflowPaused(workflowId);
                } else {
                    metrics.recordWorkflowFailed(workflowId, seconds, event.getErrorKind().orElse(null));
                }
                break;
            default:
                break;
        }
    }
}
