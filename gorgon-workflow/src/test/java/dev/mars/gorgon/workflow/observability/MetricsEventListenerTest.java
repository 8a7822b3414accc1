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
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collection;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that execution events are turned into OpenTelemetry instruments.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
class MetricsEventListenerTest {

    private InMemoryMetricReader reader;
    private SdkMeterProvider meterProvider;
    private WorkflowMetrics metrics;
    private MetricsEventListener listener;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
        metrics = new WorkflowMetrics(meterProvider.get("gorgon-workflow-test"));
        listener = new MetricsEventListener(metrics);
    }

    @AfterEach
    void tearDown() {
        meterProvider.close();
    }

    @Test
    void completedWorkflowCountsStepsAndTokens() {
        listener.onEvent(event(ExecutionEvent.Type.WORKFLOW_STARTED).build());
        assertThat(metrics.getActiveWorkflows()).isEqualTo(1);

        listener.onEvent(event(ExecutionEvent.Type.STEP_FINISHED)
                .step("fetch", StepKind.SHELL)
                .stepStatus(StepStatus.SUCCEEDED)
                .duration(Duration.ofMillis(1500))
                .build());
        listener.onEvent(event(ExecutionEvent.Type.WORKFLOW_FINISHED)
                .workflowStatus(WorkflowStatus.COMPLETED)
                .duration(Duration.ofSeconds(3))
                .tokensUsed(250)
                .build());

        Collection<MetricData> collected = reader.collectAllMetrics();
        assertThat(sum(collected, "gorgon.workflow.total")).isEqualTo(1);
        assertThat(sum(collected, "gorgon.workflow.completed")).isEqualTo(1);
        assertThat(sum(collected, "gorgon.workflow.steps.total")).isEqualTo(1);
        assertThat(sum(collected, "gorgon.workflow.steps.failed")).isZero();
        assertThat(metrics.getActiveWorkflows()).isZero();
        assertThat(collected).anyMatch(metric -> metric.getName().equals("gorgon.workflow.tokens"));
    }

    @Test
    void failuresRetriesAndThrottlesAreCounted() {
        listener.onEvent(event(ExecutionEvent.Type.WORKFLOW_STARTED).build());
        listener.onEvent(event(ExecutionEvent.Type.STEP_RETRYING).step("review", StepKind.TOOL_CALL).attempt(1).build());
        listener.onEvent(event(ExecutionEvent.Type.STEP_THROTTLED).step("review", StepKind.TOOL_CALL).build());
        listener.onEvent(event(ExecutionEvent.Type.STEP_FINISHED)
                .step("review", StepKind.TOOL_CALL)
                .stepStatus(StepStatus.FAILED)
                .errorKind("RATE_LIMITED")
                .build());
        listener.onEvent(event(ExecutionEvent.Type.WORKFLOW_FINISHED)
                .workflowStatus(WorkflowStatus.FAILED)
                .errorKind("ABORTED_BY_POLICY")
                .build());

        Collection<MetricData> collected = reader.collectAllMetrics();
        assertThat(sum(collected, "gorgon.workflow.steps.retried")).isEqualTo(1);
        assertThat(sum(collected, "gorgon.ratelimit.throttled")).isEqualTo(1);
        assertThat(sum(collected, "gorgon.workflow.steps.failed")).isEqualTo(1);
        assertThat(sum(collected, "gorgon.workflow.failed")).isEqualTo(1);
    }

    @Test
    void pausedWorkflowIsNotActive() {
        listener.onEvent(event(ExecutionEvent.Type.WORKFLOW_STARTED).build());
        listener.onEvent(event(ExecutionEvent.Type.WORKFLOW_FINISHED).workflowStatus(WorkflowStatus.PAUSED).build());

        assertThat(sum(reader.collectAllMetrics(), "gorgon.workflow.paused")).isEqualTo(1);
        assertThat(metrics.getActiveWorkflows()).isZero();
    }

    private static ExecutionEvent.Builder event(ExecutionEvent.Type type) {
        return ExecutionEvent.builder(type, "exec-1", "pr-review");
    }

    private static long sum(Collection<MetricData> metrics, String name) {
        return metrics.stream()
                .filter(metric -> metric.getName().equals(name))
                .flatMap(metric -> metric.getLongSumData().getPoints().stream())
                .mapToLong(LongPointData::getValue)
                .sum();
    }
}
