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

import dev.mars.gorgon.config.GorgonConfiguration;
import dev.mars.gorgon.workflow.FailurePolicy;
import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.StepKind;
import dev.mars.gorgon.workflow.WorkflowDefinition;
import dev.mars.gorgon.workflow.checkpoint.InMemoryCheckpointStore;
import dev.mars.gorgon.workflow.executor.StepExecutorRegistry;
import dev.mars.gorgon.workflow.executor.StepOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs parallel, fan-out, fan-in and map-reduce steps through the engine.
 */
class GroupStepExecutionTest {

    private ScriptedStepHandler tools;
    private DefaultWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty(GorgonConfiguration.METRICS_ENABLED, "false");
        tools = new ScriptedStepHandler();
        engine = new DefaultWorkflowEngine(
                StepExecutorRegistry.withDefaults(null, null).register(StepKind.TOOL_CALL, tools),
                new InMemoryCheckpointStore(), new GorgonConfiguration(properties));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Nested
    @DisplayName("Parallel")
    class Parallel {

        @Test
        @DisplayName("Nested outputs are exported to the enclosing workflow")
        void exportsNestedOutputs() throws Exception {
            StepDefinition group = StepDefinition.builder("both", StepKind.PARALLEL)
                    .param("max_workers", 2)
                    .steps(List.of(
                            tool("left").param("value", "L").outputs("left_out").build(),
                            tool("right").param("value", "R").outputs("right_out").build()))
                    .build();
            WorkflowDefinition definition = workflow(group,
                    tool("join").param("value", "${left_out}${right_out}").outputs("joined").dependsOn("both").build());

            ExecutionResult result = run(definition);

            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(result.getVariables()).containsEntry("joined", "LR");
            StepResult groupResult = result.getStepResult("both").orElseThrow();
            assertThat(ids(groupResult.getChildren())).containsExactly("left", "right");
        }

        @Test
        @DisplayName("fail_fast skips siblings that have not started")
        void failFastSkipsUnstarted() throws Exception {
            tools.on("p1", ScriptedStepHandler.failing(StepErrorKind.TOOL_INVOCATION_FAILED));
            StepDefinition group = StepDefinition.builder("group", StepKind.PARALLEL)
                    .param("max_workers", 1)
                    .param("fail_fast", true)
                    .steps(List.of(tool("p1").build(), tool("p2").build(), tool("p3").build()))
                    .build();

            ExecutionResult result = run(workflow(group));

            StepResult groupResult = result.getStepResult("group").orElseThrow();
            assertThat(groupResult.getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(statuses(groupResult.getChildren()))
                    .containsExactly(StepStatus.FAILED, StepStatus.SKIPPED, StepStatus.SKIPPED);
            assertThat(tools.invocations("p2")).isZero();
            assertThat(tools.invocations("p3")).isZero();
            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        }

        @Test
        @DisplayName("Without fail_fast every sibling runs and the group still reports the failure")
        void withoutFailFastSiblingsRun() throws Exception {
            tools.on("p1", ScriptedStepHandler.failing(StepErrorKind.TOOL_INVOCATION_FAILED));
            StepDefinition group = StepDefinition.builder("group", StepKind.PARALLEL)
                    .param("max_workers", 1)
                    .steps(List.of(tool("p1").build(), tool("p2").build(), tool("p3").build()))
                    .build();

            ExecutionResult result = run(workflow(group));

            StepResult groupResult = result.getStepResult("group").orElseThrow();
            assertThat(groupResult.getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(statuses(groupResult.getChildren()))
                    .containsExactly(StepStatus.FAILED, StepStatus.SUCCEEDED, StepStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("A nested failure under skip policy does not fail the group")
        void nestedSkipPolicy() throws Exception {
            tools.on("optional", ScriptedStepHandler.failing(StepErrorKind.TOOL_INVOCATION_FAILED));
            StepDefinition group = StepDefinition.builder("group", StepKind.PARALLEL)
                    .steps(List.of(tool("optional").onFailure(FailurePolicy.SKIP).build(), tool("required").build()))
                    .build();

            ExecutionResult result = run(workflow(group));

            assertThat(result.getStepResult("group").orElseThrow().getStatus()).isEqualTo(StepStatus.SUCCEEDED);
            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("Fan-out and fan-in")
    class FanOutFanIn {

        @Test
        @DisplayName("Fan-out results keep input order regardless of completion order")
        void fanOutPreservesOrder() throws Exception {
            tools.on("review[0]", context -> {
                Thread.sleep(150);
                return StepOutcome.of(context.getParams().get("value"));
            });
            StepDefinition fanOut = StepDefinition.builder("review", StepKind.FAN_OUT)
                    .param("items", "files")
                    .param("item_variable", "file")
                    .param("max_concurrent", 3)
                    .template(tool("review_item").param("value", "${file}#${file_index}").build())
                    .outputs("reviews")
                    .build();
            WorkflowDefinition definition = WorkflowDefinition.builder("fan")
                    .variable("files", List.of("a.java", "b.java", "c.java"))
                    .step(fanOut)
                    .build();

            ExecutionResult result = run(definition);

            assertThat(result.getVariables().get("reviews")).isEqualTo(List.of("a.java#0", "b.java#1", "c.java#2"));
            assertThat(ids(result.getStepResult("review").orElseThrow().getChildren()))
                    .containsExactly("review[0]", "review[1]", "review[2]");
        }

        @Test
        @DisplayName("An empty item list succeeds with no instances")
        void fanOutEmpty() throws Exception {
            StepDefinition fanOut = StepDefinition.builder("review", StepKind.FAN_OUT)
                    .param("items", List.of())
                    .template(tool("review_item").build())
                    .outputs("reviews")
                    .build();

            ExecutionResult result = run(workflow(fanOut));

            assertThat(result.getVariables().get("reviews")).isEqualTo(List.of());
        }

        @Test
        @DisplayName("Fan-out fail_fast stops dispatching after a failed item")
        void fanOutFailFast() throws Exception {
            tools.on("review[0]", ScriptedStepHandler.failing(StepErrorKind.TOOL_INVOCATION_FAILED));
            StepDefinition fanOut = StepDefinition.builder("review", StepKind.FAN_OUT)
                    .param("items", List.of(1, 2, 3))
                    .param("max_concurrent", 1)
                    .param("fail_fast", true)
                    .template(tool("review_item").build())
                    .build();

            ExecutionResult result = run(workflow(fanOut));

            StepResult review = result.getStepResult("review").orElseThrow();
            assertThat(review.getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(statuses(review.getChildren()))
                    .containsExactly(StepStatus.FAILED, StepStatus.SKIPPED, StepStatus.SKIPPED);
        }

        @Test
        @DisplayName("Fan-in concatenates strings and drops missing entries")
        void fanInConcat() throws Exception {
            StepDefinition fanIn = StepDefinition.builder("gather", StepKind.FAN_IN)
                    .param("input", "parts")
                    .param("separator", ", ")
                    .outputs("joined")
                    .build();
            WorkflowDefinition definition = WorkflowDefinition.builder("gather")
                    .variable("parts", Arrays.asList("x", null, "y"))
                    .step(fanIn)
                    .build();

            ExecutionResult result = run(definition);

            assertThat(result.getVariables()).containsEntry("joined", "x, y");
        }

        @Test
        @DisplayName("Fan-in with a provider method hands the list to the tool handler")
        void fanInViaTool() throws Exception {
            tools.on("summarize", context -> StepOutcome.of(context.getStep().getProvider().orElse("none") + ":"
                    + ((List<?>) context.getParams().get("items")).size()));
            StepDefinition fanIn = StepDefinition.builder("summarize", StepKind.FAN_IN)
                    .param("input", List.of("one", "two"))
                    .param("method", "claude_code")
                    .param("prompt", "Summarise")
                    .outputs("summary")
                    .build();

            ExecutionResult result = run(workflow(fanIn));

            assertThat(result.getVariables()).containsEntry("summary", "anthropic:2");
        }

        @Test
        @DisplayName("Map-reduce maps every item then reduces the ordered values")
        void mapReduce() throws Exception {
            StepDefinition mapReduce = StepDefinition.builder("totals", StepKind.MAP_REDUCE)
                    .param("items", List.of(1, 2, 3))
                    .param("reduce", Map.of("method", "concat", "separator", "+"))
                    .template(tool("square").param("value", "n${item}").build())
                    .outputs("total", "mapped")
                    .build();

            ExecutionResult result = run(workflow(mapReduce));

            assertThat(result.getVariables())
                    .containsEntry("total", "n1+n2+n3")
                    .containsEntry("mapped", List.of("n1", "n2", "n3"));
        }
    }

    private ExecutionResult run(WorkflowDefinition definition) throws Exception {
        return engine.execute(definition, Map.of()).get(10, TimeUnit.SECONDS);
    }

    private static WorkflowDefinition workflow(StepDefinition... steps) {
        return WorkflowDefinition.builder("groups").steps(List.of(steps)).build();
    }

    private static StepDefinition.Builder tool(String id) {
        return StepDefinition.builder(id, StepKind.TOOL_CALL);
    }

    private static List<String> ids(List<StepResult> results) {
        return results.stream().map(StepResult::getStepId).collect(Collectors.toList());
    }

    private static List<StepStatus> statuses(List<StepResult> results) {
        return results.stream().map(StepResult::getStatus).collect(Collectors.toList());
    }
}
