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
import dev.mars.gorgon.workflow.ConditionSpec;
import dev.mars.gorgon.workflow.FailurePolicy;
import dev.mars.gorgon.workflow.GraphException;
import dev.mars.gorgon.workflow.InputSpec;
import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.StepKind;
import dev.mars.gorgon.workflow.WorkflowDefinition;
import dev.mars.gorgon.workflow.checkpoint.Checkpoint;
import dev.mars.gorgon.workflow.checkpoint.CheckpointException;
import dev.mars.gorgon.workflow.checkpoint.InMemoryCheckpointStore;
import dev.mars.gorgon.workflow.executor.StepExecutorRegistry;
import dev.mars.gorgon.workflow.executor.StepFailureException;
import dev.mars.gorgon.workflow.executor.StepOutcome;
import dev.mars.gorgon.workflow.observability.ExecutionEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link DefaultWorkflowEngine} scheduling, failure policies, limits and checkpoints.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-10
 * @version 1.0
 */
class DefaultWorkflowEngineTest {

    private ScriptedStepHandler tools;
    private InMemoryCheckpointStore checkpointStore;
    private DefaultWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty(GorgonConfiguration.METRICS_ENABLED, "false");
        properties.setProperty(GorgonConfiguration.RETRY_BASE_DELAY_MS, "10");
        properties.setProperty(GorgonConfiguration.RETRY_MAX_DELAY_MS, "50");

        tools = new ScriptedStepHandler();
        StepExecutorRegistry registry = StepExecutorRegistry.withDefaults(null, null)
                .register(StepKind.TOOL_CALL, tools);
        checkpointStore = new InMemoryCheckpointStore();
        engine = new DefaultWorkflowEngine(registry, checkpointStore, new GorgonConfiguration(properties));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Nested
    @DisplayName("Scheduling")
    class Scheduling {

        @Test
        @DisplayName("Outputs of one step feed the templates of its dependents")
        void outputsFlowToDependents() throws Exception {
            WorkflowDefinition definition = workflow(
                    tool("greet").param("value", "hello").outputs("greeting").build(),
                    tool("shout").param("value", "${greeting} world").outputs("message").dependsOn("greet").build());

            ExecutionResult result = run(definition);

            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(result.isSuccessful()).isTrue();
            assertThat(result.getVariables()).containsEntry("message", "hello world");
            assertThat(stepIds(result)).containsExactly("greet", "shout");
        }

        @Test
        @DisplayName("A step with two dependencies starts only after both finish")
        void joinWaitsForAllDependencies() throws Exception {
            tools.on("a", ScriptedStepHandler.sleeping(150, "a"))
                    .on("b", ScriptedStepHandler.sleeping(50, "b"));
            WorkflowDefinition definition = workflow(
                    tool("a").build(),
                    tool("b").build(),
                    tool("c").dependsOn("a", "b").build());

            ExecutionResult result = run(definition);

            Instant cStarted = result.getStepResult("c").orElseThrow().getStartedAt();
            assertThat(cStarted).isAfterOrEqualTo(result.getStepResult("a").orElseThrow().getEndedAt());
            assertThat(cStarted).isAfterOrEqualTo(result.getStepResult("b").orElseThrow().getEndedAt());
        }

        @Test
        @DisplayName("Independent steps of a layer run concurrently")
        void layerRunsConcurrently() throws Exception {
            CountDownLatch bothStarted = new CountDownLatch(2);
            tools.on("a", context -> {
                bothStarted.countDown();
                return StepOutcome.of(bothStarted.await(5, TimeUnit.SECONDS));
            }).on("b", context -> {
                bothStarted.countDown();
                return StepOutcome.of(bothStarted.await(5, TimeUnit.SECONDS));
            });
            WorkflowDefinition definition = workflow(
                    tool("a").outputs("a_saw_b").build(),
                    tool("b").outputs("b_saw_a").build());

            ExecutionResult result = run(definition);

            assertThat(result.getVariables()).containsEntry("a_saw_b", true).containsEntry("b_saw_a", true);
        }

        @Test
        @DisplayName("Same-layer steps writing the same name: the later-declared step wins")
        void laterDeclaredOutputWins() throws Exception {
            tools.on("first", ScriptedStepHandler.sleeping(100, "from first"));
            WorkflowDefinition definition = workflow(
                    tool("first").outputs("summary").build(),
                    tool("second").param("value", "from second").outputs("summary").build());

            ExecutionResult result = run(definition);

            assertThat(result.getVariables()).containsEntry("summary", "from second");
        }

        @Test
        @DisplayName("Declared workflow outputs are copied into the result")
        void collectsWorkflowOutputs() throws Exception {
            WorkflowDefinition definition = WorkflowDefinition.builder("outputs")
                    .output("verdict")
                    .output("never_set")
                    .step(tool("decide").param("value", "approve").outputs("verdict").build())
                    .build();

            ExecutionResult result = run(definition);

            assertThat(result.getOutputs()).containsExactly(Map.entry("verdict", "approve"));
        }

        @Test
        @DisplayName("Cyclic definitions are rejected before anything runs")
        void cycleRejected() {
            WorkflowDefinition definition = workflow(
                    tool("a").dependsOn("b").build(),
                    tool("b").dependsOn("a").build());

            assertThatThrownBy(() -> engine.execute(definition, Map.of()))
                    .isInstanceOf(GraphException.class);
            assertThat(tools.order()).isEmpty();
        }

        @Test
        @DisplayName("A step kind with no registered handler fails the step")
        void unknownKindFails() throws Exception {
            DefaultWorkflowEngine bare = new DefaultWorkflowEngine(StepExecutorRegistry.withDefaults(null, null),
                    new InMemoryCheckpointStore(), new GorgonConfiguration(new Properties()));
            try {
                ExecutionResult result = bare.execute(workflow(tool("a").build()), Map.of())
                        .get(5, TimeUnit.SECONDS);

                assertThat(result.getStepResult("a").orElseThrow().getError().getKind())
                        .isEqualTo(StepErrorKind.UNKNOWN_STEP_KIND);
                assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            } finally {
                bare.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("Failure policies")
    class FailurePolicies {

        @Test
        @DisplayName("A retryable failure is retried until it succeeds")
        void retryThenSucceed() throws Exception {
            AtomicInteger attempts = new AtomicInteger();
            tools.on("flaky", context -> {
                if (attempts.incrementAndGet() <= 2) {
                    throw new StepFailureException(
                            StepErrorKind.TOOL_INVOCATION_FAILED, "transient");
                }
                return StepOutcome.of("ok");
            });
            WorkflowDefinition definition = workflow(
                    tool("flaky").onFailure(FailurePolicy.RETRY).maxRetries(3).outputs("out").build());

            ExecutionResult result = run(definition);

            StepResult flaky = result.getStepResult("flaky").orElseThrow();
            assertThat(flaky.getStatus()).isEqualTo(StepStatus.SUCCEEDED);
            assertThat(flaky.getRetryCount()).isEqualTo(2);
            assertThat(result.getVariables()).containsEntry("out", "ok");
        }

        @Test
        @DisplayName("Exhausted retries abort the workflow and skip dependents")
        void exhaustedRetriesAbort() throws Exception {
            tools.on("flaky", ScriptedStepHandler.failing(StepErrorKind.TOOL_INVOCATION_FAILED));
            WorkflowDefinition definition = workflow(
                    tool("flaky").onFailure(FailurePolicy.RETRY).maxRetries(1).build(),
                    tool("after").dependsOn("flaky").build());

            ExecutionResult result = run(definition);

            assertThat(tools.invocations("flaky")).isEqualTo(2);
            assertThat(result.getStepResult("flaky").orElseThrow().getRetryCount()).isEqualTo(1);
            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(result.getError().orElseThrow().getKind()).isEqualTo(WorkflowErrorKind.ABORTED_BY_POLICY);
            assertThat(result.getStepResult("after").orElseThrow().getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(tools.invocations("after")).isZero();
        }

        @Test
        @DisplayName("Unresolved template variables fail without retrying")
        void templateFailureIsNotRetried() throws Exception {
            WorkflowDefinition definition = workflow(
                    tool("a").param("value", "${missing}").maxRetries(3).build());

            ExecutionResult result = run(definition);

            StepResult a = result.getStepResult("a").orElseThrow();
            assertThat(a.getError().getKind()).isEqualTo(StepErrorKind.TEMPLATE_RESOLUTION_FAILED);
            assertThat(a.getError().getMessage()).contains("missing");
            assertThat(a.getRetryCount()).isZero();
            assertThat(tools.invocations("a")).isZero();
        }

        @Test
        @DisplayName("Optional variables resolve to empty instead of failing")
        void optionalVariables() throws Exception {
            WorkflowDefinition definition = workflow(
                    tool("a").param("value", "notes:${notes}").optionalVariables("notes").outputs("out").build());

            ExecutionResult result = run(definition);

            assertThat(result.getVariables()).containsEntry("out", "notes:");
        }

        @Test
        @DisplayName("Skip policy records the failure and lets dependents run")
        void skipPolicyContinues() throws Exception {
            tools.on("optional", ScriptedStepHandler.failing(StepErrorKind.TOOL_INVOCATION_FAILED));
            WorkflowDefinition definition = workflow(
                    tool("optional").onFailure(FailurePolicy.SKIP).outputs("extra").build(),
                    tool("next").param("value", "done").dependsOn("optional").outputs("out").build());

            ExecutionResult result = run(definition);

            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(result.getStepResult("optional").orElseThrow().getStatus()).isEqualTo(StepStatus.FAILED);
            assertThat(result.getVariables()).containsEntry("out", "done").doesNotContainKey("extra");
        }

        @Test
        @DisplayName("Abort skips same-layer steps that have not started")
        void abortSkipsUnstartedSiblings() throws Exception {
            tools.on("broken", ScriptedStepHandler.failing(StepErrorKind.TOOL_INVOCATION_FAILED));
            WorkflowDefinition definition = workflow(
                    tool("broken").build(),
                    tool("sibling").build());
            ExecutionOptions options = ExecutionOptions.builder().maxConcurrency(1).build();

            ExecutionResult result = engine.execute(definition, Map.of(), options).get(5, TimeUnit.SECONDS);

            StepResult sibling = result.getStepResult("sibling").orElseThrow();
            assertThat(sibling.getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(sibling.getError().getKind()).isEqualTo(StepErrorKind.CANCELLED);
            assertThat(tools.invocations("sibling")).isZero();
        }

        @Test
        @DisplayName("A step exceeding its timeout fails with TIMEOUT")
        void stepTimeout() throws Exception {
            tools.on("slow", ScriptedStepHandler.sleeping(5_000, "too late"));
            WorkflowDefinition definition = workflow(tool("slow").timeout(Duration.ofMillis(100)).build());

            long started = System.nanoTime();
            ExecutionResult result = run(definition);

            StepResult slow = result.getStepResult("slow").orElseThrow();
            assertThat(slow.getError().getKind()).isEqualTo(StepErrorKind.TIMEOUT);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(3));
            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("Inputs and limits")
    class InputsAndLimits {

        @Test
        @DisplayName("A missing required input fails the run before any step")
        void missingRequiredInput() throws Exception {
            WorkflowDefinition definition = WorkflowDefinition.builder("needs-input")
                    .input(InputSpec.required("repo"))
                    .step(tool("a").param("value", "${repo}").build())
                    .build();

            ExecutionResult result = run(definition);

            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(result.getError().orElseThrow().getKind()).isEqualTo(WorkflowErrorKind.MISSING_INPUT);
            assertThat(result.getError().orElseThrow().getMessage()).contains("repo");
            assertThat(result.getStepResult("a").orElseThrow().getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(tools.invocations("a")).isZero();
        }

        @Test
        @DisplayName("Supplied inputs and defaults are bound before the first step")
        void inputsAndDefaults() throws Exception {
            WorkflowDefinition definition = WorkflowDefinition.builder("with-inputs")
                    .input(InputSpec.required("repo"))
                    .input(InputSpec.optional("branch", "main"))
                    .step(tool("a").param("value", "${repo}@${branch}").outputs("ref").build())
                    .build();

            ExecutionResult result = engine.execute(definition, Map.of("repo", "gorgon"))
                    .get(5, TimeUnit.SECONDS);

            assertThat(result.getVariables()).containsEntry("ref", "gorgon@main");
        }

        @Test
        @DisplayName("Token usage is summed and an exhausted budget stops the next layer")
        void tokenBudget() throws Exception {
            tools.on("expensive", context -> StepOutcome.builder().primary("x").tokensUsed(150).build());
            WorkflowDefinition definition = WorkflowDefinition.builder("budgeted")
                    .tokenBudget(100L)
                    .step(tool("expensive").build())
                    .step(tool("next").dependsOn("expensive").build())
                    .build();

            ExecutionResult result = run(definition);

            assertThat(result.getTotalTokens()).isEqualTo(150);
            assertThat(result.getError().orElseThrow().getKind()).isEqualTo(WorkflowErrorKind.BUDGET_EXCEEDED);
            assertThat(result.getStepResult("next").orElseThrow().getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(tools.invocations("next")).isZero();
        }

        @Test
        @DisplayName("Tokens reported as a tokens_used output are counted")
        void tokensFromOutputs() throws Exception {
            tools.on("a", context -> StepOutcome.builder().primary("x").output("tokens_used", 42).build());

            ExecutionResult result = run(workflow(tool("a").build()));

            assertThat(result.getStepResult("a").orElseThrow().getTokensUsed()).isEqualTo(42);
            assertThat(result.getTotalTokens()).isEqualTo(42);
        }

        @Test
        @DisplayName("The workflow timeout stops dispatch at the next layer boundary")
        void globalTimeout() throws Exception {
            tools.on("slow", ScriptedStepHandler.sleeping(300, "done"));
            WorkflowDefinition definition = WorkflowDefinition.builder("timed")
                    .timeout(Duration.ofMillis(100))
                    .step(tool("slow").build())
                    .step(tool("next").dependsOn("slow").build())
                    .build();

            ExecutionResult result = run(definition);

            assertThat(result.getStepResult("slow").orElseThrow().getStatus()).isEqualTo(StepStatus.SUCCEEDED);
            assertThat(result.getError().orElseThrow().getKind())
                    .isEqualTo(WorkflowErrorKind.GLOBAL_TIMEOUT_EXCEEDED);
            assertThat(tools.invocations("next")).isZero();
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @DisplayName("Only the selected branch runs; the other and its dependents are skipped")
        void branchSelection() throws Exception {
            WorkflowDefinition definition = WorkflowDefinition.builder("branching")
                    .variable("score", 8)
                    .step(StepDefinition.builder("check", StepKind.CONDITION)
                            .param("field", "score")
                            .param("operator", "greater_than")
                            .param("value", 5)
                            .param("true_step", "high")
                            .param("false_step", "low")
                            .build())
                    .step(tool("high").build())
                    .step(tool("low").build())
                    .step(tool("after_low").dependsOn("low").build())
                    .build();

            ExecutionResult result = run(definition);

            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(result.getStepResult("high").orElseThrow().getStatus()).isEqualTo(StepStatus.SUCCEEDED);
            StepResult low = result.getStepResult("low").orElseThrow();
            assertThat(low.getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(low.getError().getKind()).isEqualTo(StepErrorKind.BRANCH_NOT_TAKEN);
            assertThat(result.getStepResult("after_low").orElseThrow().getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(tools.invocations("low")).isZero();
            assertThat(tools.invocations("after_low")).isZero();
        }

        @Test
        @DisplayName("A false step guard skips the step without invoking it")
        void guardSkips() throws Exception {
            WorkflowDefinition definition = WorkflowDefinition.builder("guarded")
                    .variable("enabled", false)
                    .step(tool("maybe")
                            .condition(new ConditionSpec("enabled", ConditionSpec.Operator.EQUALS, true))
                            .build())
                    .build();

            ExecutionResult result = run(definition);

            StepResult maybe = result.getStepResult("maybe").orElseThrow();
            assertThat(maybe.getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(maybe.getError().getKind()).isEqualTo(StepErrorKind.CONDITION_NOT_MET);
            assertThat(tools.invocations("maybe")).isZero();
        }
    }

    @Nested
    @DisplayName("Checkpoints, pause and cancel")
    class Lifecycle {

        private WorkflowDefinition checkpointed() {
            return workflow(
                    tool("draft").param("value", "v1").outputs("draft").build(),
                    StepDefinition.builder("review_gate", StepKind.CHECKPOINT).dependsOn("draft").build(),
                    tool("publish").param("value", "${draft}-published").outputs("published")
                            .dependsOn("review_gate").build());
        }

        @Test
        @DisplayName("A checkpoint step pauses the run and resuming finishes it")
        void pauseAtCheckpointAndResume() throws Exception {
            WorkflowDefinition definition = checkpointed();

            ExecutionResult paused = run(definition);

            assertThat(paused.getStatus()).isEqualTo(WorkflowStatus.PAUSED);
            assertThat(paused.getStepResult("publish").orElseThrow().getStatus()).isEqualTo(StepStatus.PENDING);
            String checkpointId = paused.getCheckpointId().orElseThrow();
            Checkpoint checkpoint = checkpointStore.load(checkpointId);
            assertThat(checkpoint.getCompletedStepIds()).containsExactly("draft", "review_gate");
            assertThat(checkpoint.getFrontier()).containsExactly("publish");
            assertThat(checkpoint.getContext()).containsEntry("draft", "v1");

            ExecutionResult resumed = engine.resume(checkpointId, definition).get(5, TimeUnit.SECONDS);

            assertThat(resumed.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(resumed.getExecutionId()).isEqualTo(paused.getExecutionId());
            assertThat(resumed.getVariables()).containsEntry("published", "v1-published");
            assertThat(tools.invocations("draft")).isEqualTo(1);
            assertThat(checkpointStore.listCheckpointIds()).doesNotContain(checkpointId);
        }

        @Test
        @DisplayName("A resumed run ends like an uninterrupted one")
        void resumedRunMatchesUninterrupted() throws Exception {
            WorkflowDefinition definition = checkpointed();
            ExecutionResult straight = engine.execute(definition, Map.of(),
                    ExecutionOptions.builder().pauseAtCheckpoints(false).build()).get(5, TimeUnit.SECONDS);

            ExecutionResult paused = run(definition);
            ExecutionResult resumed = engine.resume(checkpointStore.load(paused.getCheckpointId().orElseThrow()),
                    definition).get(5, TimeUnit.SECONDS);

            assertThat(straight.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(resumed.getVariables()).isEqualTo(straight.getVariables());
            assertThat(statuses(resumed)).isEqualTo(statuses(straight));
        }

        @Test
        @DisplayName("Resuming from an unknown checkpoint reports CHECKPOINT_CORRUPT")
        void unknownCheckpoint() throws Exception {
            ExecutionResult result = engine.resume("no-such-checkpoint", checkpointed()).get(5, TimeUnit.SECONDS);

            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(result.getError().orElseThrow().getKind()).isEqualTo(WorkflowErrorKind.CHECKPOINT_CORRUPT);
        }

        @Test
        @DisplayName("A checkpoint inside a parallel group is rejected before anything runs")
        void nestedCheckpointRejected() {
            WorkflowDefinition definition = workflow(
                    StepDefinition.builder("review", StepKind.PARALLEL)
                            .steps(List.of(
                                    tool("draft").build(),
                                    StepDefinition.builder("gate", StepKind.CHECKPOINT).build()))
                            .build());

            assertThatThrownBy(() -> engine.execute(definition, Map.of()))
                    .isInstanceOf(GraphException.class)
                    .satisfies(e -> assertThat(((GraphException) e).getKind())
                            .isEqualTo(GraphException.Kind.MISPLACED_CHECKPOINT));
            assertThat(tools.order()).isEmpty();
            assertThat(checkpointStore.listCheckpointIds()).isEmpty();
        }

        @Test
        @DisplayName("A checkpoint from another workflow is rejected")
        void checkpointFromOtherWorkflow() {
            Checkpoint foreign = Checkpoint.builder()
                    .executionId("exec-1")
                    .workflowId("other")
                    .build();

            assertThatThrownBy(() -> engine.resume(foreign, checkpointed()))
                    .isInstanceOf(CheckpointException.class)
                    .hasMessageContaining("other");
        }

        @Test
        @DisplayName("An explicit pause takes effect at the next layer boundary")
        void explicitPause() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            tools.on("first", context -> {
                release.await(5, TimeUnit.SECONDS);
                return StepOutcome.of("done");
            });
            WorkflowDefinition definition = workflow(
                    tool("first").build(),
                    tool("second").dependsOn("first").build());

            CompletableFuture<ExecutionResult> future = engine.execute(definition, Map.of(),
                    ExecutionOptions.builder().executionId("exec-pause").build());
            await().atMost(Duration.ofSeconds(5)).until(() -> tools.invocations("first") == 1);
            assertThat(engine.getStatus("exec-pause")).contains(WorkflowStatus.RUNNING);

            assertThat(engine.pause("exec-pause")).isTrue();
            release.countDown();
            ExecutionResult result = future.get(5, TimeUnit.SECONDS);

            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.PAUSED);
            assertThat(result.getStepResult("first").orElseThrow().getStatus()).isEqualTo(StepStatus.SUCCEEDED);
            assertThat(result.getStepResult("second").orElseThrow().getStatus()).isEqualTo(StepStatus.PENDING);
            assertThat(tools.invocations("second")).isZero();
            assertThat(engine.getStatus("exec-pause")).isEmpty();
        }

        @Test
        @DisplayName("Cancel signals the running step and discards its late result")
        void cancelRunningExecution() throws Exception {
            tools.on("waiting", ScriptedStepHandler.waitingForCancel());
            WorkflowDefinition definition = workflow(
                    tool("waiting").outputs("late").build(),
                    tool("never").dependsOn("waiting").build());

            CompletableFuture<ExecutionResult> future = engine.execute(definition, Map.of(),
                    ExecutionOptions.builder().executionId("exec-cancel").build());
            await().atMost(Duration.ofSeconds(5)).until(() -> tools.invocations("waiting") == 1);

            assertThat(engine.cancel("exec-cancel")).isTrue();
            ExecutionResult result = future.get(5, TimeUnit.SECONDS);

            assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
            assertThat(result.getError().orElseThrow().getKind()).isEqualTo(WorkflowErrorKind.CANCELLED);
            assertThat(result.getStepResult("waiting").orElseThrow().getError().getKind())
                    .isEqualTo(StepErrorKind.CANCELLED);
            assertThat(result.getVariables()).doesNotContainKey("late");
            assertThat(result.getStepResult("never").orElseThrow().getStatus()).isEqualTo(StepStatus.SKIPPED);
        }

        @Test
        @DisplayName("Pause and cancel of unknown executions report false")
        void unknownExecution() {
            assertThat(engine.pause("nope")).isFalse();
            assertThat(engine.cancel("nope")).isFalse();
            assertThat(engine.getStatus("nope")).isEqualTo(Optional.empty());
        }
    }

    @Nested
    @DisplayName("Events and shutdown")
    class EventsAndShutdown {

        @Test
        @DisplayName("Listeners see the workflow and step lifecycle in order")
        void lifecycleEvents() throws Exception {
            List<ExecutionEvent> events = new CopyOnWriteArrayList<>();
            engine.addListener(events::add);

            run(workflow(tool("a").build()));

            await().atMost(Duration.ofSeconds(5)).until(() -> events.stream()
                    .anyMatch(event -> event.getType() == ExecutionEvent.Type.WORKFLOW_FINISHED));
            assertThat(events).extracting(ExecutionEvent::getType).containsExactly(
                    ExecutionEvent.Type.WORKFLOW_STARTED,
                    ExecutionEvent.Type.STEP_STARTED,
                    ExecutionEvent.Type.STEP_FINISHED,
                    ExecutionEvent.Type.WORKFLOW_FINISHED);
            assertThat(events.get(2).getStepStatus()).contains(StepStatus.SUCCEEDED);
            assertThat(events.get(3).getWorkflowStatus()).contains(WorkflowStatus.COMPLETED);
        }

        @Test
        @DisplayName("Retries are announced before each new attempt")
        void retryEvents() throws Exception {
            List<ExecutionEvent> events = new CopyOnWriteArrayList<>();
            engine.addListener(events::add);
            tools.on("flaky", ScriptedStepHandler.failing(StepErrorKind.TOOL_INVOCATION_FAILED));

            run(workflow(tool("flaky").maxRetries(2).build()));

            await().atMost(Duration.ofSeconds(5)).until(() -> events.stream()
                    .filter(event -> event.getType() == ExecutionEvent.Type.STEP_RETRYING).count() == 2);
        }

        @Test
        @DisplayName("A shut-down engine refuses new executions")
        void refusesAfterShutdown() throws Exception {
            engine.shutdown();

            CompletableFuture<ExecutionResult> future = engine.execute(workflow(tool("a").build()), Map.of());

            assertThat(future).isCompletedExceptionally();
        }
    }

    private ExecutionResult run(WorkflowDefinition definition) throws Exception {
        return engine.execute(definition, Map.of()).get(10, TimeUnit.SECONDS);
    }

    private static WorkflowDefinition workflow(StepDefinition... steps) {
        return WorkflowDefinition.builder("test-workflow").steps(List.of(steps)).build();
    }

    private static StepDefinition.Builder tool(String id) {
        return StepDefinition.builder(id, StepKind.TOOL_CALL);
    }

    private static List<String> stepIds(ExecutionResult result) {
        return result.getSteps().stream().map(StepResult::getStepId).collect(Collectors.toList());
    }

    private static Map<String, StepStatus> statuses(ExecutionResult result) {
        return result.getSteps().stream().collect(Collectors.toMap(StepResult::getStepId, StepResult::getStatus));
    }
}
