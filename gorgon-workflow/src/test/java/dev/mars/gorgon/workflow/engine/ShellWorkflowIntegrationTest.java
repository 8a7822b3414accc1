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
import dev.mars.gorgon.workflow.WorkflowDefinition;
import dev.mars.gorgon.workflow.YamlWorkflowDefinitionParser;
import dev.mars.gorgon.workflow.checkpoint.FileCheckpointStore;
import dev.mars.gorgon.workflow.executor.StepExecutorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs YAML workflows made of real shell steps through the default handlers.
 */
@DisabledOnOs(OS.WINDOWS)
class ShellWorkflowIntegrationTest {

    private static final String BRANCHING = String.join("\n",
            "id: count-files",
            "inputs:",
            "  expected:",
            "    default: '3'",
            "outputs: [verdict]",
            "steps:",
            "  - id: count",
            "    type: shell",
            "    params:",
            "      command: printf 3",
            "    outputs: [count_out]",
            "  - id: check",
            "    type: condition",
            "    depends_on: count",
            "    params:",
            "      field: count_out",
            "      operator: equals",
            "      value: ${expected}",
            "      true_step: matched",
            "      false_step: mismatched",
            "  - id: matched",
            "    type: shell",
            "    params:",
            "      command: printf matched-${count_out}",
            "    outputs: [verdict]",
            "  - id: mismatched",
            "    type: shell",
            "    params:",
            "      command: printf mismatched",
            "    outputs: [verdict]");

    @TempDir
    Path directory;

    private DefaultWorkflowEngine engine;
    private final YamlWorkflowDefinitionParser parser = new YamlWorkflowDefinitionParser();

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty(GorgonConfiguration.METRICS_ENABLED, "false");
        properties.setProperty(GorgonConfiguration.CHECKPOINT_DIR, directory.toString());
        GorgonConfiguration configuration = new GorgonConfiguration(properties);
        engine = new DefaultWorkflowEngine(StepExecutorRegistry.withDefaults(null, null),
                new FileCheckpointStore(configuration), configuration);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    void shellOutputDrivesConditionBranch() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(BRANCHING);

        ExecutionResult result = engine.execute(definition, Map.of()).get(30, TimeUnit.SECONDS);

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        assertThat(result.getOutputs()).containsEntry("verdict", "matched-3");
        assertThat(result.getStepResult("mismatched")).hasValueSatisfying(step -> {
            assertThat(step.getStatus()).isEqualTo(StepStatus.SKIPPED);
            assertThat(step.getError().getKind()).isEqualTo(StepErrorKind.BRANCH_NOT_TAKEN);
        });
        assertThat(result.getStepResult("count")).hasValueSatisfying(step ->
                assertThat(step.getOutputs()).containsEntry("returncode", 0));
    }

    @Test
    void otherBranchRunsWhenInputDiffers() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(BRANCHING);

        ExecutionResult result = engine.execute(definition, Map.of("expected", "4")).get(30, TimeUnit.SECONDS);

        assertThat(result.getOutputs()).containsEntry("verdict", "mismatched");
        assertThat(result.getStepResult("matched").map(StepResult::getStatus)).contains(StepStatus.SKIPPED);
    }

    @Test
    void failingCommandAbortsWorkflow() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(String.join("\n",
                "id: broken",
                "steps:",
                "  - id: fail",
                "    type: shell",
                "    params:",
                "      command: exit 7",
                "  - id: after",
                "    type: shell",
                "    depends_on: fail",
                "    params:",
                "      command: printf never"));

        ExecutionResult result = engine.execute(definition, Map.of()).get(30, TimeUnit.SECONDS);

        assertThat(result.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(result.getError()).hasValueSatisfying(error ->
                assertThat(error.getKind()).isEqualTo(WorkflowErrorKind.ABORTED_BY_POLICY));
        assertThat(result.getStepResult("fail")).hasValueSatisfying(step ->
                assertThat(step.getError().getKind()).isEqualTo(StepErrorKind.TOOL_INVOCATION_FAILED));
        assertThat(result.getStepResult("after").map(StepResult::getStatus)).contains(StepStatus.SKIPPED);
        new ExecutionResultWriter().write(result, directory.resolve("results/broken.json"));
    }
}
