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
import dev.mars.gorgon.workflow.engine.StepErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class ShellCommandInvokerTest {

    private final ShellCommandInvoker invoker = new ShellCommandInvoker();

    @Test
    void capturesStdoutStderrAndExitCode() throws Exception {
        InvocationResult result = invoker.invoke(invocation(Map.of("command", "echo out; echo err 1>&2")));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getRaw()).isEqualTo("out\n");
        assertThat(result.getOutputs())
                .containsEntry("stdout", "out\n")
                .containsEntry("stderr", "err\n")
                .containsEntry("returncode", 0);
    }

    @Test
    void nonZeroExitFails() throws Exception {
        InvocationResult result = invoker.invoke(invocation(Map.of("command", "echo broken 1>&2; exit 3")));

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getError()).hasValueSatisfying(error -> assertThat(error).contains("3").contains("broken"));
        assertThat(result.getOutputs()).containsEntry("returncode", 3);
    }

    @Test
    void allowFailureKeepsNonZeroExitSuccessful() throws Exception {
        InvocationResult result = invoker.invoke(invocation(Map.of("command", "exit 2", "allow_failure", true)));

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getOutputs()).containsEntry("returncode", 2);
    }

    @Test
    void listCommandRunsWithoutShell() throws Exception {
        InvocationResult result = invoker.invoke(invocation(Map.of("command", List.of("echo", "$HOME"))));

        assertThat(result.getRaw()).isEqualTo("$HOME\n");
    }

    @Test
    void honoursWorkingDirectoryAndEnvironment(@TempDir Path directory) throws Exception {
        InvocationResult result = invoker.invoke(invocation(Map.of(
                "command", "pwd; echo $GORGON_TEST",
                "working_dir", directory.toString(),
                "env", Map.of("GORGON_TEST", "value"))));

        String stdout = (String) result.getOutputs().get("stdout");
        assertThat(stdout).contains(directory.getFileName().toString()).contains("value");
    }

    @Test
    void timeoutKillsTheProcess() {
        Invocation invocation = new Invocation("slow", StepKind.SHELL, null, Map.of("command", "sleep 10"),
                Duration.ofMillis(200), new CancellationToken());

        long started = System.nanoTime();
        assertThatThrownBy(() -> invoker.invoke(invocation))
                .isInstanceOf(StepFailureException.class)
                .satisfies(e -> assertThat(((StepFailureException) e).getKind()).isEqualTo(StepErrorKind.TIMEOUT));
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void missingCommandIsInvalid() {
        assertThatThrownBy(() -> invoker.invoke(invocation(Map.of())))
                .isInstanceOf(StepFailureException.class)
                .satisfies(e -> assertThat(((StepFailureException) e).getKind())
                        .isEqualTo(StepErrorKind.INVALID_PARAMETERS));
    }

    private static Invocation invocation(Map<String, Object> params) {
        return new Invocation("shell", StepKind.SHELL, null, params, Duration.ofSeconds(10), new CancellationToken());
    }
}
