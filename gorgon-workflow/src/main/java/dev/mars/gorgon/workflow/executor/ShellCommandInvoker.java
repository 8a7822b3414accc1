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

import dev.mars.gorgon.workflow.engine.StepErrorKind;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs shell commands with {@link ProcessBuilder}.
 * <p>
 * Parameters: {@code command} (a string run through {@code sh -c}, or a list of arguments),
 * optional {@code working_dir}, {@code env} and {@code allow_failure}. Outputs are
 * {@code stdout}, {@code stderr} and {@code returncode}; the raw result is stdout.
 */
public class ShellCommandInvoker implements StepInvoker {

    private static final Logger logger = Logger.getLogger(ShellCommandInvoker.class.getName());

    private final List<String> shell;

    public ShellCommandInvoker() {
        this(List.of("sh", "-c"));
    }

    /**
     * @param shell interpreter prefix used for string commands
     */
    public ShellCommandInvoker(List<String> shell) {
        this.shell = List.copyOf(shell);
    }

    @Override
    public InvocationResult invoke(Invocation invocation) throws InterruptedException {
        List<String> command = toCommand(invocation);
        ProcessBuilder builder = new ProcessBuilder(command);
        Object workingDir = invocation.getParams().get("working_dir");
        if (workingDir != null && !workingDir.toString().isBlank()) {
            builder.directory(new File(workingDir.toString()));
        }
        Object env = invocation.getParams().get("env");
        if (env instanceof Map) {
            ((Map<?, ?>) env).forEach((key, value) ->
                    builder.environment().put(String.valueOf(key), value != null ? value.toString() : ""));
        }

        logger.fine("Running shell step " + invocation.getStepId() + ": " + command);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new StepFailureException(StepErrorKind.TOOL_INVOCATION_FAILED,
                    "Failed to start command for step '" + invocation.getStepId() + "': " + e.getMessage(), e);
        }
        invocation.getCancellationToken().onCancel(process::destroy);

        StreamCollector stdout = new StreamCollector(process.getInputStream(), invocation.getStepId() + "-stdout");
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), invocation.getStepId() + "-stderr");
        stdout.start();
        stderr.start();

        try {
            boolean finished = process.waitFor(invocation.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new StepFailureException(StepErrorKind.TIMEOUT,
                        "Command for step '" + invocation.getStepId() + "' exceeded timeout of " + invocation.getTimeout());
            }
            stdout.join();
            stderr.join();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        int exitCode = process.exitValue();
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("stdout", stdout.getText());
        outputs.put("stderr", stderr.getText());
        outputs.put("returncode", exitCode);

        boolean allowFailure = Boolean.parseBoolean(String.valueOf(invocation.getParams().get("allow_failure")));
        if (exitCode != 0 && !allowFailure) {
            return InvocationResult.failure("Command failed with code " + exitCode + ": " + stderr.getText().trim(), outputs);
        }
        return InvocationResult.success(stdout.getText(), outputs);
    }

    private List<String> toCommand(Invocation invocation) {
        Object command = invocation.getParams().get("command");
        if (command instanceof List) {
            List<String> args = new ArrayList<>();
            ((List<?>) command).forEach(arg -> args.add(String.valueOf(arg)));
            if (!args.isEmpty()) {
                return args;
            }
        } else if (command != null && !command.toString().isBlank()) {
            List<String> args = new ArrayList<>(shell);
            args.add(command.toString());
            return args;
        }
        throw new StepFailureException(StepErrorKind.INVALID_PARAMETERS,
                "Shell step '" + invocation.getStepId() + "' requires a 'command' parameter");
    }

    private static final class StreamCollector extends Thread {
        private final InputStream input;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        StreamCollector(InputStream input, String name) {
            super(name);
            this.input = input;
            setDaemon(true);
        }

        @Override
        public void run() {
            try (InputStream in = input) {
                in.transferTo(buffer);
            } catch (IOException e) {
                logger.log(Level.FINE, "Stream " + getName() + " closed early", e);
            }
        }

        String getText() {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
