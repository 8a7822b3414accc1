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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingEventListenerTest {

    private final Logger logger = Logger.getLogger(LoggingEventListener.class.getName());
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };
    private Level previousLevel;

    @BeforeEach
    void setUp() {
        previousLevel = logger.getLevel();
        logger.setLevel(Level.ALL);
        logger.addHandler(capture);
    }

    @AfterEach
    void tearDown() {
        logger.removeHandler(capture);
        logger.setLevel(previousLevel);
    }

    @Test
    void workflowLifecycleLoggedAtInfo() {
        LoggingEventListener listener = new LoggingEventListener();

        listener.onEvent(ExecutionEvent.builder(ExecutionEvent.Type.WORKFLOW_STARTED, "exec-1", "pr-review").build());
        listener.onEvent(ExecutionEvent.builder(ExecutionEvent.Type.WORKFLOW_FINISHED, "exec-1", "pr-review")
                .workflowStatus(WorkflowStatus.COMPLETED)
                .duration(Duration.ofMillis(1200))
                .tokensUsed(99)
                .build());

        assertThat(records).extracting(LogRecord::getLevel).containsExactly(Level.INFO, Level.INFO);
        assertThat(records.get(0).getMessage()).contains("pr-review", "exec-1");
        assertThat(records.get(1).getMessage()).contains("completed", "1200ms", "tokens=99");
    }

    @Test
    void stepFailureLoggedAsWarning() {
        new LoggingEventListener().onEvent(ExecutionEvent.builder(ExecutionEvent.Type.STEP_FINISHED, "exec-1", "pr-review")
                .step("review", StepKind.TOOL_CALL)
                .stepStatus(StepStatus.FAILED)
                .errorKind("TIMEOUT")
                .message("exceeded 30s")
                .build());

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.getLevel()).isEqualTo(Level.WARNING);
            assertThat(record.getMessage()).contains("review", "TIMEOUT", "exceeded 30s");
        });
    }
}
