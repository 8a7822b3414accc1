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

import dev.mars.gorgon.workflow.engine.StepStatus;
import dev.mars.gorgon.workflow.engine.WorkflowStatus;

import java.util.logging.Logger;

/**
 * Writes execution events to {@code java.util.logging}.
 */
public class LoggingEventListener implements ExecutionEventListener {

    private static final Logger logger = Logger.getLogger(LoggingEventListener.class.getName());

    @Override
    public void onEvent(ExecutionEvent event) {
        String step = event.getStepId().orElse("");
        switch (event.getType()) {
            case WORKFLOW_STARTED:
                logger.info("Workflow " + event.getWorkflowId() + " started (execution " + event.getExecutionId() + ")");
                break;
            case STEP_STARTED:
                logger.fine("Step " + step + " started (attempt " + (event.getAttempt() + 1) + ")");
                break;
            case STEP_RETRYING:
                logger.warning("Step " + step + " retrying after attempt " + (event.getAttempt() + 1) + ": "
                        + event.getErrorKind().orElse("") + " " + event.getMessage().orElse(""));
                break;
            case STEP_THROTTLED:
                logger.warning("Step " + step + " was rate limited: " + event.getMessage().orElse(""));
                break;
            case STEP_FINISHED:
                if (event.getStepStatus().orElse(null) == StepStatus.FAILED) {
                    logger.warning("Step " + step + " failed: " + event.getErrorKind().orElse("") + " "
                            + event.getMessage().orElse(""));
                } else {
                    logger.fine("Step " + step + " finished " + event.getStepStatus().map(StepStatus::getValue).orElse("")
                            + " in " + event.getDuration().map(d -> d.toMillis() + "ms").orElse("?")
                            + ", tokens=" + event.getTokensUsed());
                }
                break;
            case WORKFLOW_FINISHED:
                logger.info("Workflow " + event.getWorkflowId() + " finished "
                        + event.getWorkflowStatus().map(WorkflowStatus::getValue).orElse("")
                        + " in " + event.getDuration().map(d -> d.toMillis() + "ms").orElse("?")
                        + ", tokens=" + event.getTokensUsed());
                break;
            default:
                break;
        }
    }
}
