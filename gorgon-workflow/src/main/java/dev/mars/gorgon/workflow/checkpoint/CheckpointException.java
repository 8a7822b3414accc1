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

package dev.mars.gorgon.workflow.checkpoint;

import dev.mars.gorgon.core.exceptions.GorgonException;

/**
 * Raised when a checkpoint cannot be saved, found or read back.
 */
public class CheckpointException extends GorgonException {

    public enum Kind {
        NOT_FOUND,
        CORRUPT,
        IO
    }

    private final Kind kind;
    private final String checkpointId;

    public CheckpointException(Kind kind, String checkpointId, String message) {
        super(message);
        this.kind = kind;
        this.checkpointId = checkpointId;
    }

    public CheckpointException(Kind kind, String checkpointId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.checkpointId = checkpointId;
    }

    public static CheckpointException notFound(String checkpointId) {
        return new CheckpointException(Kind.NOT_FOUND, checkpointId, "Checkpoint not found: " + checkpointId);
    }

    public Kind getKind() {
        return kind;
    }

    public String getCheckpointId() {
        return checkpointId;
    }
}
