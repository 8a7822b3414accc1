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

import java.util.List;

/**
 * Persistence for paused executions.
 */
public interface CheckpointStore {

    /**
     * Saves a checkpoint, replacing any with the same id.
     *
     * @return the checkpoint id
     */
    String save(Checkpoint checkpoint) throws CheckpointException;

    /**
     * @throws CheckpointException with kind NOT_FOUND if no such checkpoint exists, or
     *         CORRUPT if it cannot be read back
     */
    Checkpoint load(String checkpointId) throws CheckpointException;

    /**
     * @return true if a checkpoint was removed
     */
    boolean delete(String checkpointId) throws CheckpointException;

    List<String> listCheckpointIds() throws CheckpointException;
}
