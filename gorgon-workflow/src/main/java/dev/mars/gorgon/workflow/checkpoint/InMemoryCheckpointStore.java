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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoint store for a single process; checkpoints do not survive a restart.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public String save(Checkpoint checkpoint) {
        checkpoints.put(checkpoint.getCheckpointId(), checkpoint);
        return checkpoint.getCheckpointId();
    }

    @Override
    public Checkpoint load(String checkpointId) throws CheckpointException {
        Checkpoint checkpoint = checkpoints.get(checkpointId);
        if (checkpoint == null) {
            throw CheckpointException.notFound(checkpointId);
        }
        return checkpoint;
    }

    @Override
    public boolean delete(String checkpointId) {
        return checkpoints.remove(checkpointId) != null;
    }

    @Override
    public List<String> listCheckpointIds() {
        return new ArrayList<>(checkpoints.keySet());
    }
}
