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

package dev.mars.quill.checkpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Non-durable {@link CheckpointStore} keeping checkpoints on the heap.
 */
public class InMemoryCheckpointStore implements CheckpointStore {
    private static final Logger logger = Logger.getLogger(InMemoryCheckpointStore.class.getName());

    private final Map<String, Map<String, Checkpoint>> checkpointsByJob = new ConcurrentHashMap<>();

    @Override
    public void write(Checkpoint checkpoint) {
        checkpointsByJob.computeIfAbsent(checkpoint.getJobId(), id -> new ConcurrentHashMap<>())
                .put(checkpoint.getCheckpointId(), checkpoint);
        logger.fine("Stored checkpoint " + checkpoint.getCheckpointId());
    }

    @Override
    public List<Checkpoint> list(String jobId) {
        Map<String, Checkpoint> checkpoints = checkpointsByJob.get(jobId);
        if (checkpoints == null) {
            return List.of();
        }
        List<Checkpoint> result = new ArrayList<>(checkpoints.values());
        result.sort(Checkpoint.MOST_RECENT_FIRST);
        return result;
    }

    @Override
    public Optional<Checkpoint> find(String checkpointId) {
        for (Map<String, Checkpoint> checkpoints : checkpointsByJob.values()) {
            Checkpoint checkpoint = checkpoints.get(checkpointId);
            if (checkpoint != null) {
                return Optional.of(checkpoint);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean delete(String jobId, String checkpointId) {
        Map<String, Checkpoint> checkpoints = checkpointsByJob.get(jobId);
        return checkpoints != null && checkpoints.remove(checkpointId) != null;
    }

    public int getCheckpointCount() {
        return checkpointsByJob.values().stream().mapToInt(Map::size).sum();
    }
}
