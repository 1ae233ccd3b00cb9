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

import dev.mars.quill.core.exceptions.CheckpointStorageException;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for checkpoints, one location per job.
 *
 * <p>Writes are all-or-nothing: a checkpoint is either fully readable through
 * {@link #list} and {@link #find}, or not visible at all.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface CheckpointStore {

    /**
     * Persists a checkpoint atomically.
     *
     * @param checkpoint the checkpoint to write
     * @throws CheckpointStorageException if the write did not complete
     */
    void write(Checkpoint checkpoint) throws CheckpointStorageException;

    /**
     * Lists a job's checkpoints, most recent first.
     *
     * @param jobId the job identifier
     * @return the checkpoints, empty if the job has none
     * @throws CheckpointStorageException if the job's location cannot be read
     */
    List<Checkpoint> list(String jobId) throws CheckpointStorageException;

    /**
     * Looks a checkpoint up by identifier across all jobs.
     *
     * @param checkpointId the checkpoint identifier
     * @return the checkpoint, or empty if unknown
     * @throws CheckpointStorageException if storage cannot be read
     */
    Optional<Checkpoint> find(String checkpointId) throws CheckpointStorageException;

    /**
     * Deletes one checkpoint.
     *
     * @return {@code true} if the checkpoint existed
     * @throws CheckpointStorageException if the deletion failed
     */
    boolean delete(String jobId, String checkpointId) throws CheckpointStorageException;
}
