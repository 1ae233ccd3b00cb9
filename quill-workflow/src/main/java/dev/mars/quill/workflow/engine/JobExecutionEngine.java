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

package dev.mars.quill.workflow.engine;

import dev.mars.quill.checkpoint.Checkpoint;
import dev.mars.quill.checkpoint.CheckpointSnapshot;
import dev.mars.quill.checkpoint.CleanupResult;
import dev.mars.quill.core.JobStatus;
import dev.mars.quill.core.exceptions.CheckpointNotFoundException;
import dev.mars.quill.core.exceptions.CheckpointStorageException;
import dev.mars.quill.core.exceptions.InvalidTransitionException;
import dev.mars.quill.core.exceptions.JobNotFoundException;
import dev.mars.quill.core.exceptions.VersionMismatchException;
import dev.mars.quill.core.exceptions.WorkflowNotFoundException;
import dev.mars.quill.event.EventFilter;
import dev.mars.quill.event.EventListener;
import dev.mars.quill.event.EventSubscription;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the lifecycle of jobs and drives their compiled graphs level by level.
 *
 * <p>Pause and cancel are cooperative: they are observed only between levels, so the
 * level in flight always finishes first.</p>
 */
public interface JobExecutionEngine {

    /**
     * Creates a {@link JobStatus#PENDING} job for the current version of a workflow.
     *
     * @param workflowId registered workflow id
     * @param inputs     job inputs visible to every step
     * @return the new job id
     */
    String createJob(String workflowId, Map<String, Object> inputs) throws WorkflowNotFoundException;

    /**
     * Creates a {@link JobStatus#PENDING} job for a specific workflow version.
     */
    String createJob(String workflowId, String version, Map<String, Object> inputs)
            throws WorkflowNotFoundException;

    /**
     * Starts a pending job.
     *
     * @return future completing with the status the job stops in: {@code COMPLETED},
     *         {@code FAILED}, {@code PAUSED} or {@code CANCELLED}
     */
    CompletableFuture<JobStatus> executeJob(String jobId) throws JobNotFoundException, InvalidTransitionException;

    /**
     * Requests a pause at the next level boundary.
     */
    void pauseJob(String jobId) throws JobNotFoundException, InvalidTransitionException;

    /**
     * Resumes a paused job, optionally from a checkpoint.
     *
     * @param checkpointId checkpoint to restore first, or {@code null} to continue from in-memory state
     * @return future for the resumed execution
     */
    CompletableFuture<JobStatus> resumeJob(String jobId, String checkpointId)
            throws JobNotFoundException, InvalidTransitionException, CheckpointNotFoundException,
                   VersionMismatchException, WorkflowNotFoundException, CheckpointStorageException;

    /**
     * Cancels a job. A running job stops at the next level boundary; a paused job is
     * cancelled immediately. Both write a final checkpoint.
     */
    void cancelJob(String jobId) throws JobNotFoundException, InvalidTransitionException;

    /**
     * Rebuilds a job this engine does not know from its most recent checkpoint, for example
     * after a restart against a file store. The job comes back {@code PAUSED} and can be
     * resumed, unless the checkpoint shows it had already been cancelled, had failed or had
     * run every level. A job the engine already tracks is returned unchanged.
     *
     * @throws JobNotFoundException     if the store holds no checkpoint for the job
     * @throws VersionMismatchException if the checkpoint no longer fits the workflow's current graph
     */
    Job recoverJob(String jobId)
            throws JobNotFoundException, CheckpointNotFoundException, VersionMismatchException,
                   WorkflowNotFoundException, CheckpointStorageException;

    /**
     * @return reports for every job the engine tracks, oldest first
     */
    List<JobStatusReport> listJobs();

    /**
     * @return reports for the tracked jobs currently in {@code status}, oldest first
     */
    List<JobStatusReport> listJobs(JobStatus status);

    /**
     * Forgets a finished job: the engine drops it along with its event history and its
     * checkpoint sequence.
     *
     * @param deleteCheckpoints also remove the job's checkpoints from the store
     * @throws IllegalStateException if the job is not in a terminal state
     */
    void deleteJob(String jobId, boolean deleteCheckpoints) throws JobNotFoundException, CheckpointStorageException;

    JobStatusReport getStatus(String jobId) throws JobNotFoundException;

    Job getJob(String jobId) throws JobNotFoundException;

    List<Checkpoint> listCheckpoints(String jobId) throws CheckpointStorageException;

    CheckpointSnapshot restoreCheckpoint(String checkpointId)
            throws CheckpointNotFoundException, VersionMismatchException, WorkflowNotFoundException,
                   CheckpointStorageException;

    CleanupResult cleanupCheckpoints(String jobId, int keepLast) throws CheckpointStorageException;

    EventSubscription subscribe(EventFilter filter, EventListener listener);

    /**
     * Stops accepting work and releases the engine's threads.
     */
    void shutdown();
}
