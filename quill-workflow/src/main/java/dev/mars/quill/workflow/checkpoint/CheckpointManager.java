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

package dev.mars.quill.workflow.checkpoint;

import dev.mars.quill.checkpoint.Checkpoint;
import dev.mars.quill.checkpoint.CheckpointSnapshot;
import dev.mars.quill.checkpoint.CheckpointStore;
import dev.mars.quill.checkpoint.CleanupResult;
import dev.mars.quill.config.QuillConfiguration;
import dev.mars.quill.core.exceptions.CheckpointNotFoundException;
import dev.mars.quill.core.exceptions.CheckpointStorageException;
import dev.mars.quill.core.exceptions.VersionMismatchException;
import dev.mars.quill.core.exceptions.WorkflowNotFoundException;
import dev.mars.quill.event.EventBus;
import dev.mars.quill.event.EventType;
import dev.mars.quill.event.JobEvent;
import dev.mars.quill.workflow.CompiledGraph;
import dev.mars.quill.workflow.WorkflowRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists, lists, restores and prunes job checkpoints.
 *
 * <p>Saves are retried up to {@code maxAttempts} times with linear backoff. A save
 * that still fails is reported as a {@link EventType#CHECKPOINT_SAVE_FAILED} warning
 * and {@link Optional#empty()} is returned; the caller keeps its in-memory state and
 * carries on.</p>
 *
 * <p>Restoring verifies the snapshot against the workflow's currently registered graph
 * and rejects it with {@link VersionMismatchException} when the graph no longer has the
 * snapshot's steps or levels.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CheckpointManager {

    private static final Logger logger = Logger.getLogger(CheckpointManager.class.getName());

    private final CheckpointStore store;
    private final WorkflowRegistry workflowRegistry;
    private final EventBus eventBus;
    private final int maxAttempts;
    private final long retryDelayMs;
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public CheckpointManager(CheckpointStore store, WorkflowRegistry workflowRegistry, EventBus eventBus,
                             QuillConfiguration config) {
        this(store, workflowRegistry, eventBus, config.getCheckpointSaveMaxAttempts(),
                config.getCheckpointSaveRetryDelayMs());
    }

    public CheckpointManager(CheckpointStore store, WorkflowRegistry workflowRegistry, EventBus eventBus,
                             int maxAttempts, long retryDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
        }
        this.store = Objects.requireNonNull(store, "Checkpoint store cannot be null");
        this.workflowRegistry = Objects.requireNonNull(workflowRegistry, "Workflow registry cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.maxAttempts = maxAttempts;
        this.retryDelayMs = retryDelayMs;
    }

    /**
     * Writes a new checkpoint for the job.
     *
     * @param jobId    owning job
     * @param marker   position marker such as {@code level-2} or {@code cancelled}
     * @param snapshot job state to persist
     * @return the checkpoint id, or empty if every attempt failed
     */
    public Optional<String> save(String jobId, String marker, CheckpointSnapshot snapshot) {
        Objects.requireNonNull(jobId, "Job ID cannot be null");
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");

        long sequence = nextSequence(jobId);
        Checkpoint checkpoint = new Checkpoint(Checkpoint.idFor(jobId, sequence), jobId, sequence,
                marker, Instant.now(), snapshot);

        CheckpointStorageException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                store.write(checkpoint);
                publishSaved(checkpoint);
                logger.fine("Saved checkpoint " + checkpoint.getCheckpointId() + " (" + marker + ")");
                return Optional.of(checkpoint.getCheckpointId());
            } catch (CheckpointStorageException e) {
                lastError = e;
                logger.log(Level.WARNING, String.format("Checkpoint save attempt %d/%d failed for job %s: %s",
                        attempt, maxAttempts, jobId, e.getMessage()));
                if (attempt < maxAttempts && !backoff(attempt)) {
                    break;
                }
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("marker", marker);
        payload.put("checkpointId", checkpoint.getCheckpointId());
        payload.put("error", lastError != null ? lastError.getMessage() : "interrupted");
        eventBus.publish(JobEvent.of(EventType.CHECKPOINT_SAVE_FAILED, jobId, payload));
        logger.warning("Giving up on checkpoint " + checkpoint.getCheckpointId() + " for job " + jobId);
        return Optional.empty();
    }

    /**
     * @return checkpoints of the job, most recent first
     */
    public List<Checkpoint> list(String jobId) throws CheckpointStorageException {
        return store.list(jobId);
    }

    /**
     * Loads a checkpoint and returns its snapshot after checking it against the current graph.
     */
    public CheckpointSnapshot restore(String checkpointId)
            throws CheckpointNotFoundException, VersionMismatchException, WorkflowNotFoundException,
                   CheckpointStorageException {
        return restoreCheckpoint(checkpointId).getSnapshot();
    }

    public Checkpoint restoreCheckpoint(String checkpointId)
            throws CheckpointNotFoundException, VersionMismatchException, WorkflowNotFoundException,
                   CheckpointStorageException {
        Checkpoint checkpoint = store.find(checkpointId)
                .orElseThrow(() -> new CheckpointNotFoundException(checkpointId));
        CheckpointSnapshot snapshot = checkpoint.getSnapshot();
        CompiledGraph graph = workflowRegistry.currentGraph(snapshot.getWorkflowId());

        List<String> problems = findIncompatibilities(snapshot, graph);
        if (!problems.isEmpty()) {
            throw new VersionMismatchException(checkpointId, snapshot.getWorkflowVersion(),
                    graph.getVersion(), problems);
        }
        logger.info("Restored checkpoint " + checkpointId + " at level " + snapshot.getNextLevelIndex());
        return checkpoint;
    }

    /**
     * Deletes all but the newest {@code keepLast} checkpoints of the job, oldest first.
     */
    public CleanupResult cleanup(String jobId, int keepLast) throws CheckpointStorageException {
        if (keepLast < 0) {
            throw new IllegalArgumentException("keepLast cannot be negative: " + keepLast);
        }
        List<Checkpoint> checkpoints = store.list(jobId);
        if (checkpoints.size() <= keepLast) {
            return new CleanupResult(checkpoints.size(), List.of());
        }

        List<String> deleted = new ArrayList<>();
        for (int i = checkpoints.size() - 1; i >= keepLast; i--) {
            Checkpoint checkpoint = checkpoints.get(i);
            if (store.delete(jobId, checkpoint.getCheckpointId())) {
                deleted.add(checkpoint.getCheckpointId());
            }
        }
        logger.fine("Cleaned up " + deleted.size() + " checkpoints for job " + jobId);
        return new CleanupResult(checkpoints.size() - deleted.size(), deleted);
    }

    /**
     * Drops the job's sequence counter. The next save for the job reseeds it from the store.
     */
    public void forget(String jobId) {
        sequences.remove(Objects.requireNonNull(jobId, "Job ID cannot be null"));
    }

    int getTrackedJobCount() {
        return sequences.size();
    }

    static List<String> findIncompatibilities(CheckpointSnapshot snapshot, CompiledGraph graph) {
        List<String> problems = new ArrayList<>();
        if (snapshot.getNextLevelIndex() > graph.levelCount()) {
            problems.add("next level " + snapshot.getNextLevelIndex() + " exceeds level count "
                    + graph.levelCount());
        }

        List<String> referenced = new ArrayList<>(snapshot.getCompletedSteps());
        referenced.addAll(snapshot.getFailedSteps().keySet());
        referenced.addAll(snapshot.getSkippedSteps());
        for (String stepId : referenced) {
            if (!graph.containsStep(stepId)) {
                problems.add("step '" + stepId + "' no longer exists");
            }
        }

        for (String stepId : snapshot.getCompletedSteps()) {
            if (graph.containsStep(stepId) && graph.levelOf(stepId) >= snapshot.getNextLevelIndex()) {
                problems.add("completed step '" + stepId + "' is now in level " + graph.levelOf(stepId));
            }
        }
        return problems;
    }

    private long nextSequence(String jobId) {
        return sequences.computeIfAbsent(jobId, this::seedSequence).incrementAndGet();
    }

    private AtomicLong seedSequence(String jobId) {
        try {
            long highest = store.list(jobId).stream().mapToLong(Checkpoint::getSequence).max().orElse(0L);
            return new AtomicLong(highest);
        } catch (CheckpointStorageException e) {
            logger.warning("Could not read existing checkpoints for job " + jobId + ": " + e.getMessage());
            return new AtomicLong(0L);
        }
    }

    private boolean backoff(int attempt) {
        long delay = retryDelayMs * attempt;
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void publishSaved(Checkpoint checkpoint) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("checkpointId", checkpoint.getCheckpointId());
        payload.put("marker", checkpoint.getMarker());
        payload.put("sequence", checkpoint.getSequence());
        payload.put("nextLevelIndex", checkpoint.getSnapshot().getNextLevelIndex());
        eventBus.publish(JobEvent.of(EventType.CHECKPOINT_SAVED, checkpoint.getJobId(), payload));
    }
}
