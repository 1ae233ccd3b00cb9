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

import dev.mars.quill.checkpoint.CheckpointSnapshot;
import dev.mars.quill.core.JobStatus;
import dev.mars.quill.core.exceptions.InvalidTransitionException;
import dev.mars.quill.workflow.CompiledGraph;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runtime state of one execution of a compiled workflow.
 *
 * <p>A job is created {@link JobStatus#PENDING} by the engine and moves through the
 * {@link JobStatus} state machine as levels are dispatched. Its status, step
 * bookkeeping and outputs are written only by the {@link SimpleJobExecutionEngine}
 * that owns it; other components see it through the public getters, which return
 * copies.</p>
 *
 * <h3>Thread Safety:</h3>
 * <p>All mutators and the copying getters synchronize on the job, so a status query
 * from another thread always sees a consistent view. The pause and cancel flags are
 * volatile because they are set by callers and polled by the engine thread at level
 * boundaries.</p>
 *
 * <h3>Step bookkeeping:</h3>
 * <ul>
 *   <li><strong>completed</strong> steps have an entry in the output map (possibly {@code null})</li>
 *   <li><strong>failed</strong> steps carry the error text of their last attempt</li>
 *   <li><strong>skipped</strong> steps were never dispatched</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class Job {

    private final String jobId;
    private final String workflowId;
    private final Instant createdAt;

    private CompiledGraph graph;
    private JobStatus status = JobStatus.PENDING;
    private int currentLevel;
    private final Set<String> completedSteps = new LinkedHashSet<>();
    private final Map<String, String> failedSteps = new LinkedHashMap<>();
    private final Set<String> skippedSteps = new LinkedHashSet<>();
    private final Map<String, Object> outputs = new LinkedHashMap<>();
    private Map<String, Object> inputs;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant finishedAt;
    private String errorMessage;

    private volatile boolean pauseRequested;
    private volatile boolean cancelRequested;

    Job(String jobId, CompiledGraph graph, Map<String, Object> inputs) {
        this.jobId = Objects.requireNonNull(jobId, "Job ID cannot be null");
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        this.workflowId = graph.getWorkflowId();
        this.inputs = copyOf(inputs);
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public String getJobId() {
        return jobId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public synchronized String getWorkflowVersion() {
        return graph.getVersion();
    }

    public synchronized CompiledGraph getGraph() {
        return graph;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized int getCurrentLevel() {
        return currentLevel;
    }

    public synchronized Set<String> getCompletedSteps() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(completedSteps));
    }

    public synchronized Map<String, String> getFailedSteps() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(failedSteps));
    }

    public synchronized Set<String> getSkippedSteps() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(skippedSteps));
    }

    /**
     * @return copy of the step outputs keyed by step id; values may be {@code null}
     */
    public synchronized Map<String, Object> getOutputs() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public synchronized Map<String, Object> getInputs() {
        return inputs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public synchronized Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public synchronized Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public boolean isPauseRequested() {
        return pauseRequested;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    // Engine-side mutators

    synchronized void transitionTo(JobStatus target) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(jobId, status, target, status.getValidTransitions());
        }
        status = target;
        Instant now = Instant.now();
        updatedAt = now;
        if (target == JobStatus.RUNNING && startedAt == null) {
            startedAt = now;
        }
        if (target.isTerminal()) {
            finishedAt = now;
        }
    }

    void requestPause() {
        pauseRequested = true;
    }

    void requestCancel() {
        cancelRequested = true;
    }

    void clearPauseRequest() {
        pauseRequested = false;
    }

    synchronized void recordSuccess(String stepId, Object output) {
        completedSteps.add(stepId);
        outputs.put(stepId, output);
        updatedAt = Instant.now();
    }

    synchronized void recordFailure(String stepId, String error) {
        failedSteps.put(stepId, error != null ? error : "unknown error");
        updatedAt = Instant.now();
    }

    synchronized void recordSkipped(String stepId) {
        skippedSteps.add(stepId);
        updatedAt = Instant.now();
    }

    synchronized boolean isSettled(String stepId) {
        return completedSteps.contains(stepId) || failedSteps.containsKey(stepId) || skippedSteps.contains(stepId);
    }

    synchronized boolean isBlocked(String stepId) {
        return failedSteps.containsKey(stepId) || skippedSteps.contains(stepId);
    }

    synchronized void advanceLevel() {
        currentLevel++;
        updatedAt = Instant.now();
    }

    synchronized void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    /**
     * Inputs overlaid with outputs keyed by step id, used to evaluate step conditions.
     */
    synchronized Map<String, Object> conditionContext() {
        Map<String, Object> context = new LinkedHashMap<>(inputs);
        context.putAll(outputs);
        return context;
    }

    synchronized CheckpointSnapshot snapshot() {
        return new CheckpointSnapshot(workflowId, graph.getVersion(), currentLevel, completedSteps,
                new TreeMap<>(failedSteps), skippedSteps, outputs, inputs);
    }

    /**
     * Replaces all progress with the snapshot's and rebinds the job to the given graph.
     */
    synchronized void restore(CheckpointSnapshot snapshot, CompiledGraph restoredGraph) {
        this.graph = restoredGraph;
        this.currentLevel = snapshot.getNextLevelIndex();
        completedSteps.clear();
        completedSteps.addAll(snapshot.getCompletedSteps());
        failedSteps.clear();
        failedSteps.putAll(snapshot.getFailedSteps());
        skippedSteps.clear();
        skippedSteps.addAll(snapshot.getSkippedSteps());
        outputs.clear();
        outputs.putAll(snapshot.getStepOutputs());
        inputs = copyOf(snapshot.getInputs());
        errorMessage = null;
        updatedAt = Instant.now();
    }

    /**
     * Sets the status of a job rebuilt from a checkpoint. The state machine is bypassed
     * because the job never ran in this engine.
     */
    synchronized void recoverAs(JobStatus recovered, Instant checkpointedAt, String error) {
        this.status = Objects.requireNonNull(recovered, "Status cannot be null");
        this.errorMessage = error;
        this.updatedAt = Instant.now();
        if (recovered.isTerminal()) {
            this.finishedAt = checkpointedAt;
        }
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    @Override
    public synchronized String toString() {
        return "Job{" +
               "jobId='" + jobId + '\'' +
               ", workflow='" + workflowId + '@' + graph.getVersion() + '\'' +
               ", status=" + status +
               ", level=" + currentLevel + '/' + graph.levelCount() +
               '}';
    }
}
