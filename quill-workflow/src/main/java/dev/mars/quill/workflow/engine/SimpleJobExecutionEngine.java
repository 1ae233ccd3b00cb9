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
import dev.mars.quill.checkpoint.CheckpointStore;
import dev.mars.quill.checkpoint.CleanupResult;
import dev.mars.quill.checkpoint.FileCheckpointStore;
import dev.mars.quill.checkpoint.InMemoryCheckpointStore;
import dev.mars.quill.config.QuillConfiguration;
import dev.mars.quill.core.JobStatus;
import dev.mars.quill.core.exceptions.CheckpointNotFoundException;
import dev.mars.quill.core.exceptions.CheckpointStorageException;
import dev.mars.quill.core.exceptions.InvalidTransitionException;
import dev.mars.quill.core.exceptions.JobNotFoundException;
import dev.mars.quill.core.exceptions.VersionMismatchException;
import dev.mars.quill.core.exceptions.WorkflowNotFoundException;
import dev.mars.quill.event.EventBus;
import dev.mars.quill.event.EventFilter;
import dev.mars.quill.event.EventHistory;
import dev.mars.quill.event.EventListener;
import dev.mars.quill.event.EventSubscription;
import dev.mars.quill.event.EventType;
import dev.mars.quill.event.JobEvent;
import dev.mars.quill.event.SimpleEventBus;
import dev.mars.quill.workflow.CompiledGraph;
import dev.mars.quill.workflow.ExecutionLevel;
import dev.mars.quill.workflow.StepSpec;
import dev.mars.quill.workflow.WorkflowRegistry;
import dev.mars.quill.workflow.checkpoint.CheckpointManager;
import dev.mars.quill.workflow.execution.LevelResult;
import dev.mars.quill.workflow.execution.ParallelExecutor;
import dev.mars.quill.workflow.execution.StepResult;
import dev.mars.quill.workflow.observability.WorkflowMetrics;
import dev.mars.quill.workflow.step.StepRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link JobExecutionEngine}.
 *
 * <p>Each job runs on the engine's job pool. For every level the engine:</p>
 * <ol>
 *   <li>checks the cancel flag, then the pause flag</li>
 *   <li>skips steps whose dependency failed or was skipped, or whose condition is false</li>
 *   <li>hands the remaining steps to the {@link ParallelExecutor} and merges the results</li>
 *   <li>advances the level index and saves a checkpoint marked {@code level-<n>}</li>
 *   <li>publishes {@link EventType#LEVEL_COMPLETED}</li>
 * </ol>
 * <p>A failed step without {@code continueOnError} fails the job after that checkpoint
 * is written; no further level runs. A failed step with {@code continueOnError} only
 * causes its dependents to be skipped.</p>
 *
 * <p>Instances are built explicitly with {@link #builder(WorkflowRegistry, StepRegistry)}
 * and passed by reference.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SimpleJobExecutionEngine implements JobExecutionEngine {

    private static final Logger logger = Logger.getLogger(SimpleJobExecutionEngine.class.getName());

    static final String CANCELLED_MARKER = "cancelled";

    private final WorkflowRegistry workflowRegistry;
    private final ParallelExecutor executor;
    private final CheckpointManager checkpointManager;
    private final EventBus eventBus;
    private final WorkflowMetrics metrics;
    private final boolean autoCleanup;
    private final int keepLast;
    private final int keepAfterCompletion;
    private final ExecutorService jobPool;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private SimpleJobExecutionEngine(Builder builder, QuillConfiguration config, EventBus eventBus,
                                     CheckpointStore store) {
        this.workflowRegistry = builder.workflowRegistry;
        this.eventBus = eventBus;
        this.executor = new ParallelExecutor(builder.stepRegistry, eventBus, config);
        this.checkpointManager = new CheckpointManager(store, workflowRegistry, eventBus, config);
        if (builder.metrics != null) {
            this.metrics = builder.metrics;
        } else {
            this.metrics = config.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
        }
        this.autoCleanup = config.isCheckpointAutoCleanup();
        this.keepLast = config.getCheckpointKeepLast();
        this.keepAfterCompletion = config.getCheckpointKeepAfterCompletion();

        AtomicInteger counter = new AtomicInteger();
        this.jobPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "quill-job-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        logger.info("SimpleJobExecutionEngine initialized with " + store.getClass().getSimpleName()
                + ", max concurrency " + config.getMaxConcurrency());
    }

    public static Builder builder(WorkflowRegistry workflowRegistry, StepRegistry stepRegistry) {
        return new Builder(workflowRegistry, stepRegistry);
    }

    @Override
    public String createJob(String workflowId, Map<String, Object> inputs) throws WorkflowNotFoundException {
        return registerJob(workflowRegistry.currentGraph(workflowId), inputs);
    }

    @Override
    public String createJob(String workflowId, String version, Map<String, Object> inputs)
            throws WorkflowNotFoundException {
        return registerJob(workflowRegistry.graph(workflowId, version), inputs);
    }

    private String registerJob(CompiledGraph graph, Map<String, Object> inputs) {
        ensureRunning();
        String jobId = "job-" + UUID.randomUUID();
        Job job = new Job(jobId, graph, inputs);
        jobs.put(jobId, job);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflowId", graph.getWorkflowId());
        payload.put("version", graph.getVersion());
        payload.put("totalSteps", graph.totalSteps());
        eventBus.publish(JobEvent.of(EventType.JOB_CREATED, jobId, payload));
        logger.info("Created job " + jobId + " for workflow " + graph.getWorkflowId() + "@" + graph.getVersion());
        return jobId;
    }

    @Override
    public CompletableFuture<JobStatus> executeJob(String jobId)
            throws JobNotFoundException, InvalidTransitionException {
        Job job = findJob(jobId);
        if (shutdown.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Job execution engine is shutdown"));
        }

        synchronized (job) {
            job.transitionTo(JobStatus.RUNNING);
        }
        if (metrics != null) {
            metrics.recordJobStarted(job.getWorkflowId());
        }
        eventBus.publish(JobEvent.of(EventType.JOB_STARTED, jobId));
        logger.info("Starting job " + jobId);
        return launch(job);
    }

    @Override
    public void pauseJob(String jobId) throws JobNotFoundException, InvalidTransitionException {
        Job job = findJob(jobId);
        synchronized (job) {
            JobStatus status = job.getStatus();
            if (status != JobStatus.RUNNING) {
                throw new InvalidTransitionException(jobId, status, JobStatus.PAUSED, status.getValidTransitions());
            }
            job.requestPause();
        }
        logger.info("Pause requested for job " + jobId);
    }

    @Override
    public CompletableFuture<JobStatus> resumeJob(String jobId, String checkpointId)
            throws JobNotFoundException, InvalidTransitionException, CheckpointNotFoundException,
                   VersionMismatchException, WorkflowNotFoundException, CheckpointStorageException {
        Job job = findJob(jobId);
        ensureRunning();

        Checkpoint checkpoint = null;
        synchronized (job) {
            JobStatus status = job.getStatus();
            if (status != JobStatus.PAUSED) {
                throw new InvalidTransitionException(jobId, status, JobStatus.RUNNING, status.getValidTransitions());
            }
            if (checkpointId != null) {
                checkpoint = checkpointManager.restoreCheckpoint(checkpointId);
                CheckpointSnapshot snapshot = checkpoint.getSnapshot();
                if (!snapshot.getWorkflowId().equals(job.getWorkflowId())) {
                    throw new VersionMismatchException(checkpointId, snapshot.getWorkflowVersion(),
                            job.getWorkflowVersion(),
                            List.of("checkpoint belongs to workflow '" + snapshot.getWorkflowId() + "'"));
                }
                job.restore(snapshot, workflowRegistry.currentGraph(job.getWorkflowId()));
            }
            job.clearPauseRequest();
            job.transitionTo(JobStatus.RUNNING);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("checkpointId", checkpoint != null ? checkpoint.getCheckpointId() : null);
        payload.put("nextLevelIndex", job.getCurrentLevel());
        eventBus.publish(JobEvent.of(EventType.JOB_RESUMED, jobId, payload));
        logger.info("Resuming job " + jobId + " at level " + job.getCurrentLevel()
                + (checkpoint != null ? " from checkpoint " + checkpoint.getCheckpointId() : ""));
        return launch(job);
    }

    @Override
    public void cancelJob(String jobId) throws JobNotFoundException, InvalidTransitionException {
        Job job = findJob(jobId);
        synchronized (job) {
            JobStatus status = job.getStatus();
            if (status == JobStatus.RUNNING) {
                job.requestCancel();
                logger.info("Cancel requested for job " + jobId);
                return;
            }
            if (status != JobStatus.PAUSED) {
                throw new InvalidTransitionException(jobId, status, JobStatus.CANCELLED, status.getValidTransitions());
            }
            job.requestCancel();
            finishCancelled(job);
        }
    }

    @Override
    public Job recoverJob(String jobId)
            throws JobNotFoundException, CheckpointNotFoundException, VersionMismatchException,
                   WorkflowNotFoundException, CheckpointStorageException {
        Objects.requireNonNull(jobId, "Job ID cannot be null");
        ensureRunning();
        Job known = jobs.get(jobId);
        if (known != null) {
            return known;
        }

        List<Checkpoint> checkpoints = checkpointManager.list(jobId);
        if (checkpoints.isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        Checkpoint latest = checkpointManager.restoreCheckpoint(checkpoints.get(0).getCheckpointId());
        CheckpointSnapshot snapshot = latest.getSnapshot();
        CompiledGraph graph = workflowRegistry.currentGraph(snapshot.getWorkflowId());

        Job job = new Job(jobId, graph, snapshot.getInputs());
        job.restore(snapshot, graph);
        String fatalStep = fatalStep(snapshot, graph);
        JobStatus status;
        String error = null;
        if (CANCELLED_MARKER.equals(latest.getMarker())) {
            status = JobStatus.CANCELLED;
        } else if (fatalStep != null) {
            status = JobStatus.FAILED;
            error = "Step " + fatalStep + " failed: " + snapshot.getFailedSteps().get(fatalStep);
        } else if (snapshot.getNextLevelIndex() >= graph.levelCount()) {
            status = JobStatus.COMPLETED;
        } else {
            status = JobStatus.PAUSED;
        }
        job.recoverAs(status, latest.getCreatedAt(), error);

        Job raced = jobs.putIfAbsent(jobId, job);
        if (raced != null) {
            return raced;
        }
        if (status == JobStatus.PAUSED && metrics != null) {
            metrics.recordJobRecovered();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("checkpointId", latest.getCheckpointId());
        payload.put("status", status.name());
        payload.put("nextLevelIndex", snapshot.getNextLevelIndex());
        eventBus.publish(JobEvent.of(EventType.JOB_RECOVERED, jobId, payload));
        logger.info("Recovered job " + jobId + " as " + status + " from checkpoint " + latest.getCheckpointId());
        return job;
    }

    @Override
    public List<JobStatusReport> listJobs() {
        return listJobs(null);
    }

    @Override
    public List<JobStatusReport> listJobs(JobStatus status) {
        List<Job> snapshot = new ArrayList<>(jobs.values());
        snapshot.sort(Comparator.comparing(Job::getCreatedAt).thenComparing(Job::getJobId));
        List<JobStatusReport> reports = new ArrayList<>(snapshot.size());
        for (Job job : snapshot) {
            JobStatusReport report = report(job);
            if (status == null || report.getStatus() == status) {
                reports.add(report);
            }
        }
        return reports;
    }

    @Override
    public void deleteJob(String jobId, boolean deleteCheckpoints)
            throws JobNotFoundException, CheckpointStorageException {
        Job job = findJob(jobId);
        synchronized (job) {
            JobStatus status = job.getStatus();
            if (!status.isTerminal()) {
                throw new IllegalStateException("Job " + jobId + " is " + status + "; only finished jobs can be deleted");
            }
            jobs.remove(jobId, job);
        }
        eventBus.release(jobId);
        if (deleteCheckpoints) {
            checkpointManager.cleanup(jobId, 0);
        }
        checkpointManager.forget(jobId);
        logger.info("Deleted job " + jobId + (deleteCheckpoints ? " and its checkpoints" : ""));
    }

    @Override
    public JobStatusReport getStatus(String jobId) throws JobNotFoundException {
        return report(findJob(jobId));
    }

    private static JobStatusReport report(Job job) {
        synchronized (job) {
            CompiledGraph graph = job.getGraph();
            return new JobStatusReport(job.getJobId(), job.getStatus(), job.getCompletedSteps().size(),
                    job.getFailedSteps().size(), job.getSkippedSteps().size(), graph.totalSteps(),
                    job.getCurrentLevel(), graph.levelCount(), job.getErrorMessage().orElse(null));
        }
    }

    /**
     * @return the first failed step (by id) that stops the job, or {@code null}
     */
    private static String fatalStep(CheckpointSnapshot snapshot, CompiledGraph graph) {
        for (String stepId : snapshot.getFailedSteps().keySet()) {
            if (!graph.getStep(stepId).isContinueOnError()) {
                return stepId;
            }
        }
        return null;
    }

    @Override
    public Job getJob(String jobId) throws JobNotFoundException {
        return findJob(jobId);
    }

    @Override
    public List<Checkpoint> listCheckpoints(String jobId) throws CheckpointStorageException {
        return checkpointManager.list(jobId);
    }

    @Override
    public CheckpointSnapshot restoreCheckpoint(String checkpointId)
            throws CheckpointNotFoundException, VersionMismatchException, WorkflowNotFoundException,
                   CheckpointStorageException {
        return checkpointManager.restore(checkpointId);
    }

    @Override
    public CleanupResult cleanupCheckpoints(String jobId, int keepLast) throws CheckpointStorageException {
        return checkpointManager.cleanup(jobId, keepLast);
    }

    @Override
    public EventSubscription subscribe(EventFilter filter, EventListener listener) {
        return eventBus.subscribe(filter, listener);
    }

    @Override
    public void shutdown() {
        if (shutdown.getAndSet(true)) {
            return;
        }
        logger.info("Shutting down job execution engine...");
        jobPool.shutdown();
        try {
            if (!jobPool.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Job execution engine shutdown timed out, forcing shutdown");
                jobPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            jobPool.shutdownNow();
        }
        executor.shutdown();
        logger.info("Job execution engine shutdown completed");
    }

    private CompletableFuture<JobStatus> launch(Job job) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return runLevels(job);
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Job execution failed: " + job.getJobId() + " - " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Job execution exception details for: " + job.getJobId(), e);
                }
                failAfterError(job, e);
                throw new CompletionException(e);
            }
        }, jobPool);
    }

    private JobStatus runLevels(Job job) throws InvalidTransitionException {
        while (true) {
            ExecutionLevel level;
            synchronized (job) {
                CompiledGraph graph = job.getGraph();
                if (job.getCurrentLevel() >= graph.levelCount()) {
                    break;
                }
                if (job.isCancelRequested()) {
                    finishCancelled(job);
                    return JobStatus.CANCELLED;
                }
                if (job.isPauseRequested()) {
                    job.transitionTo(JobStatus.PAUSED);
                    job.clearPauseRequest();
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("nextLevelIndex", job.getCurrentLevel());
                    eventBus.publish(JobEvent.of(EventType.JOB_PAUSED, job.getJobId(), payload));
                    logger.info("Job " + job.getJobId() + " paused before level " + job.getCurrentLevel());
                    return JobStatus.PAUSED;
                }
                level = graph.getLevel(job.getCurrentLevel());
            }

            Optional<String> fatalStep = executeLevel(job, level);
            if (fatalStep.isPresent()) {
                String message = "Step " + fatalStep.get() + " failed: "
                        + job.getFailedSteps().get(fatalStep.get());
                synchronized (job) {
                    job.setErrorMessage(message);
                    job.transitionTo(JobStatus.FAILED);
                }
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("failedStep", fatalStep.get());
                payload.put("error", message);
                eventBus.publish(JobEvent.of(EventType.JOB_FAILED, job.getJobId(), payload));
                if (metrics != null) {
                    metrics.recordJobFailed(job.getWorkflowId(), "step_failed");
                }
                logger.severe("Job " + job.getJobId() + " failed: " + message);
                cleanupAfterTerminal(job);
                return JobStatus.FAILED;
            }
        }

        synchronized (job) {
            job.transitionTo(JobStatus.COMPLETED);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("completedSteps", job.getCompletedSteps().size());
        payload.put("failedSteps", job.getFailedSteps().size());
        payload.put("skippedSteps", job.getSkippedSteps().size());
        eventBus.publish(JobEvent.of(EventType.JOB_COMPLETED, job.getJobId(), payload));
        if (metrics != null) {
            metrics.recordJobCompleted(job.getWorkflowId(), elapsedSeconds(job));
        }
        logger.info("Job " + job.getJobId() + " completed");
        cleanupAfterTerminal(job);
        return JobStatus.COMPLETED;
    }

    /**
     * Runs one level and merges its results into the job.
     *
     * @return the first step (by id) that failed without {@code continueOnError}, if any
     */
    private Optional<String> executeLevel(Job job, ExecutionLevel level) {
        String jobId = job.getJobId();
        CompiledGraph graph = job.getGraph();

        Map<String, Object> startPayload = new LinkedHashMap<>();
        startPayload.put("levelIndex", level.getIndex());
        startPayload.put("steps", level.getStepIds());
        eventBus.publish(JobEvent.of(EventType.LEVEL_STARTED, jobId, startPayload));

        Map<String, Object> conditionContext = job.conditionContext();
        List<StepSpec> dispatch = new ArrayList<>();
        for (String stepId : level.getStepIds()) {
            if (job.isSettled(stepId)) {
                continue;
            }
            StepSpec step = graph.getStep(stepId);
            String skipReason = skipReason(job, step, conditionContext);
            if (skipReason != null) {
                job.recordSkipped(stepId);
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("reason", skipReason);
                eventBus.publish(JobEvent.forStep(EventType.STEP_SKIPPED, jobId, stepId, payload));
                logger.fine("Skipping step " + stepId + " of job " + jobId + ": " + skipReason);
            } else {
                dispatch.add(step);
            }
        }

        LevelResult result = dispatch.isEmpty()
                ? new LevelResult(level.getIndex(), Map.of())
                : executor.executeLevel(jobId, level, dispatch, job.getInputs(), job.getOutputs());

        String fatalStep = null;
        for (StepResult stepResult : result.getResults().values()) {
            StepSpec step = graph.getStep(stepResult.getStepId());
            if (metrics != null) {
                metrics.recordStepExecuted(job.getWorkflowId(), step.getRef());
            }
            if (stepResult.isSuccessful()) {
                job.recordSuccess(step.getId(), stepResult.getOutput());
            } else {
                job.recordFailure(step.getId(), stepResult.getErrorMessage().orElse(stepResult.getStatus().name()));
                if (metrics != null) {
                    metrics.recordStepFailed(job.getWorkflowId(), step.getRef());
                }
                if (!step.isContinueOnError() && fatalStep == null) {
                    fatalStep = step.getId();
                }
            }
        }

        job.advanceLevel();
        Optional<String> checkpointId = saveCheckpoint(job, "level-" + level.getIndex());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("levelIndex", level.getIndex());
        payload.put("succeeded", result.getSuccessCount());
        payload.put("failed", result.getFailureCount());
        payload.put("skipped", level.size() - dispatch.size());
        payload.put("checkpointId", checkpointId.orElse(null));
        eventBus.publish(JobEvent.of(EventType.LEVEL_COMPLETED, jobId, payload));
        logger.fine("Level " + level.getIndex() + " of job " + jobId + " completed: " + result);
        return Optional.ofNullable(fatalStep);
    }

    private static String skipReason(Job job, StepSpec step, Map<String, Object> conditionContext) {
        for (String dependency : step.getDependsOn()) {
            if (job.isBlocked(dependency)) {
                return "dependency '" + dependency + "' did not complete";
            }
        }
        if (step.getCondition().isPresent() && !step.getCondition().get().evaluate(conditionContext)) {
            return "condition " + step.getCondition().get() + " not met";
        }
        return null;
    }

    private Optional<String> saveCheckpoint(Job job, String marker) {
        Optional<String> checkpointId = checkpointManager.save(job.getJobId(), marker, job.snapshot());
        if (checkpointId.isPresent() && autoCleanup) {
            cleanupQuietly(job.getJobId(), keepLast);
        }
        return checkpointId;
    }

    /**
     * Flushes the final checkpoint and moves the job to CANCELLED. Caller holds the job lock.
     */
    private void finishCancelled(Job job) throws InvalidTransitionException {
        saveCheckpoint(job, CANCELLED_MARKER);
        job.transitionTo(JobStatus.CANCELLED);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("nextLevelIndex", job.getCurrentLevel());
        eventBus.publish(JobEvent.of(EventType.JOB_CANCELLED, job.getJobId(), payload));
        if (metrics != null) {
            metrics.recordJobCancelled(job.getWorkflowId());
        }
        logger.info("Job " + job.getJobId() + " cancelled at level " + job.getCurrentLevel());
        cleanupAfterTerminal(job);
    }

    private void failAfterError(Job job, Exception error) {
        synchronized (job) {
            if (!job.getStatus().canTransitionTo(JobStatus.FAILED)) {
                return;
            }
            job.setErrorMessage(error.getMessage());
            try {
                job.transitionTo(JobStatus.FAILED);
            } catch (InvalidTransitionException e) {
                logger.warning("Could not mark job " + job.getJobId() + " failed: " + e.getMessage());
                return;
            }
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error.getMessage());
        eventBus.publish(JobEvent.of(EventType.JOB_FAILED, job.getJobId(), payload));
        if (metrics != null) {
            metrics.recordJobFailed(job.getWorkflowId(), error.getClass().getSimpleName());
        }
    }

    private void cleanupAfterTerminal(Job job) {
        if (autoCleanup) {
            cleanupQuietly(job.getJobId(), keepAfterCompletion);
        }
    }

    private void cleanupQuietly(String jobId, int keep) {
        try {
            checkpointManager.cleanup(jobId, keep);
        } catch (CheckpointStorageException e) {
            logger.warning("Checkpoint cleanup failed for job " + jobId + ": " + e.getMessage());
        }
    }

    private static double elapsedSeconds(Job job) {
        return job.getStartedAt()
                .map(start -> Duration.between(start, job.getFinishedAt().orElse(start)).toMillis() / 1000.0)
                .orElse(0.0);
    }

    private Job findJob(String jobId) throws JobNotFoundException {
        Job job = jobs.get(Objects.requireNonNull(jobId, "Job ID cannot be null"));
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private void ensureRunning() {
        if (shutdown.get()) {
            throw new IllegalStateException("Job execution engine is shutdown");
        }
    }

    /**
     * Assembles an engine from configuration. Unset collaborators are derived from the
     * {@link QuillConfiguration}: the event bus keeps {@code quill.events.history.size}
     * events per job and the checkpoint store follows {@code quill.checkpoint.storage.type}.
     */
    public static final class Builder {
        private final WorkflowRegistry workflowRegistry;
        private final StepRegistry stepRegistry;
        private QuillConfiguration configuration;
        private EventBus eventBus;
        private CheckpointStore checkpointStore;
        private WorkflowMetrics metrics;

        private Builder(WorkflowRegistry workflowRegistry, StepRegistry stepRegistry) {
            this.workflowRegistry = Objects.requireNonNull(workflowRegistry, "Workflow registry cannot be null");
            this.stepRegistry = Objects.requireNonNull(stepRegistry, "Step registry cannot be null");
        }

        public Builder configuration(QuillConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        /**
         * Metrics sink for this engine. When unset, {@link WorkflowMetrics#getInstance()} is used
         * if {@code quill.metrics.enabled} is true.
         */
        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public SimpleJobExecutionEngine build() {
            QuillConfiguration config = configuration != null ? configuration : new QuillConfiguration();
            EventBus bus = eventBus != null ? eventBus
                    : new SimpleEventBus(new EventHistory(config.getEventHistorySize()));
            CheckpointStore store = checkpointStore != null ? checkpointStore : createStore(config);
            return new SimpleJobExecutionEngine(this, config, bus, store);
        }

        private static CheckpointStore createStore(QuillConfiguration config) {
            String type = config.getCheckpointStorageType();
            if ("memory".equalsIgnoreCase(type)) {
                return new InMemoryCheckpointStore();
            }
            if (!"file".equalsIgnoreCase(type)) {
                throw new IllegalArgumentException("Unknown checkpoint storage type: " + type);
            }
            return new FileCheckpointStore(config.getCheckpointStorageDir());
        }
    }
}
