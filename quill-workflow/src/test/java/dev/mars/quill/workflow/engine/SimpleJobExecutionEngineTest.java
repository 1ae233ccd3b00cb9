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
import dev.mars.quill.checkpoint.InMemoryCheckpointStore;
import dev.mars.quill.config.QuillConfiguration;
import dev.mars.quill.core.JobStatus;
import dev.mars.quill.core.exceptions.InvalidTransitionException;
import dev.mars.quill.core.exceptions.JobNotFoundException;
import dev.mars.quill.core.exceptions.VersionMismatchException;
import dev.mars.quill.core.exceptions.WorkflowNotFoundException;
import dev.mars.quill.event.EventType;
import dev.mars.quill.event.JobEvent;
import dev.mars.quill.event.SimpleEventBus;
import dev.mars.quill.workflow.StepCondition;
import dev.mars.quill.workflow.StepSpec;
import dev.mars.quill.workflow.TestSteps;
import dev.mars.quill.workflow.WorkflowCompiler;
import dev.mars.quill.workflow.WorkflowDefinition;
import dev.mars.quill.workflow.WorkflowRegistry;
import dev.mars.quill.workflow.observability.WorkflowMetrics;
import dev.mars.quill.workflow.step.StepRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class SimpleJobExecutionEngineTest {

    private WorkflowRegistry workflows;
    private StepRegistry steps;
    private SimpleEventBus eventBus;
    private SimpleJobExecutionEngine engine;

    private final CountDownLatch gateStarted = new CountDownLatch(1);
    private final CountDownLatch gateRelease = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        workflows = new WorkflowRegistry(new WorkflowCompiler());
        steps = new StepRegistry()
                .registerInstance("echo", TestSteps.echo())
                .registerInstance("constant", TestSteps.constant("value"))
                .registerInstance("boom", TestSteps.failing("boom"))
                .registerInstance("gate", TestSteps.gated(gateStarted, gateRelease, "opened"));
        eventBus = new SimpleEventBus();
        engine = engine(testConfiguration(), new InMemoryCheckpointStore());
    }

    @AfterEach
    void tearDown() {
        gateRelease.countDown();
        engine.shutdown();
    }

    @Test
    void runsLevelsInOrderAndPassesOutputs() throws Exception {
        register("blog",
                StepSpec.builder("research", "echo").build(),
                StepSpec.builder("outline", "echo").dependsOn("research").build(),
                StepSpec.builder("keywords", "echo").dependsOn("research").build(),
                StepSpec.builder("draft", "echo").dependsOn("outline", "keywords").build());

        String jobId = engine.createJob("blog", Map.of("topic", "java"));
        assertEquals(JobStatus.COMPLETED, engine.executeJob(jobId).get(10, TimeUnit.SECONDS));

        Job job = engine.getJob(jobId);
        assertEquals(Set.of("research", "outline", "keywords", "draft"), job.getCompletedSteps());
        assertEquals("research:[]", job.getOutputs().get("research"));
        assertEquals("draft:[keywords, outline, research]", job.getOutputs().get("draft"));
        assertEquals(3, job.getCurrentLevel());
        assertTrue(job.getStartedAt().isPresent());
        assertTrue(job.getFinishedAt().isPresent());
    }

    @Test
    void failedStepStopsJobAfterCheckpoint() throws Exception {
        register("wf",
                StepSpec.builder("A", "constant").build(),
                StepSpec.builder("B", "boom").build(),
                StepSpec.builder("C", "echo").dependsOn("A", "B").build());

        String jobId = engine.createJob("wf", Map.of());
        assertEquals(JobStatus.FAILED, engine.executeJob(jobId).get(10, TimeUnit.SECONDS));

        Job job = engine.getJob(jobId);
        assertEquals(Map.of("A", "value"), job.getOutputs());
        assertEquals(Map.of("B", "boom"), job.getFailedSteps());
        assertFalse(job.getSkippedSteps().contains("C"));
        assertEquals("Step B failed: boom", job.getErrorMessage().orElseThrow());
        assertTrue(eventBus.replay(jobId).stream()
                .noneMatch(e -> e.getType() == EventType.STEP_STARTED && e.getStepId().filter("C"::equals).isPresent()));

        List<Checkpoint> checkpoints = engine.listCheckpoints(jobId);
        assertEquals(1, checkpoints.size());
        assertEquals("level-0", checkpoints.get(0).getMarker());
        CheckpointSnapshot snapshot = checkpoints.get(0).getSnapshot();
        assertEquals(List.of("A"), snapshot.getCompletedSteps());
        assertEquals(Map.of("B", "boom"), snapshot.getFailedSteps());
        assertEquals(1, snapshot.getNextLevelIndex());
    }

    @Test
    void continueOnErrorSkipsOnlyDependents() throws Exception {
        register("wf",
                StepSpec.builder("A", "boom").continueOnError(true).build(),
                StepSpec.builder("B", "echo").dependsOn("A").build(),
                StepSpec.builder("C", "echo").build(),
                StepSpec.builder("D", "echo").dependsOn("B", "C").build());

        String jobId = engine.createJob("wf", Map.of());
        assertEquals(JobStatus.COMPLETED, engine.executeJob(jobId).get(10, TimeUnit.SECONDS));

        Job job = engine.getJob(jobId);
        assertEquals(Set.of("C"), job.getCompletedSteps());
        assertEquals(Set.of("A"), job.getFailedSteps().keySet());
        assertEquals(Set.of("B", "D"), job.getSkippedSteps());

        JobStatusReport report = engine.getStatus(jobId);
        assertEquals(1, report.getCompletedStepCount());
        assertEquals(1, report.getFailedStepCount());
        assertEquals(2, report.getSkippedStepCount());
        assertEquals(1.0, report.getProgress(), 0.0001);
    }

    @Test
    void falseConditionSkipsStepAndDependents() throws Exception {
        register("wf",
                StepSpec.builder("outline", "echo").build(),
                StepSpec.builder("seo", "echo").dependsOn("outline")
                        .condition(StepCondition.ifTrue("seo_enabled")).build(),
                StepSpec.builder("publish", "echo").dependsOn("seo").build(),
                StepSpec.builder("draft", "echo").dependsOn("outline")
                        .condition(StepCondition.requires("outline")).build());

        String jobId = engine.createJob("wf", Map.of("seo_enabled", false));
        assertEquals(JobStatus.COMPLETED, engine.executeJob(jobId).get(10, TimeUnit.SECONDS));

        Job job = engine.getJob(jobId);
        assertEquals(Set.of("outline", "draft"), job.getCompletedSteps());
        assertEquals(Set.of("seo", "publish"), job.getSkippedSteps());
        JobEvent skipped = eventBus.replay(jobId).stream()
                .filter(e -> e.getType() == EventType.STEP_SKIPPED)
                .findFirst().orElseThrow();
        assertEquals("seo", skipped.getStepId().orElseThrow());
        assertThat((String) skipped.getPayload().get("reason")).contains("seo_enabled");
    }

    @Test
    void pauseWaitsForLevelBoundary() throws Exception {
        registerGatedWorkflow();
        String jobId = engine.createJob("gated", Map.of());
        var execution = engine.executeJob(jobId);

        assertTrue(gateStarted.await(5, TimeUnit.SECONDS));
        engine.pauseJob(jobId);
        assertEquals(JobStatus.RUNNING, engine.getStatus(jobId).getStatus());

        gateRelease.countDown();
        assertEquals(JobStatus.PAUSED, execution.get(10, TimeUnit.SECONDS));

        Job job = engine.getJob(jobId);
        assertEquals(1, job.getCurrentLevel());
        assertEquals(Set.of("gate", "side"), job.getCompletedSteps());
        assertEquals(List.of("level-0"), markers(jobId));

        assertEquals(JobStatus.COMPLETED, engine.resumeJob(jobId, null).get(10, TimeUnit.SECONDS));
        assertEquals("after:[gate, side]", engine.getJob(jobId).getOutputs().get("after"));
    }

    @Test
    void pauseAndResumeEventsArePublished() throws Exception {
        registerGatedWorkflow();
        String jobId = engine.createJob("gated", Map.of());
        var execution = engine.executeJob(jobId);
        assertTrue(gateStarted.await(5, TimeUnit.SECONDS));
        engine.pauseJob(jobId);
        gateRelease.countDown();
        await().atMost(Duration.ofSeconds(10))
                .until(() -> engine.getStatus(jobId).getStatus() == JobStatus.PAUSED);
        execution.get(5, TimeUnit.SECONDS);

        engine.resumeJob(jobId, null).get(10, TimeUnit.SECONDS);

        List<EventType> lifecycle = eventBus.replay(jobId).stream()
                .map(JobEvent::getType)
                .filter(type -> type.name().startsWith("JOB_"))
                .toList();
        assertEquals(List.of(EventType.JOB_CREATED, EventType.JOB_STARTED, EventType.JOB_PAUSED,
                EventType.JOB_RESUMED, EventType.JOB_COMPLETED), lifecycle);
    }

    @Test
    void cancelRunningJobStopsAtNextBoundary() throws Exception {
        registerGatedWorkflow();
        String jobId = engine.createJob("gated", Map.of());
        var execution = engine.executeJob(jobId);

        assertTrue(gateStarted.await(5, TimeUnit.SECONDS));
        engine.cancelJob(jobId);
        gateRelease.countDown();

        assertEquals(JobStatus.CANCELLED, execution.get(10, TimeUnit.SECONDS));
        Job job = engine.getJob(jobId);
        assertFalse(job.getOutputs().containsKey("after"));
        assertEquals(List.of(SimpleJobExecutionEngine.CANCELLED_MARKER, "level-0"), markers(jobId));
        assertThrows(InvalidTransitionException.class, () -> engine.resumeJob(jobId, null));
    }

    @Test
    void cancelPausedJobIsImmediate() throws Exception {
        registerGatedWorkflow();
        String jobId = engine.createJob("gated", Map.of());
        var execution = engine.executeJob(jobId);
        assertTrue(gateStarted.await(5, TimeUnit.SECONDS));
        engine.pauseJob(jobId);
        gateRelease.countDown();
        assertEquals(JobStatus.PAUSED, execution.get(10, TimeUnit.SECONDS));

        engine.cancelJob(jobId);

        assertEquals(JobStatus.CANCELLED, engine.getStatus(jobId).getStatus());
        assertEquals(SimpleJobExecutionEngine.CANCELLED_MARKER, markers(jobId).get(0));
        assertEquals(EventType.JOB_CANCELLED, last(eventBus.replay(jobId)).getType());
    }

    @Test
    void resumeFromCheckpointMatchesUninterruptedRun() throws Exception {
        registerGatedWorkflow();

        String paused = engine.createJob("gated", Map.of("topic", "java"));
        var execution = engine.executeJob(paused);
        assertTrue(gateStarted.await(5, TimeUnit.SECONDS));
        engine.pauseJob(paused);
        gateRelease.countDown();
        assertEquals(JobStatus.PAUSED, execution.get(10, TimeUnit.SECONDS));

        String checkpointId = engine.listCheckpoints(paused).get(0).getCheckpointId();
        assertEquals(JobStatus.COMPLETED, engine.resumeJob(paused, checkpointId).get(10, TimeUnit.SECONDS));

        String straight = engine.createJob("gated", Map.of("topic", "java"));
        assertEquals(JobStatus.COMPLETED, engine.executeJob(straight).get(10, TimeUnit.SECONDS));

        assertEquals(engine.getJob(straight).getOutputs(), engine.getJob(paused).getOutputs());
        assertEquals(engine.getJob(straight).getCompletedSteps(), engine.getJob(paused).getCompletedSteps());
        JobEvent resumed = eventBus.replay(paused).stream()
                .filter(e -> e.getType() == EventType.JOB_RESUMED)
                .findFirst().orElseThrow();
        assertEquals(checkpointId, resumed.getPayload().get("checkpointId"));
    }

    @Test
    void resumeFromFileCheckpointKeepsOutputTypes(@TempDir Path checkpointDir) throws Exception {
        engine.shutdown();
        engine = fileEngine(checkpointDir);
        steps.registerInstance("count", TestSteps.constant(5L))
                .registerInstance("increment", TestSteps.increment("count"));
        register("typed",
                StepSpec.builder("count", "count").build(),
                StepSpec.builder("gate", "gate").build(),
                StepSpec.builder("next", "increment").dependsOn("count", "gate").build());

        String paused = engine.createJob("typed", Map.of("limit", 10L));
        var execution = engine.executeJob(paused);
        assertTrue(gateStarted.await(5, TimeUnit.SECONDS));
        engine.pauseJob(paused);
        gateRelease.countDown();
        assertEquals(JobStatus.PAUSED, execution.get(10, TimeUnit.SECONDS));

        String checkpointId = engine.listCheckpoints(paused).get(0).getCheckpointId();
        assertEquals(JobStatus.COMPLETED, engine.resumeJob(paused, checkpointId).get(10, TimeUnit.SECONDS));

        String straight = engine.createJob("typed", Map.of("limit", 10L));
        assertEquals(JobStatus.COMPLETED, engine.executeJob(straight).get(10, TimeUnit.SECONDS));

        Map<String, Object> resumedOutputs = engine.getJob(paused).getOutputs();
        assertEquals(engine.getJob(straight).getOutputs(), resumedOutputs);
        assertThat(resumedOutputs.get("count")).isInstanceOf(Long.class);
        assertEquals(6L, resumedOutputs.get("next"));
        assertEquals(10L, engine.restoreCheckpoint(checkpointId).getInputs().get("limit"));
    }

    @Test
    void resumeRejectsCheckpointOfAnotherWorkflow() throws Exception {
        registerGatedWorkflow();
        register("other", StepSpec.builder("only", "echo").build());
        String other = engine.createJob("other", Map.of());
        engine.executeJob(other).get(10, TimeUnit.SECONDS);
        String foreignCheckpoint = engine.listCheckpoints(other).get(0).getCheckpointId();

        String jobId = engine.createJob("gated", Map.of());
        var execution = engine.executeJob(jobId);
        assertTrue(gateStarted.await(5, TimeUnit.SECONDS));
        engine.pauseJob(jobId);
        gateRelease.countDown();
        execution.get(10, TimeUnit.SECONDS);

        assertThrows(VersionMismatchException.class, () -> engine.resumeJob(jobId, foreignCheckpoint));
        assertEquals(JobStatus.PAUSED, engine.getStatus(jobId).getStatus());
    }

    @Test
    void terminalJobsRejectLifecycleOperations() throws Exception {
        register("wf", StepSpec.builder("only", "echo").build());
        String jobId = engine.createJob("wf", Map.of());

        assertThrows(InvalidTransitionException.class, () -> engine.pauseJob(jobId));
        assertThrows(InvalidTransitionException.class, () -> engine.cancelJob(jobId));

        engine.executeJob(jobId).get(10, TimeUnit.SECONDS);

        assertThrows(InvalidTransitionException.class, () -> engine.executeJob(jobId));
        assertThrows(InvalidTransitionException.class, () -> engine.pauseJob(jobId));
        assertThrows(InvalidTransitionException.class, () -> engine.cancelJob(jobId));
        assertThrows(InvalidTransitionException.class, () -> engine.resumeJob(jobId, null));
    }

    @Test
    void statusBeforeExecution() throws Exception {
        register("wf",
                StepSpec.builder("a", "echo").build(),
                StepSpec.builder("b", "echo").dependsOn("a").build());
        String jobId = engine.createJob("wf", Map.of());

        JobStatusReport report = engine.getStatus(jobId);
        assertEquals(JobStatus.PENDING, report.getStatus());
        assertEquals(2, report.getTotalStepCount());
        assertEquals(2, report.getLevelCount());
        assertEquals(0, report.getCurrentLevel());
        assertEquals(0.0, report.getProgress(), 0.0001);
    }

    @Test
    void unknownJobAndWorkflowAreReported() throws Exception {
        register("wf", StepSpec.builder("a", "echo").build());

        assertThrows(JobNotFoundException.class, () -> engine.getStatus("job-missing"));
        assertThrows(JobNotFoundException.class, () -> engine.executeJob("job-missing"));
        assertThrows(WorkflowNotFoundException.class, () -> engine.createJob("missing", Map.of()));
        assertThrows(WorkflowNotFoundException.class, () -> engine.createJob("wf", "9", Map.of()));
    }

    @Test
    void eventsFollowExecutionOrder() throws Exception {
        register("wf",
                StepSpec.builder("a", "echo").build(),
                StepSpec.builder("b", "echo").dependsOn("a").build());
        String jobId = engine.createJob("wf", Map.of());
        engine.executeJob(jobId).get(10, TimeUnit.SECONDS);

        List<JobEvent> events = eventBus.replay(jobId);
        assertEquals(List.of(
                EventType.JOB_CREATED, EventType.JOB_STARTED,
                EventType.LEVEL_STARTED, EventType.STEP_STARTED, EventType.STEP_COMPLETED,
                EventType.CHECKPOINT_SAVED, EventType.LEVEL_COMPLETED,
                EventType.LEVEL_STARTED, EventType.STEP_STARTED, EventType.STEP_COMPLETED,
                EventType.CHECKPOINT_SAVED, EventType.LEVEL_COMPLETED,
                EventType.JOB_COMPLETED), events.stream().map(JobEvent::getType).toList());
        for (int i = 1; i < events.size(); i++) {
            assertEquals(events.get(i - 1).getSequence() + 1, events.get(i).getSequence());
        }
    }

    @Test
    void autoCleanupKeepsConfiguredCheckpoints() throws Exception {
        engine.shutdown();
        QuillConfiguration config = testConfiguration();
        config.setProperty(QuillConfiguration.CHECKPOINT_AUTO_CLEANUP, "true");
        config.setProperty(QuillConfiguration.CHECKPOINT_KEEP_LAST, "2");
        config.setProperty(QuillConfiguration.CHECKPOINT_KEEP_AFTER_COMPLETION, "1");
        engine = engine(config, new InMemoryCheckpointStore());
        register("chain",
                StepSpec.builder("a", "echo").build(),
                StepSpec.builder("b", "echo").dependsOn("a").build(),
                StepSpec.builder("c", "echo").dependsOn("b").build());

        String jobId = engine.createJob("chain", Map.of());
        engine.executeJob(jobId).get(10, TimeUnit.SECONDS);

        assertEquals(List.of("level-2"), markers(jobId));
        assertEquals(0, engine.cleanupCheckpoints(jobId, 0).getKept());
    }

    @Test
    void fileStoreFromConfiguration(@TempDir Path checkpointDir) throws Exception {
        engine.shutdown();
        QuillConfiguration config = testConfiguration();
        config.setProperty(QuillConfiguration.CHECKPOINT_STORAGE_TYPE, "file");
        config.setProperty(QuillConfiguration.CHECKPOINT_STORAGE_DIR, checkpointDir.toString());
        engine = SimpleJobExecutionEngine.builder(workflows, steps).configuration(config).eventBus(eventBus).build();
        register("wf",
                StepSpec.builder("a", "echo").build(),
                StepSpec.builder("b", "echo").dependsOn("a").build());

        String jobId = engine.createJob("wf", Map.of());
        engine.executeJob(jobId).get(10, TimeUnit.SECONDS);

        try (Stream<Path> files = Files.list(checkpointDir.resolve(jobId))) {
            assertEquals(2, files.filter(p -> p.toString().endsWith(".json")).count());
        }
        CheckpointSnapshot restored = engine.restoreCheckpoint(engine.listCheckpoints(jobId).get(0).getCheckpointId());
        assertEquals(2, restored.getNextLevelIndex());
        assertEquals("b:[a]", restored.getStepOutputs().get("b"));
    }

    @Test
    void recoverRebuildsPausedJobInAnotherEngine(@TempDir Path checkpointDir) throws Exception {
        engine.shutdown();
        engine = fileEngine(checkpointDir);
        registerGatedWorkflow();
        String jobId = engine.createJob("gated", Map.of("topic", "java"));
        var execution = engine.executeJob(jobId);
        assertTrue(gateStarted.await(5, TimeUnit.SECONDS));
        engine.pauseJob(jobId);
        gateRelease.countDown();
        assertEquals(JobStatus.PAUSED, execution.get(10, TimeUnit.SECONDS));
        engine.shutdown();

        SimpleJobExecutionEngine restarted = fileEngine(checkpointDir);
        engine = restarted;
        assertThrows(JobNotFoundException.class, () -> restarted.getStatus(jobId));

        Job recovered = restarted.recoverJob(jobId);

        assertEquals(JobStatus.PAUSED, recovered.getStatus());
        assertEquals(1, recovered.getCurrentLevel());
        assertEquals(Set.of("gate", "side"), recovered.getCompletedSteps());
        assertEquals(Map.of("topic", "java"), recovered.getInputs());
        assertSame(recovered, restarted.recoverJob(jobId));
        assertEquals(EventType.JOB_RECOVERED, last(eventBus.replay(jobId)).getType());

        assertEquals(JobStatus.COMPLETED, restarted.resumeJob(jobId, null).get(10, TimeUnit.SECONDS));
        assertEquals("after:[gate, side]", restarted.getJob(jobId).getOutputs().get("after"));
        assertEquals(List.of("level-1", "level-0"), markers(jobId));
    }

    @Test
    void recoverKeepsTerminalOutcome(@TempDir Path checkpointDir) throws Exception {
        engine.shutdown();
        engine = fileEngine(checkpointDir);
        register("wf",
                StepSpec.builder("A", "constant").build(),
                StepSpec.builder("B", "boom").build(),
                StepSpec.builder("C", "echo").dependsOn("A", "B").build());
        String failed = engine.createJob("wf", Map.of());
        assertEquals(JobStatus.FAILED, engine.executeJob(failed).get(10, TimeUnit.SECONDS));
        engine.shutdown();

        engine = fileEngine(checkpointDir);
        Job recovered = engine.recoverJob(failed);

        assertEquals(JobStatus.FAILED, recovered.getStatus());
        assertEquals("Step B failed: boom", recovered.getErrorMessage().orElseThrow());
        assertThrows(InvalidTransitionException.class, () -> engine.resumeJob(failed, null));
        assertThrows(JobNotFoundException.class, () -> engine.recoverJob("job-never-saved"));
    }

    @Test
    void listJobsReportsTrackedJobsOldestFirst() throws Exception {
        register("wf", StepSpec.builder("a", "echo").build());
        String first = engine.createJob("wf", Map.of());
        Thread.sleep(5);
        String second = engine.createJob("wf", Map.of());
        engine.executeJob(second).get(10, TimeUnit.SECONDS);

        assertThat(engine.listJobs())
                .extracting(JobStatusReport::getJobId)
                .containsExactly(first, second);
        assertThat(engine.listJobs(JobStatus.COMPLETED))
                .extracting(JobStatusReport::getJobId)
                .containsExactly(second);
        assertThat(engine.listJobs(JobStatus.RUNNING)).isEmpty();
    }

    @Test
    void deleteJobReleasesItsState() throws Exception {
        register("chain",
                StepSpec.builder("a", "echo").build(),
                StepSpec.builder("b", "echo").dependsOn("a").build());
        String pending = engine.createJob("chain", Map.of());
        String done = engine.createJob("chain", Map.of());
        engine.executeJob(done).get(10, TimeUnit.SECONDS);
        assertEquals(2, engine.listCheckpoints(done).size());

        assertThrows(IllegalStateException.class, () -> engine.deleteJob(pending, true));
        engine.deleteJob(done, true);

        assertThrows(JobNotFoundException.class, () -> engine.getStatus(done));
        assertTrue(eventBus.replay(done).isEmpty());
        assertTrue(engine.listCheckpoints(done).isEmpty());
        assertEquals(1, eventBus.getChannelCount());
        assertThat(engine.listJobs()).extracting(JobStatusReport::getJobId).containsExactly(pending);
        assertThrows(JobNotFoundException.class, () -> engine.deleteJob(done, true));
    }

    @Test
    void deleteJobCanKeepCheckpointsForRecovery() throws Exception {
        register("wf", StepSpec.builder("a", "echo").build());
        String jobId = engine.createJob("wf", Map.of());
        engine.executeJob(jobId).get(10, TimeUnit.SECONDS);

        engine.deleteJob(jobId, false);

        assertEquals(List.of("level-0"), markers(jobId));
        assertEquals(JobStatus.COMPLETED, engine.recoverJob(jobId).getStatus());
    }

    @Test
    void injectedMetricsTrackThisEngineOnly() throws Exception {
        engine.shutdown();
        WorkflowMetrics metrics = new WorkflowMetrics(OpenTelemetry.noop().getMeter(WorkflowMetrics.METER_NAME));
        engine = SimpleJobExecutionEngine.builder(workflows, steps)
                .configuration(testConfiguration())
                .eventBus(eventBus)
                .checkpointStore(new InMemoryCheckpointStore())
                .metrics(metrics)
                .build();
        registerGatedWorkflow();

        String jobId = engine.createJob("gated", Map.of());
        var execution = engine.executeJob(jobId);
        assertTrue(gateStarted.await(5, TimeUnit.SECONDS));
        engine.pauseJob(jobId);
        gateRelease.countDown();
        assertEquals(JobStatus.PAUSED, execution.get(10, TimeUnit.SECONDS));
        assertEquals(1, metrics.getActiveJobs());

        engine.resumeJob(jobId, null).get(10, TimeUnit.SECONDS);
        assertEquals(0, metrics.getActiveJobs());
    }

    @Test
    void negativeRetentionDoesNotFailJobs() throws Exception {
        engine.shutdown();
        QuillConfiguration config = testConfiguration();
        config.setProperty(QuillConfiguration.CHECKPOINT_AUTO_CLEANUP, "true");
        config.setProperty(QuillConfiguration.CHECKPOINT_KEEP_LAST, "-2");
        config.setProperty(QuillConfiguration.CHECKPOINT_KEEP_AFTER_COMPLETION, "-1");
        engine = engine(config, new InMemoryCheckpointStore());
        register("chain",
                StepSpec.builder("a", "echo").build(),
                StepSpec.builder("b", "echo").dependsOn("a").build());

        String jobId = engine.createJob("chain", Map.of());

        assertEquals(JobStatus.COMPLETED, engine.executeJob(jobId).get(10, TimeUnit.SECONDS));
        assertTrue(engine.listCheckpoints(jobId).isEmpty());
    }

    @Test
    void unknownStorageTypeIsRejected() {
        QuillConfiguration config = testConfiguration();
        config.setProperty(QuillConfiguration.CHECKPOINT_STORAGE_TYPE, "s3");

        assertThrows(IllegalArgumentException.class,
                () -> SimpleJobExecutionEngine.builder(workflows, steps).configuration(config).build());
    }

    @Test
    void executeAfterShutdownFails() throws Exception {
        register("wf", StepSpec.builder("a", "echo").build());
        String jobId = engine.createJob("wf", Map.of());
        engine.shutdown();

        assertTrue(engine.executeJob(jobId).isCompletedExceptionally());
        assertThrows(IllegalStateException.class, () -> engine.createJob("wf", Map.of()));
    }

    private void registerGatedWorkflow() throws Exception {
        register("gated",
                StepSpec.builder("gate", "gate").build(),
                StepSpec.builder("side", "constant").build(),
                StepSpec.builder("after", "echo").dependsOn("gate").build());
    }

    private void register(String workflowId, StepSpec... specs) throws Exception {
        workflows.register(new WorkflowDefinition(workflowId, "1", List.of(specs)));
    }

    private List<String> markers(String jobId) throws Exception {
        return engine.listCheckpoints(jobId).stream().map(Checkpoint::getMarker).toList();
    }

    private SimpleJobExecutionEngine engine(QuillConfiguration config, InMemoryCheckpointStore store) {
        return SimpleJobExecutionEngine.builder(workflows, steps)
                .configuration(config)
                .eventBus(eventBus)
                .checkpointStore(store)
                .build();
    }

    private SimpleJobExecutionEngine fileEngine(Path checkpointDir) {
        QuillConfiguration config = testConfiguration();
        config.setProperty(QuillConfiguration.CHECKPOINT_STORAGE_TYPE, "file");
        config.setProperty(QuillConfiguration.CHECKPOINT_STORAGE_DIR, checkpointDir.toString());
        return SimpleJobExecutionEngine.builder(workflows, steps).configuration(config).eventBus(eventBus).build();
    }

    private static QuillConfiguration testConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(QuillConfiguration.METRICS_ENABLED, "false");
        properties.setProperty(QuillConfiguration.CHECKPOINT_STORAGE_TYPE, "memory");
        properties.setProperty(QuillConfiguration.CHECKPOINT_AUTO_CLEANUP, "false");
        properties.setProperty(QuillConfiguration.CHECKPOINT_SAVE_RETRY_DELAY_MS, "0");
        properties.setProperty(QuillConfiguration.STEP_RETRY_DELAY_MS, "5");
        properties.setProperty(QuillConfiguration.STEP_DEFAULT_TIMEOUT_MS, "5000");
        return new QuillConfiguration(properties);
    }

    private static JobEvent last(List<JobEvent> events) {
        return events.get(events.size() - 1);
    }
}
