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

package dev.mars.quill.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the job execution engine.
 *
 * Provides:
 * - quill.jobs.active (gauge) - Jobs running or paused
 * - quill.jobs.total (counter) - Jobs started
 * - quill.jobs.completed (counter) - Jobs that ran every level
 * - quill.jobs.failed (counter) - Failed jobs
 * - quill.jobs.cancelled (counter) - Cancelled jobs
 * - quill.steps.total (counter) - Steps executed
 * - quill.steps.failed (counter) - Steps that failed or timed out
 * - quill.jobs.duration.seconds (histogram) - Job duration distribution
 *
 * Engines take an instance through their builder; {@link #getInstance()} is the
 * default, bound to the global OpenTelemetry meter provider.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    public static final String METER_NAME = "quill-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter jobsTotal;
    private final LongCounter jobsCompleted;
    private final LongCounter jobsFailed;
    private final LongCounter jobsCancelled;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final DoubleHistogram jobDuration;

    private final AtomicLong activeJobs = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> STEP_REF_KEY = AttributeKey.stringKey("step.ref");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    public WorkflowMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        jobsTotal = meter.counterBuilder("quill.jobs.total")
                .setDescription("Total number of jobs started")
                .setUnit("1")
                .build();

        jobsCompleted = meter.counterBuilder("quill.jobs.completed")
                .setDescription("Number of completed jobs")
                .setUnit("1")
                .build();

        jobsFailed = meter.counterBuilder("quill.jobs.failed")
                .setDescription("Number of failed jobs")
                .setUnit("1")
                .build();

        jobsCancelled = meter.counterBuilder("quill.jobs.cancelled")
                .setDescription("Number of cancelled jobs")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("quill.steps.total")
                .setDescription("Total number of steps executed")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("quill.steps.failed")
                .setDescription("Number of steps that failed or timed out")
                .setUnit("1")
                .build();

        jobDuration = meter.histogramBuilder("quill.jobs.duration.seconds")
                .setDescription("Job duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("quill.jobs.active")
                .setDescription("Number of jobs running or paused")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeJobs.get()));

        logger.info("WorkflowMetrics initialized");
    }

    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    public void recordJobStarted(String workflowId) {
        jobsTotal.add(1, workflowAttributes(workflowId));
        activeJobs.incrementAndGet();
    }

    /**
     * Counts a paused job reloaded from a checkpoint as active without counting a new start.
     */
    public void recordJobRecovered() {
        activeJobs.incrementAndGet();
    }

    public void recordJobCompleted(String workflowId, double durationSeconds) {
        activeJobs.decrementAndGet();
        Attributes attrs = workflowAttributes(workflowId);
        jobsCompleted.add(1, attrs);
        jobDuration.record(durationSeconds, attrs);
    }

    public void recordJobFailed(String workflowId, String failureReason) {
        activeJobs.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        jobsFailed.add(1, attrs);
    }

    public void recordJobCancelled(String workflowId) {
        activeJobs.decrementAndGet();
        jobsCancelled.add(1, workflowAttributes(workflowId));
    }

    public void recordStepExecuted(String workflowId, String stepRef) {
        stepsTotal.add(1, stepAttributes(workflowId, stepRef));
    }

    /**
     * Record a step that failed or timed out after its last attempt.
     */
    public void recordStepFailed(String workflowId, String stepRef) {
        stepsFailed.add(1, stepAttributes(workflowId, stepRef));
    }

    public long getActiveJobs() {
        return activeJobs.get();
    }

    private static Attributes workflowAttributes(String workflowId) {
        return Attributes.of(WORKFLOW_ID_KEY, workflowId);
    }

    private static Attributes stepAttributes(String workflowId, String stepRef) {
        return Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(STEP_REF_KEY, stepRef)
                .build();
    }
}
