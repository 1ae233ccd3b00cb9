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

package dev.mars.quill.workflow.execution;

import dev.mars.quill.config.QuillConfiguration;
import dev.mars.quill.core.exceptions.StepTimeoutException;
import dev.mars.quill.event.EventBus;
import dev.mars.quill.event.EventType;
import dev.mars.quill.event.JobEvent;
import dev.mars.quill.workflow.ExecutionLevel;
import dev.mars.quill.workflow.StepSpec;
import dev.mars.quill.workflow.step.Step;
import dev.mars.quill.workflow.step.StepContext;
import dev.mars.quill.workflow.step.StepRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the steps of one execution level concurrently with bounded parallelism.
 *
 * <p>Each step is an independent task admitted against a shared {@link Semaphore};
 * steps beyond the limit wait for a free permit. Every attempt runs on the step pool
 * and is bounded by the step timeout; a timed-out attempt is cancelled by interruption
 * without affecting its siblings. Failed attempts are retried with linear backoff
 * ({@code retryDelay * attempt}).</p>
 *
 * <p>Mutual exclusion inside a level:</p>
 * <ul>
 *   <li>a non-parallel step without a tag holds the level's write lock and runs alone</li>
 *   <li>a non-parallel step with an exclusive tag holds that tag's write lock, so it never
 *       overlaps a sibling sharing the tag</li>
 *   <li>a parallel step with an exclusive tag holds that tag's read lock and may overlap
 *       other parallel steps of the same tag</li>
 *   <li>every step except the untagged non-parallel one also holds the level's read lock</li>
 * </ul>
 *
 * <p>{@link #executeLevel} blocks until every step has succeeded, failed or timed out and
 * never writes job state: results are returned for the caller to merge.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ParallelExecutor {

    private static final Logger logger = Logger.getLogger(ParallelExecutor.class.getName());

    private final StepRegistry stepRegistry;
    private final EventBus eventBus;
    private final int maxConcurrency;
    private final Duration defaultTimeout;
    private final long retryDelayMs;
    private final Semaphore permits;
    private final ExecutorService dispatchPool;
    private final ExecutorService stepPool;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public ParallelExecutor(StepRegistry stepRegistry, EventBus eventBus, QuillConfiguration config) {
        this(stepRegistry, eventBus, config.getMaxConcurrency(), config.getDefaultStepTimeout(),
                config.getStepRetryDelayMs());
    }

    public ParallelExecutor(StepRegistry stepRegistry, EventBus eventBus, int maxConcurrency,
                            Duration defaultTimeout, long retryDelayMs) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("Max concurrency must be at least 1: " + maxConcurrency);
        }
        this.stepRegistry = Objects.requireNonNull(stepRegistry, "Step registry cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.maxConcurrency = maxConcurrency;
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "Default timeout cannot be null");
        this.retryDelayMs = retryDelayMs;
        this.permits = new Semaphore(maxConcurrency, true);
        this.dispatchPool = Executors.newCachedThreadPool(daemonThreads("quill-dispatch-"));
        this.stepPool = Executors.newCachedThreadPool(daemonThreads("quill-step-"));

        logger.info("ParallelExecutor initialized with " + maxConcurrency + " max concurrent steps");
    }

    /**
     * Executes every given step of the level and waits for all of them.
     *
     * @param jobId   owning job, used for events and step contexts
     * @param level   the level being executed
     * @param steps   the steps to dispatch; may be a subset of the level
     * @param inputs  job inputs
     * @param outputs outputs of steps completed in earlier levels
     * @return one result per dispatched step
     */
    public LevelResult executeLevel(String jobId, ExecutionLevel level, List<StepSpec> steps,
                                    Map<String, Object> inputs, Map<String, Object> outputs) {
        if (shutdown.get()) {
            throw new IllegalStateException("Parallel executor is shutdown");
        }

        ReentrantReadWriteLock levelLock = new ReentrantReadWriteLock(true);
        Map<String, ReentrantReadWriteLock> tagLocks = new HashMap<>();
        for (StepSpec step : steps) {
            step.getExclusiveTag().ifPresent(
                    tag -> tagLocks.computeIfAbsent(tag, t -> new ReentrantReadWriteLock(true)));
        }

        Map<String, CompletableFuture<StepResult>> futures = new LinkedHashMap<>();
        for (StepSpec step : steps) {
            StepContext context = StepContext.builder(jobId, step.getId())
                    .params(step.getParams())
                    .inputs(inputs)
                    .outputs(outputs)
                    .build();
            List<Lock> locks = locksFor(step, levelLock, tagLocks);
            futures.put(step.getId(), CompletableFuture.supplyAsync(
                    () -> runGuarded(step, context, locks), dispatchPool));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0])).join();

        Map<String, StepResult> results = new LinkedHashMap<>();
        futures.forEach((stepId, future) -> results.put(stepId, future.join()));
        LevelResult levelResult = new LevelResult(level.getIndex(), results);
        logger.fine("Level " + level.getIndex() + " of job " + jobId + " finished: " + levelResult);
        return levelResult;
    }

    private List<Lock> locksFor(StepSpec step, ReentrantReadWriteLock levelLock,
                                Map<String, ReentrantReadWriteLock> tagLocks) {
        List<Lock> locks = new ArrayList<>(2);
        boolean exclusiveLevel = !step.isParallel() && step.getExclusiveTag().isEmpty();
        locks.add(exclusiveLevel ? levelLock.writeLock() : levelLock.readLock());
        step.getExclusiveTag().ifPresent(tag -> {
            ReentrantReadWriteLock tagLock = tagLocks.get(tag);
            locks.add(step.isParallel() ? tagLock.readLock() : tagLock.writeLock());
        });
        return locks;
    }

    private StepResult runGuarded(StepSpec step, StepContext context, List<Lock> locks) {
        Instant started = Instant.now();
        int acquiredLocks = 0;
        boolean permitAcquired = false;
        try {
            for (Lock lock : locks) {
                lock.lockInterruptibly();
                acquiredLocks++;
            }
            permits.acquire();
            permitAcquired = true;
            return runWithRetries(step, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepResult.failed(step.getId(), "Interrupted before completion", e, 0,
                    Duration.between(started, Instant.now()));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error running step " + step.getId() + ": " + e.getMessage(), e);
            return StepResult.failed(step.getId(), e.getMessage(), e, 0, Duration.between(started, Instant.now()));
        } finally {
            if (permitAcquired) {
                permits.release();
            }
            for (int i = acquiredLocks - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }

    private StepResult runWithRetries(StepSpec step, StepContext baseContext) throws InterruptedException {
        String jobId = baseContext.getJobId();
        String stepId = step.getId();
        Duration timeout = step.getTimeout().orElse(defaultTimeout);
        int maxAttempts = step.getRetries() + 1;
        Instant started = Instant.now();

        Step executable;
        try {
            executable = stepRegistry.create(step.getRef());
        } catch (IllegalArgumentException e) {
            publish(EventType.STEP_FAILED, jobId, stepId, failurePayload("FAILED", e.getMessage(), 0));
            return StepResult.failed(stepId, e.getMessage(), e, 0, Duration.ZERO);
        }

        Throwable lastError = null;
        boolean timedOut = false;
        int attempt = 0;

        while (attempt < maxAttempts) {
            attempt++;
            Map<String, Object> startPayload = new LinkedHashMap<>();
            startPayload.put("attempt", attempt);
            startPayload.put("ref", step.getRef());
            publish(EventType.STEP_STARTED, jobId, stepId, startPayload);

            AtomicBoolean attemptCancelled = new AtomicBoolean(false);
            StepContext context = baseContext.forAttempt(attempt, () -> attemptCancelled.get() || shutdown.get());
            Future<Object> future = stepPool.submit(() -> executable.execute(context));

            try {
                Object output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                Duration duration = Duration.between(started, Instant.now());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("attempts", attempt);
                payload.put("durationMs", duration.toMillis());
                publish(EventType.STEP_COMPLETED, jobId, stepId, payload);
                logger.fine("Step " + stepId + " of job " + jobId + " succeeded on attempt " + attempt);
                return StepResult.succeeded(stepId, output, attempt, duration);
            } catch (TimeoutException e) {
                attemptCancelled.set(true);
                future.cancel(true);
                lastError = new StepTimeoutException(stepId, timeout);
                timedOut = true;
            } catch (ExecutionException e) {
                lastError = e.getCause() != null ? e.getCause() : e;
                timedOut = false;
            } catch (InterruptedException e) {
                attemptCancelled.set(true);
                future.cancel(true);
                throw e;
            }

            logger.log(Level.WARNING, String.format("Step attempt %d/%d failed for %s in job %s: %s",
                    attempt, maxAttempts, stepId, jobId, lastError.getMessage()));

            if (attempt < maxAttempts) {
                long delay = retryDelayMs * attempt;
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("attempt", attempt);
                payload.put("nextAttempt", attempt + 1);
                payload.put("delayMs", delay);
                payload.put("error", describe(lastError));
                publish(EventType.STEP_RETRY, jobId, stepId, payload);
                if (delay > 0) {
                    Thread.sleep(delay);
                }
            }
        }

        Duration duration = Duration.between(started, Instant.now());
        String message = describe(lastError);
        publish(EventType.STEP_FAILED, jobId, stepId,
                failurePayload(timedOut ? "TIMED_OUT" : "FAILED", message, attempt));
        logger.warning("Step " + stepId + " of job " + jobId + " failed after " + attempt + " attempt(s): " + message);
        return timedOut
                ? StepResult.timedOut(stepId, message, lastError, attempt, duration)
                : StepResult.failed(stepId, message, lastError, attempt, duration);
    }

    private static Map<String, Object> failurePayload(String status, String error, int attempts) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status);
        payload.put("error", error);
        payload.put("attempts", attempts);
        return payload;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private void publish(EventType type, String jobId, String stepId, Map<String, Object> payload) {
        eventBus.publish(JobEvent.forStep(type, jobId, stepId, payload));
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }

    /**
     * Stops accepting levels and interrupts any running step attempts.
     */
    public void shutdown() {
        if (shutdown.getAndSet(true)) {
            return;
        }
        logger.info("Shutting down parallel executor...");
        dispatchPool.shutdownNow();
        stepPool.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
