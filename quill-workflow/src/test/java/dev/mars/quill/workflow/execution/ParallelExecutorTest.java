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

import dev.mars.quill.core.StepStatus;
import dev.mars.quill.core.exceptions.StepTimeoutException;
import dev.mars.quill.event.EventFilter;
import dev.mars.quill.event.EventType;
import dev.mars.quill.event.JobEvent;
import dev.mars.quill.event.SimpleEventBus;
import dev.mars.quill.workflow.ExecutionLevel;
import dev.mars.quill.workflow.StepSpec;
import dev.mars.quill.workflow.TestSteps;
import dev.mars.quill.workflow.step.StepRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParallelExecutorTest {

    private StepRegistry registry;
    private SimpleEventBus eventBus;
    private List<JobEvent> events;
    private ParallelExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new StepRegistry();
        eventBus = new SimpleEventBus();
        events = Collections.synchronizedList(new ArrayList<>());
        eventBus.subscribe(EventFilter.all(), events::add);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void collectsEveryResultWhenSomeStepsFail() {
        registry.registerInstance("ok", TestSteps.constant("done"));
        registry.registerInstance("boom", TestSteps.failing("kaput"));
        executor = new ParallelExecutor(registry, eventBus, 4, Duration.ofSeconds(5), 0);

        List<StepSpec> steps = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            steps.add(StepSpec.builder("s" + i, i % 3 == 0 ? "boom" : "ok").build());
        }
        LevelResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), Map.of());

        assertEquals(6, result.getResults().size());
        assertEquals(4, result.getSuccessCount());
        assertEquals(2, result.getFailureCount());
        assertFalse(result.isSuccessful());
        assertEquals("kaput", result.get("s0").getErrorMessage().orElseThrow());
        assertEquals(StepStatus.FAILED, result.get("s3").getStatus());
        assertEquals("done", result.getOutputs().get("s1"));
        assertFalse(result.getOutputs().containsKey("s0"));
    }

    @Test
    void timeoutOnlyAffectsSlowStep() {
        registry.registerInstance("slow", TestSteps.sleeping(5_000, "late"));
        registry.registerInstance("fast", TestSteps.sleeping(50, "fast"));
        executor = new ParallelExecutor(registry, eventBus, 4, Duration.ofSeconds(5), 0);

        List<StepSpec> steps = List.of(
                StepSpec.builder("slow", "slow").timeout(Duration.ofMillis(200)).build(),
                StepSpec.builder("fast", "fast").build());
        long started = System.nanoTime();
        LevelResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), Map.of());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertEquals(StepStatus.TIMED_OUT, result.get("slow").getStatus());
        assertInstanceOf(StepTimeoutException.class, result.get("slow").getCause().orElseThrow());
        assertTrue(result.get("fast").isSuccessful());
        assertThat(elapsedMs).isLessThan(3_000);
    }

    @Test
    void concurrencyNeverExceedsLimit() {
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        registry.registerInstance("tracked", TestSteps.concurrencyTracker(current, peak, 100));
        executor = new ParallelExecutor(registry, eventBus, 3, Duration.ofSeconds(5), 0);

        List<StepSpec> steps = IntStream.range(0, 10)
                .mapToObj(i -> StepSpec.builder("p" + i, "tracked").build())
                .collect(Collectors.toList());
        LevelResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), Map.of());

        assertTrue(result.isSuccessful());
        assertThat(peak.get()).isBetween(1, 3);
        assertEquals(3, executor.getAvailablePermits());
    }

    @Test
    void parallelStepsSharingTagMayOverlap() {
        AtomicInteger tagged = new AtomicInteger();
        AtomicInteger taggedPeak = new AtomicInteger();
        registry.registerInstance("llm", TestSteps.concurrencyTracker(tagged, taggedPeak, 150));
        executor = new ParallelExecutor(registry, eventBus, 8, Duration.ofSeconds(5), 0);

        List<StepSpec> steps = IntStream.range(0, 3)
                .mapToObj(i -> StepSpec.builder("llm" + i, "llm").exclusiveTag("llm").build())
                .collect(Collectors.toList());
        LevelResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), Map.of());

        assertTrue(result.isSuccessful());
        assertThat(taggedPeak.get()).isGreaterThan(1);
    }

    @Test
    void nonParallelTaggedStepExcludesOnlyItsTag() {
        AtomicInteger tagged = new AtomicInteger();
        AtomicInteger free = new AtomicInteger();
        AtomicInteger freePeak = new AtomicInteger();
        Map<String, Integer> taggedSeen = new HashMap<>();
        registry.registerInstance("llm", context -> {
            int now = tagged.incrementAndGet();
            try {
                Thread.sleep(80);
                synchronized (taggedSeen) {
                    taggedSeen.put(context.getStepId(), Math.max(now, tagged.get()));
                }
            } finally {
                tagged.decrementAndGet();
            }
            return now;
        });
        registry.registerInstance("io", TestSteps.concurrencyTracker(free, freePeak, 200));
        executor = new ParallelExecutor(registry, eventBus, 8, Duration.ofSeconds(5), 0);

        List<StepSpec> steps = new ArrayList<>();
        steps.add(StepSpec.builder("llm0", "llm").exclusiveTag("llm").build());
        steps.add(StepSpec.builder("llm1", "llm").exclusiveTag("llm").build());
        steps.add(StepSpec.builder("solo", "llm").exclusiveTag("llm").parallel(false).build());
        steps.add(StepSpec.builder("llm2", "llm").exclusiveTag("llm").build());
        for (int i = 0; i < 3; i++) {
            steps.add(StepSpec.builder("io" + i, "io").build());
        }
        LevelResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), Map.of());

        assertTrue(result.isSuccessful());
        assertEquals(1, taggedSeen.get("solo"));
        assertThat(freePeak.get()).isGreaterThan(1);
    }

    @Test
    void nonParallelStepRunsAlone() {
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Map<String, Integer> seenByStep = new HashMap<>();
        registry.registerInstance("tracked", TestSteps.concurrencyTracker(current, peak, 60));
        registry.registerInstance("solo", context -> {
            int now = current.incrementAndGet();
            try {
                Thread.sleep(60);
                synchronized (seenByStep) {
                    seenByStep.put(context.getStepId(), Math.max(now, current.get()));
                }
            } finally {
                current.decrementAndGet();
            }
            return now;
        });
        executor = new ParallelExecutor(registry, eventBus, 8, Duration.ofSeconds(5), 0);

        List<StepSpec> steps = List.of(
                StepSpec.builder("a", "tracked").build(),
                StepSpec.builder("b", "tracked").build(),
                StepSpec.builder("solo", "solo").parallel(false).build(),
                StepSpec.builder("c", "tracked").build());
        LevelResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), Map.of());

        assertTrue(result.isSuccessful());
        assertEquals(1, seenByStep.get("solo"));
        assertEquals(1, result.get("solo").getOutput());
    }

    @Test
    void retriesUntilSuccessAndPublishesRetryEvents() {
        AtomicInteger attempts = new AtomicInteger();
        registry.registerInstance("flaky", TestSteps.flaky(2, attempts));
        executor = new ParallelExecutor(registry, eventBus, 2, Duration.ofSeconds(5), 10);

        List<StepSpec> steps = List.of(StepSpec.builder("flaky", "flaky").retries(2).build());
        LevelResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), Map.of());

        StepResult flaky = result.get("flaky");
        assertTrue(flaky.isSuccessful());
        assertEquals(3, flaky.getAttempts());
        assertEquals("ok after 3", flaky.getOutput());

        List<EventType> types = events.stream().map(JobEvent::getType).toList();
        assertEquals(List.of(EventType.STEP_STARTED, EventType.STEP_RETRY, EventType.STEP_STARTED,
                EventType.STEP_RETRY, EventType.STEP_STARTED, EventType.STEP_COMPLETED), types);
        assertEquals(20L, events.get(3).getPayload().get("delayMs"));
    }

    @Test
    void exhaustedRetriesReportFailure() {
        AtomicInteger attempts = new AtomicInteger();
        registry.registerInstance("flaky", TestSteps.flaky(5, attempts));
        executor = new ParallelExecutor(registry, eventBus, 2, Duration.ofSeconds(5), 0);

        List<StepSpec> steps = List.of(StepSpec.builder("flaky", "flaky").retries(1).build());
        StepResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), Map.of()).get("flaky");

        assertEquals(StepStatus.FAILED, result.getStatus());
        assertEquals(2, result.getAttempts());
        assertEquals(2, attempts.get());
        assertEquals(EventType.STEP_FAILED, events.get(events.size() - 1).getType());
    }

    @Test
    void unknownRefFailsWithoutRetry() {
        executor = new ParallelExecutor(registry, eventBus, 2, Duration.ofSeconds(5), 0);

        List<StepSpec> steps = List.of(StepSpec.builder("ghost", "missing").retries(3).build());
        StepResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), Map.of()).get("ghost");

        assertEquals(StepStatus.FAILED, result.getStatus());
        assertEquals(0, result.getAttempts());
    }

    @Test
    void stepsSeeReadOnlyUpstreamOutputsAndParams() {
        registry.registerInstance("mutator", context -> {
            context.getOutputs().put("outline", "tampered");
            return "unreachable";
        });
        registry.registerInstance("params", TestSteps.paramsEcho());
        registry.registerInstance("echo", TestSteps.echo());
        executor = new ParallelExecutor(registry, eventBus, 2, Duration.ofSeconds(5), 0);

        Map<String, Object> outputs = new HashMap<>(Map.of("outline", "# Title"));
        List<StepSpec> steps = List.of(
                StepSpec.builder("mutate", "mutator").build(),
                StepSpec.builder("draft", "echo").build(),
                StepSpec.builder("cfg", "params").param("words", 800).build());
        LevelResult result = executor.executeLevel("job-1", level(steps), steps, Map.of(), outputs);

        assertInstanceOf(UnsupportedOperationException.class, result.get("mutate").getCause().orElseThrow());
        assertEquals("# Title", outputs.get("outline"));
        assertEquals("draft:[outline]", result.get("draft").getOutput());
        assertEquals(Map.of("words", 800), result.get("cfg").getOutput());
    }

    @Test
    void rejectsLevelsAfterShutdown() {
        executor = new ParallelExecutor(registry, eventBus, 2, Duration.ofSeconds(5), 0);
        executor.shutdown();

        assertThrows(IllegalStateException.class,
                () -> executor.executeLevel("job-1", new ExecutionLevel(0, List.of()), List.of(), Map.of(), Map.of()));
    }

    private static ExecutionLevel level(List<StepSpec> steps) {
        return new ExecutionLevel(0, steps.stream().map(StepSpec::getId).toList());
    }
}
