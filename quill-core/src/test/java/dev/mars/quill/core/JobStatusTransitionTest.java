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

package dev.mars.quill.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parameterized tests for JobStatus transition validation.
 * Covers every (source, target) pair of the job state machine.
 */
class JobStatusTransitionTest {

    private static final EnumSet<JobStatus> FROM_PENDING = EnumSet.of(JobStatus.RUNNING);

    private static final EnumSet<JobStatus> FROM_RUNNING =
            EnumSet.of(JobStatus.PAUSED, JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);

    private static final EnumSet<JobStatus> FROM_PAUSED = EnumSet.of(JobStatus.RUNNING, JobStatus.CANCELLED);

    private static EnumSet<JobStatus> validTargets(JobStatus from) {
        return switch (from) {
            case PENDING -> FROM_PENDING;
            case RUNNING -> FROM_RUNNING;
            case PAUSED -> FROM_PAUSED;
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    static Stream<Arguments> allJobStatusPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (JobStatus from : JobStatus.values()) {
            Set<JobStatus> valid = validTargets(from);
            for (JobStatus to : JobStatus.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest(name = "{0} → {1} should be {2}")
    @MethodSource("allJobStatusPairs")
    void canTransitionTo_coversAllPairs(JobStatus from, JobStatus to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to),
                () -> String.format("%s → %s should be %s", from, to, expected ? "valid" : "invalid"));
    }

    @ParameterizedTest(name = "getValidTransitions consistent for {0}")
    @EnumSource(JobStatus.class)
    void getValidTransitions_matchesCanTransitionTo(JobStatus from) {
        Set<JobStatus> fromMethod = EnumSet.noneOf(JobStatus.class);
        fromMethod.addAll(Arrays.asList(from.getValidTransitions()));

        Set<JobStatus> fromCanTransition = EnumSet.noneOf(JobStatus.class);
        for (JobStatus to : JobStatus.values()) {
            if (from.canTransitionTo(to)) {
                fromCanTransition.add(to);
            }
        }
        assertEquals(fromCanTransition, fromMethod);
    }

    @ParameterizedTest(name = "{0} is terminal iff it has no outgoing transitions")
    @EnumSource(JobStatus.class)
    void terminalStatuses_haveNoTransitions(JobStatus status) {
        assertEquals(status.isTerminal(), status.getValidTransitions().length == 0);
    }

    @Test
    void activeStatuses() {
        assertTrue(JobStatus.RUNNING.isActive());
        assertTrue(JobStatus.PAUSED.isActive());
        assertFalse(JobStatus.PENDING.isActive());
        assertFalse(JobStatus.COMPLETED.isActive());
    }

    @Test
    void stepStatusClassification() {
        assertTrue(StepStatus.SUCCEEDED.isSuccessful());
        assertTrue(StepStatus.FAILED.isFailure());
        assertTrue(StepStatus.TIMED_OUT.isFailure());
        assertFalse(StepStatus.SKIPPED.isFailure());
        assertFalse(StepStatus.SKIPPED.isSuccessful());
    }
}
