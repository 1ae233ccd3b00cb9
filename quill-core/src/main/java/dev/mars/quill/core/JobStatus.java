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

/**
 * Lifecycle status of a job.
 *
 * <p>Valid transitions:</p>
 * <pre>
 * PENDING  → RUNNING
 * RUNNING  → PAUSED | COMPLETED | FAILED | CANCELLED
 * PAUSED   → RUNNING | CANCELLED
 * </pre>
 *
 * <p>{@link #COMPLETED}, {@link #FAILED} and {@link #CANCELLED} are terminal.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum JobStatus {

    /**
     * Job has been created from a compiled workflow but not started.
     */
    PENDING,

    /**
     * Job is dispatching levels.
     */
    RUNNING,

    /**
     * Job stopped at a level boundary and can be resumed.
     */
    PAUSED,

    /**
     * Every level ran; failures flagged {@code continueOnError} may still be recorded.
     */
    COMPLETED,

    /**
     * A step failed without {@code continueOnError}, or execution broke down.
     */
    FAILED,

    /**
     * Job was cancelled at a level boundary or while paused.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * Checks whether a transition from this status to the target is allowed.
     *
     * @param target the requested status
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target == PAUSED || target == COMPLETED
                        || target == FAILED || target == CANCELLED;
            case PAUSED -> target == RUNNING || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * Returns all statuses reachable from this one in a single transition.
     *
     * @return valid targets (empty for terminal statuses)
     */
    public JobStatus[] getValidTransitions() {
        return switch (this) {
            case PENDING -> new JobStatus[]{RUNNING};
            case RUNNING -> new JobStatus[]{PAUSED, COMPLETED, FAILED, CANCELLED};
            case PAUSED -> new JobStatus[]{RUNNING, CANCELLED};
            case COMPLETED, FAILED, CANCELLED -> new JobStatus[0];
        };
    }
}
