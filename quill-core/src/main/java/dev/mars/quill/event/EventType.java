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

package dev.mars.quill.event;

/**
 * Lifecycle and progress notifications published for a job.
 */
public enum EventType {
    JOB_CREATED,
    JOB_STARTED,
    JOB_PAUSED,
    JOB_RESUMED,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_CANCELLED,
    /**
     * A job was rebuilt from its latest checkpoint by an engine that did not create it.
     */
    JOB_RECOVERED,
    LEVEL_STARTED,
    LEVEL_COMPLETED,
    STEP_STARTED,
    STEP_RETRY,
    STEP_COMPLETED,
    STEP_FAILED,
    STEP_SKIPPED,
    CHECKPOINT_SAVED,
    /**
     * Warning: a checkpoint could not be written after all retries. The job keeps running.
     */
    CHECKPOINT_SAVE_FAILED;

    public boolean isJobTerminal() {
        return this == JOB_COMPLETED || this == JOB_FAILED || this == JOB_CANCELLED;
    }

    public boolean isWarning() {
        return this == CHECKPOINT_SAVE_FAILED;
    }
}
