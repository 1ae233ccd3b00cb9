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
 * Outcome of a single step within a job.
 */
public enum StepStatus {

    SUCCEEDED,

    /**
     * Step threw or returned a failure after exhausting its retry budget.
     */
    FAILED,

    /**
     * Last attempt exceeded the step timeout.
     */
    TIMED_OUT,

    /**
     * Step was never dispatched: a dependency failed or was skipped, or its condition was false.
     */
    SKIPPED;

    public boolean isSuccessful() {
        return this == SUCCEEDED;
    }

    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }
}
