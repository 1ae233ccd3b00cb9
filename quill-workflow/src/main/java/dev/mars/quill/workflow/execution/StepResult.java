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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running one step, including all of its attempts.
 */
public final class StepResult {

    private final String stepId;
    private final StepStatus status;
    private final Object output;
    private final String errorMessage;
    private final Throwable cause;
    private final int attempts;
    private final Duration duration;

    private StepResult(String stepId, StepStatus status, Object output, String errorMessage,
                       Throwable cause, int attempts, Duration duration) {
        this.stepId = Objects.requireNonNull(stepId, "Step ID cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.output = output;
        this.errorMessage = errorMessage;
        this.cause = cause;
        this.attempts = attempts;
        this.duration = duration != null ? duration : Duration.ZERO;
    }

    public static StepResult succeeded(String stepId, Object output, int attempts, Duration duration) {
        return new StepResult(stepId, StepStatus.SUCCEEDED, output, null, null, attempts, duration);
    }

    public static StepResult failed(String stepId, String errorMessage, Throwable cause,
                                    int attempts, Duration duration) {
        return new StepResult(stepId, StepStatus.FAILED, null, errorMessage, cause, attempts, duration);
    }

    public static StepResult timedOut(String stepId, String errorMessage, Throwable cause,
                                      int attempts, Duration duration) {
        return new StepResult(stepId, StepStatus.TIMED_OUT, null, errorMessage, cause, attempts, duration);
    }

    public String getStepId() {
        return stepId;
    }

    public StepStatus getStatus() {
        return status;
    }

    public boolean isSuccessful() {
        return status.isSuccessful();
    }

    /**
     * @return the step output; {@code null} for failures or steps that returned nothing
     */
    public Object getOutput() {
        return output;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "StepResult{" +
               "stepId='" + stepId + '\'' +
               ", status=" + status +
               ", attempts=" + attempts +
               (errorMessage != null ? ", error='" + errorMessage + '\'' : "") +
               '}';
    }
}
