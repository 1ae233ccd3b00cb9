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

package dev.mars.quill.core.exceptions;

/**
 * Signals that a step could not produce its output. Steps throw this (or any
 * other exception) from their execute method; the executor records it as a
 * failed attempt.
 */
public class StepExecutionException extends QuillException {

    private final String stepId;

    public StepExecutionException(String stepId, String message) {
        super(message);
        this.stepId = stepId;
    }

    public StepExecutionException(String stepId, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }

    @Override
    public String getMessage() {
        return String.format("Step %s failed: %s", stepId, super.getMessage());
    }
}
