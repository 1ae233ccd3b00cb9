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

package dev.mars.quill.workflow;

import dev.mars.quill.core.exceptions.QuillException;

import java.util.Objects;

/**
 * Raised when a workflow definition cannot be compiled into an execution graph.
 * No partial graph is ever produced.
 */
public class CompileException extends QuillException {

    private final String workflowId;
    private final ValidationResult validationResult;

    public CompileException(String workflowId, ValidationResult validationResult) {
        super("Workflow '" + workflowId + "' failed to compile:" + validationResult.describeErrors());
        this.workflowId = workflowId;
        this.validationResult = Objects.requireNonNull(validationResult, "Validation result cannot be null");
    }

    protected CompileException(String workflowId, String message, ValidationResult validationResult) {
        super(message);
        this.workflowId = workflowId;
        this.validationResult = validationResult;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
