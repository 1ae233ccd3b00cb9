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
 * Raised by a checkpoint store when a snapshot cannot be written, read or deleted.
 */
public class CheckpointStorageException extends QuillException {

    private final String jobId;

    public CheckpointStorageException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public CheckpointStorageException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }

    @Override
    public String getMessage() {
        return String.format("Checkpoint storage for job %s failed: %s", jobId, super.getMessage());
    }
}
