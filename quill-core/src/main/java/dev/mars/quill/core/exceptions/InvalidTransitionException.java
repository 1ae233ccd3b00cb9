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

import dev.mars.quill.core.JobStatus;

import java.util.Arrays;
import java.util.List;

/**
 * Thrown when a lifecycle operation asks for a status change that the
 * job's current status does not allow, for example resuming a completed job.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InvalidTransitionException extends QuillException {

    private final String jobId;
    private final JobStatus currentStatus;
    private final JobStatus requestedStatus;
    private final List<JobStatus> validTargets;

    /**
     * @param jobId           the job whose transition was rejected
     * @param currentStatus   status the job is in
     * @param requestedStatus status the operation would have moved it to
     * @param validTargets    statuses reachable from {@code currentStatus}
     */
    public InvalidTransitionException(String jobId, JobStatus currentStatus,
                                      JobStatus requestedStatus, JobStatus[] validTargets) {
        super(String.format("Job %s cannot move %s → %s. Valid targets: %s",
                jobId, currentStatus, requestedStatus, Arrays.toString(validTargets)));
        this.jobId = jobId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
        this.validTargets = validTargets != null ? List.of(validTargets) : List.of();
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getCurrentStatus() {
        return currentStatus;
    }

    public JobStatus getRequestedStatus() {
        return requestedStatus;
    }

    public List<JobStatus> getValidTargets() {
        return validTargets;
    }
}
