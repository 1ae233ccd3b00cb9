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

package dev.mars.quill.workflow.engine;

import dev.mars.quill.core.JobStatus;

import java.util.Optional;

/**
 * Point-in-time summary of a job's progress.
 */
public final class JobStatusReport {

    private final String jobId;
    private final JobStatus status;
    private final int completedStepCount;
    private final int failedStepCount;
    private final int skippedStepCount;
    private final int totalStepCount;
    private final int currentLevel;
    private final int levelCount;
    private final String errorMessage;

    JobStatusReport(String jobId, JobStatus status, int completedStepCount, int failedStepCount,
                    int skippedStepCount, int totalStepCount, int currentLevel, int levelCount,
                    String errorMessage) {
        this.jobId = jobId;
        this.status = status;
        this.completedStepCount = completedStepCount;
        this.failedStepCount = failedStepCount;
        this.skippedStepCount = skippedStepCount;
        this.totalStepCount = totalStepCount;
        this.currentLevel = currentLevel;
        this.levelCount = levelCount;
        this.errorMessage = errorMessage;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getCompletedStepCount() {
        return completedStepCount;
    }

    public int getFailedStepCount() {
        return failedStepCount;
    }

    public int getSkippedStepCount() {
        return skippedStepCount;
    }

    public int getTotalStepCount() {
        return totalStepCount;
    }

    /**
     * @return index of the next level to dispatch; equals {@link #getLevelCount()} once all levels ran
     */
    public int getCurrentLevel() {
        return currentLevel;
    }

    public int getLevelCount() {
        return levelCount;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    /**
     * Fraction of steps that are settled (completed, failed or skipped), between 0.0 and 1.0.
     */
    public double getProgress() {
        if (totalStepCount == 0) {
            return status == JobStatus.COMPLETED ? 1.0 : 0.0;
        }
        return (double) (completedStepCount + failedStepCount + skippedStepCount) / totalStepCount;
    }

    @Override
    public String toString() {
        return "JobStatusReport{" +
               "jobId='" + jobId + '\'' +
               ", status=" + status +
               ", completed=" + completedStepCount + '/' + totalStepCount +
               ", failed=" + failedStepCount +
               ", skipped=" + skippedStepCount +
               ", level=" + currentLevel + '/' + levelCount +
               '}';
    }
}
