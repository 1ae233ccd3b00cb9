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

package dev.mars.quill.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * An immutable, persisted snapshot of a job's progress.
 *
 * <p>Checkpoints of one job are totally ordered by creation time and then by
 * their per-job sequence number.</p>
 */
public final class Checkpoint {

    /**
     * Orders checkpoints most recent first.
     */
    public static final Comparator<Checkpoint> MOST_RECENT_FIRST =
            Comparator.comparing(Checkpoint::getCreatedAt)
                    .thenComparingLong(Checkpoint::getSequence)
                    .reversed();

    @JsonProperty("checkpointId")
    private final String checkpointId;

    @JsonProperty("jobId")
    private final String jobId;

    @JsonProperty("sequence")
    private final long sequence;

    @JsonProperty("marker")
    private final String marker;

    @JsonProperty("createdAt")
    private final Instant createdAt;

    @JsonProperty("snapshot")
    private final CheckpointSnapshot snapshot;

    @JsonCreator
    public Checkpoint(@JsonProperty("checkpointId") String checkpointId,
                      @JsonProperty("jobId") String jobId,
                      @JsonProperty("sequence") long sequence,
                      @JsonProperty("marker") String marker,
                      @JsonProperty("createdAt") Instant createdAt,
                      @JsonProperty("snapshot") CheckpointSnapshot snapshot) {
        this.checkpointId = Objects.requireNonNull(checkpointId, "Checkpoint ID cannot be null");
        this.jobId = Objects.requireNonNull(jobId, "Job ID cannot be null");
        this.sequence = sequence;
        this.marker = Objects.requireNonNull(marker, "Marker cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "Creation time cannot be null");
        this.snapshot = Objects.requireNonNull(snapshot, "Snapshot cannot be null");
    }

    public static String idFor(String jobId, long sequence) {
        return String.format("%s-cp%06d", jobId, sequence);
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    public String getJobId() {
        return jobId;
    }

    public long getSequence() {
        return sequence;
    }

    public String getMarker() {
        return marker;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public CheckpointSnapshot getSnapshot() {
        return snapshot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Checkpoint that = (Checkpoint) o;
        return checkpointId.equals(that.checkpointId);
    }

    @Override
    public int hashCode() {
        return checkpointId.hashCode();
    }

    @Override
    public String toString() {
        return "Checkpoint{" +
               "checkpointId='" + checkpointId + '\'' +
               ", marker='" + marker + '\'' +
               ", createdAt=" + createdAt +
               ", nextLevelIndex=" + snapshot.getNextLevelIndex() +
               '}';
    }
}
