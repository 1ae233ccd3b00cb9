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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable notification about a job. The sequence number is assigned by the
 * event bus on publication and is strictly increasing per job.
 */
public final class JobEvent {

    public static final long UNSEQUENCED = -1L;

    private final EventType type;
    private final String jobId;
    private final String stepId;
    private final Map<String, Object> payload;
    private final Instant timestamp;
    private final long sequence;

    private JobEvent(EventType type, String jobId, String stepId, Map<String, Object> payload,
                     Instant timestamp, long sequence) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.jobId = Objects.requireNonNull(jobId, "Job ID cannot be null");
        this.stepId = stepId;
        this.payload = payload != null ? copyOf(payload) : Map.of();
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.sequence = sequence;
    }

    public static JobEvent of(EventType type, String jobId) {
        return new JobEvent(type, jobId, null, Map.of(), Instant.now(), UNSEQUENCED);
    }

    public static JobEvent of(EventType type, String jobId, Map<String, Object> payload) {
        return new JobEvent(type, jobId, null, payload, Instant.now(), UNSEQUENCED);
    }

    public static JobEvent forStep(EventType type, String jobId, String stepId, Map<String, Object> payload) {
        return new JobEvent(type, jobId, stepId, payload, Instant.now(), UNSEQUENCED);
    }

    JobEvent withSequence(long sequence) {
        return new JobEvent(type, jobId, stepId, payload, timestamp, sequence);
    }

    public EventType getType() {
        return type;
    }

    public String getJobId() {
        return jobId;
    }

    public Optional<String> getStepId() {
        return Optional.ofNullable(stepId);
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getSequence() {
        return sequence;
    }

    // payload values may be null
    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    @Override
    public String toString() {
        return "JobEvent{" +
               "type=" + type +
               ", jobId='" + jobId + '\'' +
               (stepId != null ? ", stepId='" + stepId + '\'' : "") +
               ", sequence=" + sequence +
               ", payload=" + payload +
               '}';
    }
}
