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
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Full, restorable state of a job at a level boundary.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class CheckpointSnapshot {

    @JsonProperty("workflowId")
    private final String workflowId;

    @JsonProperty("workflowVersion")
    private final String workflowVersion;

    @JsonProperty("nextLevelIndex")
    private final int nextLevelIndex;

    @JsonProperty("completedSteps")
    private final List<String> completedSteps;

    @JsonProperty("failedSteps")
    private final Map<String, String> failedSteps;

    @JsonProperty("skippedSteps")
    private final List<String> skippedSteps;

    @JsonProperty("stepOutputs")
    @JsonSerialize(using = TypedValues.MapSerializer.class)
    @JsonDeserialize(using = TypedValues.MapDeserializer.class)
    private final Map<String, Object> stepOutputs;

    @JsonProperty("inputs")
    @JsonSerialize(using = TypedValues.MapSerializer.class)
    @JsonDeserialize(using = TypedValues.MapDeserializer.class)
    private final Map<String, Object> inputs;

    @JsonCreator
    public CheckpointSnapshot(@JsonProperty("workflowId") String workflowId,
                              @JsonProperty("workflowVersion") String workflowVersion,
                              @JsonProperty("nextLevelIndex") int nextLevelIndex,
                              @JsonProperty("completedSteps") Set<String> completedSteps,
                              @JsonProperty("failedSteps") Map<String, String> failedSteps,
                              @JsonProperty("skippedSteps") Set<String> skippedSteps,
                              @JsonProperty("stepOutputs")
                              @JsonDeserialize(using = TypedValues.MapDeserializer.class) Map<String, Object> stepOutputs,
                              @JsonProperty("inputs")
                              @JsonDeserialize(using = TypedValues.MapDeserializer.class) Map<String, Object> inputs) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.workflowVersion = Objects.requireNonNull(workflowVersion, "Workflow version cannot be null");
        if (nextLevelIndex < 0) {
            throw new IllegalArgumentException("Next level index cannot be negative: " + nextLevelIndex);
        }
        this.nextLevelIndex = nextLevelIndex;
        this.completedSteps = sortedList(completedSteps);
        this.failedSteps = failedSteps != null
                ? Collections.unmodifiableMap(new TreeMap<>(failedSteps)) : Map.of();
        this.skippedSteps = sortedList(skippedSteps);
        this.stepOutputs = unmodifiableCopy(stepOutputs);
        this.inputs = unmodifiableCopy(inputs);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getWorkflowVersion() {
        return workflowVersion;
    }

    public int getNextLevelIndex() {
        return nextLevelIndex;
    }

    public List<String> getCompletedSteps() {
        return completedSteps;
    }

    public Map<String, String> getFailedSteps() {
        return failedSteps;
    }

    public List<String> getSkippedSteps() {
        return skippedSteps;
    }

    public Map<String, Object> getStepOutputs() {
        return stepOutputs;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    private static List<String> sortedList(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new TreeSet<>(values));
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CheckpointSnapshot that = (CheckpointSnapshot) o;
        return nextLevelIndex == that.nextLevelIndex &&
               workflowId.equals(that.workflowId) &&
               workflowVersion.equals(that.workflowVersion) &&
               completedSteps.equals(that.completedSteps) &&
               failedSteps.equals(that.failedSteps) &&
               skippedSteps.equals(that.skippedSteps) &&
               stepOutputs.equals(that.stepOutputs) &&
               inputs.equals(that.inputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, workflowVersion, nextLevelIndex, completedSteps,
                failedSteps, skippedSteps, stepOutputs, inputs);
    }

    @Override
    public String toString() {
        return "CheckpointSnapshot{" +
               "workflow='" + workflowId + '@' + workflowVersion + '\'' +
               ", nextLevelIndex=" + nextLevelIndex +
               ", completed=" + completedSteps +
               ", failed=" + new ArrayList<>(failedSteps.keySet()) +
               ", skipped=" + skippedSteps +
               '}';
    }
}
